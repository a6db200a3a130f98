package com.tessera.search.filter.cache;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Configuration of the cross-request {@link FilterResultCache}.
 *
 * <p><b>Environment Variable Override:</b>
 * every property can be overridden with an environment variable or a system property:
 * <pre>
 * FILTER_CACHE_ENABLED=true
 * FILTER_CACHE_MAX_SIZE=10000
 * FILTER_CACHE_TTL_SECONDS=300
 * FILTER_CACHE_RECORD_STATS=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * FilterCacheConfig config = FilterCacheConfig.builder()
 *     .maxSize(50_000)
 *     .ttl(Duration.ofMinutes(10))
 *     .build();
 * }</pre>
 */
public final class FilterCacheConfig {

    private static final Logger logger = Logger.getLogger(FilterCacheConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_ENABLED = "FILTER_CACHE_ENABLED";
    private static final String ENV_MAX_SIZE = "FILTER_CACHE_MAX_SIZE";
    private static final String ENV_TTL_SECONDS = "FILTER_CACHE_TTL_SECONDS";
    private static final String ENV_RECORD_STATS = "FILTER_CACHE_RECORD_STATS";

    private final boolean enabled;
    private final long maxSize;
    private final Duration ttl;
    private final boolean recordStats;

    private FilterCacheConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.maxSize = builder.maxSize;
        this.ttl = builder.ttl;
        this.recordStats = builder.recordStats;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static FilterCacheConfig defaults() {
        return builder().build();
    }

    /** Disabled cache; every filter is evaluated on each request. */
    public static FilterCacheConfig disabled() {
        return builder().enabled(false).build();
    }

    /** Defaults overridden by {@code FILTER_CACHE_*} environment variables or system properties. */
    public static FilterCacheConfig fromEnvironment() {
        Builder builder = builder();
        String enabled = getEnvOrProperty(ENV_ENABLED);
        if (enabled != null) {
            builder.enabled(Boolean.parseBoolean(enabled));
        }
        String maxSize = getEnvOrProperty(ENV_MAX_SIZE);
        if (maxSize != null) {
            builder.maxSize(parseLong(ENV_MAX_SIZE, maxSize, builder.maxSize));
        }
        String ttl = getEnvOrProperty(ENV_TTL_SECONDS);
        if (ttl != null) {
            builder.ttl(Duration.ofSeconds(parseLong(ENV_TTL_SECONDS, ttl, builder.ttl.getSeconds())));
        }
        String recordStats = getEnvOrProperty(ENV_RECORD_STATS);
        if (recordStats != null) {
            builder.recordStats(Boolean.parseBoolean(recordStats));
        }
        return builder.build();
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        return value != null ? value : System.getProperty(key);
    }

    private static long parseLong(String key, String value, long fallback) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warning(String.format("Invalid value '%s' for %s, using %d", value, key, fallback));
            return fallback;
        }
    }

    private void validate() {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("FilterCacheConfig{enabled=%b, maxSize=%d, ttl=%s, recordStats=%b}",
            enabled, maxSize, ttl, recordStats);
    }

    public static class Builder {
        private boolean enabled = true;
        private long maxSize = 10_000;
        private Duration ttl = Duration.ofMinutes(5);
        private boolean recordStats = true;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public FilterCacheConfig build() {
            return new FilterCacheConfig(this);
        }
    }
}
