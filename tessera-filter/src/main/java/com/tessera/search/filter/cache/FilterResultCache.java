package com.tessera.search.filter.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tessera.search.filter.FilterNode;
import org.roaringbitmap.RoaringBitmap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Cross-request cache of evaluated filters, backed by Caffeine.
 *
 * <p>Entries are keyed by snapshot id and parsed filter tree, so a new index
 * snapshot never sees results computed on an older one, and two filters share an
 * entry only when their trees are equal. Stored bitmaps are
 * private to the cache: callers always receive a copy they may mutate.
 */
public final class FilterResultCache {

    private static final Logger logger = Logger.getLogger(FilterResultCache.class.getName());

    /** Cache key: one evaluated filter on one snapshot. */
    public record Key(long snapshotId, FilterNode filter) {
        public Key {
            Objects.requireNonNull(filter, "filter cannot be null");
        }
    }

    private final Cache<Key, RoaringBitmap> cache;
    private final boolean enabled;
    private final boolean statsEnabled;

    public FilterResultCache(FilterCacheConfig config) {
        this.enabled = config.isEnabled();
        this.statsEnabled = config.isRecordStats();

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(config.getMaxSize())
            .expireAfterWrite(config.getTtl());
        if (statsEnabled) {
            builder.recordStats();
        }
        this.cache = builder.build();

        logger.info(String.format("FilterResultCache initialized: %s", config));
    }

    /**
     * Returns the cached docids for {@code key}, computing them with {@code loader} on a miss.
     */
    public RoaringBitmap get(Key key, Supplier<RoaringBitmap> loader) {
        if (!enabled) {
            return loader.get();
        }
        RoaringBitmap docids = cache.get(key, k -> {
            RoaringBitmap computed = loader.get();
            computed.runOptimize();
            return computed;
        });
        return docids.clone();
    }

    public Map<String, Object> getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("filterCacheSize", cache.estimatedSize());
        metrics.put("filterCacheHits", stats.hitCount());
        metrics.put("filterCacheMisses", stats.missCount());
        metrics.put("filterCacheHitRate", stats.hitRate());
        metrics.put("filterCacheEvictions", stats.evictionCount());
        return metrics;
    }
}
