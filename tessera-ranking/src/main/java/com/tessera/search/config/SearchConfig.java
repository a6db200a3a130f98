/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.config;

import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.filter.cache.FilterCacheConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Engine-wide search configuration.
 *
 * <p><b>Environment Variable Override:</b>
 * every property can be overridden via environment variables or system properties
 * using the pattern {@code SEARCH_<PROPERTY_NAME>}:
 * <pre>
 * SEARCH_TIMEOUT_MS=1500
 * SEARCH_WORDS_LIMIT=10
 * SEARCH_MIN_WORD_LEN_ONE_TYPO=5
 * SEARCH_MIN_WORD_LEN_TWO_TYPOS=9
 * SEARCH_MAX_QUERY_GRAPH_NODES=64
 * SEARCH_TERMS_MATCHING_STRATEGY=last
 * </pre>
 * The filter cache reads its own {@code FILTER_CACHE_*} keys, see {@link FilterCacheConfig}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SearchConfig config = SearchConfig.builder()
 *     .timeout(Duration.ofMillis(500))
 *     .termsMatchingStrategy(TermsMatchingStrategy.ALL)
 *     .build();
 * }</pre>
 */
public final class SearchConfig {

    private static final Logger logger = Logger.getLogger(SearchConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_TIMEOUT_MS = "SEARCH_TIMEOUT_MS";
    private static final String ENV_WORDS_LIMIT = "SEARCH_WORDS_LIMIT";
    private static final String ENV_MIN_WORD_LEN_ONE_TYPO = "SEARCH_MIN_WORD_LEN_ONE_TYPO";
    private static final String ENV_MIN_WORD_LEN_TWO_TYPOS = "SEARCH_MIN_WORD_LEN_TWO_TYPOS";
    private static final String ENV_MAX_QUERY_GRAPH_NODES = "SEARCH_MAX_QUERY_GRAPH_NODES";
    private static final String ENV_TERMS_MATCHING_STRATEGY = "SEARCH_TERMS_MATCHING_STRATEGY";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final Duration timeout;
    private final int wordsLimit;
    private final int minWordLenOneTypo;
    private final int minWordLenTwoTypos;
    private final int maxQueryGraphNodes;
    private final TermsMatchingStrategy termsMatchingStrategy;
    private final FilterCacheConfig filterCacheConfig;

    private SearchConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.wordsLimit = builder.wordsLimit;
        this.minWordLenOneTypo = builder.minWordLenOneTypo;
        this.minWordLenTwoTypos = builder.minWordLenTwoTypos;
        this.maxQueryGraphNodes = builder.maxQueryGraphNodes;
        this.termsMatchingStrategy = builder.termsMatchingStrategy;
        this.filterCacheConfig = builder.filterCacheConfig;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static SearchConfig defaults() {
        return builder().build();
    }

    /** Defaults overridden by {@code SEARCH_*} environment variables or system properties. */
    public static SearchConfig fromEnvironment() {
        Builder builder = builder().filterCacheConfig(FilterCacheConfig.fromEnvironment());

        String timeout = getEnvOrProperty(ENV_TIMEOUT_MS);
        if (timeout != null) {
            builder.timeout(Duration.ofMillis(parseInt(ENV_TIMEOUT_MS, timeout, (int) builder.timeout.toMillis())));
        }
        String wordsLimit = getEnvOrProperty(ENV_WORDS_LIMIT);
        if (wordsLimit != null) {
            builder.wordsLimit(parseInt(ENV_WORDS_LIMIT, wordsLimit, builder.wordsLimit));
        }
        String oneTypo = getEnvOrProperty(ENV_MIN_WORD_LEN_ONE_TYPO);
        if (oneTypo != null) {
            builder.minWordLenOneTypo(parseInt(ENV_MIN_WORD_LEN_ONE_TYPO, oneTypo, builder.minWordLenOneTypo));
        }
        String twoTypos = getEnvOrProperty(ENV_MIN_WORD_LEN_TWO_TYPOS);
        if (twoTypos != null) {
            builder.minWordLenTwoTypos(parseInt(ENV_MIN_WORD_LEN_TWO_TYPOS, twoTypos, builder.minWordLenTwoTypos));
        }
        String maxNodes = getEnvOrProperty(ENV_MAX_QUERY_GRAPH_NODES);
        if (maxNodes != null) {
            builder.maxQueryGraphNodes(parseInt(ENV_MAX_QUERY_GRAPH_NODES, maxNodes, builder.maxQueryGraphNodes));
        }
        String strategy = getEnvOrProperty(ENV_TERMS_MATCHING_STRATEGY);
        if (strategy != null) {
            try {
                builder.termsMatchingStrategy(TermsMatchingStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warning(String.format("Invalid value '%s' for %s, using %s",
                    strategy, ENV_TERMS_MATCHING_STRATEGY, builder.termsMatchingStrategy));
            }
        }
        return builder.build();
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        return value != null ? value : System.getProperty(key);
    }

    private static int parseInt(String key, String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning(String.format("Invalid value '%s' for %s, using %d", value, key, fallback));
            return fallback;
        }
    }

    private void validate() {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        if (wordsLimit <= 0) {
            throw new IllegalArgumentException("wordsLimit must be positive: " + wordsLimit);
        }
        if (minWordLenOneTypo < 0 || minWordLenTwoTypos < minWordLenOneTypo) {
            throw new IllegalArgumentException(String.format(
                "Invalid typo word lengths: oneTypo=%d, twoTypos=%d", minWordLenOneTypo, minWordLenTwoTypos));
        }
        if (maxQueryGraphNodes < 3) {
            throw new IllegalArgumentException("maxQueryGraphNodes must be >= 3: " + maxQueryGraphNodes);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /** Deadline of one search; {@link Duration#ZERO} disables it. */
    public Duration getTimeout() {
        return timeout;
    }

    public int getWordsLimit() {
        return wordsLimit;
    }

    public int getMinWordLenOneTypo() {
        return minWordLenOneTypo;
    }

    public int getMinWordLenTwoTypos() {
        return minWordLenTwoTypos;
    }

    public int getMaxQueryGraphNodes() {
        return maxQueryGraphNodes;
    }

    public TermsMatchingStrategy getTermsMatchingStrategy() {
        return termsMatchingStrategy;
    }

    public FilterCacheConfig getFilterCacheConfig() {
        return filterCacheConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("SearchConfig{timeout=%s, wordsLimit=%d, typoLengths=%d/%d, maxNodes=%d, strategy=%s, %s}",
            timeout, wordsLimit, minWordLenOneTypo, minWordLenTwoTypos, maxQueryGraphNodes,
            termsMatchingStrategy, filterCacheConfig);
    }

    public static class Builder {
        private Duration timeout = Duration.ofMillis(1500);
        private int wordsLimit = 10;
        private int minWordLenOneTypo = 5;
        private int minWordLenTwoTypos = 9;
        private int maxQueryGraphNodes = 64;
        private TermsMatchingStrategy termsMatchingStrategy = TermsMatchingStrategy.LAST;
        private FilterCacheConfig filterCacheConfig = FilterCacheConfig.defaults();

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder wordsLimit(int wordsLimit) {
            this.wordsLimit = wordsLimit;
            return this;
        }

        public Builder minWordLenOneTypo(int length) {
            this.minWordLenOneTypo = length;
            return this;
        }

        public Builder minWordLenTwoTypos(int length) {
            this.minWordLenTwoTypos = length;
            return this;
        }

        public Builder maxQueryGraphNodes(int maxQueryGraphNodes) {
            this.maxQueryGraphNodes = maxQueryGraphNodes;
            return this;
        }

        public Builder termsMatchingStrategy(TermsMatchingStrategy strategy) {
            this.termsMatchingStrategy = strategy;
            return this;
        }

        public Builder filterCacheConfig(FilterCacheConfig filterCacheConfig) {
            this.filterCacheConfig = filterCacheConfig;
            return this;
        }

        public SearchConfig build() {
            return new SearchConfig(this);
        }
    }
}
