/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A search request.
 *
 * <p>A {@code null} or blank query runs a placeholder search: only the sort and boost
 * ranking rules apply and every document of the (filtered) index is a candidate.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SearchRequest request = SearchRequest.builder()
 *     .query("quick brown fox")
 *     .filter("genre = horror AND year > 1990")
 *     .sort("year:desc")
 *     .from(0)
 *     .length(20)
 *     .rankingScoreThreshold(0.5)
 *     .build();
 * }</pre>
 *
 * @param query                 the raw query text, may be null
 * @param filter                filter expression restricting the candidates, may be null
 * @param sort                  request sort criteria, applied where the {@code sort} rule sits
 * @param from                  number of ranked documents to skip
 * @param length                maximum number of documents to return
 * @param termsMatchingStrategy strategy override, or null for the engine default
 * @param timeout               deadline override, or null for the engine default
 * @param distinct              distinct field override, or null for the index setting
 * @param showRankingScoreDetails whether every ranking rule must score every returned document
 * @param rankingScoreThreshold documents scoring below this value in [0, 1] are dropped; may be null
 */
public record SearchRequest(
    @JsonProperty("q") String query,
    @JsonProperty("filter") String filter,
    @JsonProperty("sort") List<SortCriterion> sort,
    @JsonProperty("offset") int from,
    @JsonProperty("limit") int length,
    @JsonProperty("matching_strategy") TermsMatchingStrategy termsMatchingStrategy,
    @JsonProperty("timeout") Duration timeout,
    @JsonProperty("distinct") String distinct,
    @JsonProperty("show_ranking_score_details") boolean showRankingScoreDetails,
    @JsonProperty("ranking_score_threshold") Double rankingScoreThreshold
) implements Serializable {

    public static final int DEFAULT_LENGTH = 20;

    public SearchRequest {
        sort = sort == null ? List.of() : List.copyOf(sort);
        if (from < 0) {
            throw new UserErrorException(ErrorCode.INVALID_PAGINATION, "from must be >= 0: " + from);
        }
        if (length < 0) {
            throw new UserErrorException(ErrorCode.INVALID_PAGINATION, "length must be >= 0: " + length);
        }
        if (rankingScoreThreshold != null
            && !(rankingScoreThreshold >= 0.0 && rankingScoreThreshold <= 1.0)) {
            throw new UserErrorException(ErrorCode.INVALID_RANKING_SCORE_THRESHOLD,
                "rankingScoreThreshold must be between 0.0 and 1.0: " + rankingScoreThreshold);
        }
    }

    public static SearchRequest of(String query) {
        return builder().query(query).build();
    }

    @JsonIgnore
    public boolean isPlaceholder() {
        return query == null || query.isBlank();
    }

    /** True when every ranking rule must score every returned document. */
    public boolean requiresDetailedScores() {
        return showRankingScoreDetails || rankingScoreThreshold != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String query;
        private String filter;
        private final List<SortCriterion> sort = new ArrayList<>();
        private int from = 0;
        private int length = DEFAULT_LENGTH;
        private TermsMatchingStrategy termsMatchingStrategy;
        private Duration timeout;
        private String distinct;
        private boolean showRankingScoreDetails;
        private Double rankingScoreThreshold;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder sort(String criterion) {
            this.sort.add(SortCriterion.parse(criterion));
            return this;
        }

        public Builder sort(SortCriterion criterion) {
            this.sort.add(criterion);
            return this;
        }

        public Builder from(int from) {
            this.from = from;
            return this;
        }

        public Builder length(int length) {
            this.length = length;
            return this;
        }

        public Builder termsMatchingStrategy(TermsMatchingStrategy strategy) {
            this.termsMatchingStrategy = strategy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder distinct(String field) {
            this.distinct = field;
            return this;
        }

        public Builder showRankingScoreDetails(boolean show) {
            this.showRankingScoreDetails = show;
            return this;
        }

        public Builder rankingScoreThreshold(Double threshold) {
            this.rankingScoreThreshold = threshold;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(query, filter, sort, from, length, termsMatchingStrategy, timeout,
                distinct, showRankingScoreDetails, rankingScoreThreshold);
        }
    }
}
