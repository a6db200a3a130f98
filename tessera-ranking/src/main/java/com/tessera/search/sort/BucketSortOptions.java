package com.tessera.search.sort;

import java.util.Objects;

/**
 * Options of a bucket sort beyond the window.
 *
 * @param distinctField         facet field deduplicating the results, or null
 * @param scoringStrategy       whether single-document buckets are still split
 * @param rankingScoreThreshold documents scoring below it are dropped, or null
 */
public record BucketSortOptions(String distinctField, ScoringStrategy scoringStrategy,
                                Double rankingScoreThreshold) {

    public static final BucketSortOptions DEFAULTS = new BucketSortOptions(null, ScoringStrategy.SKIP, null);

    public BucketSortOptions {
        Objects.requireNonNull(scoringStrategy, "scoringStrategy cannot be null");
    }
}
