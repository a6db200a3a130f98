package com.tessera.search.sort;

/**
 * How completely the bucket sort scores the documents it returns.
 */
public enum ScoringStrategy {

    /** Buckets of a single document are not split further, so their scores may stop early. */
    SKIP,

    /** Every ranking rule scores every returned document. */
    DETAILED
}
