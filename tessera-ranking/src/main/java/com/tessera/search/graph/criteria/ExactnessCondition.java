package com.tessera.search.graph.criteria;

import com.tessera.search.query.LocatedQueryTermSubset;

/**
 * Condition of the exactness criterion.
 */
public interface ExactnessCondition {

    LocatedQueryTermSubset term();

    /** Documents containing the exact word, or the exact phrase, of the term. */
    record ExactInAttribute(LocatedQueryTermSubset term) implements ExactnessCondition {
    }

    /** Documents containing any derivation of the term. */
    record Any(LocatedQueryTermSubset term) implements ExactnessCondition {
    }
}
