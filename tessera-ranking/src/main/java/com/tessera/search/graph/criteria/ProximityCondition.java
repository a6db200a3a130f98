package com.tessera.search.graph.criteria;

import com.tessera.search.query.LocatedQueryTermSubset;

/**
 * Condition of the proximity criterion.
 */
public interface ProximityCondition {

    /** Documents containing the term, whatever its distance to the previous one. */
    record Term(LocatedQueryTermSubset term) implements ProximityCondition {
    }

    /**
     * Documents where the two terms occur at the given proximity: {@code proximity}
     * words apart in order, or {@code proximity - 1} apart in reverse order.
     */
    record Pair(LocatedQueryTermSubset left, LocatedQueryTermSubset right, int proximity)
        implements ProximityCondition {
    }
}
