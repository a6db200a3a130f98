package com.tessera.search.graph;

import com.tessera.search.interner.Interned;

/**
 * Edge of a {@link RankingRuleGraph}.
 *
 * @param source    source query node id
 * @param dest      destination query node id
 * @param cost      cost of walking the edge, never negative
 * @param condition documents allowed through the edge; null for unconditional edges
 * @param <C>       condition type of the criterion
 */
public record Edge<C>(int source, int dest, int cost, Interned<C> condition) {

    public Edge {
        if (cost < 0) {
            throw new IllegalArgumentException("Edge cost must be >= 0: " + cost);
        }
    }

    public boolean isUnconditional() {
        return condition == null;
    }
}
