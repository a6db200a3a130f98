/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.graph;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;
import com.tessera.search.query.LocatedQueryTermSubset;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.roaringbitmap.RoaringBitmap;

/**
 * Memo of resolved conditions for one ranking rule iteration.
 *
 * <p>A cached entry holds the condition's documents within the universe it was last
 * used with. Universes only shrink during an iteration, so a lookup with a smaller
 * universe narrows the entry in place instead of resolving the condition again.
 * Each distinct condition is resolved at most once per iteration.
 *
 * @param <C> condition type of the criterion
 */
public final class ConditionDocIdsCache<C> {

    private final Int2ObjectMap<ComputedCondition> cache = new Int2ObjectOpenHashMap<>();

    /**
     * The documents of {@code universe} that satisfy {@code condition}.
     *
     * @param universe the current universe; never larger than the one of a previous call
     */
    public ComputedCondition getComputedCondition(SearchContext ctx, Interned<C> condition,
                                                  RankingRuleGraph<C> graph, RoaringBitmap universe) {
        ComputedCondition computed = cache.get(condition.index());
        if (computed != null) {
            if (computed.universeLen() == universe.getLongCardinality()) {
                ctx.metrics().recordConditionCacheHit();
            } else {
                computed.narrow(universe);
                ctx.metrics().recordConditionNarrowing();
            }
            return computed;
        }
        computed = graph.type().resolveCondition(ctx, graph.condition(condition), universe);
        ctx.metrics().recordConditionResolution();
        cache.put(condition.index(), computed);
        return computed;
    }

    /**
     * Start and end term subsets of a condition that was already resolved.
     *
     * @throws IllegalStateException if the condition was never resolved
     */
    public LocatedQueryTermSubset[] getSubsetsUsedByCondition(Interned<C> condition) {
        ComputedCondition computed = cache.get(condition.index());
        if (computed == null) {
            throw new IllegalStateException("Condition " + condition + " was not resolved");
        }
        return new LocatedQueryTermSubset[]{computed.startTermSubset(), computed.endTermSubset()};
    }

    public int size() {
        return cache.size();
    }
}
