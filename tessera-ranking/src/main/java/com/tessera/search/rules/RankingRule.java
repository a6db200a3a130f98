/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.rules;

import com.tessera.search.context.SearchContext;
import com.tessera.search.logger.SearchLogger;
import org.roaringbitmap.RoaringBitmap;

/**
 * One ranking criterion, iterated as a sequence of buckets of tied documents.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #startIteration} receives the universe to split and the query</li>
 *   <li>{@link #nextBucket} returns the buckets in increasing cost order, then null</li>
 *   <li>{@link #endIteration} releases the iteration state; it is idempotent</li>
 * </ol>
 * A rule may be started again after {@code endIteration}, on another universe.
 *
 * <h2>Buckets</h2>
 * <p>Buckets of one iteration are non-empty, pairwise disjoint, and together cover the
 * universe given to {@code startIteration}. The universe passed to {@code nextBucket}
 * is the start universe minus the buckets already returned. Rules must not mutate the
 * bitmaps they receive.
 *
 * @param <Q> query type: a query graph, or the placeholder query
 */
public interface RankingRule<Q> {

    /** Identifier of the rule, as written in the ranking rule settings. */
    String id();

    void startIteration(SearchContext ctx, SearchLogger<Q> logger, RoaringBitmap universe, Q query);

    /**
     * @return the next bucket, or null once the universe is exhausted
     */
    RankingRuleOutput<Q> nextBucket(SearchContext ctx, SearchLogger<Q> logger, RoaringBitmap universe);

    void endIteration(SearchContext ctx, SearchLogger<Q> logger);
}
