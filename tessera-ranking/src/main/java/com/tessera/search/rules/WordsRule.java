/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.rules;

import com.tessera.search.api.model.Rank;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ConditionDocIdsCache;
import com.tessera.search.graph.RankingRuleGraph;
import com.tessera.search.graph.criteria.WordsCondition;
import com.tessera.search.graph.criteria.WordsGraph;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.query.QueryGraph;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Ranks documents by how many query words they match.
 *
 * <p>The first bucket holds the documents matching the whole query graph. Each
 * following bucket drops the next group of words of the terms matching strategy's
 * removal order and holds the newly matched documents. Documents matching none of the
 * reduced graphs form the last bucket.
 *
 * <p>With {@link TermsMatchingStrategy#ALL} nothing is ever dropped. Each bucket
 * carries the query graph it was computed with. The bucket computed after {@code n}
 * removal steps out of {@code s} ranks {@code s + 1 - n} of {@code s + 1}; the last
 * bucket ranks 0.
 */
public final class WordsRule implements RankingRule<QueryGraph> {

    private static final Logger logger = LoggerFactory.getLogger(WordsRule.class);

    private static final WordsGraph WORDS_GRAPH = new WordsGraph();

    private final TermsMatchingStrategy strategy;

    private QueryGraph queryGraph;
    private Deque<RoaringBitmap> removalOrder;
    private DedupInterner<WordsCondition> conditions;
    private ConditionDocIdsCache<WordsCondition> conditionsCache;
    private int maxRank;
    private int step;
    private boolean exhausted;
    private boolean remainderEmitted;

    public WordsRule(TermsMatchingStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
    }

    @Override
    public String id() {
        return "words";
    }

    @Override
    public void startIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                               RoaringBitmap universe, QueryGraph query) {
        queryGraph = query.copy();
        removalOrder = new ArrayDeque<>(strategy == TermsMatchingStrategy.LAST
            ? queryGraph.removalOrderForTermsMatchingStrategyLast(ctx)
            : List.of());
        conditions = new DedupInterner<>();
        conditionsCache = new ConditionDocIdsCache<>();
        maxRank = removalOrder.size() + 1;
        step = 0;
        exhausted = false;
        remainderEmitted = false;
        searchLogger.logInternalState(id(), removalOrder::toString);
    }

    @Override
    public RankingRuleOutput<QueryGraph> nextBucket(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                                                    RoaringBitmap universe) {
        if (queryGraph == null) {
            throw new IllegalStateException("Ranking rule words was not started");
        }
        if (universe.isEmpty()) {
            return null;
        }
        while (!exhausted) {
            RoaringBitmap bucket = resolve(ctx, queryGraph, conditions, conditionsCache, universe);
            QueryGraph bucketQuery = queryGraph.copy();
            Rank rank = new Rank(maxRank - step, maxRank);
            step++;
            if (removalOrder.isEmpty()) {
                exhausted = true;
            } else {
                queryGraph.removeNodesKeepEdges(removalOrder.pollFirst());
            }
            if (!bucket.isEmpty()) {
                logger.debug("words: bucket of {} documents, {} removal steps left",
                    bucket.getLongCardinality(), removalOrder.size());
                return new RankingRuleOutput<>(bucketQuery, bucket, ScoreDetails.ranked(id(), rank));
            }
        }
        if (remainderEmitted) {
            return null;
        }
        remainderEmitted = true;
        return new RankingRuleOutput<>(queryGraph.copy(), universe.clone(),
            ScoreDetails.ranked(id(), new Rank(0, maxRank)));
    }

    @Override
    public void endIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger) {
        queryGraph = null;
        removalOrder = null;
        conditions = null;
        conditionsCache = null;
    }

    /**
     * Documents of {@code universe} matching {@code queryGraph}: the union, over every
     * path of the graph, of the intersection of the documents of its terms.
     */
    public static RoaringBitmap resolveQueryGraph(SearchContext ctx, QueryGraph queryGraph, RoaringBitmap universe) {
        return resolve(ctx, queryGraph, new DedupInterner<>(), new ConditionDocIdsCache<>(), universe);
    }

    private static RoaringBitmap resolve(SearchContext ctx, QueryGraph queryGraph,
                                         DedupInterner<WordsCondition> conditions,
                                         ConditionDocIdsCache<WordsCondition> cache, RoaringBitmap universe) {
        RankingRuleGraph<WordsCondition> graph = RankingRuleGraph.build(ctx, WORDS_GRAPH, queryGraph, conditions);
        return graph.docidsOfAllPaths(ctx, cache, universe);
    }
}
