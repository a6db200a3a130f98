/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.rules;

import com.tessera.search.api.model.Rank;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ConditionDocIdsCache;
import com.tessera.search.graph.DeadEndsCache;
import com.tessera.search.graph.PathVisitor;
import com.tessera.search.graph.RankingRuleGraph;
import com.tessera.search.graph.RankingRuleGraphType;
import com.tessera.search.graph.criteria.ExactnessGraph;
import com.tessera.search.graph.criteria.ProximityGraph;
import com.tessera.search.graph.criteria.TypoGraph;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.interner.Interned;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.query.QueryGraph;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ranking rule driven by a {@link RankingRuleGraph}: bucket {@code n} holds the
 * documents whose cheapest path through the graph costs the {@code n}-th smallest
 * reachable cost.
 *
 * <h2>Bucket computation</h2>
 * <p>For one cost, every path of exactly that cost is enumerated by a {@link PathVisitor}.
 * The documents of a path are the intersection of the documents of its conditions;
 * consecutive paths share the documents of their common prefix. Documents found by a
 * path leave the working universe, so later paths and costs only see the rest.
 *
 * <p>Conditions that resolve to nothing are retracted from the graph and the cost
 * table is updated. Conditions disjoint from a prefix are recorded in the
 * {@link DeadEndsCache} so that the visitor no longer walks them after that prefix.
 *
 * <p>Once every cost was visited, documents that no path matched form a last bucket.
 * Every bucket carries the query graph the iteration was started with.
 *
 * <h2>Scores</h2>
 * <p>With {@code m} the highest path cost of the graph when the iteration starts, the
 * bucket of cost {@code c} ranks {@code m + 1 - c} of {@code m + 1}. The bucket of
 * unmatched documents ranks 0.
 *
 * @param <C> condition type of the criterion
 */
public class GraphBasedRankingRule<C> implements RankingRule<QueryGraph> {

    private static final Logger logger = LoggerFactory.getLogger(GraphBasedRankingRule.class);

    private final String id;
    private final RankingRuleGraphType<C> type;
    private State<C> state;

    private static final class State<C> {
        private final QueryGraph query;
        private final RankingRuleGraph<C> graph;
        private final ConditionDocIdsCache<C> conditionsCache = new ConditionDocIdsCache<>();
        private final DeadEndsCache<C> deadEnds = new DeadEndsCache<>();
        private final int nextMaxCost;
        private int[][] allCosts;
        private int curCost;
        private boolean exhausted;
        private List<List<C>> lastBucketPaths = List.of();

        private State(QueryGraph query, RankingRuleGraph<C> graph) {
            this.query = query;
            this.graph = graph;
            this.allCosts = graph.findAllCostsToEnd();
            int maxCost = 0;
            for (int cost : allCosts[QueryGraph.ROOT]) {
                maxCost = Math.max(maxCost, cost);
            }
            this.nextMaxCost = maxCost + 1;
        }

        Rank rankOf(int cost) {
            return new Rank(Math.max(nextMaxCost - cost, 0), nextMaxCost);
        }
    }

    public GraphBasedRankingRule(String id, RankingRuleGraphType<C> type) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public static GraphBasedRankingRule<?> typo() {
        return new GraphBasedRankingRule<>("typo", new TypoGraph());
    }

    public static GraphBasedRankingRule<?> proximity() {
        return new GraphBasedRankingRule<>("proximity", new ProximityGraph());
    }

    public static GraphBasedRankingRule<?> exactness() {
        return new GraphBasedRankingRule<>("exactness", new ExactnessGraph());
    }

    @Override
    public String id() {
        return id;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ITERATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public void startIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                               RoaringBitmap universe, QueryGraph query) {
        RankingRuleGraph<C> graph = RankingRuleGraph.build(ctx, type, query, new DedupInterner<>());
        state = new State<>(query, graph);
        searchLogger.logInternalState(id, () -> graph.description(ctx));
    }

    @Override
    public RankingRuleOutput<QueryGraph> nextBucket(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                                                    RoaringBitmap universe) {
        if (state == null) {
            throw new IllegalStateException("Ranking rule " + id + " was not started");
        }
        while (!state.exhausted) {
            int cost = nextCost();
            if (cost < 0) {
                state.exhausted = true;
                state.lastBucketPaths = List.of();
                if (universe.isEmpty()) {
                    return null;
                }
                logger.debug("{}: {} documents left unmatched by any path", id, universe.getLongCardinality());
                return new RankingRuleOutput<>(state.query, universe.clone(),
                    ScoreDetails.ranked(id, new Rank(0, state.nextMaxCost)));
            }
            RoaringBitmap bucket = computeBucket(ctx, searchLogger, cost, universe);
            if (!bucket.isEmpty()) {
                logger.debug("{}: bucket at cost {} holds {} documents", id, cost, bucket.getLongCardinality());
                return new RankingRuleOutput<>(state.query, bucket, ScoreDetails.ranked(id, state.rankOf(cost)));
            }
        }
        return null;
    }

    @Override
    public void endIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger) {
        state = null;
    }

    /** Conditions of the paths that made up the last bucket; empty for the unmatched bucket. */
    protected List<List<C>> lastBucketPaths() {
        return state == null ? List.of() : state.lastBucketPaths;
    }

    private int nextCost() {
        for (int cost : state.allCosts[QueryGraph.ROOT]) {
            if (cost >= state.curCost) {
                state.curCost = cost + 1;
                return cost;
            }
        }
        return -1;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUCKET COMPUTATION
    // ════════════════════════════════════════════════════════════════════════════════

    private RoaringBitmap computeBucket(SearchContext ctx, SearchLogger<QueryGraph> searchLogger, int cost,
                                        RoaringBitmap parentUniverse) {
        RankingRuleGraph<C> graph = state.graph;
        RoaringBitmap bucket = new RoaringBitmap();
        RoaringBitmap universe = parentUniverse.clone();
        RoaringBitmap nodesWithRemovedEdges = new RoaringBitmap();
        List<PathPrefix<C>> subpaths = new ArrayList<>();
        List<List<C>> goodPaths = new ArrayList<>();

        PathVisitor<C> visitor = new PathVisitor<>(cost, graph, state.allCosts, state.deadEnds);
        visitor.visitPaths((path, g, deadEnds) -> {
            int common = 0;
            while (common < path.size() && common < subpaths.size()
                && path.get(common).equals(subpaths.get(common).condition())) {
                common++;
            }
            subpaths.subList(common, subpaths.size()).clear();

            for (int i = common; i < path.size(); i++) {
                if (!visitPathCondition(ctx, g, universe, deadEnds, subpaths, nodesWithRemovedEdges, path.get(i))) {
                    return true;
                }
            }

            RoaringBitmap pathDocids = subpaths.isEmpty()
                ? universe.clone()
                : subpaths.remove(subpaths.size() - 1).docids();
            List<C> conditions = new ArrayList<>(path.size());
            for (Interned<C> condition : path) {
                conditions.add(g.condition(condition));
            }
            goodPaths.add(conditions);

            for (PathPrefix<C> prefix : subpaths) {
                prefix.docids().andNot(pathDocids);
            }
            universe.andNot(pathDocids);
            bucket.or(pathDocids);
            return !universe.isEmpty();
        });

        if (nodesWithRemovedEdges.getCardinality() == 1) {
            graph.updateAllCostsBeforeNode(state.allCosts, nodesWithRemovedEdges.first());
        } else if (!nodesWithRemovedEdges.isEmpty()) {
            state.allCosts = graph.findAllCostsToEnd();
        }
        state.lastBucketPaths = goodPaths;
        searchLogger.logInternalState(id, goodPaths::toString);
        return bucket;
    }

    private record PathPrefix<C>(Interned<C> condition, RoaringBitmap docids) {}

    /**
     * Extends the current prefix with {@code condition}.
     *
     * @return false if the extended prefix matches no document
     */
    private boolean visitPathCondition(SearchContext ctx, RankingRuleGraph<C> graph, RoaringBitmap universe,
                                       DeadEndsCache<C> deadEnds, List<PathPrefix<C>> subpaths,
                                       RoaringBitmap nodesWithRemovedEdges, Interned<C> condition) {
        RoaringBitmap conditionDocids =
            state.conditionsCache.getComputedCondition(ctx, condition, graph, universe).docids();
        if (conditionDocids.isEmpty()) {
            deadEnds.forbidCondition(condition);
            nodesWithRemovedEdges.or(graph.removeEdgesWithCondition(condition));
            return false;
        }

        RoaringBitmap pathDocids = subpaths.isEmpty()
            ? conditionDocids.clone()
            : RoaringBitmap.and(subpaths.get(subpaths.size() - 1).docids(), conditionDocids);
        if (!pathDocids.isEmpty()) {
            subpaths.add(new PathPrefix<>(condition, pathDocids));
            return true;
        }

        List<Interned<C>> prefix = new ArrayList<>(subpaths.size());
        for (PathPrefix<C> subpath : subpaths) {
            prefix.add(subpath.condition());
        }
        deadEnds.forbidConditionAfterPrefix(prefix, condition);
        // a shorter prefix may already be disjoint from the condition
        for (int i = 0; i < subpaths.size() - 1; i++) {
            if (!RoaringBitmap.intersects(subpaths.get(i).docids(), conditionDocids)) {
                deadEnds.forbidConditionAfterPrefix(prefix.subList(0, i + 1), condition);
            }
        }
        return false;
    }
}
