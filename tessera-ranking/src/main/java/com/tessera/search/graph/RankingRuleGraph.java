/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.graph;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.interner.Interned;
import com.tessera.search.query.QueryGraph;
import com.tessera.search.query.QueryNode;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntConsumer;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The query graph seen by one ranking criterion: every query edge is replaced by the
 * costed conditions of the criterion.
 *
 * <p>Edges live in an arena indexed by edge id. Retracted edges leave null holes so
 * that the ids of the other edges stay valid.
 *
 * <h2>Cost table</h2>
 * <p>{@link #findAllCostsToEnd()} computes, for every node, the sorted distinct costs
 * of the paths from that node to the end node. Path enumeration uses it to only walk
 * edges that can still complete a path of the requested cost.
 *
 * @param <C> condition type of the criterion
 */
public final class RankingRuleGraph<C> {

    private final RankingRuleGraphType<C> type;
    private final QueryGraph queryGraph;
    private final List<Edge<C>> edges;
    private final RoaringBitmap[] edgesOfNode;
    private final RoaringBitmap[] successors;
    private final DedupInterner<C> conditions;

    private RankingRuleGraph(RankingRuleGraphType<C> type, QueryGraph queryGraph, List<Edge<C>> edges,
                             RoaringBitmap[] edgesOfNode, RoaringBitmap[] successors,
                             DedupInterner<C> conditions) {
        this.type = type;
        this.queryGraph = queryGraph;
        this.edges = edges;
        this.edgesOfNode = edgesOfNode;
        this.successors = successors;
        this.conditions = conditions;
    }

    /**
     * Builds the graph of {@code type} over {@code queryGraph}. Edges into the end node
     * are unconditional with cost 0. Conditions are interned into {@code conditions},
     * which may be shared between graphs of the same criterion.
     */
    public static <C> RankingRuleGraph<C> build(SearchContext ctx, RankingRuleGraphType<C> type,
                                                QueryGraph queryGraph, DedupInterner<C> conditions) {
        Objects.requireNonNull(type, "type cannot be null");
        int nodeCount = queryGraph.size();
        List<Edge<C>> edges = new ArrayList<>();
        RoaringBitmap[] edgesOfNode = new RoaringBitmap[nodeCount];
        RoaringBitmap[] successors = new RoaringBitmap[nodeCount];

        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            edgesOfNode[nodeId] = new RoaringBitmap();
            successors[nodeId] = new RoaringBitmap();
        }

        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            QueryNode node = queryGraph.node(nodeId);
            if (node.isDeleted() || node.kind() == QueryNode.Kind.END) {
                continue;
            }
            for (int succId : node.successors()) {
                QueryNode succ = queryGraph.node(succId);
                if (succ.kind() == QueryNode.Kind.END) {
                    edgesOfNode[nodeId].add(edges.size());
                    edges.add(new Edge<>(nodeId, succId, 0, null));
                    successors[nodeId].add(succId);
                    continue;
                }
                if (!succ.isTerm()) {
                    continue;
                }
                List<CostedCondition<C>> built = type.buildEdges(ctx, node.isTerm() ? node.term() : null, succ.term());
                for (CostedCondition<C> costed : built) {
                    Interned<C> condition = costed.condition() == null ? null : conditions.insert(costed.condition());
                    edgesOfNode[nodeId].add(edges.size());
                    edges.add(new Edge<>(nodeId, succId, costed.cost(), condition));
                    successors[nodeId].add(succId);
                }
            }
        }
        return new RankingRuleGraph<>(type, queryGraph, edges, edgesOfNode, successors, conditions);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public RankingRuleGraphType<C> type() {
        return type;
    }

    public QueryGraph queryGraph() {
        return queryGraph;
    }

    /** Edge of an id; null if it was retracted. */
    public Edge<C> edge(int edgeId) {
        return edges.get(edgeId);
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Ids of the live outgoing edges of a node. */
    public RoaringBitmap edgesOfNode(int nodeId) {
        return edgesOfNode[nodeId];
    }

    public RoaringBitmap successors(int nodeId) {
        return successors[nodeId];
    }

    public C condition(Interned<C> condition) {
        return conditions.get(condition);
    }

    public int conditionCount() {
        return conditions.size();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // MUTATION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Retracts every edge carrying {@code condition}.
     *
     * @return ids of the nodes that lost outgoing edges
     */
    public RoaringBitmap removeEdgesWithCondition(Interned<C> condition) {
        RoaringBitmap sourceNodes = new RoaringBitmap();
        for (int edgeId = 0; edgeId < edges.size(); edgeId++) {
            Edge<C> edge = edges.get(edgeId);
            if (edge == null || !condition.equals(edge.condition())) {
                continue;
            }
            edges.set(edgeId, null);
            edgesOfNode[edge.source()].remove(edgeId);
            sourceNodes.add(edge.source());
        }
        return sourceNodes;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // COSTS
    // ════════════════════════════════════════════════════════════════════════════════

    /** For every node, the sorted distinct costs of its paths to the end node. */
    public int[][] findAllCostsToEnd() {
        int[][] costs = new int[queryGraph.size()][];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = new int[0];
        }
        traverseBreadthFirstBackward(QueryGraph.END, node -> {
            if (node == QueryGraph.END) {
                costs[node] = new int[]{0};
                return;
            }
            IntSortedSet nodeCosts = new IntAVLTreeSet();
            for (int edgeId : edgesOfNode[node]) {
                Edge<C> edge = edges.get(edgeId);
                for (int succCost : costs[edge.dest()]) {
                    nodeCosts.add(edge.cost() + succCost);
                }
            }
            costs[node] = nodeCosts.toIntArray();
        });
        return costs;
    }

    /**
     * Drops from {@code costs} the costs that the nodes before {@code node} can no
     * longer reach after {@code node} lost outgoing edges.
     */
    public void updateAllCostsBeforeNode(int[][] costs, int node) {
        traverseBreadthFirstBackward(node, current -> {
            IntOpenHashSet toRemove = new IntOpenHashSet(costs[current]);
            for (int edgeId : edgesOfNode[current]) {
                if (toRemove.isEmpty()) {
                    return;
                }
                Edge<C> edge = edges.get(edgeId);
                for (int succCost : costs[edge.dest()]) {
                    toRemove.remove(edge.cost() + succCost);
                }
            }
            if (toRemove.isEmpty()) {
                return;
            }
            IntSortedSet remaining = new IntAVLTreeSet(costs[current]);
            remaining.removeAll(toRemove);
            costs[current] = remaining.toIntArray();
        });
    }

    /**
     * Visits {@code from} and every node that can reach it, each node only after all
     * of its successors that can reach {@code from} were visited.
     */
    public void traverseBreadthFirstBackward(int from, IntConsumer visit) {
        int nodeCount = queryGraph.size();

        RoaringBitmap reachable = new RoaringBitmap();
        RoaringBitmap enqueued = new RoaringBitmap();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(from);
        enqueued.add(from);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            if (reachable.contains(node)) {
                continue;
            }
            reachable.add(node);
            for (int pred : queryGraph.node(node).predecessors()) {
                if (!enqueued.contains(pred) && !reachable.contains(pred)) {
                    queue.enqueue(pred);
                    enqueued.add(pred);
                }
            }
        }

        RoaringBitmap unreachableOrVisited = new RoaringBitmap();
        unreachableOrVisited.add(0L, (long) nodeCount);
        unreachableOrVisited.andNot(reachable);

        enqueued.clear();
        queue.enqueue(from);
        enqueued.add(from);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            if (!RoaringBitmap.andNot(successors[node], unreachableOrVisited).isEmpty()) {
                queue.enqueue(node);
                continue;
            }
            unreachableOrVisited.add(node);
            visit.accept(node);
            for (int pred : queryGraph.node(node).predecessors()) {
                if (!enqueued.contains(pred) && !unreachableOrVisited.contains(pred)) {
                    queue.enqueue(pred);
                    enqueued.add(pred);
                }
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RESOLUTION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Documents of {@code universe} matched by at least one path from the start node to
     * the end node, whatever its cost. Every condition is resolved once through
     * {@code cache}.
     */
    public RoaringBitmap docidsOfAllPaths(SearchContext ctx, ConditionDocIdsCache<C> cache,
                                          RoaringBitmap universe) {
        RoaringBitmap[] nodeDocids = new RoaringBitmap[queryGraph.size()];
        nodeDocids[QueryGraph.ROOT] = universe.clone();
        RoaringBitmap result = new RoaringBitmap();
        // node ids do not follow a topological order once ngram nodes exist
        traverseForward(node -> {
            RoaringBitmap docids = nodeDocids[node];
            if (docids == null || docids.isEmpty()) {
                return;
            }
            for (int edgeId : edgesOfNode[node]) {
                Edge<C> edge = edges.get(edgeId);
                RoaringBitmap through = edge.isUnconditional()
                    ? docids
                    : RoaringBitmap.and(docids, cache.getComputedCondition(ctx, edge.condition(), this, universe).docids());
                if (edge.dest() == QueryGraph.END) {
                    result.or(through);
                } else if (nodeDocids[edge.dest()] == null) {
                    nodeDocids[edge.dest()] = through.clone();
                } else {
                    nodeDocids[edge.dest()].or(through);
                }
            }
        });
        return result;
    }

    /** Visits the nodes reachable from the start node, each after all of its predecessors. */
    private void traverseForward(IntConsumer visit) {
        int nodeCount = queryGraph.size();
        RoaringBitmap reachable = new RoaringBitmap();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(QueryGraph.ROOT);
        reachable.add(QueryGraph.ROOT);
        while (!queue.isEmpty()) {
            for (int succ : successors[queue.dequeueInt()]) {
                if (reachable.checkedAdd(succ)) {
                    queue.enqueue(succ);
                }
            }
        }
        int[] pendingPredecessors = new int[nodeCount];
        for (int node : reachable) {
            for (int succ : successors[node]) {
                pendingPredecessors[succ]++;
            }
        }

        queue.enqueue(QueryGraph.ROOT);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            visit.accept(node);
            for (int succ : successors[node]) {
                if (--pendingPredecessors[succ] == 0) {
                    queue.enqueue(succ);
                }
            }
        }
    }

    public String description(SearchContext ctx) {
        StringBuilder sb = new StringBuilder(type.label()).append(" graph\n");
        for (int edgeId = 0; edgeId < edges.size(); edgeId++) {
            Edge<C> edge = edges.get(edgeId);
            if (edge == null) {
                continue;
            }
            sb.append(String.format("  %d -> %d cost=%d %s%n", edge.source(), edge.dest(), edge.cost(),
                edge.isUnconditional() ? "-" : type.conditionDescription(ctx, conditions.get(edge.condition()))));
        }
        return sb.toString();
    }
}
