package com.tessera.search.graph;

import com.tessera.search.interner.Interned;
import com.tessera.search.query.QueryGraph;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Depth-first enumeration of the paths of a {@link RankingRuleGraph} whose cost is
 * exactly a given value.
 *
 * <p>The cost table prunes edges that cannot complete a path of the remaining cost.
 * The {@link DeadEndsCache} prunes conditions known to be empty after the current
 * prefix; since the visit callback may record new dead ends, they are re-read after
 * every successful path and the visitor backtracks out of prefixes that became dead.
 *
 * @param <C> condition type of the criterion
 */
public final class PathVisitor<C> {

    /** Receives each path found; returns false to stop the enumeration. */
    @FunctionalInterface
    public interface Visit<C> {
        boolean visit(List<Interned<C>> path, RankingRuleGraph<C> graph, DeadEndsCache<C> deadEnds);
    }

    /** Outcome of visiting a subgraph. */
    private enum Flow { NONE_VALID, ANY_VALID, STOP }

    private final RankingRuleGraph<C> graph;
    private final int[][] allCosts;
    private final DeadEndsCache<C> deadEnds;

    private int remainingCost;
    private final List<Interned<C>> path = new ArrayList<>();
    private final RoaringBitmap visitedConditions = new RoaringBitmap();
    private RoaringBitmap forbiddenConditions = new RoaringBitmap();

    public PathVisitor(int cost, RankingRuleGraph<C> graph, int[][] allCosts, DeadEndsCache<C> deadEnds) {
        this.remainingCost = cost;
        this.graph = graph;
        this.allCosts = allCosts;
        this.deadEnds = deadEnds;
    }

    public void visitPaths(Visit<C> visit) {
        forbiddenConditions = deadEnds.forbiddenConditionsForAllPrefixesUpTo(List.of());
        visitNode(QueryGraph.ROOT, visit);
    }

    private Flow visitNode(int fromNode, Visit<C> visit) {
        boolean anyValid = false;
        RoaringBitmap edgeIds = graph.edgesOfNode(fromNode).clone();
        for (int edgeId : edgeIds) {
            Edge<C> edge = graph.edge(edgeId);
            if (edge == null || edge.cost() > remainingCost) {
                continue;
            }
            remainingCost -= edge.cost();
            Flow flow = edge.isUnconditional()
                ? visitNoCondition(edge.dest(), visit)
                : visitCondition(edge.condition(), edge.dest(), visit);
            remainingCost += edge.cost();

            if (flow == Flow.STOP) {
                return Flow.STOP;
            }
            if (flow == Flow.ANY_VALID) {
                anyValid = true;
                // the visit may have made the current prefix a dead end
                forbiddenConditions = deadEnds.forbiddenConditionsForAllPrefixesUpTo(path);
                if (RoaringBitmap.intersects(visitedConditions, forbiddenConditions)) {
                    return Flow.ANY_VALID;
                }
            }
        }
        return anyValid ? Flow.ANY_VALID : Flow.NONE_VALID;
    }

    private Flow visitNoCondition(int destNode, Visit<C> visit) {
        if (!canReachEndWithRemainingCost(destNode)) {
            return Flow.NONE_VALID;
        }
        if (destNode == QueryGraph.END) {
            return visit.visit(Collections.unmodifiableList(path), graph, deadEnds) ? Flow.ANY_VALID : Flow.STOP;
        }
        return visitNode(destNode, visit);
    }

    private Flow visitCondition(Interned<C> condition, int destNode, Visit<C> visit) {
        if (forbiddenConditions.contains(condition.index()) || !canReachEndWithRemainingCost(destNode)) {
            return Flow.NONE_VALID;
        }
        path.add(condition);
        visitedConditions.add(condition.index());
        RoaringBitmap previousForbidden = forbiddenConditions.clone();
        RoaringBitmap nextForbidden = deadEnds.forbiddenConditionsAfterPrefix(path);
        if (nextForbidden != null) {
            forbiddenConditions.or(nextForbidden);
        }

        Flow flow = visitNode(destNode, visit);

        forbiddenConditions = previousForbidden;
        visitedConditions.remove(condition.index());
        path.remove(path.size() - 1);
        return flow;
    }

    private boolean canReachEndWithRemainingCost(int node) {
        for (int cost : allCosts[node]) {
            if (cost == remainingCost) {
                return true;
            }
        }
        return false;
    }
}
