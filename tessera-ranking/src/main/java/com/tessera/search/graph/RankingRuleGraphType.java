package com.tessera.search.graph;

import com.tessera.search.context.SearchContext;
import com.tessera.search.query.LocatedQueryTermSubset;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/**
 * What makes one ranking criterion: how query graph edges become costed conditions,
 * and how a condition resolves to documents.
 *
 * @param <C> condition type; values are interned, so they must implement
 *            {@code equals} and {@code hashCode}
 */
public interface RankingRuleGraphType<C> {

    /** Short name of the criterion, used in logs. */
    String label();

    /**
     * Conditions of the edges from {@code source} to {@code dest}, in a deterministic order.
     *
     * @param source term of the source node, or null when the source is the start node
     * @param dest   term of the destination node
     */
    List<CostedCondition<C>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                        LocatedQueryTermSubset dest);

    /** Documents of {@code universe} that satisfy {@code condition}. */
    ComputedCondition resolveCondition(SearchContext ctx, C condition, RoaringBitmap universe);

    default String conditionDescription(SearchContext ctx, C condition) {
        return String.valueOf(condition);
    }
}
