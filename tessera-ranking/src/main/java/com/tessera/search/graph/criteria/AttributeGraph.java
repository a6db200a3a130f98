package com.tessera.search.graph.criteria;

import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ComputedCondition;
import com.tessera.search.graph.CostedCondition;
import com.tessera.search.graph.RankingRuleGraphType;
import com.tessera.search.query.LocatedQueryTermSubset;
import com.tessera.search.query.QueryTermSubset;
import com.tessera.search.query.TermDocidsResolver;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * Attribute criterion. Edges follow the typo levels of the term like {@link TypoGraph};
 * the attribute rule then orders each bucket by field importance.
 */
public final class AttributeGraph implements RankingRuleGraphType<AttributeCondition> {

    @Override
    public String label() {
        return "attribute";
    }

    @Override
    public List<CostedCondition<AttributeCondition>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                                                LocatedQueryTermSubset dest) {
        List<CostedCondition<AttributeCondition>> edges = new ArrayList<>();
        int maxTypos = ctx.term(dest.termSubset().original()).maxTypos();
        for (int typos = 0; typos <= maxTypos; typos++) {
            QueryTermSubset restricted = dest.termSubset().keepOnlyTypoLevel(typos);
            if (!restricted.isEmpty(ctx)) {
                edges.add(CostedCondition.of(typos + dest.ngramBaseCost(),
                    new AttributeCondition(dest.withTermSubset(restricted), typos)));
            }
        }
        return edges;
    }

    @Override
    public ComputedCondition resolveCondition(SearchContext ctx, AttributeCondition condition,
                                              RoaringBitmap universe) {
        RoaringBitmap docids = TermDocidsResolver.termSubsetDocids(ctx, condition.term().termSubset());
        return ComputedCondition.of(docids, universe, null, condition.term());
    }

    @Override
    public String conditionDescription(SearchContext ctx, AttributeCondition condition) {
        return condition.term().termSubset().description(ctx) + " : " + condition.nbrTypos() + " typo(s)";
    }
}
