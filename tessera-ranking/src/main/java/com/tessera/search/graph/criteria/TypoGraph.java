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
 * Typo criterion: one edge per typo level the term can match, costing the number of
 * typos plus the ngram base cost of the term.
 */
public final class TypoGraph implements RankingRuleGraphType<TypoCondition> {

    static final int MAX_TYPOS = 2;

    @Override
    public String label() {
        return "typo";
    }

    @Override
    public List<CostedCondition<TypoCondition>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                                           LocatedQueryTermSubset dest) {
        List<CostedCondition<TypoCondition>> edges = new ArrayList<>(MAX_TYPOS + 1);
        int maxTypos = ctx.term(dest.termSubset().original()).maxTypos();
        for (int typos = 0; typos <= maxTypos; typos++) {
            QueryTermSubset restricted = dest.termSubset().keepOnlyTypoLevel(typos);
            if (!restricted.isEmpty(ctx)) {
                edges.add(CostedCondition.of(typos + dest.ngramBaseCost(),
                    new TypoCondition(dest.withTermSubset(restricted), typos)));
            }
        }
        return edges;
    }

    @Override
    public ComputedCondition resolveCondition(SearchContext ctx, TypoCondition condition, RoaringBitmap universe) {
        RoaringBitmap docids = TermDocidsResolver.termSubsetDocids(ctx, condition.term().termSubset());
        return ComputedCondition.of(docids, universe, null, condition.term());
    }

    @Override
    public String conditionDescription(SearchContext ctx, TypoCondition condition) {
        return condition.term().termSubset().description(ctx) + " : " + condition.nbrTypos() + " typo(s)";
    }
}
