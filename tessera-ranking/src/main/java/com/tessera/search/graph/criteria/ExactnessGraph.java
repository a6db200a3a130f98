package com.tessera.search.graph.criteria;

import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ComputedCondition;
import com.tessera.search.graph.CostedCondition;
import com.tessera.search.graph.RankingRuleGraphType;
import com.tessera.search.query.ExactTerm;
import com.tessera.search.query.LocatedQueryTermSubset;
import com.tessera.search.query.TermDocidsResolver;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/**
 * Exactness criterion: matching the exact form of a term is free, any other
 * derivation costs one.
 */
public final class ExactnessGraph implements RankingRuleGraphType<ExactnessCondition> {

    @Override
    public String label() {
        return "exactness";
    }

    @Override
    public List<CostedCondition<ExactnessCondition>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                                                LocatedQueryTermSubset dest) {
        CostedCondition<ExactnessCondition> any = CostedCondition.of(1, new ExactnessCondition.Any(dest));
        if (dest.termSubset().exactTerm(ctx) == null) {
            return List.of(any);
        }
        LocatedQueryTermSubset exact = dest.withTermSubset(dest.termSubset().keepOnlyExactTerm(ctx));
        return List.of(CostedCondition.of(0, new ExactnessCondition.ExactInAttribute(exact)), any);
    }

    @Override
    public ComputedCondition resolveCondition(SearchContext ctx, ExactnessCondition condition,
                                              RoaringBitmap universe) {
        RoaringBitmap docids;
        if (condition instanceof ExactnessCondition.ExactInAttribute) {
            ExactTerm exact = condition.term().termSubset().exactTerm(ctx);
            if (exact == null) {
                docids = new RoaringBitmap();
            } else if (exact.isPhrase()) {
                docids = TermDocidsResolver.phraseDocids(ctx, exact.phrase());
            } else {
                docids = ctx.dbCache().wordDocids(exact.word());
            }
        } else {
            docids = TermDocidsResolver.termSubsetDocids(ctx, condition.term().termSubset());
        }
        return ComputedCondition.of(docids, universe, null, condition.term());
    }

    @Override
    public String conditionDescription(SearchContext ctx, ExactnessCondition condition) {
        String kind = condition instanceof ExactnessCondition.ExactInAttribute ? "exact" : "any";
        return condition.term().termSubset().description(ctx) + " : " + kind;
    }
}
