package com.tessera.search.graph.criteria;

import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ComputedCondition;
import com.tessera.search.graph.CostedCondition;
import com.tessera.search.graph.RankingRuleGraphType;
import com.tessera.search.query.LocatedQueryTermSubset;
import com.tessera.search.query.TermDocidsResolver;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/**
 * Words criterion: every term edge costs nothing, so the graph resolves to the
 * documents matching the query graph as a whole.
 */
public final class WordsGraph implements RankingRuleGraphType<WordsCondition> {

    @Override
    public String label() {
        return "words";
    }

    @Override
    public List<CostedCondition<WordsCondition>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                                            LocatedQueryTermSubset dest) {
        return List.of(CostedCondition.of(0, new WordsCondition(dest)));
    }

    @Override
    public ComputedCondition resolveCondition(SearchContext ctx, WordsCondition condition, RoaringBitmap universe) {
        RoaringBitmap docids = TermDocidsResolver.termSubsetDocids(ctx, condition.term().termSubset());
        return ComputedCondition.of(docids, universe, null, condition.term());
    }

    @Override
    public String conditionDescription(SearchContext ctx, WordsCondition condition) {
        return condition.term().termSubset().description(ctx);
    }
}
