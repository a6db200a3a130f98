package com.tessera.search.rules;

import com.tessera.search.api.model.Rank;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.filter.Filter;
import com.tessera.search.filter.FilterCompiler;
import com.tessera.search.logger.SearchLogger;
import org.roaringbitmap.RoaringBitmap;

import java.util.Objects;

/**
 * Puts the documents matching a filter before the others.
 *
 * <p>The filter is parsed when the rule is created and evaluated against the whole
 * index the first time the rule is started. Matching documents rank 2 of 2, the others
 * 1 of 2.
 *
 * @param <Q> query type, passed through unchanged
 */
public final class BoostRule<Q> implements RankingRule<Q> {

    private final Filter filter;
    private final FilterCompiler filterCompiler;
    private RoaringBitmap matching;

    private Q query;
    private int phase = -1;

    /**
     * @throws com.tessera.search.filter.FilterParseException if the expression is invalid
     */
    public BoostRule(String expression, FilterCompiler filterCompiler) {
        this.filterCompiler = Objects.requireNonNull(filterCompiler, "filterCompiler cannot be null");
        this.filter = filterCompiler.parse(expression);
    }

    @Override
    public String id() {
        return "boost:" + filter.expression();
    }

    @Override
    public void startIteration(SearchContext ctx, SearchLogger<Q> searchLogger, RoaringBitmap universe, Q query) {
        if (matching == null) {
            matching = filterCompiler.evaluate(filter, ctx.index());
        }
        this.query = query;
        this.phase = 0;
    }

    @Override
    public RankingRuleOutput<Q> nextBucket(SearchContext ctx, SearchLogger<Q> searchLogger, RoaringBitmap universe) {
        if (phase < 0) {
            throw new IllegalStateException("Ranking rule " + id() + " was not started");
        }
        while (phase < 2) {
            RoaringBitmap bucket = phase == 0
                ? RoaringBitmap.and(universe, matching)
                : RoaringBitmap.andNot(universe, matching);
            Rank rank = new Rank(2 - phase, 2);
            phase++;
            if (!bucket.isEmpty()) {
                return new RankingRuleOutput<>(query, bucket, ScoreDetails.ranked(id(), rank));
            }
        }
        return null;
    }

    @Override
    public void endIteration(SearchContext ctx, SearchLogger<Q> searchLogger) {
        query = null;
        phase = -1;
    }
}
