package com.tessera.search.rules;

import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.logger.SearchLogger;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders documents by the facet values of one field.
 *
 * <p>Ascending order yields numbers before strings, descending order strings before
 * numbers; each distinct value is a bucket. A document with several values lands in
 * the bucket of the first value reached. Documents without the field come last.
 * Each bucket is scored with its facet value, and the last one with no value.
 *
 * @param <Q> query type, passed through unchanged
 */
public final class SortRule<Q> implements RankingRule<Q> {

    private final String field;
    private final boolean ascending;

    private Q query;
    private Iterator<Map.Entry<?, RoaringBitmap>> values;
    private boolean remainderEmitted;

    public SortRule(String field, boolean ascending) {
        this.field = Objects.requireNonNull(field, "field cannot be null");
        this.ascending = ascending;
    }

    @Override
    public String id() {
        return (ascending ? "asc(" : "desc(") + field + ")";
    }

    public String field() {
        return field;
    }

    public boolean ascending() {
        return ascending;
    }

    @Override
    public void startIteration(SearchContext ctx, SearchLogger<Q> searchLogger, RoaringBitmap universe, Q query) {
        this.query = query;
        List<Map.Entry<?, RoaringBitmap>> ordered = new ArrayList<>();
        if (ascending) {
            ordered.addAll(ctx.index().numberFacetDocids(field).entrySet());
            ordered.addAll(ctx.index().stringFacetDocids(field).entrySet());
        } else {
            ordered.addAll(ctx.index().stringFacetDocids(field).descendingMap().entrySet());
            ordered.addAll(ctx.index().numberFacetDocids(field).descendingMap().entrySet());
        }
        this.values = ordered.iterator();
        this.remainderEmitted = false;
    }

    @Override
    public RankingRuleOutput<Q> nextBucket(SearchContext ctx, SearchLogger<Q> searchLogger, RoaringBitmap universe) {
        if (values == null) {
            throw new IllegalStateException("Ranking rule " + id() + " was not started");
        }
        while (values.hasNext()) {
            Map.Entry<?, RoaringBitmap> value = values.next();
            RoaringBitmap bucket = RoaringBitmap.and(value.getValue(), universe);
            if (!bucket.isEmpty()) {
                return new RankingRuleOutput<>(query, bucket, ScoreDetails.sorted(id(), value.getKey()));
            }
        }
        if (remainderEmitted || universe.isEmpty()) {
            return null;
        }
        remainderEmitted = true;
        return new RankingRuleOutput<>(query, universe.clone(), ScoreDetails.sorted(id(), null));
    }

    @Override
    public void endIteration(SearchContext ctx, SearchLogger<Q> searchLogger) {
        query = null;
        values = null;
    }
}
