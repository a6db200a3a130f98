package com.tessera.search.rules;

import com.tessera.search.api.model.Rank;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.criteria.AttributeCondition;
import com.tessera.search.graph.criteria.AttributeGraph;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.query.QueryGraph;
import com.tessera.search.query.TermDocidsResolver;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Ranks documents by the importance of the fields their matched terms occur in.
 *
 * <p>Each bucket of the attribute graph is split by searchable field, most important
 * field first: a document goes to the part of the first field that contains every
 * term of one of the bucket's paths. Documents not placed by any field come last.
 *
 * <p>With {@code f} searchable fields, the part of field {@code i} ranks {@code f - i}
 * of {@code f} within the graph bucket, and the unplaced part 0.
 */
public final class AttributeRule extends GraphBasedRankingRule<AttributeCondition> {

    private final Deque<RankingRuleOutput<QueryGraph>> pending = new ArrayDeque<>();

    public AttributeRule() {
        super("attribute", new AttributeGraph());
    }

    @Override
    public void startIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                               RoaringBitmap universe, QueryGraph query) {
        pending.clear();
        super.startIteration(ctx, searchLogger, universe, query);
    }

    @Override
    public RankingRuleOutput<QueryGraph> nextBucket(SearchContext ctx, SearchLogger<QueryGraph> searchLogger,
                                                    RoaringBitmap universe) {
        if (!pending.isEmpty()) {
            return pending.pollFirst();
        }
        RankingRuleOutput<QueryGraph> bucket = super.nextBucket(ctx, searchLogger, universe);
        if (bucket == null) {
            return null;
        }
        List<List<AttributeCondition>> paths = lastBucketPaths();
        if (paths.isEmpty()) {
            return bucket;
        }

        RoaringBitmap rest = bucket.candidates().clone();
        int fieldCount = ctx.index().searchableFields().size();
        Rank graphRank = bucket.score().rank();
        for (int fieldId = 0; fieldId < fieldCount && !rest.isEmpty(); fieldId++) {
            RoaringBitmap inField = new RoaringBitmap();
            for (List<AttributeCondition> path : paths) {
                RoaringBitmap pathInField = rest.clone();
                for (AttributeCondition condition : path) {
                    pathInField.and(TermDocidsResolver.termSubsetFieldDocids(ctx,
                        condition.term().termSubset(), fieldId));
                }
                inField.or(pathInField);
            }
            if (!inField.isEmpty()) {
                pending.addLast(new RankingRuleOutput<>(bucket.query(), inField,
                    fieldScore(graphRank, new Rank(fieldCount - fieldId, fieldCount))));
                rest.andNot(inField);
            }
        }
        if (!rest.isEmpty()) {
            pending.addLast(new RankingRuleOutput<>(bucket.query(), rest,
                fieldScore(graphRank, new Rank(0, Math.max(fieldCount, 1)))));
        }
        return pending.pollFirst();
    }

    private ScoreDetails fieldScore(Rank graphRank, Rank fieldRank) {
        return ScoreDetails.ranked(id(), Rank.merge(graphRank, fieldRank));
    }

    @Override
    public void endIteration(SearchContext ctx, SearchLogger<QueryGraph> searchLogger) {
        pending.clear();
        super.endIteration(ctx, searchLogger);
    }
}
