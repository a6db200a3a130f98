package com.tessera.search.rules;

import com.tessera.search.api.model.ScoreDetails;
import org.roaringbitmap.RoaringBitmap;

import java.util.Objects;

/**
 * A bucket produced by a ranking rule.
 *
 * @param query      query handed to the next rule for this bucket
 * @param candidates documents of the bucket, tied on this rule
 * @param score      score shared by the documents of the bucket
 * @param <Q>        query type
 */
public record RankingRuleOutput<Q>(Q query, RoaringBitmap candidates, ScoreDetails score) {

    public RankingRuleOutput {
        Objects.requireNonNull(candidates, "candidates cannot be null");
        Objects.requireNonNull(score, "score cannot be null");
    }
}
