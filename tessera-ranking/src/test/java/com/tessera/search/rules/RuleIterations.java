package com.tessera.search.rules;

import com.tessera.search.context.SearchContext;
import com.tessera.search.logger.DefaultSearchLogger;
import com.tessera.search.logger.SearchLogger;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a ranking rule the way the bucket sort does and collects its buckets.
 */
final class RuleIterations {

    private RuleIterations() {
    }

    static <Q> List<RoaringBitmap> buckets(SearchContext ctx, RankingRule<Q> rule, Q query, RoaringBitmap universe) {
        return outputs(ctx, rule, query, universe).stream().map(RankingRuleOutput::candidates).toList();
    }

    static <Q> List<RankingRuleOutput<Q>> outputs(SearchContext ctx, RankingRule<Q> rule, Q query,
                                                  RoaringBitmap universe) {
        SearchLogger<Q> logger = DefaultSearchLogger.instance();
        List<RankingRuleOutput<Q>> outputs = new ArrayList<>();
        RoaringBitmap remaining = universe.clone();
        rule.startIteration(ctx, logger, universe, query);
        try {
            RankingRuleOutput<Q> next;
            while (!remaining.isEmpty() && (next = rule.nextBucket(ctx, logger, remaining)) != null) {
                outputs.add(next);
                remaining.andNot(next.candidates());
            }
        } finally {
            rule.endIteration(ctx, logger);
        }
        return outputs;
    }
}
