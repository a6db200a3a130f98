package com.tessera.search.logger;

import com.tessera.search.rules.RankingRule;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.function.Supplier;

/**
 * Observer of a search, notified at every step of the bucket sort.
 *
 * <p>Implementations must not mutate the bitmaps they receive. A logger never changes
 * the outcome of a search. All callbacks default to doing nothing.
 *
 * @param <Q> query type of the ranking rules
 */
public interface SearchLogger<Q> {

    default void initialQuery(Q query) {
    }

    default void queryForInitialUniverse(Q query) {
    }

    default void initialUniverse(RoaringBitmap universe) {
    }

    default void rankingRules(List<RankingRule<Q>> rules) {
    }

    default void startIterationRankingRule(int ruleIndex, RankingRule<Q> rule, Q query, RoaringBitmap universe) {
    }

    default void nextBucketRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap universe,
                                       RoaringBitmap bucket) {
    }

    default void skipBucketRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap bucket) {
    }

    default void endIterationRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap universe) {
    }

    default void addToResults(List<Integer> docids) {
    }

    /**
     * Rule-specific state, such as a ranking rule graph or the paths of a bucket. The
     * state is only built if the logger asks {@code state} for it.
     */
    default void logInternalState(String ruleId, Supplier<?> state) {
    }
}
