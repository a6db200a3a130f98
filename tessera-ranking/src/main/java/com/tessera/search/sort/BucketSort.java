/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.sort;

import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.rules.RankingRule;
import com.tessera.search.rules.RankingRuleOutput;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Chains ranking rules to produce the final document order.
 *
 * <p>The universe is split into buckets by the first rule; every bucket of more than
 * one document is split again by the next rule, depth first. Buckets of one document,
 * and buckets of the last rule, are emitted in ascending id order. With
 * {@link ScoringStrategy#DETAILED} single-document buckets go through every rule too.
 *
 * <p>Only the documents of the window {@code [from, from + length)} are returned:
 * buckets lying entirely before {@code from} are skipped without being refined, and
 * the sort stops as soon as the window is full.
 *
 * <h2>Distinct</h2>
 * <p>With a distinct field, every bucket about to be emitted or skipped keeps one
 * document per field value. The documents it excludes leave the candidates and the
 * universes still being split at every level, so they are never returned later.
 *
 * <h2>Scores</h2>
 * <p>Each returned document carries the scores of the buckets it went through,
 * outermost rule first. With a ranking score threshold, a bucket whose global score
 * falls below it is dropped from the candidates with the rest of its level, since the
 * following buckets of a level never score higher.
 *
 * <p>The deadline of the context is checked before every bucket. Every started rule is
 * ended, also when a rule or the deadline fails.
 */
public final class BucketSort {

    private BucketSort() {
    }

    public static <Q> BucketSortOutput bucketSort(SearchContext ctx, List<RankingRule<Q>> rules, Q query,
                                                  RoaringBitmap universe, int from, int length,
                                                  SearchLogger<Q> logger) {
        return bucketSort(ctx, rules, query, universe, from, length, BucketSortOptions.DEFAULTS, logger);
    }

    public static <Q> BucketSortOutput bucketSort(SearchContext ctx, List<RankingRule<Q>> rules, Q query,
                                                  RoaringBitmap universe, int from, int length,
                                                  BucketSortOptions options, SearchLogger<Q> logger) {
        logger.initialQuery(query);
        logger.rankingRules(rules);
        logger.initialUniverse(universe);

        DistinctFilter distinct = options.distinctField() == null
            ? null
            : new DistinctFilter(ctx.index(), options.distinctField());
        Results results = new Results(from, length, universe, distinct);
        if (length == 0 || universe.getLongCardinality() <= from) {
            return results.output();
        }
        new Run<>(ctx, rules, options, logger, results).sort(0, universe, query, universe);
        logger.addToResults(results.documentIds);
        return results.output();
    }

    private static final class Results {
        private final int from;
        private final int length;
        private final DistinctFilter distinct;
        private long position;
        private final List<Integer> documentIds = new ArrayList<>();
        private final List<List<ScoreDetails>> scoreDetails = new ArrayList<>();
        private final RoaringBitmap candidates;
        private final RoaringBitmap bucketCandidates = new RoaringBitmap();
        /** Universes of the rules currently iterating, outermost first. */
        private final Deque<RoaringBitmap> openUniverses = new ArrayDeque<>();

        private Results(int from, int length, RoaringBitmap universe, DistinctFilter distinct) {
            this.from = from;
            this.length = length;
            this.candidates = universe.clone();
            this.distinct = distinct;
        }

        boolean isFull() {
            return documentIds.size() >= length;
        }

        /** True if the whole bucket falls before the window. */
        boolean canSkip(RoaringBitmap bucket) {
            return position + bucket.getLongCardinality() <= from;
        }

        void skip(RoaringBitmap bucket) {
            position += bucket.getLongCardinality();
        }

        /** The documents of {@code bucket} left by distinct; the others are dropped everywhere. */
        RoaringBitmap deduplicate(RoaringBitmap bucket) {
            if (distinct == null) {
                return bucket;
            }
            DistinctFilter.Output output = distinct.apply(bucket);
            if (!output.excluded().isEmpty()) {
                candidates.andNot(output.excluded());
                for (RoaringBitmap universe : openUniverses) {
                    universe.andNot(output.excluded());
                }
            }
            return output.remaining();
        }

        void discard(RoaringBitmap docids) {
            candidates.andNot(docids);
        }

        void emit(RoaringBitmap bucket, RoaringBitmap outermostBucket, List<ScoreDetails> scores) {
            RoaringBitmap docids = deduplicate(bucket);
            List<ScoreDetails> bucketScores = List.copyOf(scores);
            boolean contributed = false;
            for (int docid : docids) {
                if (isFull()) {
                    break;
                }
                if (position++ < from) {
                    continue;
                }
                documentIds.add(docid);
                scoreDetails.add(bucketScores);
                contributed = true;
            }
            if (contributed) {
                bucketCandidates.or(outermostBucket);
            }
        }

        BucketSortOutput output() {
            return new BucketSortOutput(documentIds, scoreDetails, candidates,
                RoaringBitmap.and(bucketCandidates, candidates));
        }
    }

    private static final class Run<Q> {
        private final SearchContext ctx;
        private final List<RankingRule<Q>> rules;
        private final BucketSortOptions options;
        private final SearchLogger<Q> logger;
        private final Results results;
        private final List<ScoreDetails> scores = new ArrayList<>();

        private Run(SearchContext ctx, List<RankingRule<Q>> rules, BucketSortOptions options,
                    SearchLogger<Q> logger, Results results) {
            this.ctx = ctx;
            this.rules = rules;
            this.options = options;
            this.logger = logger;
            this.results = results;
        }

        void sort(int level, RoaringBitmap universe, Q query, RoaringBitmap outermostBucket) {
            if (level == rules.size() || universe.isEmpty() || (universe.getLongCardinality() == 1
                && options.scoringStrategy() == ScoringStrategy.SKIP)) {
                results.emit(universe, outermostBucket, scores);
                return;
            }

            RankingRule<Q> rule = rules.get(level);
            logger.startIterationRankingRule(level, rule, query, universe);
            rule.startIteration(ctx, logger, universe, query);
            RoaringBitmap remaining = universe.clone();
            results.openUniverses.addLast(remaining);
            try {
                while (!remaining.isEmpty() && !results.isFull()) {
                    ctx.deadline().check();
                    RankingRuleOutput<Q> next = rule.nextBucket(ctx, logger, remaining);
                    if (next == null) {
                        RoaringBitmap rest = remaining.clone();
                        results.emit(rest, level == 0 ? rest : outermostBucket, scores);
                        break;
                    }
                    RoaringBitmap bucket = next.candidates();
                    ctx.metrics().recordBucket();
                    logger.nextBucketRankingRule(level, rule, remaining, bucket);
                    remaining.andNot(bucket);

                    scores.add(next.score());
                    try {
                        if (isBelowThreshold()) {
                            results.discard(bucket);
                            results.discard(remaining);
                            break;
                        }
                        if (results.canSkip(bucket)) {
                            RoaringBitmap kept = results.deduplicate(bucket);
                            logger.skipBucketRankingRule(level, rule, kept);
                            results.skip(kept);
                            continue;
                        }
                        sort(level + 1, bucket, next.query(), level == 0 ? bucket : outermostBucket);
                    } finally {
                        scores.remove(scores.size() - 1);
                    }
                }
            } finally {
                results.openUniverses.removeLast();
                rule.endIteration(ctx, logger);
                logger.endIterationRankingRule(level, rule, universe);
            }
        }

        private boolean isBelowThreshold() {
            Double threshold = options.rankingScoreThreshold();
            return threshold != null && ScoreDetails.globalScore(scores) < threshold;
        }
    }
}
