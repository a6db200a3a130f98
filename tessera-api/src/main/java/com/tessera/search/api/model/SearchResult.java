/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.roaringbitmap.RoaringBitmap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a search.
 *
 * @param documentIds       ranked document ids of the requested window, best first
 * @param scoreDetails      per returned document, the score of every ranking rule that
 *                          split its bucket, outermost rule first
 * @param candidates        every document that matched the query and the filter, minus the
 *                          documents removed by distinct and by the ranking score threshold
 * @param bucketCandidates  union of the outermost ranking buckets that supplied at least one
 *                          returned document; used to compute facet distributions
 * @param processingTimeMs  wall-clock time spent in the engine
 */
public record SearchResult(
    @JsonProperty("hits") List<Integer> documentIds,
    @JsonProperty("ranking_score_details") List<List<ScoreDetails>> scoreDetails,
    @JsonIgnore RoaringBitmap candidates,
    @JsonIgnore RoaringBitmap bucketCandidates,
    @JsonProperty("processing_time_ms") long processingTimeMs
) implements Serializable {

    public SearchResult {
        documentIds = List.copyOf(documentIds);
        List<List<ScoreDetails>> copied = new ArrayList<>(scoreDetails.size());
        for (List<ScoreDetails> details : scoreDetails) {
            copied.add(List.copyOf(details));
        }
        scoreDetails = List.copyOf(copied);
        if (scoreDetails.size() != documentIds.size()) {
            throw new IllegalArgumentException(String.format("%d score details for %d documents",
                scoreDetails.size(), documentIds.size()));
        }
    }

    @JsonProperty("estimated_total_hits")
    public long estimatedTotalHits() {
        return candidates.getLongCardinality();
    }

    /** Global relevance score of each returned document, see {@link ScoreDetails#globalScore}. */
    @JsonProperty("ranking_scores")
    public List<Double> rankingScores() {
        List<Double> scores = new ArrayList<>(scoreDetails.size());
        for (List<ScoreDetails> details : scoreDetails) {
            scores.add(ScoreDetails.globalScore(details));
        }
        return scores;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return documentIds.isEmpty();
    }
}
