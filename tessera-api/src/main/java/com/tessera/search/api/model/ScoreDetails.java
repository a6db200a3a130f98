/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Why a document landed in its bucket for one ranking rule.
 *
 * <p>Relevance rules report a {@link Rank}. Sort rules report the facet value the
 * document was ordered by instead, which has no score: a value of {@code null} means
 * the document lacks the field.
 *
 * @param rule  id of the ranking rule, e.g. {@code typo} or {@code desc(year)}
 * @param rank  rank of the bucket, null for sort rules
 * @param value facet value of the bucket, null for relevance rules
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreDetails(
    @JsonProperty("rule") String rule,
    @JsonProperty("rank") Rank rank,
    @JsonProperty("value") Object value
) implements Serializable {

    public ScoreDetails {
        Objects.requireNonNull(rule, "rule cannot be null");
    }

    public static ScoreDetails ranked(String rule, Rank rank) {
        return new ScoreDetails(rule, Objects.requireNonNull(rank, "rank cannot be null"), null);
    }

    public static ScoreDetails sorted(String rule, Object value) {
        return new ScoreDetails(rule, null, value);
    }

    /**
     * Relevance score in [0, 1] of a document ranked by {@code details}, outermost rule first.
     *
     * <p>The ranks of the first run of relevance rules are merged into one; sort rules
     * before that run are ignored and the run ends at the next sort rule. Without any
     * relevance rule the score is 1.
     */
    public static double globalScore(List<ScoreDetails> details) {
        Rank merged = null;
        for (ScoreDetails detail : details) {
            if (detail.rank() == null) {
                if (merged != null) {
                    break;
                }
                continue;
            }
            merged = merged == null ? detail.rank() : Rank.merge(merged, detail.rank());
        }
        return merged == null ? 1.0 : merged.localScore();
    }
}
