/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the index's ranking rules setting.
 *
 * <p>Accepted textual forms:
 * <ul>
 *   <li>{@code words}, {@code typo}, {@code proximity}, {@code attribute}, {@code exactness}</li>
 *   <li>{@code sort}: placeholder for the request's sort criteria</li>
 *   <li>{@code asc(field)} and {@code desc(field)}: fixed facet ordering</li>
 *   <li>{@code boost:<filter>}: documents matching the filter first</li>
 * </ul>
 */
public record RankingRuleSetting(Kind kind, String argument) implements Serializable {

    public enum Kind {
        WORDS, TYPO, PROXIMITY, ATTRIBUTE, EXACTNESS, SORT, ASC, DESC, BOOST;

        /** True for the criteria that need a query graph and are skipped by placeholder searches. */
        public boolean requiresQuery() {
            return switch (this) {
                case WORDS, TYPO, PROXIMITY, ATTRIBUTE, EXACTNESS -> true;
                case SORT, ASC, DESC, BOOST -> false;
            };
        }
    }

    public RankingRuleSetting {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static RankingRuleSetting of(Kind kind) {
        return new RankingRuleSetting(kind, null);
    }

    @JsonCreator
    public static RankingRuleSetting parse(String text) {
        if (text == null || text.isBlank()) {
            throw new UserErrorException(ErrorCode.INVALID_RANKING_RULE, "Ranking rule cannot be empty");
        }
        String trimmed = text.trim();

        if (trimmed.regionMatches(true, 0, "boost:", 0, 6)) {
            String filter = trimmed.substring(6).trim();
            if (filter.isEmpty()) {
                throw new UserErrorException(ErrorCode.INVALID_RANKING_RULE,
                    "Boost ranking rule requires a filter expression: " + text);
            }
            return new RankingRuleSetting(Kind.BOOST, filter);
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if ((lower.startsWith("asc(") || lower.startsWith("desc(")) && lower.endsWith(")")) {
            int open = trimmed.indexOf('(');
            String field = trimmed.substring(open + 1, trimmed.length() - 1).trim();
            if (field.isEmpty()) {
                throw new UserErrorException(ErrorCode.INVALID_RANKING_RULE,
                    "Missing field name in ranking rule: " + text);
            }
            return new RankingRuleSetting(lower.startsWith("asc(") ? Kind.ASC : Kind.DESC, field);
        }

        return switch (lower) {
            case "words" -> of(Kind.WORDS);
            case "typo" -> of(Kind.TYPO);
            case "proximity" -> of(Kind.PROXIMITY);
            case "attribute" -> of(Kind.ATTRIBUTE);
            case "exactness" -> of(Kind.EXACTNESS);
            case "sort" -> of(Kind.SORT);
            default -> throw new UserErrorException(ErrorCode.INVALID_RANKING_RULE,
                String.format("`%s` ranking rule is invalid. Valid ranking rules are words, typo, sort, "
                    + "proximity, attribute, exactness, boost:<filter> and custom ranking rules "
                    + "(asc(field) or desc(field))", text));
        };
    }

    public static List<RankingRuleSetting> parseAll(List<String> texts) {
        List<RankingRuleSetting> settings = new ArrayList<>(texts.size());
        for (String text : texts) {
            settings.add(parse(text));
        }
        return settings;
    }

    /** The default ranking rules of a new index. */
    public static List<RankingRuleSetting> defaults() {
        return List.of(of(Kind.WORDS), of(Kind.TYPO), of(Kind.PROXIMITY),
            of(Kind.ATTRIBUTE), of(Kind.SORT), of(Kind.EXACTNESS));
    }

    @JsonValue
    @Override
    public String toString() {
        return switch (kind) {
            case ASC -> "asc(" + argument + ")";
            case DESC -> "desc(" + argument + ")";
            case BOOST -> "boost:" + argument;
            default -> kind.name().toLowerCase(Locale.ROOT);
        };
    }
}
