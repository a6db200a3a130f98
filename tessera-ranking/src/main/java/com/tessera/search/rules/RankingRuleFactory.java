/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.rules;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.api.model.RankingRuleSetting;
import com.tessera.search.api.model.SortCriterion;
import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.filter.FilterCompiler;
import com.tessera.search.query.PlaceholderQuery;
import com.tessera.search.query.QueryGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Instantiates the ranking rules of a search from the index's ranking rule settings.
 *
 * <ul>
 *   <li>{@code words} is inserted before the first of {@code typo}, {@code proximity},
 *       {@code attribute} and {@code exactness} when the settings omit it</li>
 *   <li>repeated settings are ignored</li>
 *   <li>the {@code sort} setting expands to one sort rule per request sort criterion</li>
 *   <li>placeholder searches only keep {@code sort}, {@code asc}, {@code desc} and {@code boost}</li>
 * </ul>
 */
public final class RankingRuleFactory {

    private final FilterCompiler filterCompiler;

    public RankingRuleFactory(FilterCompiler filterCompiler) {
        this.filterCompiler = Objects.requireNonNull(filterCompiler, "filterCompiler cannot be null");
    }

    /**
     * Rules of a search with a query.
     *
     * @throws UserErrorException if a sort field is not sortable, the request sorts
     *                            without a {@code sort} setting, or a boost filter is invalid
     */
    public List<RankingRule<QueryGraph>> queryRules(IndexSnapshot index, List<SortCriterion> sort,
                                                    TermsMatchingStrategy strategy) {
        List<RankingRuleSetting> settings = index.rankingRules();
        validateSort(index, settings, sort);

        List<RankingRule<QueryGraph>> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean wordsPresent = settings.stream().anyMatch(s -> s.kind() == RankingRuleSetting.Kind.WORDS);

        for (RankingRuleSetting setting : settings) {
            if (!seen.add(setting.toString())) {
                continue;
            }
            switch (setting.kind()) {
                case WORDS -> rules.add(new WordsRule(strategy));
                case TYPO, PROXIMITY, ATTRIBUTE, EXACTNESS -> {
                    if (!wordsPresent) {
                        rules.add(new WordsRule(strategy));
                        wordsPresent = true;
                    }
                    rules.add(graphRule(setting.kind()));
                }
                default -> addGenericRule(index, setting, sort, rules);
            }
        }
        return rules;
    }

    /** Rules of a placeholder search. */
    public List<RankingRule<PlaceholderQuery>> placeholderRules(IndexSnapshot index, List<SortCriterion> sort) {
        List<RankingRuleSetting> settings = index.rankingRules();
        validateSort(index, settings, sort);

        List<RankingRule<PlaceholderQuery>> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RankingRuleSetting setting : settings) {
            if (setting.kind().requiresQuery() || !seen.add(setting.toString())) {
                continue;
            }
            addGenericRule(index, setting, sort, rules);
        }
        return rules;
    }

    private static RankingRule<QueryGraph> graphRule(RankingRuleSetting.Kind kind) {
        return switch (kind) {
            case TYPO -> GraphBasedRankingRule.typo();
            case PROXIMITY -> GraphBasedRankingRule.proximity();
            case ATTRIBUTE -> new AttributeRule();
            case EXACTNESS -> GraphBasedRankingRule.exactness();
            default -> throw new IllegalArgumentException("Not a graph-based ranking rule: " + kind);
        };
    }

    private <Q> void addGenericRule(IndexSnapshot index, RankingRuleSetting setting, List<SortCriterion> sort,
                                    List<RankingRule<Q>> rules) {
        switch (setting.kind()) {
            case SORT -> {
                for (SortCriterion criterion : sort) {
                    rules.add(new SortRule<>(criterion.field(), criterion.ascending()));
                }
            }
            case ASC, DESC -> {
                requireSortable(index, setting.argument());
                rules.add(new SortRule<>(setting.argument(), setting.kind() == RankingRuleSetting.Kind.ASC));
            }
            case BOOST -> rules.add(new BoostRule<>(setting.argument(), filterCompiler));
            default -> throw new IllegalArgumentException("Ranking rule needs a query: " + setting);
        }
    }

    /**
     * @throws UserErrorException if the request sorts but the settings have no
     *                            {@code sort} rule, or sorts on a field that is not sortable
     */
    public static void validateSort(IndexSnapshot index, List<RankingRuleSetting> settings,
                                    List<SortCriterion> sort) {
        if (sort.isEmpty()) {
            return;
        }
        boolean hasSortRule = settings.stream().anyMatch(s -> s.kind() == RankingRuleSetting.Kind.SORT);
        if (!hasSortRule) {
            throw new UserErrorException(ErrorCode.SORT_RANKING_RULE_MISSING,
                "You must specify where `sort` is listed in the ranking rules setting to use the sort parameter "
                    + "at search time");
        }
        for (SortCriterion criterion : sort) {
            requireSortable(index, criterion.field());
        }
    }

    private static void requireSortable(IndexSnapshot index, String field) {
        if (!index.sortableFields().contains(field)) {
            throw new UserErrorException(ErrorCode.ATTRIBUTE_NOT_SORTABLE, String.format(
                "Attribute `%s` is not sortable. Available sortable attributes are: %s",
                field, new TreeSet<>(index.sortableFields())));
        }
    }
}
