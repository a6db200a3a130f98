/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.graph.criteria;

import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.ComputedCondition;
import com.tessera.search.graph.CostedCondition;
import com.tessera.search.graph.RankingRuleGraphType;
import com.tessera.search.interner.Interned;
import com.tessera.search.query.LocatedQueryTermSubset;
import com.tessera.search.query.Phrase;
import com.tessera.search.query.QueryTermSubset;
import com.tessera.search.query.TermDocidsResolver;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Proximity criterion: the cost of an edge between two consecutive terms is their
 * distance in the document.
 *
 * <p>For contiguous terms, edges of cost {@code d} in
 * {@code [rightNgramLen, MAX_DISTANCE - 1 + rightNgramLen)} require pair proximity
 * {@code d - rightNgramLen + 1}; a fallback edge of cost
 * {@code MAX_DISTANCE - 1 + rightNgramLen} only requires the right term. Terms that
 * are not contiguous in the query, because words were dropped between them, are
 * joined by a single fallback edge of cost {@code MAX_DISTANCE - 1}.
 */
public final class ProximityGraph implements RankingRuleGraphType<ProximityCondition> {

    public static final int MAX_DISTANCE = 8;

    @Override
    public String label() {
        return "proximity";
    }

    @Override
    public List<CostedCondition<ProximityCondition>> buildEdges(SearchContext ctx, LocatedQueryTermSubset source,
                                                                LocatedQueryTermSubset dest) {
        if (source == null) {
            return List.of(CostedCondition.of(0, new ProximityCondition.Term(dest)));
        }
        if (source.positions().end() + 1 != dest.positions().start()) {
            return List.of(CostedCondition.of(MAX_DISTANCE - 1, new ProximityCondition.Term(dest)));
        }
        int rightNgramLen = dest.termIds().length();
        List<CostedCondition<ProximityCondition>> edges = new ArrayList<>(MAX_DISTANCE);
        for (int cost = rightNgramLen; cost < MAX_DISTANCE - 1 + rightNgramLen; cost++) {
            edges.add(CostedCondition.of(cost,
                new ProximityCondition.Pair(source, dest, cost - rightNgramLen + 1)));
        }
        edges.add(CostedCondition.of(MAX_DISTANCE - 1 + rightNgramLen, new ProximityCondition.Term(dest)));
        return edges;
    }

    @Override
    public ComputedCondition resolveCondition(SearchContext ctx, ProximityCondition condition,
                                              RoaringBitmap universe) {
        if (condition instanceof ProximityCondition.Term term) {
            RoaringBitmap docids = TermDocidsResolver.termSubsetDocids(ctx, term.term().termSubset());
            return ComputedCondition.of(docids, universe, null, term.term());
        }
        ProximityCondition.Pair pair = (ProximityCondition.Pair) condition;
        RoaringBitmap docids = pairDocids(ctx, pair, universe);
        return ComputedCondition.of(docids, universe, pair.left(), pair.right());
    }

    /**
     * Documents of {@code universe} containing both terms at the pair's proximity. Left
     * phrases contribute their last word and right phrases their first word.
     */
    private static RoaringBitmap pairDocids(SearchContext ctx, ProximityCondition.Pair pair,
                                            RoaringBitmap universe) {
        RoaringBitmap candidates = RoaringBitmap.and(universe,
            TermDocidsResolver.termSubsetDocids(ctx, pair.left().termSubset()));
        candidates.and(TermDocidsResolver.termSubsetDocids(ctx, pair.right().termSubset()));
        if (candidates.isEmpty()) {
            return candidates;
        }
        Set<Interned<String>> leftWords = boundaryWords(ctx, pair.left().termSubset(), true);
        Set<Interned<String>> rightWords = boundaryWords(ctx, pair.right().termSubset(), false);

        RoaringBitmap docids = new RoaringBitmap();
        for (Interned<String> left : leftWords) {
            for (Interned<String> right : rightWords) {
                docids.or(RoaringBitmap.and(candidates,
                    ctx.dbCache().wordPairProximityDocids(left, right, pair.proximity())));
            }
        }
        return docids;
    }

    private static Set<Interned<String>> boundaryWords(SearchContext ctx, QueryTermSubset subset, boolean last) {
        Set<Interned<String>> words = new LinkedHashSet<>(subset.allSingleWords(ctx));
        for (Interned<Phrase> phrase : subset.allPhrases(ctx)) {
            Phrase value = ctx.getPhrase(phrase);
            words.add(last ? value.lastWord() : value.firstWord());
        }
        Interned<String> prefix = subset.usePrefixDb(ctx);
        if (prefix != null) {
            words.addAll(TermDocidsResolver.expandPrefix(ctx, prefix));
        }
        return words;
    }

    @Override
    public String conditionDescription(SearchContext ctx, ProximityCondition condition) {
        if (condition instanceof ProximityCondition.Pair pair) {
            return pair.left().termSubset().description(ctx) + " -- " + pair.right().termSubset().description(ctx)
                + " : " + pair.proximity();
        }
        return ((ProximityCondition.Term) condition).term().termSubset().description(ctx) + " : any";
    }
}
