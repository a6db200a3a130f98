/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.query;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A query term restricted to some of its derivations, one {@link NTypoTermSubset}
 * per typo level.
 *
 * <p>Immutable and hashable, so that conditions holding subsets can be interned.
 * A mandatory subset is never dropped by the terms matching strategy.
 */
public final class QueryTermSubset {

    private final Interned<QueryTerm> original;
    private final NTypoTermSubset zeroTypo;
    private final NTypoTermSubset oneTypo;
    private final NTypoTermSubset twoTypo;
    private final boolean mandatory;

    private QueryTermSubset(Interned<QueryTerm> original, NTypoTermSubset zeroTypo,
                            NTypoTermSubset oneTypo, NTypoTermSubset twoTypo, boolean mandatory) {
        this.original = Objects.requireNonNull(original, "original cannot be null");
        this.zeroTypo = zeroTypo;
        this.oneTypo = oneTypo;
        this.twoTypo = twoTypo;
        this.mandatory = mandatory;
    }

    public static QueryTermSubset full(Interned<QueryTerm> term) {
        return new QueryTermSubset(term, NTypoTermSubset.ALL, NTypoTermSubset.ALL, NTypoTermSubset.ALL, false);
    }

    public static QueryTermSubset empty(Interned<QueryTerm> term) {
        return new QueryTermSubset(term, NTypoTermSubset.NOTHING, NTypoTermSubset.NOTHING,
            NTypoTermSubset.NOTHING, false);
    }

    public Interned<QueryTerm> original() {
        return original;
    }

    public NTypoTermSubset zeroTypo() {
        return zeroTypo;
    }

    public NTypoTermSubset oneTypo() {
        return oneTypo;
    }

    public NTypoTermSubset twoTypo() {
        return twoTypo;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public QueryTermSubset withMandatory(boolean mandatory) {
        return new QueryTermSubset(original, zeroTypo, oneTypo, twoTypo, mandatory);
    }

    /**
     * @throws IllegalArgumentException if {@code other} restricts another term
     */
    public QueryTermSubset union(QueryTermSubset other) {
        requireSameTerm(other);
        return new QueryTermSubset(original, zeroTypo.union(other.zeroTypo), oneTypo.union(other.oneTypo),
            twoTypo.union(other.twoTypo), mandatory || other.mandatory);
    }

    /**
     * @throws IllegalArgumentException if {@code other} restricts another term
     */
    public QueryTermSubset intersect(QueryTermSubset other) {
        requireSameTerm(other);
        return new QueryTermSubset(original, zeroTypo.intersect(other.zeroTypo),
            oneTypo.intersect(other.oneTypo), twoTypo.intersect(other.twoTypo), mandatory);
    }

    private void requireSameTerm(QueryTermSubset other) {
        if (!original.equals(other.original)) {
            throw new IllegalArgumentException(
                "Cannot combine subsets of different terms: " + original + " and " + other.original);
        }
    }

    /** Keeps only the derivations that cost exactly {@code typos} typos. */
    public QueryTermSubset keepOnlyTypoLevel(int typos) {
        return new QueryTermSubset(original,
            typos == 0 ? zeroTypo : NTypoTermSubset.NOTHING,
            typos == 1 ? oneTypo : NTypoTermSubset.NOTHING,
            typos == 2 ? twoTypo : NTypoTermSubset.NOTHING,
            mandatory);
    }

    /** Keeps only the exact word or phrase, or nothing if the term has no exact form. */
    public QueryTermSubset keepOnlyExactTerm(SearchContext ctx) {
        ExactTerm exact = exactTerm(ctx);
        if (exact == null) {
            return new QueryTermSubset(original, NTypoTermSubset.NOTHING, NTypoTermSubset.NOTHING,
                NTypoTermSubset.NOTHING, mandatory);
        }
        NTypoTermSubset zero = exact.isPhrase()
            ? NTypoTermSubset.of(Set.of(), Set.of(exact.phrase()))
            : NTypoTermSubset.of(Set.of(exact.word()), Set.of());
        return new QueryTermSubset(original, zero, NTypoTermSubset.NOTHING, NTypoTermSubset.NOTHING, mandatory);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // DERIVATIONS
    // ════════════════════════════════════════════════════════════════════════════════

    /** True if no derivation of the term is kept. */
    public boolean isEmpty(SearchContext ctx) {
        if (zeroTypo.isNothing() && oneTypo.isNothing() && twoTypo.isNothing()) {
            return true;
        }
        return allSingleWords(ctx).isEmpty() && allPhrases(ctx).isEmpty() && usePrefixDb(ctx) == null;
    }

    /** Kept single words, excluding the prefix database entry, in derivation order. */
    public Set<Interned<String>> allSingleWords(SearchContext ctx) {
        QueryTerm term = ctx.term(original);
        Set<Interned<String>> words = new LinkedHashSet<>();
        QueryTerm.ZeroTypoTerm zero = term.zeroTypo();
        if (zero.exact() != null && zeroTypo.containsWord(zero.exact())) {
            words.add(zero.exact());
        }
        for (Interned<String> word : zero.prefixOf()) {
            if (zeroTypo.containsWord(word)) {
                words.add(word);
            }
        }
        if (term.maxTypos() >= 1) {
            for (Interned<String> word : term.oneTypo().oneTypo()) {
                if (oneTypo.containsWord(word)) {
                    words.add(word);
                }
            }
        }
        if (term.maxTypos() >= 2) {
            for (Interned<String> word : term.twoTypo().twoTypos()) {
                if (twoTypo.containsWord(word)) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    /** Kept phrases: the quoted phrase, multi-word synonyms and the split words. */
    public Set<Interned<Phrase>> allPhrases(SearchContext ctx) {
        QueryTerm term = ctx.term(original);
        Set<Interned<Phrase>> phrases = new LinkedHashSet<>();
        QueryTerm.ZeroTypoTerm zero = term.zeroTypo();
        if (zero.phrase() != null && zeroTypo.containsPhrase(zero.phrase())) {
            phrases.add(zero.phrase());
        }
        for (Interned<Phrase> synonym : zero.synonyms()) {
            if (zeroTypo.containsPhrase(synonym)) {
                phrases.add(synonym);
            }
        }
        Interned<Phrase> split = term.oneTypo().splitWords();
        if (term.maxTypos() >= 1 && split != null && oneTypo.containsPhrase(split)) {
            phrases.add(split);
        }
        return phrases;
    }

    /** The prefix database entry if the term is a prefix and the entry is kept, else null. */
    public Interned<String> usePrefixDb(SearchContext ctx) {
        Interned<String> prefix = ctx.term(original).zeroTypo().usePrefixDb();
        return prefix != null && zeroTypo.containsWord(prefix) ? prefix : null;
    }

    /**
     * The exact form of the term if it is kept: its quoted phrase, or its original
     * word when the term is not an ngram. Null otherwise.
     */
    public ExactTerm exactTerm(SearchContext ctx) {
        QueryTerm term = ctx.term(original);
        Interned<Phrase> phrase = term.originalPhrase();
        if (phrase != null) {
            return zeroTypo.containsPhrase(phrase) ? ExactTerm.ofPhrase(phrase) : null;
        }
        Interned<String> exact = term.zeroTypo().exact();
        if (exact == null || term.isNgram() || !zeroTypo.containsWord(exact)) {
            return null;
        }
        return ExactTerm.ofWord(exact);
    }

    public String description(SearchContext ctx) {
        return ctx.term(original).description(ctx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryTermSubset that)) return false;
        return mandatory == that.mandatory
            && original.equals(that.original)
            && zeroTypo.equals(that.zeroTypo)
            && oneTypo.equals(that.oneTypo)
            && twoTypo.equals(that.twoTypo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, zeroTypo, oneTypo, twoTypo, mandatory);
    }

    @Override
    public String toString() {
        return "QueryTermSubset{term=" + original + ", 0=" + zeroTypo + ", 1=" + oneTypo + ", 2=" + twoTypo
            + (mandatory ? ", mandatory" : "") + "}";
    }
}
