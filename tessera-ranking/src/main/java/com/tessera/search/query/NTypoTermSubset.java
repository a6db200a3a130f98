package com.tessera.search.query;

import com.tessera.search.interner.Interned;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The derivations of one typo level that a term subset keeps: all of them, none of
 * them, or an explicit set of words and phrases.
 *
 * <p>Immutable. Union with {@link #ALL} yields {@link #ALL}; intersection with
 * {@link #NOTHING} yields {@link #NOTHING}.
 */
public final class NTypoTermSubset {

    public enum Kind { ALL, SUBSET, NOTHING }

    public static final NTypoTermSubset ALL = new NTypoTermSubset(Kind.ALL, Set.of(), Set.of());
    public static final NTypoTermSubset NOTHING = new NTypoTermSubset(Kind.NOTHING, Set.of(), Set.of());

    private final Kind kind;
    private final Set<Interned<String>> words;
    private final Set<Interned<Phrase>> phrases;

    private NTypoTermSubset(Kind kind, Set<Interned<String>> words, Set<Interned<Phrase>> phrases) {
        this.kind = kind;
        this.words = words;
        this.phrases = phrases;
    }

    /** An explicit subset; sorted so that iteration is deterministic. */
    public static NTypoTermSubset of(Set<Interned<String>> words, Set<Interned<Phrase>> phrases) {
        return new NTypoTermSubset(Kind.SUBSET,
            Collections.unmodifiableSet(new TreeSet<>(words)),
            Collections.unmodifiableSet(new TreeSet<>(phrases)));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNothing() {
        return kind == Kind.NOTHING;
    }

    public boolean isAll() {
        return kind == Kind.ALL;
    }

    public boolean containsWord(Interned<String> word) {
        return switch (kind) {
            case ALL -> true;
            case SUBSET -> words.contains(word);
            case NOTHING -> false;
        };
    }

    public boolean containsPhrase(Interned<Phrase> phrase) {
        return switch (kind) {
            case ALL -> true;
            case SUBSET -> phrases.contains(phrase);
            case NOTHING -> false;
        };
    }

    public NTypoTermSubset union(NTypoTermSubset other) {
        if (kind == Kind.ALL || other.kind == Kind.NOTHING) {
            return this;
        }
        if (other.kind == Kind.ALL || kind == Kind.NOTHING) {
            return other;
        }
        Set<Interned<String>> unionWords = new TreeSet<>(words);
        unionWords.addAll(other.words);
        Set<Interned<Phrase>> unionPhrases = new TreeSet<>(phrases);
        unionPhrases.addAll(other.phrases);
        return of(unionWords, unionPhrases);
    }

    public NTypoTermSubset intersect(NTypoTermSubset other) {
        if (kind == Kind.NOTHING || other.kind == Kind.ALL) {
            return this;
        }
        if (other.kind == Kind.NOTHING || kind == Kind.ALL) {
            return other;
        }
        Set<Interned<String>> commonWords = new TreeSet<>(words);
        commonWords.retainAll(other.words);
        Set<Interned<Phrase>> commonPhrases = new TreeSet<>(phrases);
        commonPhrases.retainAll(other.phrases);
        return of(commonWords, commonPhrases);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NTypoTermSubset that)) return false;
        return kind == that.kind && words.equals(that.words) && phrases.equals(that.phrases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, words, phrases);
    }

    @Override
    public String toString() {
        return kind == Kind.SUBSET ? "SUBSET" + words + phrases : kind.name();
    }
}
