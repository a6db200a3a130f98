/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.query;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One word (or merged ngram, or quoted phrase) of the query with every derivation it
 * may match in the index, grouped by typo cost.
 *
 * <ul>
 *   <li>zero typo: the exact word, the quoted phrase, words the term is a prefix of,
 *       synonyms and the prefix database entry</li>
 *   <li>one typo: words at edit distance one, and the term split into two words</li>
 *   <li>two typos: words at edit distance two</li>
 * </ul>
 *
 * <p>Terms are produced by a {@link QueryTermBuilder} and stored in the request's term
 * interner; the ranking rules refer to them through {@link QueryTermSubset}s.
 */
public final class QueryTerm {

    /** Derivations that cost no typo. */
    public record ZeroTypoTerm(
        Interned<Phrase> phrase,
        Interned<String> exact,
        List<Interned<String>> prefixOf,
        List<Interned<Phrase>> synonyms,
        Interned<String> usePrefixDb
    ) {
        public ZeroTypoTerm {
            prefixOf = List.copyOf(prefixOf);
            synonyms = List.copyOf(synonyms);
        }

        boolean isEmpty() {
            return phrase == null && exact == null && prefixOf.isEmpty() && synonyms.isEmpty() && usePrefixDb == null;
        }
    }

    /** Derivations that cost one typo. */
    public record OneTypoTerm(Interned<Phrase> splitWords, List<Interned<String>> oneTypo) {
        public OneTypoTerm {
            oneTypo = List.copyOf(oneTypo);
        }

        boolean isEmpty() {
            return splitWords == null && oneTypo.isEmpty();
        }
    }

    /** Derivations that cost two typos. */
    public record TwoTypoTerm(List<Interned<String>> twoTypos) {
        public TwoTypoTerm {
            twoTypos = List.copyOf(twoTypos);
        }

        boolean isEmpty() {
            return twoTypos.isEmpty();
        }
    }

    private final Interned<String> original;
    private final List<Interned<String>> ngramWords;
    private final int maxTypos;
    private final boolean prefix;
    private final ZeroTypoTerm zeroTypo;
    private final OneTypoTerm oneTypo;
    private final TwoTypoTerm twoTypo;

    private QueryTerm(Builder builder) {
        this.original = builder.original;
        this.ngramWords = List.copyOf(builder.ngramWords);
        this.maxTypos = builder.maxTypos;
        this.prefix = builder.prefix;
        this.zeroTypo = new ZeroTypoTerm(builder.phrase, builder.exact, builder.prefixOf,
            builder.synonyms, builder.prefix && builder.phrase == null ? builder.original : null);
        this.oneTypo = new OneTypoTerm(builder.splitWords, builder.oneTypo);
        this.twoTypo = new TwoTypoTerm(builder.twoTypos);
    }

    public Interned<String> original() {
        return original;
    }

    /** The query words merged into this term; empty unless it is an ngram. */
    public List<Interned<String>> ngramWords() {
        return ngramWords;
    }

    public boolean isNgram() {
        return !ngramWords.isEmpty();
    }

    public int maxTypos() {
        return maxTypos;
    }

    public boolean isPrefix() {
        return prefix;
    }

    public ZeroTypoTerm zeroTypo() {
        return zeroTypo;
    }

    public OneTypoTerm oneTypo() {
        return oneTypo;
    }

    public TwoTypoTerm twoTypo() {
        return twoTypo;
    }

    /** The quoted phrase this term stands for, or null. */
    public Interned<Phrase> originalPhrase() {
        return zeroTypo.phrase();
    }

    /** True if no derivation is admissible at {@code typoLevel}. */
    public boolean isEmptyAtTypoLevel(int typoLevel) {
        return switch (typoLevel) {
            case 0 -> zeroTypo.isEmpty();
            case 1 -> maxTypos < 1 || oneTypo.isEmpty();
            case 2 -> maxTypos < 2 || twoTypo.isEmpty();
            default -> true;
        };
    }

    public boolean isEmpty() {
        return isEmptyAtTypoLevel(0) && isEmptyAtTypoLevel(1) && isEmptyAtTypoLevel(2);
    }

    public String description(SearchContext ctx) {
        return ctx.wordText(original);
    }

    /**
     * Starts a term for {@code word}. The exact derivation defaults to the word itself.
     */
    public static Builder builder(SearchContext ctx, String word) {
        return new Builder(ctx, word);
    }

    /** A quoted phrase term: zero typos, never a prefix. */
    public static QueryTerm phrase(SearchContext ctx, List<String> words) {
        List<Interned<String>> interned = new ArrayList<>(words.size());
        for (String word : words) {
            interned.add(ctx.word(word));
        }
        Builder builder = new Builder(ctx, String.join(" ", words));
        builder.exact = null;
        builder.phrase = ctx.phrase(new Phrase(interned));
        return builder.build();
    }

    public static class Builder {
        private final SearchContext ctx;
        private final Interned<String> original;
        private final List<Interned<String>> ngramWords = new ArrayList<>();
        private int maxTypos = 0;
        private boolean prefix = false;
        private Interned<Phrase> phrase;
        private Interned<String> exact;
        private final List<Interned<String>> prefixOf = new ArrayList<>();
        private final List<Interned<Phrase>> synonyms = new ArrayList<>();
        private Interned<Phrase> splitWords;
        private final List<Interned<String>> oneTypo = new ArrayList<>();
        private final List<Interned<String>> twoTypos = new ArrayList<>();

        private Builder(SearchContext ctx, String word) {
            this.ctx = Objects.requireNonNull(ctx, "ctx cannot be null");
            this.original = ctx.word(word);
            this.exact = original;
        }

        public Builder maxTypos(int maxTypos) {
            if (maxTypos < 0 || maxTypos > 2) {
                throw new IllegalArgumentException("maxTypos must be within 0..=2: " + maxTypos);
            }
            this.maxTypos = maxTypos;
            return this;
        }

        /** Marks the term as a prefix; its prefix database entry is the original word. */
        public Builder prefix(boolean prefix) {
            this.prefix = prefix;
            return this;
        }

        /** Whether the original word itself is an admissible derivation. */
        public Builder exact(boolean exact) {
            this.exact = exact ? original : null;
            return this;
        }

        public Builder ngramWords(List<String> words) {
            ngramWords.clear();
            words.forEach(w -> ngramWords.add(ctx.word(w)));
            return this;
        }

        public Builder prefixOf(String... words) {
            for (String word : words) {
                prefixOf.add(ctx.word(word));
            }
            return this;
        }

        public Builder synonym(List<String> words) {
            List<Interned<String>> interned = new ArrayList<>(words.size());
            words.forEach(w -> interned.add(ctx.word(w)));
            synonyms.add(ctx.phrase(new Phrase(interned)));
            return this;
        }

        public Builder splitWords(String left, String right) {
            this.splitWords = ctx.phrase(new Phrase(List.of(ctx.word(left), ctx.word(right))));
            return this;
        }

        public Builder oneTypo(String... words) {
            for (String word : words) {
                oneTypo.add(ctx.word(word));
            }
            return this;
        }

        public Builder twoTypos(String... words) {
            for (String word : words) {
                twoTypos.add(ctx.word(word));
            }
            return this;
        }

        public QueryTerm build() {
            return new QueryTerm(this);
        }
    }
}
