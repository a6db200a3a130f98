/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.query;

import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.config.SearchConfig;
import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;

/**
 * Reference query term builder.
 *
 * <p>Splits the query on anything that is not a letter or a digit, lowercases the
 * words and treats double-quoted text as phrases. Typo derivations are looked up in
 * the index vocabulary:
 * <ul>
 *   <li>words shorter than {@link SearchConfig#getMinWordLenOneTypo()} allow no typo,
 *       shorter than {@link SearchConfig#getMinWordLenTwoTypos()} one typo, else two</li>
 *   <li>a typo on the first letter counts as two</li>
 *   <li>the last word is a prefix unless the query ends with a separator</li>
 * </ul>
 * At most {@link SearchConfig#getWordsLimit()} terms are kept.
 *
 * <p>Also derives ngrams: consecutive words whose concatenation is indexed.
 */
public final class WhitespaceQueryTermBuilder implements QueryTermBuilder, NgramDeriver {

    private static final Logger logger = LoggerFactory.getLogger(WhitespaceQueryTermBuilder.class);

    private record RawTerm(List<String> words, boolean phrase) {}

    @Override
    public List<LocatedQueryTerm> build(SearchContext ctx, String query) {
        List<RawTerm> rawTerms = split(query);
        int wordsLimit = ctx.config().getWordsLimit();
        if (rawTerms.size() > wordsLimit) {
            logger.debug("Query has {} terms, keeping the first {}", rawTerms.size(), wordsLimit);
            rawTerms = rawTerms.subList(0, wordsLimit);
        }
        boolean lastIsPrefix = !query.isEmpty() && Character.isLetterOrDigit(query.charAt(query.length() - 1));

        List<LocatedQueryTerm> located = new ArrayList<>(rawTerms.size());
        int position = 0;
        for (int i = 0; i < rawTerms.size(); i++) {
            RawTerm raw = rawTerms.get(i);
            QueryTerm term;
            if (raw.phrase()) {
                term = QueryTerm.phrase(ctx, raw.words());
            } else {
                boolean prefix = lastIsPrefix && i == rawTerms.size() - 1;
                term = wordTerm(ctx, raw.words().get(0), prefix);
            }
            IntRange positions = new IntRange(position, position + raw.words().size() - 1);
            located.add(new LocatedQueryTerm(ctx.addTerm(term), positions));
            position = positions.end() + 1;
        }
        return located;
    }

    @Override
    public QueryTerm derive(SearchContext ctx, List<QueryTerm> words) {
        StringBuilder concat = new StringBuilder();
        List<String> originals = new ArrayList<>(words.size());
        for (QueryTerm word : words) {
            String text = ctx.wordText(word.original());
            concat.append(text);
            originals.add(text);
        }
        String ngram = concat.toString();
        boolean prefix = words.get(words.size() - 1).isPrefix();
        NavigableSet<String> vocabulary = ctx.index().vocabulary();
        boolean indexed = vocabulary.contains(ngram)
            || prefix && !vocabulary.subSet(ngram, true, ngram + Character.MAX_VALUE, true).isEmpty();
        List<List<String>> synonyms = ctx.index().synonyms(originals);
        if (!indexed && synonyms.isEmpty()) {
            return null;
        }

        int maxTypos = Math.min(1, typoBudget(ctx.config(), ngram));
        QueryTerm.Builder builder = QueryTerm.builder(ctx, ngram)
            .ngramWords(originals)
            .maxTypos(maxTypos)
            .prefix(prefix);
        synonyms.forEach(builder::synonym);
        if (maxTypos >= 1) {
            addTypoDerivations(ctx, builder, ngram, prefix, maxTypos);
        }
        return builder.build();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TOKENIZATION
    // ════════════════════════════════════════════════════════════════════════════════

    private static List<RawTerm> split(String query) {
        List<RawTerm> terms = new ArrayList<>();
        int i = 0;
        while (i < query.length()) {
            int quote = query.indexOf('"', i);
            if (quote < 0) {
                addWords(terms, query.substring(i));
                break;
            }
            addWords(terms, query.substring(i, quote));
            int closing = query.indexOf('"', quote + 1);
            String phrase = closing < 0 ? query.substring(quote + 1) : query.substring(quote + 1, closing);
            List<String> words = InMemoryIndex.tokenize(phrase);
            if (!words.isEmpty()) {
                terms.add(new RawTerm(words, true));
            }
            if (closing < 0) {
                break;
            }
            i = closing + 1;
        }
        return terms;
    }

    private static void addWords(List<RawTerm> terms, String text) {
        for (String word : InMemoryIndex.tokenize(text)) {
            terms.add(new RawTerm(List.of(word), false));
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // DERIVATIONS
    // ════════════════════════════════════════════════════════════════════════════════

    private QueryTerm wordTerm(SearchContext ctx, String word, boolean prefix) {
        int maxTypos = typoBudget(ctx.config(), word);
        QueryTerm.Builder builder = QueryTerm.builder(ctx, word)
            .maxTypos(maxTypos)
            .prefix(prefix);
        for (List<String> synonym : ctx.index().synonyms(List.of(word))) {
            builder.synonym(synonym);
        }
        if (maxTypos >= 1) {
            addTypoDerivations(ctx, builder, word, prefix, maxTypos);
            addSplitWords(ctx, builder, word);
        }
        return builder.build();
    }

    static int typoBudget(SearchConfig config, String word) {
        int length = word.codePointCount(0, word.length());
        if (length < config.getMinWordLenOneTypo()) {
            return 0;
        }
        return length < config.getMinWordLenTwoTypos() ? 1 : 2;
    }

    private static void addTypoDerivations(SearchContext ctx, QueryTerm.Builder builder, String word,
                                           boolean prefix, int maxTypos) {
        for (String candidate : ctx.index().vocabulary()) {
            if (candidate.equals(word)) {
                continue;
            }
            int typos = typos(word, candidate, prefix, maxTypos);
            if (typos == 1) {
                builder.oneTypo(candidate);
            } else if (typos == 2 && maxTypos >= 2) {
                builder.twoTypos(candidate);
            }
        }
    }

    /**
     * Typos needed to turn {@code word} into {@code candidate}, or into a prefix of it
     * when {@code prefix} is set. Returns {@code maxTypos + 1} when out of reach.
     */
    static int typos(String word, String candidate, boolean prefix, int maxTypos) {
        int best = maxTypos + 1;
        if (prefix) {
            int from = Math.max(0, word.length() - maxTypos);
            int to = Math.min(candidate.length(), word.length() + maxTypos);
            for (int len = from; len <= to; len++) {
                best = Math.min(best, distance(word, candidate.substring(0, len)));
            }
            if (best == 0) {
                // the candidate extends the word: covered by the prefix database
                return maxTypos + 1;
            }
        } else if (Math.abs(word.length() - candidate.length()) <= maxTypos) {
            best = distance(word, candidate);
        }
        if (best > 0 && !candidate.isEmpty() && word.charAt(0) != candidate.charAt(0)) {
            best++;
        }
        return Math.min(best, maxTypos + 1);
    }

    private static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /** Picks the split into two indexed words that most often appear next to each other. */
    private static void addSplitWords(SearchContext ctx, QueryTerm.Builder builder, String word) {
        NavigableSet<String> vocabulary = ctx.index().vocabulary();
        String bestLeft = null;
        String bestRight = null;
        long bestCount = 0;
        for (int i = 1; i < word.length(); i++) {
            String left = word.substring(0, i);
            String right = word.substring(i);
            if (!vocabulary.contains(left) || !vocabulary.contains(right)) {
                continue;
            }
            Interned<String> l = ctx.word(left);
            Interned<String> r = ctx.word(right);
            RoaringBitmap docids = ctx.dbCache().wordPairProximityDocids(l, r, 1);
            if (docids.getLongCardinality() > bestCount) {
                bestCount = docids.getLongCardinality();
                bestLeft = left;
                bestRight = right;
            }
        }
        if (bestLeft != null) {
            builder.splitWords(bestLeft, bestRight);
        }
    }
}
