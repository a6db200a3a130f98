package com.tessera.search.query;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves term subsets and phrases to the documents that contain them.
 *
 * <p>Results are memoized in the request's {@link com.tessera.search.context.DatabaseCache}
 * and must not be mutated.
 */
public final class TermDocidsResolver {

    private TermDocidsResolver() {
    }

    /** Documents containing any kept derivation of the subset. */
    public static RoaringBitmap termSubsetDocids(SearchContext ctx, QueryTermSubset subset) {
        return ctx.dbCache().termSubsetDocids(subset, () -> {
            RoaringBitmap docids = new RoaringBitmap();
            for (Interned<String> word : subset.allSingleWords(ctx)) {
                docids.or(ctx.dbCache().wordDocids(word));
            }
            for (Interned<Phrase> phrase : subset.allPhrases(ctx)) {
                docids.or(phraseDocids(ctx, phrase));
            }
            Interned<String> prefix = subset.usePrefixDb(ctx);
            if (prefix != null) {
                docids.or(ctx.dbCache().wordPrefixDocids(prefix));
            }
            return docids;
        });
    }

    /**
     * Documents containing the words of the phrase next to each other and in order.
     */
    public static RoaringBitmap phraseDocids(SearchContext ctx, Interned<Phrase> phrase) {
        return ctx.dbCache().phraseDocids(phrase, () -> {
            List<Interned<String>> words = ctx.getPhrase(phrase).words();
            RoaringBitmap docids = ctx.dbCache().wordDocids(words.get(0)).clone();
            for (int i = 1; i < words.size() && !docids.isEmpty(); i++) {
                docids.and(ctx.dbCache().wordDocids(words.get(i)));
                docids.and(ctx.dbCache().wordPairProximityDocids(words.get(i - 1), words.get(i), 1));
            }
            return docids;
        });
    }

    /** Documents where a kept derivation of the subset occurs in field {@code fieldId}. */
    public static RoaringBitmap termSubsetFieldDocids(SearchContext ctx, QueryTermSubset subset, int fieldId) {
        RoaringBitmap docids = new RoaringBitmap();
        for (Interned<String> word : subset.allSingleWords(ctx)) {
            docids.or(ctx.dbCache().wordFieldIdDocids(word, fieldId));
        }
        for (Interned<Phrase> phrase : subset.allPhrases(ctx)) {
            RoaringBitmap phraseInField = phraseDocids(ctx, phrase).clone();
            for (Interned<String> word : ctx.getPhrase(phrase).words()) {
                phraseInField.and(ctx.dbCache().wordFieldIdDocids(word, fieldId));
            }
            docids.or(phraseInField);
        }
        Interned<String> prefix = subset.usePrefixDb(ctx);
        if (prefix != null) {
            for (Interned<String> word : expandPrefix(ctx, prefix)) {
                docids.or(ctx.dbCache().wordFieldIdDocids(word, fieldId));
            }
        }
        return docids;
    }

    /** Indexed words starting with {@code prefix}, the prefix itself included if indexed. */
    public static List<Interned<String>> expandPrefix(SearchContext ctx, Interned<String> prefix) {
        String text = ctx.wordText(prefix);
        List<Interned<String>> words = new ArrayList<>();
        for (String word : ctx.index().vocabulary().subSet(text, true, text + Character.MAX_VALUE, true)) {
            words.add(ctx.word(word));
        }
        return words;
    }
}
