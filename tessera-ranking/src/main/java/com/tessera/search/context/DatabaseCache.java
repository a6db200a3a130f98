package com.tessera.search.context;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.InternalErrorException;
import com.tessera.search.api.exceptions.SearchException;
import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.interner.Interned;
import com.tessera.search.query.Phrase;
import com.tessera.search.query.QueryTermSubset;
import org.roaringbitmap.RoaringBitmap;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Request-scoped memo of storage lookups, so that every distinct key is read from
 * the {@link IndexSnapshot} at most once per search.
 *
 * <p>Returned bitmaps are shared: callers clone before mutating. Storage failures
 * surface as {@link InternalErrorException} with {@link ErrorCode#STORAGE_FAILURE}.
 */
public final class DatabaseCache {

    private record PairKey(Interned<String> left, Interned<String> right, int proximity) {}

    private record FieldKey(Interned<String> word, int fieldId) {}

    private final IndexSnapshot index;
    private final DedupInterner<String> words;

    private final Map<Interned<String>, RoaringBitmap> wordDocids = new HashMap<>();
    private final Map<Interned<String>, RoaringBitmap> wordPrefixDocids = new HashMap<>();
    private final Map<PairKey, RoaringBitmap> pairProximityDocids = new HashMap<>();
    private final Map<FieldKey, RoaringBitmap> fieldDocids = new HashMap<>();
    private final Map<Interned<Phrase>, RoaringBitmap> phraseDocids = new HashMap<>();
    private final Map<QueryTermSubset, RoaringBitmap> termSubsetDocids = new HashMap<>();

    DatabaseCache(IndexSnapshot index, DedupInterner<String> words) {
        this.index = index;
        this.words = words;
    }

    public RoaringBitmap wordDocids(Interned<String> word) {
        RoaringBitmap cached = wordDocids.get(word);
        if (cached == null) {
            String text = words.get(word);
            cached = load("word docids of '" + text + "'", () -> index.wordDocids(text));
            wordDocids.put(word, cached);
        }
        return cached;
    }

    public RoaringBitmap wordPrefixDocids(Interned<String> prefix) {
        RoaringBitmap cached = wordPrefixDocids.get(prefix);
        if (cached == null) {
            String text = words.get(prefix);
            cached = load("prefix docids of '" + text + "'", () -> index.wordPrefixDocids(text));
            wordPrefixDocids.put(prefix, cached);
        }
        return cached;
    }

    public RoaringBitmap wordPairProximityDocids(Interned<String> left, Interned<String> right, int proximity) {
        PairKey key = new PairKey(left, right, proximity);
        RoaringBitmap cached = pairProximityDocids.get(key);
        if (cached == null) {
            String leftText = words.get(left);
            String rightText = words.get(right);
            cached = load("pair docids of '" + leftText + "' '" + rightText + "' at " + proximity,
                () -> index.wordPairProximityDocids(leftText, rightText, proximity));
            pairProximityDocids.put(key, cached);
        }
        return cached;
    }

    public RoaringBitmap wordFieldIdDocids(Interned<String> word, int fieldId) {
        FieldKey key = new FieldKey(word, fieldId);
        RoaringBitmap cached = fieldDocids.get(key);
        if (cached == null) {
            String text = words.get(word);
            cached = load("field docids of '" + text + "' in field " + fieldId,
                () -> index.wordFieldIdDocids(text, fieldId));
            fieldDocids.put(key, cached);
        }
        return cached;
    }

    /** Memoized phrase docids; {@code compute} runs at most once per phrase. */
    public RoaringBitmap phraseDocids(Interned<Phrase> phrase, Supplier<RoaringBitmap> compute) {
        RoaringBitmap cached = phraseDocids.get(phrase);
        if (cached == null) {
            cached = compute.get();
            phraseDocids.put(phrase, cached);
        }
        return cached;
    }

    /** Memoized term subset docids; {@code compute} runs at most once per subset. */
    public RoaringBitmap termSubsetDocids(QueryTermSubset subset, Supplier<RoaringBitmap> compute) {
        RoaringBitmap cached = termSubsetDocids.get(subset);
        if (cached == null) {
            cached = compute.get();
            termSubsetDocids.put(subset, cached);
        }
        return cached;
    }

    private static RoaringBitmap load(String what, Supplier<RoaringBitmap> lookup) {
        try {
            RoaringBitmap docids = lookup.get();
            return docids != null ? docids : new RoaringBitmap();
        } catch (SearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalErrorException(ErrorCode.STORAGE_FAILURE, "Failed to read " + what, e);
        }
    }
}
