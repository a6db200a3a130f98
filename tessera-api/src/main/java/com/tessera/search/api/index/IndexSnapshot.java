/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.index;

import com.tessera.search.api.model.RankingRuleSetting;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only view over one consistent state of an index.
 *
 * <p>This is the storage collaborator of the ranking engine. All lookups are
 * deterministic for the lifetime of a snapshot, so a search may memoize them.
 * Bitmaps returned by implementations must not be mutated by callers; lookups of
 * unknown keys return an empty bitmap, never null.
 *
 * <p>Word pair proximities are stored per document as the smallest proximity
 * found between the two words within one field: {@code d} when the right word
 * follows the left one at distance {@code d}, {@code d + 1} when it precedes it.
 * Only proximities in {@code 1..MAX_PROXIMITY} are stored.
 */
public interface IndexSnapshot {

    /** Largest stored word pair proximity. */
    int MAX_PROXIMITY = 7;

    /**
     * Identifier of this snapshot. Two snapshots with the same id hold the same data,
     * which makes the id usable as a cross-request cache key.
     */
    long snapshotId();

    RoaringBitmap documentIds();

    // ─── Words ───────────────────────────────────────────────────────────────

    RoaringBitmap wordDocids(String word);

    /** Documents containing at least one word that starts with {@code prefix}. */
    RoaringBitmap wordPrefixDocids(String prefix);

    RoaringBitmap wordPairProximityDocids(String left, String right, int proximity);

    RoaringBitmap wordFieldIdDocids(String word, int fieldId);

    /** Every indexed word, sorted. */
    NavigableSet<String> vocabulary();

    /**
     * Synonym alternatives of a sequence of normalized words. Each alternative is
     * itself a sequence of words.
     */
    List<List<String>> synonyms(List<String> words);

    // ─── Fields ──────────────────────────────────────────────────────────────

    /** Searchable fields by decreasing importance; the position is the field id. */
    List<String> searchableFields();

    default OptionalInt fieldId(String field) {
        int id = searchableFields().indexOf(field);
        return id < 0 ? OptionalInt.empty() : OptionalInt.of(id);
    }

    Set<String> filterableFields();

    Set<String> sortableFields();

    List<RankingRuleSetting> rankingRules();

    /**
     * Field whose facet values identify duplicates: at most one document per value is
     * returned by a search. Documents without the field are never deduplicated.
     */
    default Optional<String> distinctField() {
        return Optional.empty();
    }

    // ─── Facets ──────────────────────────────────────────────────────────────

    /** Normalized string facet values of {@code field} mapped to their documents. */
    NavigableMap<String, RoaringBitmap> stringFacetDocids(String field);

    NavigableMap<Double, RoaringBitmap> numberFacetDocids(String field);

    /** Documents holding any value for {@code field}. */
    RoaringBitmap fieldExistsDocids(String field);
}
