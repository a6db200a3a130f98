/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.index;

import com.tessera.search.api.model.RankingRuleSetting;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-resident {@link IndexSnapshot} built from plain documents.
 *
 * <p>Text of the searchable fields is lowercased and split on every character that is
 * neither a letter nor a digit. Field values may be strings, numbers, booleans or
 * collections of those; collection elements are indexed as consecutive positions of the
 * same field. Filterable and sortable fields, and the distinct field, are indexed as
 * facets: numbers in the number facet, everything else lowercased in the string facet.
 *
 * <pre>{@code
 * IndexSnapshot index = InMemoryIndex.builder()
 *     .searchableFields("title", "overview")
 *     .filterableFields("genre", "year")
 *     .sortableFields("year")
 *     .addDocument(1, Map.of("title", "The quick fox", "genre", "comedy", "year", 1999))
 *     .build();
 * }</pre>
 */
public final class InMemoryIndex implements IndexSnapshot {

    private static final AtomicLong SNAPSHOT_SEQUENCE = new AtomicLong();

    private final long snapshotId;
    private final RoaringBitmap documentIds;
    private final List<String> searchableFields;
    private final Set<String> filterableFields;
    private final Set<String> sortableFields;
    private final String distinctField;
    private final List<RankingRuleSetting> rankingRules;
    private final Map<String, List<List<String>>> synonyms;

    private final TreeMap<String, RoaringBitmap> wordDocids = new TreeMap<>();
    private final Map<PairKey, RoaringBitmap> pairProximityDocids = new HashMap<>();
    private final Map<FieldWordKey, RoaringBitmap> fieldWordDocids = new HashMap<>();
    private final Map<String, TreeMap<String, RoaringBitmap>> stringFacets = new HashMap<>();
    private final Map<String, TreeMap<Double, RoaringBitmap>> numberFacets = new HashMap<>();
    private final Map<String, RoaringBitmap> fieldExists = new HashMap<>();

    private record PairKey(String left, String right, int proximity) {
    }

    private record FieldWordKey(String word, int fieldId) {
    }

    private InMemoryIndex(Builder builder) {
        this.snapshotId = SNAPSHOT_SEQUENCE.incrementAndGet();
        this.searchableFields = List.copyOf(builder.searchableFields);
        this.filterableFields = Set.copyOf(builder.filterableFields);
        this.sortableFields = Set.copyOf(builder.sortableFields);
        this.distinctField = builder.distinctField;
        this.rankingRules = List.copyOf(builder.rankingRules);
        this.synonyms = Map.copyOf(builder.synonyms);
        this.documentIds = new RoaringBitmap();

        for (Map.Entry<Integer, Map<String, Object>> document : builder.documents.entrySet()) {
            indexDocument(document.getKey(), document.getValue());
        }
        documentIds.runOptimize();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Splits text into lowercase words; any character that is neither a letter nor a
     * digit separates words.
     */
    public static List<String> tokenize(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        String lower = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                current.append(c);
            } else if (current.length() > 0) {
                words.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return words;
    }

    /** Normalization applied to string facet values, at indexing and at filtering time. */
    public static String normalizeFacet(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // INDEXING
    // ════════════════════════════════════════════════════════════════════════════════

    private void indexDocument(int docid, Map<String, Object> fields) {
        documentIds.add(docid);
        Map<PairKey, Integer> smallestProximities = new HashMap<>();

        for (int fieldId = 0; fieldId < searchableFields.size(); fieldId++) {
            Object value = fields.get(searchableFields.get(fieldId));
            if (value == null) {
                continue;
            }
            List<String> words = new ArrayList<>();
            for (Object element : flatten(value)) {
                words.addAll(tokenize(String.valueOf(element)));
            }
            for (int position = 0; position < words.size(); position++) {
                String word = words.get(position);
                wordDocids.computeIfAbsent(word, w -> new RoaringBitmap()).add(docid);
                fieldWordDocids.computeIfAbsent(new FieldWordKey(word, fieldId), k -> new RoaringBitmap()).add(docid);

                for (int next = position + 1; next < words.size() && next - position <= MAX_PROXIMITY; next++) {
                    int distance = next - position;
                    recordProximity(smallestProximities, word, words.get(next), distance);
                    if (distance + 1 <= MAX_PROXIMITY) {
                        recordProximity(smallestProximities, words.get(next), word, distance + 1);
                    }
                }
            }
        }

        for (Map.Entry<PairKey, Integer> pair : smallestProximities.entrySet()) {
            PairKey key = new PairKey(pair.getKey().left(), pair.getKey().right(), pair.getValue());
            pairProximityDocids.computeIfAbsent(key, k -> new RoaringBitmap()).add(docid);
        }

        Set<String> facetFields = new HashSet<>(filterableFields);
        facetFields.addAll(sortableFields);
        if (distinctField != null) {
            facetFields.add(distinctField);
        }
        for (String field : facetFields) {
            Object value = fields.get(field);
            if (value == null) {
                continue;
            }
            fieldExists.computeIfAbsent(field, f -> new RoaringBitmap()).add(docid);
            for (Object element : flatten(value)) {
                if (element instanceof Number number) {
                    numberFacets.computeIfAbsent(field, f -> new TreeMap<>())
                        .computeIfAbsent(number.doubleValue(), n -> new RoaringBitmap())
                        .add(docid);
                } else {
                    stringFacets.computeIfAbsent(field, f -> new TreeMap<>())
                        .computeIfAbsent(normalizeFacet(String.valueOf(element)), s -> new RoaringBitmap())
                        .add(docid);
                }
            }
        }
    }

    private static void recordProximity(Map<PairKey, Integer> smallest, String left, String right, int proximity) {
        // keyed without proximity so that only the smallest one per document is kept
        smallest.merge(new PairKey(left, right, 0), proximity, Math::min);
    }

    private static Collection<?> flatten(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        return List.of(value);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LOOKUPS
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public long snapshotId() {
        return snapshotId;
    }

    @Override
    public RoaringBitmap documentIds() {
        return documentIds;
    }

    @Override
    public RoaringBitmap wordDocids(String word) {
        return orEmpty(wordDocids.get(word));
    }

    @Override
    public RoaringBitmap wordPrefixDocids(String prefix) {
        RoaringBitmap docids = new RoaringBitmap();
        for (RoaringBitmap bitmap : wordDocids.subMap(prefix, true, prefix + Character.MAX_VALUE, false).values()) {
            docids.or(bitmap);
        }
        return docids;
    }

    @Override
    public RoaringBitmap wordPairProximityDocids(String left, String right, int proximity) {
        return orEmpty(pairProximityDocids.get(new PairKey(left, right, proximity)));
    }

    @Override
    public RoaringBitmap wordFieldIdDocids(String word, int fieldId) {
        return orEmpty(fieldWordDocids.get(new FieldWordKey(word, fieldId)));
    }

    @Override
    public NavigableSet<String> vocabulary() {
        return Collections.unmodifiableNavigableSet(wordDocids.navigableKeySet());
    }

    @Override
    public List<List<String>> synonyms(List<String> words) {
        return synonyms.getOrDefault(String.join(" ", words), List.of());
    }

    @Override
    public List<String> searchableFields() {
        return searchableFields;
    }

    @Override
    public Set<String> filterableFields() {
        return filterableFields;
    }

    @Override
    public Set<String> sortableFields() {
        return sortableFields;
    }

    @Override
    public List<RankingRuleSetting> rankingRules() {
        return rankingRules;
    }

    @Override
    public Optional<String> distinctField() {
        return Optional.ofNullable(distinctField);
    }

    @Override
    public NavigableMap<String, RoaringBitmap> stringFacetDocids(String field) {
        TreeMap<String, RoaringBitmap> facet = stringFacets.get(field);
        return facet == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(facet);
    }

    @Override
    public NavigableMap<Double, RoaringBitmap> numberFacetDocids(String field) {
        TreeMap<Double, RoaringBitmap> facet = numberFacets.get(field);
        return facet == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(facet);
    }

    @Override
    public RoaringBitmap fieldExistsDocids(String field) {
        return orEmpty(fieldExists.get(field));
    }

    private static RoaringBitmap orEmpty(RoaringBitmap bitmap) {
        return bitmap == null ? new RoaringBitmap() : bitmap;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static class Builder {
        private final List<String> searchableFields = new ArrayList<>();
        private final Set<String> filterableFields = new LinkedHashSet<>();
        private final Set<String> sortableFields = new LinkedHashSet<>();
        private String distinctField;
        private List<RankingRuleSetting> rankingRules = RankingRuleSetting.defaults();
        private final Map<String, List<List<String>>> synonyms = new HashMap<>();
        private final TreeMap<Integer, Map<String, Object>> documents = new TreeMap<>();

        /** Searchable fields by decreasing importance. */
        public Builder searchableFields(String... fields) {
            searchableFields.clear();
            searchableFields.addAll(List.of(fields));
            return this;
        }

        public Builder filterableFields(String... fields) {
            filterableFields.addAll(List.of(fields));
            return this;
        }

        public Builder sortableFields(String... fields) {
            sortableFields.addAll(List.of(fields));
            return this;
        }

        public Builder distinctField(String field) {
            this.distinctField = field;
            return this;
        }

        public Builder rankingRules(List<RankingRuleSetting> rules) {
            this.rankingRules = List.copyOf(rules);
            return this;
        }

        public Builder rankingRules(String... rules) {
            return rankingRules(RankingRuleSetting.parseAll(List.of(rules)));
        }

        /**
         * Registers {@code alternative} as a synonym of {@code words}; both are split with
         * {@link #tokenize(String)}.
         */
        public Builder synonym(String words, String alternative) {
            synonyms.computeIfAbsent(String.join(" ", tokenize(words)), k -> new ArrayList<>())
                .add(tokenize(alternative));
            return this;
        }

        public Builder addDocument(int docid, Map<String, Object> fields) {
            if (docid < 0) {
                throw new IllegalArgumentException("Document ids must be >= 0: " + docid);
            }
            documents.put(docid, Map.copyOf(Objects.requireNonNull(fields, "fields cannot be null")));
            return this;
        }

        public InMemoryIndex build() {
            if (searchableFields.isEmpty()) {
                throw new IllegalStateException("At least one searchable field is required");
            }
            return new InMemoryIndex(this);
        }
    }
}
