package com.tessera.search.api.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryIndexTest {

    private InMemoryIndex index;

    @BeforeEach
    void setUp() {
        index = InMemoryIndex.builder()
            .searchableFields("title", "overview")
            .filterableFields("genre", "year")
            .sortableFields("year")
            .synonym("nyc", "new york")
            .addDocument(1, Map.of("title", "The quick brown fox", "genre", "Comedy", "year", 1999))
            .addDocument(2, Map.of("title", "Brown fox", "overview", "very quick", "genre", List.of("Horror", "Drama")))
            .addDocument(3, Map.of("title", "Quickly done", "year", 2005))
            .build();
    }

    @Test
    @DisplayName("Should tokenize on non alphanumeric characters and lowercase")
    void shouldTokenize() {
        assertThat(InMemoryIndex.tokenize("Hello, World! It's 2024"))
            .containsExactly("hello", "world", "it", "s", "2024");
    }

    @Test
    @DisplayName("Should index words and prefixes")
    void shouldIndexWords() {
        assertThat(index.wordDocids("quick")).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(index.wordPrefixDocids("quick")).isEqualTo(RoaringBitmap.bitmapOf(1, 2, 3));
        assertThat(index.wordDocids("missing").isEmpty()).isTrue();
        assertThat(index.documentIds()).isEqualTo(RoaringBitmap.bitmapOf(1, 2, 3));
    }

    @Test
    @DisplayName("Should keep the smallest pair proximity per document")
    void shouldIndexPairProximities() {
        // doc 1: quick(1) brown(2) -> 1 ; doc 2: brown fox in title, quick in overview
        assertThat(index.wordPairProximityDocids("quick", "brown", 1)).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(index.wordPairProximityDocids("brown", "quick", 2)).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(index.wordPairProximityDocids("quick", "fox", 2)).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(index.wordPairProximityDocids("brown", "fox", 1)).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(index.wordPairProximityDocids("fox", "quick", 3)).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(index.wordPairProximityDocids("quick", "fox", 1).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should index words per searchable field")
    void shouldIndexFieldWords() {
        assertThat(index.fieldId("overview")).hasValue(1);
        assertThat(index.wordFieldIdDocids("quick", 0)).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(index.wordFieldIdDocids("quick", 1)).isEqualTo(RoaringBitmap.bitmapOf(2));
    }

    @Test
    @DisplayName("Should index string and number facets")
    void shouldIndexFacets() {
        assertThat(index.stringFacetDocids("genre")).containsOnlyKeys("comedy", "horror", "drama");
        assertThat(index.numberFacetDocids("year")).containsOnlyKeys(1999.0, 2005.0);
        assertThat(index.fieldExistsDocids("year")).isEqualTo(RoaringBitmap.bitmapOf(1, 3));
        assertThat(index.numberFacetDocids("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should expose synonyms and distinct snapshot ids")
    void shouldExposeSynonymsAndSnapshotIds() {
        assertThat(index.synonyms(List.of("nyc"))).containsExactly(List.of("new", "york"));
        assertThat(index.synonyms(List.of("paris"))).isEmpty();

        InMemoryIndex other = InMemoryIndex.builder().searchableFields("title").build();
        assertThat(other.snapshotId()).isNotEqualTo(index.snapshotId());
    }

    @Test
    @DisplayName("Should index the distinct field as a facet even when it is not filterable")
    void shouldIndexDistinctField() {
        InMemoryIndex products = InMemoryIndex.builder()
            .searchableFields("title")
            .distinctField("sku")
            .addDocument(1, Map.of("title", "shirt", "sku", "S-1"))
            .addDocument(2, Map.of("title", "shirt", "sku", "S-1"))
            .addDocument(3, Map.of("title", "cap", "sku", 7))
            .build();

        assertThat(products.distinctField()).contains("sku");
        assertThat(products.filterableFields()).doesNotContain("sku");
        assertThat(products.stringFacetDocids("sku").get("s-1")).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(products.numberFacetDocids("sku").get(7.0)).isEqualTo(RoaringBitmap.bitmapOf(3));
        assertThat(index.distinctField()).isEmpty();
    }
}
