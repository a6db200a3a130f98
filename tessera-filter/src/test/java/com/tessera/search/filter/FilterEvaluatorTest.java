package com.tessera.search.filter;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.InMemoryIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterEvaluatorTest {

    private InMemoryIndex index;

    @BeforeEach
    void setUp() {
        index = InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("genre", "year", "rating")
            .addDocument(1, Map.of("title", "a", "genre", "Horror", "year", 1985))
            .addDocument(2, Map.of("title", "b", "genre", List.of("Drama", "Horror"), "year", 1999))
            .addDocument(3, Map.of("title", "c", "genre", "Comedy", "year", 2004, "rating", 8))
            .addDocument(4, Map.of("title", "d", "year", 2010))
            .addDocument(5, Map.of("title", "e", "genre", "Science Fiction"))
            .build();
    }

    private RoaringBitmap eval(String expression) {
        return Filter.parse(expression).evaluate(index);
    }

    @Test
    @DisplayName("Should match string equality case-insensitively")
    void shouldMatchEquality() {
        assertThat(eval("genre = horror")).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(eval("genre = 'science fiction'")).isEqualTo(RoaringBitmap.bitmapOf(5));
        assertThat(eval("year = 1999")).isEqualTo(RoaringBitmap.bitmapOf(2));
    }

    @Test
    @DisplayName("Should complement != and NOT within all documents")
    void shouldComplementWithinAllDocuments() {
        assertThat(eval("genre != horror")).isEqualTo(RoaringBitmap.bitmapOf(3, 4, 5));
        assertThat(eval("NOT genre = horror")).isEqualTo(RoaringBitmap.bitmapOf(3, 4, 5));
    }

    @Test
    @DisplayName("Should evaluate numeric ranges")
    void shouldEvaluateRanges() {
        assertThat(eval("year > 1999")).isEqualTo(RoaringBitmap.bitmapOf(3, 4));
        assertThat(eval("year >= 1999")).isEqualTo(RoaringBitmap.bitmapOf(2, 3, 4));
        assertThat(eval("year < 1999")).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(eval("year <= 1999")).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(eval("year 1990 TO 2005")).isEqualTo(RoaringBitmap.bitmapOf(2, 3));
        assertThat(eval("year 2005 TO 1990").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should combine AND, OR, IN and EXISTS")
    void shouldCombineOperators() {
        assertThat(eval("genre IN [comedy, drama] OR rating EXISTS")).isEqualTo(RoaringBitmap.bitmapOf(2, 3));
        assertThat(eval("genre = horror AND year > 1990")).isEqualTo(RoaringBitmap.bitmapOf(2));
        assertThat(eval("genre NOT EXISTS")).isEqualTo(RoaringBitmap.bitmapOf(4));
        assertThat(eval("(genre = horror OR genre = comedy) AND NOT year < 1990"))
            .isEqualTo(RoaringBitmap.bitmapOf(2, 3));
    }

    @Test
    @DisplayName("Should reject fields that are not filterable")
    void shouldRejectNonFilterableField() {
        assertThatThrownBy(() -> eval("title = a"))
            .isInstanceOf(UserErrorException.class)
            .hasMessageContaining("not filterable")
            .satisfies(e -> assertThat(((UserErrorException) e).code()).isEqualTo(ErrorCode.ATTRIBUTE_NOT_FILTERABLE));
    }

    @Test
    @DisplayName("Should reject non numeric range bounds")
    void shouldRejectNonNumericBounds() {
        assertThatThrownBy(() -> eval("year > recent"))
            .isInstanceOf(UserErrorException.class)
            .hasMessageContaining("not a valid number");
    }
}
