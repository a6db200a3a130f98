package com.tessera.search.graph;

import com.tessera.search.interner.Interned;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeadEndsCacheTest {

    private final Interned<String> a = new Interned<>(0);
    private final Interned<String> b = new Interned<>(1);
    private final Interned<String> c = new Interned<>(2);

    @Test
    @DisplayName("Should record conditions forbidden after a prefix")
    void shouldForbidAfterPrefix() {
        DeadEndsCache<String> cache = new DeadEndsCache<>();
        cache.forbidConditionAfterPrefix(List.of(a, b), c);

        assertThat(cache.forbiddenConditionsAfterPrefix(List.of(a, b))).isEqualTo(RoaringBitmap.bitmapOf(2));
        assertThat(cache.forbiddenConditionsAfterPrefix(List.of(a))).isEqualTo(new RoaringBitmap());
        assertThat(cache.forbiddenConditionsAfterPrefix(List.of(b))).isNull();
    }

    @Test
    @DisplayName("Should merge the forbidden conditions of every prefix of a path")
    void shouldMergeAllPrefixes() {
        DeadEndsCache<String> cache = new DeadEndsCache<>();
        cache.forbidCondition(a);
        cache.forbidConditionAfterPrefix(List.of(b), c);

        assertThat(cache.forbiddenConditionsForAllPrefixesUpTo(List.of(b, c))).isEqualTo(RoaringBitmap.bitmapOf(0, 2));
        assertThat(cache.forbiddenConditionsForAllPrefixesUpTo(List.of(c))).isEqualTo(RoaringBitmap.bitmapOf(0));
    }
}
