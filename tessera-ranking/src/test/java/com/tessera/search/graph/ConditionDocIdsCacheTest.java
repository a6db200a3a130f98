package com.tessera.search.graph;

import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.context.SearchContext;
import com.tessera.search.graph.criteria.TypoCondition;
import com.tessera.search.graph.criteria.TypoGraph;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.interner.Interned;
import com.tessera.search.query.NgramDeriver;
import com.tessera.search.query.QueryGraph;
import com.tessera.search.query.WhitespaceQueryTermBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionDocIdsCacheTest {

    private SearchContext ctx;
    private RankingRuleGraph<TypoCondition> graph;
    private Interned<TypoCondition> exact;

    @BeforeEach
    void setUp() {
        InMemoryIndex.Builder builder = InMemoryIndex.builder().searchableFields("title");
        for (int docid = 0; docid < 10; docid++) {
            builder.addDocument(docid, Map.of("title", docid % 2 == 0 ? "hello" : "helo"));
        }
        ctx = new SearchContext(builder.build());
        QueryGraph query = QueryGraph.fromQuery(ctx, new WhitespaceQueryTermBuilder().build(ctx, "hello "),
            NgramDeriver.NONE);
        graph = RankingRuleGraph.build(ctx, new TypoGraph(), query, new DedupInterner<>());
        exact = graph.edge(0).condition();
    }

    @Test
    @DisplayName("Should resolve once and narrow for a smaller universe")
    void shouldResolveOnceAndNarrow() {
        ConditionDocIdsCache<TypoCondition> cache = new ConditionDocIdsCache<>();
        RoaringBitmap universe = new RoaringBitmap();
        universe.add(0L, 10L);

        ComputedCondition first = cache.getComputedCondition(ctx, exact, graph, universe);
        assertThat(first.docids()).isEqualTo(RoaringBitmap.bitmapOf(0, 2, 4, 6, 8));

        ComputedCondition narrowed = cache.getComputedCondition(ctx, exact, graph, RoaringBitmap.bitmapOf(0, 1, 2, 3));

        assertThat(narrowed.docids()).isEqualTo(RoaringBitmap.bitmapOf(0, 2));
        assertThat(narrowed.universeLen()).isEqualTo(4);
        assertThat(ctx.metrics().conditionResolutions()).isEqualTo(1);
        assertThat(ctx.metrics().conditionNarrowings()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count a lookup with the same universe as a hit")
    void shouldHitForSameUniverse() {
        ConditionDocIdsCache<TypoCondition> cache = new ConditionDocIdsCache<>();
        RoaringBitmap universe = RoaringBitmap.bitmapOf(0, 1, 2);

        cache.getComputedCondition(ctx, exact, graph, universe);
        cache.getComputedCondition(ctx, exact, graph, universe);

        assertThat(ctx.metrics().conditionResolutions()).isEqualTo(1);
        assertThat(ctx.metrics().conditionCacheHits()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should expose the term subsets used by a resolved condition")
    void shouldExposeSubsets() {
        ConditionDocIdsCache<TypoCondition> cache = new ConditionDocIdsCache<>();
        cache.getComputedCondition(ctx, exact, graph, RoaringBitmap.bitmapOf(0));

        assertThat(cache.getSubsetsUsedByCondition(exact)[1]).isEqualTo(graph.condition(exact).term());
        assertThatThrownBy(() -> cache.getSubsetsUsedByCondition(graph.edge(1).condition()))
            .isInstanceOf(IllegalStateException.class);
    }
}
