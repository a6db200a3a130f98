package com.tessera.search.rules;

import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.api.model.Rank;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.context.SearchContext;
import com.tessera.search.filter.FilterCompiler;
import com.tessera.search.filter.FilterParseException;
import com.tessera.search.query.PlaceholderQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoostRuleTest {

    private SearchContext ctx;
    private FilterCompiler compiler;

    @BeforeEach
    void setUp() {
        InMemoryIndex.Builder builder = InMemoryIndex.builder().searchableFields("title").filterableFields("genre");
        for (int docid = 1; docid <= 5; docid++) {
            builder.addDocument(docid, Map.of("title", "t", "genre", docid % 2 == 0 ? "horror" : "drama"));
        }
        ctx = new SearchContext(builder.build());
        compiler = new FilterCompiler();
    }

    @Test
    @DisplayName("Should rank documents matching the filter first")
    void shouldBoostMatchingDocuments() {
        BoostRule<PlaceholderQuery> rule = new BoostRule<>("genre = horror", compiler);

        List<RoaringBitmap> buckets = RuleIterations.buckets(ctx, rule, PlaceholderQuery.INSTANCE,
            RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));

        assertThat(rule.id()).isEqualTo("boost:genre = horror");
        assertThat(buckets).containsExactly(RoaringBitmap.bitmapOf(2, 4), RoaringBitmap.bitmapOf(1, 3, 5));
    }

    @Test
    @DisplayName("Should score matching documents 2 of 2 and the others 1 of 2")
    void shouldScoreBoostedBuckets() {
        List<RankingRuleOutput<PlaceholderQuery>> outputs = RuleIterations.outputs(ctx,
            new BoostRule<>("genre = horror", compiler), PlaceholderQuery.INSTANCE, RoaringBitmap.bitmapOf(1, 2, 3));

        assertThat(outputs).extracting(RankingRuleOutput::score).containsExactly(
            ScoreDetails.ranked("boost:genre = horror", new Rank(2, 2)),
            ScoreDetails.ranked("boost:genre = horror", new Rank(1, 2)));
    }

    @Test
    @DisplayName("Should evaluate the filter once per rule")
    void shouldEvaluateFilterOnce() {
        BoostRule<PlaceholderQuery> rule = new BoostRule<>("genre = horror", compiler);

        RuleIterations.buckets(ctx, rule, PlaceholderQuery.INSTANCE, RoaringBitmap.bitmapOf(1, 2));
        List<RoaringBitmap> second = RuleIterations.buckets(ctx, rule, PlaceholderQuery.INSTANCE,
            RoaringBitmap.bitmapOf(3, 4));

        assertThat(second).containsExactly(RoaringBitmap.bitmapOf(4), RoaringBitmap.bitmapOf(3));
        assertThat(compiler.getMetrics().get("filterCacheMisses")).isEqualTo(1L);
        assertThat(compiler.getMetrics().get("filterCacheHits")).isEqualTo(0L);
    }

    @Test
    @DisplayName("Should reject an invalid filter when the rule is created")
    void shouldRejectInvalidFilter() {
        assertThatThrownBy(() -> new BoostRule<PlaceholderQuery>("genre =", compiler))
            .isInstanceOf(FilterParseException.class);
    }
}
