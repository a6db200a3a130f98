package com.tessera.search.rules;

import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.api.model.Rank;
import com.tessera.search.context.SearchContext;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.query.NgramDeriver;
import com.tessera.search.query.QueryGraph;
import com.tessera.search.query.WhitespaceQueryTermBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class GraphBasedRankingRuleTest {

    private static QueryGraph graph(SearchContext ctx, String query) {
        return QueryGraph.fromQuery(ctx, new WhitespaceQueryTermBuilder().build(ctx, query), NgramDeriver.NONE);
    }

    private static SearchContext typoContext() {
        return new SearchContext(InMemoryIndex.builder()
            .searchableFields("title")
            .addDocument(1, Map.of("title", "hello world"))
            .addDocument(2, Map.of("title", "helo world"))
            .addDocument(3, Map.of("title", "hello"))
            .addDocument(4, Map.of("title", "helo"))
            .addDocument(5, Map.of("title", "world"))
            .build());
    }

    @Test
    @DisplayName("Should rank exact matches before typos and leave unmatched documents last")
    void shouldRankByTypos() {
        SearchContext ctx = typoContext();

        List<RoaringBitmap> buckets = RuleIterations.buckets(ctx, GraphBasedRankingRule.typo(), graph(ctx, "hello "),
            RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));

        assertThat(buckets).containsExactly(
            RoaringBitmap.bitmapOf(1, 3),
            RoaringBitmap.bitmapOf(2, 4),
            RoaringBitmap.bitmapOf(5));
    }

    @Test
    @DisplayName("Should give the same ranking when started again on a smaller universe")
    void shouldRestartIteration() {
        SearchContext ctx = typoContext();
        RankingRule<QueryGraph> rule = GraphBasedRankingRule.typo();
        QueryGraph query = graph(ctx, "hello ");

        RuleIterations.buckets(ctx, rule, query, RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));
        List<RoaringBitmap> second = RuleIterations.buckets(ctx, rule, query, RoaringBitmap.bitmapOf(2, 3, 5));

        assertThat(second).containsExactly(
            RoaringBitmap.bitmapOf(3),
            RoaringBitmap.bitmapOf(2),
            RoaringBitmap.bitmapOf(5));
    }

    @Test
    @DisplayName("Should rank closer word pairs first")
    void shouldRankByProximity() {
        SearchContext ctx = new SearchContext(InMemoryIndex.builder()
            .searchableFields("title")
            .addDocument(1, Map.of("title", "quick brown fox"))
            .addDocument(2, Map.of("title", "quick red brown"))
            .addDocument(3, Map.of("title", "brown quick"))
            .addDocument(4, Map.of("title", "quick a b c d e f g h brown"))
            .addDocument(5, Map.of("title", "quick"))
            .build());

        List<RoaringBitmap> buckets = RuleIterations.buckets(ctx, GraphBasedRankingRule.proximity(),
            graph(ctx, "quick brown "), RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));

        assertThat(buckets).containsExactly(
            RoaringBitmap.bitmapOf(1),
            RoaringBitmap.bitmapOf(2, 3),
            RoaringBitmap.bitmapOf(4),
            RoaringBitmap.bitmapOf(5));
    }

    @Test
    @DisplayName("Should rank the exact word before its derivations")
    void shouldRankByExactness() {
        SearchContext ctx = typoContext();

        List<RoaringBitmap> buckets = RuleIterations.buckets(ctx, GraphBasedRankingRule.exactness(),
            graph(ctx, "hello "), RoaringBitmap.bitmapOf(1, 2, 3, 4));

        assertThat(buckets).containsExactly(RoaringBitmap.bitmapOf(1, 3), RoaringBitmap.bitmapOf(2, 4));
    }

    @Test
    @DisplayName("Should partition the universe into disjoint buckets without touching it")
    void shouldPartitionUniverse() {
        SearchContext ctx = typoContext();
        RoaringBitmap universe = RoaringBitmap.bitmapOf(1, 2, 3, 4, 5);

        List<RoaringBitmap> buckets = RuleIterations.buckets(ctx, GraphBasedRankingRule.typo(), graph(ctx, "hello "),
            universe);

        RoaringBitmap union = new RoaringBitmap();
        long total = 0;
        for (RoaringBitmap bucket : buckets) {
            assertThat(bucket.isEmpty()).isFalse();
            union.or(bucket);
            total += bucket.getLongCardinality();
        }
        assertThat(union).isEqualTo(universe);
        assertThat(total).isEqualTo(universe.getLongCardinality());
        assertThat(universe).isEqualTo(RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));
    }

    @Test
    @DisplayName("Should rank the cheapest bucket highest and the unmatched documents 0")
    void shouldScoreBucketsByCost() {
        SearchContext ctx = typoContext();

        List<RankingRuleOutput<QueryGraph>> outputs = RuleIterations.outputs(ctx, GraphBasedRankingRule.typo(),
            graph(ctx, "hello "), RoaringBitmap.bitmapOf(1, 2, 3, 4, 5));

        List<Rank> ranks = outputs.stream().map(output -> output.score().rank()).toList();
        assertThat(ranks).hasSize(3);
        assertThat(outputs).allSatisfy(output -> assertThat(output.score().rule()).isEqualTo("typo"));
        assertThat(ranks.get(0).localScore()).isEqualTo(1.0);
        assertThat(ranks.get(1).rank()).isLessThan(ranks.get(0).rank()).isPositive();
        assertThat(ranks.get(2).rank()).isZero();
        assertThat(ranks).extracting(Rank::maxRank).containsOnly(ranks.get(0).maxRank());
    }

    @Test
    @DisplayName("Should hand the graph description to the logger without building it")
    void shouldDescribeGraphOnlyOnDemand() {
        SearchContext ctx = typoContext();
        List<Supplier<?>> states = new ArrayList<>();
        SearchLogger<QueryGraph> logger = new SearchLogger<>() {
            @Override
            public void logInternalState(String ruleId, Supplier<?> state) {
                states.add(state);
            }
        };
        RankingRule<QueryGraph> rule = GraphBasedRankingRule.typo();

        rule.startIteration(ctx, logger, RoaringBitmap.bitmapOf(1, 2, 3, 4, 5), graph(ctx, "hello "));
        rule.endIteration(ctx, logger);

        assertThat(states).singleElement()
            .satisfies(state -> assertThat(String.valueOf(state.get())).startsWith("typo graph"));
    }
}
