package com.tessera.search.logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.search.query.PlaceholderQuery;
import com.tessera.search.rules.RankingRule;
import com.tessera.search.rules.SortRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetailedSearchLoggerTest {

    private final RankingRule<PlaceholderQuery> rule = new SortRule<>("year", true);

    @Test
    @DisplayName("Should record events in the order they happen")
    void shouldRecordEventsInOrder() {
        DetailedSearchLogger<PlaceholderQuery> logger = new DetailedSearchLogger<>();
        RoaringBitmap universe = RoaringBitmap.bitmapOf(1, 2, 3);

        logger.initialUniverse(universe);
        logger.rankingRules(List.of(rule));
        logger.startIterationRankingRule(0, rule, PlaceholderQuery.INSTANCE, universe);
        logger.nextBucketRankingRule(0, rule, universe, RoaringBitmap.bitmapOf(2));
        logger.endIterationRankingRule(0, rule, universe);
        logger.addToResults(List.of(2, 1, 3));

        assertThat(logger.events()).extracting(DetailedSearchLogger.Event::type).containsExactly(
            "initial_universe", "ranking_rules", "start_iteration", "next_bucket", "end_iteration", "add_to_results");
        assertThat(logger.events("next_bucket")).singleElement().satisfies(event -> {
            assertThat(event.rule()).isEqualTo("asc(year)");
            assertThat(event.universeSize()).isEqualTo(3L);
            assertThat(event.docids()).containsExactly(2);
        });
        assertThat(logger.events("ranking_rules").get(0).detail()).isEqualTo("asc(year)");
    }

    @Test
    @DisplayName("Should truncate recorded document ids")
    void shouldTruncateIds() {
        DetailedSearchLogger<PlaceholderQuery> logger = new DetailedSearchLogger<>();
        RoaringBitmap large = new RoaringBitmap();
        large.add(0L, 1000L);

        logger.initialUniverse(large);

        DetailedSearchLogger.Event event = logger.events().get(0);
        assertThat(event.universeSize()).isEqualTo(1000L);
        assertThat(event.docids()).hasSize(DetailedSearchLogger.MAX_RECORDED_IDS);
    }

    @Test
    @DisplayName("Should export events as JSON without empty fields")
    void shouldExportJson() throws Exception {
        DetailedSearchLogger<PlaceholderQuery> logger = new DetailedSearchLogger<>();
        logger.skipBucketRankingRule(1, rule, RoaringBitmap.bitmapOf(7, 8));

        JsonNode events = new ObjectMapper().readTree(logger.toJson());

        assertThat(events.isArray()).isTrue();
        JsonNode event = events.get(0);
        assertThat(event.get("type").asText()).isEqualTo("skip_bucket");
        assertThat(event.get("rule_index").asInt()).isEqualTo(1);
        assertThat(event.get("bucket_size").asLong()).isEqualTo(2L);
        assertThat(event.has("universe_size")).isFalse();
        assertThat(event.get("docids")).hasSize(2);
    }
}
