package com.tessera.search.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SearchMetricsTest {

    @Test
    @DisplayName("Should aggregate searches into the snapshot")
    void shouldAggregateSearches() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordSearch(false, 2_000, 10);
        metrics.recordSearch(true, 4_000, 0);
        metrics.recordTimeout();

        Map<String, Object> snapshot = metrics.getSnapshot();

        assertThat(snapshot.get("totalSearches")).isEqualTo(2L);
        assertThat(snapshot.get("placeholderSearches")).isEqualTo(1L);
        assertThat(snapshot.get("timeouts")).isEqualTo(1L);
        assertThat(snapshot.get("avgSearchTimeNanos")).isEqualTo(3_000L);
        assertThat(snapshot.get("avgResultsPerSearch")).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should compute the condition cache reuse rate")
    void shouldComputeReuseRate() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordConditionResolution();
        metrics.recordConditionCacheHit();
        metrics.recordConditionNarrowing();
        metrics.recordConditionCacheHit();

        Map<String, Object> snapshot = metrics.getSnapshot();

        assertThat(metrics.conditionResolutions()).isEqualTo(1);
        assertThat(snapshot.get("conditionCacheReuseRate")).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Should report zeros before any search")
    void shouldStartEmpty() {
        Map<String, Object> snapshot = new SearchMetrics().getSnapshot();

        assertThat(snapshot.get("totalSearches")).isEqualTo(0L);
        assertThat(snapshot.get("avgSearchTimeNanos")).isEqualTo(0L);
        assertThat(snapshot.get("conditionCacheReuseRate")).isEqualTo(0.0);
    }
}
