package com.tessera.search.api.model;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchRequestTest {

    @Test
    @DisplayName("Should default to the first page without sort")
    void shouldApplyDefaults() {
        SearchRequest request = SearchRequest.of("hello");

        assertThat(request.from()).isZero();
        assertThat(request.length()).isEqualTo(SearchRequest.DEFAULT_LENGTH);
        assertThat(request.sort()).isEmpty();
        assertThat(request.isPlaceholder()).isFalse();
    }

    @Test
    @DisplayName("Should treat a missing or blank query as a placeholder search")
    void shouldDetectPlaceholder() {
        assertThat(SearchRequest.builder().build().isPlaceholder()).isTrue();
        assertThat(SearchRequest.of("   ").isPlaceholder()).isTrue();
    }

    @Test
    @DisplayName("Should parse sort criteria in order")
    void shouldParseSortCriteria() {
        SearchRequest request = SearchRequest.builder().sort("year:desc").sort("title:ASC").build();

        assertThat(request.sort()).containsExactly(
            new SortCriterion("year", false), new SortCriterion("title", true));
    }

    @Test
    @DisplayName("Should reject malformed sort criteria")
    void shouldRejectMalformedSort() {
        assertThatThrownBy(() -> SortCriterion.parse("year"))
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.INVALID_SORT_CRITERION);
        assertThatThrownBy(() -> SortCriterion.parse("year:up"))
            .isInstanceOf(UserErrorException.class);
    }

    @Test
    @DisplayName("Should reject negative pagination")
    void shouldRejectNegativePagination() {
        assertThatThrownBy(() -> SearchRequest.builder().from(-1).build())
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.INVALID_PAGINATION);
        assertThatThrownBy(() -> SearchRequest.builder().length(-5).build())
            .isInstanceOf(UserErrorException.class);
    }

    @Test
    @DisplayName("Should accept ranking score thresholds between 0 and 1 only")
    void shouldValidateRankingScoreThreshold() {
        assertThat(SearchRequest.builder().rankingScoreThreshold(0.0).build().rankingScoreThreshold()).isZero();
        assertThat(SearchRequest.builder().rankingScoreThreshold(1.0).build().requiresDetailedScores()).isTrue();
        assertThatThrownBy(() -> SearchRequest.builder().rankingScoreThreshold(1.01).build())
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.INVALID_RANKING_SCORE_THRESHOLD);
        assertThatThrownBy(() -> SearchRequest.builder().rankingScoreThreshold(Double.NaN).build())
            .isInstanceOf(UserErrorException.class);
    }

    @Test
    @DisplayName("Should ask for detailed scores only with score details or a threshold")
    void shouldRequireDetailedScores() {
        assertThat(SearchRequest.of("fox").requiresDetailedScores()).isFalse();
        assertThat(SearchRequest.builder().showRankingScoreDetails(true).build().requiresDetailedScores()).isTrue();
    }
}
