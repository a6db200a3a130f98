package com.tessera.search.engine;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.SearchTimeoutException;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.api.model.SearchRequest;
import com.tessera.search.api.model.ScoreDetails;
import com.tessera.search.api.model.SearchResult;
import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.context.Deadline;
import com.tessera.search.filter.FilterParseException;
import com.tessera.search.logger.DefaultSearchLogger;
import com.tessera.search.logger.DetailedSearchLogger;
import com.tessera.search.query.PlaceholderQuery;
import com.tessera.search.query.QueryGraph;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchEngineTest {

    private InMemorySpanExporter spanExporter;
    private SearchEngine engine;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
            .build();

        InMemoryIndex index = InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("genre", "year")
            .sortableFields("year")
            .addDocument(1, Map.of("title", "the quick brown fox", "genre", "animal", "year", 2001))
            .addDocument(2, Map.of("title", "quick brown dog", "genre", "animal", "year", 1999))
            .addDocument(3, Map.of("title", "brown fox", "genre", "animal", "year", 2010))
            .addDocument(4, Map.of("title", "slow turtle", "genre", "reptile", "year", 2005))
            .addDocument(5, Map.of("title", "quick fox jumps", "genre", "animal", "year", 2020))
            .build();

        engine = SearchEngine.builder(index)
            .tracer(tracerProvider.get("test-tracer"))
            .build();
    }

    @Test
    @DisplayName("Should rank full matches first, closest words first, then partial matches")
    void shouldRankQueryResults() {
        SearchResult result = engine.search(SearchRequest.of("quick fox"));

        assertThat(result.documentIds()).containsExactly(5, 1, 2);
        assertThat(result.candidates()).isEqualTo(RoaringBitmap.bitmapOf(1, 2, 5));
        assertThat(result.estimatedTotalHits()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should only return documents with every word under the all strategy")
    void shouldMatchAllWords() {
        SearchResult result = engine.search(SearchRequest.builder()
            .query("quick fox")
            .termsMatchingStrategy(TermsMatchingStrategy.ALL)
            .build());

        assertThat(result.documentIds()).containsExactly(5, 1);
    }

    @Test
    @DisplayName("Should restrict results to the documents matching the filter")
    void shouldApplyFilter() {
        SearchResult result = engine.search(SearchRequest.builder()
            .query("brown")
            .filter("year >= 2001")
            .build());

        assertThat(result.documentIds()).containsExactly(1, 3);
    }

    @Test
    @DisplayName("Should sort every document for a placeholder search")
    void shouldRunPlaceholderSearch() {
        SearchResult result = engine.search(SearchRequest.builder().sort("year:desc").build());

        assertThat(result.documentIds()).containsExactly(5, 3, 4, 1, 2);
        assertThat(engine.getMetrics().get("placeholderSearches")).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should run a placeholder search when the query has no words")
    void shouldTreatQueryWithoutWordsAsPlaceholder() {
        SearchResult result = engine.search(SearchRequest.of("!!!"));

        assertThat(result.documentIds()).containsExactly(1, 2, 3, 4, 5);
        assertThat(engine.getMetrics().get("placeholderSearches")).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should return the requested page and report every candidate")
    void shouldPaginate() {
        SearchResult result = engine.search(SearchRequest.builder()
            .sort("year:asc")
            .from(1)
            .length(2)
            .build());

        assertThat(result.documentIds()).containsExactly(1, 4);
        assertThat(result.estimatedTotalHits()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should record a search span with universe resolution and bucket sort children")
    void shouldTraceSearch() {
        engine.search(SearchRequest.of("quick fox"));

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).extracting(SpanData::getName).contains("search", "resolve-universe", "bucket-sort");

        SpanData search = spans.stream().filter(s -> s.getName().equals("search")).findFirst().orElseThrow();
        assertThat(spans).filteredOn(s -> !s.getName().equals("search"))
            .allSatisfy(s -> assertThat(s.getParentSpanId()).isEqualTo(search.getSpanId()));
    }

    @Test
    @DisplayName("Should not change the results when a detailed logger is used")
    void shouldIgnoreLogger() {
        SearchRequest request = SearchRequest.of("quick fox");
        DetailedSearchLogger<QueryGraph> queryLogger = new DetailedSearchLogger<>();

        SearchResult logged = engine.search(request, Deadline.never(), queryLogger,
            DefaultSearchLogger.<PlaceholderQuery>instance());
        SearchResult plain = engine.search(request);

        assertThat(logged.documentIds()).isEqualTo(plain.documentIds());
        assertThat(queryLogger.events("add_to_results")).hasSize(1);
        assertThat(queryLogger.events("query_for_universe")).hasSize(1);
    }

    @Test
    @DisplayName("Should abort a cancelled search and count the timeout")
    void shouldTimeOut() {
        Deadline deadline = Deadline.never();
        deadline.cancel();

        assertThatThrownBy(() -> engine.search(SearchRequest.of("quick"), deadline,
            DefaultSearchLogger.<QueryGraph>instance(), DefaultSearchLogger.<PlaceholderQuery>instance()))
            .isInstanceOf(SearchTimeoutException.class);

        Map<String, Object> metrics = engine.getMetrics();
        assertThat(metrics.get("timeouts")).isEqualTo(1L);
        assertThat(metrics.get("totalSearches")).isEqualTo(0L);
    }

    @Test
    @DisplayName("Should propagate user errors without counting them as failures")
    void shouldPropagateUserErrors() {
        assertThatThrownBy(() -> engine.search(SearchRequest.builder().query("fox").sort("title:asc").build()))
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.ATTRIBUTE_NOT_SORTABLE);
        assertThatThrownBy(() -> engine.search(SearchRequest.builder().query("fox").filter("year >").build()))
            .isInstanceOf(FilterParseException.class);

        assertThat(engine.getMetrics().get("failures")).isEqualTo(0L);
    }

    @Test
    @DisplayName("Should expose search and filter cache metrics")
    void shouldExposeMetrics() {
        engine.search(SearchRequest.builder().query("fox").filter("genre = animal").build());
        engine.search(SearchRequest.builder().query("brown").filter("genre = animal").build());

        Map<String, Object> metrics = engine.getMetrics();
        assertThat(metrics.get("totalSearches")).isEqualTo(2L);
        assertThat(metrics).containsKey("filterCache");
        @SuppressWarnings("unchecked")
        Map<String, Object> filterCache = (Map<String, Object>) metrics.get("filterCache");
        assertThat(filterCache.get("filterCacheHits")).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should return one document per value of the requested distinct field")
    void shouldApplyRequestDistinct() {
        SearchResult result = engine.search(SearchRequest.builder().sort("year:desc").distinct("genre").build());

        assertThat(result.documentIds()).containsExactly(5, 4);
        assertThat(result.estimatedTotalHits()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should deduplicate on the distinct field of the index unless the request overrides it")
    void shouldApplyIndexDistinct() {
        InMemoryIndex index = InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("color")
            .distinctField("sku")
            .addDocument(1, Map.of("title", "red shirt", "sku", "shirt", "color", "red"))
            .addDocument(2, Map.of("title", "blue shirt", "sku", "shirt", "color", "blue"))
            .addDocument(3, Map.of("title", "red cap", "sku", "cap", "color", "red"))
            .build();
        SearchEngine products = SearchEngine.builder(index).build();

        assertThat(products.search(SearchRequest.builder().build()).documentIds()).containsExactly(1, 3);
        assertThat(products.search(SearchRequest.builder().distinct("color").build()).documentIds())
            .containsExactly(1, 2);
        assertThat(products.search(SearchRequest.builder().distinct("sku").build()).documentIds())
            .containsExactly(1, 3);
    }

    @Test
    @DisplayName("Should reject a distinct field that is neither filterable nor the index distinct field")
    void shouldRejectInvalidDistinct() {
        assertThatThrownBy(() -> engine.search(SearchRequest.builder().query("fox").distinct("title").build()))
            .isInstanceOf(UserErrorException.class)
            .extracting(e -> ((UserErrorException) e).code())
            .isEqualTo(ErrorCode.INVALID_DISTINCT_ATTRIBUTE);

        assertThat(engine.getMetrics().get("failures")).isEqualTo(0L);
    }

    @Test
    @DisplayName("Should report the score details of every returned document when asked")
    void shouldReportScoreDetails() {
        SearchResult result = engine.search(SearchRequest.builder()
            .query("quick fox")
            .showRankingScoreDetails(true)
            .build());

        assertThat(result.documentIds()).containsExactly(5, 1, 2);
        assertThat(result.scoreDetails()).hasSize(3).allSatisfy(details ->
            assertThat(details).extracting(ScoreDetails::rule)
                .containsExactly("words", "typo", "proximity", "attribute", "exactness"));
        List<Double> scores = result.rankingScores();
        assertThat(scores).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(scores.get(0)).isGreaterThan(scores.get(2));
        assertThat(scores.get(2)).isLessThanOrEqualTo(0.5);
    }

    @Test
    @DisplayName("Should drop the documents scoring below the ranking score threshold")
    void shouldApplyRankingScoreThreshold() {
        List<Double> scores = engine.search(SearchRequest.builder()
            .query("quick fox")
            .showRankingScoreDetails(true)
            .build()).rankingScores();
        // document 2 lacks "fox": the words rule ranks it 1 of 2
        assertThat(scores.get(2)).isLessThan(scores.get(1));

        SearchResult result = engine.search(SearchRequest.builder()
            .query("quick fox")
            .rankingScoreThreshold(scores.get(1))
            .build());

        assertThat(result.documentIds()).containsExactly(5, 1);
        assertThat(result.estimatedTotalHits()).isEqualTo(2);
        assertThat(result.rankingScores()).containsExactly(scores.get(0), scores.get(1));
    }

    @Test
    @DisplayName("Should tag the bucket sort span with the scoring strategy")
    void shouldTraceScoringStrategy() {
        engine.search(SearchRequest.builder().query("quick fox").rankingScoreThreshold(0.0).build());

        SpanData bucketSort = spanExporter.getFinishedSpanItems().stream()
            .filter(s -> s.getName().equals("bucket-sort")).findFirst().orElseThrow();
        assertThat(bucketSort.getAttributes().asMap().values()).contains("DETAILED");
    }
}
