package com.tessera.search.filter;

import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.filter.cache.FilterCacheConfig;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterCompilerTest {

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private FilterCompiler compiler;
    private InMemoryIndex index;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
            .build();
        Tracer tracer = tracerProvider.get("test");
        compiler = new FilterCompiler(tracer, FilterCacheConfig.defaults());

        index = InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("genre")
            .addDocument(1, Map.of("title", "a", "genre", "horror"))
            .addDocument(2, Map.of("title", "b", "genre", "drama"))
            .build();
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    @Test
    @DisplayName("Should trace parsing and evaluation")
    void shouldTraceParseAndEvaluate() {
        RoaringBitmap docids = compiler.evaluate("genre = horror", index);

        assertThat(docids).isEqualTo(RoaringBitmap.bitmapOf(1));
        assertThat(spanExporter.getFinishedSpanItems())
            .extracting(SpanData::getName)
            .containsExactly("parse-filter", "evaluate-filter");
    }

    @Test
    @DisplayName("Should serve repeated evaluations from the cache and hand out private copies")
    void shouldCacheEvaluations() {
        RoaringBitmap first = compiler.evaluate("genre = horror", index);
        first.add(42);
        RoaringBitmap second = compiler.evaluate("genre  =  horror", index);

        assertThat(second).isEqualTo(RoaringBitmap.bitmapOf(1));
        Map<String, Object> metrics = compiler.getMetrics();
        assertThat(metrics.get("filterCacheHits")).isEqualTo(1L);
        assertThat(metrics.get("filterCacheMisses")).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should not share cached results between a quoted value and the values it spells")
    void shouldKeepQuotedCommaValueApartFromTwoValues() {
        InMemoryIndex genres = InMemoryIndex.builder()
            .searchableFields("title")
            .filterableFields("genre")
            .addDocument(1, Map.of("title", "a", "genre", "horror"))
            .addDocument(2, Map.of("title", "b", "genre", "comedy"))
            .addDocument(3, Map.of("title", "c", "genre", "horror, comedy"))
            .build();

        RoaringBitmap quoted = compiler.evaluate("genre IN [\"horror, comedy\"]", genres);
        RoaringBitmap twoValues = compiler.evaluate("genre IN [horror, comedy]", genres);

        assertThat(quoted).isEqualTo(RoaringBitmap.bitmapOf(3));
        assertThat(twoValues).isEqualTo(RoaringBitmap.bitmapOf(1, 2));
        assertThat(compiler.getMetrics().get("filterCacheMisses")).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should record the exception on the span of a failed parse")
    void shouldRecordParseFailure() {
        assertThatThrownBy(() -> compiler.parse("genre ="))
            .isInstanceOf(FilterParseException.class);

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("parse-filter");
        assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
    }

    @Test
    @DisplayName("Should evaluate every time when the cache is disabled")
    void shouldBypassDisabledCache() {
        FilterCompiler uncached = new FilterCompiler(tracerProvider.get("test"), FilterCacheConfig.disabled());

        assertThat(uncached.evaluate("genre = drama", index)).isEqualTo(RoaringBitmap.bitmapOf(2));
        assertThat(uncached.evaluate("genre = drama", index)).isEqualTo(RoaringBitmap.bitmapOf(2));
        assertThat(uncached.getMetrics().get("filterCacheSize")).isEqualTo(0L);
    }
}
