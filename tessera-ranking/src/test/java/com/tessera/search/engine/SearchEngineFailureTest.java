package com.tessera.search.engine;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.InternalErrorException;
import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.api.model.SearchRequest;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.roaringbitmap.RoaringBitmap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchEngineFailureTest {

    @Mock
    private IndexSnapshot index;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
        when(index.documentIds()).thenReturn(RoaringBitmap.bitmapOf(1, 2, 3));
    }

    @Test
    void shouldWrapStorageFailuresAsInternalErrors() {
        IllegalStateException failure = new IllegalStateException("storage unavailable");
        when(index.rankingRules()).thenThrow(failure);
        SearchEngine engine = SearchEngine.builder(index).tracer(tracer).build();

        assertThatThrownBy(() -> engine.search(SearchRequest.builder().build()))
            .isInstanceOf(InternalErrorException.class)
            .hasCause(failure)
            .extracting(e -> ((InternalErrorException) e).code())
            .isEqualTo(ErrorCode.INTERNAL);

        assertThat(engine.getMetrics().get("failures")).isEqualTo(1L);
        verify(span).recordException(any(IllegalStateException.class));
        verify(span).end();
        verify(scope).close();
    }
}
