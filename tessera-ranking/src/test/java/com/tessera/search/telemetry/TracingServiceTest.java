package com.tessera.search.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    @DisplayName("Should derive the default sampling ratio from the environment")
    void shouldUseEnvironmentDefaults() {
        assertThat(TracingService.samplingRatio(null, "prod")).isEqualTo(0.1);
        assertThat(TracingService.samplingRatio("", "staging")).isEqualTo(0.5);
        assertThat(TracingService.samplingRatio(null, "dev")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should clamp configured ratios and ignore invalid ones")
    void shouldClampConfiguredRatio() {
        assertThat(TracingService.samplingRatio("0.25", "prod")).isEqualTo(0.25);
        assertThat(TracingService.samplingRatio("3", "dev")).isEqualTo(1.0);
        assertThat(TracingService.samplingRatio("-1", "dev")).isEqualTo(0.0);
        assertThat(TracingService.samplingRatio("often", "staging")).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should hand out a tracer that records nothing when disabled")
    void shouldProvideNoopTracer() {
        TracingService tracing = TracingService.noop();

        Span span = tracing.getTracer().spanBuilder("search").startSpan();
        span.end();

        assertThat(tracing.isEnabled()).isFalse();
        assertThat(span.getSpanContext().isValid()).isFalse();
        tracing.flush();
        tracing.shutdown();
    }

    @Test
    @DisplayName("Should resolve settings with defaults for missing keys")
    void shouldResolveSettings() {
        Map<String, String> env = Map.of("DEPLOYMENT_ENVIRONMENT", "staging", "SERVICE_VERSION", "2.1.0");

        TracingService.Settings settings = TracingService.Settings.resolve(env::get);

        assertThat(settings.disabled()).isFalse();
        assertThat(settings.serviceName()).isEqualTo("tessera-search");
        assertThat(settings.serviceVersion()).isEqualTo("2.1.0");
        assertThat(settings.samplingRatio()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should start without an SDK when tracing is disabled")
    void shouldHonorDisabledFlag() {
        TracingService.Settings settings = TracingService.Settings.resolve(Map.of("OTEL_DISABLED", "true")::get);

        assertThat(TracingService.start(settings).isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should start an SDK tracer when tracing is enabled")
    void shouldStartSdk() {
        TracingService tracing = TracingService.start(TracingService.Settings.resolve(Map.<String, String>of()::get));
        try {
            Span span = tracing.getTracer().spanBuilder("search").startSpan();
            span.end();

            assertThat(tracing.isEnabled()).isTrue();
            assertThat(span.getSpanContext().isValid()).isTrue();
        } finally {
            tracing.shutdown();
        }
    }
}
