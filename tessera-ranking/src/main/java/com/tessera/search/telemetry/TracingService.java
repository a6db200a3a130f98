/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry tracer for search engines built with
 * {@code SearchEngine.Builder#withDefaultTracing()}.
 *
 * <p>Spans are batched to the logging exporter. Embedders that already run an
 * OpenTelemetry SDK should pass their own tracer to the engine builder instead.
 *
 * <p>Read from environment variables, then system properties:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: {@code true} turns tracing off</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0 to 1.0; defaults to 0.1 in prod, 0.5 in staging, 1.0 elsewhere</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}, {@code DEPLOYMENT_ENVIRONMENT}: resource attributes</li>
 * </ul>
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.tessera.search";

    private static final Duration EXPORT_DELAY = Duration.ofSeconds(5);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private static volatile TracingService shared;

    /**
     * Resolved tracing settings.
     */
    record Settings(boolean disabled, String serviceName, String serviceVersion, String environment,
                    double samplingRatio) {

        static Settings resolve(UnaryOperator<String> lookup) {
            String environment = valueOr(lookup, "DEPLOYMENT_ENVIRONMENT", "dev");
            return new Settings(
                Boolean.parseBoolean(valueOr(lookup, "OTEL_DISABLED", "false")),
                valueOr(lookup, "SERVICE_NAME", "tessera-search"),
                valueOr(lookup, "SERVICE_VERSION", "unknown"),
                environment,
                TracingService.samplingRatio(lookup.apply("OTEL_TRACE_SAMPLING_RATIO"), environment));
        }

        private static String valueOr(UnaryOperator<String> lookup, String key, String fallback) {
            String value = lookup.apply(key);
            return value == null || value.isBlank() ? fallback : value.trim();
        }
    }

    private final OpenTelemetry openTelemetry;
    private final SdkTracerProvider sdkProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider sdkProvider) {
        this.openTelemetry = openTelemetry;
        this.sdkProvider = sdkProvider;
    }

    /**
     * The shared instance, created on first use. Falls back to {@link #noop()} when
     * tracing is disabled or the SDK cannot start.
     */
    public static TracingService getInstance() {
        TracingService current = shared;
        if (current != null) {
            return current;
        }
        synchronized (TracingService.class) {
            if (shared == null) {
                shared = start(Settings.resolve(TracingService::environmentOrProperty));
            }
            return shared;
        }
    }

    /** A tracing service whose spans are never recorded. */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    static TracingService start(Settings settings) {
        if (settings.disabled()) {
            logger.info("Search tracing disabled by OTEL_DISABLED");
            return noop();
        }
        try {
            Sampler sampler = Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(settings.samplingRatio())).build();
            SdkTracerProvider provider = SdkTracerProvider.builder()
                .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(
                    AttributeKey.stringKey("service.name"), settings.serviceName(),
                    AttributeKey.stringKey("service.version"), settings.serviceVersion(),
                    AttributeKey.stringKey("deployment.environment"), settings.environment()))))
                .setSampler(sampler)
                .addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create())
                    .setScheduleDelay(EXPORT_DELAY)
                    .setMaxExportBatchSize(256)
                    .build())
                .build();
            OpenTelemetry sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(provider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

            TracingService service = new TracingService(sdk, provider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "tessera-tracing-shutdown"));
            logger.info(String.format("Search tracing started for %s %s (%s), sampling %s",
                settings.serviceName(), settings.serviceVersion(), settings.environment(), sampler.getDescription()));
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Search tracing could not start, spans will not be recorded", e);
            return noop();
        }
    }

    /**
     * Sampling ratio for {@code environment}, overridden by {@code configured} when it
     * parses. Configured values are clamped to [0, 1].
     */
    static double samplingRatio(String configured, String environment) {
        double byEnvironment = switch (environment.toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> 0.1;
            case "staging" -> 0.5;
            default -> 1.0;
        };
        if (configured == null || configured.isBlank()) {
            return byEnvironment;
        }
        try {
            double ratio = Double.parseDouble(configured.trim());
            return Math.min(1.0, Math.max(0.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning(String.format("Ignoring OTEL_TRACE_SAMPLING_RATIO=%s, using %.2f", configured,
                byEnvironment));
            return byEnvironment;
        }
    }

    private static String environmentOrProperty(String key) {
        String value = System.getenv(key);
        return value != null && !value.isEmpty() ? value : System.getProperty(key);
    }

    public Tracer getTracer() {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return sdkProvider != null;
    }

    /** Exports the spans still queued. */
    public void flush() {
        if (sdkProvider != null) {
            sdkProvider.forceFlush().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
    }

    /** Exports the spans still queued and stops the exporter. */
    public void shutdown() {
        if (sdkProvider != null) {
            sdkProvider.shutdown().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.fine("Search tracing stopped");
        }
    }
}
