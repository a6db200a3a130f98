/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.filter;

import com.tessera.search.api.exceptions.SearchException;
import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.filter.cache.FilterCacheConfig;
import com.tessera.search.filter.cache.FilterResultCache;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;
import java.util.Objects;

/**
 * Parses and evaluates filter expressions for the search engine.
 *
 * <p>Evaluation results are memoized across requests in a {@link FilterResultCache}
 * keyed by snapshot id and parsed filter tree. Both steps are traced.
 *
 * <pre>{@code
 * FilterCompiler compiler = new FilterCompiler(tracer, FilterCacheConfig.defaults());
 * RoaringBitmap horror = compiler.evaluate("genre = horror", index);
 * }</pre>
 *
 * <p>Instances are thread-safe.
 */
public final class FilterCompiler {

    private final Tracer tracer;
    private final FilterResultCache cache;

    public FilterCompiler() {
        this(OpenTelemetry.noop().getTracer("tessera-filter"), FilterCacheConfig.defaults());
    }

    public FilterCompiler(Tracer tracer, FilterCacheConfig cacheConfig) {
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.cache = new FilterResultCache(Objects.requireNonNull(cacheConfig, "cacheConfig cannot be null"));
    }

    /**
     * Parses an expression.
     *
     * @throws FilterParseException if the expression is malformed
     */
    public Filter parse(String expression) {
        Span span = tracer.spanBuilder("parse-filter").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("filter.length", expression == null ? 0 : expression.length());
            return Filter.parse(Objects.requireNonNull(expression, "expression cannot be null"));
        } catch (SearchException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Documents of {@code index} matching {@code filter}. The returned bitmap belongs to the caller.
     *
     * @throws com.tessera.search.api.exceptions.UserErrorException if a field is not filterable
     *         or a range bound is not a number
     */
    public RoaringBitmap evaluate(Filter filter, IndexSnapshot index) {
        Span span = tracer.spanBuilder("evaluate-filter").startSpan();
        try (Scope scope = span.makeCurrent()) {
            FilterResultCache.Key key = new FilterResultCache.Key(index.snapshotId(), filter.root());
            RoaringBitmap docids = cache.get(key, () -> filter.evaluate(index));
            span.setAttribute("filter.matches", docids.getLongCardinality());
            return docids;
        } catch (SearchException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public RoaringBitmap evaluate(String expression, IndexSnapshot index) {
        return evaluate(parse(expression), index);
    }

    public Map<String, Object> getMetrics() {
        return cache.getMetrics();
    }
}
