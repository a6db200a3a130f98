/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.engine;

import com.tessera.search.api.ISearchEngine;
import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.InternalErrorException;
import com.tessera.search.api.exceptions.SearchException;
import com.tessera.search.api.exceptions.SearchTimeoutException;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.api.model.SearchRequest;
import com.tessera.search.api.model.SearchResult;
import com.tessera.search.api.model.TermsMatchingStrategy;
import com.tessera.search.config.SearchConfig;
import com.tessera.search.context.Deadline;
import com.tessera.search.context.SearchContext;
import com.tessera.search.filter.FilterCompiler;
import com.tessera.search.logger.DefaultSearchLogger;
import com.tessera.search.logger.SearchLogger;
import com.tessera.search.metrics.SearchMetrics;
import com.tessera.search.query.LocatedQueryTerm;
import com.tessera.search.query.NgramDeriver;
import com.tessera.search.query.PlaceholderQuery;
import com.tessera.search.query.QueryGraph;
import com.tessera.search.query.QueryTermBuilder;
import com.tessera.search.query.WhitespaceQueryTermBuilder;
import com.tessera.search.rules.RankingRule;
import com.tessera.search.rules.RankingRuleFactory;
import com.tessera.search.rules.WordsRule;
import com.tessera.search.sort.BucketSort;
import com.tessera.search.sort.BucketSortOptions;
import com.tessera.search.sort.BucketSortOutput;
import com.tessera.search.sort.ScoringStrategy;
import com.tessera.search.telemetry.TracingService;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Search engine over one index snapshot.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>the filter restricts the index documents to the initial universe</li>
 *   <li>the query is tokenized into located terms and built into a query graph</li>
 *   <li>the universe is reduced to the documents matching the graph, after the terms
 *       matching strategy dropped every droppable word</li>
 *   <li>the ranking rules bucket-sort the universe; only the requested window is ranked</li>
 * </ol>
 * <p>The distinct field of the request, or else of the index, deduplicates the ranked
 * documents. Asking for score details or setting a ranking score threshold makes every
 * rule score every returned document.
 * <p>A blank query, or one without any word, runs a placeholder search where only the
 * sort and boost rules apply.
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe. Every search builds its own {@link SearchContext}; the index snapshot,
 * the filter cache and the metrics are shared.
 */
public final class SearchEngine implements ISearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    // ════════════════════════════════════════════════════════════════════════════════
    // INSTANCE FIELDS
    // ════════════════════════════════════════════════════════════════════════════════

    private final IndexSnapshot index;
    private final SearchConfig config;
    private final Tracer tracer;
    private final QueryTermBuilder termBuilder;
    private final NgramDeriver ngramDeriver;
    private final FilterCompiler filterCompiler;
    private final RankingRuleFactory ruleFactory;
    private final SearchMetrics metrics = new SearchMetrics();

    private SearchEngine(Builder builder) {
        this.index = builder.index;
        this.config = builder.config;
        this.tracer = builder.tracer;
        this.termBuilder = builder.termBuilder;
        this.ngramDeriver = builder.ngramDeriver;
        this.filterCompiler = builder.filterCompiler != null
            ? builder.filterCompiler
            : new FilterCompiler(tracer, config.getFilterCacheConfig());
        this.ruleFactory = new RankingRuleFactory(filterCompiler);
        logger.info("SearchEngine initialized: snapshot={}, {} documents, config={}",
            index.snapshotId(), index.documentIds().getLongCardinality(), config);
    }

    public static Builder builder(IndexSnapshot index) {
        return new Builder(index);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ISearchEngine INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public SearchResult search(SearchRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        Duration timeout = request.timeout() != null ? request.timeout() : config.getTimeout();
        return search(request, Deadline.after(timeout), DefaultSearchLogger.instance(), DefaultSearchLogger.instance());
    }

    /**
     * Runs a search with a caller-owned deadline and loggers. The deadline may be
     * cancelled from another thread; the loggers never change the outcome.
     *
     * @throws com.tessera.search.api.exceptions.UserErrorException invalid request or settings
     * @throws SearchTimeoutException the deadline elapsed or was cancelled
     * @throws InternalErrorException storage failure
     */
    public SearchResult search(SearchRequest request, Deadline deadline,
                               SearchLogger<QueryGraph> queryLogger,
                               SearchLogger<PlaceholderQuery> placeholderLogger) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(deadline, "deadline cannot be null");
        long startNanos = System.nanoTime();

        Span span = tracer.spanBuilder("search").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("search.placeholder", request.isPlaceholder());
            span.setAttribute("search.from", request.from());
            span.setAttribute("search.length", request.length());

            SearchContext ctx = new SearchContext(index, config, metrics, deadline);
            BucketSortOptions options = sortOptions(request);
            RoaringBitmap filtered = filteredUniverse(request);
            span.setAttribute("search.filtered_universe", filtered.getLongCardinality());

            Outcome outcome = request.isPlaceholder()
                ? placeholderSearch(ctx, request, options, filtered, placeholderLogger)
                : querySearch(ctx, request, options, filtered, queryLogger, placeholderLogger);

            long elapsedNanos = System.nanoTime() - startNanos;
            metrics.recordSearch(outcome.placeholder(), elapsedNanos, outcome.sorted().documentIds().size());
            span.setAttribute("search.candidates", outcome.sorted().candidates().getLongCardinality());
            span.setAttribute("search.hits", outcome.sorted().documentIds().size());
            logger.debug("Search '{}' returned {} of {} candidates in {} µs", request.query(),
                outcome.sorted().documentIds().size(), outcome.sorted().candidates().getLongCardinality(),
                elapsedNanos / 1000);

            return new SearchResult(outcome.sorted().documentIds(), outcome.sorted().scoreDetails(),
                outcome.sorted().candidates(), outcome.sorted().bucketCandidates(), elapsedNanos / 1_000_000);
        } catch (SearchTimeoutException e) {
            metrics.recordTimeout();
            span.recordException(e);
            logger.warn("Search '{}' aborted: {}", request.query(), e.getMessage());
            throw e;
        } catch (SearchException e) {
            if (e instanceof InternalErrorException) {
                metrics.recordFailure();
                logger.error("Search '{}' failed [{}]", request.query(), e.code().wireName(), e);
            }
            span.recordException(e);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordFailure();
            span.recordException(e);
            logger.error("Search '{}' failed with an unexpected error", request.query(), e);
            throw new InternalErrorException(ErrorCode.INTERNAL,
                "Search failed for query '" + request.query() + "': " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    @Override
    public Map<String, Object> getMetrics() {
        Map<String, Object> snapshot = new LinkedHashMap<>(metrics.getSnapshot());
        snapshot.put("filterCache", filterCompiler.getMetrics());
        return snapshot;
    }

    public SearchConfig getConfig() {
        return config;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PIPELINE
    // ════════════════════════════════════════════════════════════════════════════════

    private record Outcome(BucketSortOutput sorted, boolean placeholder) {
    }

    /**
     * Distinct field, scoring strategy and score threshold of {@code request}. A distinct
     * field given by the request must be filterable or be the index's distinct field.
     */
    private BucketSortOptions sortOptions(SearchRequest request) {
        String distinct = request.distinct();
        if (distinct != null) {
            boolean indexDistinct = index.distinctField().map(distinct::equals).orElse(false);
            if (!indexDistinct && !index.filterableFields().contains(distinct)) {
                throw new UserErrorException(ErrorCode.INVALID_DISTINCT_ATTRIBUTE, String.format(
                    "Attribute `%s` is not filterable and thus cannot be used as distinct attribute. "
                        + "Filterable attributes are %s", distinct, index.filterableFields()));
            }
        } else {
            distinct = index.distinctField().orElse(null);
        }
        ScoringStrategy scoring = request.requiresDetailedScores() ? ScoringStrategy.DETAILED : ScoringStrategy.SKIP;
        return new BucketSortOptions(distinct, scoring, request.rankingScoreThreshold());
    }

    private RoaringBitmap filteredUniverse(SearchRequest request) {
        RoaringBitmap all = index.documentIds();
        if (request.filter() == null || request.filter().isBlank()) {
            return all.clone();
        }
        RoaringBitmap filtered = filterCompiler.evaluate(request.filter(), index);
        filtered.and(all);
        return filtered;
    }

    private Outcome placeholderSearch(SearchContext ctx, SearchRequest request, BucketSortOptions options,
                                      RoaringBitmap universe, SearchLogger<PlaceholderQuery> searchLogger) {
        List<RankingRule<PlaceholderQuery>> rules = ruleFactory.placeholderRules(index, request.sort());
        searchLogger.queryForInitialUniverse(PlaceholderQuery.INSTANCE);
        BucketSortOutput sorted = bucketSort(ctx, rules, PlaceholderQuery.INSTANCE, universe, request, options,
            searchLogger);
        return new Outcome(sorted, true);
    }

    private Outcome querySearch(SearchContext ctx, SearchRequest request, BucketSortOptions options,
                                RoaringBitmap filtered,
                                SearchLogger<QueryGraph> queryLogger,
                                SearchLogger<PlaceholderQuery> placeholderLogger) {
        List<LocatedQueryTerm> terms = termBuilder.build(ctx, request.query());
        if (terms.isEmpty()) {
            logger.debug("Query '{}' has no words, running a placeholder search", request.query());
            return placeholderSearch(ctx, request, options, filtered, placeholderLogger);
        }
        TermsMatchingStrategy strategy = request.termsMatchingStrategy() != null
            ? request.termsMatchingStrategy()
            : config.getTermsMatchingStrategy();

        QueryGraph graph = QueryGraph.fromQuery(ctx, terms, ngramDeriver);
        List<RankingRule<QueryGraph>> rules = ruleFactory.queryRules(index, request.sort(), strategy);

        RoaringBitmap universe = resolveUniverse(ctx, graph, strategy, filtered, queryLogger);
        BucketSortOutput sorted = bucketSort(ctx, rules, graph, universe, request, options, queryLogger);
        return new Outcome(sorted, false);
    }

    /**
     * Documents of {@code filtered} matching the query graph once the strategy dropped
     * every word it is allowed to drop.
     */
    private RoaringBitmap resolveUniverse(SearchContext ctx, QueryGraph graph, TermsMatchingStrategy strategy,
                                          RoaringBitmap filtered, SearchLogger<QueryGraph> searchLogger) {
        Span span = tracer.spanBuilder("resolve-universe").startSpan();
        try (Scope scope = span.makeCurrent()) {
            QueryGraph reduced = graph.copy();
            if (strategy == TermsMatchingStrategy.LAST) {
                for (RoaringBitmap step : reduced.removalOrderForTermsMatchingStrategyLast(ctx)) {
                    reduced.removeNodesKeepEdges(step);
                }
            }
            searchLogger.queryForInitialUniverse(reduced);
            RoaringBitmap universe = WordsRule.resolveQueryGraph(ctx, reduced, filtered);
            span.setAttribute("search.universe", universe.getLongCardinality());
            return universe;
        } catch (SearchException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <Q> BucketSortOutput bucketSort(SearchContext ctx, List<RankingRule<Q>> rules, Q query,
                                            RoaringBitmap universe, SearchRequest request,
                                            BucketSortOptions options, SearchLogger<Q> searchLogger) {
        Span span = tracer.spanBuilder("bucket-sort").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("search.ranking_rules", rules.size());
            span.setAttribute("search.scoring_strategy", options.scoringStrategy().name());
            return BucketSort.bucketSort(ctx, rules, query, universe, request.from(), request.length(), options,
                searchLogger);
        } catch (SearchException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static class Builder {
        private final IndexSnapshot index;
        private SearchConfig config = SearchConfig.defaults();
        private Tracer tracer = OpenTelemetry.noop().getTracer(TracingService.INSTRUMENTATION_NAME);
        private QueryTermBuilder termBuilder;
        private NgramDeriver ngramDeriver;
        private FilterCompiler filterCompiler;

        private Builder(IndexSnapshot index) {
            this.index = Objects.requireNonNull(index, "index cannot be null");
        }

        public Builder config(SearchConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
            return this;
        }

        /** Traces through the process-wide {@link TracingService}. */
        public Builder withDefaultTracing() {
            return tracer(TracingService.getInstance().getTracer());
        }

        public Builder termBuilder(QueryTermBuilder termBuilder) {
            this.termBuilder = Objects.requireNonNull(termBuilder, "termBuilder cannot be null");
            return this;
        }

        public Builder ngramDeriver(NgramDeriver ngramDeriver) {
            this.ngramDeriver = Objects.requireNonNull(ngramDeriver, "ngramDeriver cannot be null");
            return this;
        }

        public Builder filterCompiler(FilterCompiler filterCompiler) {
            this.filterCompiler = Objects.requireNonNull(filterCompiler, "filterCompiler cannot be null");
            return this;
        }

        public SearchEngine build() {
            WhitespaceQueryTermBuilder defaults = new WhitespaceQueryTermBuilder();
            if (termBuilder == null) {
                termBuilder = defaults;
            }
            if (ngramDeriver == null) {
                ngramDeriver = defaults;
            }
            return new SearchEngine(this);
        }
    }
}
