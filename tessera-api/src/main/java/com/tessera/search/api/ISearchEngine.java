/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api;

import com.tessera.search.api.exceptions.SearchException;
import com.tessera.search.api.model.SearchRequest;
import com.tessera.search.api.model.SearchResult;

import java.util.Map;

/**
 * Contract for running relevance-ranked searches over one index snapshot.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ISearchEngine engine = SearchEngine.builder(index).build();
 *
 * SearchResult result = engine.search(SearchRequest.builder()
 *     .query("quick brown fox")
 *     .length(10)
 *     .build());
 *
 * for (int docid : result.documentIds()) {
 *     System.out.println("Hit: " + docid);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. Each call builds its own request-scoped
 * state; the index snapshot is only read.
 *
 * <h2>Failure Model</h2>
 * <p>A search either completes or throws a {@link SearchException}. It never returns
 * a partial ranking, even when the deadline elapses mid-way.
 */
public interface ISearchEngine {

    /**
     * Runs a search and returns the requested window of the ranking.
     *
     * @param request the request (must not be null)
     * @return ranked document ids plus candidate sets
     * @throws com.tessera.search.api.exceptions.UserErrorException invalid request or settings
     * @throws com.tessera.search.api.exceptions.SearchTimeoutException deadline elapsed
     * @throws com.tessera.search.api.exceptions.InternalErrorException storage failure
     */
    SearchResult search(SearchRequest request);

    /**
     * Returns engine metrics (searches, timeouts, cache statistics).
     */
    Map<String, Object> getMetrics();
}
