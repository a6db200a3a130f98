/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.context;

import com.tessera.search.api.index.IndexSnapshot;
import com.tessera.search.config.SearchConfig;
import com.tessera.search.interner.DedupInterner;
import com.tessera.search.interner.Interned;
import com.tessera.search.interner.Interner;
import com.tessera.search.metrics.SearchMetrics;
import com.tessera.search.query.Phrase;
import com.tessera.search.query.QueryTerm;

import java.util.Objects;

/**
 * State shared by every ranking rule of one search request: the index snapshot,
 * the request interners for words, phrases and query terms, and the storage memo.
 *
 * <p>Not thread-safe. A context is created per request and discarded with it.
 */
public final class SearchContext {

    private final IndexSnapshot index;
    private final SearchConfig config;
    private final SearchMetrics metrics;
    private final Deadline deadline;

    private final DedupInterner<String> words = new DedupInterner<>();
    private final DedupInterner<Phrase> phrases = new DedupInterner<>();
    private final Interner<QueryTerm> terms = new Interner<>();
    private final DatabaseCache dbCache;

    public SearchContext(IndexSnapshot index, SearchConfig config, SearchMetrics metrics, Deadline deadline) {
        this.index = Objects.requireNonNull(index, "index cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.deadline = Objects.requireNonNull(deadline, "deadline cannot be null");
        this.dbCache = new DatabaseCache(index, words);
    }

    /** A context with default configuration, fresh metrics and no deadline. */
    public SearchContext(IndexSnapshot index) {
        this(index, SearchConfig.defaults(), new SearchMetrics(), Deadline.never());
    }

    public IndexSnapshot index() {
        return index;
    }

    public SearchConfig config() {
        return config;
    }

    public SearchMetrics metrics() {
        return metrics;
    }

    public Deadline deadline() {
        return deadline;
    }

    public DatabaseCache dbCache() {
        return dbCache;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // INTERNERS
    // ════════════════════════════════════════════════════════════════════════════════

    public Interned<String> word(String word) {
        return words.insert(word);
    }

    public String wordText(Interned<String> word) {
        return words.get(word);
    }

    public Interned<Phrase> phrase(Phrase phrase) {
        return phrases.insert(phrase);
    }

    public Phrase getPhrase(Interned<Phrase> phrase) {
        return phrases.get(phrase);
    }

    public Interned<QueryTerm> addTerm(QueryTerm term) {
        return terms.push(term);
    }

    public QueryTerm term(Interned<QueryTerm> term) {
        return terms.get(term);
    }
}
