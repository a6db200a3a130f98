/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.exceptions;

/**
 * Stable error codes reported by the search engine.
 *
 * <p>Each code belongs to exactly one {@link ErrorType}. User errors are caused by
 * the request or the index settings and are safe to report back to the caller;
 * internal errors indicate a storage failure or a bug.
 */
public enum ErrorCode {

    INVALID_FILTER(ErrorType.USER),
    FILTER_TOO_DEEP(ErrorType.USER),
    ATTRIBUTE_NOT_FILTERABLE(ErrorType.USER),
    INVALID_RANKING_RULE(ErrorType.USER),
    INVALID_SORT_CRITERION(ErrorType.USER),
    ATTRIBUTE_NOT_SORTABLE(ErrorType.USER),
    SORT_RANKING_RULE_MISSING(ErrorType.USER),
    INVALID_SEARCHABLE_ATTRIBUTE(ErrorType.USER),
    QUERY_TOO_COMPLEX(ErrorType.USER),
    INVALID_PAGINATION(ErrorType.USER),
    INVALID_RANKING_SCORE_THRESHOLD(ErrorType.USER),
    INVALID_DISTINCT_ATTRIBUTE(ErrorType.USER),

    SEARCH_TIMED_OUT(ErrorType.TIMEOUT),

    STORAGE_FAILURE(ErrorType.INTERNAL),
    FIELD_ID_MAPPING_MISSING(ErrorType.INTERNAL),
    INTERNAL(ErrorType.INTERNAL);

    private final ErrorType type;

    ErrorCode(ErrorType type) {
        this.type = type;
    }

    public ErrorType type() {
        return type;
    }

    /** Wire name of the code, e.g. {@code invalid_filter}. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
