package com.tessera.search.api.exceptions;

/**
 * Raised when a search exceeds its deadline or is cancelled by the caller.
 * The search returns no partial results.
 */
public class SearchTimeoutException extends SearchException {

    public SearchTimeoutException(String message) {
        super(ErrorCode.SEARCH_TIMED_OUT, message);
    }
}
