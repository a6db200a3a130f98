package com.tessera.search.api.exceptions;

/**
 * Broad classification of search failures.
 */
public enum ErrorType {
    /** Invalid request or settings; the caller can fix it. */
    USER,
    /** The search deadline elapsed or the request was cancelled. */
    TIMEOUT,
    /** Storage failure or broken invariant. */
    INTERNAL
}
