package com.tessera.search.api.exceptions;

/**
 * Raised on storage failures and broken internal invariants.
 */
public class InternalErrorException extends SearchException {

    public InternalErrorException(String message) {
        super(ErrorCode.INTERNAL, message);
    }

    public InternalErrorException(ErrorCode code, String message) {
        super(code, message);
    }

    public InternalErrorException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
