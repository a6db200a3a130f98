package com.tessera.search.api.exceptions;

/**
 * Raised when the request or the index settings are invalid: malformed filter,
 * unknown ranking rule, sort on a field that is not sortable, query too complex.
 */
public class UserErrorException extends SearchException {

    public UserErrorException(ErrorCode code, String message) {
        super(code, message);
        if (code.type() != ErrorType.USER) {
            throw new IllegalArgumentException("Not a user error code: " + code);
        }
    }

    public UserErrorException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
        if (code.type() != ErrorType.USER) {
            throw new IllegalArgumentException("Not a user error code: " + code);
        }
    }
}
