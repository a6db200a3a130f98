package com.tessera.search.filter;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;

/**
 * Raised when a filter expression is syntactically invalid.
 *
 * <p>Carries the character offset at which parsing failed so that callers can point
 * at the offending part of the expression.
 */
public class FilterParseException extends UserErrorException {

    private final int position;

    public FilterParseException(String message, int position) {
        this(ErrorCode.INVALID_FILTER, message, position);
    }

    public FilterParseException(ErrorCode code, String message, int position) {
        super(code, message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
