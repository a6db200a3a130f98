/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.api.exceptions;

import java.util.Objects;

/**
 * Base class of every failure raised while executing a search.
 *
 * <p>This is a RuntimeException so that the ranking pipeline, which is deeply
 * recursive, does not have to declare it on every signature. The first error
 * aborts the whole search; no partial result is ever returned.
 */
public abstract class SearchException extends RuntimeException {

    private final ErrorCode code;

    protected SearchException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code cannot be null");
    }

    protected SearchException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code cannot be null");
    }

    public ErrorCode code() {
        return code;
    }

    public ErrorType type() {
        return code.type();
    }
}
