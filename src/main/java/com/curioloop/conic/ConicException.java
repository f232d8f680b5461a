/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Base exception for modeling, canonicalization and assembly failures.
 * <p>
 * Every failure is raised synchronously at the call that detected it and is
 * never retried: errors in a static model are not transient.
 * </p>
 */
public class ConicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /**
     * Creates an exception of the given kind.
     * @param message Error message
     * @param kind Failure category
     */
    public ConicException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates an exception of the given kind with cause.
     * @param message Error message
     * @param kind Failure category
     * @param cause Underlying cause
     */
    public ConicException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the failure category.
     * @return Error kind
     */
    public ErrorKind getKind() {
        return kind;
    }
}
