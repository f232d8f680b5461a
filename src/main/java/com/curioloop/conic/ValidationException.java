/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Raised when a constant or parameter receives a non-numeric value, or a value
 * whose shape or sign does not match the declaration.
 */
public class ValidationException extends ConicException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     * @param message Error message
     */
    public ValidationException(String message) {
        super(message, ErrorKind.VALIDATION);
    }

    /**
     * Creates the exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public ValidationException(String message, Throwable cause) {
        super(message, ErrorKind.VALIDATION, cause);
    }
}
