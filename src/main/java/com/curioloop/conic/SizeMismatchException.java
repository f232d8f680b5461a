/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Raised when operand shapes are incompatible, or when a canonical affine
 * expression does not have the shape of the node it was derived from.
 */
public class SizeMismatchException extends ConicException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     * @param message Error message
     */
    public SizeMismatchException(String message) {
        super(message, ErrorKind.SIZE_MISMATCH);
    }

    /**
     * Creates the exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public SizeMismatchException(String message, Throwable cause) {
        super(message, ErrorKind.SIZE_MISMATCH, cause);
    }
}
