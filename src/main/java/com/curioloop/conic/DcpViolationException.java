/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Raised at the offending node when an operator's curvature or sign
 * precondition does not hold for one of its arguments.
 */
public class DcpViolationException extends ConicException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     * @param message Error message
     */
    public DcpViolationException(String message) {
        super(message, ErrorKind.DCP_VIOLATION);
    }

    /**
     * Creates the exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public DcpViolationException(String message, Throwable cause) {
        super(message, ErrorKind.DCP_VIOLATION, cause);
    }
}
