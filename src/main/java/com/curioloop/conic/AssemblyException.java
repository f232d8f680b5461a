/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Raised when numeric assembly fails: a parameter without a value, a cone block
 * whose extent disagrees with its descriptor, or a solution of the wrong length.
 */
public class AssemblyException extends ConicException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     * @param message Error message
     */
    public AssemblyException(String message) {
        super(message, ErrorKind.ASSEMBLY);
    }

    /**
     * Creates the exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public AssemblyException(String message, Throwable cause) {
        super(message, ErrorKind.ASSEMBLY, cause);
    }
}
