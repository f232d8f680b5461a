/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Raised when a sign name is not one of ZERO, POSITIVE, NEGATIVE or UNKNOWN.
 */
public class SignDeclarationException extends ConicException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     * @param message Error message
     */
    public SignDeclarationException(String message) {
        super(message, ErrorKind.SIGN_DECLARATION);
    }

    /**
     * Creates the exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public SignDeclarationException(String message, Throwable cause) {
        super(message, ErrorKind.SIGN_DECLARATION, cause);
    }
}
