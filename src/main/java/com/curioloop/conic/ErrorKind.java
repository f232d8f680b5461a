/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Enumeration of failure categories raised while building, canonicalizing
 * or assembling a model.
 */
public enum ErrorKind {

    /** A leaf was given a non-numeric value or a value of the wrong shape or sign */
    VALIDATION("Invalid value"),

    /** A sign declaration outside ZERO, POSITIVE, NEGATIVE, UNKNOWN */
    SIGN_DECLARATION("Invalid sign declaration"),

    /** An operator was applied to an argument violating its curvature or sign rule */
    DCP_VIOLATION("Disciplined convex programming rule violated"),

    /** Computed canonical shape disagrees with the declared shape */
    SIZE_MISMATCH("Size mismatch"),

    /** Numeric assembly could not be completed */
    ASSEMBLY("Assembly failed");

    private final String message;

    ErrorKind(String message) {
        this.message = message;
    }

    /**
     * Gets the description of this kind.
     * @return Description
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return name() + ": " + message;
    }
}
