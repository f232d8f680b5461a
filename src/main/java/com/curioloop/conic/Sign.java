/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Locale;

/**
 * Four-valued sign lattice.
 * <p>
 * {@code POSITIVE} means provably non-negative and {@code NEGATIVE} provably
 * non-positive. {@code ZERO} is both, {@code UNKNOWN} is neither.
 * </p>
 * <pre>
 *          UNKNOWN
 *         /       \
 *   POSITIVE    NEGATIVE
 *         \       /
 *           ZERO
 * </pre>
 */
public enum Sign {

    /** Every entry is zero */
    ZERO(true, true),

    /** Every entry is non-negative */
    POSITIVE(true, false),

    /** Every entry is non-positive */
    NEGATIVE(false, true),

    /** Nothing can be assumed */
    UNKNOWN(false, false);

    private final boolean positive;
    private final boolean negative;

    Sign(boolean positive, boolean negative) {
        this.positive = positive;
        this.negative = negative;
    }

    /**
     * Checks if values of this sign are non-negative.
     * @return true for ZERO and POSITIVE
     */
    public boolean isPositive() {
        return positive;
    }

    /**
     * Checks if values of this sign are non-positive.
     * @return true for ZERO and NEGATIVE
     */
    public boolean isNegative() {
        return negative;
    }

    /**
     * Checks if values of this sign are identically zero.
     * @return true for ZERO
     */
    public boolean isZero() {
        return positive && negative;
    }

    /**
     * Sign of {@code a + b} where a has this sign.
     * @param other Sign of b
     * @return Sign of the sum
     */
    public Sign add(Sign other) {
        return fromFlags(positive && other.positive, negative && other.negative);
    }

    /**
     * Sign of {@code -a} where a has this sign.
     * @return Negated sign
     */
    public Sign negate() {
        return fromFlags(negative, positive);
    }

    /**
     * Sign of {@code a * b} where a has this sign.
     * @param other Sign of b
     * @return Sign of the product
     */
    public Sign multiply(Sign other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        boolean pos = (positive && other.positive) || (negative && other.negative);
        boolean neg = (positive && other.negative) || (negative && other.positive);
        return fromFlags(pos, neg);
    }

    /**
     * Least upper bound of two signs, used when values of either sign may appear
     * side by side (e.g. stacked blocks).
     * @param other Other sign
     * @return Weakest sign implied by both
     */
    public Sign join(Sign other) {
        // coincides with addition on this lattice
        return add(other);
    }

    /**
     * Maps a pair of flags to a lattice element.
     * @param positive Provably non-negative
     * @param negative Provably non-positive
     * @return Corresponding sign
     */
    public static Sign fromFlags(boolean positive, boolean negative) {
        if (positive && negative) return ZERO;
        if (positive) return POSITIVE;
        if (negative) return NEGATIVE;
        return UNKNOWN;
    }

    /**
     * Derives the sign of a numeric value from its entries.
     * @param value Numeric value
     * @return Tightest sign describing every entry
     */
    public static Sign fromValue(Matrix value) {
        boolean pos = true;
        boolean neg = true;
        for (int i = 0; i < value.size(); i++) {
            double v = value.get(i);
            pos &= v >= 0;
            neg &= v <= 0;
        }
        return fromFlags(pos, neg);
    }

    /**
     * Parses a sign name, ignoring case.
     * @param name One of ZERO, POSITIVE, NEGATIVE, UNKNOWN
     * @return Parsed sign
     * @throws SignDeclarationException if the name is not a sign
     */
    public static Sign parse(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (Sign sign : values()) {
                if (sign.name().equals(upper)) {
                    return sign;
                }
            }
        }
        throw new SignDeclarationException(
            "Sign must be one of ZERO, POSITIVE, NEGATIVE, UNKNOWN but was: " + name);
    }
}
