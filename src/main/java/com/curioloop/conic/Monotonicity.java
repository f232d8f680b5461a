/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Monotonicity of an operator in one of its arguments.
 */
public enum Monotonicity {

    /** Non-decreasing in the argument */
    INCREASING,

    /** Non-increasing in the argument */
    DECREASING,

    /** Neither */
    NONMONOTONIC;

    /**
     * Monotonicity of a function that is increasing on non-negative arguments
     * and decreasing on non-positive ones, such as {@code |x|} or a norm.
     * @param argument Sign of the argument
     * @return Monotonicity on that argument's range
     */
    public static Monotonicity ofSymmetric(Sign argument) {
        if (argument.isPositive()) return INCREASING;
        if (argument.isNegative()) return DECREASING;
        return NONMONOTONIC;
    }

    /**
     * Monotonicity of {@code k * x} in x for a coefficient of the given sign.
     * @param coefficient Sign of k
     * @return Monotonicity in x
     */
    public static Monotonicity ofScaling(Sign coefficient) {
        if (coefficient.isPositive()) return INCREASING;
        if (coefficient.isNegative()) return DECREASING;
        return NONMONOTONIC;
    }
}
