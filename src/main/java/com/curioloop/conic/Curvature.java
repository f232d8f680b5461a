/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Curvature lattice of disciplined convex programming.
 * <pre>
 *          UNKNOWN
 *         /       \
 *     CONVEX    CONCAVE
 *         \       /
 *          AFFINE
 *            |
 *         CONSTANT
 * </pre>
 */
public enum Curvature {

    /** Does not depend on any variable */
    CONSTANT(true, true, true),

    /** Linear in the variables plus an offset */
    AFFINE(false, true, true),

    /** Provably convex */
    CONVEX(false, true, false),

    /** Provably concave */
    CONCAVE(false, false, true),

    /** Not provably convex or concave */
    UNKNOWN(false, false, false);

    private final boolean constant;
    private final boolean convex;
    private final boolean concave;

    Curvature(boolean constant, boolean convex, boolean concave) {
        this.constant = constant;
        this.convex = convex;
        this.concave = concave;
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isAffine() {
        return convex && concave;
    }

    public boolean isConvex() {
        return convex;
    }

    public boolean isConcave() {
        return concave;
    }

    /**
     * Checks if this curvature is allowed by disciplined convex programming.
     * @return false only for UNKNOWN
     */
    public boolean isDcp() {
        return convex || concave;
    }

    /**
     * Curvature of {@code f + g} where f has this curvature.
     * @param other Curvature of g
     * @return Curvature of the sum
     */
    public Curvature add(Curvature other) {
        return of(constant && other.constant, convex && other.convex, concave && other.concave);
    }

    /**
     * Curvature of {@code -f} where f has this curvature.
     * @return Negated curvature
     */
    public Curvature negate() {
        return of(constant, concave, convex);
    }

    /**
     * Curvature of {@code f(g)} in a single argument, following the composition
     * rules of convex analysis.
     *
     * @param function Curvature of f
     * @param monotonicity Monotonicity of f in this argument
     * @param argument Curvature of g
     * @return Curvature of the composition
     */
    public static Curvature compose(Curvature function, Monotonicity monotonicity, Curvature argument) {
        if (argument.isConstant()) {
            return CONSTANT;
        }
        if (function.isConstant()) {
            return CONSTANT;
        }
        if (argument.isAffine()) {
            return function == AFFINE ? AFFINE : function;
        }
        switch (monotonicity) {
            case INCREASING:
                if (function.isAffine()) return argument;
                if (function == CONVEX && argument.isConvex()) return CONVEX;
                if (function == CONCAVE && argument.isConcave()) return CONCAVE;
                return UNKNOWN;
            case DECREASING:
                if (function.isAffine()) return argument.negate();
                if (function == CONVEX && argument.isConcave()) return CONVEX;
                if (function == CONCAVE && argument.isConvex()) return CONCAVE;
                return UNKNOWN;
            default:
                return UNKNOWN;
        }
    }

    private static Curvature of(boolean constant, boolean convex, boolean concave) {
        if (constant) return CONSTANT;
        if (convex && concave) return AFFINE;
        if (convex) return CONVEX;
        if (concave) return CONCAVE;
        return UNKNOWN;
    }
}
