/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Locale;

/**
 * Scalar expression to minimize or maximize.
 */
public final class Objective {

    /**
     * Optimization direction.
     */
    public enum Sense {
        MINIMIZE,
        MAXIMIZE
    }

    private final Sense sense;
    private final Expression expression;

    private Objective(Sense sense, Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Objective expression cannot be null");
        }
        if (!expression.isScalar()) {
            throw new SizeMismatchException("Objective must be scalar, got " + expression.getShape());
        }
        this.sense = sense;
        this.expression = expression;
    }

    public static Objective minimize(Expression expression) {
        return new Objective(Sense.MINIMIZE, expression);
    }

    public static Objective maximize(Expression expression) {
        return new Objective(Sense.MAXIMIZE, expression);
    }

    public Sense getSense() {
        return sense;
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * Checks whether minimization of a convex or maximization of a concave
     * expression is requested.
     * @return true if the objective is DCP
     */
    public boolean isDcp() {
        return sense == Sense.MINIMIZE ? expression.isConvex() : expression.isConcave();
    }

    @Override
    public String toString() {
        return sense.name().charAt(0) + sense.name().substring(1).toLowerCase(Locale.ROOT)
            + " " + expression;
    }
}
