/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Collections;
import java.util.List;

/**
 * {@code expr >= 0} elementwise, i.e. membership in the non-negative orthant.
 */
public final class InequalityConstraint extends Constraint {

    private final AffineExpr expr;

    InequalityConstraint(int id, AffineExpr expr) {
        super(id);
        this.expr = expr;
    }

    public AffineExpr getExpr() {
        return expr;
    }

    @Override
    public List<AffineExpr> getExpressions() {
        return Collections.singletonList(expr);
    }

    @Override
    public int size() {
        return expr.getShape().size();
    }

    @Override
    public List<Cone> cones() {
        return Collections.singletonList(Cone.nonNegative(size()));
    }

    @Override
    public String toString() {
        return expr + " >= 0";
    }
}
