/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.List;

/**
 * Canonical constraint: membership of affine expressions in a cone.
 * <p>
 * A constraint contributes {@link #size()} consecutive rows to the assembled
 * problem, described by the cones returned from {@link #cones()} in order.
 * </p>
 */
public abstract class Constraint {

    private final int id;

    Constraint(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Gets the constrained affine expressions.
     * @return Expressions in row order
     */
    public abstract List<AffineExpr> getExpressions();

    /**
     * Gets the number of rows this constraint occupies.
     * @return Row count
     */
    public abstract int size();

    /**
     * Gets the cones covering this constraint's rows, in row order.
     * @return Cone list
     */
    public abstract List<Cone> cones();
}
