/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Block of independent second-order cones stacked along an axis.
 * <p>
 * With {@code t} of shape (n, 1) and {@code axis = COLUMNS}, {@code x} must
 * have n columns and cone i is {@code ||x[:, i]||_2 <= t[i]}. With
 * {@code axis = ROWS}, {@code x} must have n rows and cone i is
 * {@code ||x[i, :]||_2 <= t[i]}.
 * </p>
 * <p>
 * When assembled, cone i occupies {@link #coneSize()} consecutive rows:
 * first {@code t[i]}, then the entries of its slice of x. The block extent is
 * {@code numCones() * coneSize()}.
 * </p>
 */
public final class SOCAxis extends Constraint {

    /**
     * Axis along which the cones are stacked.
     */
    public enum Axis {
        /** One cone per column of x */
        COLUMNS,
        /** One cone per row of x */
        ROWS
    }

    private final AffineExpr t;
    private final AffineExpr x;
    private final Axis axis;

    SOCAxis(int id, AffineExpr t, AffineExpr x, Axis axis) {
        super(id);
        if (t.getShape().getCols() != 1) {
            throw new SizeMismatchException("Cone bound t must be a column vector, got " + t.getShape());
        }
        int n = t.getShape().getRows();
        int stacked = axis == Axis.COLUMNS ? x.getShape().getCols() : x.getShape().getRows();
        if (stacked != n) {
            throw new SizeMismatchException("x of shape " + x.getShape() + " does not have " + n
                + (axis == Axis.COLUMNS ? " columns" : " rows"));
        }
        this.t = t;
        this.x = x;
        this.axis = axis;
    }

    public AffineExpr getT() {
        return t;
    }

    public AffineExpr getX() {
        return x;
    }

    public Axis getAxis() {
        return axis;
    }

    /**
     * Gets the number of independent cones in this block.
     * @return Number of cones
     */
    public int numCones() {
        return t.getShape().getRows();
    }

    /**
     * Gets the dimension of each cone.
     * @return 1 + length of each x slice
     */
    public int coneSize() {
        return 1 + (axis == Axis.COLUMNS ? x.getShape().getRows() : x.getShape().getCols());
    }

    /**
     * Row inside this block that holds {@code t[cone]}.
     * @param cone Cone index
     * @return Block-relative row
     */
    int tRow(int cone) {
        return cone * coneSize();
    }

    /**
     * Row inside this block that holds entry {@code index} (column-major) of x.
     * @param index Linear index into x
     * @return Block-relative row
     */
    int xRow(int index) {
        int rows = x.getShape().getRows();
        int cone = axis == Axis.COLUMNS ? index / rows : index % rows;
        int k = axis == Axis.COLUMNS ? index % rows : index / rows;
        return cone * coneSize() + 1 + k;
    }

    @Override
    public List<AffineExpr> getExpressions() {
        return Arrays.asList(t, x);
    }

    @Override
    public int size() {
        return t.getShape().size() + x.getShape().size();
    }

    @Override
    public List<Cone> cones() {
        List<Cone> out = new ArrayList<>(numCones());
        for (int i = 0; i < numCones(); i++) {
            out.add(Cone.soc(coneSize()));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "SOCAxis(" + t + ", " + x + ", " + axis + ")";
    }
}
