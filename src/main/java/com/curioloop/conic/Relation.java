/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Constraint stated over expressions, before canonicalization.
 * <pre>{@code
 * Relation.eq(Atoms.sumEntries(x), Constant.scalar(1));   // affine == affine
 * Relation.leq(Atoms.norm2(x), t);                        // convex <= concave
 * Relation.soc(t, x, SOCAxis.Axis.COLUMNS);               // ||x[:, i]|| <= t[i]
 * }</pre>
 */
public final class Relation {

    /**
     * Relation kinds.
     */
    public enum Kind {
        /** lhs == rhs */
        EQUAL,
        /** lhs <= rhs elementwise */
        LESS_EQUAL,
        /** second-order cone block */
        SOC
    }

    private final Kind kind;
    private final List<Expression> args;
    private final SOCAxis.Axis axis;

    private Relation(Kind kind, List<Expression> args, SOCAxis.Axis axis) {
        this.kind = kind;
        this.args = Collections.unmodifiableList(args);
        this.axis = axis;
    }

    /**
     * {@code lhs == rhs}; a scalar side is broadcast.
     * @param lhs Left side
     * @param rhs Right side
     * @return Relation
     * @throws SizeMismatchException if the sides have incompatible shapes
     */
    public static Relation eq(Expression lhs, Expression rhs) {
        return new Relation(Kind.EQUAL, Collections.singletonList(Atoms.subtract(lhs, rhs)), null);
    }

    /**
     * {@code lhs <= rhs} elementwise; a scalar side is broadcast.
     * @param lhs Left side
     * @param rhs Right side
     * @return Relation
     * @throws SizeMismatchException if the sides have incompatible shapes
     */
    public static Relation leq(Expression lhs, Expression rhs) {
        return new Relation(Kind.LESS_EQUAL, Collections.singletonList(Atoms.subtract(lhs, rhs)), null);
    }

    public static Relation geq(Expression lhs, Expression rhs) {
        return leq(rhs, lhs);
    }

    /**
     * Block of second-order cones, {@code ||x_i||_2 <= t_i} for each slice of x
     * along the axis.
     * @param t Column vector of cone bounds
     * @param x Stacked cone bodies
     * @param axis Stacking axis
     * @return Relation
     * @throws SizeMismatchException if t is not a column or x does not have
     *         one slice per entry of t
     */
    public static Relation soc(Expression t, Expression x, SOCAxis.Axis axis) {
        if (axis == null) {
            throw new IllegalArgumentException("Axis cannot be null");
        }
        Shape ts = t.getShape();
        int stacked = axis == SOCAxis.Axis.COLUMNS ? x.getShape().getCols() : x.getShape().getRows();
        if (ts.getCols() != 1 || ts.getRows() != stacked) {
            throw new SizeMismatchException("Cone bound of shape " + ts + " does not match body of shape "
                + x.getShape() + " along " + axis);
        }
        return new Relation(Kind.SOC, Arrays.asList(t, x), axis);
    }

    /**
     * Single cone {@code ||vec(x)||_2 <= t} for a scalar t.
     * @param t Scalar bound
     * @param x Cone body
     * @return Relation
     */
    public static Relation soc(Expression t, Expression x) {
        if (!t.isScalar()) {
            throw new SizeMismatchException("Cone bound must be scalar, got " + t.getShape());
        }
        return soc(t, x.getShape().getCols() == 1 ? x : Atoms.vec(x), SOCAxis.Axis.COLUMNS);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the expressions of this relation: {@code lhs - rhs} for (in)equalities,
     * {@code t, x} for cone blocks.
     * @return Expressions
     */
    public List<Expression> getArgs() {
        return args;
    }

    /**
     * Gets the stacking axis of a cone block.
     * @return Axis, or null for (in)equalities
     */
    public SOCAxis.Axis getAxis() {
        return axis;
    }

    /**
     * Checks whether this relation describes a convex set.
     * @return true if affine == affine, convex <= concave, or a cone over affine
     *         expressions
     */
    public boolean isDcp() {
        switch (kind) {
            case EQUAL:
                return args.get(0).isAffine();
            case LESS_EQUAL:
                return args.get(0).isConvex();
            default:
                return args.get(0).isAffine() && args.get(1).isAffine();
        }
    }

    public Set<Variable> variables() {
        Set<Variable> out = new LinkedHashSet<>();
        for (Expression arg : args) {
            out.addAll(arg.variables());
        }
        return out;
    }

    public Set<Parameter> parameters() {
        Set<Parameter> out = new LinkedHashSet<>();
        for (Expression arg : args) {
            out.addAll(arg.parameters());
        }
        return out;
    }

    @Override
    public String toString() {
        switch (kind) {
            case EQUAL:
                return args.get(0) + " == 0";
            case LESS_EQUAL:
                return args.get(0) + " <= 0";
            default:
                return "soc(" + args.get(0) + ", " + args.get(1) + ", " + axis + ")";
        }
    }
}
