/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Affine map from the global variable vector, kept as an immutable tree of
 * linear operators.
 * <p>
 * Parameters appear as symbolic {@link Kind#PARAMETER} references, so the tree
 * is independent of parameter values; numbers are bound only when a problem is
 * assembled. Every factory checks operand shapes and fails with
 * {@link SizeMismatchException} on disagreement.
 * </p>
 */
public final class AffineExpr {

    /**
     * Linear operator kinds.
     */
    public enum Kind {
        /** Identity reference to a variable's entries */
        VARIABLE,
        /** Symbolic reference to a parameter's value */
        PARAMETER,
        /** Fixed numeric value */
        CONSTANT,
        /** Elementwise sum of equally shaped operands */
        SUM,
        /** Elementwise negation */
        NEGATE,
        /** Constant left operand times affine right operand */
        MULTIPLY,
        /** Scalar broadcast to a shape */
        PROMOTE,
        /** Sum of all entries */
        SUM_ENTRIES,
        /** Transpose */
        TRANSPOSE,
        /** Column-major reshape to a shape with the same number of entries */
        RESHAPE,
        /** Row-wise concatenation */
        VSTACK,
        /** Single entry selection */
        INDEX
    }

    private final Kind kind;
    private final Shape shape;
    private final List<AffineExpr> args;
    private final int variableId;
    private final Parameter parameter;
    private final Matrix constant;
    private final int row;
    private final int col;

    private AffineExpr(Kind kind, Shape shape, List<AffineExpr> args,
                       int variableId, Parameter parameter, Matrix constant, int row, int col) {
        this.kind = kind;
        this.shape = shape;
        this.args = args;
        this.variableId = variableId;
        this.parameter = parameter;
        this.constant = constant;
        this.row = row;
        this.col = col;
    }

    private static AffineExpr node(Kind kind, Shape shape, AffineExpr... args) {
        return new AffineExpr(kind, shape, Collections.unmodifiableList(Arrays.asList(args)), 0, null, null, -1, -1);
    }

    public static AffineExpr variable(int variableId, Shape shape) {
        return new AffineExpr(Kind.VARIABLE, shape, Collections.emptyList(), variableId, null, null, -1, -1);
    }

    public static AffineExpr parameter(Parameter parameter) {
        return new AffineExpr(Kind.PARAMETER, parameter.getShape(), Collections.emptyList(), 0, parameter, null, -1, -1);
    }

    public static AffineExpr constant(Matrix value) {
        return new AffineExpr(Kind.CONSTANT, value.getShape(), Collections.emptyList(), 0, null, value, -1, -1);
    }

    public static AffineExpr scalar(double value) {
        return constant(Matrix.scalar(value));
    }

    /**
     * Sum of operands that already share one shape.
     * @param terms Operands
     * @return Sum
     */
    public static AffineExpr sum(List<AffineExpr> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Sum needs at least one term");
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        Shape shape = terms.get(0).shape;
        for (AffineExpr term : terms) {
            requireShape(term, shape, "sum");
        }
        return node(Kind.SUM, shape, terms.toArray(new AffineExpr[0]));
    }

    public static AffineExpr sum(AffineExpr a, AffineExpr b) {
        return sum(Arrays.asList(a, b));
    }

    public static AffineExpr negate(AffineExpr arg) {
        return node(Kind.NEGATE, arg.shape, arg);
    }

    /**
     * {@code a - b}, broadcasting a scalar operand.
     * @param a Minuend
     * @param b Subtrahend
     * @return Difference
     */
    public static AffineExpr subtract(AffineExpr a, AffineExpr b) {
        Shape shape = a.shape.isScalar() ? b.shape : a.shape;
        return sum(promote(a, shape), negate(promote(b, shape)));
    }

    /**
     * Product of a constant left operand and an affine right operand. A scalar
     * left operand scales the right one.
     * @param lhs Left operand, must not depend on variables
     * @param rhs Right operand
     * @return Product
     */
    public static AffineExpr multiply(AffineExpr lhs, AffineExpr rhs) {
        if (!lhs.isConstant()) {
            throw new DcpViolationException("Left operand of a product must not depend on variables");
        }
        Shape shape;
        if (lhs.shape.isScalar()) {
            shape = rhs.shape;
        } else if (lhs.shape.getCols() == rhs.shape.getRows()) {
            shape = Shape.of(lhs.shape.getRows(), rhs.shape.getCols());
        } else {
            throw new SizeMismatchException("Cannot multiply " + lhs.shape + " by " + rhs.shape);
        }
        return node(Kind.MULTIPLY, shape, lhs, rhs);
    }

    /**
     * Broadcasts a scalar to a shape; returns the argument if it already has it.
     * @param arg Operand
     * @param shape Target shape
     * @return Promoted operand
     */
    public static AffineExpr promote(AffineExpr arg, Shape shape) {
        if (arg.shape.equals(shape)) {
            return arg;
        }
        if (!arg.shape.isScalar()) {
            throw new SizeMismatchException("Cannot promote " + arg.shape + " to " + shape);
        }
        return node(Kind.PROMOTE, shape, arg);
    }

    public static AffineExpr sumEntries(AffineExpr arg) {
        return node(Kind.SUM_ENTRIES, Shape.scalar(), arg);
    }

    public static AffineExpr transpose(AffineExpr arg) {
        return node(Kind.TRANSPOSE, arg.shape.transpose(), arg);
    }

    public static AffineExpr reshape(AffineExpr arg, Shape shape) {
        if (arg.shape.equals(shape)) {
            return arg;
        }
        if (arg.shape.size() != shape.size()) {
            throw new SizeMismatchException("Cannot reshape " + arg.shape + " to " + shape);
        }
        return node(Kind.RESHAPE, shape, arg);
    }

    /**
     * Column-major vectorization.
     * @param arg Operand
     * @return n x 1 expression
     */
    public static AffineExpr vec(AffineExpr arg) {
        return reshape(arg, Shape.of(arg.shape.size(), 1));
    }

    public static AffineExpr vstack(List<AffineExpr> blocks) {
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("Stack needs at least one block");
        }
        if (blocks.size() == 1) {
            return blocks.get(0);
        }
        int cols = blocks.get(0).shape.getCols();
        int rows = 0;
        for (AffineExpr block : blocks) {
            if (block.shape.getCols() != cols) {
                throw new SizeMismatchException("Cannot stack " + block.shape + " under blocks with " + cols + " columns");
            }
            rows += block.shape.getRows();
        }
        return node(Kind.VSTACK, Shape.of(rows, cols), blocks.toArray(new AffineExpr[0]));
    }

    public static AffineExpr index(AffineExpr arg, int row, int col) {
        if (row < 0 || row >= arg.shape.getRows() || col < 0 || col >= arg.shape.getCols()) {
            throw new SizeMismatchException("Index (" + row + ", " + col + ") outside " + arg.shape);
        }
        return new AffineExpr(Kind.INDEX, Shape.scalar(), Collections.singletonList(arg), 0, null, null, row, col);
    }

    private static void requireShape(AffineExpr expr, Shape shape, String op) {
        if (!expr.shape.equals(shape)) {
            throw new SizeMismatchException("Operand of " + op + " has shape " + expr.shape + ", expected " + shape);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public Shape getShape() {
        return shape;
    }

    public List<AffineExpr> getArgs() {
        return args;
    }

    /**
     * Gets the referenced variable id.
     * @return Id for {@link Kind#VARIABLE} nodes, 0 otherwise
     */
    public int getVariableId() {
        return variableId;
    }

    /**
     * Gets the referenced parameter.
     * @return Parameter for {@link Kind#PARAMETER} nodes, null otherwise
     */
    public Parameter getParameter() {
        return parameter;
    }

    /**
     * Gets the fixed value.
     * @return Value for {@link Kind#CONSTANT} nodes, null otherwise
     */
    public Matrix getConstant() {
        return constant;
    }

    /** Row selected by an {@link Kind#INDEX} node. */
    public int getRow() {
        return row;
    }

    /** Column selected by an {@link Kind#INDEX} node. */
    public int getCol() {
        return col;
    }

    /**
     * Checks that no variable appears in this tree.
     * @return true if constant
     */
    public boolean isConstant() {
        if (kind == Kind.VARIABLE) {
            return false;
        }
        for (AffineExpr arg : args) {
            if (!arg.isConstant()) return false;
        }
        return true;
    }

    /**
     * Collects the ids of variables referenced in this tree.
     * @return Distinct ids in order of first appearance
     */
    public Set<Integer> variableIds() {
        Set<Integer> out = new LinkedHashSet<>();
        collect(this, out, null);
        return out;
    }

    /**
     * Collects parameters referenced in this tree.
     * @return Distinct parameters in order of first appearance
     */
    public Set<Parameter> parameters() {
        Set<Parameter> out = new LinkedHashSet<>();
        collect(this, null, out);
        return out;
    }

    private static void collect(AffineExpr node, Set<Integer> vars, Set<Parameter> params) {
        if (node.kind == Kind.VARIABLE && vars != null) {
            vars.add(node.variableId);
        } else if (node.kind == Kind.PARAMETER && params != null) {
            params.add(node.parameter);
        }
        for (AffineExpr arg : node.args) {
            collect(arg, vars, params);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case VARIABLE:
                return "var" + variableId;
            case PARAMETER:
                return parameter.getName();
            case CONSTANT:
                return constant.getShape().isScalar() ? String.valueOf(constant.get(0)) : "const" + shape;
            case INDEX:
                return args.get(0) + "[" + row + ", " + col + "]";
            default:
                List<String> parts = new ArrayList<>();
                for (AffineExpr arg : args) {
                    parts.add(arg.toString());
                }
                return kind.name().toLowerCase(Locale.ROOT) + "(" + String.join(", ", parts) + ")";
        }
    }
}
