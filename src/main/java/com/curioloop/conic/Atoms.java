/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Arrays;
import java.util.Collections;

/**
 * Factory methods for composite expressions.
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * ModelContext ctx = new ModelContext();
 * Variable x = ctx.variable(3);
 * Parameter a = ctx.parameter(1, 3);
 *
 * Expression fit = Atoms.norm2(Atoms.subtract(Atoms.multiply(a, x), Constant.scalar(1)));
 * fit.isConvex();   // true
 * }</pre>
 */
public final class Atoms {

    private Atoms() {}

    public static Expression add(Expression... terms) {
        return new Atom(Operator.ADD, Arrays.asList(terms));
    }

    public static Expression subtract(Expression a, Expression b) {
        return add(a, negate(b));
    }

    public static Expression negate(Expression x) {
        return new Atom(Operator.NEGATE, Collections.singletonList(x));
    }

    /**
     * Product of two expressions, at least one of which must be constant for
     * the result to be usable in a convex model. A constant right operand is
     * moved to the left, transposing when both operands are matrices.
     * @param a Left operand
     * @param b Right operand
     * @return Product
     */
    public static Expression multiply(Expression a, Expression b) {
        if (!a.isConstant() && b.isConstant()) {
            if (a.isScalar() || b.isScalar()) {
                return new Atom(Operator.MULTIPLY, Arrays.asList(b, a));
            }
            // a * B = (B' * a')'
            return transpose(new Atom(Operator.MULTIPLY, Arrays.asList(transpose(b), transpose(a))));
        }
        return new Atom(Operator.MULTIPLY, Arrays.asList(a, b));
    }

    public static Expression multiply(double k, Expression x) {
        return multiply(Constant.scalar(k), x);
    }

    public static Expression sumEntries(Expression x) {
        return new Atom(Operator.SUM_ENTRIES, Collections.singletonList(x));
    }

    public static Expression transpose(Expression x) {
        return new Atom(Operator.TRANSPOSE, Collections.singletonList(x));
    }

    /**
     * Column-major vectorization.
     * @param x Operand
     * @return n x 1 expression
     */
    public static Expression vec(Expression x) {
        return new Atom(Operator.VEC, Collections.singletonList(x));
    }

    public static Expression vstack(Expression... blocks) {
        return new Atom(Operator.VSTACK, Arrays.asList(blocks));
    }

    /**
     * Selects a single entry.
     * @param x Operand
     * @param row Row index
     * @param col Column index
     * @return 1x1 expression
     */
    public static Expression index(Expression x, int row, int col) {
        return new Atom(Operator.INDEX, Collections.singletonList(x), row, col);
    }

    public static Expression abs(Expression x) {
        return new Atom(Operator.ABS, Collections.singletonList(x));
    }

    public static Expression pos(Expression x) {
        return new Atom(Operator.POS, Collections.singletonList(x));
    }

    public static Expression neg(Expression x) {
        return new Atom(Operator.NEG, Collections.singletonList(x));
    }

    public static Expression maxEntries(Expression x) {
        return new Atom(Operator.MAX_ENTRIES, Collections.singletonList(x));
    }

    public static Expression minEntries(Expression x) {
        return new Atom(Operator.MIN_ENTRIES, Collections.singletonList(x));
    }

    public static Expression norm2(Expression x) {
        return new Atom(Operator.NORM2, Collections.singletonList(x));
    }

    public static Expression normInf(Expression x) {
        return new Atom(Operator.NORM_INF, Collections.singletonList(x));
    }

    /**
     * Sum of absolute values of all entries.
     * @param x Operand
     * @return Scalar expression
     */
    public static Expression norm1(Expression x) {
        return sumEntries(abs(x));
    }

    /**
     * Largest of several scalar expressions.
     * @param terms Scalar operands
     * @return Scalar expression
     */
    public static Expression max(Expression... terms) {
        for (Expression term : terms) {
            if (!term.isScalar()) {
                throw new SizeMismatchException("max expects scalar operands, got " + term.getShape());
            }
        }
        return maxEntries(vstack(terms));
    }
}
