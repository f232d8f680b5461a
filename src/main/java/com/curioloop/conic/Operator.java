/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Rule table of composite operators.
 * <p>
 * Each operator defines, as pure functions of its arguments, the result shape,
 * the sign rule, its own curvature, its monotonicity in each argument, numeric
 * evaluation, and a graph implementation that rewrites it into affine
 * expressions plus cone constraints. Affine operators rewrite directly;
 * nonlinear ones introduce an auxiliary variable {@code t} and constrain it in
 * epigraph (convex) or hypograph (concave) form.
 * </p>
 *
 * <h2>Catalog</h2>
 * <pre>
 *   operator      curvature  sign         graph implementation
 *   ADD           affine     sum          sum of promoted operands
 *   NEGATE        affine     negated      -x
 *   MULTIPLY      affine     product      A * x, A constant
 *   SUM_ENTRIES   affine     arg          1' vec(x)
 *   TRANSPOSE     affine     arg          x'
 *   VEC           affine     arg          vec(x), column-major
 *   VSTACK        affine     join         [x1; x2; ...]
 *   INDEX         affine     arg          x[i, j]
 *   ABS           convex     positive     t >= x, t >= -x
 *   POS           convex     positive     t >= x, t >= 0
 *   NEG           convex     positive     t >= -x, t >= 0
 *   MAX_ENTRIES   convex     arg          t >= x
 *   MIN_ENTRIES   concave    arg          t <= x
 *   NORM2         convex     positive     ||vec(x)|| <= t
 *   NORM_INF      convex     positive     t >= x, t >= -x
 * </pre>
 */
public enum Operator {

    ADD {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, Integer.MAX_VALUE);
            Shape shape = Shape.scalar();
            for (Expression arg : args) {
                Shape s = arg.getShape();
                if (s.isScalar()) continue;
                if (shape.isScalar()) {
                    shape = s;
                } else if (!shape.equals(s)) {
                    throw new SizeMismatchException("Cannot add " + shape + " and " + s);
                }
            }
            return shape;
        }

        @Override
        Sign sign(List<Expression> args) {
            Sign sign = Sign.ZERO;
            for (Expression arg : args) {
                sign = sign.add(arg.getSign());
            }
            return sign;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix sum = values.get(0);
            for (int i = 1; i < values.size(); i++) {
                sum = sum.add(values.get(i));
            }
            return sum;
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            List<AffineExpr> terms = new ArrayList<>(args.size());
            for (AffineExpr arg : args) {
                terms.add(AffineExpr.promote(arg, atom.getShape()));
            }
            return AffineExpr.sum(terms);
        }
    },

    NEGATE {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return args.get(0).getShape();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign().negate();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.DECREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return values.get(0).negate();
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.negate(args.get(0));
        }
    },

    /**
     * Product with a constant left operand. A scalar on either side scales the
     * other operand; otherwise this is the matrix product.
     */
    MULTIPLY {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 2, 2);
            Shape lhs = args.get(0).getShape();
            Shape rhs = args.get(1).getShape();
            if (lhs.isScalar()) return rhs;
            if (rhs.isScalar()) return lhs;
            if (lhs.getCols() != rhs.getRows()) {
                throw new SizeMismatchException("Cannot multiply " + lhs + " by " + rhs);
            }
            return Shape.of(lhs.getRows(), rhs.getCols());
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign().multiply(args.get(1).getSign());
        }

        @Override
        Curvature curvature(List<Expression> args) {
            // only a constant left operand keeps the product affine
            return args.get(0).isConstant() ? Curvature.AFFINE : Curvature.UNKNOWN;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return index == 1 ? Monotonicity.ofScaling(args.get(0).getSign()) : Monotonicity.NONMONOTONIC;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix lhs = values.get(0);
            Matrix rhs = values.get(1);
            return rhs.size() == 1 && lhs.size() != 1 ? rhs.multiply(lhs) : lhs.multiply(rhs);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr lhs = args.get(0);
            AffineExpr rhs = args.get(1);
            if (rhs.getShape().isScalar() && !lhs.getShape().isScalar()) {
                return AffineExpr.reshape(AffineExpr.multiply(AffineExpr.vec(lhs), rhs), atom.getShape());
            }
            return AffineExpr.multiply(lhs, rhs);
        }
    },

    SUM_ENTRIES {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix x = values.get(0);
            double sum = 0;
            for (int i = 0; i < x.size(); i++) {
                sum += x.get(i);
            }
            return Matrix.scalar(sum);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.sumEntries(args.get(0));
        }
    },

    TRANSPOSE {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return args.get(0).getShape().transpose();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return values.get(0).transpose();
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.transpose(args.get(0));
        }
    },

    VEC {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.of(args.get(0).getShape().size(), 1);
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return Matrix.column(values.get(0).toArray());
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.vec(args.get(0));
        }
    },

    VSTACK {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, Integer.MAX_VALUE);
            int cols = args.get(0).getShape().getCols();
            int rows = 0;
            for (Expression arg : args) {
                if (arg.getShape().getCols() != cols) {
                    throw new SizeMismatchException("Cannot stack " + arg.getShape() + " under blocks with "
                        + cols + " columns");
                }
                rows += arg.getShape().getRows();
            }
            return Shape.of(rows, cols);
        }

        @Override
        Sign sign(List<Expression> args) {
            Sign sign = args.get(0).getSign();
            for (int i = 1; i < args.size(); i++) {
                sign = sign.join(args.get(i).getSign());
            }
            return sign;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Shape shape = atom.getShape();
            double[] out = new double[shape.size()];
            int offset = 0;
            for (Matrix block : values) {
                for (int i = 0; i < block.getRows(); i++) {
                    for (int j = 0; j < block.getCols(); j++) {
                        out[offset + i + shape.getRows() * j] = block.get(i, j);
                    }
                }
                offset += block.getRows();
            }
            return Matrix.of(shape.getRows(), shape.getCols(), out);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.vstack(args);
        }
    },

    /**
     * Selects entry (row, col); the position is carried as two attributes.
     */
    INDEX {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            Shape shape = args.get(0).getShape();
            if (attributes.length != 2 || attributes[0] < 0 || attributes[0] >= shape.getRows()
                    || attributes[1] < 0 || attributes[1] >= shape.getCols()) {
                throw new SizeMismatchException("Index outside " + shape);
            }
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.AFFINE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return Matrix.scalar(values.get(0).get(atom.getAttribute(0), atom.getAttribute(1)));
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            return AffineExpr.index(args.get(0), atom.getAttribute(0), atom.getAttribute(1));
        }
    },

    ABS {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return args.get(0).getShape();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).isZero() ? Sign.ZERO : Sign.POSITIVE;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.ofSymmetric(args.get(0).getSign());
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return map(values.get(0), Math::abs);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr x = args.get(0);
            AffineExpr t = graph.newVariable(atom.getShape());
            graph.greaterOrEqual(t, x);
            graph.greaterOrEqual(t, AffineExpr.negate(x));
            return t;
        }
    },

    /**
     * Elementwise {@code max(x, 0)}.
     */
    POS {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return args.get(0).getShape();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).isNegative() ? Sign.ZERO : Sign.POSITIVE;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return map(values.get(0), v -> Math.max(v, 0.0));
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr t = graph.newVariable(atom.getShape());
            graph.greaterOrEqual(t, args.get(0));
            graph.nonNegative(t);
            return t;
        }
    },

    /**
     * Elementwise {@code max(-x, 0)}.
     */
    NEG {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return args.get(0).getShape();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).isPositive() ? Sign.ZERO : Sign.POSITIVE;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.DECREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            return map(values.get(0), v -> Math.max(-v, 0.0));
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr t = graph.newVariable(atom.getShape());
            graph.greaterOrEqual(t, AffineExpr.negate(args.get(0)));
            graph.nonNegative(t);
            return t;
        }
    },

    MAX_ENTRIES {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix x = values.get(0);
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < x.size(); i++) {
                max = Math.max(max, x.get(i));
            }
            return Matrix.scalar(max);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr x = args.get(0);
            AffineExpr t = graph.newVariable(Shape.scalar());
            graph.greaterOrEqual(AffineExpr.promote(t, x.getShape()), x);
            return t;
        }
    },

    MIN_ENTRIES {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return args.get(0).getSign();
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONCAVE;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.INCREASING;
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix x = values.get(0);
            double min = Double.POSITIVE_INFINITY;
            for (int i = 0; i < x.size(); i++) {
                min = Math.min(min, x.get(i));
            }
            return Matrix.scalar(min);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr x = args.get(0);
            AffineExpr t = graph.newVariable(Shape.scalar());
            graph.greaterOrEqual(x, AffineExpr.promote(t, x.getShape()));
            return t;
        }
    },

    /**
     * Euclidean norm of all entries (Frobenius norm for matrices).
     */
    NORM2 {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return Sign.POSITIVE;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.ofSymmetric(args.get(0).getSign());
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix x = values.get(0);
            double sum = 0;
            for (int i = 0; i < x.size(); i++) {
                sum += x.get(i) * x.get(i);
            }
            return Matrix.scalar(Math.sqrt(sum));
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr t = graph.newVariable(Shape.scalar());
            graph.secondOrderCone(t, AffineExpr.vec(args.get(0)), SOCAxis.Axis.COLUMNS);
            return t;
        }
    },

    NORM_INF {
        @Override
        Shape shape(List<Expression> args, int[] attributes) {
            requireArity(args, 1, 1);
            return Shape.scalar();
        }

        @Override
        Sign sign(List<Expression> args) {
            return Sign.POSITIVE;
        }

        @Override
        Curvature curvature(List<Expression> args) {
            return Curvature.CONVEX;
        }

        @Override
        Monotonicity monotonicity(List<Expression> args, int index) {
            return Monotonicity.ofSymmetric(args.get(0).getSign());
        }

        @Override
        Matrix evaluate(Atom atom, List<Matrix> values) {
            Matrix x = values.get(0);
            double max = 0;
            for (int i = 0; i < x.size(); i++) {
                max = Math.max(max, Math.abs(x.get(i)));
            }
            return Matrix.scalar(max);
        }

        @Override
        AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph) {
            AffineExpr x = args.get(0);
            AffineExpr t = graph.newVariable(Shape.scalar());
            AffineExpr bound = AffineExpr.promote(t, x.getShape());
            graph.greaterOrEqual(bound, x);
            graph.greaterOrEqual(bound, AffineExpr.negate(x));
            return t;
        }
    };

    /**
     * Computes and validates the result shape.
     * @param args Arguments
     * @param attributes Operator-specific integer attributes
     * @return Result shape
     * @throws SizeMismatchException if the operands are incompatible
     */
    abstract Shape shape(List<Expression> args, int[] attributes);

    /**
     * Sign of the result from the argument signs.
     */
    abstract Sign sign(List<Expression> args);

    /**
     * Curvature of the operator itself, before composition with its arguments.
     */
    abstract Curvature curvature(List<Expression> args);

    /**
     * Monotonicity in argument {@code index}; may depend on argument signs.
     */
    abstract Monotonicity monotonicity(List<Expression> args, int index);

    /**
     * Numeric value from argument values.
     */
    abstract Matrix evaluate(Atom atom, List<Matrix> values);

    /**
     * Rewrites the operator applied to canonical arguments. New auxiliary
     * variables and constraints are obtained from {@code graph}.
     *
     * @param atom Node being canonicalized
     * @param args Canonical affine arguments, in argument order
     * @param graph Canonicalizer receiving auxiliary variables and constraints
     * @return Affine expression of the node's shape
     */
    abstract AffineExpr graphImplementation(Atom atom, List<AffineExpr> args, Canonicalizer graph);

    private static void requireArity(List<Expression> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new IllegalArgumentException("Wrong number of arguments: " + args.size());
        }
    }

    private static Matrix map(Matrix x, DoubleUnaryOperator f) {
        double[] out = x.toArray();
        for (int i = 0; i < out.length; i++) {
            out[i] = f.applyAsDouble(out[i]);
        }
        return Matrix.of(x.getRows(), x.getCols(), out);
    }
}
