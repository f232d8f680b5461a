/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Composite node: an {@link Operator} applied to an ordered list of children.
 * <p>
 * Shape is validated at construction. Sign and curvature are computed from
 * the children's annotations only:
 * {@code curvature = sum_i compose(curvature(op), monotonicity(op, i), curvature(arg_i))}.
 * Instances are created through {@link Atoms}.
 * </p>
 */
public final class Atom extends Expression {

    private final Operator operator;
    private final List<Expression> args;
    private final int[] attributes;
    private final Shape shape;
    private final Sign sign;
    private final Curvature curvature;

    Atom(Operator operator, List<Expression> args, int... attributes) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator cannot be null");
        }
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException(operator + " needs at least one argument");
        }
        for (Expression arg : args) {
            if (arg == null) {
                throw new IllegalArgumentException("Arguments of " + operator + " cannot be null");
            }
        }
        this.operator = operator;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.attributes = attributes != null ? attributes.clone() : new int[0];
        this.shape = operator.shape(this.args, this.attributes);
        this.sign = operator.sign(this.args);
        this.curvature = inferCurvature();
    }

    private Curvature inferCurvature() {
        Curvature function = operator.curvature(args);
        Curvature result = Curvature.CONSTANT;
        for (int i = 0; i < args.size(); i++) {
            result = result.add(Curvature.compose(function, operator.monotonicity(args, i), args.get(i).getCurvature()));
        }
        return result;
    }

    public Operator getOperator() {
        return operator;
    }

    @Override
    public List<Expression> getArgs() {
        return args;
    }

    /**
     * Gets an operator-specific integer attribute, such as an index position.
     * @param i Attribute position
     * @return Attribute value
     */
    public int getAttribute(int i) {
        return attributes[i];
    }

    @Override
    public Shape getShape() {
        return shape;
    }

    @Override
    public Sign getSign() {
        return sign;
    }

    @Override
    public Curvature getCurvature() {
        return curvature;
    }

    @Override
    public Matrix value() {
        return evaluate(Parameter::value);
    }

    @Override
    Matrix evaluate(Function<Parameter, Matrix> parameters) {
        List<Matrix> values = new ArrayList<>(args.size());
        for (Expression arg : args) {
            Matrix v = arg.evaluate(parameters);
            if (v == null) {
                return null;
            }
            values.add(v);
        }
        return operator.evaluate(this, values);
    }

    /**
     * Verifies the composition rule for this node.
     * @throws DcpViolationException naming the first argument whose curvature
     *         the operator cannot accept
     */
    void checkDcp() {
        if (curvature.isDcp()) {
            return;
        }
        Curvature function = operator.curvature(args);
        for (int i = 0; i < args.size(); i++) {
            Expression arg = args.get(i);
            Monotonicity m = operator.monotonicity(args, i);
            if (!Curvature.compose(function, m, arg.getCurvature()).isDcp()) {
                throw new DcpViolationException(operator + " is " + function + " and " + m
                    + " in argument " + i + ", which is " + arg.getCurvature() + ": " + this);
            }
        }
        throw new DcpViolationException(operator + " combines arguments of incompatible curvature: " + this);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(args.size());
        for (Expression arg : args) {
            parts.add(arg.toString());
        }
        String attrs = attributes.length > 0 ? ", " + Arrays.toString(attributes) : "";
        return operator.name().toLowerCase(Locale.ROOT) + "(" + String.join(", ", parts) + attrs + ")";
    }
}
