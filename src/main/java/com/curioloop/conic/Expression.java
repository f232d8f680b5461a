/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Node of a mathematical expression tree.
 * <p>
 * The hierarchy is closed: the only variants are the leaves {@link Constant},
 * {@link Parameter}, {@link CallbackParam} and {@link Variable}, and the
 * composite {@link Atom}, whose behavior is selected by its {@link Operator}.
 * Every node knows its shape, sign and curvature; sign and curvature of an
 * atom depend only on its direct children.
 * </p>
 */
public abstract class Expression {

    Expression() {}

    /**
     * Gets the (rows, cols) dimensions.
     * @return Shape
     */
    public abstract Shape getShape();

    /**
     * Gets the sign inferred for every entry.
     * @return Sign
     */
    public abstract Sign getSign();

    /**
     * Gets the curvature inferred for this node.
     * @return Curvature
     */
    public abstract Curvature getCurvature();

    /**
     * Evaluates the expression numerically.
     * @return Current value, or null if some leaf has no value yet
     */
    public abstract Matrix value();

    /**
     * Evaluates the expression with parameter values supplied by the caller.
     * @param parameters Value of each parameter leaf
     * @return Value, or null if some leaf has no value
     */
    Matrix evaluate(Function<Parameter, Matrix> parameters) {
        return value();
    }

    /**
     * Gets the ordered children of this node.
     * @return Children, empty for leaves
     */
    public List<Expression> getArgs() {
        return Collections.emptyList();
    }

    public boolean isPositive() {
        return getSign().isPositive();
    }

    public boolean isNegative() {
        return getSign().isNegative();
    }

    public boolean isZero() {
        return getSign().isZero();
    }

    public boolean isConstant() {
        return getCurvature().isConstant();
    }

    public boolean isAffine() {
        return getCurvature().isAffine();
    }

    public boolean isConvex() {
        return getCurvature().isConvex();
    }

    public boolean isConcave() {
        return getCurvature().isConcave();
    }

    public boolean isScalar() {
        return getShape().isScalar();
    }

    /**
     * Collects the variables in this tree, in order of first appearance.
     * @return Distinct variables
     */
    public Set<Variable> variables() {
        Set<Variable> out = new LinkedHashSet<>();
        collect(this, Variable.class, out);
        return out;
    }

    /**
     * Collects the parameters (including callback parameters) in this tree, in
     * order of first appearance.
     * @return Distinct parameters
     */
    public Set<Parameter> parameters() {
        Set<Parameter> out = new LinkedHashSet<>();
        collect(this, Parameter.class, out);
        return out;
    }

    private static <T> void collect(Expression node, Class<T> type, Set<T> out) {
        if (type.isInstance(node)) {
            out.add(type.cast(node));
        }
        for (Expression arg : node.getArgs()) {
            collect(arg, type, out);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getCurvature() + ", " + getSign() + ", " + getShape() + ")";
    }
}
