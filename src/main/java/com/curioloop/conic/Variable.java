/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decision variable.
 * <p>
 * A variable occupies {@code rows * cols} consecutive columns of the assembled
 * problem, in column-major order. Its value is filled in when a solution is
 * unpacked.
 * </p>
 */
public final class Variable extends Leaf {

    /** Prefix of generated variable names */
    public static final String NAME_PREFIX = "var";

    private final int id;
    private final ModelContext context;
    private final Shape shape;
    private final String name;
    private Matrix value;

    Variable(int id, ModelContext context, Shape shape, String name) {
        if (shape == null) {
            throw new ValidationException("Variable shape must not be null");
        }
        this.id = id;
        this.context = context;
        this.shape = shape;
        this.name = name != null ? name : NAME_PREFIX + id;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public ModelContext getContext() {
        return context;
    }

    @Override
    public Shape getShape() {
        return shape;
    }

    @Override
    public Sign getSign() {
        return Sign.UNKNOWN;
    }

    @Override
    public Curvature getCurvature() {
        return Curvature.AFFINE;
    }

    /**
     * Gets the value from the most recent unpacked solution.
     * @return Value, or null before the first solve
     */
    @Override
    public Matrix value() {
        return value;
    }

    void assign(Matrix solution) {
        if (!solution.getShape().equals(shape)) {
            throw new SizeMismatchException("Solution for " + name + " has shape " + solution.getShape()
                + " but " + shape + " was declared");
        }
        this.value = solution;
    }

    @Override
    public CanonicalForm canonicalize() {
        return CanonicalForm.of(AffineExpr.variable(id, shape));
    }

    @Override
    public Map<String, Object> getData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("rows", shape.getRows());
        data.put("cols", shape.getCols());
        data.put("name", name);
        return Collections.unmodifiableMap(data);
    }

    @Override
    public String toString() {
        return "Variable(" + shape.getRows() + ", " + shape.getCols() + ", name = " + name + ")";
    }
}
