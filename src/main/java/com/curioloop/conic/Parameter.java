/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Leaf standing for a constant whose value may change between solves.
 * <p>
 * A parameter has a fixed id, shape and declared sign. Its value is the only
 * part of a model that is mutable after construction. Canonical structure never
 * depends on the value: it is read when the problem is assembled, so one
 * canonicalization serves any number of re-solves.
 * </p>
 * <pre>{@code
 * Parameter p = context.parameter(3, 1, "NEGATIVE");
 * p.setValue(-1, -2, -3);
 * p.isNegative();   // true
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. Value updates must not overlap an
 * assembly reading the same parameter.
 * </p>
 */
public class Parameter extends Leaf {

    /** Prefix of generated parameter names */
    public static final String NAME_PREFIX = "param";

    private final int id;
    private final ModelContext context;
    private final Shape shape;
    private final String name;
    private final Sign declaredSign;
    private Matrix value;

    Parameter(int id, ModelContext context, Shape shape, String name, Sign declaredSign) {
        if (shape == null) {
            throw new ValidationException("Parameter shape must not be null");
        }
        this.id = id;
        this.context = context;
        this.shape = shape;
        this.name = name != null ? name : NAME_PREFIX + id;
        this.declaredSign = declaredSign != null ? declaredSign : Sign.UNKNOWN;
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

    /**
     * Gets the sign this parameter was declared with.
     * @return Declared sign
     */
    public Sign getDeclaredSign() {
        return declaredSign;
    }

    @Override
    public Shape getShape() {
        return shape;
    }

    @Override
    public Sign getSign() {
        return declaredSign;
    }

    @Override
    public Matrix value() {
        return value;
    }

    /**
     * Checks if a value has been assigned.
     * @return true if {@link #value()} is not null
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * Assigns a new value after validating it against the declared shape and
     * sign. On failure the previous value is kept.
     *
     * @param newValue New value
     * @throws ValidationException if the value does not conform
     */
    public void setValue(Matrix newValue) {
        this.value = validate(newValue);
    }

    /**
     * Assigns a vector value; a single entry is a scalar.
     * @param entries Entries of an n x 1 value
     * @throws ValidationException if the value does not conform
     */
    public void setValue(double... entries) {
        setValue(entries != null && entries.length == 1 ? Matrix.scalar(entries[0]) : Matrix.column(entries));
    }

    /**
     * Checks a candidate value against the declaration.
     * @param candidate Candidate value
     * @return The candidate, unchanged
     * @throws ValidationException if the value is missing, non-finite, of the
     *         wrong shape, or violates a POSITIVE/NEGATIVE declaration
     */
    protected Matrix validate(Matrix candidate) {
        if (candidate == null) {
            throw new ValidationException("Value of " + name + " must not be null");
        }
        if (!candidate.isFinite()) {
            throw new ValidationException("Value of " + name + " must contain only finite numeric entries");
        }
        if (!candidate.getShape().equals(shape)) {
            throw new ValidationException("Value of " + name + " has shape " + candidate.getShape()
                + " but " + shape + " was declared");
        }
        Sign actual = Sign.fromValue(candidate);
        if (declaredSign == Sign.POSITIVE && !actual.isPositive()) {
            throw new ValidationException("Value of " + name + " must be non-negative");
        }
        if (declaredSign == Sign.NEGATIVE && !actual.isNegative()) {
            throw new ValidationException("Value of " + name + " must be non-positive");
        }
        return candidate;
    }

    @Override
    Matrix evaluate(Function<Parameter, Matrix> parameters) {
        return parameters.apply(this);
    }

    @Override
    public CanonicalForm canonicalize() {
        return CanonicalForm.of(AffineExpr.parameter(this));
    }

    @Override
    public Map<String, Object> getData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("rows", shape.getRows());
        data.put("cols", shape.getCols());
        data.put("name", name);
        data.put("sign", declaredSign);
        data.put("value", value);
        return Collections.unmodifiableMap(data);
    }

    @Override
    public String toString() {
        return "Parameter(" + shape.getRows() + ", " + shape.getCols() + ", sign = " + declaredSign + ")";
    }
}
