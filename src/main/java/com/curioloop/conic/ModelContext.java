/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.function.Supplier;

/**
 * Modeling session: the single place leaves obtain their ids from.
 * <p>
 * Separate contexts never share ids, so independent models can be built side
 * by side. Canonicalization allocates auxiliary variables and constraint ids
 * from the context of the problem being canonicalized.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. A context and every model built from
 * it must be used by one thread at a time.
 * </p>
 */
public final class ModelContext {

    private final IdAllocator ids;

    public ModelContext() {
        this(new IdAllocator());
    }

    public ModelContext(IdAllocator ids) {
        if (ids == null) {
            throw new IllegalArgumentException("Allocator cannot be null");
        }
        this.ids = ids;
    }

    /**
     * Allocates a fresh id.
     * @return Id strictly greater than every id issued before
     */
    public int nextId() {
        return ids.nextId();
    }

    public IdAllocator getAllocator() {
        return ids;
    }

    public Variable variable() {
        return variable(1, 1);
    }

    public Variable variable(int rows) {
        return variable(rows, 1);
    }

    public Variable variable(int rows, int cols) {
        return variable(rows, cols, null);
    }

    /**
     * Creates a variable.
     * @param rows Number of rows
     * @param cols Number of columns
     * @param name Name, or null for a generated one
     * @return New variable
     * @throws ValidationException if a dimension is not positive
     */
    public Variable variable(int rows, int cols, String name) {
        Shape shape = Shape.of(rows, cols);
        return new Variable(ids.nextId(), this, shape, name);
    }

    Variable variable(Shape shape) {
        return new Variable(ids.nextId(), this, shape, null);
    }

    public Parameter parameter(int rows, int cols) {
        return parameter(rows, cols, null, Sign.UNKNOWN, null);
    }

    public Parameter parameter(int rows, int cols, Sign sign) {
        return parameter(rows, cols, null, sign, null);
    }

    /**
     * Creates a parameter with a sign given by name.
     * @param rows Number of rows
     * @param cols Number of columns
     * @param sign One of ZERO, POSITIVE, NEGATIVE, UNKNOWN (case-insensitive)
     * @return New parameter without a value
     * @throws SignDeclarationException if the sign name is invalid
     */
    public Parameter parameter(int rows, int cols, String sign) {
        return parameter(rows, cols, null, Sign.parse(sign), null);
    }

    /**
     * Creates a parameter.
     * @param rows Number of rows
     * @param cols Number of columns
     * @param name Name, or null for a generated one
     * @param sign Declared sign
     * @param initialValue Initial value, or null to leave it unset
     * @return New parameter
     * @throws ValidationException if a dimension is not positive or the
     *         initial value does not conform
     */
    public Parameter parameter(int rows, int cols, String name, Sign sign, Matrix initialValue) {
        Shape shape = Shape.of(rows, cols);
        Parameter parameter = new Parameter(ids.nextId(), this, shape, name, sign);
        if (initialValue != null) {
            parameter.setValue(initialValue);
        }
        return parameter;
    }

    public CallbackParam callbackParam(Supplier<Matrix> callback, int rows, int cols) {
        return callbackParam(callback, rows, cols, null, Sign.UNKNOWN);
    }

    /**
     * Creates a callback parameter.
     * @param callback Value source, invoked on every read
     * @param rows Number of rows
     * @param cols Number of columns
     * @param name Name, or null for a generated one
     * @param sign Declared sign
     * @return New callback parameter
     */
    public CallbackParam callbackParam(Supplier<Matrix> callback, int rows, int cols, String name, Sign sign) {
        Shape shape = Shape.of(rows, cols);
        return new CallbackParam(ids.nextId(), this, callback, shape, name, sign);
    }

    /**
     * Creates a callback parameter with a sign given by name.
     * @param callback Value source, invoked on every read
     * @param rows Number of rows
     * @param cols Number of columns
     * @param sign One of ZERO, POSITIVE, NEGATIVE, UNKNOWN (case-insensitive)
     * @return New callback parameter
     * @throws SignDeclarationException if the sign name is invalid
     */
    public CallbackParam callbackParam(Supplier<Matrix> callback, int rows, int cols, String sign) {
        return callbackParam(callback, rows, cols, null, Sign.parse(sign));
    }

    /**
     * Creates a parameter standing for a constant subexpression.
     * @param source Expression whose curvature is constant
     * @return Callback parameter evaluating the subexpression
     */
    CallbackParam derivedParam(Expression source) {
        return new CallbackParam(ids.nextId(), this, source);
    }
}
