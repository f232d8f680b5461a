/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaf holding a fixed numeric value.
 * <p>
 * Shape and sign are derived once from the value. A vector supplied as
 * {@code double...} becomes a column.
 * </p>
 * <pre>{@code
 * Constant five = Constant.scalar(5);        // (1, 1), POSITIVE
 * Constant eye = Constant.of(Matrix.identity(3));
 * }</pre>
 */
public final class Constant extends Leaf {

    private final Matrix value;
    private final boolean sparse;
    private final Sign sign;

    private Constant(Matrix value, boolean sparse) {
        if (value == null) {
            throw new ValidationException("Constant value must not be null");
        }
        if (!value.isFinite()) {
            throw new ValidationException("Constant value must contain only finite numeric entries");
        }
        this.value = value;
        this.sparse = sparse;
        this.sign = Sign.fromValue(value);
    }

    public static Constant of(Matrix value) {
        return new Constant(value, false);
    }

    /**
     * Creates a constant from a sparse value. The value is stored densely; the
     * sparse origin is kept for {@link #isSparse()}.
     * @param value Sparse value
     * @return Constant
     */
    public static Constant of(DMatrixSparseCSC value) {
        if (value == null) {
            throw new ValidationException("Constant value must not be null");
        }
        double[] data = new double[value.numRows * value.numCols];
        for (int j = 0; j < value.numCols; j++) {
            for (int p = value.col_idx[j]; p < value.col_idx[j + 1]; p++) {
                data[value.nz_rows[p] + value.numRows * j] += value.nz_values[p];
            }
        }
        return new Constant(Matrix.of(value.numRows, value.numCols, data), true);
    }

    public static Constant scalar(double value) {
        return new Constant(Matrix.scalar(value), false);
    }

    /**
     * Creates a column-vector constant.
     * @param values Entries
     * @return n x 1 constant
     */
    public static Constant column(double... values) {
        return new Constant(Matrix.column(values), false);
    }

    /**
     * Returns the argument unchanged if it is an expression, otherwise wraps a
     * number or matrix as a constant.
     * @param value Expression, Number, Matrix or DMatrixSparseCSC
     * @return Expression
     * @throws ValidationException for any other type
     */
    public static Expression as(Object value) {
        if (value instanceof Expression) return (Expression) value;
        if (value instanceof Number) return scalar(((Number) value).doubleValue());
        if (value instanceof Matrix) return of((Matrix) value);
        if (value instanceof DMatrixSparseCSC) return of((DMatrixSparseCSC) value);
        throw new ValidationException("Cannot convert " + (value == null ? "null" : value.getClass().getName())
            + " to a constant");
    }

    /**
     * Checks if the constant was created from a sparse value.
     * @return true if sparse
     */
    public boolean isSparse() {
        return sparse;
    }

    @Override
    public Matrix value() {
        return value;
    }

    @Override
    public Shape getShape() {
        return value.getShape();
    }

    @Override
    public Sign getSign() {
        return sign;
    }

    @Override
    public CanonicalForm canonicalize() {
        return CanonicalForm.of(AffineExpr.constant(value));
    }

    @Override
    public Map<String, Object> getData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("value", value);
        return Collections.unmodifiableMap(data);
    }
}
