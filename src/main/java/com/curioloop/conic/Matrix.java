/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Arrays;

/**
 * Immutable dense matrix stored in column-major order.
 * <p>
 * Entry (i, j) lives at {@code data[i + rows * j]}, so the linear index used by
 * {@link #get(int)} is the vectorization order used throughout canonicalization
 * and assembly.
 * </p>
 */
public final class Matrix {

    private final int rows;
    private final int cols;
    private final double[] data;

    private Matrix(int rows, int cols, double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Creates a matrix from column-major data.
     * @param rows Number of rows
     * @param cols Number of columns
     * @param columnMajor Entries in column-major order (copied)
     * @return Matrix
     * @throws ValidationException if the data length is not rows * cols
     */
    public static Matrix of(int rows, int cols, double[] columnMajor) {
        Shape.of(rows, cols);
        if (columnMajor == null || columnMajor.length != rows * cols) {
            throw new ValidationException("Expected " + rows * cols + " entries for shape ("
                + rows + ", " + cols + ")");
        }
        return new Matrix(rows, cols, columnMajor.clone());
    }

    /**
     * Creates a matrix from row arrays.
     * @param rowData Rows, all of equal length
     * @return Matrix
     * @throws ValidationException if the rows are empty or ragged
     */
    public static Matrix fromRows(double[]... rowData) {
        if (rowData == null || rowData.length == 0 || rowData[0] == null || rowData[0].length == 0) {
            throw new ValidationException("Matrix must have at least one row and one column");
        }
        int r = rowData.length;
        int c = rowData[0].length;
        double[] data = new double[r * c];
        for (int i = 0; i < r; i++) {
            if (rowData[i] == null || rowData[i].length != c) {
                throw new ValidationException("Row " + i + " does not have " + c + " columns");
            }
            for (int j = 0; j < c; j++) {
                data[i + r * j] = rowData[i][j];
            }
        }
        return new Matrix(r, c, data);
    }

    /**
     * Creates a column vector.
     * @param values Entries
     * @return n x 1 matrix
     */
    public static Matrix column(double... values) {
        if (values == null || values.length == 0) {
            throw new ValidationException("Vector must have at least one entry");
        }
        return new Matrix(values.length, 1, values.clone());
    }

    public static Matrix scalar(double value) {
        return new Matrix(1, 1, new double[]{value});
    }

    public static Matrix zeros(int rows, int cols) {
        Shape.of(rows, cols);
        return new Matrix(rows, cols, new double[rows * cols]);
    }

    /**
     * Creates a matrix with every entry equal to the given value.
     * @param shape Shape
     * @param value Fill value
     * @return Matrix
     */
    public static Matrix filled(Shape shape, double value) {
        double[] data = new double[shape.size()];
        Arrays.fill(data, value);
        return new Matrix(shape.getRows(), shape.getCols(), data);
    }

    public static Matrix identity(int n) {
        Shape.of(n, n);
        double[] data = new double[n * n];
        for (int i = 0; i < n; i++) {
            data[i + n * i] = 1.0;
        }
        return new Matrix(n, n, data);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public Shape getShape() {
        return Shape.of(rows, cols);
    }

    /**
     * Gets the number of entries.
     * @return rows * cols
     */
    public int size() {
        return data.length;
    }

    /**
     * Gets an entry by column-major linear index.
     * @param index Linear index
     * @return Entry value
     */
    public double get(int index) {
        return data[index];
    }

    public double get(int row, int col) {
        return data[row + rows * col];
    }

    /**
     * Gets a copy of the column-major data.
     * @return Copy of entries
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Checks that every entry is a finite number.
     * @return true if no entry is NaN or infinite
     */
    public boolean isFinite() {
        for (double v : data) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    public Matrix transpose() {
        double[] out = new double[data.length];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[j + cols * i] = data[i + rows * j];
            }
        }
        return new Matrix(cols, rows, out);
    }

    public Matrix negate() {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = -data[i];
        }
        return new Matrix(rows, cols, out);
    }

    /**
     * Elementwise sum; a 1x1 operand is broadcast.
     * @param other Other operand
     * @return Sum
     */
    public Matrix add(Matrix other) {
        if (other.data.length == 1 && data.length != 1) {
            return other.add(this);
        }
        if (data.length == 1) {
            double[] out = other.data.clone();
            for (int i = 0; i < out.length; i++) {
                out[i] += data[0];
            }
            return new Matrix(other.rows, other.cols, out);
        }
        requireShape(other.rows, other.cols);
        double[] out = data.clone();
        for (int i = 0; i < out.length; i++) {
            out[i] += other.data[i];
        }
        return new Matrix(rows, cols, out);
    }

    /**
     * Matrix product; a 1x1 left operand scales the right one.
     * @param other Right operand
     * @return Product
     */
    public Matrix multiply(Matrix other) {
        if (data.length == 1) {
            double[] out = other.data.clone();
            for (int i = 0; i < out.length; i++) {
                out[i] *= data[0];
            }
            return new Matrix(other.rows, other.cols, out);
        }
        if (cols != other.rows) {
            throw new SizeMismatchException("Cannot multiply " + getShape() + " by " + other.getShape());
        }
        double[] out = new double[rows * other.cols];
        for (int j = 0; j < other.cols; j++) {
            for (int k = 0; k < cols; k++) {
                double b = other.data[k + other.rows * j];
                if (b == 0) continue;
                for (int i = 0; i < rows; i++) {
                    out[i + rows * j] += data[i + rows * k] * b;
                }
            }
        }
        return new Matrix(rows, other.cols, out);
    }

    private void requireShape(int r, int c) {
        if (rows != r || cols != c) {
            throw new SizeMismatchException("Incompatible shapes " + getShape() + " and (" + r + ", " + c + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matrix)) return false;
        Matrix other = (Matrix) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append("; ");
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(", ");
                sb.append(data[i + rows * j]);
            }
        }
        return sb.append(']').toString();
    }
}
