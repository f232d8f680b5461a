/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Dimensions (rows, cols) of an expression or value.
 */
public final class Shape {

    private static final Shape SCALAR = new Shape(1, 1);

    private final int rows;
    private final int cols;

    private Shape(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Creates a shape.
     * @param rows Number of rows (positive)
     * @param cols Number of columns (positive)
     * @return Shape
     * @throws ValidationException if either dimension is not positive
     */
    public static Shape of(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new ValidationException("Dimensions must be positive: (" + rows + ", " + cols + ")");
        }
        if (rows == 1 && cols == 1) {
            return SCALAR;
        }
        return new Shape(rows, cols);
    }

    /**
     * The 1x1 shape.
     * @return Scalar shape
     */
    public static Shape scalar() {
        return SCALAR;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * Gets the number of entries.
     * @return rows * cols
     */
    public int size() {
        return rows * cols;
    }

    public boolean isScalar() {
        return rows == 1 && cols == 1;
    }

    /**
     * Gets the transposed shape.
     * @return (cols, rows)
     */
    public Shape transpose() {
        return of(cols, rows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape)) return false;
        Shape other = (Shape) o;
        return rows == other.rows && cols == other.cols;
    }

    @Override
    public int hashCode() {
        return 31 * rows + cols;
    }

    @Override
    public String toString() {
        return "(" + rows + ", " + cols + ")";
    }
}
