/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numeric image of an {@link AffineExpr}: {@code vec(expr) = sum_v B_v vec(x_v) + offset}.
 * <p>
 * Rows follow the column-major vectorization of the expression. Each block
 * {@code B_v} is a sparse matrix with one column per entry of variable
 * {@code v}. Every linear operator is a sparse row map {@code T}, applied as
 * {@code B_v <- T B_v} and {@code offset <- T offset}, so storage grows with
 * the number of non-zeros rather than with the square of a variable's size.
 * </p>
 * <p>
 * Blocks are never mutated once built and may be shared between forms.
 * </p>
 */
final class LinearForm {

    private final int rows;
    private final double[] offset;
    private final Map<Integer, DMatrixSparseCSC> blocks;

    private LinearForm(int rows, double[] offset, Map<Integer, DMatrixSparseCSC> blocks) {
        this.rows = rows;
        this.offset = offset;
        this.blocks = blocks;
    }

    /**
     * Evaluates an affine tree with parameter values taken from a snapshot.
     * @param expr Affine expression
     * @param snapshot Parameter values
     * @return Linear form with {@code expr.getShape().size()} rows
     */
    static LinearForm of(AffineExpr expr, ParameterSnapshot snapshot) {
        Shape shape = expr.getShape();
        int m = shape.size();
        switch (expr.getKind()) {
            case VARIABLE: {
                Map<Integer, DMatrixSparseCSC> blocks = new LinkedHashMap<>();
                blocks.put(expr.getVariableId(), CommonOps_DSCC.identity(m));
                return new LinearForm(m, new double[m], blocks);
            }
            case PARAMETER:
                return constant(snapshot.get(expr.getParameter()), shape);
            case CONSTANT:
                return constant(expr.getConstant(), shape);
            case SUM: {
                LinearForm sum = null;
                for (AffineExpr arg : expr.getArgs()) {
                    LinearForm term = of(arg, snapshot);
                    sum = sum == null ? term : sum.plus(term);
                }
                return sum;
            }
            case NEGATE:
                return of(expr.getArgs().get(0), snapshot).map(diagonal(m, -1.0));
            case MULTIPLY:
                return multiply(expr, snapshot);
            case PROMOTE: {
                DMatrixSparseTriplet t = new DMatrixSparseTriplet(m, 1, m);
                for (int i = 0; i < m; i++) {
                    t.addItem(i, 0, 1.0);
                }
                return of(expr.getArgs().get(0), snapshot).map(compress(t));
            }
            case SUM_ENTRIES: {
                int n = expr.getArgs().get(0).getShape().size();
                DMatrixSparseTriplet t = new DMatrixSparseTriplet(1, n, n);
                for (int i = 0; i < n; i++) {
                    t.addItem(0, i, 1.0);
                }
                return of(expr.getArgs().get(0), snapshot).map(compress(t));
            }
            case TRANSPOSE: {
                Shape inner = expr.getArgs().get(0).getShape();
                int r = inner.getRows();
                int c = inner.getCols();
                DMatrixSparseTriplet t = new DMatrixSparseTriplet(m, m, m);
                for (int i = 0; i < r; i++) {
                    for (int j = 0; j < c; j++) {
                        t.addItem(j + c * i, i + r * j, 1.0);
                    }
                }
                return of(expr.getArgs().get(0), snapshot).map(compress(t));
            }
            case RESHAPE:
                // column-major order is preserved
                return of(expr.getArgs().get(0), snapshot);
            case VSTACK:
                return vstack(expr, snapshot);
            case INDEX: {
                Shape inner = expr.getArgs().get(0).getShape();
                DMatrixSparseTriplet t = new DMatrixSparseTriplet(1, inner.size(), 1);
                t.addItem(0, expr.getRow() + inner.getRows() * expr.getCol(), 1.0);
                return of(expr.getArgs().get(0), snapshot).map(compress(t));
            }
            default:
                throw new AssemblyException("Unsupported affine node " + expr.getKind());
        }
    }

    private static LinearForm constant(Matrix value, Shape shape) {
        if (!value.getShape().equals(shape)) {
            throw new AssemblyException("Value of shape " + value.getShape() + " bound where " + shape + " is expected");
        }
        return new LinearForm(shape.size(), value.toArray(), new LinkedHashMap<>());
    }

    private static LinearForm multiply(AffineExpr expr, ParameterSnapshot snapshot) {
        AffineExpr lhs = expr.getArgs().get(0);
        AffineExpr rhs = expr.getArgs().get(1);
        LinearForm left = of(lhs, snapshot);
        if (!left.blocks.isEmpty()) {
            throw new AssemblyException("Left operand of a product depends on variables: " + lhs);
        }
        double[] l = left.offset;
        LinearForm right = of(rhs, snapshot);
        int m = expr.getShape().size();
        if (lhs.getShape().isScalar()) {
            return right.map(diagonal(m, l[0]));
        }
        // vec(L X) = (I kron L) vec(X)
        int k = lhs.getShape().getRows();
        int inner = lhs.getShape().getCols();
        int c = rhs.getShape().getCols();
        DMatrixSparseTriplet t = new DMatrixSparseTriplet(m, inner * c, l.length * c);
        for (int j = 0; j < c; j++) {
            for (int s = 0; s < inner; s++) {
                for (int i = 0; i < k; i++) {
                    double v = l[i + k * s];
                    if (v != 0.0) {
                        t.addItem(i + k * j, s + inner * j, v);
                    }
                }
            }
        }
        return right.map(compress(t));
    }

    private static LinearForm vstack(AffineExpr expr, ParameterSnapshot snapshot) {
        int total = expr.getShape().getRows();
        int cols = expr.getShape().getCols();
        int m = expr.getShape().size();
        LinearForm result = null;
        int rowOffset = 0;
        for (AffineExpr block : expr.getArgs()) {
            int r = block.getShape().getRows();
            DMatrixSparseTriplet t = new DMatrixSparseTriplet(m, r * cols, r * cols);
            for (int j = 0; j < cols; j++) {
                for (int i = 0; i < r; i++) {
                    t.addItem(rowOffset + i + total * j, i + r * j, 1.0);
                }
            }
            LinearForm placed = of(block, snapshot).map(compress(t));
            result = result == null ? placed : result.plus(placed);
            rowOffset += r;
        }
        return result;
    }

    private static DMatrixSparseCSC diagonal(int n, double value) {
        DMatrixSparseTriplet t = new DMatrixSparseTriplet(n, n, n);
        for (int i = 0; i < n; i++) {
            t.addItem(i, i, value);
        }
        return compress(t);
    }

    private static DMatrixSparseCSC compress(DMatrixSparseTriplet triplet) {
        DMatrixSparseCSC csc = DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
        csc.sortIndices(null);
        return csc;
    }

    /**
     * Applies a row map to the offset and to every block.
     */
    private LinearForm map(DMatrixSparseCSC t) {
        if (t.numCols != rows) {
            throw new AssemblyException("Row map with " + t.numCols + " columns applied to " + rows + " rows");
        }
        double[] newOffset = new double[t.numRows];
        for (int j = 0; j < t.numCols; j++) {
            double v = offset[j];
            if (v == 0.0) continue;
            for (int p = t.col_idx[j]; p < t.col_idx[j + 1]; p++) {
                newOffset[t.nz_rows[p]] += t.nz_values[p] * v;
            }
        }
        Map<Integer, DMatrixSparseCSC> newBlocks = new LinkedHashMap<>();
        for (Map.Entry<Integer, DMatrixSparseCSC> e : blocks.entrySet()) {
            DMatrixSparseCSC out = new DMatrixSparseCSC(t.numRows, e.getValue().numCols, 0);
            CommonOps_DSCC.mult(t, e.getValue(), out);
            newBlocks.put(e.getKey(), out);
        }
        return new LinearForm(t.numRows, newOffset, newBlocks);
    }

    private LinearForm plus(LinearForm other) {
        if (other.rows != rows) {
            throw new AssemblyException("Cannot add linear forms with " + rows + " and " + other.rows + " rows");
        }
        double[] newOffset = offset.clone();
        for (int i = 0; i < rows; i++) {
            newOffset[i] += other.offset[i];
        }
        Map<Integer, DMatrixSparseCSC> newBlocks = new LinkedHashMap<>(blocks);
        for (Map.Entry<Integer, DMatrixSparseCSC> e : other.blocks.entrySet()) {
            DMatrixSparseCSC existing = newBlocks.get(e.getKey());
            if (existing == null) {
                newBlocks.put(e.getKey(), e.getValue());
            } else {
                DMatrixSparseCSC sum = new DMatrixSparseCSC(rows, existing.numCols, 0);
                CommonOps_DSCC.add(1.0, existing, 1.0, e.getValue(), sum, null, null);
                newBlocks.put(e.getKey(), sum);
            }
        }
        return new LinearForm(rows, newOffset, newBlocks);
    }

    int getRows() {
        return rows;
    }

    double getOffset(int row) {
        return offset[row];
    }

    Map<Integer, DMatrixSparseCSC> getBlocks() {
        return blocks;
    }
}
