/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conic standard form of an assembled problem:
 * <pre>
 *   minimize    c'x + objectiveOffset
 *   subject to  A x + b in K
 * </pre>
 * where K is the product of {@link #getCones()} in row order.
 * <p>
 * Column {@code varIndex.get(id) + k} holds entry k (column-major) of the
 * variable with that id.
 * </p>
 */
public final class ConicData {

    private final DMatrixSparseCSC a;
    private final double[] b;
    private final double[] c;
    private final double objectiveOffset;
    private final List<Cone> cones;
    private final Map<Integer, Integer> varIndex;
    private final List<Variable> variables;

    ConicData(DMatrixSparseCSC a, double[] b, double[] c, double objectiveOffset,
              List<Cone> cones, Map<Integer, Integer> varIndex, List<Variable> variables) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.objectiveOffset = objectiveOffset;
        this.cones = Collections.unmodifiableList(new ArrayList<>(cones));
        this.varIndex = Collections.unmodifiableMap(new LinkedHashMap<>(varIndex));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    }

    /**
     * Gets the constraint matrix in compressed sparse column form, row indices
     * sorted within each column.
     * @return Copy of A with {@link #getRowCount()} rows and {@link #getColumnCount()} columns
     */
    public DMatrixSparseCSC getA() {
        return a.copy();
    }

    /**
     * Gets the constraint offset.
     * @return Copy of b
     */
    public double[] getB() {
        return b.clone();
    }

    /**
     * Gets the objective coefficients.
     * @return Copy of c
     */
    public double[] getC() {
        return c.clone();
    }

    public double getObjectiveOffset() {
        return objectiveOffset;
    }

    public List<Cone> getCones() {
        return cones;
    }

    /**
     * Gets the first column of every variable.
     * @return Map from variable id to column offset
     */
    public Map<Integer, Integer> getVarIndex() {
        return varIndex;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public int getRowCount() {
        return b.length;
    }

    public int getColumnCount() {
        return c.length;
    }

    /**
     * Evaluates the minimization objective at a primal point.
     * @param x Primal vector
     * @return {@code c'x + objectiveOffset}
     */
    public double objectiveValue(double[] x) {
        requireLength(x);
        double value = objectiveOffset;
        for (int j = 0; j < c.length; j++) {
            value += c[j] * x[j];
        }
        return value;
    }

    /**
     * Scatters a primal vector into the variables.
     * @param x Primal vector of length {@link #getColumnCount()}
     * @throws AssemblyException if the length does not match
     */
    public void unpack(double[] x) {
        requireLength(x);
        for (Variable variable : variables) {
            int offset = varIndex.get(variable.getId());
            Shape shape = variable.getShape();
            double[] entries = new double[shape.size()];
            System.arraycopy(x, offset, entries, 0, entries.length);
            variable.assign(Matrix.of(shape.getRows(), shape.getCols(), entries));
        }
    }

    private void requireLength(double[] x) {
        if (x == null || x.length != c.length) {
            throw new AssemblyException("Solution vector has length " + (x == null ? 0 : x.length)
                + ", expected " + c.length);
        }
    }

    @Override
    public String toString() {
        return "ConicData{" +
                "rows=" + getRowCount() +
                ", columns=" + getColumnCount() +
                ", nonZeros=" + a.nz_length +
                ", cones=" + cones +
                '}';
    }
}
