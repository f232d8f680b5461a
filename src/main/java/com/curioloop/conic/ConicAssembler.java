/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * Binds parameter values into a {@link CanonicalProblem} and lays it out in
 * conic standard form.
 * <p>
 * Columns hold every variable in ascending id order, each occupying
 * {@code rows * cols} consecutive columns. Rows follow the constraint order of
 * the canonical problem. An equality or inequality constraint contributes the
 * vectorized rows of its expression. An {@link SOCAxis} contributes, for each
 * cone i, the row of {@code t[i]} followed by the rows of its slice of x.
 * </p>
 */
public final class ConicAssembler {

    private static final Logger log = LoggerFactory.getLogger(ConicAssembler.class);

    private ConicAssembler() {
    }

    /**
     * Assembles a problem with the current parameter values.
     * @param problem Canonical problem
     * @return Conic data
     * @throws AssemblyException if a parameter has no value
     */
    public static ConicData assemble(CanonicalProblem problem) {
        return assemble(problem, ParameterSnapshot.capture(problem.getParameters()));
    }

    /**
     * Assembles a problem with parameter values taken from a snapshot.
     * @param problem Canonical problem
     * @param snapshot Parameter values
     * @return Conic data
     * @throws AssemblyException on a missing parameter value or a cone block
     *         whose extent disagrees with its cone list
     */
    public static ConicData assemble(CanonicalProblem problem, ParameterSnapshot snapshot) {
        Map<Integer, Integer> varIndex = new LinkedHashMap<>();
        int columns = 0;
        for (Variable variable : problem.getVariables()) {
            varIndex.put(variable.getId(), columns);
            columns += variable.getShape().size();
        }

        int rows = problem.rowCount();
        DMatrixSparseTriplet triplets = new DMatrixSparseTriplet(rows, columns, Math.max(rows, 16));
        double[] b = new double[rows];
        int row = 0;
        for (Constraint constraint : problem.getConstraints()) {
            int extent = 0;
            for (Cone cone : constraint.cones()) {
                extent += cone.getDimension();
            }
            if (extent != constraint.size()) {
                throw new AssemblyException("Constraint " + constraint + " spans " + constraint.size()
                    + " rows but its cones cover " + extent);
            }
            int start = row;
            if (constraint instanceof SOCAxis) {
                SOCAxis soc = (SOCAxis) constraint;
                if (soc.numCones() * soc.coneSize() != soc.size()) {
                    throw new AssemblyException("Cone block " + soc + " has extent " + soc.size()
                        + " but holds " + soc.numCones() + " cones of size " + soc.coneSize());
                }
                emit(LinearForm.of(soc.getT(), snapshot), i -> start + soc.tRow(i), varIndex, triplets, b);
                emit(LinearForm.of(soc.getX(), snapshot), i -> start + soc.xRow(i), varIndex, triplets, b);
            } else {
                emit(LinearForm.of(constraint.getExpressions().get(0), snapshot), i -> start + i,
                    varIndex, triplets, b);
            }
            row += constraint.size();
        }

        LinearForm objective = LinearForm.of(problem.getObjective(), snapshot);
        double[] c = new double[columns];
        for (Map.Entry<Integer, DMatrixSparseCSC> e : objective.getBlocks().entrySet()) {
            int offset = column(varIndex, e.getKey());
            DMatrixSparseCSC block = e.getValue();
            for (int k = 0; k < block.numCols; k++) {
                for (int p = block.col_idx[k]; p < block.col_idx[k + 1]; p++) {
                    c[offset + k] += block.nz_values[p];
                }
            }
        }

        DMatrixSparseCSC a = DConvertMatrixStruct.convert(triplets, (DMatrixSparseCSC) null);
        a.sortIndices(null);
        List<Cone> cones = problem.cones();
        log.debug("Assembled conic data: {} rows, {} columns, {} non-zeros, {} cones",
            rows, columns, a.nz_length, cones.size());
        return new ConicData(a, b, c, objective.getOffset(0), cones, varIndex, problem.getVariables());
    }

    /**
     * Copies the rows of a linear form into the triplets and b, placing source
     * row i at {@code rowOf(i)}.
     */
    private static void emit(LinearForm form, IntUnaryOperator rowOf, Map<Integer, Integer> varIndex,
                             DMatrixSparseTriplet triplets, double[] b) {
        for (int i = 0; i < form.getRows(); i++) {
            b[rowOf.applyAsInt(i)] = form.getOffset(i);
        }
        for (Map.Entry<Integer, DMatrixSparseCSC> e : form.getBlocks().entrySet()) {
            int offset = column(varIndex, e.getKey());
            DMatrixSparseCSC block = e.getValue();
            for (int k = 0; k < block.numCols; k++) {
                for (int p = block.col_idx[k]; p < block.col_idx[k + 1]; p++) {
                    double v = block.nz_values[p];
                    if (v != 0.0) {
                        triplets.addItem(rowOf.applyAsInt(block.nz_rows[p]), offset + k, v);
                    }
                }
            }
        }
    }

    private static int column(Map<Integer, Integer> varIndex, int variableId) {
        Integer offset = varIndex.get(variableId);
        if (offset == null) {
            throw new AssemblyException("Variable " + variableId + " is not part of the problem");
        }
        return offset;
    }
}
