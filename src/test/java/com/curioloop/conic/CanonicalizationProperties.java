/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.ejml.data.DMatrixSparseCSC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for canonicalization and assembly.
 */
public class CanonicalizationProperties {

    /**
     * Property 1: Size Preservation
     *
     * For every operator and argument shape, the affine expression produced by
     * canonicalization has the shape of the expression it replaces.
     */
    @Property(tries = 50)
    @Label("Feature: canonicalization, Property 1: Size Preservation")
    void canonicalShapeMatchesExpressionShape(
            @ForAll @IntRange(min = 1, max = 4) int rows,
            @ForAll @IntRange(min = 1, max = 4) int cols,
            @ForAll @IntRange(min = 1, max = 3) int k
    ) {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(rows, cols);
        Parameter a = ctx.parameter(k, rows);

        for (Expression e : catalog(x, a, rows, cols)) {
            CanonicalForm form = new Canonicalizer(ctx).canonicalize(e);
            assertThat(form.getAffine().getShape())
                .as("canonical shape of %s", e)
                .isEqualTo(e.getShape());
        }
    }

    /**
     * Property 2: Idempotence of Structure
     *
     * Canonicalizing the same expression with two canonicalizers yields the
     * same number of constraints and the same cone sequence.
     */
    @Property(tries = 50)
    @Label("Feature: canonicalization, Property 2: Idempotence of Structure")
    void canonicalizationIsStructurallyIdempotent(
            @ForAll @IntRange(min = 1, max = 4) int rows,
            @ForAll @IntRange(min = 1, max = 4) int cols
    ) {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(rows, cols);
        Parameter a = ctx.parameter(2, rows);

        for (Expression e : catalog(x, a, rows, cols)) {
            CanonicalForm first = new Canonicalizer(ctx).canonicalize(e);
            CanonicalForm second = new Canonicalizer(ctx).canonicalize(e);
            assertThat(second.getConstraints()).hasSameSizeAs(first.getConstraints());
            assertThat(second.cones()).isEqualTo(first.cones());
        }
    }

    /**
     * Property 3: Cone Accounting
     *
     * A second-order cone block covers exactly numCones * coneSize rows, and
     * the cone list of an assembled problem covers exactly its rows.
     */
    @Property(tries = 100)
    @Label("Feature: canonicalization, Property 3: Cone Accounting")
    void conesCoverEveryRow(
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @IntRange(min = 1, max = 5) int m,
            @ForAll SOCAxis.Axis axis
    ) {
        ModelContext ctx = new ModelContext();
        Variable t = ctx.variable(n);
        Variable x = axis == SOCAxis.Axis.COLUMNS ? ctx.variable(m, n) : ctx.variable(n, m);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.add(Atoms.sumEntries(t), Atoms.normInf(x)))
            .subjectTo(Relation.soc(t, x, axis), Relation.geq(t, Constant.scalar(0)))
            .build();

        SOCAxis soc = null;
        for (Constraint c : problem.canonicalize().getConstraints()) {
            if (c instanceof SOCAxis) soc = (SOCAxis) c;
        }
        assertThat(soc).isNotNull();
        assertThat(soc.numCones()).isEqualTo(n);
        assertThat(soc.coneSize()).isEqualTo(m + 1);
        assertThat(soc.numCones() * soc.coneSize()).isEqualTo(soc.size());

        ConicData data = problem.assemble();
        int covered = data.getCones().stream().mapToInt(Cone::getDimension).sum();
        assertThat(covered).isEqualTo(data.getRowCount());
    }

    /**
     * Property 4: Assembly Agrees With Evaluation
     *
     * For an affine relation {@code e == 0}, the assembled rows {@code A x + b}
     * equal the column-major entries of e evaluated at the unpacked point.
     */
    @Property(tries = 100)
    @Label("Feature: canonicalization, Property 4: Assembly Agrees With Evaluation")
    void assembledRowsMatchEvaluation(
            @ForAll @IntRange(min = 1, max = 3) int k,
            @ForAll @IntRange(min = 1, max = 3) int r,
            @ForAll @IntRange(min = 1, max = 3) int c,
            @ForAll long seed
    ) {
        Random random = new Random(seed);
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(r, c);
        Variable y = ctx.variable(c, k);
        Parameter p = ctx.parameter(k, r);
        p.setValue(randomMatrix(random, k, r));
        Constant offset = Constant.of(randomMatrix(random, k, c));

        Expression px = Atoms.multiply(p, x);
        Expression stacked = Atoms.vstack(
            Atoms.subtract(Atoms.add(px, offset), Atoms.transpose(y)),
            Atoms.negate(px));
        Expression scalars = Atoms.vstack(
            Atoms.multiply(2.5, Atoms.index(x, r - 1, c - 1)),
            Atoms.sumEntries(y));

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Constant.scalar(0))
            .subjectTo(Relation.eq(stacked, Constant.scalar(0)), Relation.eq(scalars, Constant.scalar(0)))
            .build();
        ConicData data = problem.assemble();

        double[] point = new double[data.getColumnCount()];
        for (int i = 0; i < point.length; i++) {
            point[i] = random.nextDouble() * 4 - 2;
        }
        data.unpack(point);

        double[] rows = multiply(data.getA(), point);
        double[] b = data.getB();
        double[] first = stacked.value().toArray();
        double[] second = scalars.value().toArray();
        double[] expected = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, expected, first.length, second.length);
        assertThat(rows).hasSameSizeAs(expected);
        for (int i = 0; i < rows.length; i++) {
            assertThat(rows[i] + b[i]).as("row %d", i).isCloseTo(expected[i], within(1e-9));
        }
    }

    /**
     * Property 5: Constant Atoms Are Exact
     *
     * An atom of constant curvature enters assembly as its value, so
     * {@code x == f(p)} has the single solution {@code x = f(p)} for the
     * current parameter value.
     */
    @Property(tries = 100)
    @Label("Feature: canonicalization, Property 5: Constant Atoms Are Exact")
    void constantAtomsBindTheirValue(
            @ForAll @IntRange(min = 1, max = 4) int n,
            @ForAll long seed
    ) {
        Random random = new Random(seed);
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(n);
        Parameter p = ctx.parameter(n, 1);
        p.setValue(randomMatrix(random, n, 1));
        Expression bound = Atoms.add(Atoms.abs(p), Atoms.pos(Atoms.negate(p)));

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(x))
            .subjectTo(Relation.eq(x, bound))
            .build();
        ConicData data = problem.assemble();

        assertThat(data.getCones()).containsExactly(Cone.zero(n));
        assertThat(data.getColumnCount()).isEqualTo(n);
        double[] expected = bound.value().toArray();
        for (int i = 0; i < n; i++) {
            assertThat(data.getA().get(i, i)).isEqualTo(1.0);
            assertThat(-data.getB()[i]).as("row %d", i).isCloseTo(expected[i], within(1e-12));
        }
    }

    private static List<Expression> catalog(Variable x, Parameter a, int rows, int cols) {
        List<Expression> out = new ArrayList<>(Arrays.asList(
            Atoms.add(x, Constant.scalar(1)),
            Atoms.negate(x),
            Atoms.multiply(2.0, x),
            Atoms.multiply(a, x),
            Atoms.multiply(x, Constant.scalar(-3)),
            Atoms.sumEntries(x),
            Atoms.transpose(x),
            Atoms.vec(x),
            Atoms.vstack(x, x),
            Atoms.index(x, rows - 1, cols - 1),
            Atoms.abs(x),
            Atoms.pos(x),
            Atoms.neg(x),
            Atoms.maxEntries(x),
            Atoms.minEntries(x),
            Atoms.norm2(x),
            Atoms.normInf(x),
            Atoms.norm1(x),
            Atoms.max(Atoms.sumEntries(x), Atoms.norm2(x))));
        if (cols == 1) {
            out.add(Atoms.multiply(Atoms.transpose(x), Constant.of(Matrix.identity(rows))));
        }
        return out;
    }

    private static Matrix randomMatrix(Random random, int rows, int cols) {
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextDouble() * 2 - 1;
        }
        return Matrix.of(rows, cols, data);
    }

    private static double[] multiply(DMatrixSparseCSC a, double[] x) {
        double[] out = new double[a.numRows];
        for (int j = 0; j < a.numCols; j++) {
            for (int p = a.col_idx[j]; p < a.col_idx[j + 1]; p++) {
                out[a.nz_rows[p]] += a.nz_values[p] * x[j];
            }
        }
        return out;
    }
}
