/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for conic assembly.
 */
public class ConicAssemblerTest {

    @Test
    @DisplayName("Rows follow constraint order and SOC rows are t then its column of x")
    void testAssemblyOrdering() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2, 2);
        Variable t = ctx.variable(2);
        Variable y = ctx.variable(2);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(t))
            .subjectTo(
                Relation.eq(y, Constant.column(1, 2)),
                Relation.soc(t, x, SOCAxis.Axis.COLUMNS))
            .build();

        ConicData data = problem.assemble();

        assertThat(data.getCones()).containsExactly(Cone.zero(2), Cone.soc(3), Cone.soc(3));
        assertThat(data.getRowCount()).isEqualTo(8);
        assertThat(data.getColumnCount()).isEqualTo(8);
        assertThat(data.getVarIndex()).containsEntry(x.getId(), 0).containsEntry(t.getId(), 4)
            .containsEntry(y.getId(), 6);

        DMatrixSparseCSC a = data.getA();
        // y - [1, 2] == 0
        assertThat(a.get(0, 6)).isEqualTo(1.0);
        assertThat(a.get(1, 7)).isEqualTo(1.0);
        assertThat(data.getB()).containsExactly(-1, -2, 0, 0, 0, 0, 0, 0);
        // cone 0: t[0], x[0, 0], x[1, 0]
        assertThat(a.get(2, 4)).isEqualTo(1.0);
        assertThat(a.get(3, 0)).isEqualTo(1.0);
        assertThat(a.get(4, 1)).isEqualTo(1.0);
        // cone 1: t[1], x[0, 1], x[1, 1]
        assertThat(a.get(5, 5)).isEqualTo(1.0);
        assertThat(a.get(6, 2)).isEqualTo(1.0);
        assertThat(a.get(7, 3)).isEqualTo(1.0);
        assertThat(data.getA().getNonZeroLength()).isEqualTo(8);

        assertThat(data.getC()).containsExactly(0, 0, 0, 0, 1, 1, 0, 0);
        assertThat(data.getObjectiveOffset()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Row-axis cones take one row of x each")
    void testRowAxis() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2, 3);
        Variable t = ctx.variable(2);

        ConicData data = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(t))
            .subjectTo(Relation.soc(t, x, SOCAxis.Axis.ROWS))
            .build()
            .assemble();

        assertThat(data.getCones()).containsExactly(Cone.soc(4), Cone.soc(4));
        DMatrixSparseCSC a = data.getA();
        // cone 1: t[1], x[1, 0], x[1, 1], x[1, 2] at columns 1, 3, 5
        assertThat(a.get(4, 6 + 1)).isEqualTo(1.0);
        assertThat(a.get(5, 1)).isEqualTo(1.0);
        assertThat(a.get(6, 3)).isEqualTo(1.0);
        assertThat(a.get(7, 5)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Inequalities are stored as rhs - lhs in the non-negative cone")
    void testInequality() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2);

        ConicData data = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(Atoms.multiply(Constant.of(Matrix.fromRows(new double[]{2, 3})), x)))
            .subjectTo(Relation.leq(x, Constant.scalar(3)))
            .build()
            .assemble();

        assertThat(data.getCones()).containsExactly(Cone.nonNegative(2));
        DMatrixSparseCSC a = data.getA();
        assertThat(a.get(0, 0)).isEqualTo(-1.0);
        assertThat(a.get(1, 1)).isEqualTo(-1.0);
        assertThat(a.get(0, 1)).isEqualTo(0.0);
        assertThat(data.getB()).containsExactly(3, 3);
        assertThat(data.getC()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Parameter values are bound at assembly and the structure is reused")
    void testParameterRebinding() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2);
        Parameter p = ctx.parameter(2, 2);
        Parameter q = ctx.parameter(1, 1);
        p.setValue(Matrix.fromRows(new double[]{1, 2}, new double[]{3, 4}));
        q.setValue(5);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.add(Atoms.sumEntries(x), q))
            .subjectTo(Relation.eq(Atoms.multiply(p, x), Constant.column(7, 8)))
            .build();

        ConicData first = problem.assemble();
        DMatrixSparseCSC a = first.getA();
        assertThat(a.get(0, 0)).isEqualTo(1.0);
        assertThat(a.get(0, 1)).isEqualTo(2.0);
        assertThat(a.get(1, 0)).isEqualTo(3.0);
        assertThat(a.get(1, 1)).isEqualTo(4.0);
        assertThat(first.getB()).containsExactly(-7, -8);
        assertThat(first.getObjectiveOffset()).isEqualTo(5.0);

        CanonicalProblem structure = problem.canonicalize();
        p.setValue(Matrix.fromRows(new double[]{0, 1}, new double[]{1, 0}));
        q.setValue(-2);
        ConicData second = problem.assemble();

        assertThat(problem.canonicalize()).isSameAs(structure);
        DMatrixSparseCSC a2 = second.getA();
        assertThat(a2.get(0, 0)).isEqualTo(0.0);
        assertThat(a2.get(0, 1)).isEqualTo(1.0);
        assertThat(a2.get(1, 0)).isEqualTo(1.0);
        assertThat(second.getObjectiveOffset()).isEqualTo(-2.0);
        assertThat(second.getCones()).isEqualTo(first.getCones());
    }

    @Test
    @DisplayName("A missing parameter value fails the assembly")
    void testMissingParameter() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2);
        Parameter p = ctx.parameter(2, 1);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.norm2(Atoms.subtract(x, p)))
            .build();

        assertThatThrownBy(problem::assemble)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining(p.getName())
            .satisfies(e -> assertThat(((ConicException) e).getKind()).isEqualTo(ErrorKind.ASSEMBLY));
    }

    @Test
    @DisplayName("A callback parameter is read once per assembly and never while canonicalizing")
    void testCallbackReadOncePerAssembly() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2);
        AtomicInteger calls = new AtomicInteger();
        CallbackParam c = ctx.callbackParam(() -> Matrix.column(calls.incrementAndGet(), 0), 2, 1);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.add(Atoms.norm2(Atoms.subtract(x, c)), Atoms.sumEntries(c)))
            .subjectTo(Relation.leq(c, x))
            .build();

        problem.canonicalize();
        assertThat(calls.get()).isZero();

        ConicData first = problem.assemble();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(first.getObjectiveOffset()).isEqualTo(1.0);

        ConicData second = problem.assemble();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(second.getObjectiveOffset()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("A snapshot fixes parameter values for the assembly that uses it")
    void testSnapshotIsolation() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable();
        Parameter p = ctx.parameter(1, 1);
        p.setValue(1);

        Problem problem = Problem.builder().context(ctx).minimize(Atoms.add(x, p)).build();
        CanonicalProblem structure = problem.canonicalize();
        ParameterSnapshot snapshot = ParameterSnapshot.capture(structure.getParameters());
        p.setValue(9);

        assertThat(ConicAssembler.assemble(structure, snapshot).getObjectiveOffset()).isEqualTo(1.0);
        assertThat(ConicAssembler.assemble(structure).getObjectiveOffset()).isEqualTo(9.0);
        assertThatThrownBy(() -> ConicAssembler.assemble(structure, ParameterSnapshot.empty()))
            .isInstanceOf(AssemblyException.class);
    }

    @Test
    @DisplayName("Unconstrained problems assemble to zero rows")
    void testUnconstrained() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(3);

        ConicData data = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(Atoms.multiply(2.0, x)))
            .subjectTo(Collections.emptyList())
            .build()
            .assemble();

        assertThat(data.getRowCount()).isZero();
        assertThat(data.getCones()).isEmpty();
        assertThat(data.getC()).containsExactly(2, 2, 2);
    }

    @Test
    @DisplayName("Transpose, stacking and indexing map rows in column-major order")
    void testAffineLayout() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(2, 3);
        Variable s = ctx.variable();

        // rows of x' are (j, i) -> entry x[i, j]; vstack puts s under index(x, 1, 2)
        ConicData data = Problem.builder()
            .context(ctx)
            .minimize(Constant.scalar(0))
            .subjectTo(
                Relation.eq(Atoms.transpose(x), Constant.scalar(0)),
                Relation.eq(Atoms.vstack(Atoms.index(x, 1, 2), s), Constant.scalar(0)))
            .build()
            .assemble();

        DMatrixSparseCSC a = data.getA();
        // x' has shape (3, 2); row j + 3 * i holds x[i, j] at column i + 2 * j
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                assertThat(a.get(j + 3 * i, i + 2 * j)).isEqualTo(1.0);
            }
        }
        assertThat(a.get(6, 1 + 2 * 2)).isEqualTo(1.0);
        assertThat(a.get(7, 6)).isEqualTo(1.0);
        assertThat(data.getA().getNonZeroLength()).isEqualTo(8);
    }

    @Test
    @DisplayName("A constant atom over a parameter is an exact equality and a valid coefficient")
    void testConstantAtomOverParameter() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable();
        Variable y = ctx.variable(2);
        Parameter p = ctx.parameter(1, 1);
        p.setValue(-3);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(Atoms.multiply(Atoms.abs(p), y)))
            .subjectTo(Relation.eq(x, Atoms.abs(p)))
            .build();
        ConicData data = problem.assemble();

        // x - |p| == 0 pins x to 3
        assertThat(data.getCones()).containsExactly(Cone.zero(1));
        assertThat(data.getColumnCount()).isEqualTo(3);
        assertThat(data.getA().get(0, 0)).isEqualTo(1.0);
        assertThat(data.getB()).containsExactly(-3.0);
        assertThat(data.getC()).containsExactly(0, 3, 3);

        p.setValue(2);
        ConicData rebound = problem.assemble();
        assertThat(rebound.getB()).containsExactly(-2.0);
        assertThat(rebound.getC()).containsExactly(0, 2, 2);
    }

    @Test
    @DisplayName("Large variables assemble without dense coefficient blocks")
    void testLargeVariable() {
        int n = 46341;
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable(n);

        ConicData data = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(x))
            .subjectTo(Relation.leq(x, Constant.scalar(1)))
            .build()
            .assemble();

        assertThat(data.getColumnCount()).isEqualTo(n);
        assertThat(data.getRowCount()).isEqualTo(n);
        assertThat(data.getC()).hasSize(n).containsOnly(1.0);
        assertThat(data.getA().getNonZeroLength()).isEqualTo(n);
        assertThat(data.getA().get(n - 1, n - 1)).isEqualTo(-1.0);
        assertThat(data.getB()).hasSize(n).containsOnly(1.0);
    }

    @Test
    @DisplayName("Mixing variables from two model contexts is rejected")
    void testMixedContexts() {
        ModelContext ctx = new ModelContext();
        ModelContext other = new ModelContext();
        Variable x = ctx.variable(2);
        Variable y = other.variable(2);

        Problem problem = Problem.builder()
            .context(ctx)
            .minimize(Atoms.sumEntries(x))
            .subjectTo(Relation.eq(x, y))
            .build();

        assertThatThrownBy(problem::assemble)
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ConicException) e).getKind()).isEqualTo(ErrorKind.VALIDATION));
    }
}
