/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for leaf expressions and the id allocator.
 */
public class LeafTest {

    @Test
    @DisplayName("Scalar constant has shape (1, 1), positive sign and constant curvature")
    void testScalarConstant() {
        Constant five = Constant.scalar(5);

        assertThat(five.getShape()).isEqualTo(Shape.of(1, 1));
        assertThat(five.getSign()).isEqualTo(Sign.POSITIVE);
        assertThat(five.getCurvature()).isEqualTo(Curvature.CONSTANT);
        assertThat(five.value().get(0)).isEqualTo(5.0);

        CanonicalForm form = five.canonicalize();
        assertThat(form.getConstraints()).isEmpty();
        assertThat(form.getAffine().getKind()).isEqualTo(AffineExpr.Kind.CONSTANT);
        assertThat(form.getAffine().getConstant().get(0)).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Constant sign follows its entries")
    void testConstantSign() {
        assertThat(Constant.column(0, 0).getSign()).isEqualTo(Sign.ZERO);
        assertThat(Constant.column(-1, 0).getSign()).isEqualTo(Sign.NEGATIVE);
        assertThat(Constant.column(-1, 2).getSign()).isEqualTo(Sign.UNKNOWN);
        assertThat(Constant.of(Matrix.fromRows(new double[]{1, 2}, new double[]{3, 4})).getShape())
            .isEqualTo(Shape.of(2, 2));
    }

    @Test
    @DisplayName("Constant rejects non-finite entries")
    void testConstantRejectsNonFinite() {
        assertThatThrownBy(() -> Constant.column(1, Double.NaN))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ConicException) e).getKind()).isEqualTo(ErrorKind.VALIDATION));
        assertThatThrownBy(() -> Constant.scalar(Double.POSITIVE_INFINITY))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Sparse constants keep their origin and dense value")
    void testSparseConstant() {
        DMatrixSparseTriplet triplets = new DMatrixSparseTriplet(2, 2, 1);
        triplets.addItem(0, 1, 3.0);
        Constant c = Constant.of(DConvertMatrixStruct.convert(triplets, (DMatrixSparseCSC) null));

        assertThat(c.isSparse()).isTrue();
        assertThat(c.value().get(0, 1)).isEqualTo(3.0);
        assertThat(c.value().get(1, 0)).isEqualTo(0.0);
        assertThat(c.getSign()).isEqualTo(Sign.POSITIVE);
    }

    @Test
    @DisplayName("Constant.as wraps numbers and passes expressions through")
    void testConstantAs() {
        Variable x = new ModelContext().variable();
        assertThat(Constant.as(x)).isSameAs(x);
        assertThat(Constant.as(2).value().get(0)).isEqualTo(2.0);
        assertThatThrownBy(() -> Constant.as("two")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Declared-negative parameter rejects a positive entry and keeps no value")
    void testNegativeParameter() {
        ModelContext ctx = new ModelContext();
        Parameter p = ctx.parameter(3, 1, "NEGATIVE");

        assertThatThrownBy(() -> p.setValue(1, -2, -3))
            .isInstanceOf(ValidationException.class);
        assertThat(p.hasValue()).isFalse();

        p.setValue(-1, -2, -3);
        assertThat(p.value()).isEqualTo(Matrix.column(-1, -2, -3));
        assertThat(p.isNegative()).isTrue();
        assertThat(p.getCurvature()).isEqualTo(Curvature.CONSTANT);

        assertThatThrownBy(() -> p.setValue(-1, 2, -3)).isInstanceOf(ValidationException.class);
        assertThat(p.value()).isEqualTo(Matrix.column(-1, -2, -3));
    }

    @Test
    @DisplayName("Parameter rejects values of the wrong shape or with non-finite entries")
    void testParameterValueValidation() {
        Parameter p = new ModelContext().parameter(2, 1);

        assertThatThrownBy(() -> p.setValue(1, 2, 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> p.setValue(1, Double.NaN)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> p.setValue((Matrix) null)).isInstanceOf(ValidationException.class);

        p.setValue(-4, 5);
        assertThat(p.getSign()).isEqualTo(Sign.UNKNOWN);
    }

    @Test
    @DisplayName("A ZERO declaration is not checked against values")
    void testZeroDeclarationNotEnforced() {
        Parameter p = new ModelContext().parameter(2, 1, Sign.ZERO);
        p.setValue(1, -1);
        assertThat(p.getSign()).isEqualTo(Sign.ZERO);
    }

    @ParameterizedTest
    @ValueSource(strings = {"positive", "Negative", "ZERO", "unknown"})
    @DisplayName("Sign names are accepted regardless of case")
    void testSignNames(String name) {
        Parameter p = new ModelContext().parameter(1, 1, name);
        assertThat(p.getDeclaredSign().name()).isEqualToIgnoringCase(name);
    }

    @Test
    @DisplayName("Unknown sign names are rejected")
    void testInvalidSignName() {
        ModelContext ctx = new ModelContext();
        assertThatThrownBy(() -> ctx.parameter(1, 1, "SIDEWAYS"))
            .isInstanceOf(SignDeclarationException.class)
            .hasMessageContaining("SIDEWAYS");
        assertThatThrownBy(() -> ctx.callbackParam(() -> Matrix.scalar(1), 1, 1, "NONNEG"))
            .isInstanceOf(SignDeclarationException.class);
    }

    @Test
    @DisplayName("Non-positive dimensions are rejected")
    void testNonPositiveDimensions() {
        ModelContext ctx = new ModelContext();
        assertThatThrownBy(() -> ctx.variable(0, 1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ctx.parameter(2, -1)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("CallbackParam returns a fresh value on every read")
    void testCallbackFreshness() {
        Matrix a = Matrix.column(1, 2);
        Matrix b = Matrix.column(3, 4);
        AtomicInteger calls = new AtomicInteger();
        Supplier<Matrix> source = () -> calls.getAndIncrement() == 0 ? a : b;
        CallbackParam p = new ModelContext().callbackParam(source, 2, 1);

        assertThat(p.value()).isEqualTo(a);
        assertThat(p.value()).isEqualTo(b);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(p.hasValue()).isTrue();
    }

    @Test
    @DisplayName("CallbackParam validates callback output and cannot be assigned")
    void testCallbackValidation() {
        ModelContext ctx = new ModelContext();
        CallbackParam wrongShape = ctx.callbackParam(() -> Matrix.column(1, 2, 3), 2, 1);
        CallbackParam wrongSign = ctx.callbackParam(() -> Matrix.column(-1, 2), 2, 1, "POSITIVE");

        assertThatThrownBy(wrongShape::value).isInstanceOf(ValidationException.class);
        assertThatThrownBy(wrongSign::value).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> wrongShape.setValue(Matrix.column(1, 2)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("getData lists constructor fields in declaration order")
    void testGetData() {
        ModelContext ctx = new ModelContext();
        Supplier<Matrix> source = () -> Matrix.scalar(1);

        Parameter p = ctx.parameter(2, 1, "price", Sign.POSITIVE, Matrix.column(1, 2));
        CallbackParam cb = ctx.callbackParam(source, 1, 1, "feed", Sign.UNKNOWN);
        Variable x = ctx.variable(3, 2, "weights");
        Constant c = Constant.scalar(7);

        assertThat(p.getData()).containsExactly(
            entry("rows", 2), entry("cols", 1), entry("name", "price"),
            entry("sign", Sign.POSITIVE), entry("value", Matrix.column(1, 2)));
        assertThat(cb.getData()).containsExactly(
            entry("callback", source), entry("rows", 1), entry("cols", 1),
            entry("name", "feed"), entry("sign", Sign.UNKNOWN));
        assertThat(x.getData()).containsExactly(entry("rows", 3), entry("cols", 2), entry("name", "weights"));
        assertThat(c.getData()).containsExactly(entry("value", Matrix.scalar(7)));
        assertThatThrownBy(() -> x.getData().put("rows", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Generated names use the leaf id")
    void testGeneratedNames() {
        ModelContext ctx = new ModelContext();
        Variable x = ctx.variable();
        Parameter p = ctx.parameter(1, 1);

        assertThat(x.getName()).isEqualTo(Variable.NAME_PREFIX + x.getId());
        assertThat(p.getName()).isEqualTo(Parameter.NAME_PREFIX + p.getId());
    }

    @Test
    @DisplayName("Variable canonicalizes to itself and is affine with unknown sign")
    void testVariable() {
        Variable x = new ModelContext().variable(2, 3);

        assertThat(x.getCurvature()).isEqualTo(Curvature.AFFINE);
        assertThat(x.getSign()).isEqualTo(Sign.UNKNOWN);
        assertThat(x.value()).isNull();

        AffineExpr affine = x.canonicalize().getAffine();
        assertThat(affine.getKind()).isEqualTo(AffineExpr.Kind.VARIABLE);
        assertThat(affine.getVariableId()).isEqualTo(x.getId());
        assertThat(affine.getShape()).isEqualTo(Shape.of(2, 3));
    }

    @Test
    @DisplayName("Ids are strictly increasing within a context and independent across contexts")
    void testIdAllocation() {
        ModelContext first = new ModelContext();
        ModelContext second = new ModelContext(new IdAllocator(100));

        int a = first.variable().getId();
        int b = first.parameter(1, 1).getId();
        int c = first.callbackParam(() -> Matrix.scalar(0), 1, 1).getId();

        assertThat(a).isLessThan(b);
        assertThat(b).isLessThan(c);
        assertThat(second.variable().getId()).isEqualTo(101);
        assertThat(first.getAllocator().lastId()).isEqualTo(c);
    }
}
