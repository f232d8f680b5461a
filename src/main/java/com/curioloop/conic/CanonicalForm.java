/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of canonicalizing an expression: an affine expression equal to the
 * original on the feasible set of the accompanying constraints.
 */
public final class CanonicalForm {

    private final AffineExpr affine;
    private final List<Constraint> constraints;

    /**
     * Creates a canonical form.
     * @param affine Affine expression
     * @param constraints Constraints in declaration order (copied)
     */
    public CanonicalForm(AffineExpr affine, List<Constraint> constraints) {
        if (affine == null) {
            throw new IllegalArgumentException("Affine expression cannot be null");
        }
        this.affine = affine;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
    }

    /**
     * Canonical form without constraints.
     * @param affine Affine expression
     * @return Canonical form
     */
    public static CanonicalForm of(AffineExpr affine) {
        return new CanonicalForm(affine, Collections.emptyList());
    }

    public AffineExpr getAffine() {
        return affine;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    /**
     * Concatenates the cone lists of all constraints, in order.
     * @return Cone sequence
     */
    public List<Cone> cones() {
        List<Cone> out = new ArrayList<>();
        for (Constraint constraint : constraints) {
            out.addAll(constraint.cones());
        }
        return out;
    }

    @Override
    public String toString() {
        return "CanonicalForm{affine=" + affine + ", constraints=" + constraints + '}';
    }
}
