/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Map;

/**
 * Expression with no children.
 */
public abstract class Leaf extends Expression {

    Leaf() {}

    /**
     * Canonical form of this leaf: an affine expression and no constraints.
     * @return Canonical form
     */
    public abstract CanonicalForm canonicalize();

    /**
     * Describes the constructor-level fields of this leaf, in declaration order.
     * The result is descriptive only and plays no part in canonicalization.
     *
     * @return Unmodifiable field map
     */
    public abstract Map<String, Object> getData();

    /**
     * Gets the session that allocated this leaf's id.
     * @return Owning context, or null for a leaf without an id
     */
    public ModelContext getContext() {
        return null;
    }

    @Override
    public Curvature getCurvature() {
        return Curvature.CONSTANT;
    }
}
