/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Entry of the positional cone list handed to a conic solver.
 */
public final class Cone {

    /**
     * Cone families.
     */
    public enum Type {
        /** {x : x = 0} */
        ZERO,
        /** {x : x >= 0} */
        NONNEGATIVE,
        /** {(t, x) : ||x||_2 <= t} */
        SOC
    }

    private final Type type;
    private final int dimension;

    private Cone(Type type, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Cone dimension must be positive");
        }
        this.type = type;
        this.dimension = dimension;
    }

    public static Cone zero(int dimension) {
        return new Cone(Type.ZERO, dimension);
    }

    public static Cone nonNegative(int dimension) {
        return new Cone(Type.NONNEGATIVE, dimension);
    }

    /**
     * Second-order cone of the given dimension (one t entry plus
     * {@code dimension - 1} x entries).
     * @param dimension Cone dimension
     * @return Cone
     */
    public static Cone soc(int dimension) {
        return new Cone(Type.SOC, dimension);
    }

    public Type getType() {
        return type;
    }

    /**
     * Gets the number of rows this cone covers.
     * @return Dimension
     */
    public int getDimension() {
        return dimension;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cone)) return false;
        Cone other = (Cone) o;
        return type == other.type && dimension == other.dimension;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + dimension;
    }

    @Override
    public String toString() {
        return type + "(" + dimension + ")";
    }
}
