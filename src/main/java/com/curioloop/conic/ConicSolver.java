/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Functional interface for external conic solvers.
 * <p>
 * The solver receives a problem in the form
 * {@code minimize c'x subject to A x + b in K} and returns a primal point.
 * </p>
 */
@FunctionalInterface
public interface ConicSolver {

    /**
     * Solves an assembled problem.
     * @param data Conic data (read-only)
     * @return Primal vector of length {@link ConicData#getColumnCount()}
     */
    double[] solve(ConicData data);
}
