/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Arrays;

/**
 * Result of solving a problem with an external solver.
 */
public final class SolveResult {

    private final double[] solution;
    private final double objectiveValue;
    private final Objective.Sense sense;

    /**
     * Creates a solve result.
     * @param solution Primal vector in column order
     * @param objectiveValue Objective value in the problem's own sense
     * @param sense Objective sense
     */
    public SolveResult(double[] solution, double objectiveValue, Objective.Sense sense) {
        this.solution = solution != null ? solution.clone() : new double[0];
        this.objectiveValue = objectiveValue;
        this.sense = sense;
    }

    /**
     * Gets the primal vector.
     * @return Copy of the primal vector
     */
    public double[] getSolution() {
        return solution.clone();
    }

    /**
     * Gets the optimal value; for a maximization problem this is the
     * maximized value, not its negation.
     * @return Objective value
     */
    public double getObjectiveValue() {
        return objectiveValue;
    }

    public Objective.Sense getSense() {
        return sense;
    }

    public int getDimension() {
        return solution.length;
    }

    @Override
    public String toString() {
        return "SolveResult{" +
                "sense=" + sense +
                ", objectiveValue=" + objectiveValue +
                ", solution=" + Arrays.toString(solution) +
                '}';
    }
}
