/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical structure of a problem: a scalar affine objective to minimize
 * and an ordered list of cone constraints over user and auxiliary variables.
 * <p>
 * The structure references parameters symbolically and never changes when
 * their values do, so one instance can be assembled any number of times.
 * </p>
 */
public final class CanonicalProblem {

    private final Objective.Sense sense;
    private final AffineExpr objective;
    private final List<Constraint> constraints;
    private final List<Variable> variables;
    private final List<Parameter> parameters;

    /**
     * Creates a canonical problem.
     * @param sense Sense of the original objective
     * @param objective Scalar affine objective in minimization form
     * @param constraints Constraints in row order
     * @param variables Variables ordered by id
     * @param parameters Parameters referenced anywhere in the problem
     */
    public CanonicalProblem(Objective.Sense sense, AffineExpr objective, List<Constraint> constraints,
                            List<Variable> variables, List<Parameter> parameters) {
        if (!objective.getShape().isScalar()) {
            throw new SizeMismatchException("Objective must be scalar, got " + objective.getShape());
        }
        this.sense = sense;
        this.objective = objective;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public Objective.Sense getSense() {
        return sense;
    }

    /**
     * Gets the objective to minimize; negated for a maximization problem.
     * @return Scalar affine expression
     */
    public AffineExpr getObjective() {
        return objective;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    /**
     * Gets the cones of all constraints in row order.
     * @return Cone list
     */
    public List<Cone> cones() {
        List<Cone> out = new ArrayList<>();
        for (Constraint constraint : constraints) {
            out.addAll(constraint.cones());
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Gets the total number of constraint rows.
     * @return Row count
     */
    public int rowCount() {
        int rows = 0;
        for (Constraint constraint : constraints) {
            rows += constraint.size();
        }
        return rows;
    }

    /**
     * Gets the total number of variable entries.
     * @return Column count
     */
    public int columnCount() {
        int cols = 0;
        for (Variable variable : variables) {
            cols += variable.getShape().size();
        }
        return cols;
    }

    @Override
    public String toString() {
        return "CanonicalProblem{" +
                "sense=" + sense +
                ", objective=" + objective +
                ", constraints=" + constraints.size() +
                ", variables=" + variables.size() +
                ", parameters=" + parameters.size() +
                '}';
    }
}
