/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Optimization problem: an objective and an ordered list of relations.
 * <p>
 * The canonical form is computed on first use and kept, since it does not
 * depend on parameter values. Every {@link #assemble()} takes a fresh
 * parameter snapshot, so changing a parameter only requires re-assembly.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. The memoized canonical form is
 * created lazily without synchronization.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * ModelContext ctx = new ModelContext();
 * Variable x = ctx.variable(2);
 * Parameter b = ctx.parameter(2, 1);
 * b.setValue(1.0, 2.0);
 *
 * Problem problem = Problem.builder()
 *     .context(ctx)
 *     .minimize(Atoms.norm2(Atoms.subtract(x, b)))
 *     .subjectTo(Relation.geq(x, Constant.scalar(0)))
 *     .build();
 *
 * ConicData data = problem.assemble();
 * SolveResult result = problem.solve(mySolver);
 * }</pre>
 */
public final class Problem {

    private static final Logger log = LoggerFactory.getLogger(Problem.class);

    private final ModelContext context;
    private final Objective objective;
    private final List<Relation> relations;
    private CanonicalProblem canonical;

    private Problem(Builder builder) {
        this.context = builder.context;
        this.objective = builder.objective;
        this.relations = Collections.unmodifiableList(new ArrayList<>(builder.relations));
    }

    /**
     * Creates a new builder.
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Objective getObjective() {
        return objective;
    }

    public List<Relation> getRelations() {
        return relations;
    }

    public ModelContext getContext() {
        return context;
    }

    /**
     * Checks the objective and every relation against the composition rules.
     * @return true if the problem is DCP
     */
    public boolean isDcp() {
        if (!objective.isDcp()) {
            return false;
        }
        for (Relation relation : relations) {
            if (!relation.isDcp()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects the user variables of the problem.
     * @return Variables in order of first appearance
     */
    public Set<Variable> variables() {
        Set<Variable> out = new LinkedHashSet<>(objective.getExpression().variables());
        for (Relation relation : relations) {
            out.addAll(relation.variables());
        }
        return out;
    }

    /**
     * Collects the parameters of the problem.
     * @return Parameters in order of first appearance
     */
    public Set<Parameter> parameters() {
        Set<Parameter> out = new LinkedHashSet<>(objective.getExpression().parameters());
        for (Relation relation : relations) {
            out.addAll(relation.parameters());
        }
        return out;
    }

    /**
     * Gets the canonical form, computing it on first call.
     * @return Canonical problem
     * @throws DcpViolationException if the problem is not DCP
     * @throws ValidationException if a leaf was built in another context
     */
    public CanonicalProblem canonicalize() {
        if (canonical == null) {
            canonical = new Canonicalizer(context).canonicalize(objective, relations);
        }
        return canonical;
    }

    /**
     * Assembles the problem with the current parameter values.
     * @return Conic data
     * @throws AssemblyException if a parameter has no value
     */
    public ConicData assemble() {
        return ConicAssembler.assemble(canonicalize());
    }

    /**
     * Assembles the problem, runs a solver and scatters the solution into the
     * variables.
     * @param solver External conic solver
     * @return Primal vector and optimal value in the problem's own sense
     * @throws AssemblyException if the solver returns a vector of the wrong length
     */
    public SolveResult solve(ConicSolver solver) {
        if (solver == null) {
            throw new IllegalArgumentException("Solver cannot be null");
        }
        ConicData data = assemble();
        double[] x = solver.solve(data);
        data.unpack(x);
        double value = data.objectiveValue(x);
        if (objective.getSense() == Objective.Sense.MAXIMIZE) {
            value = -value;
        }
        log.debug("Solved problem: objective {}", value);
        return new SolveResult(x, value, objective.getSense());
    }

    @Override
    public String toString() {
        return "Problem{" +
                "objective=" + objective +
                ", relations=" + relations +
                '}';
    }

    /**
     * Builder for {@link Problem}.
     */
    public static final class Builder {
        private ModelContext context;
        private Objective objective;
        private final List<Relation> relations = new ArrayList<>();

        private Builder() {}

        /**
         * Sets the session that allocates auxiliary variable ids.
         * @param context Model context the expressions were built in
         * @return This builder
         */
        public Builder context(ModelContext context) {
            this.context = context;
            return this;
        }

        public Builder objective(Objective objective) {
            this.objective = objective;
            return this;
        }

        public Builder minimize(Expression expression) {
            return objective(Objective.minimize(expression));
        }

        public Builder maximize(Expression expression) {
            return objective(Objective.maximize(expression));
        }

        /**
         * Adds relations in declaration order.
         * @param constraints Relations
         * @return This builder
         */
        public Builder subjectTo(Relation... constraints) {
            if (constraints != null) {
                subjectTo(Arrays.asList(constraints));
            }
            return this;
        }

        public Builder subjectTo(List<Relation> constraints) {
            for (Relation r : constraints) {
                if (r != null) {
                    relations.add(r);
                }
            }
            return this;
        }

        /**
         * Builds the problem.
         * @return Problem
         * @throws IllegalArgumentException if the context or objective is missing
         */
        public Problem build() {
            if (context == null) {
                throw new IllegalArgumentException("Model context is required");
            }
            if (objective == null) {
                throw new IllegalArgumentException("Objective is required");
            }
            return new Problem(this);
        }
    }
}
