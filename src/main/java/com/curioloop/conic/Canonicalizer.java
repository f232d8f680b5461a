/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Rewrites expression trees into affine expressions plus cone constraints.
 * <p>
 * Children are canonicalized before their parent. Leaves map directly to
 * affine references. An {@link Atom} of constant curvature is replaced by its
 * value: a fixed constant when no parameter occurs in it, otherwise a
 * {@link CallbackParam} evaluated at assembly. Any other atom is first checked
 * against the composition rules and then rewritten by its operator's graph
 * implementation, which may allocate auxiliary variables and emit constraints
 * through this object.
 * Constraints are returned in declaration order: those of the children in
 * argument order, then those introduced by the node itself.
 * </p>
 * <p>
 * Every public call starts from an empty scope and returns a self-contained
 * result. Within one call a node reached more than once (a shared
 * subexpression) is rewritten once; later visits reuse its affine result and
 * add no constraints. A whole-problem call shares one scope across the
 * objective and all relations. The variable and auxiliary lists describe the
 * most recent call. Each call is all-or-nothing: if it fails, the
 * canonicalizer is left as it was before the call. Leaves must belong to the
 * context this canonicalizer allocates from.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>.
 * </p>
 */
public final class Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private final ModelContext context;
    private final Map<Expression, AffineExpr> memo = new IdentityHashMap<>();
    private final Map<Integer, Variable> variables = new LinkedHashMap<>();
    private final Set<Parameter> parameters = new LinkedHashSet<>();
    private final List<Variable> auxiliaries = new ArrayList<>();
    private List<Constraint> sink;

    /**
     * Creates a canonicalizer allocating auxiliary ids from the given context.
     * @param context Session the model was built in
     */
    public Canonicalizer(ModelContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Context cannot be null");
        }
        this.context = context;
    }

    /**
     * Canonicalizes an expression.
     * @param expression Expression tree
     * @return Affine expression of the same shape with its constraints
     * @throws DcpViolationException if some node breaks a composition rule
     * @throws SizeMismatchException if some node's rewrite has the wrong shape
     * @throws ValidationException if a leaf belongs to another context
     */
    public CanonicalForm canonicalize(Expression expression) {
        List<Constraint> constraints = new ArrayList<>();
        AffineExpr affine = atomically(() -> {
            reset();
            return visit(expression, constraints);
        });
        log.trace("Canonicalized {} with {} constraints", expression, constraints.size());
        return new CanonicalForm(affine, constraints);
    }

    /**
     * Canonicalizes an objective into minimization form.
     * @param objective Objective
     * @return Scalar affine expression to minimize with its constraints
     * @throws DcpViolationException if the objective is not DCP
     */
    public CanonicalForm canonicalize(Objective objective) {
        return atomically(() -> {
            reset();
            return objectiveForm(objective);
        });
    }

    private CanonicalForm objectiveForm(Objective objective) {
        List<Constraint> constraints = new ArrayList<>();
        AffineExpr affine = atomically(() -> {
            AffineExpr value = visit(objective.getExpression(), constraints);
            if (!objective.isDcp()) {
                throw new DcpViolationException("Cannot " + objective.getSense().name().toLowerCase(Locale.ROOT)
                    + " an expression that is " + objective.getExpression().getCurvature());
            }
            return objective.getSense() == Objective.Sense.MAXIMIZE ? AffineExpr.negate(value) : value;
        });
        return new CanonicalForm(affine, constraints);
    }

    /**
     * Canonicalizes a relation.
     * @param relation Relation
     * @return Constraints of its subexpressions followed by the relation itself
     * @throws DcpViolationException if the relation is not DCP
     */
    public List<Constraint> canonicalize(Relation relation) {
        return atomically(() -> {
            reset();
            return relationForm(relation);
        });
    }

    private List<Constraint> relationForm(Relation relation) {
        List<Constraint> constraints = new ArrayList<>();
        atomically(() -> {
            List<AffineExpr> args = new ArrayList<>();
            for (Expression arg : relation.getArgs()) {
                args.add(visit(arg, constraints));
            }
            if (!relation.isDcp()) {
                throw new DcpViolationException("Relation is not DCP: " + relation);
            }
            switch (relation.getKind()) {
                case EQUAL:
                    constraints.add(new EqualityConstraint(context.nextId(), args.get(0)));
                    break;
                case LESS_EQUAL:
                    constraints.add(new InequalityConstraint(context.nextId(), AffineExpr.negate(args.get(0))));
                    break;
                default:
                    constraints.add(new SOCAxis(context.nextId(), args.get(0), args.get(1), relation.getAxis()));
                    break;
            }
            return null;
        });
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Canonicalizes a whole problem.
     * @param objective Objective
     * @param relations Relations in declaration order
     * @return Problem structure, independent of parameter values
     */
    public CanonicalProblem canonicalize(Objective objective, List<Relation> relations) {
        CanonicalProblem problem = atomically(() -> {
            reset();
            CanonicalForm objectiveForm = objectiveForm(objective);
            List<Constraint> constraints = new ArrayList<>(objectiveForm.getConstraints());
            for (Relation relation : relations) {
                constraints.addAll(relationForm(relation));
            }
            return new CanonicalProblem(objective.getSense(), objectiveForm.getAffine(),
                constraints, getVariables(), new ArrayList<>(parameters));
        });
        log.debug("Canonicalized problem: {} constraints, {} variables ({} auxiliary), {} parameters",
            problem.getConstraints().size(), problem.getVariables().size(), auxiliaries.size(),
            problem.getParameters().size());
        return problem;
    }

    /**
     * Gets every variable seen or created by the most recent call, ordered by id.
     * @return Variables
     */
    public List<Variable> getVariables() {
        return Collections.unmodifiableList(new ArrayList<>(new TreeMap<>(variables).values()));
    }

    /**
     * Gets the auxiliary variables created by the most recent call.
     * @return Auxiliary variables in creation order
     */
    public List<Variable> getAuxiliaryVariables() {
        return Collections.unmodifiableList(new ArrayList<>(auxiliaries));
    }

    private AffineExpr visit(Expression expression, List<Constraint> out) {
        AffineExpr cached = memo.get(expression);
        if (cached != null) {
            return cached;
        }
        AffineExpr affine;
        if (expression instanceof Leaf) {
            requireOwned((Leaf) expression);
            CanonicalForm form = ((Leaf) expression).canonicalize();
            out.addAll(form.getConstraints());
            affine = form.getAffine();
            if (expression instanceof Variable) {
                Variable v = (Variable) expression;
                variables.put(v.getId(), v);
            } else if (expression instanceof Parameter) {
                parameters.add((Parameter) expression);
            }
        } else if (expression.isConstant()) {
            affine = constantValue((Atom) expression);
        } else {
            Atom atom = (Atom) expression;
            List<AffineExpr> args = new ArrayList<>(atom.getArgs().size());
            for (Expression arg : atom.getArgs()) {
                args.add(visit(arg, out));
            }
            atom.checkDcp();
            List<Constraint> previous = sink;
            sink = out;
            try {
                affine = atom.getOperator().graphImplementation(atom, args, this);
            } finally {
                sink = previous;
            }
        }
        if (!affine.getShape().equals(expression.getShape())) {
            throw new SizeMismatchException("Canonical form of " + expression + " has shape "
                + affine.getShape() + " but the expression has shape " + expression.getShape());
        }
        memo.put(expression, affine);
        return affine;
    }

    /**
     * Binds a constant atom to its value instead of rewriting its graph.
     */
    private AffineExpr constantValue(Atom atom) {
        Set<Parameter> inner = atom.parameters();
        if (inner.isEmpty()) {
            return AffineExpr.constant(atom.value());
        }
        for (Parameter parameter : inner) {
            requireOwned(parameter);
        }
        CallbackParam value = context.derivedParam(atom);
        parameters.add(value);
        return AffineExpr.parameter(value);
    }

    private void requireOwned(Leaf leaf) {
        ModelContext owner = leaf.getContext();
        if (owner != null && owner != context) {
            throw new ValidationException(leaf + " belongs to a different model context");
        }
    }

    private void reset() {
        memo.clear();
        variables.clear();
        parameters.clear();
        auxiliaries.clear();
    }

    private <T> T atomically(Supplier<T> action) {
        Map<Expression, AffineExpr> memoBefore = new IdentityHashMap<>(memo);
        Map<Integer, Variable> variablesBefore = new LinkedHashMap<>(variables);
        Set<Parameter> parametersBefore = new LinkedHashSet<>(parameters);
        List<Variable> auxiliariesBefore = new ArrayList<>(auxiliaries);
        try {
            return action.get();
        } catch (RuntimeException e) {
            memo.clear();
            memo.putAll(memoBefore);
            variables.clear();
            variables.putAll(variablesBefore);
            parameters.clear();
            parameters.addAll(parametersBefore);
            auxiliaries.clear();
            auxiliaries.addAll(auxiliariesBefore);
            throw e;
        }
    }

    // ==================== Graph implementation hooks ====================

    /**
     * Allocates an auxiliary variable.
     * @param shape Shape
     * @return Affine reference to the new variable
     */
    AffineExpr newVariable(Shape shape) {
        Variable v = context.variable(shape);
        auxiliaries.add(v);
        variables.put(v.getId(), v);
        return AffineExpr.variable(v.getId(), shape);
    }

    /**
     * Emits {@code a >= b}; a scalar side is broadcast.
     */
    void greaterOrEqual(AffineExpr a, AffineExpr b) {
        nonNegative(AffineExpr.subtract(a, b));
    }

    void nonNegative(AffineExpr expr) {
        emit(new InequalityConstraint(context.nextId(), expr));
    }

    void secondOrderCone(AffineExpr t, AffineExpr x, SOCAxis.Axis axis) {
        emit(new SOCAxis(context.nextId(), t, x, axis));
    }

    private void emit(Constraint constraint) {
        if (sink == null) {
            throw new IllegalStateException("Constraints can only be emitted during canonicalization");
        }
        sink.add(constraint);
    }
}
