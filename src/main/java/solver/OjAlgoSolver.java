/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import static utility.Kit.control;

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.ojalgo.optimisation.integer.IntegerSolver;
import org.ojalgo.optimisation.integer.IntegerStrategy;
import org.ojalgo.type.context.NumberContext;

import utility.Kit;
import variables.ValueType;

/**
 * A solver backed by an ojAlgo expressions-based model, with continuous, integer and binary variables. Constraints must be linear; the
 * objective may be quadratic (convex when minimized, concave when maximized). The built-in ojAlgo solvers (simplex, convex and
 * branch-and-bound) are selected by ojAlgo depending on the model.
 *
 * Variables and constraints are recorded, and the ojAlgo model is built again at each call to optimize(), so that constraints can be added
 * between two calls. Constraints without any variable are not posted: they are checked immediately, and a violated one makes the model
 * infeasible.
 */
public class OjAlgoSolver implements MinlpSolver {

    private static final class Bounds {
        final ValueType type;
        final Double lower, upper;

        Bounds(ValueType type, Double lower, Double upper) {
            this.type = type;
            this.lower = lower;
            this.upper = upper;
        }
    }

    private final String name;

    private final double feasibilityTolerance;

    private final List<SolverVariable> variables = new ArrayList<>();

    private final List<Bounds> bounds = new ArrayList<>();

    private final List<String> constraintNames = new ArrayList<>();

    private final List<Constraint> constraints = new ArrayList<>();

    private Term objective;

    private boolean maximization = true;

    /**
     * Set when a constraint without variables is violated
     */
    private boolean trivialInfeasibility;

    private double gap = -1;

    private boolean verbose;

    private long timeLimit;

    private ExpressionsBasedModel model;

    private Variable[] lpVars;

    private Optimisation.Result result;

    /**
     * Creates an empty model.
     *
     * @param name the name of the model (used in logs)
     * @param feasibilityTolerance the tolerance used when checking constraints
     */
    public OjAlgoSolver(String name, double feasibilityTolerance) {
        this.name = name;
        this.feasibilityTolerance = feasibilityTolerance;
    }

    @Override
    public SolverVariable addVariable(String name, ValueType type, Double lower, Double upper) {
        SolverVariable x = new SolverVariable(variables.size(), name, type);
        variables.add(x);
        bounds.add(type == ValueType.BOOLEAN ? new Bounds(type, lower == null ? 0.0 : Math.max(0.0, lower), upper == null ? 1.0 : Math.min(1.0, upper))
                : new Bounds(type, lower, upper));
        return x;
    }

    private void check(SolverVariable x) {
        control(x.index < variables.size() && variables.get(x.index).equals(x), () -> x + " does not belong to model " + name);
    }

    @Override
    public void addConstraint(String name, Constraint constraint) {
        Term body = constraint.body;
        for (Term.Monomial m : body.monomials().keySet()) {
            // ojAlgo reports nonconvex quadratic constraints as infeasible
            if (m.degree() > 1)
                throw new SolverException("Constraint " + name + " is not linear (term " + m + ") and cannot be encoded with ojAlgo: " + constraint);
            m.factors().forEach(this::check);
        }
        if (body.isConstant()) {
            if (!constraint.holds(body.constant(), feasibilityTolerance)) {
                Kit.log.fine("Constraint " + name + " without variables is violated: " + constraint);
                trivialInfeasibility = true;
            }
            return;
        }
        constraintNames.add(name);
        constraints.add(constraint);
    }

    @Override
    public void setObjective(Term objective, boolean maximization) {
        control(this.objective == null, () -> "The objective of " + name + " is already set");
        for (Term.Monomial m : objective.monomials().keySet())
            if (m.degree() > 2)
                throw new SolverException("Terms of degree " + m.degree() + " cannot be encoded with ojAlgo: " + m);
        this.objective = objective;
        this.maximization = maximization;
    }

    /**
     * Copies the variable part of a term into an ojAlgo expression.
     */
    private void fill(Expression expr, Term term) {
        for (Entry<Term.Monomial, Double> e : term.monomials().entrySet()) {
            List<SolverVariable> factors = e.getKey().factors();
            if (factors.size() == 1)
                expr.set(lpVars[factors.get(0).index], e.getValue());
            else
                expr.set(lpVars[factors.get(0).index], lpVars[factors.get(1).index], e.getValue());
        }
    }

    /**
     * Build the ojAlgo model from the recorded variables, constraints and objective.
     */
    private void buildModel() {
        model = new ExpressionsBasedModel();
        lpVars = new Variable[variables.size()];
        for (int i = 0; i < lpVars.length; i++) {
            Bounds b = bounds.get(i);
            lpVars[i] = model.addVariable(variables.get(i).name);
            if (b.lower != null)
                lpVars[i].lower(b.lower);
            if (b.upper != null)
                lpVars[i].upper(b.upper);
            if (b.type != ValueType.CONTINUOUS)
                lpVars[i].integer(true);
        }
        for (int i = 0; i < constraints.size(); i++) {
            Constraint c = constraints.get(i);
            // ojAlgo identifies expressions by name, so names are made unique
            Expression expr = model.addExpression(constraintNames.get(i) + "#" + i);
            fill(expr, c.body);
            double rhs = -c.body.constant();
            switch (c.relation) {
                case LE:
                    expr.upper(rhs);
                    break;
                case GE:
                    expr.lower(rhs);
                    break;
                case EQ:
                    expr.level(rhs);
                    break;
            }
        }
        if (objective != null) {
            Expression objExpr = model.addExpression("objective");
            fill(objExpr, objective);
            objExpr.weight(1);
        }
        configureSolver();
    }

    /**
     * Returns the ojAlgo context whose relative precision corresponds to the specified relative gap (at least one digit, at most 12).
     */
    static NumberContext gapTolerance(double gap) {
        int digits = gap <= 0 ? 12 : Math.max(1, Math.min(12, (int) Math.round(-Math.log10(gap))));
        return NumberContext.of(digits, digits + 1);
    }

    /**
     * Configure solver options. Called each time the model is built.
     */
    private void configureSolver() {
        if (gap >= 0)
            model.options.integer(IntegerStrategy.DEFAULT.withGapTolerance(gapTolerance(gap)));
        if (verbose)
            model.options.progress(IntegerSolver.class);
        if (timeLimit > 0L)
            model.options.time_abort = timeLimit;
    }

    @Override
    public boolean optimize() {
        result = null;
        if (trivialInfeasibility)
            return false;
        buildModel();
        long startTime = System.currentTimeMillis();
        try {
            result = maximization ? model.maximise() : model.minimise();
        } catch (RuntimeException e) {
            throw new SolverException("ojAlgo failed on model " + name, e);
        }
        long elapsed = System.currentTimeMillis() - startTime;
        Kit.log.fine("Solve time of " + name + ": " + elapsed + "ms, state: " + result.getState()
                + (result.getState().isFeasible() ? ", value: " + objectiveValue() : ""));
        return result.getState().isFeasible();
    }

    private void controlSolution() {
        control(result != null && result.getState().isFeasible(), () -> "No solution available for model " + name);
    }

    @Override
    public double value(SolverVariable variable) {
        controlSolution();
        check(variable);
        // variables are added to the ojAlgo model in the order of their indexes
        return result.doubleValue(variable.index);
    }

    @Override
    public double objectiveValue() {
        controlSolution();
        return objective == null ? 0 : objective.evaluate(this::value);
    }

    /**
     * Returns the ojAlgo model built by the last call to optimize(), or null
     */
    ExpressionsBasedModel model() {
        return model;
    }

    @Override
    public double feasibilityTolerance() {
        return feasibilityTolerance;
    }

    @Override
    public void setRelativeGap(double gap) {
        this.gap = gap;
    }

    @Override
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void setTimeLimit(long milliseconds) {
        this.timeLimit = milliseconds;
    }

    @Override
    public int numberOfVariables() {
        return variables.size();
    }

    @Override
    public int numberOfConstraints() {
        return constraints.size();
    }

    @Override
    public String toString() {
        return "ojAlgo model " + name + " (" + variables.size() + " variables, " + constraints.size() + " constraints)";
    }
}
