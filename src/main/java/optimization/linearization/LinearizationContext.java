/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.linearization;

import static utility.Kit.control;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import solver.MinlpSolver;
import solver.SolverVariable;
import variables.ValueType;

/**
 * Context object passed to ConstraintLinearizers while compiling one statement.
 * Provides the auxiliary 0/1 variables, either freshly added to the solver or taken from a list of variables
 * allocated when the same statement was compiled before (so that refinements do not add variables).
 */
public class LinearizationContext {

    private final MinlpSolver solver;
    private final String label;
    private final List<SolverVariable> reused;
    private final List<SolverVariable> auxiliaries = new ArrayList<>();
    private final double bigM;

    /**
     * Creates a new linearization context.
     *
     * @param solver the solver where auxiliary variables are added
     * @param label the label of the compiled statement (used to name auxiliary variables)
     * @param reused the auxiliary variables to be reused, in allocation order (possibly empty)
     * @param bigM the constant used in big-M constraints
     */
    public LinearizationContext(MinlpSolver solver, String label, List<SolverVariable> reused, double bigM) {
        this.solver = solver;
        this.label = label;
        this.reused = reused == null ? Collections.emptyList() : reused;
        this.bigM = bigM;
    }

    /**
     * Returns the next auxiliary 0/1 variable: the next one from the reuse list if it is not empty,
     * a new solver variable otherwise.
     *
     * @return an auxiliary variable
     */
    public SolverVariable nextAuxiliary() {
        int i = auxiliaries.size();
        SolverVariable aux;
        if (!reused.isEmpty()) {
            control(i < reused.size(), () -> "Only " + reused.size() + " auxiliary variables can be reused for " + label);
            aux = reused.get(i);
        } else
            aux = solver.addVariable("Aux_" + i + "_" + label, ValueType.BOOLEAN, 0.0, 1.0);
        auxiliaries.add(aux);
        return aux;
    }

    /**
     * Get the auxiliary variables used so far (allocated or reused).
     *
     * @return the auxiliary variables, in order
     */
    public List<SolverVariable> auxiliaries() {
        return Collections.unmodifiableList(auxiliaries);
    }

    public double bigM() {
        return bigM;
    }

    /**
     * Get the feasibility tolerance of the solver, used to encode strict comparisons.
     *
     * @return the tolerance
     */
    public double tolerance() {
        return solver.feasibilityTolerance();
    }
}
