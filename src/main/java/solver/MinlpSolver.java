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

import variables.ValueType;

/**
 * The boundary with the numeric solver in charge of the mixed-integer program built by the planner. Calls are blocking: optimize() returns
 * once the solver has found a solution (possibly within the relative gap) or proved that there is none.
 */
public interface MinlpSolver {

	/**
	 * Adds a variable to the model
	 *
	 * @param name
	 *            the name of the variable (unique in the model)
	 * @param type
	 *            the type of the values of the variable
	 * @param lower
	 *            the lower bound, or null if unbounded
	 * @param upper
	 *            the upper bound, or null if unbounded
	 * @return a handle on the new variable
	 */
	SolverVariable addVariable(String name, ValueType type, Double lower, Double upper);

	/**
	 * Posts a constraint to the model. Constraints can be added after a call to optimize(); they are taken into account at the next call.
	 */
	void addConstraint(String name, Constraint constraint);

	void setObjective(Term objective, boolean maximization);

	/**
	 * Solves the current model
	 *
	 * @return true if a solution has been found, false if the model is infeasible
	 */
	boolean optimize();

	/**
	 * Returns the value of the specified variable in the last solution found
	 */
	double value(SolverVariable variable);

	double objectiveValue();

	/**
	 * Returns the tolerance used when checking that constraints are satisfied
	 */
	double feasibilityTolerance();

	void setRelativeGap(double gap);

	void setVerbose(boolean verbose);

	/**
	 * Sets a limit (in milliseconds) on the duration of each call to optimize(), 0 meaning no limit
	 */
	void setTimeLimit(long milliseconds);

	int numberOfVariables();

	int numberOfConstraints();
}
