/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.List;

import evaluation.Bindings;
import expressions.Node;

/**
 * A solved plan, seen as a trajectory that can be checked between the discrete time steps
 */
public interface Trajectory {

	int horizon();

	/**
	 * Returns the duration of the specified step in the current solution
	 */
	double duration(int step);

	/**
	 * Returns the temporal constraints, in declaration order, written in terms of the elapsed time in a step
	 */
	List<Node> temporalConstraints();

	/**
	 * Returns the values of all names at the specified step of the current solution, when the specified time has elapsed in the step
	 */
	Bindings<Double> valuesAt(int step, double elapsed);

	/**
	 * Returns the tolerance to be used when checking constraints
	 */
	double tolerance();
}
