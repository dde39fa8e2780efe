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

/**
 * Builds a fresh solver model. A new model is built for every horizon tried by the planner.
 */
@FunctionalInterface
public interface SolverFactory {

	MinlpSolver create(String modelName, double feasibilityTolerance);
}
