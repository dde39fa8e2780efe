/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package evaluation;

/**
 * The two ways of evaluating an expression tree
 */
public enum Mode {
	/**
	 * Expressions are turned into solver constraints
	 */
	COMPILE,

	/**
	 * Expressions are evaluated to numbers and booleans
	 */
	CALCULATE;
}
