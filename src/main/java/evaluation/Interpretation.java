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

import java.util.List;

import expressions.Operator;
import solver.SolverVariable;

/**
 * The table of operations used by the evaluator. An interpretation gives a meaning to constants, operators and function calls, so that the
 * same expression tree can be turned either into solver constraints or into numbers.
 *
 * @param <V>
 *            the type of values (for example, numbers or solver terms)
 * @param <C>
 *            the type of conditions (for example, booleans or solver constraints)
 */
public interface Interpretation<V, C> {

	Mode mode();

	V constant(double value);

	/**
	 * Returns the value of an auxiliary 0/1 variable introduced when linearizing disjunctions
	 */
	V indicator(SolverVariable auxiliary);

	/**
	 * Applies a unary arithmetic operator (PLUS or MINUS)
	 */
	V unary(Operator op, V operand);

	V binary(Operator op, V left, V right);

	/**
	 * Applies the named function to the specified arguments
	 *
	 * @throws expressions.ParseException
	 *             if the function is unknown
	 */
	V call(String function, List<V> arguments);

	C compare(Operator op, V left, V right);

	/**
	 * Returns the condition corresponding to a value used as a statement
	 */
	C truth(V value);

	C negate(C condition);

	C any(List<C> conditions);

	C all(List<C> conditions);
}
