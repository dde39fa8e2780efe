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

import java.util.function.ToDoubleFunction;

/**
 * An algebraic constraint ready to be posted to a solver: body &lt;= 0, body &gt;= 0 or body == 0.
 */
public final class Constraint {

	public final Term body;

	public final Relation relation;

	public Constraint(Term body, Relation relation) {
		this.body = body;
		this.relation = relation;
	}

	/**
	 * Builds the constraint left op right, by moving everything to the left side
	 */
	public static Constraint of(Term left, Relation relation, Term right) {
		return new Constraint(left.minus(right), relation);
	}

	/**
	 * Returns true if the constraint holds (up to the specified tolerance) for the given values of the variables
	 */
	public boolean isSatisfiedBy(ToDoubleFunction<SolverVariable> values, double tolerance) {
		return holds(body.evaluate(values), tolerance);
	}

	boolean holds(double value, double tolerance) {
		switch (relation) {
		case LE:
			return value <= tolerance;
		case GE:
			return value >= -tolerance;
		default:
			return Math.abs(value) <= tolerance;
		}
	}

	@Override
	public String toString() {
		Term variablePart = body.minus(Term.constant(body.constant()));
		return variablePart + " " + relation.symbol + " " + (body.constant() == 0 ? 0.0 : -body.constant());
	}
}
