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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import solver.SolverVariable;

/**
 * The result of evaluating one statement: an ordered list of conditions (a conjunction gives one condition per operand), together with the
 * auxiliary variables used when linearizing disjunctions.
 *
 * @param <C>
 *            the type of conditions
 */
public final class CompiledExpressions<C> implements Iterable<C> {

	public final String label;

	public final int step;

	private final List<C> expressions;

	private final List<SolverVariable> auxiliaries;

	public CompiledExpressions(String label, int step, List<C> expressions, List<SolverVariable> auxiliaries) {
		this.label = label;
		this.step = step;
		this.expressions = Collections.unmodifiableList(new ArrayList<>(expressions));
		this.auxiliaries = Collections.unmodifiableList(new ArrayList<>(auxiliaries));
	}

	public List<C> expressions() {
		return expressions;
	}

	public List<SolverVariable> auxiliaries() {
		return auxiliaries;
	}

	public int size() {
		return expressions.size();
	}

	@Override
	public Iterator<C> iterator() {
		return expressions.iterator();
	}

	@Override
	public String toString() {
		return label + "@" + step + " " + expressions + (auxiliaries.isEmpty() ? "" : " aux=" + auxiliaries);
	}
}
