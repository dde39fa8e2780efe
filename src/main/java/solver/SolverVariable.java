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
 * A handle on a variable of a solver model. Handles are identified by their index in the model they belong to.
 */
public final class SolverVariable implements Comparable<SolverVariable> {

	public final int index;

	public final String name;

	public final ValueType type;

	public SolverVariable(int index, String name, ValueType type) {
		this.index = index;
		this.name = name;
		this.type = type;
	}

	@Override
	public int compareTo(SolverVariable other) {
		return Integer.compare(index, other.index);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SolverVariable && ((SolverVariable) obj).index == index && ((SolverVariable) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return index;
	}

	@Override
	public String toString() {
		return name;
	}
}
