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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import solver.SolverVariable;

/**
 * The auxiliary variables allocated when compiling statements, indexed by family, declaration index and time step. When a statement is
 * compiled again for the same step, the recorded variables are reused.
 */
public final class AuxiliaryIndex {

	private static final class Key {
		final Family family;
		final int index;
		final int step;

		Key(Family family, int index, int step) {
			this.family = family;
			this.index = index;
			this.step = step;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Key))
				return false;
			Key other = (Key) obj;
			return family == other.family && index == other.index && step == other.step;
		}

		@Override
		public int hashCode() {
			return Objects.hash(family, index, step);
		}
	}

	private final Map<Key, List<SolverVariable>> map = new HashMap<>();

	/**
	 * Returns the auxiliary variables recorded for the specified statement at the specified step (an empty list if there are none)
	 */
	public List<SolverVariable> get(Family family, int index, int step) {
		return map.getOrDefault(new Key(family, index, step), Collections.emptyList());
	}

	/**
	 * Records the auxiliary variables of the specified statement at the specified step, unless the list is empty
	 */
	public void put(Family family, int index, int step, List<SolverVariable> auxiliaries) {
		if (!auxiliaries.isEmpty())
			map.put(new Key(family, index, step), List.copyOf(auxiliaries));
	}

	public int size() {
		return map.values().stream().mapToInt(List::size).sum();
	}
}
