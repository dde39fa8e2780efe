/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import java.util.List;

import variables.Variable;

/**
 * The value of a variable in the solution found at some iteration of the generation of constraints
 */
public final class Snapshot {

	public final Variable variable;

	public final double value;

	public final int iteration;

	public Snapshot(Variable variable, double value, int iteration) {
		this.variable = variable;
		this.value = value;
		this.iteration = iteration;
	}

	/**
	 * Returns the fields saved in CSV files, in order
	 */
	public static List<String> header() {
		return List.of("name", "variable_type", "value_type", "horizon", "variable_value", "iteration");
	}

	public List<Object> row() {
		return List.of(variable.name, variable.role, variable.type == null ? "" : variable.type, variable.time, value, iteration);
	}

	@Override
	public String toString() {
		return variable.name + "_" + variable.time + "=" + value + " (iteration " + iteration + ")";
	}
}
