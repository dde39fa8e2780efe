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
import java.util.stream.Collectors;

import solver.Constraint;

/**
 * A cutting constraint added to the model, with the violation it comes from
 */
public final class GeneratedConstraint {

	public final ZeroCrossing zeroCrossing;

	public final List<Constraint> constraints;

	public GeneratedConstraint(ZeroCrossing zeroCrossing, List<Constraint> constraints) {
		this.zeroCrossing = zeroCrossing;
		this.constraints = List.copyOf(constraints);
	}

	/**
	 * Returns the fields saved in CSV files, in order
	 */
	public static List<String> header() {
		return List.of("interval_start", "interval_end", "dt_interval", "zero_crossing_coefficient", "new_dt_val", "horizon", "iteration",
				"constraint_idx");
	}

	public List<Object> row() {
		ZeroCrossing z = zeroCrossing;
		return List.of(z.start, z.end, z.duration, z.coefficient, z.newDuration, z.step, z.iteration, z.constraintIndex);
	}

	@Override
	public String toString() {
		return zeroCrossing + "\n    " + constraints.stream().map(Constraint::toString).collect(Collectors.joining("\n    "));
	}
}
