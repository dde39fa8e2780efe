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

import evaluation.Evaluator;
import expressions.Node;
import problem.Trajectory;
import utility.Kit;

/**
 * Checks the temporal constraints of a solved trajectory between the discrete time steps. Each step is sampled every epsilon time units,
 * from 0 to the duration of the step; the first interval of consecutive samples where a temporal constraint does not hold is reported.
 * Steps are considered in order, and for each step, constraints in declaration order.
 */
public final class ViolationDetector {

	private final double epsilon;

	public ViolationDetector(double epsilon) {
		if (!(epsilon > 0))
			throw new IllegalArgumentException("The time resolution must be positive: " + epsilon);
		this.epsilon = epsilon;
	}

	/**
	 * Returns the first violation of a temporal constraint found in the trajectory, or ZeroCrossing.none()
	 */
	public ZeroCrossing detect(Trajectory trajectory, int iteration) {
		List<Node> constraints = trajectory.temporalConstraints();
		for (int h = 0; h < trajectory.horizon(); h++) {
			double dt = trajectory.duration(h);
			for (int idx = 0; idx < constraints.size(); idx++) {
				ZeroCrossing zeroCrossing = scan(trajectory, h, idx, constraints.get(idx), dt, iteration);
				if (zeroCrossing.violated) {
					Kit.log.fine("  " + zeroCrossing);
					return zeroCrossing;
				}
			}
		}
		return ZeroCrossing.none();
	}

	private ZeroCrossing scan(Trajectory trajectory, int h, int idx, Node constraint, double dt, int iteration) {
		boolean violated = false;
		double start = -epsilon, end = -epsilon;
		// samples are obtained by accumulation, as 0, eps, eps+eps, ...
		for (double time = 0; time <= dt; time += epsilon) {
			boolean holds = Evaluator.calculator(trajectory.valuesAt(h, time), trajectory.tolerance()).condition(constraint);
			if (!holds) {
				if (!violated) {
					violated = true;
					start = time;
				}
				end = time;
			}
			if (violated && (holds || time + epsilon > dt))
				return new ZeroCrossing(h, iteration, idx, start, end, dt);
		}
		return ZeroCrossing.none();
	}
}
