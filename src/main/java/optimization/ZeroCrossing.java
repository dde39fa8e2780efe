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

/**
 * The result of checking temporal constraints on a solution: either no violation, or an interval [start, end] of the elapsed time in a
 * step where a temporal constraint is violated.
 */
public final class ZeroCrossing {

	private static final ZeroCrossing NONE = new ZeroCrossing();

	public static ZeroCrossing none() {
		return NONE;
	}

	public final boolean violated;

	public final int step;

	public final int iteration;

	public final int constraintIndex;

	public final double start;

	public final double end;

	/**
	 * The duration of the step in the checked solution
	 */
	public final double duration;

	/**
	 * The ratio between the middle of the violation interval and the duration of the step (0 for a step of duration 0)
	 */
	public final double coefficient;

	public final double newDuration;

	private ZeroCrossing() {
		this.violated = false;
		this.step = -1;
		this.iteration = -1;
		this.constraintIndex = -1;
		this.start = Double.NaN;
		this.end = Double.NaN;
		this.duration = Double.NaN;
		this.coefficient = Double.NaN;
		this.newDuration = Double.NaN;
	}

	/**
	 * Builds a record for a violation found in the specified step
	 *
	 * @throws IllegalArgumentException
	 *             if start, end or duration is missing
	 */
	public ZeroCrossing(int step, int iteration, int constraintIndex, Double start, Double end, Double duration) {
		if (start == null || end == null || duration == null || start.isNaN() || end.isNaN() || duration.isNaN())
			throw new IllegalArgumentException("start, end and duration must be given for a violation: start=" + start + " end=" + end
					+ " duration=" + duration);
		if (start > end)
			throw new IllegalArgumentException("Bad interval [" + start + ", " + end + "]");
		this.violated = true;
		this.step = step;
		this.iteration = iteration;
		this.constraintIndex = constraintIndex;
		this.start = start;
		this.end = end;
		this.duration = duration;
		this.coefficient = duration == 0 ? 0 : (start + end) / 2.0 / duration;
		this.newDuration = coefficient * duration;
	}

	@Override
	public String toString() {
		if (!violated)
			return "no violation";
		return "violation of temporal constraint " + constraintIndex + " at step " + step + " on [" + start + ", " + end + "] (duration " + duration
				+ ", coefficient " + coefficient + ", new duration " + newDuration + ", iteration " + iteration + ")";
	}
}
