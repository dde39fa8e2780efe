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

import static utility.Kit.control;

import evaluation.CompiledExpressions;
import problem.PlanModel;
import solver.Constraint;
import utility.Kit;

/**
 * Builds the cutting constraint corresponding to a violation: the violated temporal constraint is compiled again for the same step, with
 * the duration of the step scaled by the coefficient of the violation, so that the constraint is enforced at the middle of the violation
 * interval. The new constraints are added to the model; nothing is removed.
 */
public final class ConstraintGenerator {

	public GeneratedConstraint generate(PlanModel model, ZeroCrossing zeroCrossing) {
		control(zeroCrossing.violated, () -> "No violation to repair");
		CompiledExpressions<Constraint> compiled = model.addTemporalCut(zeroCrossing.constraintIndex, zeroCrossing.step, zeroCrossing.coefficient,
				zeroCrossing.iteration);
		GeneratedConstraint generated = new GeneratedConstraint(zeroCrossing, compiled.expressions());
		Kit.log.fine("  New constraint: " + generated);
		return generated;
	}
}
