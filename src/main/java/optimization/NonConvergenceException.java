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
 * Raised when the maximal number of generated constraints is reached while temporal constraints are still violated
 */
public class NonConvergenceException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public final int nGenerated;

	public final int horizon;

	public NonConvergenceException(int nGenerated, int horizon) {
		super("Temporal constraints are still violated after " + nGenerated + " generated constraints for horizon " + horizon);
		this.nGenerated = nGenerated;
		this.horizon = horizon;
	}
}
