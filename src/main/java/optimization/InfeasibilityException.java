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
 * Raised when no plan exists for a given horizon
 */
public class InfeasibilityException extends Exception {

	private static final long serialVersionUID = 1L;

	public final int horizon;

	public InfeasibilityException(int horizon) {
		super("No feasible plan for horizon " + horizon);
		this.horizon = horizon;
	}
}
