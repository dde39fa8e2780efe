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

/**
 * Raised when the solver cannot represent or solve a model (for example, a non-polynomial function of decision variables). Always fatal.
 */
public class SolverException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SolverException(String message) {
		super(message);
	}

	public SolverException(String message, Throwable cause) {
		super(message, cause);
	}
}
