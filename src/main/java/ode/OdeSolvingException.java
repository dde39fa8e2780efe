/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package ode;

/**
 * Raised when no closed form can be found for a system of differential equations
 */
public class OdeSolvingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public OdeSolvingException(String message) {
		super(message);
	}
}
