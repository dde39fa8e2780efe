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

/**
 * The families of statements of a domain, in the order they are compiled
 */
public enum Family {
	INITIALS("initials"),
	INSTANTANEOUS("instantaneous_constraints"),
	TEMPORAL("temporal_constraints"),
	TRANSITIONS("transitions"),
	GOALS("goals");

	/**
	 * The name of the section of the domain file
	 */
	public final String section;

	Family(String section) {
		this.section = section;
	}
}
