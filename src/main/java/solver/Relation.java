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
 * The relation between the body of a constraint and zero.
 */
public enum Relation {
	LE("<="), GE(">="), EQ("==");

	public final String symbol;

	Relation(String symbol) {
		this.symbol = symbol;
	}
}
