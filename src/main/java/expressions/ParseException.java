/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

/**
 * Raised when a text of the expression language is malformed, or when it uses a construct that cannot be evaluated (conditional
 * expressions, attribute calls, disjunctions of non comparisons, unknown names or functions). Always fatal.
 */
public class ParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ParseException(String message) {
		super(message);
	}

	public ParseException(String message, String text, int position) {
		super(message + " at position " + position + " in: " + text);
	}
}
