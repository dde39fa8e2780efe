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
 * The tag of a node of an expression tree. Evaluators dispatch on this tag.
 */
public enum Kind {
	NUMBER, NAME, UNARY, BINARY, COMPARE, AND, OR, CALL, ATTRIBUTE_CALL, CONDITIONAL;
}
