/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package variables;

/**
 * The types of values that variables can take
 */
public enum ValueType {
	CONTINUOUS, INTEGER, BOOLEAN;

	/**
	 * Returns the value type mentioned in the specified declared type (for example, "global action continuous"), or null
	 */
	public static ValueType of(String declaredType) {
		String s = declaredType.toLowerCase();
		for (ValueType type : values())
			if (s.contains(type.name().toLowerCase()))
				return type;
		return null;
	}
}
