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
 * The role of a variable in a planning domain
 */
public enum Role {
	ACTION, STATE, AUXILIARY, CONSTANT;

	/**
	 * Returns the role mentioned in the specified declared type (for example, "state continuous"), or null
	 */
	public static Role of(String declaredType) {
		String s = declaredType.toLowerCase();
		for (Role role : values())
			if (s.contains(role.name().toLowerCase()))
				return role;
		return null;
	}

	/**
	 * Returns true if variables with this role also exist at the end of the horizon
	 */
	public boolean hasTerminalValue() {
		return this == STATE;
	}
}
