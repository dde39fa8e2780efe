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

import static utility.Kit.control;

import solver.SolverVariable;
import solver.Term;

/**
 * A modeled quantity at a given time step. A variable is identified by its name and its time step; it is either bound to a solver
 * variable, or (for constants) to a literal value. Variables are never modified after their creation: values are read from the solver.
 */
public final class Variable {

	/**
	 * The time step used for global variables, which share the same solver variable over the whole horizon
	 */
	public static final int GLOBAL = -1;

	public final String name;

	public final Role role;

	/**
	 * The type of values, null for constants
	 */
	public final ValueType type;

	public final int time;

	/**
	 * The solver variable, null for constants
	 */
	public final SolverVariable handle;

	/**
	 * The value of a constant (meaningless for other variables)
	 */
	public final double value;

	private Variable(String name, Role role, ValueType type, int time, SolverVariable handle, double value) {
		this.name = name;
		this.role = role;
		this.type = type;
		this.time = time;
		this.handle = handle;
		this.value = value;
	}

	public static Variable constant(String name, double value) {
		return new Variable(name, Role.CONSTANT, null, GLOBAL, null, value);
	}

	public static Variable of(String name, Role role, int time, SolverVariable handle) {
		control(role != Role.CONSTANT && handle != null, () -> "A solver variable is required for " + name);
		return new Variable(name, role, handle.type, time, handle, 0);
	}

	public boolean isConstant() {
		return role == Role.CONSTANT;
	}

	public boolean isGlobal() {
		return time == GLOBAL;
	}

	/**
	 * Returns the symbolic value of this variable, as used when building solver constraints
	 */
	public Term term() {
		return isConstant() ? Term.constant(value) : Term.of(handle);
	}

	@Override
	public String toString() {
		return name + (isGlobal() ? "" : "_" + time) + (isConstant() ? "=" + value : "");
	}
}
