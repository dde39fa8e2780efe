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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import solver.MinlpSolver;
import solver.SolverVariable;

/**
 * The variables of a plan model, indexed by name and time step. Names are kept in declaration order. Global variables and constants are
 * registered once and returned for any time step.
 */
public final class VariableRegistry {

	private static final class Key {
		final String name;
		final int time;

		Key(String name, int time) {
			this.name = name;
			this.time = time;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Key && ((Key) obj).name.equals(name) && ((Key) obj).time == time;
		}

		@Override
		public int hashCode() {
			return name.hashCode() * 31 + time;
		}
	}

	private final Map<Key, Variable> variables = new LinkedHashMap<>();

	/**
	 * Roles of declared names, in declaration order
	 */
	private final Map<String, Role> roles = new LinkedHashMap<>();

	private final Map<String, Boolean> globals = new HashMap<>();

	private void declare(String name, Role role, boolean global) {
		Role previous = roles.putIfAbsent(name, role);
		control(previous == null || previous == role, () -> name + " is declared both as " + previous + " and " + role);
		globals.put(name, global);
	}

	public Variable addConstant(String name, double value) {
		control(!roles.containsKey(name) || roles.get(name) == Role.CONSTANT, () -> name + " is already declared");
		declare(name, Role.CONSTANT, true);
		Variable x = Variable.constant(name, value);
		variables.put(new Key(name, Variable.GLOBAL), x);
		return x;
	}

	/**
	 * Creates (in the solver) and registers the variable for the specified name and time step. For a global variable, the solver variable
	 * is created at the first call and shared afterwards.
	 */
	public Variable add(MinlpSolver solver, String name, Role role, ValueType type, boolean global, int time, Double lower, Double upper) {
		control(role != Role.CONSTANT, () -> "Constants have no solver variable: " + name);
		declare(name, role, global);
		Key key = new Key(name, global ? Variable.GLOBAL : time);
		Variable x = variables.get(key);
		if (x != null) {
			control(global, () -> name + " already exists at time " + time);
			return x;
		}
		SolverVariable handle = solver.addVariable(global ? name : name + "_" + time, type, lower, upper);
		x = Variable.of(name, role, global ? Variable.GLOBAL : time, handle);
		variables.put(key, x);
		return x;
	}

	/**
	 * Returns the variable with the specified name at the specified time step, or null
	 */
	public Variable get(String name, int time) {
		Boolean global = globals.get(name);
		if (global == null)
			return null;
		return variables.get(new Key(name, global ? Variable.GLOBAL : time));
	}

	public boolean contains(String name) {
		return roles.containsKey(name);
	}

	public Role role(String name) {
		return roles.get(name);
	}

	public boolean isGlobal(String name) {
		return globals.getOrDefault(name, false);
	}

	/**
	 * Returns the declared names with the specified role, in declaration order
	 */
	public List<String> names(Role role) {
		List<String> list = new ArrayList<>();
		roles.forEach((name, r) -> {
			if (r == role)
				list.add(name);
		});
		return list;
	}

	public List<String> names() {
		return Collections.unmodifiableList(new ArrayList<>(roles.keySet()));
	}

	/**
	 * Returns all registered variables (constants included), in creation order
	 */
	public List<Variable> all() {
		return new ArrayList<>(variables.values());
	}

	public int size() {
		return variables.size();
	}
}
