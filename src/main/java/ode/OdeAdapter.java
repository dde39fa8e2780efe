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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import expressions.Kind;
import expressions.Node;
import expressions.Operator;
import utility.Kit;

/**
 * Solves the differential equations of a domain, one equation dd(x) == rhs (or dd(x, Dt) == rhs) per state x, with the initial condition
 * that x is equal to the (symbolic) state x at elapsed time 0. Actions and auxiliary variables are constant during a step.
 *
 * Equations are solved one at a time, each state being solved once the states occurring in its right-hand side are solved. Two forms of
 * equations admit a closed form when the right-hand side is polynomial in the elapsed time and does not involve x: x(t) = x + integral of
 * the right-hand side. Equations such as dd(x) == a*x + b have exponential solutions, which cannot be posted in the model: like any other
 * system, they lead to an OdeSolvingException.
 */
public final class OdeAdapter {

	/**
	 * The name of the derivative operator in equations
	 */
	public static final String DERIVATIVE = "dd";

	private final List<String> states;

	private final Map<String, Node> constants = new HashMap<>();

	private final String time;

	/**
	 * @param states
	 *            the names of the states
	 * @param constants
	 *            the values of the named constants, substituted in equations
	 * @param time
	 *            the name of the elapsed time (the duration variable)
	 */
	public OdeAdapter(List<String> states, Map<String, Double> constants, String time) {
		this.states = states;
		constants.forEach((name, value) -> this.constants.put(name, Node.number(value)));
		this.time = time;
	}

	/**
	 * Returns the state whose derivative is given by the specified equation, with the right-hand side in rhs[0]
	 */
	private String parse(Node equation, Node[] rhs) {
		if (equation.kind != Kind.COMPARE || equation.operator != Operator.EQ)
			throw new OdeSolvingException("Equations must have the form dd(x) == rhs: " + equation);
		Node lhs = equation.left();
		boolean derivative = lhs.kind == Kind.CALL && lhs.name.equals(DERIVATIVE) && lhs.arguments().size() >= 1 && lhs.arguments().size() <= 2
				&& lhs.arguments().get(0).kind == Kind.NAME && (lhs.arguments().size() == 1 || lhs.arguments().get(1).isName(time));
		if (!derivative)
			throw new OdeSolvingException("Equations must have the form dd(x) == rhs or dd(x, " + time + ") == rhs: " + equation);
		String state = lhs.arguments().get(0).name;
		if (!states.contains(state))
			throw new OdeSolvingException(state + " is not a state: " + equation);
		rhs[0] = equation.right().substitute(constants);
		return state;
	}

	/**
	 * Solves the specified system of equations
	 *
	 * @param equations
	 *            one equation per state
	 * @return the closed forms, per state (in the order of states)
	 */
	public Map<String, ClosedForm> solve(List<Node> equations) {
		Map<String, Node> rhs = new LinkedHashMap<>();
		for (Node equation : equations) {
			Node[] t = new Node[1];
			String state = parse(equation, t);
			if (rhs.put(state, t[0]) != null)
				throw new OdeSolvingException("Several equations for " + state);
		}
		for (String state : states)
			if (!rhs.containsKey(state))
				throw new OdeSolvingException("No equation for " + state);
		Map<String, ClosedForm> solved = new HashMap<>();
		List<String> pending = new ArrayList<>(states);
		while (!pending.isEmpty()) {
			String next = pending.stream().filter(x -> dependencies(rhs.get(x), x).stream().allMatch(solved::containsKey)).findFirst()
					.orElseThrow(() -> new OdeSolvingException("No closed form for the coupled equations of " + pending));
			Map<String, Node> values = new HashMap<>();
			solved.values().forEach(c -> values.put(c.state, c.value));
			ClosedForm closedForm = solve(next, rhs.get(next).substitute(values));
			Kit.log.fine("  " + closedForm);
			solved.put(next, closedForm);
			pending.remove(next);
		}
		Map<String, ClosedForm> result = new LinkedHashMap<>();
		states.forEach(x -> result.put(x, solved.get(x)));
		return result;
	}

	private List<String> dependencies(Node rhs, String state) {
		List<String> list = new ArrayList<>();
		Set<String> names = rhs.names();
		for (String x : states)
			if (!x.equals(state) && names.contains(x))
				list.add(x);
		return list;
	}

	private ClosedForm solve(String state, Node rhs) {
		if (rhs.references(state))
			throw new OdeSolvingException("No closed form for dd(" + state + ") == " + rhs + " that can be posted in a linear model (the rate depends on "
					+ state + ")");
		TimePolynomial polynomial = TimePolynomial.of(rhs, time);
		if (polynomial == null)
			throw new OdeSolvingException("No closed form for dd(" + state + ") == " + rhs + " (not polynomial in " + time + ")");
		return new ClosedForm(state, Algebra.add(Node.name(state), polynomial.integral().toNode(time)), polynomial.toNode(time));
	}
}
