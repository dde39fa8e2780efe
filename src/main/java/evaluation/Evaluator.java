/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package evaluation;

import static utility.Kit.control;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import expressions.Node;
import expressions.Operator;
import expressions.ParseException;
import optimization.linearization.ConstraintLinearizer;
import optimization.linearization.DisjunctionLinearizer;
import optimization.linearization.LinearizationContext;
import solver.Constraint;
import solver.MinlpSolver;
import solver.SolverVariable;
import solver.Term;

/**
 * Evaluates expression trees with respect to an interpretation and some bindings (values associated with names). The same recursive
 * evaluation is used for building solver constraints (compile mode) and for computing values (calculate mode).
 *
 * When compiling, a conjunction gives one constraint per operand, and a disjunction is linearized with auxiliary 0/1 variables. When
 * calculating, a disjunction holds if any of its operands holds.
 *
 * @param <V>
 *            the type of values
 * @param <C>
 *            the type of conditions
 */
public final class Evaluator<V, C> {

	/**
	 * Builds an evaluator computing numbers and booleans
	 *
	 * @param bindings
	 *            the values of names
	 * @param tolerance
	 *            the tolerance used in comparisons
	 */
	public static Evaluator<Double, Boolean> calculator(Bindings<Double> bindings, double tolerance) {
		return new Evaluator<>(new NumericInterpretation(tolerance), bindings, null, 0);
	}

	/**
	 * Builds an evaluator turning statements into constraints for the specified solver
	 *
	 * @param bindings
	 *            the terms associated with names
	 * @param solver
	 *            the solver where auxiliary variables are added
	 * @param bigM
	 *            the constant used when linearizing disjunctions
	 */
	public static Evaluator<Term, Constraint> compiler(Bindings<Term> bindings, MinlpSolver solver, double bigM) {
		return new Evaluator<>(new SymbolicInterpretation(), bindings, solver, bigM);
	}

	private static final List<ConstraintLinearizer> LINEARIZERS = List.of(new DisjunctionLinearizer());

	private final Interpretation<V, C> interpretation;

	private final Bindings<V> bindings;

	private final MinlpSolver solver;

	private final double bigM;

	public Evaluator(Interpretation<V, C> interpretation, Bindings<V> bindings, MinlpSolver solver, double bigM) {
		control(interpretation.mode() == Mode.CALCULATE || solver != null, () -> "A solver is required for compiling");
		this.interpretation = interpretation;
		this.bindings = bindings;
		this.solver = solver;
		this.bigM = bigM;
	}

	public Mode mode() {
		return interpretation.mode();
	}

	/**
	 * Evaluates a statement, with new auxiliary variables if some are needed
	 */
	public CompiledExpressions<C> evaluate(Node node, String label, int step) {
		return evaluate(node, label, step, Collections.emptyList());
	}

	/**
	 * Evaluates a statement
	 *
	 * @param node
	 *            the statement
	 * @param label
	 *            the label of the statement (used for naming auxiliary variables)
	 * @param step
	 *            the time step for which the statement is evaluated
	 * @param reused
	 *            the auxiliary variables to be reused (empty if new ones must be allocated)
	 * @return the conditions obtained for the statement, in source order
	 */
	public CompiledExpressions<C> evaluate(Node node, String label, int step, List<SolverVariable> reused) {
		LinearizationContext ctx = mode() == Mode.COMPILE ? new LinearizationContext(solver, label, reused, bigM) : null;
		List<C> list = new ArrayList<>();
		statements(node, ctx == null ? bindings : bindings.copy(), ctx, list);
		return new CompiledExpressions<>(label, step, list, ctx == null ? Collections.emptyList() : ctx.auxiliaries());
	}

	/**
	 * Returns the condition corresponding to the specified statement (a conjunction of its parts)
	 */
	public C condition(Node node) {
		control(mode() == Mode.CALCULATE, () -> "Conditions are only computed in calculate mode");
		List<C> list = new ArrayList<>();
		statements(node, bindings, null, list);
		return list.size() == 1 ? list.get(0) : interpretation.all(list);
	}

	private void statements(Node node, Bindings<V> b, LinearizationContext ctx, List<C> list) {
		switch (node.kind) {
		case AND:
			for (Node child : node.children())
				statements(child, b, ctx, list);
			break;
		case OR:
			if (mode() == Mode.COMPILE) {
				List<Node> comparisons = linearize(node, ctx);
				for (SolverVariable aux : ctx.auxiliaries())
					b.put(aux.name, interpretation.indicator(aux));
				for (Node comparison : comparisons)
					statements(comparison, b, ctx, list);
			} else {
				List<C> disjuncts = new ArrayList<>();
				for (Node child : node.children())
					disjuncts.add(conjunction(child, b));
				list.add(interpretation.any(disjuncts));
			}
			break;
		case COMPARE:
			list.add(interpretation.compare(node.operator, value(node.left(), b), value(node.right(), b)));
			break;
		case UNARY:
			if (node.operator == Operator.NOT) {
				list.add(interpretation.negate(conjunction(node.operand(), b)));
				break;
			}
			list.add(interpretation.truth(value(node, b)));
			break;
		default:
			list.add(interpretation.truth(value(node, b)));
		}
	}

	/**
	 * Rewrites the specified boolean expression with the first linearizer able to handle it
	 */
	private static List<Node> linearize(Node node, LinearizationContext ctx) {
		for (ConstraintLinearizer linearizer : LINEARIZERS)
			if (linearizer.canLinearize(node))
				return linearizer.linearize(node, ctx);
		throw new ParseException("No linearization for " + node);
	}

	private C conjunction(Node node, Bindings<V> b) {
		if (mode() == Mode.COMPILE)
			throw new ParseException("Only comparisons can be combined in compiled constraints: " + node);
		List<C> list = new ArrayList<>();
		statements(node, b, null, list);
		return list.size() == 1 ? list.get(0) : interpretation.all(list);
	}

	/**
	 * Returns the value of the specified arithmetic expression
	 */
	public V value(Node node) {
		return value(node, bindings);
	}

	private V value(Node node, Bindings<V> b) {
		switch (node.kind) {
		case NUMBER:
			return interpretation.constant(node.value);
		case NAME:
			return b.get(node.name);
		case UNARY:
			if (node.operator == Operator.NOT)
				throw new ParseException("A boolean expression cannot be used as a value: " + node);
			return interpretation.unary(node.operator, value(node.operand(), b));
		case BINARY:
			return interpretation.binary(node.operator, value(node.left(), b), value(node.right(), b));
		case CALL:
			List<V> arguments = new ArrayList<>();
			for (Node argument : node.arguments())
				arguments.add(value(argument, b));
			return interpretation.call(node.name, arguments);
		case ATTRIBUTE_CALL:
			throw new ParseException("Attributes such as main.secondary() functions are not allowed: " + node);
		case CONDITIONAL:
			throw new ParseException("Can't use if else in expressions: " + node);
		default:
			throw new ParseException("A boolean expression cannot be used as a value: " + node);
		}
	}
}
