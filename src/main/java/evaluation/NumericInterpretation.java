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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import expressions.Operator;
import expressions.ParseException;
import solver.SolverVariable;

/**
 * Evaluates expressions to numbers and booleans. Comparisons are made with a tolerance: equality is approximate, and ordering comparisons
 * are relaxed so that values on the boundary of a feasible region are considered as satisfying the comparison.
 */
public final class NumericInterpretation implements Interpretation<Double, Boolean> {

	static final Map<String, Function<double[], Double>> FUNCTIONS = new HashMap<>();

	static {
		FUNCTIONS.put("exp", t -> Math.exp(t[0]));
		FUNCTIONS.put("log", t -> Math.log(t[0]));
		FUNCTIONS.put("sqrt", t -> Math.sqrt(t[0]));
		FUNCTIONS.put("sin", t -> Math.sin(t[0]));
		FUNCTIONS.put("cos", t -> Math.cos(t[0]));
		FUNCTIONS.put("abs", t -> Math.abs(t[0]));
		FUNCTIONS.put("min", t -> Math.min(t[0], t[1]));
		FUNCTIONS.put("max", t -> Math.max(t[0], t[1]));
	}

	private static final Map<String, Integer> ARITIES = Map.of("exp", 1, "log", 1, "sqrt", 1, "sin", 1, "cos", 1, "abs", 1, "min", 2, "max", 2);

	/**
	 * Applies a known function to numbers
	 */
	static double apply(String function, double[] arguments) {
		Function<double[], Double> f = FUNCTIONS.get(function);
		if (f == null)
			throw new ParseException("Unknown function " + function);
		if (arguments.length != ARITIES.get(function))
			throw new ParseException("Function " + function + " expects " + ARITIES.get(function) + " argument(s), not " + arguments.length);
		return f.apply(arguments);
	}

	/**
	 * Returns true if x is close to y, that is |x - y| <= tolerance * max(1, |y|)
	 */
	public static boolean isClose(double x, double y, double tolerance) {
		return Math.abs(x - y) <= tolerance * Math.max(1, Math.abs(y));
	}

	private final double tolerance;

	public NumericInterpretation(double tolerance) {
		this.tolerance = tolerance;
	}

	@Override
	public Mode mode() {
		return Mode.CALCULATE;
	}

	@Override
	public Double constant(double value) {
		return value;
	}

	@Override
	public Double indicator(SolverVariable auxiliary) {
		throw new IllegalStateException("Auxiliary variables only exist when compiling");
	}

	@Override
	public Double unary(Operator op, Double operand) {
		return op == Operator.MINUS ? -operand : operand;
	}

	@Override
	public Double binary(Operator op, Double left, Double right) {
		switch (op) {
		case ADD:
			return left + right;
		case SUB:
			return left - right;
		case MUL:
			return left * right;
		case DIV:
			return left / right;
		case POW:
			return Math.pow(left, right);
		default:
			throw new ParseException("Operator " + op.symbol + " cannot be applied to numbers");
		}
	}

	@Override
	public Double call(String function, List<Double> arguments) {
		return apply(function, arguments.stream().mapToDouble(Double::doubleValue).toArray());
	}

	@Override
	public Boolean compare(Operator op, Double left, Double right) {
		switch (op) {
		case LT:
			return left < right + tolerance;
		case LE:
			return left <= right + tolerance;
		case GT:
			return left + tolerance > right;
		case GE:
			return left + tolerance >= right;
		case EQ:
			return isClose(left, right, tolerance);
		case NE:
			return !isClose(left, right, tolerance);
		default:
			throw new ParseException(op.symbol + " is not a comparison operator");
		}
	}

	@Override
	public Boolean truth(Double value) {
		return value != 0;
	}

	@Override
	public Boolean negate(Boolean condition) {
		return !condition;
	}

	@Override
	public Boolean any(List<Boolean> conditions) {
		return conditions.stream().anyMatch(b -> b);
	}

	@Override
	public Boolean all(List<Boolean> conditions) {
		return conditions.stream().allMatch(b -> b);
	}
}
