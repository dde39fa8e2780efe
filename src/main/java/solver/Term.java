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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.ToDoubleFunction;

/**
 * An immutable polynomial over solver variables: a constant plus a sum of monomials, each with a coefficient. This is the symbolic value
 * built when compiling expressions into solver constraints.
 */
public final class Term {

	/**
	 * A product of solver variables (possibly with repetitions), kept sorted
	 */
	public static final class Monomial {

		private final List<SolverVariable> factors;

		private Monomial(List<SolverVariable> factors) {
			List<SolverVariable> list = new ArrayList<>(factors);
			Collections.sort(list);
			this.factors = Collections.unmodifiableList(list);
		}

		public List<SolverVariable> factors() {
			return factors;
		}

		public int degree() {
			return factors.size();
		}

		Monomial times(Monomial other) {
			List<SolverVariable> list = new ArrayList<>(factors);
			list.addAll(other.factors);
			return new Monomial(list);
		}

		double evaluate(ToDoubleFunction<SolverVariable> values) {
			double product = 1;
			for (SolverVariable x : factors)
				product *= values.applyAsDouble(x);
			return product;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Monomial && ((Monomial) obj).factors.equals(factors);
		}

		@Override
		public int hashCode() {
			return factors.hashCode();
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			for (SolverVariable x : factors)
				sb.append(sb.length() == 0 ? "" : "*").append(x.name);
			return sb.toString();
		}
	}

	private static final double ZERO = 0.0;

	private final Map<Monomial, Double> coefficients;

	private final double constant;

	private Term(Map<Monomial, Double> coefficients, double constant) {
		this.coefficients = Collections.unmodifiableMap(coefficients);
		this.constant = constant;
	}

	public static Term constant(double value) {
		return new Term(new LinkedHashMap<>(), value);
	}

	public static Term of(SolverVariable variable) {
		Map<Monomial, Double> map = new LinkedHashMap<>();
		map.put(new Monomial(List.of(variable)), 1.0);
		return new Term(map, ZERO);
	}

	public static Term sum(List<Term> terms) {
		Term sum = constant(0);
		for (Term t : terms)
			sum = sum.plus(t);
		return sum;
	}

	public boolean isConstant() {
		return coefficients.isEmpty();
	}

	public double constant() {
		return constant;
	}

	public Map<Monomial, Double> monomials() {
		return coefficients;
	}

	public int degree() {
		return coefficients.keySet().stream().mapToInt(Monomial::degree).max().orElse(0);
	}

	public double coefficient(SolverVariable variable) {
		return coefficients.getOrDefault(new Monomial(List.of(variable)), ZERO);
	}

	private static void accumulate(Map<Monomial, Double> map, Monomial m, double coeff) {
		double v = map.getOrDefault(m, ZERO) + coeff;
		if (v == ZERO)
			map.remove(m);
		else
			map.put(m, v);
	}

	public Term plus(Term other) {
		Map<Monomial, Double> map = new LinkedHashMap<>(coefficients);
		other.coefficients.forEach((m, c) -> accumulate(map, m, c));
		return new Term(map, constant + other.constant);
	}

	public Term negate() {
		return times(-1);
	}

	public Term minus(Term other) {
		return plus(other.negate());
	}

	public Term times(double factor) {
		Map<Monomial, Double> map = new LinkedHashMap<>();
		if (factor != ZERO)
			coefficients.forEach((m, c) -> map.put(m, c * factor));
		return new Term(map, constant * factor);
	}

	public Term times(Term other) {
		if (other.isConstant())
			return times(other.constant);
		if (isConstant())
			return other.times(constant);
		Map<Monomial, Double> map = new LinkedHashMap<>();
		for (Entry<Monomial, Double> e1 : coefficients.entrySet()) {
			for (Entry<Monomial, Double> e2 : other.coefficients.entrySet())
				accumulate(map, e1.getKey().times(e2.getKey()), e1.getValue() * e2.getValue());
			accumulate(map, e1.getKey(), e1.getValue() * other.constant);
		}
		other.coefficients.forEach((m, c) -> accumulate(map, m, c * constant));
		return new Term(map, constant * other.constant);
	}

	public Term dividedBy(Term other) {
		if (!other.isConstant())
			throw new SolverException("Division by an expression involving decision variables cannot be encoded: " + this + " / " + other);
		return times(1.0 / other.constant);
	}

	public Term power(Term exponent) {
		if (!exponent.isConstant())
			throw new SolverException("Exponents involving decision variables cannot be encoded: " + this + " ** " + exponent);
		double e = exponent.constant;
		if (isConstant())
			return constant(Math.pow(constant, e));
		if (e < 0 || e != Math.rint(e))
			throw new SolverException("Only non-negative integer powers of decision variables can be encoded: " + this + " ** " + e);
		Term result = constant(1);
		for (int i = 0; i < (int) e; i++)
			result = result.times(this);
		return result;
	}

	public double evaluate(ToDoubleFunction<SolverVariable> values) {
		double sum = constant;
		for (Entry<Monomial, Double> e : coefficients.entrySet())
			sum += e.getValue() * e.getKey().evaluate(values);
		return sum;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Term && ((Term) obj).coefficients.equals(coefficients) && Double.compare(((Term) obj).constant, constant) == 0;
	}

	@Override
	public int hashCode() {
		return coefficients.hashCode() * 31 + Double.hashCode(constant);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Entry<Monomial, Double> e : coefficients.entrySet()) {
			double c = e.getValue();
			sb.append(sb.length() == 0 ? (c < 0 ? "-" : "") : (c < 0 ? " - " : " + "));
			if (Math.abs(c) != 1)
				sb.append(Math.abs(c)).append("*");
			sb.append(e.getKey());
		}
		if (constant != ZERO || sb.length() == 0)
			sb.append(sb.length() == 0 ? String.valueOf(constant) : (constant < 0 ? " - " : " + ") + Math.abs(constant));
		return sb.toString();
	}
}
