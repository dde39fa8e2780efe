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
import java.util.List;

import expressions.Node;

/**
 * A polynomial in the elapsed time, whose coefficients are expressions that do not depend on the elapsed time
 */
final class TimePolynomial {

	/**
	 * Returns the polynomial corresponding to the specified expression, or null if the expression is not polynomial in the elapsed time
	 *
	 * @param node
	 *            an expression
	 * @param time
	 *            the name of the elapsed time
	 */
	static TimePolynomial of(Node node, String time) {
		if (!node.references(time))
			return new TimePolynomial(List.of(node));
		switch (node.kind) {
		case NAME:
			return new TimePolynomial(List.of(Algebra.ZERO, Algebra.ONE));
		case UNARY:
			TimePolynomial p = of(node.operand(), time);
			if (p == null)
				return null;
			switch (node.operator) {
			case PLUS:
				return p;
			case MINUS:
				return p.scale(Algebra.neg(Algebra.ONE));
			default:
				return null;
			}
		case BINARY:
			TimePolynomial left = of(node.left(), time);
			switch (node.operator) {
			case ADD:
			case SUB:
			case MUL:
				TimePolynomial right = of(node.right(), time);
				if (left == null || right == null)
					return null;
				switch (node.operator) {
				case ADD:
					return left.plus(right);
				case SUB:
					return left.plus(right.scale(Algebra.neg(Algebra.ONE)));
				default:
					return left.times(right);
				}
			case DIV:
				if (left == null || node.right().references(time))
					return null;
				return left.scale(Algebra.div(Algebra.ONE, node.right()));
			case POW:
				Node exponent = node.right();
				if (left == null || !exponent.isNumber() || exponent.value < 0 || exponent.value != Math.rint(exponent.value))
					return null;
				TimePolynomial result = new TimePolynomial(List.of(Algebra.ONE));
				for (int i = 0; i < (int) exponent.value; i++)
					result = result.times(left);
				return result;
			default:
				return null;
			}
		default:
			return null;
		}
	}

	/**
	 * coefficients.get(k) is the coefficient of t^k
	 */
	private final List<Node> coefficients;

	private TimePolynomial(List<Node> coefficients) {
		this.coefficients = coefficients;
	}

	int degree() {
		return coefficients.size() - 1;
	}

	Node coefficient(int k) {
		return k < coefficients.size() ? coefficients.get(k) : Algebra.ZERO;
	}

	TimePolynomial plus(TimePolynomial other) {
		List<Node> list = new ArrayList<>();
		for (int k = 0; k <= Math.max(degree(), other.degree()); k++)
			list.add(Algebra.add(coefficient(k), other.coefficient(k)));
		return new TimePolynomial(list);
	}

	TimePolynomial scale(Node factor) {
		List<Node> list = new ArrayList<>();
		for (Node c : coefficients)
			list.add(Algebra.mul(factor, c));
		return new TimePolynomial(list);
	}

	TimePolynomial times(TimePolynomial other) {
		List<Node> list = new ArrayList<>();
		for (int k = 0; k <= degree() + other.degree(); k++)
			list.add(Algebra.ZERO);
		for (int i = 0; i <= degree(); i++)
			for (int j = 0; j <= other.degree(); j++)
				list.set(i + j, Algebra.add(list.get(i + j), Algebra.mul(coefficients.get(i), other.coefficients.get(j))));
		return new TimePolynomial(list);
	}

	/**
	 * Returns the primitive of this polynomial that is equal to 0 at time 0
	 */
	TimePolynomial integral() {
		List<Node> list = new ArrayList<>();
		list.add(Algebra.ZERO);
		for (int k = 0; k <= degree(); k++)
			list.add(Algebra.div(coefficients.get(k), Node.number(k + 1)));
		return new TimePolynomial(list);
	}

	/**
	 * Returns the expression of this polynomial in the named elapsed time
	 */
	Node toNode(String time) {
		Node t = Node.name(time);
		Node sum = Algebra.ZERO;
		for (int k = 0; k <= degree(); k++)
			sum = Algebra.add(sum, Algebra.mul(coefficients.get(k), Algebra.pow(t, k)));
		return sum;
	}
}
