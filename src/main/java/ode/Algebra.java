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

import expressions.Node;
import expressions.Operator;

/**
 * Builders of expression trees that fold numbers and neutral elements, so that closed forms remain readable
 */
final class Algebra {

	private Algebra() {
	}

	static final Node ZERO = Node.number(0);

	static final Node ONE = Node.number(1);

	static Node add(Node a, Node b) {
		if (a.isNumber() && b.isNumber())
			return Node.number(a.value + b.value);
		if (a.isNumber(0))
			return b;
		if (b.isNumber(0))
			return a;
		return Node.binary(Operator.ADD, a, b);
	}

	static Node neg(Node a) {
		if (a.isNumber())
			return Node.number(-a.value);
		return Node.unary(Operator.MINUS, a);
	}

	static Node mul(Node a, Node b) {
		if (a.isNumber() && b.isNumber())
			return Node.number(a.value * b.value);
		if (a.isNumber(0) || b.isNumber(0))
			return ZERO;
		if (a.isNumber(1))
			return b;
		if (b.isNumber(1))
			return a;
		return Node.binary(Operator.MUL, a, b);
	}

	static Node div(Node a, Node b) {
		if (a.isNumber() && b.isNumber() && b.value != 0)
			return Node.number(a.value / b.value);
		if (a.isNumber(0))
			return ZERO;
		if (b.isNumber(1))
			return a;
		return Node.binary(Operator.DIV, a, b);
	}

	static Node pow(Node a, int k) {
		if (k == 0)
			return ONE;
		if (k == 1)
			return a;
		if (a.isNumber())
			return Node.number(Math.pow(a.value, k));
		return Node.binary(Operator.POW, a, Node.number(k));
	}
}
