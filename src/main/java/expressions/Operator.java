/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

/**
 * Operators of unary, binary and comparison nodes.
 */
public enum Operator {
	ADD("+"), SUB("-"), MUL("*"), DIV("/"), POW("**"), PLUS("+"), MINUS("-"), NOT("not"), LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

	public final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	public boolean isComparison() {
		return ordinal() >= LT.ordinal();
	}

	/**
	 * Returns true for <, <=, > and >=
	 */
	public boolean isOrdering() {
		return this == LT || this == LE || this == GT || this == GE;
	}

	/**
	 * Returns the comparison operator to be used when the two sides of a comparison are swapped
	 */
	public Operator swapped() {
		switch (this) {
		case LT:
			return GT;
		case LE:
			return GE;
		case GT:
			return LT;
		case GE:
			return LE;
		case EQ:
		case NE:
			return this;
		default:
			throw new IllegalStateException(this + " is not a comparison operator");
		}
	}

	static Operator comparison(String symbol) {
		for (Operator op : values())
			if (op.isComparison() && op.symbol.equals(symbol))
				return op;
		return null;
	}
}
