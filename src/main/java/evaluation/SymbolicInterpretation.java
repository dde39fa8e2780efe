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

import java.util.List;

import expressions.Operator;
import expressions.ParseException;
import solver.Constraint;
import solver.Relation;
import solver.SolverException;
import solver.SolverVariable;
import solver.Term;

/**
 * Turns expressions into solver terms and constraints. Comparisons are posted as they are (the solver applies its own tolerance); strict
 * comparisons become non-strict ones. Functions can only be applied to constant terms.
 */
public final class SymbolicInterpretation implements Interpretation<Term, Constraint> {

	@Override
	public Mode mode() {
		return Mode.COMPILE;
	}

	@Override
	public Term constant(double value) {
		return Term.constant(value);
	}

	@Override
	public Term indicator(SolverVariable auxiliary) {
		return Term.of(auxiliary);
	}

	@Override
	public Term unary(Operator op, Term operand) {
		return op == Operator.MINUS ? operand.negate() : operand;
	}

	@Override
	public Term binary(Operator op, Term left, Term right) {
		switch (op) {
		case ADD:
			return left.plus(right);
		case SUB:
			return left.minus(right);
		case MUL:
			return left.times(right);
		case DIV:
			return left.dividedBy(right);
		case POW:
			return left.power(right);
		default:
			throw new ParseException("Operator " + op.symbol + " cannot be applied to terms");
		}
	}

	@Override
	public Term call(String function, List<Term> arguments) {
		double[] values = new double[arguments.size()];
		for (int i = 0; i < values.length; i++) {
			Term argument = arguments.get(i);
			if (!argument.isConstant())
				throw new SolverException("Function " + function + " cannot be applied to decision variables: " + argument);
			values[i] = argument.constant();
		}
		return Term.constant(NumericInterpretation.apply(function, values));
	}

	@Override
	public Constraint compare(Operator op, Term left, Term right) {
		switch (op) {
		case LT:
		case LE:
			return Constraint.of(left, Relation.LE, right);
		case GT:
		case GE:
			return Constraint.of(left, Relation.GE, right);
		case EQ:
			return Constraint.of(left, Relation.EQ, right);
		default:
			throw new ParseException("Operator " + op.symbol + " cannot be posted as a constraint");
		}
	}

	@Override
	public Constraint truth(Term value) {
		throw new ParseException(value + " is not a constraint");
	}

	@Override
	public Constraint negate(Constraint condition) {
		throw new ParseException("Negations cannot be posted as constraints: not (" + condition + ")");
	}

	@Override
	public Constraint any(List<Constraint> conditions) {
		throw new ParseException("Disjunctions must be linearized before being posted");
	}

	@Override
	public Constraint all(List<Constraint> conditions) {
		throw new ParseException("Conjunctions are posted as separate constraints");
	}
}
