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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import variables.ValueType;

import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    private final SolverVariable x = new SolverVariable(0, "x", ValueType.CONTINUOUS);
    private final SolverVariable y = new SolverVariable(1, "y", ValueType.CONTINUOUS);

    private double evaluate(Term term, double xValue, double yValue) {
        Map<SolverVariable, Double> values = Map.of(x, xValue, y, yValue);
        return term.evaluate(values::get);
    }

    // ========== Algebra Tests ==========

    @Test
    void testAlgebra_CancellingTermsDisappear() {
        Term term = Term.of(x).plus(Term.of(y)).minus(Term.of(x));
        assertEquals(0.0, term.coefficient(x));
        assertEquals(1, term.monomials().size());
        assertTrue(Term.of(x).minus(Term.of(x)).isConstant());
    }

    @Test
    void testAlgebra_Product() {
        // (x + 1) * (y - 2) = xy - 2x + y - 2
        Term term = Term.of(x).plus(Term.constant(1)).times(Term.of(y).minus(Term.constant(2)));
        assertEquals(2, term.degree());
        assertEquals(-2.0, term.coefficient(x));
        assertEquals(1.0, term.coefficient(y));
        assertEquals(-2.0, term.constant());
        assertEquals(3 * 5 - 2 * 3 + 5 - 2, evaluate(term, 3, 5), 1e-12);
    }

    @Test
    void testAlgebra_ProductIsCommutative() {
        Term xy = Term.of(x).times(Term.of(y));
        Term yx = Term.of(y).times(Term.of(x));
        assertEquals(xy, yx);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 1.0",
            "1, 3.0",
            "3, 27.0"
    })
    void testAlgebra_IntegerPowers(double exponent, double expected) {
        assertEquals(expected, evaluate(Term.of(x).power(Term.constant(exponent)), 3, 0), 1e-12);
    }

    @Test
    void testAlgebra_UnsupportedOperations() {
        assertThrows(SolverException.class, () -> Term.of(x).dividedBy(Term.of(y)));
        assertThrows(SolverException.class, () -> Term.of(x).power(Term.of(y)));
        assertThrows(SolverException.class, () -> Term.of(x).power(Term.constant(0.5)));
        assertEquals(2.0, Term.of(x).dividedBy(Term.constant(0.5)).coefficient(x));
        assertEquals(8.0, Term.constant(2).power(Term.constant(3)).constant());
    }

    // ========== Constraint Tests ==========

    @Test
    void testConstraint_SatisfactionWithTolerance() {
        Constraint le = Constraint.of(Term.of(x), Relation.LE, Term.constant(2));
        assertTrue(le.isSatisfiedBy(v -> 2.0000001, 1e-6));
        assertFalse(le.isSatisfiedBy(v -> 2.001, 1e-6));

        Constraint ge = Constraint.of(Term.of(x), Relation.GE, Term.constant(2));
        assertTrue(ge.isSatisfiedBy(v -> 1.9999999, 1e-6));
        assertFalse(ge.isSatisfiedBy(v -> 1.5, 1e-6));

        Constraint eq = Constraint.of(Term.of(x), Relation.EQ, Term.of(y).plus(Term.constant(1)));
        assertTrue(eq.isSatisfiedBy(v -> v == x ? 3.0 : 2.0, 1e-9));
        assertFalse(eq.isSatisfiedBy(v -> 3.0, 1e-9));
    }

    @Test
    void testConstraint_ToString() {
        Constraint c = Constraint.of(Term.of(x).times(2), Relation.LE, Term.constant(4));
        assertTrue(c.toString().endsWith("<= 4.0"));
    }
}
