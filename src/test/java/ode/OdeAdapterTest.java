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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import evaluation.Bindings;
import evaluation.Evaluator;
import expressions.Node;
import expressions.Parser;

import static org.junit.jupiter.api.Assertions.*;

class OdeAdapterTest {

    private static final double EPS = 1e-9;

    private static Map<String, ClosedForm> solve(List<String> states, Map<String, Double> constants, String text) {
        return new OdeAdapter(states, constants, "Dt").solve(Parser.parse(text));
    }

    private static double eval(Node node, Bindings<Double> bindings) {
        return Evaluator.calculator(bindings, 0).value(node);
    }

    // ========== Polynomial Right-Hand Side Tests ==========

    @ParameterizedTest
    @CsvSource({
            "0.0, 2.0, 4.0",
            "1.0, 3.0, 7.0",
            "-1.0, 0.0, -1.0"
    })
    void testPolynomial_ConstantRate(double x, double dt, double expected) {
        ClosedForm c = solve(List.of("x"), Map.of("rate", 2.0), "dd(x, Dt) == rate").get("x");
        Bindings<Double> bindings = new Bindings<Double>().put("x", x).put("Dt", dt);
        assertEquals(expected, eval(c.value, bindings), EPS);
        assertEquals(2.0, eval(c.derivative, bindings), EPS);
    }

    @Test
    void testPolynomial_TimeDependentRate() {
        ClosedForm c = solve(List.of("x"), Map.of(), "dd(x) == 3 * Dt ** 2 + 1").get("x");
        Bindings<Double> bindings = new Bindings<Double>().put("x", 1.0).put("Dt", 2.0);
        assertEquals(1 + 8 + 2, eval(c.value, bindings), EPS);
        assertEquals(13.0, eval(c.derivative, bindings), EPS);
    }

    @Test
    void testPolynomial_ChainedStates() {
        Map<String, ClosedForm> solved = solve(List.of("x", "v"), Map.of("g", -10.0), "dd(x, Dt) == v\ndd(v, Dt) == g");
        assertEquals(List.of("x", "v"), List.copyOf(solved.keySet()));
        Bindings<Double> bindings = new Bindings<Double>().put("x", 0.0).put("v", 5.0).put("Dt", 1.0);
        assertEquals(0.0, eval(solved.get("x").value, bindings), EPS);
        assertEquals(-5.0, eval(solved.get("v").value, bindings), EPS);
        assertEquals(-5.0, eval(solved.get("x").derivative, bindings), EPS);
        assertEquals(-10.0, eval(solved.get("v").derivative, bindings), EPS);
    }

    @Test
    void testPolynomial_ActionsAreCoefficients() {
        ClosedForm c = solve(List.of("x"), Map.of(), "dd(x) == a - 1").get("x");
        Bindings<Double> bindings = new Bindings<Double>().put("x", 2.0).put("a", 3.0).put("Dt", 0.5);
        assertEquals(3.0, eval(c.value, bindings), EPS);
        assertTrue(c.value.references("a"));
    }

    // ========== Self-Dependent Rate Tests ==========

    @ParameterizedTest
    @ValueSource(strings = {
            "dd(x) == -k * x + 1",
            "dd(x) == 2 * x",
            "dd(x, Dt) == 1.0 - x"
    })
    void testSelfDependent_Rejected(String text) {
        OdeSolvingException e = assertThrows(OdeSolvingException.class, () -> solve(List.of("x"), Map.of("k", 0.5), text));
        assertTrue(e.getMessage().contains("rate depends on x"), e.getMessage());
    }

    // ========== Failure Tests ==========

    @ParameterizedTest
    @ValueSource(strings = {
            "dd(x) == x * x",
            "dd(x) == sin(Dt)",
            "dd(x) == Dt * x",
            "dd(x) == 1 / Dt",
            "x == 1",
            "dd(x) <= 1",
            "dd(x, t) == 1",
            "dd(z) == 1",
            "dd(x) == 1\ndd(x) == 2"
    })
    void testFailure_NoClosedForm(String text) {
        assertThrows(OdeSolvingException.class, () -> solve(List.of("x"), Map.of(), text));
    }

    @Test
    void testFailure_MissingEquation() {
        assertThrows(OdeSolvingException.class, () -> solve(List.of("x", "y"), Map.of(), "dd(x) == 1"));
    }

    @Test
    void testFailure_CoupledStates() {
        assertThrows(OdeSolvingException.class, () -> solve(List.of("x", "y"), Map.of(), "dd(x) == y\ndd(y) == x"));
    }
}
