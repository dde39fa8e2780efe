/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.linearization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Collections;
import java.util.List;

import evaluation.Bindings;
import evaluation.Evaluator;
import expressions.Node;
import expressions.ParseException;
import expressions.Parser;
import solver.OjAlgoSolver;

import static org.junit.jupiter.api.Assertions.*;

class DisjunctionLinearizerTest {

    private static final double BIG_M = 100;

    private final DisjunctionLinearizer linearizer = new DisjunctionLinearizer();
    private OjAlgoSolver solver;
    private LinearizationContext ctx;

    @BeforeEach
    void setUp() {
        solver = new OjAlgoSolver("test", 1e-6);
        ctx = new LinearizationContext(solver, "d", Collections.emptyList(), BIG_M);
    }

    /**
     * Checks the two big-M constraints of a disjunct, exactly, for the given values of x and of the auxiliary variable
     */
    private static boolean pairHolds(List<Node> nodes, int disjunct, double x, double aux) {
        Bindings<Double> bindings = new Bindings<Double>().put("x", x).put("Aux_0_d", aux).put("Aux_1_d", aux);
        Evaluator<Double, Boolean> calculator = Evaluator.calculator(bindings, 0);
        return calculator.condition(nodes.get(2 * disjunct)) && calculator.condition(nodes.get(2 * disjunct + 1));
    }

    // ========== Shape Tests ==========

    @Test
    void testShape_TwoConstraintsPerDisjunctAndCardinality() {
        List<Node> nodes = linearizer.linearize(Parser.parseStatement("x <= 2 or x > 5 or x >= 10"), ctx);
        assertEquals(7, nodes.size());
        assertEquals(3, ctx.auxiliaries().size());
        assertEquals(3, solver.numberOfVariables());
    }

    @Test
    void testShape_CanLinearizeOnlyDisjunctions() {
        assertTrue(linearizer.canLinearize(Parser.parseStatement("x <= 2 or x >= 3")));
        assertFalse(linearizer.canLinearize(Parser.parseStatement("x <= 2 and x >= 3")));
        assertFalse(linearizer.canLinearize(Parser.parseStatement("x <= 2")));
    }

    @Test
    void testShape_RejectsEquality() {
        assertThrows(ParseException.class, () -> linearizer.linearize(Parser.parseStatement("x == 2 or x >= 3"), ctx));
    }

    // ========== Indicator Semantics Tests ==========

    @ParameterizedTest
    @CsvSource({
            "-50.0, true, false",
            "0.0, true, false",
            "2.0, true, false",
            "2.5, false, true",
            "50.0, false, true"
    })
    void testIndicator_NonStrictOrdering(double x, boolean whenZero, boolean whenOne) {
        List<Node> nodes = linearizer.linearize(Parser.parseStatement("x <= 2 or x > 5"), ctx);
        // aux = 0 forces the comparison, aux = 1 forces its negation
        assertEquals(whenZero, pairHolds(nodes, 0, x, 0));
        assertEquals(whenOne, pairHolds(nodes, 0, x, 1));
    }

    @ParameterizedTest
    @CsvSource({
            "-50.0, false, true",
            "5.0, false, true",
            "5.5, true, false",
            "50.0, true, false"
    })
    void testIndicator_StrictOrderingWithSwappedSides(double x, boolean whenZero, boolean whenOne) {
        List<Node> nodes = linearizer.linearize(Parser.parseStatement("x <= 2 or x > 5"), ctx);
        assertEquals(whenZero, pairHolds(nodes, 1, x, 0));
        assertEquals(whenOne, pairHolds(nodes, 1, x, 1));
    }

    @Test
    void testIndicator_CardinalityNeedsOneDisjunct() {
        List<Node> nodes = linearizer.linearize(Parser.parseStatement("x <= 2 or x > 5"), ctx);
        Node cardinality = nodes.get(nodes.size() - 1);
        assertTrue(Evaluator.calculator(new Bindings<Double>().put("Aux_0_d", 0.0).put("Aux_1_d", 1.0), 0).condition(cardinality));
        assertTrue(Evaluator.calculator(new Bindings<Double>().put("Aux_0_d", 0.0).put("Aux_1_d", 0.0), 0).condition(cardinality));
        assertFalse(Evaluator.calculator(new Bindings<Double>().put("Aux_0_d", 1.0).put("Aux_1_d", 1.0), 0).condition(cardinality));
    }

    // ========== Context Tests ==========

    @Test
    void testContext_ReusedAuxiliariesInOrder() {
        linearizer.linearize(Parser.parseStatement("x <= 2 or x >= 3"), ctx);
        LinearizationContext other = new LinearizationContext(solver, "e", ctx.auxiliaries(), BIG_M);
        assertSame(ctx.auxiliaries().get(0), other.nextAuxiliary());
        assertSame(ctx.auxiliaries().get(1), other.nextAuxiliary());
        assertThrows(IllegalStateException.class, other::nextAuxiliary);
        assertEquals(2, solver.numberOfVariables());
    }
}
