/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import org.junit.jupiter.api.Test;

import dashboard.Control;
import problem.DomainReader;
import solver.OjAlgoSolver;

import static org.junit.jupiter.api.Assertions.*;

class HorizonSearchTest {

    private static final double EPS = 1e-4;

    private static HorizonSearch.Result solve(String domain, String... options) throws InfeasibilityException {
        String[] args = new String[options.length + 2];
        args[0] = "-domain=" + domain;
        args[1] = "-instance=1";
        System.arraycopy(options, 0, args, 2, options.length);
        Control control = new Control(args);
        return new HorizonSearch(DomainReader.read(domain, "1", control.problem.provideSolutions), control, OjAlgoSolver::new).solve();
    }

    // ========== Horizon Tests ==========

    @Test
    void testHorizon_SolvedAtFirstHorizon() throws InfeasibilityException {
        HorizonSearch.Result result = solve("trivial", "-gap=1e-6");
        assertEquals(1, result.horizon());
        assertEquals(-2.0, result.objectiveValue(), EPS);
        assertEquals(2.0, result.model().duration(0), EPS);
        assertTrue(result.optimizer.generatedConstraints().isEmpty());
        assertEquals(1, result.optimizer.numberOfIterations());
        assertTrue(result.solveTime >= 0);
    }

    @Test
    void testHorizon_Incremented() throws InfeasibilityException {
        HorizonSearch.Result result = solve("twostep", "-gap=1e-6");
        assertEquals(2, result.horizon());
        assertEquals(-1.5, result.objectiveValue(), EPS);
        assertEquals(1.5, result.model().duration(0) + result.model().duration(1), EPS);
    }

    @Test
    void testHorizon_PinnedHorizonIsNotIncremented() {
        InfeasibilityException e = assertThrows(InfeasibilityException.class, () -> solve("twostep", "-horizon=1"));
        assertEquals(1, e.horizon);
    }

    @Test
    void testHorizon_PinnedHorizon() throws InfeasibilityException {
        HorizonSearch.Result result = solve("trivial", "-horizon=3", "-gap=1e-6");
        assertEquals(3, result.horizon());
        assertEquals(-2.0, result.objectiveValue(), EPS);
    }

    @Test
    void testHorizon_ProvidedTransitions() throws InfeasibilityException {
        HorizonSearch.Result result = solve("trivial", "-provideSolutions", "-gap=1e-6");
        assertEquals(1, result.horizon());
        assertEquals(-2.0, result.objectiveValue(), EPS);
    }

    // ========== Constraint Generation Tests ==========

    @Test
    void testGeneration_OneCut() throws InfeasibilityException {
        HorizonSearch.Result result = solve("zone", "-gap=1e-6");
        assertEquals(1, result.horizon());
        assertEquals(1, result.optimizer.generatedConstraints().size());
        assertEquals(2, result.optimizer.numberOfIterations());

        ZeroCrossing z = result.optimizer.generatedConstraints().get(0).zeroCrossing;
        assertEquals(0, z.step);
        assertEquals(0, z.iteration);
        assertEquals(4.0, z.duration, EPS);
        assertEquals(2.1, z.start, EPS);
        assertEquals(2.9, z.end, EPS);
        assertEquals(0.625, z.coefficient, EPS);
        assertEquals(2.5, z.newDuration, EPS);

        assertEquals(2.0, result.objectiveValue(), EPS);
        assertEquals(2.0, result.model().duration(0), EPS);
    }

    @Test
    void testGeneration_SnapshotsPerIteration() throws InfeasibilityException {
        HorizonSearch.Result result = solve("zone", "-gap=1e-6");
        int nVariables = result.model().variables.size();
        assertEquals(2 * nVariables, result.optimizer.snapshots().size());
        assertEquals(1, result.optimizer.snapshots().get(result.optimizer.snapshots().size() - 1).iteration);
    }

    @Test
    void testGeneration_TwoCuts() throws InfeasibilityException {
        HorizonSearch.Result result = solve("twozones", "-gap=1e-6");
        assertEquals(2, result.optimizer.generatedConstraints().size());
        assertEquals(0, result.optimizer.generatedConstraints().get(0).zeroCrossing.constraintIndex);
        ZeroCrossing second = result.optimizer.generatedConstraints().get(1).zeroCrossing;
        assertEquals(1, second.constraintIndex);
        assertEquals(1, second.iteration);
        assertEquals(0.6, second.start, EPS);
        assertEquals(0.9, second.end, EPS);
        assertEquals(0.375, second.coefficient, EPS);
        assertEquals(0.5, result.objectiveValue(), EPS);
    }

    @Test
    void testGeneration_IterationCap() {
        NonConvergenceException e = assertThrows(NonConvergenceException.class, () -> solve("twozones", "-gap=1e-6", "-maxIterations=1"));
        assertEquals(1, e.nGenerated);
        assertEquals(1, e.horizon);
    }
}
