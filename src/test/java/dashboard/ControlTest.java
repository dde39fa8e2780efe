/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControlTest {

    // ========== Input Tests ==========

    @Test
    void testInput_KeysAndFlags() {
        Map<String, String> settings = Input.parse("-domain=car", "-provideSolutions", "-epsilon=0.05");
        assertEquals("car", settings.get("domain"));
        assertEquals("true", settings.get("provideSolutions"));
        assertEquals("0.05", settings.get("epsilon"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"domain=car", "-", "-=3"})
    void testInput_Malformed(String arg) {
        assertThrows(IllegalArgumentException.class, () -> Input.parse(arg));
    }

    // ========== Default Tests ==========

    @Test
    void testDefaults() {
        Control control = new Control();
        assertNull(control.problem.domain);
        assertFalse(control.problem.horizonPinned());
        assertEquals(1, control.problem.initialHorizon());
        assertFalse(control.problem.provideSolutions);
        assertEquals("Dt", control.problem.dtVar);
        assertEquals(0.1, control.search.epsilon);
        assertEquals(1000.0, control.search.bigM);
        assertEquals(0, control.search.maxIterations);
        assertEquals(0.1, control.solving.gap);
        assertEquals(1e-6, control.solving.feasibilityTolerance);
        assertEquals(0L, control.solving.timeLimit);
        assertFalse(control.output.saveSolutions);
        assertEquals(0, control.output.verbose);
    }

    // ========== Override Tests ==========

    @Test
    void testOverrides() {
        Control control = new Control("-domain=car", "-instance=2", "-horizon=4", "-epsilon=0.01", "-bigM=50", "-gap=0", "-feastol=1e-8",
                "-dtVar=Delta", "-maxIterations=10", "-solverTimeLimit=5000", "-saveSolutions", "-verbose=2");
        assertEquals("car", control.problem.domain);
        assertEquals("2", control.problem.instance);
        assertTrue(control.problem.horizonPinned());
        assertEquals(4, control.problem.initialHorizon());
        assertEquals(0.01, control.search.epsilon);
        assertEquals(50.0, control.search.bigM);
        assertEquals(0.0, control.solving.gap);
        assertEquals(1e-8, control.solving.feasibilityTolerance);
        assertEquals("Delta", control.problem.dtVar);
        assertEquals(10, control.search.maxIterations);
        assertEquals(5000L, control.solving.timeLimit);
        assertTrue(control.output.saveSolutions);
        assertEquals(2, control.output.verbose);
    }

    @Test
    void testOverrides_UnknownOption() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new Control("-epsilonn=0.1"));
        assertTrue(e.getMessage().contains("epsilonn"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-horizon=two", "-epsilon=small", "-solverTimeLimit=1.5"})
    void testOverrides_BadValues(String arg) {
        assertThrows(IllegalArgumentException.class, () -> new Control(arg));
    }

    @Test
    void testUsage_ListsAllOptions() {
        String usage = new Control().usage();
        for (String option : new String[] { "domain", "instance", "horizon", "provideSolutions", "dtVar", "epsilon", "bigM", "maxIterations",
                "gap", "feastol", "solverTimeLimit", "showOutput", "saveSolutions", "verbose" })
            assertTrue(usage.contains("-" + option + " "), option);
    }

    @Test
    void testToString_Configuration() {
        String s = new Control("-domain=car", "-instance=1").toString();
        assertTrue(s.contains("Domain: car"));
        assertTrue(s.contains("Horizon: 1 (default)"));
        assertTrue(s.contains("Use system of ODEs: true"));
    }
}
