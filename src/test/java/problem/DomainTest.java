/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DomainTest {

    private static final String TEXT = String.join("\n",
            "constants:",
            "rate = 1.5",
            "limit = config_bigM",
            "---",
            "pvariables:",
            "state continuous: x",
            "global action boolean: mode",
            "action continuous: Dt",
            "---",
            "",
            "initials:",
            "   x == 0.0   ",
            "",
            "---",
            "goals:",
            "x >= 2",
            "---",
            "reward:",
            "-Dt",
            "-x");

    // ========== Section Tests ==========

    @Test
    void testSections_LinesAreTrimmed() {
        Domain domain = Domain.parse("test", TEXT);
        assertEquals(List.of("x == 0.0"), domain.lines(Family.INITIALS));
        assertEquals(List.of("x >= 2"), domain.lines("goals"));
        assertEquals(List.of("-Dt", "-x"), domain.lines(Domain.REWARD));
    }

    @Test
    void testSections_MissingSections() {
        Domain domain = Domain.parse("test", TEXT);
        assertFalse(domain.has(Domain.ODES));
        assertTrue(domain.lines(Family.TEMPORAL).isEmpty());
        assertThrows(DomainException.class, () -> domain.required(Domain.ODES));
    }

    @Test
    void testSections_DuplicateSection() {
        assertThrows(DomainException.class, () -> Domain.parse("test", "goals:\nx >= 1\n---\ngoals:\nx >= 2"));
    }

    @ParameterizedTest
    @CsvSource({
            "INITIALS, initials",
            "INSTANTANEOUS, instantaneous_constraints",
            "TEMPORAL, temporal_constraints",
            "TRANSITIONS, transitions",
            "GOALS, goals"
    })
    void testSections_FamilyNames(Family family, String section) {
        assertEquals(section, family.section);
    }

    // ========== Constant Tests ==========

    @Test
    void testConstants_NumbersAndConfigurationValues() {
        Map<String, Double> constants = Domain.parse("test", TEXT).constants(Map.of("config_bigM", 500.0));
        assertEquals(List.of("rate", "limit"), List.copyOf(constants.keySet()));
        assertEquals(1.5, constants.get("rate"));
        assertEquals(500.0, constants.get("limit"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"rate = fast", "rate", "= 2", "a = b = 2"})
    void testConstants_Malformed(String line) {
        Domain domain = Domain.parse("test", "constants:\n" + line);
        assertThrows(DomainException.class, () -> domain.constants(Map.of()));
    }

    // ========== Declaration Tests ==========

    @Test
    void testDeclarations() {
        List<Domain.Declaration> declarations = Domain.parse("test", TEXT).declarations();
        assertEquals(3, declarations.size());
        assertEquals("state continuous", declarations.get(0).type);
        assertEquals("x", declarations.get(0).name);
        assertFalse(declarations.get(0).isGlobal());
        assertTrue(declarations.get(1).isGlobal());
    }

    @Test
    void testDeclarations_Malformed() {
        assertThrows(DomainException.class, () -> Domain.parse("test", "pvariables:\nstate continuous x").declarations());
        assertThrows(DomainException.class, () -> Domain.parse("test", "reward:\n-Dt").declarations());
    }

    // ========== Reader Tests ==========

    @Test
    void testReader_FileNames() {
        assertEquals("odes_car_1.txt", DomainReader.fileName("car", "1", false));
        assertEquals("solutions_car_1.txt", DomainReader.fileName("car", "1", true));
    }

    @Test
    void testReader_FromClasspath() {
        Domain domain = DomainReader.read("trivial", "1", false);
        assertEquals("odes_trivial_1.txt", domain.name);
        assertEquals(List.of("dd(x, Dt) == rate"), domain.lines(Domain.ODES));
    }

    @Test
    void testReader_UnknownInstance() {
        DomainException e = assertThrows(DomainException.class, () -> DomainReader.read("trivial", "42", false));
        assertTrue(e.getMessage().contains("odes_trivial_42.txt"));
        assertThrows(DomainException.class, () -> DomainReader.read(null, "1", false));
    }
}
