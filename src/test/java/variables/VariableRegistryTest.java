/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package variables;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import solver.OjAlgoSolver;

import static org.junit.jupiter.api.Assertions.*;

class VariableRegistryTest {

    private OjAlgoSolver solver;
    private VariableRegistry registry;

    @BeforeEach
    void setUp() {
        solver = new OjAlgoSolver("test", 1e-6);
        registry = new VariableRegistry();
    }

    // ========== Declared Type Tests ==========

    @ParameterizedTest
    @CsvSource({
            "state continuous, STATE, CONTINUOUS",
            "action boolean, ACTION, BOOLEAN",
            "global action integer, ACTION, INTEGER",
            "auxiliary continuous, AUXILIARY, CONTINUOUS"
    })
    void testDeclaredType_RoleAndValueType(String declared, Role role, ValueType type) {
        assertEquals(role, Role.of(declared));
        assertEquals(type, ValueType.of(declared));
    }

    @Test
    void testDeclaredType_Unknown() {
        assertNull(Role.of("parameter real"));
        assertNull(ValueType.of("state real"));
    }

    // ========== Registration Tests ==========

    @Test
    void testRegistration_PerStepVariables() {
        for (int t = 0; t <= 2; t++)
            registry.add(solver, "x", Role.STATE, ValueType.CONTINUOUS, false, t, null, null);
        assertEquals(3, registry.size());
        assertEquals(3, solver.numberOfVariables());
        assertEquals("x_1", registry.get("x", 1).handle.name);
        assertEquals(1, registry.get("x", 1).time);
        assertNull(registry.get("x", 3));
        assertNull(registry.get("y", 0));
    }

    @Test
    void testRegistration_GlobalVariableIsShared() {
        Variable first = registry.add(solver, "g", Role.ACTION, ValueType.CONTINUOUS, true, 0, null, null);
        Variable second = registry.add(solver, "g", Role.ACTION, ValueType.CONTINUOUS, true, 1, null, null);
        assertSame(first, second);
        assertSame(first, registry.get("g", 5));
        assertTrue(first.isGlobal());
        assertEquals("g", first.handle.name);
        assertEquals(1, solver.numberOfVariables());
    }

    @Test
    void testRegistration_Constants() {
        Variable c = registry.addConstant("rate", 2.5);
        assertTrue(c.isConstant());
        assertSame(c, registry.get("rate", 7));
        assertEquals(2.5, c.term().constant());
        assertTrue(c.term().isConstant());
        assertEquals(0, solver.numberOfVariables());
    }

    @Test
    void testRegistration_Duplicates() {
        registry.add(solver, "x", Role.STATE, ValueType.CONTINUOUS, false, 0, null, null);
        assertThrows(IllegalStateException.class, () -> registry.add(solver, "x", Role.STATE, ValueType.CONTINUOUS, false, 0, null, null));
        assertThrows(IllegalStateException.class, () -> registry.add(solver, "x", Role.ACTION, ValueType.CONTINUOUS, false, 1, null, null));
        assertThrows(IllegalStateException.class, () -> registry.addConstant("x", 1));
    }

    @Test
    void testRegistration_NamesInDeclarationOrder() {
        registry.addConstant("k", 1);
        registry.add(solver, "x", Role.STATE, ValueType.CONTINUOUS, false, 0, null, null);
        registry.add(solver, "a", Role.ACTION, ValueType.CONTINUOUS, false, 0, null, null);
        registry.add(solver, "y", Role.STATE, ValueType.CONTINUOUS, false, 0, null, null);
        assertEquals(List.of("k", "x", "a", "y"), registry.names());
        assertEquals(List.of("x", "y"), registry.names(Role.STATE));
        assertEquals(Role.ACTION, registry.role("a"));
        assertEquals(4, registry.all().size());
    }
}
