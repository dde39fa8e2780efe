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
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import optimization.HorizonSearch;
import optimization.InfeasibilityException;
import problem.DomainReader;
import solver.OjAlgoSolver;

import static org.junit.jupiter.api.Assertions.*;

class OutputTest {

    private static HorizonSearch.Result solveZone() throws InfeasibilityException {
        Control control = new Control("-domain=zone", "-instance=1", "-gap=1e-6");
        return new HorizonSearch(DomainReader.read("zone", "1", false), control, OjAlgoSolver::new).solve();
    }

    // ========== CSV Tests ==========

    @Test
    void testCsv_FieldsWithCommasAreQuoted() {
        assertEquals("abc", Output.csvField("abc"));
        assertEquals("\"a,b\"", Output.csvField("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", Output.csvField("say \"hi\""));
        assertEquals("2.5", Output.csvField(2.5));
    }

    @Test
    void testCsv_FileNames() {
        Control control = new Control("-domain=zone", "-instance=1");
        assertEquals("results_zone_1.csv", Output.fileName("results", control));
    }

    @Test
    void testCsv_SaveSnapshotsAndGeneratedConstraints(@TempDir Path dir) throws InfeasibilityException, IOException {
        HorizonSearch.Result result = solveZone();
        Output.save(result, dir);

        List<String> values = Files.readAllLines(dir.resolve("results_zone_1.csv"), StandardCharsets.UTF_8);
        assertEquals("name,variable_type,value_type,horizon,variable_value,iteration", values.get(0));
        assertEquals(1 + result.optimizer.snapshots().size(), values.size());

        List<String> constraints = Files.readAllLines(dir.resolve("new_constraints_zone_1.csv"), StandardCharsets.UTF_8);
        assertEquals("interval_start,interval_end,dt_interval,zero_crossing_coefficient,new_dt_val,horizon,iteration,constraint_idx",
                constraints.get(0));
        assertEquals(2, constraints.size());
        assertTrue(constraints.get(1).endsWith(",0,0,0"));
    }

    // ========== Plan Tests ==========

    @Test
    void testPlan_Printed() throws InfeasibilityException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Output.printPlan(solveZone(), new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String plan = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(plan.startsWith("Plan: "));
        assertTrue(plan.contains("Dt at step 0 by value 2.000."));
        assertTrue(plan.contains("Total reward: 2.000"));
    }
}
