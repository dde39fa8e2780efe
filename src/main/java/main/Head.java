/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package main;

import java.nio.file.Paths;

import dashboard.Control;
import dashboard.Output;
import optimization.HorizonSearch;
import optimization.InfeasibilityException;
import problem.Domain;
import problem.DomainReader;
import solver.OjAlgoSolver;
import utility.Kit;

/**
 * The launcher of the planner. Options are given as -key=value, for example: java main.Head -domain=navigation -instance=1 -horizon=3
 */
public class Head {

	public static void main(String[] args) {
		Control control;
		try {
			control = new Control(args);
		} catch (IllegalArgumentException e) {
			Kit.log.severe(e.getMessage());
			System.out.println("Usage: java main.Head -domain=<name> -instance=<name> [options]\n" + new Control().usage());
			System.exit(1);
			return;
		}
		if (control.problem.domain == null || control.problem.instance == null) {
			System.out.println("Usage: java main.Head -domain=<name> -instance=<name> [options]\n" + control.usage());
			return;
		}
		Kit.setVerbosity(control.output.verbose);
		Kit.log.config(control.toString());
		Domain domain = DomainReader.read(control.problem.domain, control.problem.instance, control.problem.provideSolutions);
		try {
			HorizonSearch.Result result = new HorizonSearch(domain, control, OjAlgoSolver::new).solve();
			if (control.output.saveSolutions)
				Output.save(result, Paths.get("."));
			Output.printPlan(result, System.out);
		} catch (InfeasibilityException e) {
			Kit.log.config(e.getMessage());
		}
	}
}
