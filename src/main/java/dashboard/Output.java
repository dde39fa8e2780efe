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

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import optimization.GeneratedConstraint;
import optimization.HorizonSearch.Result;
import optimization.Snapshot;
import problem.PlanModel;
import utility.Kit;
import variables.Role;
import variables.Variable;

/**
 * Displays and saves the results of a search
 */
public final class Output {

	private Output() {
	}

	/**
	 * Prints the plan: the value of each action at each step, the duration of each step, the total reward and the total time
	 */
	public static void printPlan(Result result, PrintStream out) {
		PlanModel model = result.model();
		List<String> actions = model.variables.names(Role.ACTION).stream().sorted().collect(Collectors.toList());
		out.println("Plan: ");
		for (int step = 0; step < model.horizon; step++) {
			for (String action : actions)
				if (!action.equals(model.control.problem.dtVar))
					out.println(String.format(Locale.US, "%s at step %d by value %.3f.", action, step, model.value(model.variables.get(action, step))));
			out.println(String.format(Locale.US, "%s at step %d by value %.3f. %n", model.control.problem.dtVar, step, model.duration(step)));
		}
		out.println(String.format(Locale.US, "Total reward: %.3f", result.objectiveValue()));
		out.println(String.format(Locale.US, "Total time: %.3f", result.solveTime));
	}

	public static String fileName(String prefix, Control control) {
		return prefix + "_" + control.problem.domain + "_" + control.problem.instance + ".csv";
	}

	/**
	 * Saves the values of variables at each iteration, and the generated constraints, in two CSV files of the specified directory
	 */
	public static void save(Result result, Path directory) {
		Control control = result.model().control;
		Path values = directory.resolve(fileName("results", control));
		writeCsv(values, Snapshot.header(), result.optimizer.snapshots().stream().map(Snapshot::row).collect(Collectors.toList()));
		Path constraints = directory.resolve(fileName("new_constraints", control));
		writeCsv(constraints, GeneratedConstraint.header(),
				result.optimizer.generatedConstraints().stream().map(GeneratedConstraint::row).collect(Collectors.toList()));
		Kit.log.config("Solutions saved in " + values + " and " + constraints);
	}

	static String csvField(Object value) {
		String s = String.valueOf(value);
		return s.contains(",") || s.contains("\"") ? "\"" + s.replace("\"", "\"\"") + "\"" : s;
	}

	static void writeCsv(Path path, List<String> header, List<List<Object>> rows) {
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writer.write(String.join(",", header) + "\n");
			for (List<Object> row : rows)
				writer.write(row.stream().map(Output::csvField).collect(Collectors.joining(",")) + "\n");
		} catch (IOException e) {
			throw new UncheckedIOException("Impossible to write " + path, e);
		}
	}

	/**
	 * Returns a short description of the values of the variables in the current solution
	 */
	public static String values(PlanModel model) {
		StringBuilder sb = new StringBuilder();
		for (Variable x : model.variables.all())
			if (!x.isConstant())
				sb.append(x).append("=").append(Kit.round(model.value(x), 3)).append(" ");
		return sb.toString().trim();
	}
}
