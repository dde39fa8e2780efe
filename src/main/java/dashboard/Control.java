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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The options of the planner, grouped by concern. Each option has a name (used on the command line as -name=value), a default value and a
 * description. A value given for an unknown option is an error.
 */
public class Control {

	private final Map<String, String> settings;

	private final Set<String> usedKeys = new HashSet<>();

	private final List<String> descriptions = new ArrayList<>();

	public final OptionsProblem problem;

	public final OptionsSearch search;

	public final OptionsSolving solving;

	public final OptionsOutput output;

	/**
	 * Builds the options from the specified command line arguments
	 */
	public Control(String... args) {
		this.settings = Input.parse(args);
		this.problem = new OptionsProblem();
		this.search = new OptionsSearch();
		this.solving = new OptionsSolving();
		this.output = new OptionsOutput();
		for (String key : settings.keySet())
			if (!usedKeys.contains(key))
				throw new IllegalArgumentException("Unknown option " + key);
	}

	public abstract class OptionGroup {

		private String value(String name, Object defaultValue, String description) {
			usedKeys.add(name);
			descriptions.add("  -" + name + " (default: " + defaultValue + ")  " + description);
			return settings.get(name);
		}

		protected String addS(String name, String defaultValue, String description) {
			String v = value(name, defaultValue, description);
			return v == null ? defaultValue : v;
		}

		protected int addI(String name, int defaultValue, String description) {
			String v = value(name, defaultValue, description);
			try {
				return v == null ? defaultValue : Integer.parseInt(v);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Option " + name + " expects an integer, not " + v, e);
			}
		}

		protected long addL(String name, long defaultValue, String description) {
			String v = value(name, defaultValue, description);
			try {
				return v == null ? defaultValue : Long.parseLong(v);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Option " + name + " expects an integer, not " + v, e);
			}
		}

		protected double addD(String name, double defaultValue, String description) {
			String v = value(name, defaultValue, description);
			try {
				return v == null ? defaultValue : Double.parseDouble(v);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Option " + name + " expects a number, not " + v, e);
			}
		}

		protected boolean addB(String name, boolean defaultValue, String description) {
			String v = value(name, defaultValue, description);
			return v == null ? defaultValue : Boolean.parseBoolean(v);
		}
	}

	public class OptionsProblem extends OptionGroup {
		public final String domain = addS("domain", null, "Name of the domain (e.g., navigation)");
		public final String instance = addS("instance", null, "Name of the instance of the domain (e.g., 1)");
		public final int horizon = addI("horizon", 0, "Initial horizon; when given, the horizon is never incremented");
		public final boolean provideSolutions = addB("provideSolutions", false, "Transitions are provided instead of a system of ODEs");
		public final String dtVar = addS("dtVar", "Dt", "Name of the variable giving the duration of each step");

		/**
		 * Returns true if the horizon has been set by the user
		 */
		public boolean horizonPinned() {
			return horizon > 0;
		}

		public int initialHorizon() {
			return horizonPinned() ? horizon : 1;
		}
	}

	public class OptionsSearch extends OptionGroup {
		public final double epsilon = addD("epsilon", 0.1, "Time resolution used when checking temporal constraints");
		public final double bigM = addD("bigM", 1000.0, "Large constant used when linearizing disjunctions and bounding durations");
		public final int maxIterations = addI("maxIterations", 0, "Maximal number of generated constraints per horizon (0 for no limit)");
	}

	public class OptionsSolving extends OptionGroup {
		public final double gap = addD("gap", 0.1, "Relative optimality gap");
		public final double feasibilityTolerance = addD("feastol", 1e-6, "Tolerance used when checking constraints");
		public final long timeLimit = addL("solverTimeLimit", 0, "Time limit in milliseconds for each call to the solver (0 for no limit)");
		public final boolean showOutput = addB("showOutput", false, "Display the progress of the solver");
	}

	public class OptionsOutput extends OptionGroup {
		public final boolean saveSolutions = addB("saveSolutions", false, "Save values and generated constraints in CSV files");
		public final int verbose = addI("verbose", 0, "Verbosity level (0, 1 or 2)");
	}

	/**
	 * Returns the description of all options
	 */
	public String usage() {
		return String.join("\n", descriptions);
	}

	@Override
	public String toString() {
		return "Configuration:\n  Use system of ODEs: " + !problem.provideSolutions + "\n  Domain: " + problem.domain + "\n  Instance: " + problem.instance
				+ "\n  Horizon: " + problem.initialHorizon() + (problem.horizonPinned() ? "" : " (default)") + "\n  Epsilon: " + search.epsilon
				+ "\n  Gap: " + solving.gap * 100 + "%\n  BigM: " + search.bigM + "\n  Dt variable: " + problem.dtVar;
	}
}
