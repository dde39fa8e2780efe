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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The textual description of a planning domain instance. The text is made of sections separated by lines containing ---, each section
 * starting with a line giving its name (followed by a colon) and containing one statement per line. Sections are constants (name = value),
 * pvariables (type: name), initials, instantaneous_constraints, temporal_constraints, odes or transitions, goals and reward.
 */
public final class Domain {

	public static final String CONSTANTS = "constants", PVARIABLES = "pvariables", ODES = "odes", REWARD = "reward";

	/**
	 * A variable declaration, as type: name
	 */
	public static final class Declaration {
		public final String type;
		public final String name;

		Declaration(String type, String name) {
			this.type = type;
			this.name = name;
		}

		public boolean isGlobal() {
			return type.startsWith("global");
		}

		@Override
		public String toString() {
			return type + ": " + name;
		}
	}

	public final String name;

	private final Map<String, List<String>> sections;

	private Domain(String name, Map<String, List<String>> sections) {
		this.name = name;
		this.sections = sections;
	}

	/**
	 * Parses the specified text
	 *
	 * @param name
	 *            the name of the domain instance (used in messages)
	 * @param text
	 *            the description of the domain instance
	 */
	public static Domain parse(String name, String text) {
		Map<String, List<String>> sections = new LinkedHashMap<>();
		List<String> current = null;
		boolean newSection = true;
		for (String line : text.split("\\R")) {
			line = line.strip();
			if (line.isEmpty())
				continue;
			if (line.equals("---"))
				newSection = true;
			else if (newSection) {
				String section = line.endsWith(":") ? line.substring(0, line.length() - 1).strip() : line;
				if (sections.containsKey(section))
					throw new DomainException("Section " + section + " appears twice in " + name);
				current = new ArrayList<>();
				sections.put(section, current);
				newSection = false;
			} else
				current.add(line);
		}
		return new Domain(name, sections);
	}

	public boolean has(String section) {
		return sections.containsKey(section);
	}

	/**
	 * Returns the (non-empty) lines of the specified section, or an empty list if the section is absent
	 */
	public List<String> lines(String section) {
		return Collections.unmodifiableList(sections.getOrDefault(section, Collections.emptyList()));
	}

	public List<String> lines(Family family) {
		return lines(family.section);
	}

	/**
	 * Returns the lines of the specified section, which must be present
	 */
	public List<String> required(String section) {
		if (!has(section))
			throw new DomainException("Missing section " + section + " in " + name);
		return lines(section);
	}

	/**
	 * Returns the constants of the domain. A value can also be the name of a configuration value (for example, config_bigM).
	 *
	 * @param configValues
	 *            the values that can be referred to by name
	 */
	public Map<String, Double> constants(Map<String, Double> configValues) {
		Map<String, Double> constants = new LinkedHashMap<>();
		for (String line : lines(CONSTANTS)) {
			int pos = line.indexOf('=');
			if (pos <= 0 || line.indexOf('=', pos + 1) != -1)
				throw new DomainException("Constants must be given as name = value: " + line);
			String name = line.substring(0, pos).strip(), value = line.substring(pos + 1).strip();
			if (configValues.containsKey(value))
				constants.put(name, configValues.get(value));
			else
				try {
					constants.put(name, Double.parseDouble(value));
				} catch (NumberFormatException e) {
					throw new DomainException("Constants can only be numbers: " + line, e);
				}
		}
		return constants;
	}

	public List<Declaration> declarations() {
		List<Declaration> list = new ArrayList<>();
		for (String line : required(PVARIABLES)) {
			int pos = line.indexOf(':');
			if (pos <= 0 || pos == line.length() - 1)
				throw new DomainException("Variables must be declared as type: name: " + line);
			list.add(new Declaration(line.substring(0, pos).strip(), line.substring(pos + 1).strip()));
		}
		return list;
	}

	@Override
	public String toString() {
		return name + " " + sections.keySet();
	}
}
