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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reading of the arguments given on the command line. Arguments have the form -key=value, or -key for flags (whose value is then true).
 */
public final class Input {

	private Input() {
	}

	/**
	 * Returns the settings given by the specified arguments, keys being given without the leading dash
	 *
	 * @param args
	 *            the arguments of the command line
	 * @return a map associating values with keys, in the order of the arguments
	 */
	public static Map<String, String> parse(String... args) {
		Map<String, String> settings = new LinkedHashMap<>();
		for (String arg : args) {
			if (!arg.startsWith("-") || arg.length() == 1)
				throw new IllegalArgumentException("Arguments must have the form -key=value or -key: " + arg);
			String s = arg.substring(1);
			int pos = s.indexOf('=');
			if (pos == -1)
				settings.put(s, "true");
			else if (pos == 0)
				throw new IllegalArgumentException("Missing key in " + arg);
			else
				settings.put(s.substring(0, pos), s.substring(pos + 1));
		}
		return settings;
	}
}
