/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package evaluation;

import java.util.LinkedHashMap;
import java.util.Map;

import expressions.ParseException;

/**
 * The values (numbers or solver terms) associated with names when evaluating expressions
 *
 * @param <V>
 *            the type of values
 */
public final class Bindings<V> {

	private final Map<String, V> map;

	public Bindings() {
		this.map = new LinkedHashMap<>();
	}

	private Bindings(Map<String, V> map) {
		this.map = new LinkedHashMap<>(map);
	}

	public Bindings<V> put(String name, V value) {
		map.put(name, value);
		return this;
	}

	public V get(String name) {
		V value = map.get(name);
		if (value == null)
			throw new ParseException("Unknown name " + name);
		return value;
	}

	public boolean contains(String name) {
		return map.containsKey(name);
	}

	public Bindings<V> copy() {
		return new Bindings<>(map);
	}

	@Override
	public String toString() {
		return map.toString();
	}
}
