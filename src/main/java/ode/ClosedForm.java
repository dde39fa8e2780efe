/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package ode;

import expressions.Node;

/**
 * The closed-form solution of a differential equation for one state: the value and the derivative of the state as expressions of the
 * elapsed time, where the name of the state stands for its value at the start of the step.
 */
public final class ClosedForm {

	public final String state;

	public final Node value;

	public final Node derivative;

	public ClosedForm(String state, Node value, Node derivative) {
		this.state = state;
		this.value = value;
		this.derivative = derivative;
	}

	@Override
	public String toString() {
		return state + "(t) = " + value + ", d" + state + "/dt = " + derivative;
	}
}
