/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import problem.PlanModel;
import utility.Kit;
import variables.Variable;

/**
 * A pilot for optimizing a plan model over a fixed horizon. The model is solved, and the solution is checked between the discrete time
 * steps; while a temporal constraint is violated, a cutting constraint is added to the model and the model is solved again. At most one
 * constraint is generated per call to the solver.
 */
public class Optimizer {

	/**
	 * The plan model to which this object is attached
	 */
	public final PlanModel model;

	private final ViolationDetector detector;

	private final ConstraintGenerator generator = new ConstraintGenerator();

	/**
	 * The maximal number of generated constraints (0 for no limit)
	 */
	private final int maxIterations;

	/**
	 * The history of generated constraints
	 */
	private final List<GeneratedConstraint> generated = new ArrayList<>();

	/**
	 * The values of variables at each iteration
	 */
	private final List<Snapshot> snapshots = new ArrayList<>();

	private int nIterations;

	public Optimizer(PlanModel model) {
		this.model = model;
		this.detector = new ViolationDetector(model.control.search.epsilon);
		this.maxIterations = model.control.search.maxIterations;
	}

	/**
	 * Solves the model until the solution satisfies all temporal constraints
	 *
	 * @throws InfeasibilityException
	 *             if the model has no solution
	 * @throws NonConvergenceException
	 *             if the maximal number of generated constraints is reached
	 */
	public void optimize() throws InfeasibilityException {
		for (int iteration = 0;; iteration++) {
			if (!model.solver.optimize())
				throw new InfeasibilityException(model.horizon);
			nIterations = iteration + 1;
			ZeroCrossing zeroCrossing = detector.detect(model, iteration);
			save(iteration);
			if (!zeroCrossing.violated) {
				Kit.log.fine("  Solution valid at iteration " + iteration + " with value " + model.solver.objectiveValue());
				return;
			}
			if (maxIterations > 0 && generated.size() >= maxIterations)
				throw new NonConvergenceException(generated.size(), model.horizon);
			generated.add(generator.generate(model, zeroCrossing));
		}
	}

	private void save(int iteration) {
		for (Variable x : model.variables.all())
			snapshots.add(new Snapshot(x, model.value(x), iteration));
	}

	public List<GeneratedConstraint> generatedConstraints() {
		return Collections.unmodifiableList(generated);
	}

	public List<Snapshot> snapshots() {
		return Collections.unmodifiableList(snapshots);
	}

	/**
	 * Returns the number of calls to the solver
	 */
	public int numberOfIterations() {
		return nIterations;
	}

	public double objectiveValue() {
		return model.solver.objectiveValue();
	}

	@Override
	public String toString() {
		return "optimizer of " + model + " (" + generated.size() + " generated constraints)";
	}
}
