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

import dashboard.Control;
import problem.Domain;
import problem.PlanModel;
import solver.SolverFactory;
import utility.Kit;

/**
 * The search for a plan: the domain is encoded over the initial horizon and optimized; when no plan exists, the horizon is incremented
 * (unless it was given by the user) and a new model is built from scratch.
 */
public final class HorizonSearch {

	/**
	 * The outcome of a successful search
	 */
	public static final class Result {

		public final Optimizer optimizer;

		/**
		 * The total time spent (in seconds), including the attempts with smaller horizons
		 */
		public final double solveTime;

		Result(Optimizer optimizer, double solveTime) {
			this.optimizer = optimizer;
			this.solveTime = solveTime;
		}

		public PlanModel model() {
			return optimizer.model;
		}

		public int horizon() {
			return optimizer.model.horizon;
		}

		public double objectiveValue() {
			return optimizer.objectiveValue();
		}
	}

	private final Domain domain;

	private final Control control;

	private final SolverFactory factory;

	public HorizonSearch(Domain domain, Control control, SolverFactory factory) {
		this.domain = domain;
		this.control = control;
		this.factory = factory;
	}

	/**
	 * Searches for a plan, starting from the initial horizon
	 *
	 * @throws InfeasibilityException
	 *             if the horizon was given by the user and no plan exists for it
	 */
	public Result solve() throws InfeasibilityException {
		long start = System.currentTimeMillis();
		for (int horizon = control.problem.initialHorizon();; horizon++) {
			Kit.log.config("Encoding the problem over horizon h=" + horizon);
			Optimizer optimizer = new Optimizer(new PlanModel(domain, control, horizon, factory));
			try {
				Kit.log.config("Solving the problem");
				optimizer.optimize();
				double solveTime = (System.currentTimeMillis() - start) / 1000.0;
				Kit.log.config("Problem solved with " + optimizer.generatedConstraints().size() + " generated constraints");
				return new Result(optimizer, solveTime);
			} catch (InfeasibilityException e) {
				if (control.problem.horizonPinned()) {
					Kit.log.config("Horizon of h=" + horizon + " is infeasible");
					throw e;
				}
				Kit.log.config("Horizon of h=" + horizon + " is infeasible, incrementing to h=" + (horizon + 1));
			}
		}
	}
}
