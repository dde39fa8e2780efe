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

import static utility.Kit.control;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dashboard.Control;
import evaluation.Bindings;
import evaluation.CompiledExpressions;
import evaluation.Evaluator;
import expressions.Kind;
import expressions.Node;
import expressions.Operator;
import expressions.ParseException;
import expressions.Parser;
import ode.ClosedForm;
import ode.OdeAdapter;
import solver.Constraint;
import solver.MinlpSolver;
import solver.Relation;
import solver.SolverFactory;
import solver.SolverVariable;
import solver.Term;
import utility.Kit;
import variables.Role;
import variables.ValueType;
import variables.Variable;
import variables.VariableRegistry;

/**
 * The encoding of a domain instance over a fixed horizon. Variables are created for every time step (states also exist at the end of the
 * horizon), and all statements of the domain are compiled into solver constraints: initials (at step 0), instantaneous constraints,
 * temporal constraints and transitions (at every step) and goals (at the last step, states referring to the end of the horizon). The
 * objective is the sum, over all steps, of the reward.
 *
 * When the domain is given with a system of ODEs, transitions are obtained from the closed-form solutions of the system, and temporal
 * constraints are rewritten in terms of the elapsed time in each step.
 */
public final class PlanModel implements Trajectory {

	/**
	 * The suffix used for referring to the value of a state at the next step
	 */
	public static final String SUCCESSOR_SUFFIX = "_dash";

	public static final String FEASTOL = "feastol";

	public static final String BIG_M = "bigM";

	public final Domain domain;

	public final Control control;

	public final int horizon;

	public final MinlpSolver solver;

	public final VariableRegistry variables = new VariableRegistry();

	public final AuxiliaryIndex auxiliaries = new AuxiliaryIndex();

	private final Map<String, Double> constants;

	private final Map<Family, List<Node>> statements = new EnumMap<>(Family.class);

	/**
	 * Closed forms of states, when a system of ODEs is given
	 */
	private final Map<String, ClosedForm> closedForms;

	private final List<Variable> objectives = new ArrayList<>();

	private final String dtVar;

	private int nPosted;

	/**
	 * Builds the encoding of the specified domain over the specified horizon
	 *
	 * @param domain
	 *            the domain instance
	 * @param control
	 *            the options of the planner
	 * @param horizon
	 *            the number of steps
	 * @param factory
	 *            the factory used to create the solver
	 */
	public PlanModel(Domain domain, Control control, int horizon, SolverFactory factory) {
		control(horizon > 0, () -> "The horizon must be positive");
		this.domain = domain;
		this.control = control;
		this.horizon = horizon;
		this.dtVar = control.problem.dtVar;
		this.solver = factory.create(domain.name + "_" + horizon, control.solving.feasibilityTolerance);
		solver.setRelativeGap(control.solving.gap);
		solver.setVerbose(control.solving.showOutput);
		solver.setTimeLimit(control.solving.timeLimit);

		this.constants = encodeConstants();
		encodeVariables();
		this.closedForms = control.problem.provideSolutions ? Collections.emptyMap() : solveOdes();
		readStatements();
		for (Family family : Family.values())
			encode(family);
		encodeReward();
		Kit.log.config("Encoding over horizon " + horizon + ": " + solver);
	}

	private Map<String, Double> encodeConstants() {
		Map<String, Double> configValues = new LinkedHashMap<>();
		configValues.put("config_epsilon", control.search.epsilon);
		configValues.put("config_gap", control.solving.gap);
		configValues.put("config_bigM", control.search.bigM);
		Map<String, Double> map = domain.constants(configValues);
		map.put(BIG_M, control.search.bigM);
		map.forEach(variables::addConstant);
		return map;
	}

	private void encodeVariables() {
		for (Domain.Declaration declaration : domain.declarations()) {
			Role role = Role.of(declaration.type);
			if (role == null)
				throw new DomainException("Unknown variable type: " + declaration);
			if (role == Role.CONSTANT) {
				if (!constants.containsKey(declaration.name))
					throw new DomainException("No value for the constant " + declaration.name);
				continue;
			}
			ValueType type = ValueType.of(declaration.type);
			if (type == null)
				throw new DomainException("Unknown value type: " + declaration);
			if (variables.contains(declaration.name))
				throw new DomainException(declaration.name + " is declared twice");
			boolean duration = declaration.name.equals(dtVar);
			Double lower = duration ? 0.0 : null, upper = duration ? control.search.bigM : null;
			int last = role.hasTerminalValue() ? horizon : horizon - 1;
			for (int t = 0; t <= last; t++)
				variables.add(solver, declaration.name, role, type, declaration.isGlobal(), t, lower, upper);
		}
		if (!variables.contains(dtVar) || variables.role(dtVar) == Role.CONSTANT)
			throw new DomainException("The duration variable " + dtVar + " must be declared as a variable");
	}

	private Map<String, ClosedForm> solveOdes() {
		List<Node> equations = new ArrayList<>();
		for (String line : domain.required(Domain.ODES))
			equations.add(Parser.parseStatement(line));
		OdeAdapter adapter = new OdeAdapter(variables.names(Role.STATE), constants, dtVar);
		return adapter.solve(equations);
	}

	private void readStatements() {
		for (Family family : Family.values()) {
			List<Node> list = new ArrayList<>();
			if (family == Family.TRANSITIONS && !control.problem.provideSolutions) {
				closedForms.values().forEach(c -> list.add(Node.compare(Operator.EQ, Node.name(c.state + SUCCESSOR_SUFFIX), c.value)));
			} else {
				for (String line : domain.lines(family)) {
					Node node = Parser.parseStatement(line);
					list.add(family == Family.TEMPORAL ? inElapsedTime(node) : node);
				}
			}
			statements.put(family, Collections.unmodifiableList(list));
		}
	}

	/**
	 * Rewrites a temporal constraint in terms of the elapsed time: states are replaced by their closed forms, and dd(x) by the derivative
	 * of x
	 */
	private Node inElapsedTime(Node node) {
		if (closedForms.isEmpty())
			return node;
		return node.replace(n -> {
			if (n.kind == Kind.NAME && closedForms.containsKey(n.name))
				return closedForms.get(n.name).value;
			if (n.kind == Kind.CALL && n.name.equals(OdeAdapter.DERIVATIVE) && !n.arguments().isEmpty() && n.arguments().get(0).kind == Kind.NAME) {
				ClosedForm closedForm = closedForms.get(n.arguments().get(0).name);
				if (closedForm == null)
					throw new ParseException("The derivative of " + n.arguments().get(0).name + " is unknown");
				return closedForm.derivative;
			}
			return null;
		});
	}

	private static List<Integer> steps(Family family, int horizon) {
		switch (family) {
		case INITIALS:
			return List.of(0);
		case GOALS:
			return List.of(horizon - 1);
		default:
			List<Integer> list = new ArrayList<>();
			for (int t = 0; t < horizon; t++)
				list.add(t);
			return list;
		}
	}

	private void encode(Family family) {
		List<Node> list = statements.get(family);
		for (int idx = 0; idx < list.size(); idx++)
			for (int t : steps(family, horizon)) {
				String label = family.section + "_" + idx + "_" + t;
				CompiledExpressions<Constraint> compiled = compile(list.get(idx), label, t, compilerBindings(t, family == Family.GOALS),
						Collections.emptyList());
				auxiliaries.put(family, idx, t, compiled.auxiliaries());
			}
	}

	private CompiledExpressions<Constraint> compile(Node node, String label, int t, Bindings<Term> bindings, List<SolverVariable> reused) {
		CompiledExpressions<Constraint> compiled = Evaluator.compiler(bindings, solver, control.search.bigM).evaluate(node, label, t, reused);
		for (int i = 0; i < compiled.size(); i++)
			post(label + "_" + i, compiled.expressions().get(i));
		return compiled;
	}

	private void post(String name, Constraint constraint) {
		Kit.log.finest("  " + name + ": " + constraint);
		solver.addConstraint(name, constraint);
		nPosted++;
	}

	private void encodeReward() {
		Node reward = Parser.parseStatement(domain.required(Domain.REWARD).stream().findFirst()
				.orElseThrow(() -> new DomainException("The reward of " + domain.name + " is missing")));
		Term sum = Term.constant(0);
		for (int t = 0; t < horizon; t++) {
			Variable objective = Variable.of("Obj", Role.AUXILIARY, t, solver.addVariable("Obj_" + t, ValueType.CONTINUOUS, null, null));
			objectives.add(objective);
			Term value = Evaluator.compiler(compilerBindings(t, false), solver, control.search.bigM).value(reward);
			post("Obj_" + t, Constraint.of(objective.term(), Relation.EQ, value));
			sum = sum.plus(objective.term());
		}
		solver.setObjective(sum, true);
	}

	/**
	 * Returns the terms associated with names at the specified step. States at the next step are referred to with the suffix _dash; for
	 * goals, states refer directly to the next step.
	 */
	public Bindings<Term> compilerBindings(int t, boolean goal) {
		Bindings<Term> bindings = new Bindings<>();
		for (String name : variables.names()) {
			Variable x = variables.get(name, t);
			if (x.role == Role.STATE) {
				Variable next = variables.get(name, t + 1);
				bindings.put(name, goal ? next.term() : x.term());
				if (!goal)
					bindings.put(name + SUCCESSOR_SUFFIX, next.term());
			} else
				bindings.put(name, x.term());
		}
		bindings.put(FEASTOL, Term.constant(solver.feasibilityTolerance()));
		return bindings;
	}

	/**
	 * Compiles again the specified temporal constraint for the specified step, the duration of the step being scaled by the specified
	 * coefficient, and adds the obtained constraints to the model. The auxiliary variables allocated for this constraint and this step are
	 * reused.
	 *
	 * @return the added constraints
	 */
	public CompiledExpressions<Constraint> addTemporalCut(int idx, int step, double coefficient, int iteration) {
		Node node = temporalConstraints().get(idx);
		Bindings<Term> bindings = compilerBindings(step, false);
		bindings.put(dtVar, variables.get(dtVar, step).term().times(coefficient));
		List<SolverVariable> reused = auxiliaries.get(Family.TEMPORAL, idx, step);
		String label = "cut_" + iteration + "_" + Family.TEMPORAL.section + "_" + idx + "_" + step;
		CompiledExpressions<Constraint> compiled = compile(node, label, step, bindings, reused);
		if (reused.isEmpty())
			auxiliaries.put(Family.TEMPORAL, idx, step, compiled.auxiliaries());
		return compiled;
	}

	public List<Node> statements(Family family) {
		return statements.get(family);
	}

	public Map<String, ClosedForm> closedForms() {
		return closedForms;
	}

	public int numberOfPostedConstraints() {
		return nPosted;
	}

	public List<Variable> objectives() {
		return Collections.unmodifiableList(objectives);
	}

	public Variable durationVariable(int step) {
		return variables.get(dtVar, step);
	}

	/**
	 * Returns the value of the specified variable in the current solution
	 */
	public double value(Variable x) {
		return x.isConstant() ? x.value : solver.value(x.handle);
	}

	@Override
	public int horizon() {
		return horizon;
	}

	@Override
	public double duration(int step) {
		return value(durationVariable(step));
	}

	@Override
	public List<Node> temporalConstraints() {
		return statements.get(Family.TEMPORAL);
	}

	@Override
	public Bindings<Double> valuesAt(int step, double elapsed) {
		Bindings<Double> bindings = new Bindings<>();
		for (String name : variables.names()) {
			Variable x = variables.get(name, step);
			bindings.put(name, value(x));
			if (x.role == Role.STATE)
				bindings.put(name + SUCCESSOR_SUFFIX, value(variables.get(name, step + 1)));
		}
		bindings.put(dtVar, elapsed);
		bindings.put(FEASTOL, solver.feasibilityTolerance());
		return bindings;
	}

	@Override
	public double tolerance() {
		return solver.feasibilityTolerance();
	}

	@Override
	public String toString() {
		return "Plan model of " + domain.name + " over horizon " + horizon + " (" + variables.size() + " variables, " + nPosted + " constraints)";
	}
}
