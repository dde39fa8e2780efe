/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An immutable node of an expression tree. The kind of the node tells which fields are meaningful:
 * <ul>
 * <li>NUMBER: value</li>
 * <li>NAME: name</li>
 * <li>UNARY: operator and one child</li>
 * <li>BINARY, COMPARE: operator and two children (left and right)</li>
 * <li>AND, OR: at least two children</li>
 * <li>CALL: name of the function and the arguments as children</li>
 * <li>ATTRIBUTE_CALL: name of the method, the target as first child, then the arguments</li>
 * <li>CONDITIONAL: body, test and alternative as children</li>
 * </ul>
 * Trees are never modified: values are injected at evaluation time through bindings, and substitutions build new trees.
 */
public final class Node {

	public final Kind kind;

	public final Operator operator;

	public final double value;

	public final String name;

	private final List<Node> children;

	private Node(Kind kind, Operator operator, double value, String name, List<Node> children) {
		this.kind = kind;
		this.operator = operator;
		this.value = value;
		this.name = name;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public static Node number(double value) {
		return new Node(Kind.NUMBER, null, value, null, List.of());
	}

	public static Node name(String name) {
		return new Node(Kind.NAME, null, 0, Objects.requireNonNull(name), List.of());
	}

	public static Node unary(Operator op, Node operand) {
		if (op != Operator.PLUS && op != Operator.MINUS && op != Operator.NOT)
			throw new IllegalArgumentException(op + " is not a unary operator");
		return new Node(Kind.UNARY, op, 0, null, List.of(operand));
	}

	public static Node binary(Operator op, Node left, Node right) {
		if (op.isComparison() || op == Operator.PLUS || op == Operator.MINUS || op == Operator.NOT)
			throw new IllegalArgumentException(op + " is not a binary arithmetic operator");
		return new Node(Kind.BINARY, op, 0, null, List.of(left, right));
	}

	public static Node compare(Operator op, Node left, Node right) {
		if (!op.isComparison())
			throw new IllegalArgumentException(op + " is not a comparison operator");
		return new Node(Kind.COMPARE, op, 0, null, List.of(left, right));
	}

	public static Node and(List<Node> operands) {
		return new Node(Kind.AND, null, 0, null, operands);
	}

	public static Node or(List<Node> operands) {
		return new Node(Kind.OR, null, 0, null, operands);
	}

	public static Node call(String function, List<Node> arguments) {
		return new Node(Kind.CALL, null, 0, function, arguments);
	}

	public static Node attributeCall(Node target, String method, List<Node> arguments) {
		List<Node> list = new ArrayList<>();
		list.add(target);
		list.addAll(arguments);
		return new Node(Kind.ATTRIBUTE_CALL, null, 0, method, list);
	}

	public static Node conditional(Node body, Node test, Node alternative) {
		return new Node(Kind.CONDITIONAL, null, 0, null, List.of(body, test, alternative));
	}

	public List<Node> children() {
		return children;
	}

	public Node left() {
		return children.get(0);
	}

	public Node right() {
		return children.get(1);
	}

	public Node operand() {
		return children.get(0);
	}

	/**
	 * Returns the arguments of a call (the target of an attribute call is not included)
	 */
	public List<Node> arguments() {
		return kind == Kind.ATTRIBUTE_CALL ? children.subList(1, children.size()) : children;
	}

	public boolean isNumber() {
		return kind == Kind.NUMBER;
	}

	public boolean isNumber(double v) {
		return kind == Kind.NUMBER && value == v;
	}

	public boolean isName(String s) {
		return kind == Kind.NAME && name.equals(s);
	}

	/**
	 * Returns the set of names (variables, constants) referenced in this tree, function names excluded
	 */
	public Set<String> names() {
		Set<String> set = new LinkedHashSet<>();
		collectNames(set);
		return set;
	}

	private void collectNames(Set<String> set) {
		if (kind == Kind.NAME)
			set.add(name);
		for (Node child : children)
			child.collectNames(set);
	}

	public boolean references(String s) {
		if (kind == Kind.NAME)
			return name.equals(s);
		for (Node child : children)
			if (child.references(s))
				return true;
		return false;
	}

	/**
	 * Builds a new tree by visiting this tree top-down: whenever the replacer returns a non-null node for a visited node, this node (and
	 * its subtree) is replaced, otherwise children are visited.
	 *
	 * @param replacer
	 *            the function giving replacement nodes (or null)
	 * @return a new tree, or this tree if nothing was replaced
	 */
	public Node replace(Function<Node, Node> replacer) {
		Node replacement = replacer.apply(this);
		if (replacement != null)
			return replacement;
		if (children.isEmpty())
			return this;
		List<Node> list = new ArrayList<>(children.size());
		boolean changed = false;
		for (Node child : children) {
			Node c = child.replace(replacer);
			changed |= c != child;
			list.add(c);
		}
		return changed ? new Node(kind, operator, value, name, list) : this;
	}

	/**
	 * Returns a new tree where names are replaced by the trees given in the specified map
	 */
	public Node substitute(Map<String, Node> substitutions) {
		return replace(node -> node.kind == Kind.NAME ? substitutions.get(node.name) : null);
	}

	private String wrapped() {
		boolean atomic = kind == Kind.NUMBER && value >= 0 || kind == Kind.NAME || kind == Kind.CALL || kind == Kind.ATTRIBUTE_CALL;
		return atomic ? toString() : "(" + this + ")";
	}

	/**
	 * Operands of a comparison need no parentheses unless they are themselves boolean or conditional
	 */
	private String comparand() {
		boolean arithmetic = kind == Kind.BINARY || kind == Kind.UNARY && operator != Operator.NOT || kind == Kind.NUMBER || kind == Kind.NAME
				|| kind == Kind.CALL || kind == Kind.ATTRIBUTE_CALL;
		return arithmetic ? toString() : "(" + this + ")";
	}

	private static String format(double v) {
		return v == Math.rint(v) && Math.abs(v) < 1e15 ? String.valueOf((long) v) + ".0" : String.valueOf(v);
	}

	@Override
	public String toString() {
		switch (kind) {
		case NUMBER:
			return format(value);
		case NAME:
			return name;
		case UNARY:
			return (operator == Operator.NOT ? "not " : operator.symbol) + operand().wrapped();
		case BINARY:
			return left().wrapped() + " " + operator.symbol + " " + right().wrapped();
		case COMPARE:
			return left().comparand() + " " + operator.symbol + " " + right().comparand();
		case AND:
			return children.stream().map(c -> c.kind == Kind.COMPARE ? c.toString() : c.wrapped()).collect(Collectors.joining(" and "));
		case OR:
			return children.stream().map(c -> c.kind == Kind.COMPARE ? c.toString() : c.wrapped()).collect(Collectors.joining(" or "));
		case CALL:
			return name + "(" + children.stream().map(Node::toString).collect(Collectors.joining(", ")) + ")";
		case ATTRIBUTE_CALL:
			return left().wrapped() + "." + name + "(" + arguments().stream().map(Node::toString).collect(Collectors.joining(", ")) + ")";
		case CONDITIONAL:
			return children.get(0).wrapped() + " if " + children.get(1).wrapped() + " else " + children.get(2).wrapped();
		default:
			throw new AssertionError();
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Node))
			return false;
		Node other = (Node) obj;
		return kind == other.kind && operator == other.operator && Double.compare(value, other.value) == 0 && Objects.equals(name, other.name)
				&& children.equals(other.children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, operator, value, name, children);
	}
}
