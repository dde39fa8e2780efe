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
import java.util.List;

import expressions.Lexer.Token;
import expressions.Lexer.Type;

/**
 * A recursive descent parser for the expression language used in domain files. The grammar follows the usual precedence of arithmetic
 * and boolean operators (from the loosest to the tightest):
 *
 * <pre>
 * statement   := disjunction [ 'if' disjunction 'else' statement ]
 * disjunction := conjunction ( 'or' conjunction )*
 * conjunction := negation ( 'and' negation )*
 * negation    := 'not' negation | comparison
 * comparison  := sum [ compOp sum ]
 * sum         := product ( ('+' | '-') product )*
 * product     := factor ( ('*' | '/') factor )*
 * factor      := ('+' | '-') factor | power
 * power       := primary [ '**' factor ]
 * primary     := NUMBER | NAME [ '(' args ')' ] | '(' statement ')' , followed by ( '.' NAME '(' args ')' )*
 * </pre>
 *
 * Only one comparison operator is allowed per comparison (no chains such as a &lt; b &lt; c).
 */
public final class Parser {

	/**
	 * Parses a text containing one or several statements (separated by newlines or semicolons)
	 *
	 * @param text
	 *            the text to be parsed
	 * @return the list of parsed statements, in the order of the text
	 */
	public static List<Node> parse(String text) {
		return new Parser(text).statements();
	}

	/**
	 * Parses a text containing exactly one statement
	 */
	public static Node parseStatement(String text) {
		List<Node> list = parse(text);
		if (list.size() != 1)
			throw new ParseException("Exactly one statement expected, found " + list.size() + " in: " + text);
		return list.get(0);
	}

	private final String text;

	private final List<Token> tokens;

	private int pos;

	private Parser(String text) {
		this.text = text;
		this.tokens = new Lexer(text).tokenize();
	}

	private Token peek() {
		return tokens.get(pos);
	}

	private Token next() {
		return tokens.get(pos++);
	}

	private boolean isKeyword(String keyword) {
		return peek().is(Type.NAME, keyword);
	}

	private boolean isOperator(String symbol) {
		return peek().is(Type.OPERATOR, symbol);
	}

	private Token expect(Type type, String what) {
		Token token = next();
		if (token.type != type)
			throw new ParseException("Expected " + what + " but found " + token, text, token.position);
		return token;
	}

	private List<Node> statements() {
		List<Node> list = new ArrayList<>();
		while (peek().type != Type.END) {
			if (peek().type == Type.NEWLINE) {
				next();
				continue;
			}
			list.add(statement());
			Token token = peek();
			if (token.type != Type.NEWLINE && token.type != Type.END)
				throw new ParseException("Unexpected " + token, text, token.position);
		}
		return list;
	}

	private Node statement() {
		Node body = disjunction();
		if (isKeyword("if")) {
			next();
			Node test = disjunction();
			if (!isKeyword("else"))
				throw new ParseException("Expected 'else'", text, peek().position);
			next();
			return Node.conditional(body, test, statement());
		}
		return body;
	}

	private Node disjunction() {
		Node first = conjunction();
		if (!isKeyword("or"))
			return first;
		List<Node> operands = new ArrayList<>(List.of(first));
		while (isKeyword("or")) {
			next();
			operands.add(conjunction());
		}
		return Node.or(operands);
	}

	private Node conjunction() {
		Node first = negation();
		if (!isKeyword("and"))
			return first;
		List<Node> operands = new ArrayList<>(List.of(first));
		while (isKeyword("and")) {
			next();
			operands.add(negation());
		}
		return Node.and(operands);
	}

	private Node negation() {
		if (isKeyword("not")) {
			next();
			return Node.unary(Operator.NOT, negation());
		}
		return comparison();
	}

	private Node comparison() {
		Node left = sum();
		Operator op = peek().type == Type.OPERATOR ? Operator.comparison(peek().text) : null;
		if (op == null)
			return left;
		next();
		Node node = Node.compare(op, left, sum());
		if (peek().type == Type.OPERATOR && Operator.comparison(peek().text) != null)
			throw new ParseException("Too many comparison operators, please don't use more than 1 per comparison", text, peek().position);
		return node;
	}

	private Node sum() {
		Node node = product();
		while (isOperator("+") || isOperator("-")) {
			Operator op = next().text.equals("+") ? Operator.ADD : Operator.SUB;
			node = Node.binary(op, node, product());
		}
		return node;
	}

	private Node product() {
		Node node = factor();
		while (isOperator("*") || isOperator("/")) {
			Operator op = next().text.equals("*") ? Operator.MUL : Operator.DIV;
			node = Node.binary(op, node, factor());
		}
		return node;
	}

	private Node factor() {
		if (isOperator("+") || isOperator("-")) {
			Operator op = next().text.equals("+") ? Operator.PLUS : Operator.MINUS;
			return Node.unary(op, factor());
		}
		return power();
	}

	private Node power() {
		Node base = primary();
		if (isOperator("**")) {
			next();
			return Node.binary(Operator.POW, base, factor()); // right associative, and -x**2 is -(x**2)
		}
		return base;
	}

	private Node primary() {
		Token token = next();
		Node node;
		switch (token.type) {
		case NUMBER:
			try {
				node = Node.number(Double.parseDouble(token.text));
			} catch (NumberFormatException e) {
				throw new ParseException("Bad number " + token, text, token.position);
			}
			break;
		case NAME:
			if (isReserved(token.text))
				throw new ParseException("Unexpected keyword " + token, text, token.position);
			node = peek().type == Type.LPAREN ? Node.call(token.text, arguments()) : Node.name(token.text);
			break;
		case LPAREN:
			node = statement();
			expect(Type.RPAREN, "')'");
			break;
		default:
			throw new ParseException("Unexpected " + token, text, token.position);
		}
		while (peek().type == Type.DOT) {
			next();
			Token method = expect(Type.NAME, "a name");
			if (peek().type != Type.LPAREN)
				throw new ParseException("Attribute access is not supported", text, method.position);
			node = Node.attributeCall(node, method.text, arguments());
		}
		return node;
	}

	private List<Node> arguments() {
		expect(Type.LPAREN, "'('");
		List<Node> list = new ArrayList<>();
		if (peek().type == Type.RPAREN) {
			next();
			return list;
		}
		list.add(statement());
		while (peek().type == Type.COMMA) {
			next();
			list.add(statement());
		}
		expect(Type.RPAREN, "')'");
		return list;
	}

	private static boolean isReserved(String s) {
		return s.equals("and") || s.equals("or") || s.equals("not") || s.equals("if") || s.equals("else");
	}
}
