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

/**
 * Splits a text of the expression language into tokens. Newlines separate statements, except inside parentheses.
 */
final class Lexer {

	enum Type {
		NUMBER, NAME, OPERATOR, LPAREN, RPAREN, COMMA, DOT, NEWLINE, END;
	}

	static final class Token {
		final Type type;
		final String text;
		final int position;

		Token(Type type, String text, int position) {
			this.type = type;
			this.text = text;
			this.position = position;
		}

		boolean is(Type t, String s) {
			return type == t && text.equals(s);
		}

		@Override
		public String toString() {
			return type == Type.END ? "end of text" : type == Type.NEWLINE ? "end of line" : "'" + text + "'";
		}
	}

	private static final String[] OPERATORS = { "**", "<=", ">=", "==", "!=", "+", "-", "*", "/", "<", ">" };

	private final String text;

	private int pos;

	private int depth;

	Lexer(String text) {
		this.text = text;
	}

	List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '#') { // comment until the end of the line
				while (pos < text.length() && text.charAt(pos) != '\n')
					pos++;
			} else if (c == '\n' || c == ';') {
				if (depth == 0)
					tokens.add(new Token(Type.NEWLINE, String.valueOf(c), pos));
				pos++;
			} else if (Character.isWhitespace(c))
				pos++;
			else if (Character.isDigit(c) || c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))
				tokens.add(number());
			else if (Character.isLetter(c) || c == '_')
				tokens.add(name());
			else if (c == '(') {
				depth++;
				tokens.add(new Token(Type.LPAREN, "(", pos++));
			} else if (c == ')') {
				depth--;
				tokens.add(new Token(Type.RPAREN, ")", pos++));
			} else if (c == ',')
				tokens.add(new Token(Type.COMMA, ",", pos++));
			else if (c == '.')
				tokens.add(new Token(Type.DOT, ".", pos++));
			else
				tokens.add(operator());
		}
		tokens.add(new Token(Type.END, "", pos));
		return tokens;
	}

	private Token number() {
		int start = pos;
		while (pos < text.length() && Character.isDigit(text.charAt(pos)))
			pos++;
		if (pos < text.length() && text.charAt(pos) == '.') {
			pos++;
			while (pos < text.length() && Character.isDigit(text.charAt(pos)))
				pos++;
		}
		if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
			int mark = pos++;
			if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-'))
				pos++;
			if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
				while (pos < text.length() && Character.isDigit(text.charAt(pos)))
					pos++;
			} else
				pos = mark; // not an exponent, as in 2e
		}
		return new Token(Type.NUMBER, text.substring(start, pos), start);
	}

	private Token name() {
		int start = pos;
		while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
			pos++;
		return new Token(Type.NAME, text.substring(start, pos), start);
	}

	private Token operator() {
		for (String op : OPERATORS)
			if (text.startsWith(op, pos)) {
				Token token = new Token(Type.OPERATOR, op, pos);
				pos += op.length();
				return token;
			}
		if (text.charAt(pos) == '=')
			throw new ParseException("Assignments are not allowed, use == for equality", text, pos);
		throw new ParseException("Unexpected character '" + text.charAt(pos) + "'", text, pos);
	}
}
