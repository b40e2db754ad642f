package org.metricshub.exprc.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Exprc
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.exprc.frontend.ast.LexerException;

/**
 * Splits the text of an arithmetic expression into {@link Token}s.
 * <p>
 * The scan is a single left-to-right pass over the input. It stops on the
 * first character that cannot start or continue a token; there is no
 * attempt to recover and report more problems.
 * <p>
 * An instance holds the cursor of one scan and must not be reused. Use
 * {@link #tokenize(String)}.
 */
public final class ExprLexer {

	private static final String OPERATORS = "+-*/()";

	private final String input;
	private int pos;
	private final StringBuilder text = new StringBuilder();

	private ExprLexer(String input) {
		this.input = input;
	}

	/**
	 * Tokenizes the specified expression.
	 *
	 * @param input text of the expression
	 * @return the tokens, in source order
	 * @throws LexerException on an invalid character or a malformed number
	 */
	public static List<Token> tokenize(String input) throws LexerException {
		return new ExprLexer(input).scan();
	}

	private List<Token> scan() throws LexerException {
		List<Token> tokens = new ArrayList<Token>();
		while (pos < input.length()) {
			skipWhitespaces();
			if (pos >= input.length()) {
				break;
			}
			tokens.add(nextToken());
		}
		return Collections.unmodifiableList(tokens);
	}

	private void skipWhitespaces() {
		while (pos < input.length() && isBlank(input.charAt(pos))) {
			pos++;
		}
	}

	private Token nextToken() throws LexerException {
		char c = input.charAt(pos);
		text.setLength(0);

		if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
			int dots = 0;
			while (pos < input.length() && (isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
				if (input.charAt(pos) == '.') {
					dots++;
				}
				read();
			}
			if (dots > 1) {
				throw new LexerException("Invalid number format: multiple dots");
			}
			return new Token(TokenKind.NUMBER, text.toString());
		}

		if (isLetter(c)) {
			while (pos < input.length() && (isLetter(input.charAt(pos)) || isDigit(input.charAt(pos)))) {
				read();
			}
			return new Token(TokenKind.IDENTIFIER, text.toString());
		}

		if (OPERATORS.indexOf(c) >= 0) {
			read();
			return new Token(TokenKind.OPERATOR, text.toString());
		}

		throw new LexerException("Invalid character: '" + c + "' at position " + (pos + 1), pos + 1);
	}

	private void read() {
		text.append(input.charAt(pos++));
	}

	private static boolean isBlank(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	// ASCII only: letters beyond a-z/A-Z and non-Latin digits are invalid characters
	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
