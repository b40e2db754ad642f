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

import java.util.List;
import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.BinaryOpAst;
import org.metricshub.exprc.frontend.ast.NumberLiteralAst;
import org.metricshub.exprc.frontend.ast.ParserException;
import org.metricshub.exprc.frontend.ast.UnaryOpAst;
import org.metricshub.exprc.frontend.ast.VariableRefAst;

/**
 * Recursive descent parser for arithmetic expressions.
 * <p>
 * Each grammar rule is one method, named after the rule:
 *
 * <pre>
 * EXPRESSION : TERM [ (+|-) TERM ]*
 * TERM       : FACTOR [ (*|/) FACTOR ]*
 * FACTOR     : NUMBER | IDENTIFIER | '(' EXPRESSION ')' | '-' FACTOR
 * </pre>
 *
 * Binary operators are left-associative. Unary minus binds tighter than
 * any binary operator and may be repeated ({@code --x}).
 * <p>
 * The nesting limit bounds both the parentheses and the height of the tree
 * produced, so the phases walking the tree recursively never go deeper than
 * the limit.
 * <p>
 * An instance holds the cursor of one parse and must not be reused.
 */
public final class ExprParser {

	/** Nesting depth accepted when none is configured. */
	public static final int DEFAULT_MAX_DEPTH = 500;

	private final List<Token> tokens;
	private final int maxDepth;
	private int pos;
	private int depth;

	/**
	 * @param tokens tokens produced by {@link ExprLexer}
	 * @param maxDepth maximum nesting of parentheses and unary operators
	 */
	public ExprParser(List<Token> tokens, int maxDepth) {
		this.tokens = tokens;
		this.maxDepth = maxDepth;
	}

	/**
	 * Parses a complete token sequence with the default nesting limit.
	 *
	 * @param tokens tokens produced by {@link ExprLexer}
	 * @return root of the syntax tree
	 * @throws ParserException if the tokens do not form exactly one expression
	 */
	public static AstNode parse(List<Token> tokens) throws ParserException {
		return new ExprParser(tokens, DEFAULT_MAX_DEPTH).parse();
	}

	/**
	 * Parses the whole token sequence. Tokens left over after a complete
	 * expression are an error, so {@code 2 3} is rejected instead of being
	 * silently read as {@code 2}.
	 *
	 * @return root of the syntax tree
	 * @throws ParserException if the tokens do not form exactly one expression
	 */
	public AstNode parse() throws ParserException {
		AstNode root = EXPRESSION();
		if (pos != tokens.size()) {
			throw new ParserException("Extra tokens after expression");
		}
		return root;
	}

	// EXPRESSION : TERM [ (+|-) TERM ]*
	AstNode EXPRESSION() throws ParserException {
		AstNode term = TERM();
		while (peekOperator("+") || peekOperator("-")) {
			String op = lexer().getText();
			AstNode nextTerm = TERM();

			// Build the tree in left-associative manner
			term = checkHeight(new BinaryOpAst(op, term, nextTerm));
		}
		return term;
	}

	// TERM : FACTOR [ (*|/) FACTOR ]*
	AstNode TERM() throws ParserException {
		AstNode factor = FACTOR();
		while (peekOperator("*") || peekOperator("/")) {
			String op = lexer().getText();
			AstNode nextFactor = FACTOR();

			// Build the tree in left-associative manner
			factor = checkHeight(new BinaryOpAst(op, factor, nextFactor));
		}
		return factor;
	}

	// FACTOR : NUMBER | IDENTIFIER | '(' EXPRESSION ')' | '-' FACTOR
	AstNode FACTOR() throws ParserException {
		Token token = peek();
		if (token == null) {
			throw new ParserException("Unexpected end of input");
		}
		if (token.getKind() == TokenKind.NUMBER) {
			lexer();
			return new NumberLiteralAst(token.getText());
		}
		if (token.getKind() == TokenKind.IDENTIFIER) {
			lexer();
			return new VariableRefAst(token.getText());
		}
		if (token.isOperator("(")) {
			lexer();
			enter();
			AstNode expression = EXPRESSION();
			leave();
			lexer(")");
			return expression;
		}
		if (token.isOperator("-")) {
			lexer();
			enter();
			AstNode operand = FACTOR();
			leave();
			return checkHeight(new UnaryOpAst(operand));
		}
		throw new ParserException("Unexpected token: " + token.getKind().getLabel() + " '" + token.getText() + "'");
	}

	// SUPPORTING FUNCTIONS/METHODS
	private Token peek() {
		return pos < tokens.size() ? tokens.get(pos) : null;
	}

	private boolean peekOperator(String operator) {
		Token token = peek();
		return token != null && token.isOperator(operator);
	}

	private Token lexer() {
		return tokens.get(pos++);
	}

	private Token lexer(String expectedOperator) throws ParserException {
		Token token = peek();
		if (token == null || !token.isOperator(expectedOperator)) {
			throw new ParserException(
					"Expected " + TokenKind.OPERATOR.getLabel() + " '" + expectedOperator + "' but got "
							+ (token == null ? "EOF" : token.getKind().getLabel()));
		}
		return lexer();
	}

	// parentheses nest the parser's own recursion without growing the tree
	private void enter() throws ParserException {
		if (++depth > maxDepth) {
			throw tooDeep();
		}
	}

	// a flat chain such as 1+1+...+1 builds a tree as tall as the chain is long
	private AstNode checkHeight(AstNode node) throws ParserException {
		if (node.getHeight() > maxDepth) {
			throw tooDeep();
		}
		return node;
	}

	private ParserException tooDeep() {
		return new ParserException("Expression nesting too deep (limit " + maxDepth + ")");
	}

	private void leave() {
		depth--;
	}
}
