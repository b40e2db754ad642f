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

import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.AstVisitor;
import org.metricshub.exprc.frontend.ast.BinaryOpAst;
import org.metricshub.exprc.frontend.ast.NumberLiteralAst;
import org.metricshub.exprc.frontend.ast.UnaryOpAst;
import org.metricshub.exprc.frontend.ast.VariableRefAst;

/**
 * Renders a syntax tree as indented text, one node per line.
 * <p>
 * Operators come before their operands, left operand first:
 *
 * <pre>
 * +
 *   2
 *   *
 *     3
 *     4
 * </pre>
 */
public final class SyntaxTreePrinter {

	/** Indentation used when none is configured. */
	public static final int DEFAULT_INDENT = 2;

	private final int indent;

	public SyntaxTreePrinter() {
		this(DEFAULT_INDENT);
	}

	/**
	 * @param indent number of spaces per depth level
	 */
	public SyntaxTreePrinter(int indent) {
		this.indent = indent;
	}

	/**
	 * Dumps the tree. Every line, including the last one, ends with a newline.
	 *
	 * @param root root of the tree, may be {@code null}
	 * @return the text of the tree, or an empty string for a {@code null} tree
	 */
	public String print(AstNode root) {
		if (root == null) {
			return "";
		}
		StringBuilder out = new StringBuilder();
		root.accept(new Dumper(out, 0));
		return out.toString();
	}

	private final class Dumper implements AstVisitor<Void> {

		private final StringBuilder out;
		private final int lvl;

		private Dumper(StringBuilder out, int lvl) {
			this.out = out;
			this.lvl = lvl;
		}

		private void line(String text) {
			for (int i = 0; i < lvl * indent; i++) {
				out.append(' ');
			}
			out.append(text).append('\n');
		}

		private Dumper child() {
			return new Dumper(out, lvl + 1);
		}

		@Override
		public Void visitNumber(NumberLiteralAst number) {
			line(number.getText());
			return null;
		}

		@Override
		public Void visitVariable(VariableRefAst variable) {
			line(variable.getName());
			return null;
		}

		@Override
		public Void visitBinary(BinaryOpAst binary) {
			line(binary.getOperator());
			binary.getLeft().accept(child());
			binary.getRight().accept(child());
			return null;
		}

		@Override
		public Void visitUnary(UnaryOpAst unary) {
			line(unary.getOperator() + " (unary)");
			unary.getOperand().accept(child());
			return null;
		}
	}
}
