package org.metricshub.exprc.semantic;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.AstVisitor;
import org.metricshub.exprc.frontend.ast.BinaryOpAst;
import org.metricshub.exprc.frontend.ast.NumberLiteralAst;
import org.metricshub.exprc.frontend.ast.UnaryOpAst;
import org.metricshub.exprc.frontend.ast.VariableRefAst;

/**
 * Semantic pass over a parsed expression.
 * <p>
 * The grammar leaves no operator or arity error to detect, so the pass only
 * describes the tree: it walks it in pre-order and produces a
 * {@link SemanticReport}. Nothing is evaluated.
 */
public final class SemanticAnalyzer {

	private SemanticAnalyzer() {}

	/**
	 * @param root root of the syntax tree
	 * @return the report describing the tree
	 */
	public static SemanticReport analyze(AstNode root) {
		Inventory inventory = new Inventory();
		root.accept(inventory);
		return new SemanticReport(
				inventory.nodeCount,
				new ArrayList<String>(inventory.variables),
				inventory.constants,
				inventory.operators);
	}

	/** Accumulators of a single analysis. */
	private static final class Inventory implements AstVisitor<Void> {

		private int nodeCount;
		private final Set<String> variables = new LinkedHashSet<String>();
		private final List<String> constants = new ArrayList<String>();
		private final List<String> operators = new ArrayList<String>();

		@Override
		public Void visitNumber(NumberLiteralAst number) {
			nodeCount++;
			constants.add(number.getText());
			return null;
		}

		@Override
		public Void visitVariable(VariableRefAst variable) {
			nodeCount++;
			variables.add(variable.getName());
			return null;
		}

		@Override
		public Void visitBinary(BinaryOpAst binary) {
			nodeCount++;
			operators.add(binary.getOperator());
			binary.getLeft().accept(this);
			binary.getRight().accept(this);
			return null;
		}

		@Override
		public Void visitUnary(UnaryOpAst unary) {
			nodeCount++;
			operators.add("unary " + unary.getOperator());
			unary.getOperand().accept(this);
			return null;
		}
	}
}
