package org.metricshub.exprc.frontend.ast;

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

/**
 * A node of the abstract syntax tree of an arithmetic expression.
 * <p>
 * The set of node kinds is closed: {@link NumberLiteralAst},
 * {@link VariableRefAst}, {@link BinaryOpAst} and {@link UnaryOpAst}.
 * Every node owns its children outright, so a tree never shares a subtree
 * and never contains a cycle. Nodes are immutable once built by the parser.
 * <p>
 * The later phases walk the tree with an {@link AstVisitor}.
 */
public abstract class AstNode {

	private final int height;

	AstNode(int height) {
		this.height = height;
	}

	/**
	 * Number of operator levels between this node and its deepest leaf: 0 for
	 * a leaf, 2 for {@code --x}, 3 for {@code 1+2+3+4}. The recursive phases
	 * go this deep.
	 *
	 * @return height of the subtree rooted at this node
	 */
	public final int getHeight() {
		return height;
	}

	/**
	 * Dispatches this node to the matching method of the visitor.
	 *
	 * @param visitor the visitor to call
	 * @param <T> type of the value computed by the visitor
	 * @return the value returned by the visitor
	 */
	public abstract <T> T accept(AstVisitor<T> visitor);
}
