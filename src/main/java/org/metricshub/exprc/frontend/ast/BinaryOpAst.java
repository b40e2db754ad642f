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

import java.util.Objects;

/**
 * Binary arithmetic operation: one of {@code + - * /} applied to
 * two operands.
 */
public final class BinaryOpAst extends AstNode {

	private final String operator;
	private final AstNode left;
	private final AstNode right;

	/**
	 * @param operator one of {@code + - * /}
	 * @param left left operand, never {@code null}
	 * @param right right operand, never {@code null}
	 */
	public BinaryOpAst(String operator, AstNode left, AstNode right) {
		super(1 + Math.max(
				Objects.requireNonNull(left, "left").getHeight(),
				Objects.requireNonNull(right, "right").getHeight()));
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getOperator() {
		return operator;
	}

	public AstNode getLeft() {
		return left;
	}

	public AstNode getRight() {
		return right;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitBinary(this);
	}

	@Override
	public String toString() {
		return "BinaryOp(" + operator + ", " + left + ", " + right + ")";
	}
}
