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
 * Unary minus applied to a single operand.
 */
public final class UnaryOpAst extends AstNode {

	/** The only unary operator of the grammar. */
	public static final String MINUS = "-";

	private final AstNode operand;

	public UnaryOpAst(AstNode operand) {
		super(1 + Objects.requireNonNull(operand, "operand").getHeight());
		this.operand = operand;
	}

	public String getOperator() {
		return MINUS;
	}

	public AstNode getOperand() {
		return operand;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitUnary(this);
	}

	@Override
	public String toString() {
		return "UnaryOp(-, " + operand + ")";
	}
}
