package org.metricshub.exprc.intermediate;

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
 * One three-address instruction: a single operator at most, assigning to a
 * named target.
 * <p>
 * Three shapes exist:
 * <ul>
 * <li>{@code target = left op right}
 * <li>{@code target = -operand}
 * <li>{@code result = operand}
 * </ul>
 *
 * @see IntermediateCode
 */
public final class TacInstruction {

	/** Target of the final copy instruction. */
	public static final String RESULT = "result";

	private final String target;
	private final String left;
	private final String operator;
	private final String right;

	private TacInstruction(String target, String left, String operator, String right) {
		this.target = target;
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	static TacInstruction binary(String target, String left, String operator, String right) {
		return new TacInstruction(target, left, operator, right);
	}

	static TacInstruction negate(String target, String operand) {
		return new TacInstruction(target, null, "-", operand);
	}

	static TacInstruction result(String operand) {
		return new TacInstruction(RESULT, null, null, operand);
	}

	public String getTarget() {
		return target;
	}

	/**
	 * @return the operator, or {@code null} for the final copy
	 */
	public String getOperator() {
		return operator;
	}

	/**
	 * @return the right-hand side as written after {@code " = "}
	 */
	public String getExpression() {
		if (operator == null) {
			return right;
		}
		if (left == null) {
			return operator + right;
		}
		return left + " " + operator + " " + right;
	}

	@Override
	public String toString() {
		return target + " = " + getExpression();
	}
}
