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

import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.AstVisitor;
import org.metricshub.exprc.frontend.ast.BinaryOpAst;
import org.metricshub.exprc.frontend.ast.NumberLiteralAst;
import org.metricshub.exprc.frontend.ast.UnaryOpAst;
import org.metricshub.exprc.frontend.ast.VariableRefAst;

/**
 * Translates a syntax tree into three-address code.
 * <p>
 * Generation is post-order: the operands of a node are generated (left
 * before right) before the node's own instruction, and each operator
 * result goes into a fresh temporary. Leaves produce no instruction; their
 * text is used directly as an operand. For {@code 2+3*4}:
 *
 * <pre>
 * t0 = 3 * 4
 * t1 = 2 + t0
 * result = t1
 * </pre>
 */
public final class TacGenerator {

	private TacGenerator() {}

	/**
	 * @param root root of the syntax tree
	 * @return the generated code, ending with {@code result = ...}
	 */
	public static IntermediateCode generate(AstNode root) {
		if (root == null) {
			throw new IllegalStateException("Cannot generate code without a syntax tree");
		}
		IntermediateCode code = new IntermediateCode();
		TemporaryAllocator temporaries = new TemporaryAllocator();
		String resultRef = root.accept(new Emitter(code, temporaries));
		code.add(TacInstruction.result(resultRef));
		code.setTemporaryCount(temporaries.getCount());
		return code;
	}

	/** Returns the operand reference holding the value of each visited node. */
	private static final class Emitter implements AstVisitor<String> {

		private final IntermediateCode code;
		private final TemporaryAllocator temporaries;

		private Emitter(IntermediateCode code, TemporaryAllocator temporaries) {
			this.code = code;
			this.temporaries = temporaries;
		}

		@Override
		public String visitNumber(NumberLiteralAst number) {
			return number.getText();
		}

		@Override
		public String visitVariable(VariableRefAst variable) {
			return variable.getName();
		}

		@Override
		public String visitBinary(BinaryOpAst binary) {
			String left = binary.getLeft().accept(this);
			String right = binary.getRight().accept(this);
			String target = temporaries.allocate();
			code.add(TacInstruction.binary(target, left, binary.getOperator(), right));
			return target;
		}

		@Override
		public String visitUnary(UnaryOpAst unary) {
			String operand = unary.getOperand().accept(this);
			String target = temporaries.allocate();
			code.add(TacInstruction.negate(target, operand));
			return target;
		}
	}
}
