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
import java.util.Collections;
import java.util.List;

/**
 * Inventory of an expression: how many nodes, which variables, constants and
 * operators it uses, and whether it can be evaluated without runtime input.
 */
public final class SemanticReport {

	/** Whether the expression depends on runtime values. */
	public enum Classification {
		/** References at least one variable. */
		SYMBOLIC("symbolic"),
		/** Only constants: evaluable at compile time. */
		NUMERIC("numeric");

		private final String label;

		Classification(String label) {
			this.label = label;
		}

		public String getLabel() {
			return label;
		}
	}

	private static final String NONE = "(none)";

	private final int nodeCount;
	private final List<String> variables;
	private final List<String> constants;
	private final List<String> operators;

	/**
	 * @param nodeCount total number of nodes in the tree
	 * @param variables distinct variable names, first-seen order
	 * @param constants literal texts in encounter order, duplicates included
	 * @param operators operator symbols in pre-order, {@code "unary -"} for negation
	 */
	public SemanticReport(int nodeCount, List<String> variables, List<String> constants, List<String> operators) {
		this.nodeCount = nodeCount;
		this.variables = Collections.unmodifiableList(new ArrayList<String>(variables));
		this.constants = Collections.unmodifiableList(new ArrayList<String>(constants));
		this.operators = Collections.unmodifiableList(new ArrayList<String>(operators));
	}

	public int getNodeCount() {
		return nodeCount;
	}

	public List<String> getVariables() {
		return variables;
	}

	public List<String> getConstants() {
		return constants;
	}

	public List<String> getOperators() {
		return operators;
	}

	public Classification getClassification() {
		return variables.isEmpty() ? Classification.NUMERIC : Classification.SYMBOLIC;
	}

	/**
	 * Renders the report, one fact per line.
	 *
	 * @return the report text
	 */
	public String toText() {
		StringBuilder sb = new StringBuilder();
		sb.append("Total nodes: ").append(nodeCount).append('\n');
		sb.append("Variables: ").append(join(variables)).append('\n');
		sb.append("Constants: ").append(join(constants)).append('\n');
		sb.append("Operators: ").append(join(operators)).append('\n');
		sb.append("Classification: ").append(getClassification().getLabel()).append('\n');
		if (getClassification() == Classification.SYMBOLIC) {
			sb.append("Warning: runtime values required for unresolved variables: ").append(join(variables));
		} else {
			sb.append("Expression is fully evaluable at compile time");
		}
		return sb.toString();
	}

	private static String join(List<String> items) {
		return items.isEmpty() ? NONE : String.join(", ", items);
	}

	@Override
	public String toString() {
		return toText();
	}
}
