package org.metricshub.exprc.backend;

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
import java.util.List;

/**
 * Turns three-address code into pseudo-assembly: every
 * {@code target = expr} line becomes {@code MOV target, expr}.
 */
public final class FinalCodeEmitter {

	/** Output when the expression is a single literal or variable. */
	public static final String SINGLE_VALUE = "(single value - no operations)";

	private static final String ASSIGN = " = ";

	private FinalCodeEmitter() {}

	/**
	 * @param tacLines three-address code, as produced by
	 *        {@link org.metricshub.exprc.intermediate.IntermediateCode#lines()}
	 * @return the {@code MOV} lines joined by newlines, or {@link #SINGLE_VALUE}
	 *         when the code performs no operation
	 */
	public static String emit(List<String> tacLines) {
		// only the final copy: nothing was computed
		if (tacLines.size() <= 1) {
			return SINGLE_VALUE;
		}
		List<String> lines = new ArrayList<String>(tacLines.size());
		for (String line : tacLines) {
			int idx = line.indexOf(ASSIGN);
			if (idx < 0) {
				continue;
			}
			String target = line.substring(0, idx).trim();
			String expr = line.substring(idx + ASSIGN.length()).trim();
			lines.add("MOV " + target + ", " + expr);
		}
		return lines.isEmpty() ? SINGLE_VALUE : String.join("\n", lines);
	}
}
