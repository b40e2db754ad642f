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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of {@link TacInstruction}s for one expression. The last
 * instruction is always the {@code result = ...} copy.
 */
public final class IntermediateCode {

	private final List<TacInstruction> queue = new ArrayList<TacInstruction>();
	private int temporaryCount;

	void add(TacInstruction instruction) {
		queue.add(instruction);
	}

	void setTemporaryCount(int temporaryCount) {
		this.temporaryCount = temporaryCount;
	}

	/**
	 * @return the instructions, in execution order
	 */
	public List<TacInstruction> getInstructions() {
		return Collections.unmodifiableList(queue);
	}

	/**
	 * @return number of temporaries allocated while generating this code
	 */
	public int getTemporaryCount() {
		return temporaryCount;
	}

	/**
	 * @return the text of every instruction, in execution order
	 */
	public List<String> lines() {
		List<String> lines = new ArrayList<String>(queue.size());
		for (TacInstruction instruction : queue) {
			lines.add(instruction.toString());
		}
		return lines;
	}

	public int size() {
		return queue.size();
	}

	/**
	 * Prints the instructions with their index, for diagnostics.
	 *
	 * @param ps destination stream
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < queue.size(); i++) {
			ps.println(i + " : " + queue.get(i));
		}
	}

	@Override
	public String toString() {
		return String.join("\n", lines());
	}
}
