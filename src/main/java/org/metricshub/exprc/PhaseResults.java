package org.metricshub.exprc;

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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The text produced by every phase of one successful compilation.
 */
public final class PhaseResults {

	private final Map<Phase, String> texts;

	PhaseResults(String tokens, String syntaxTree, String semantic, String intermediate, String finalCode) {
		Map<Phase, String> map = new EnumMap<Phase, String>(Phase.class);
		map.put(Phase.TOKENS, tokens);
		map.put(Phase.SYNTAX_TREE, syntaxTree);
		map.put(Phase.SEMANTIC, semantic);
		map.put(Phase.INTERMEDIATE, intermediate);
		map.put(Phase.FINAL, finalCode);
		this.texts = Collections.unmodifiableMap(map);
	}

	/**
	 * Returns the output of a phase, or the phase fallback text when the
	 * output is empty.
	 *
	 * @param phase the phase
	 * @return the text of the phase, never empty
	 */
	public String get(Phase phase) {
		String text = texts.get(phase);
		return text == null || text.isEmpty() ? phase.getFallback() : text;
	}

	public String getTokens() {
		return get(Phase.TOKENS);
	}

	public String getSyntaxTree() {
		return get(Phase.SYNTAX_TREE);
	}

	public String getSemantic() {
		return get(Phase.SEMANTIC);
	}

	public String getIntermediate() {
		return get(Phase.INTERMEDIATE);
	}

	public String getFinalCode() {
		return get(Phase.FINAL);
	}

	/**
	 * Maps each phase key ({@code tokens}, {@code syntaxTree}, {@code semantic},
	 * {@code intermediate}, {@code final}) to its text, in pipeline order.
	 *
	 * @return a new map, free to be modified by the caller
	 */
	public Map<String, String> toMap() {
		Map<String, String> map = new LinkedHashMap<String, String>();
		for (Phase phase : Phase.values()) {
			map.put(phase.getKey(), get(phase));
		}
		return map;
	}

	/**
	 * Prints the selected phases, each under a {@code == Title ==} heading and
	 * followed by a blank line.
	 *
	 * @param ps destination stream
	 * @param phases phases to print
	 */
	public void render(PrintStream ps, Set<Phase> phases) {
		for (Phase phase : Phase.values()) {
			if (phases.contains(phase)) {
				ps.println("== " + phase.getTitle() + " ==");
				ps.println(get(phase));
				ps.println();
			}
		}
	}

	@Override
	public String toString() {
		return toMap().toString();
	}
}
