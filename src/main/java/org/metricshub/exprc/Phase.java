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

/**
 * The five traced phases of a compilation, in pipeline order.
 */
public enum Phase {
	TOKENS("Lexical Analysis", "tokens", "tokens", "(no tokens)"),
	SYNTAX_TREE("Syntax Analysis", "syntaxTree", "tree", "(empty tree)"),
	SEMANTIC("Semantic Analysis", "semantic", "semantic", "(no semantic info)"),
	INTERMEDIATE("Intermediate Code", "intermediate", "tac", "(no TAC)"),
	FINAL("Final Code", "final", "final", "(no final code)");

	private final String title;
	private final String key;
	private final String shortName;
	private final String fallback;

	Phase(String title, String key, String shortName, String fallback) {
		this.title = title;
		this.key = key;
		this.shortName = shortName;
		this.fallback = fallback;
	}

	/**
	 * @return heading printed above the phase output
	 */
	public String getTitle() {
		return title;
	}

	/**
	 * @return field name of the phase in a response map
	 */
	public String getKey() {
		return key;
	}

	/**
	 * @return name of the phase on the command line
	 */
	public String getShortName() {
		return shortName;
	}

	/**
	 * @return text shown in place of an empty phase output
	 */
	public String getFallback() {
		return fallback;
	}

	/**
	 * Looks up a phase by its command-line name, or by its enum name.
	 *
	 * @param name name to look up, case insensitive
	 * @return the matching phase
	 * @throws IllegalArgumentException if no phase has this name
	 */
	public static Phase fromShortName(String name) {
		for (Phase phase : values()) {
			if (phase.shortName.equalsIgnoreCase(name) || phase.name().equalsIgnoreCase(name)) {
				return phase;
			}
		}
		StringBuilder expected = new StringBuilder();
		for (Phase phase : values()) {
			if (expected.length() > 0) {
				expected.append(", ");
			}
			expected.append(phase.getShortName());
		}
		throw new IllegalArgumentException("Unknown phase '" + name + "'. Expected one of: " + expected);
	}
}
