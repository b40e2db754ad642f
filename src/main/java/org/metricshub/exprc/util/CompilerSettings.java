package org.metricshub.exprc.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.metricshub.exprc.Phase;
import org.metricshub.exprc.frontend.ExprParser;
import org.metricshub.exprc.frontend.SyntaxTreePrinter;

/**
 * A simple container for the parameters of a compilation and of the
 * rendering of its phases.
 * <p>
 * Settings are read when an {@link org.metricshub.exprc.ExprCompiler} is
 * created; changing them afterwards does not affect that compiler.
 */
public class CompilerSettings {

	/** Width to which token kind labels are padded in the token listing. */
	public static final int DEFAULT_TOKEN_LABEL_WIDTH = 8;

	/**
	 * Where rendered phases are written.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum nesting of parentheses and unary minus.
	 */
	private int maxNestingDepth = ExprParser.DEFAULT_MAX_DEPTH;

	/**
	 * Spaces per level in the syntax tree.
	 */
	private int treeIndent = SyntaxTreePrinter.DEFAULT_INDENT;

	private int tokenLabelWidth = DEFAULT_TOKEN_LABEL_WIDTH;

	/**
	 * Phases to render, all of them by default.
	 */
	private final Set<Phase> phases = EnumSet.allOf(Phase.class);

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * @param maxNestingDepth strictly positive nesting limit
	 */
	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth <= 0) {
			throw new IllegalArgumentException("Nesting depth must be positive: " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
	}

	public int getTreeIndent() {
		return treeIndent;
	}

	public void setTreeIndent(int treeIndent) {
		if (treeIndent < 0) {
			throw new IllegalArgumentException("Indentation cannot be negative: " + treeIndent);
		}
		this.treeIndent = treeIndent;
	}

	public int getTokenLabelWidth() {
		return tokenLabelWidth;
	}

	public void setTokenLabelWidth(int tokenLabelWidth) {
		this.tokenLabelWidth = tokenLabelWidth;
	}

	/**
	 * @return the phases to render, in pipeline order
	 */
	public Set<Phase> getPhases() {
		return Collections.unmodifiableSet(phases);
	}

	/**
	 * Restricts rendering to the specified phases.
	 *
	 * @param selected phases to render; empty means all of them
	 */
	public void setPhases(Set<Phase> selected) {
		phases.clear();
		if (selected == null || selected.isEmpty()) {
			phases.addAll(EnumSet.allOf(Phase.class));
		} else {
			phases.addAll(selected);
		}
	}
}
