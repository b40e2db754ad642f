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

/**
 * Thrown by the lexer on the first character it cannot turn into a token.
 */
public class LexerException extends CompileException {

	private static final long serialVersionUID = 1L;

	private final int position;

	/**
	 * Creates a lexer exception which is not tied to a single character.
	 *
	 * @param message description of the problem
	 */
	public LexerException(String message) {
		this(message, -1);
	}

	/**
	 * @param message description of the problem
	 * @param position 1-based position of the offending character
	 */
	public LexerException(String message, int position) {
		super(message);
		this.position = position;
	}

	/**
	 * Returns the 1-based position of the offending character, or {@code -1}
	 * when the problem spans a whole token.
	 *
	 * @return the offending position or {@code -1}
	 */
	public int getPosition() {
		return position;
	}
}
