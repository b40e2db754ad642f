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

import java.io.IOException;
import java.io.Reader;

/**
 * Represents where the text of an expression comes from.
 * This is usually either a string given on the command line,
 * or a file given with the {@code -f} command line switch.
 */
public class ExpressionSource {

	/** Description of an expression passed as a command-line argument. */
	public static final String DESCRIPTION_COMMAND_LINE = "<command-line-supplied-expression>";

	private final String description;
	private final Reader reader;

	public ExpressionSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the expression text.
	 *
	 * @return The reader which contains the expression.
	 * @throws IOException if the source cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source. Trailing line terminators are removed, so a file
	 * saved with a final newline holds the same expression as the command line.
	 *
	 * @return the expression text
	 * @throws IOException if the source cannot be read
	 */
	public String readExpression() throws IOException {
		StringBuilder sb = new StringBuilder();
		char[] buf = new char[4096];
		try (Reader r = getReader()) {
			int n;
			while ((n = r.read(buf)) >= 0) {
				sb.append(buf, 0, n);
			}
		}
		int end = sb.length();
		while (end > 0 && (sb.charAt(end - 1) == '\n' || sb.charAt(end - 1) == '\r')) {
			end--;
		}
		return sb.substring(0, end);
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
