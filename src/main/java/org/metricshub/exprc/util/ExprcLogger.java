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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class to handle SLF4J logging and prevent any stupid behavior,
 * like logging its own initialization, which we don't want in most cases.
 * <p>
 * Also shortens expressions before they end up in a log line: an expression
 * may be an arbitrarily long file.
 */
public final class ExprcLogger {

	/** Longest expression text written to a log line. */
	public static final int MAX_LOGGED_EXPRESSION = 64;

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	/**
	 * Private constructor to prevent instantiation.
	 */
	private ExprcLogger() {
		// utility class
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Shortens an expression for logging. Line breaks are shown as spaces and
	 * text beyond {@link #MAX_LOGGED_EXPRESSION} characters is replaced by
	 * {@code ...} and the total length.
	 *
	 * @param expression expression text, may be {@code null}
	 * @return a single-line text of bounded length
	 */
	public static String abbreviate(String expression) {
		if (expression == null) {
			return "null";
		}
		String oneLine = expression.replace('\r', ' ').replace('\n', ' ');
		if (oneLine.length() <= MAX_LOGGED_EXPRESSION) {
			return oneLine;
		}
		return oneLine.substring(0, MAX_LOGGED_EXPRESSION) + "... (" + expression.length() + " chars)";
	}
}
