package org.metricshub.exprc.jsr223;

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

import java.util.Arrays;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;

/** ScriptEngineFactory for Exprc. */
public class ExprcScriptEngineFactory implements ScriptEngineFactory {

	@Override
	public String getEngineName() {
		return "Exprc";
	}

	@Override
	public String getEngineVersion() {
		return "1.0.0-SNAPSHOT";
	}

	@Override
	public List<String> getExtensions() {
		return Arrays.asList("expr");
	}

	@Override
	public List<String> getMimeTypes() {
		return Arrays.asList("text/x-arithmetic-expression");
	}

	@Override
	public List<String> getNames() {
		return Arrays.asList("exprc", "Exprc");
	}

	@Override
	public String getLanguageName() {
		return "arithmetic-expression";
	}

	@Override
	public String getLanguageVersion() {
		return "1";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key) || ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	// expressions have no objects, calls, output statements or statement lists
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		throw new UnsupportedOperationException("Expressions have no method calls");
	}

	@Override
	public String getOutputStatement(String toDisplay) {
		throw new UnsupportedOperationException("Expressions have no output statement");
	}

	@Override
	public String getProgram(String... statements) {
		if (statements.length != 1) {
			throw new UnsupportedOperationException("A program is exactly one expression");
		}
		return statements[0];
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new ExprcScriptEngine(this);
	}
}
