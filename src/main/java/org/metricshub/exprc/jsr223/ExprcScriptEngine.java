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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.exprc.ExprCompiler;
import org.metricshub.exprc.InvalidExpressionException;
import org.metricshub.exprc.Phase;
import org.metricshub.exprc.PhaseResults;
import org.metricshub.exprc.frontend.ast.CompileException;
import org.metricshub.exprc.util.ExpressionSource;

/**
 * Simple JSR-223 script engine for Exprc. The "script" is one expression;
 * evaluating it returns its {@link PhaseResults}.
 */
public class ExprcScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;
	private final ExprCompiler compiler = new ExprCompiler();

	public ExprcScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			String expression = new ExpressionSource(ExpressionSource.DESCRIPTION_COMMAND_LINE, scriptReader)
					.readExpression();
			PhaseResults phases = compiler.compileOrThrow(expression);
			Writer writer = context.getWriter();
			if (writer != null) {
				ByteArrayOutputStream result = new ByteArrayOutputStream();
				try (PrintStream ps = new PrintStream(result, true, StandardCharsets.UTF_8.name())) {
					phases.render(ps, EnumSet.allOf(Phase.class));
				}
				writer.write(result.toString(StandardCharsets.UTF_8.name()));
				writer.flush();
			}
			return phases;
		} catch (CompileException | InvalidExpressionException e) {
			ScriptException se = new ScriptException(e.getMessage());
			se.initCause(e);
			throw se;
		} catch (IOException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
