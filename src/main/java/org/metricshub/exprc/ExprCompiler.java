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

import java.util.List;
import org.metricshub.exprc.backend.FinalCodeEmitter;
import org.metricshub.exprc.frontend.ExprLexer;
import org.metricshub.exprc.frontend.ExprParser;
import org.metricshub.exprc.frontend.SyntaxTreePrinter;
import org.metricshub.exprc.frontend.Token;
import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.CompileException;
import org.metricshub.exprc.intermediate.IntermediateCode;
import org.metricshub.exprc.intermediate.TacGenerator;
import org.metricshub.exprc.semantic.SemanticAnalyzer;
import org.metricshub.exprc.util.CompilerSettings;
import org.metricshub.exprc.util.ExprcLogger;
import org.slf4j.Logger;

/**
 * Entry point into the compilation of an arithmetic expression.
 * This entry point is used both when Exprc is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Scan the text into tokens.
 * <li>Parse the tokens, producing an abstract syntax tree.
 * <li>Traverse the tree three times: to print it, to analyze it, and to
 * produce three-address code.
 * <li>Turn the three-address code into pseudo-assembly.
 * </ul>
 * The first error aborts the process. Every call works on its own tokens,
 * tree and temporaries, so a compiler can be shared between threads.
 *
 * @see PhaseResults
 */
public class ExprCompiler {

	private static final Logger LOG = ExprcLogger.getLogger(ExprCompiler.class);

	private final int maxNestingDepth;
	private final int tokenLabelWidth;
	private final SyntaxTreePrinter treePrinter;

	/**
	 * Create a new compiler with default settings.
	 */
	public ExprCompiler() {
		this(new CompilerSettings());
	}

	/**
	 * @param settings nesting limit and rendering parameters
	 */
	public ExprCompiler(CompilerSettings settings) {
		this.maxNestingDepth = settings.getMaxNestingDepth();
		this.tokenLabelWidth = settings.getTokenLabelWidth();
		this.treePrinter = new SyntaxTreePrinter(settings.getTreeIndent());
	}

	/**
	 * Compiles the expression and captures the output of every phase.
	 *
	 * @param expression text of the expression
	 * @return the phase outputs, or the first lexical or syntax error
	 * @throws InvalidExpressionException if {@code expression} is {@code null} or empty
	 */
	public CompileResult compile(String expression) {
		try {
			return CompileResult.success(compileOrThrow(expression));
		} catch (CompileException e) {
			if (LOG.isDebugEnabled()) {
				LOG.debug("Compilation of '{}' failed: {}", ExprcLogger.abbreviate(expression), e.getMessage());
			}
			return CompileResult.failure(e.getMessage());
		}
	}

	/**
	 * Same as {@link #compile(String)}, for callers who prefer exceptions.
	 *
	 * @param expression text of the expression
	 * @return the phase outputs
	 * @throws CompileException on the first lexical or syntax error
	 * @throws InvalidExpressionException if {@code expression} is {@code null} or empty
	 */
	public PhaseResults compileOrThrow(String expression) throws CompileException {
		if (expression == null || expression.isEmpty()) {
			throw new InvalidExpressionException("Missing or invalid expression");
		}

		List<Token> tokens = ExprLexer.tokenize(expression);
		AstNode ast = new ExprParser(tokens, maxNestingDepth).parse();

		String syntaxTree = treePrinter.print(ast).trim();
		String semantic = SemanticAnalyzer.analyze(ast).toText();
		IntermediateCode tac = TacGenerator.generate(ast);
		List<String> tacLines = tac.lines();
		String finalCode = FinalCodeEmitter.emit(tacLines);

		if (LOG.isDebugEnabled()) {
			LOG
					.debug(
							"Compiled '{}': {} tokens, {} TAC instructions, {} temporaries",
							ExprcLogger.abbreviate(expression),
							tokens.size(),
							tac.size(),
							tac.getTemporaryCount());
		}

		return new PhaseResults(
				formatTokens(tokens),
				syntaxTree,
				semantic,
				String.join("\n", tacLines),
				finalCode);
	}

	private String formatTokens(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			if (sb.length() > 0) {
				sb.append('\n');
			}
			String label = token.getKind().getLabel();
			sb.append(label);
			for (int i = label.length(); i < tokenLabelWidth; i++) {
				sb.append(' ');
			}
			sb.append(' ').append(token.getText());
		}
		return sb.toString();
	}
}
