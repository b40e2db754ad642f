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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.metricshub.exprc.frontend.ExprParser;
import org.metricshub.exprc.util.CompilerSettings;
import org.metricshub.exprc.util.ExprcLogger;
import org.metricshub.exprc.util.ExpressionFileSource;
import org.metricshub.exprc.util.ExpressionSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Exprc.
 */
public final class Cli {

	private static final Logger LOG = ExprcLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "exprc.jar";
		}
		JAR_NAME = myName;
	}

	private final CompilerSettings settings = new CompilerSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ExpressionSource expressionSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where the phases are written
	 * @param err stream where compilation errors are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link CompilerSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CompilerSettings getSettings() {
		return settings;
	}

	/**
	 * @return the source of the expression, or {@code null} when only usage is printed
	 */
	public ExpressionSource getExpressionSource() {
		return expressionSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		Set<Phase> phases = EnumSet.noneOf(Phase.class);

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args make up the expression
				break;
			} else if (arg.equals("-") || arg.equals("--")) {
				// explicit end of options, for expressions starting with unary minus
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : read the expression from a file
				checkParameterHasArgument(args, argIdx);
				expressionSource = new ExpressionFileSource(args[++argIdx]);
			} else if (arg.equals("-p") || arg.equals("--phase")) {
				// -p phase : only print this phase
				checkParameterHasArgument(args, argIdx);
				phases.add(Phase.fromShortName(args[++argIdx]));
			} else if (arg.equals("--max-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxNestingDepth(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--indent")) {
				checkParameterHasArgument(args, argIdx);
				settings.setTreeIndent(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		settings.setPhases(phases);

		if (expressionSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Expression not provided.");
			}
			// unquoted expressions arrive split on blanks
			List<String> words = new ArrayList<String>();
			while (argIdx < args.length) {
				words.add(args[argIdx++]);
			}
			expressionSource = new ExpressionSource(
					ExpressionSource.DESCRIPTION_COMMAND_LINE,
					new StringReader(String.join(" ", words)));
		} else if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument with -f: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got: " + value, e);
		}
	}

	/**
	 * Compiles the expression and prints the selected phases.
	 *
	 * @return the process exit code: 0 on success, 1 on a compilation error
	 * @throws IOException if the expression cannot be read
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}

		String expression = expressionSource.readExpression();
		CompileResult result;
		try {
			result = new ExprCompiler(settings).compile(expression);
		} catch (InvalidExpressionException e) {
			err.println("Error: " + e.getMessage() + " (" + expressionSource.getDescription() + ")");
			return 1;
		}
		if (!result.isSuccess()) {
			err.println("Error: " + result.getError());
			return 1;
		}
		result.getPhases().render(settings.getOutputStream(), settings.getPhases());
		settings.getOutputStream().flush();
		return 0;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f expression-filename]" +
								" [-p phase]..." +
								" [--max-depth n]" +
								" [--indent n]" +
								" [--] [expression]");
		dest.println();
		dest.println(" -f filename = Read the expression from filename.");
		dest.println(" -p phase = Only print this phase: tokens, tree, semantic, tac or final.");
		dest.println("            May be repeated. All phases are printed by default.");
		dest.println(" --phase phase = Same as -p.");
		dest.println(" --max-depth n = Reject expressions nested deeper than n (default " + ExprParser.DEFAULT_MAX_DEPTH + ").");
		dest.println(" --indent n = Indent the syntax tree by n spaces per level.");
		dest.println(" -- = End of options, for expressions starting with '-'.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments, executes the CLI, and returns the exit code.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the phases
	 * @param es error stream for diagnostic messages
	 * @return the exit code
	 * @throws IOException if the expression cannot be read
	 */
	public static int create(String[] args, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(os, es);
		cli.parse(args);
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int code;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			code = cli.run();
		} catch (IllegalArgumentException e) {
			LOG.debug("Invalid arguments", e);
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = 1;
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = 1;
		}
		if (code != 0) {
			System.exit(code);
		}
	}
}
