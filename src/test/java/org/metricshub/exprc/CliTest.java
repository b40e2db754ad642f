package org.metricshub.exprc;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.exprc.util.ExpressionFileSource;
import org.metricshub.exprc.util.ExpressionSource;

public class CliTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
	private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

	private int run(String... args) throws Exception {
		try (PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
				PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8.name())) {
			return Cli.create(args, out, err);
		}
	}

	private String out() throws Exception {
		return outBytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n");
	}

	private String err() throws Exception {
		return errBytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n");
	}

	@Test
	public void testAllPhases() throws Exception {
		assertEquals(0, run("2+3*4"));
		String out = out();
		for (Phase phase : Phase.values()) {
			assertTrue(phase.getTitle(), out.contains("== " + phase.getTitle() + " ==\n"));
		}
		assertTrue(out, out.contains("MOV t1, 2 + t0\nMOV result, t1\n"));
		assertEquals("", err());
	}

	@Test
	public void testSelectedPhase() throws Exception {
		assertEquals(0, run("-p", "tac", "a", "*", "b"));
		assertEquals("== Intermediate Code ==\nt0 = a * b\nresult = t0\n\n", out());
	}

	@Test
	public void testEndOfOptions() throws Exception {
		assertEquals(0, run("--phase", "tree", "--", "-x"));
		assertEquals("== Syntax Analysis ==\n- (unary)\n  x\n\n", out());
	}

	@Test
	public void testExpressionFile() throws Exception {
		File file = tmp.newFile("expr.txt");
		Files.write(file.toPath(), "x / 2\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(0, run("-p", "final", "-f", file.getPath()));
		assertEquals("== Final Code ==\nMOV t0, x / 2\nMOV result, t0\n\n", out());
	}

	@Test
	public void testParsedOptions() throws Exception {
		Cli cli = new Cli(new PrintStream(outBytes, true, StandardCharsets.UTF_8.name()), System.err);
		cli.parse(new String[] { "-p", "semantic", "--phase", "tokens", "--max-depth", "42", "--indent", "3", "-f", "calc.expr" });
		assertEquals(EnumSet.of(Phase.TOKENS, Phase.SEMANTIC), cli.getSettings().getPhases());
		assertEquals(42, cli.getSettings().getMaxNestingDepth());
		assertEquals(3, cli.getSettings().getTreeIndent());
		assertTrue(cli.getExpressionSource() instanceof ExpressionFileSource);
		assertEquals("calc.expr", ((ExpressionFileSource) cli.getExpressionSource()).getFilePath());
		assertEquals("calc.expr", cli.getExpressionSource().getDescription());
	}

	@Test
	public void testCommandLineExpressionWords() throws Exception {
		Cli cli = new Cli(new PrintStream(outBytes, true, StandardCharsets.UTF_8.name()), System.err);
		cli.parse(new String[] { "a", "+", "2" });
		assertEquals(ExpressionSource.DESCRIPTION_COMMAND_LINE, cli.getExpressionSource().getDescription());
		assertEquals("a + 2", cli.getExpressionSource().readExpression());
		assertEquals(EnumSet.allOf(Phase.class), cli.getSettings().getPhases());
	}

	@Test
	public void testCompileError() throws Exception {
		assertEquals(1, run("2", "$", "3"));
		assertEquals("", out());
		assertEquals("Error: Invalid character: '$' at position 3\n", err());
	}

	@Test
	public void testEmptyFile() throws Exception {
		File file = tmp.newFile("empty.txt");
		assertEquals(1, run("-f", file.getPath()));
		assertTrue(err(), err().startsWith("Error: Missing or invalid expression"));
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(0, run("-h"));
		assertTrue(out().startsWith("Usage:"));
		assertEquals(0, run());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> run("-p", "bytecode", "1"));
		assertThrows(IllegalArgumentException.class, () -> run("--max-depth", "deep", "1"));
		assertThrows(IllegalArgumentException.class, () -> run("-z", "1"));
		assertThrows(IllegalArgumentException.class, () -> run("-p", "tac"));
		assertThrows(IllegalArgumentException.class, () -> run("-f"));
	}

	@Test
	public void testMaxDepthOption() throws Exception {
		assertEquals(1, run("--max-depth", "1", "((1))"));
		assertEquals("Error: Expression nesting too deep (limit 1)\n", err());
	}
}
