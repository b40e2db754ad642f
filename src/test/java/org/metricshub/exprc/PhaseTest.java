package org.metricshub.exprc;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import org.junit.Test;

public class PhaseTest {

	@Test
	public void testFromShortName() {
		assertEquals(Phase.TOKENS, Phase.fromShortName("tokens"));
		assertEquals(Phase.SYNTAX_TREE, Phase.fromShortName("tree"));
		assertEquals(Phase.SYNTAX_TREE, Phase.fromShortName("syntax_tree"));
		assertEquals(Phase.INTERMEDIATE, Phase.fromShortName("TAC"));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Phase.fromShortName("assembly"));
		assertEquals("Unknown phase 'assembly'. Expected one of: tokens, tree, semantic, tac, final", e.getMessage());
	}

	@Test
	public void testFallbackForEmptyPhase() {
		PhaseResults phases = new PhaseResults("", "", "report", "result = 1", "");
		assertEquals("(no tokens)", phases.getTokens());
		assertEquals("(empty tree)", phases.getSyntaxTree());
		assertEquals("report", phases.getSemantic());
		assertEquals("(no final code)", phases.getFinalCode());
	}

	@Test
	public void testRenderSelectedPhases() throws Exception {
		PhaseResults phases = new ExprCompiler().compile("1-x").getPhases();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
			phases.render(ps, EnumSet.of(Phase.FINAL, Phase.INTERMEDIATE));
		}
		String out = bytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n");
		assertEquals(
				"== Intermediate Code ==\nt0 = 1 - x\nresult = t0\n\n"
						+ "== Final Code ==\nMOV t0, 1 - x\nMOV result, t0\n\n",
				out);
	}
}
