package org.metricshub.exprc.intermediate;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.exprc.frontend.ExprLexer;
import org.metricshub.exprc.frontend.ExprParser;

public class TacGeneratorTest {

	private static IntermediateCode generate(String expression) throws Exception {
		return TacGenerator.generate(ExprParser.parse(ExprLexer.tokenize(expression)));
	}

	@Test
	public void testPrecedenceOrder() throws Exception {
		IntermediateCode code = generate("2+3*4");
		assertEquals(Arrays.asList("t0 = 3 * 4", "t1 = 2 + t0", "result = t1"), code.lines());
		assertEquals(2, code.getTemporaryCount());
	}

	@Test
	public void testLeftOperandFirst() throws Exception {
		assertEquals(
				Arrays.asList("t0 = a * b", "t1 = c / d", "t2 = t0 - t1", "result = t2"),
				generate("a*b - c/d").lines());
	}

	@Test
	public void testUnary() throws Exception {
		assertEquals(
				Arrays.asList("t0 = -x", "t1 = -t0", "t2 = t1 + 1", "result = t2"),
				generate("--x + 1").lines());
	}

	@Test
	public void testBareLiteral() throws Exception {
		IntermediateCode code = generate("5");
		assertEquals(Arrays.asList("result = 5"), code.lines());
		assertEquals(0, code.getTemporaryCount());
	}

	@Test
	public void testBareVariable() throws Exception {
		assertEquals(Arrays.asList("result = y"), generate("(y)").lines());
	}

	@Test
	public void testTemporariesRestartForEachExpression() throws Exception {
		assertEquals(Arrays.asList("t0 = a + 1", "result = t0"), generate("a+1").lines());
		assertEquals(Arrays.asList("t0 = b + 2", "result = t0"), generate("b+2").lines());
	}

	@Test
	public void testInstructionParts() throws Exception {
		TacInstruction first = generate("x - 1").getInstructions().get(0);
		assertEquals("t0", first.getTarget());
		assertEquals("-", first.getOperator());
		assertEquals("x - 1", first.getExpression());
		TacInstruction last = generate("x").getInstructions().get(0);
		assertEquals(TacInstruction.RESULT, last.getTarget());
		assertNull(last.getOperator());
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
			generate("1/x").dump(ps);
		}
		String[] lines = bytes.toString(StandardCharsets.UTF_8.name()).split("\\R");
		assertArrayEquals(new String[] { "0 : t0 = 1 / x", "1 : result = t0" }, lines);
	}

	@Test
	public void testNullTree() {
		assertThrows(IllegalStateException.class, () -> TacGenerator.generate(null));
	}
}
