package org.metricshub.exprc.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class SyntaxTreePrinterTest {

	private static String print(String expression) throws Exception {
		return new SyntaxTreePrinter().print(ExprParser.parse(ExprLexer.tokenize(expression)));
	}

	@Test
	public void testBinaryTree() throws Exception {
		assertEquals("+\n  2\n  *\n    3\n    4\n", print("2+3*4"));
	}

	@Test
	public void testUnary() throws Exception {
		assertEquals("- (unary)\n  - (unary)\n    x\n", print("--x"));
	}

	@Test
	public void testLeaf() throws Exception {
		assertEquals("3.14\n", print("(3.14)"));
	}

	@Test
	public void testNullTree() {
		assertEquals("", new SyntaxTreePrinter().print(null));
	}

	@Test
	public void testCustomIndent() throws Exception {
		SyntaxTreePrinter printer = new SyntaxTreePrinter(4);
		assertEquals("-\n    a\n    b\n", printer.print(ExprParser.parse(ExprLexer.tokenize("a-b"))));
	}
}
