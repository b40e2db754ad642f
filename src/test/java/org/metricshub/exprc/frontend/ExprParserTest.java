package org.metricshub.exprc.frontend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.exprc.frontend.ast.AstNode;
import org.metricshub.exprc.frontend.ast.BinaryOpAst;
import org.metricshub.exprc.frontend.ast.ParserException;
import org.metricshub.exprc.frontend.ast.UnaryOpAst;

public class ExprParserTest {

	private static AstNode parse(String expression) throws Exception {
		return ExprParser.parse(ExprLexer.tokenize(expression));
	}

	private static String parseError(String expression) throws Exception {
		return assertThrows(ParserException.class, () -> parse(expression)).getMessage();
	}

	@Test
	public void testPrecedence() throws Exception {
		assertEquals(
				"BinaryOp(+, Number(2), BinaryOp(*, Number(3), Number(4)))",
				parse("2+3*4").toString());
		assertEquals(
				"BinaryOp(-, BinaryOp(/, Variable(a), Variable(b)), Number(1))",
				parse("a / b - 1").toString());
	}

	@Test
	public void testLeftAssociativity() throws Exception {
		AstNode root = parse("8-3-2");
		assertEquals("BinaryOp(-, BinaryOp(-, Number(8), Number(3)), Number(2))", root.toString());
		BinaryOpAst binary = (BinaryOpAst) root;
		assertTrue(binary.getLeft() instanceof BinaryOpAst);
		assertEquals("BinaryOp(/, BinaryOp(/, Number(8), Number(4)), Number(2))", parse("8/4/2").toString());
	}

	@Test
	public void testParenthesesOverridePrecedence() throws Exception {
		assertEquals(
				"BinaryOp(*, BinaryOp(+, Number(2), Number(3)), Number(4))",
				parse("(2+3)*4").toString());
		assertEquals("Variable(x)", parse("((x))").toString());
	}

	@Test
	public void testUnaryMinusStacks() throws Exception {
		AstNode root = parse("--x");
		assertEquals("UnaryOp(-, UnaryOp(-, Variable(x)))", root.toString());
		assertTrue(((UnaryOpAst) root).getOperand() instanceof UnaryOpAst);
	}

	@Test
	public void testUnaryMinusBindsTighterThanBinary() throws Exception {
		assertEquals(
				"BinaryOp(*, UnaryOp(-, Number(2)), Number(3))",
				parse("-2*3").toString());
		assertEquals(
				"BinaryOp(-, Variable(a), UnaryOp(-, Variable(b)))",
				parse("a - -b").toString());
		assertEquals(
				"UnaryOp(-, BinaryOp(+, Variable(a), Number(1)))",
				parse("-(a+1)").toString());
	}

	@Test
	public void testNumberTextIsVerbatim() throws Exception {
		assertEquals("Number(007.50)", parse("007.50").toString());
	}

	@Test
	public void testUnbalancedParenthesis() throws Exception {
		assertEquals("Expected OPERATOR ')' but got EOF", parseError("(2+3"));
		assertEquals("Expected OPERATOR ')' but got NUMBER", parseError("(2+3 4"));
	}

	@Test
	public void testExtraTokens() throws Exception {
		assertEquals("Extra tokens after expression", parseError("2 3"));
		assertEquals("Extra tokens after expression", parseError("(1))"));
	}

	@Test
	public void testUnexpectedEndOfInput() throws Exception {
		assertEquals("Unexpected end of input", parseError("2 +"));
		assertEquals("Unexpected end of input", parseError(""));
		assertEquals("Unexpected end of input", parseError("-"));
	}

	@Test
	public void testUnexpectedToken() throws Exception {
		assertEquals("Unexpected token: OPERATOR ')'", parseError("2 * )"));
		assertEquals("Unexpected token: OPERATOR '*'", parseError("*2"));
		assertEquals("Unexpected token: OPERATOR '+'", parseError("+2"));
	}

	@Test
	public void testNestingLimit() throws Exception {
		StringBuilder deep = new StringBuilder();
		for (int i = 0; i < 11; i++) {
			deep.append('(');
		}
		deep.append('1');
		for (int i = 0; i < 11; i++) {
			deep.append(')');
		}
		ExprParser tooShallow = new ExprParser(ExprLexer.tokenize(deep.toString()), 10);
		ParserException e = assertThrows(ParserException.class, () -> tooShallow.parse());
		assertEquals("Expression nesting too deep (limit 10)", e.getMessage());

		ExprParser enough = new ExprParser(ExprLexer.tokenize(deep.toString()), 11);
		assertEquals("Number(1)", enough.parse().toString());

		ExprParser negations = new ExprParser(ExprLexer.tokenize("---x"), 2);
		assertThrows(ParserException.class, () -> negations.parse());
	}

	@Test
	public void testNestingLimitBoundsTreeHeight() throws Exception {
		AstNode atLimit = new ExprParser(ExprLexer.tokenize("1+1+1+1"), 3).parse();
		assertEquals(3, atLimit.getHeight());

		ExprParser flatChain = new ExprParser(ExprLexer.tokenize("1+1+1+1+1"), 3);
		ParserException e = assertThrows(ParserException.class, () -> flatChain.parse());
		assertEquals("Expression nesting too deep (limit 3)", e.getMessage());

		ExprParser products = new ExprParser(ExprLexer.tokenize("a*b*c"), 1);
		assertThrows(ParserException.class, () -> products.parse());

		// parentheses alone do not make the tree taller
		assertEquals(0, new ExprParser(ExprLexer.tokenize("((x))"), 2).parse().getHeight());
		assertEquals(2, parse("-x * (a + b)").getHeight());
	}
}
