package org.metricshub.exprc.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.exprc.frontend.ast.LexerException;

public class ExprLexerTest {

	private static String concat(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			sb.append(token.getText());
		}
		return sb.toString();
	}

	@Test
	public void testDecimalNumber() throws Exception {
		List<Token> tokens = ExprLexer.tokenize("3.14");
		assertEquals(Arrays.asList(new Token(TokenKind.NUMBER, "3.14")), tokens);
	}

	@Test
	public void testLeadingDotNumber() throws Exception {
		List<Token> tokens = ExprLexer.tokenize(".5*x");
		assertEquals(
				Arrays
						.asList(
								new Token(TokenKind.NUMBER, ".5"),
								new Token(TokenKind.OPERATOR, "*"),
								new Token(TokenKind.IDENTIFIER, "x")),
				tokens);
	}

	@Test
	public void testTrailingDotIsKeptVerbatim() throws Exception {
		assertEquals(Arrays.asList(new Token(TokenKind.NUMBER, "5.")), ExprLexer.tokenize("5."));
	}

	@Test
	public void testMultipleDots() {
		LexerException e = assertThrows(LexerException.class, () -> ExprLexer.tokenize("3.1.4"));
		assertEquals("Invalid number format: multiple dots", e.getMessage());
		assertEquals(-1, e.getPosition());
	}

	@Test
	public void testInvalidCharacterPosition() {
		LexerException e = assertThrows(LexerException.class, () -> ExprLexer.tokenize("2 $ 3"));
		assertEquals("Invalid character: '$' at position 3", e.getMessage());
		assertEquals(3, e.getPosition());
	}

	@Test
	public void testLoneDotIsInvalid() {
		LexerException e = assertThrows(LexerException.class, () -> ExprLexer.tokenize("1 + ."));
		assertEquals("Invalid character: '.' at position 5", e.getMessage());
	}

	@Test
	public void testUnderscoreIsInvalid() {
		LexerException e = assertThrows(LexerException.class, () -> ExprLexer.tokenize("my_var"));
		assertEquals(3, e.getPosition());
	}

	@Test
	public void testIdentifiers() throws Exception {
		List<Token> tokens = ExprLexer.tokenize("alpha2 + 2beta");
		assertEquals(
				Arrays
						.asList(
								new Token(TokenKind.IDENTIFIER, "alpha2"),
								new Token(TokenKind.OPERATOR, "+"),
								new Token(TokenKind.NUMBER, "2"),
								new Token(TokenKind.IDENTIFIER, "beta")),
				tokens);
	}

	@Test
	public void testOperatorsAreSingleCharacters() throws Exception {
		List<Token> tokens = ExprLexer.tokenize("--(x)");
		assertEquals(5, tokens.size());
		for (Token token : tokens.subList(0, 3)) {
			assertEquals(TokenKind.OPERATOR, token.getKind());
		}
		assertTrue(tokens.get(0).isOperator("-"));
		assertTrue(tokens.get(2).isOperator("("));
		assertTrue(tokens.get(4).isOperator(")"));
	}

	@Test
	public void testTokensCoverNonBlankInput() throws Exception {
		String[] inputs = { "2+3*4", " ( a1 + .25 ) / -b\t*\n7.0 ", "x", "8 - 3 - 2", "--x" };
		for (String input : inputs) {
			assertEquals(input, input.replaceAll("\\s", ""), concat(ExprLexer.tokenize(input)));
		}
	}

	@Test
	public void testBlankInputHasNoTokens() throws Exception {
		assertTrue(ExprLexer.tokenize("  \t\n").isEmpty());
		assertTrue(ExprLexer.tokenize("").isEmpty());
	}

	@Test
	public void testTokensAreImmutable() throws Exception {
		List<Token> tokens = ExprLexer.tokenize("1+1");
		assertThrows(UnsupportedOperationException.class, () -> tokens.add(new Token(TokenKind.NUMBER, "2")));
	}
}
