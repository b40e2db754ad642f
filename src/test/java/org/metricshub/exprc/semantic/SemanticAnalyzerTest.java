package org.metricshub.exprc.semantic;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.exprc.frontend.ExprLexer;
import org.metricshub.exprc.frontend.ExprParser;
import org.metricshub.exprc.semantic.SemanticReport.Classification;

public class SemanticAnalyzerTest {

	private static SemanticReport analyze(String expression) throws Exception {
		return SemanticAnalyzer.analyze(ExprParser.parse(ExprLexer.tokenize(expression)));
	}

	@Test
	public void testSymbolic() throws Exception {
		SemanticReport report = analyze("x+2");
		assertEquals(3, report.getNodeCount());
		assertEquals(Arrays.asList("x"), report.getVariables());
		assertEquals(Arrays.asList("2"), report.getConstants());
		assertEquals(Arrays.asList("+"), report.getOperators());
		assertEquals(Classification.SYMBOLIC, report.getClassification());
		assertEquals(
				"Total nodes: 3\n"
						+ "Variables: x\n"
						+ "Constants: 2\n"
						+ "Operators: +\n"
						+ "Classification: symbolic\n"
						+ "Warning: runtime values required for unresolved variables: x",
				report.toText());
	}

	@Test
	public void testNumeric() throws Exception {
		SemanticReport report = analyze("2+3");
		assertTrue(report.getVariables().isEmpty());
		assertEquals(Classification.NUMERIC, report.getClassification());
		assertEquals(
				"Total nodes: 3\n"
						+ "Variables: (none)\n"
						+ "Constants: 2, 3\n"
						+ "Operators: +\n"
						+ "Classification: numeric\n"
						+ "Expression is fully evaluable at compile time",
				report.toText());
	}

	@Test
	public void testDistinctVariablesInFirstSeenOrder() throws Exception {
		SemanticReport report = analyze("b * a + b - c");
		assertEquals(Arrays.asList("b", "a", "c"), report.getVariables());
		assertTrue(report.toText().endsWith("unresolved variables: b, a, c"));
	}

	@Test
	public void testConstantsKeepDuplicates() throws Exception {
		assertEquals(Arrays.asList("1", "2.5", "1"), analyze("1 + 2.5 * 1").getConstants());
	}

	@Test
	public void testOperatorsInPreOrder() throws Exception {
		// the root operator comes before those of its operands
		assertEquals(Arrays.asList("-", "*", "unary -", "/"), analyze("a * -b - c / d").getOperators());
	}

	@Test
	public void testSingleValue() throws Exception {
		SemanticReport report = analyze("5");
		assertEquals(1, report.getNodeCount());
		assertEquals(Collections.emptyList(), report.getOperators());
		assertTrue(report.toText().contains("Operators: (none)\n"));
	}

	@Test
	public void testNodeCountIncludesUnary() throws Exception {
		assertEquals(3, analyze("--x").getNodeCount());
	}
}
