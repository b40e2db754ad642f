package org.metricshub.exprc.jsr223;

import static org.junit.Assert.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.exprc.PhaseResults;

public class ScriptEngineTest {

	@Test
	public void testCompileThroughScriptEngine() throws Exception {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("exprc");
		assertNotNull("Exprc ScriptEngine not found", engine);

		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));

		Object phases = engine.eval("a - 1");

		assertTrue(phases instanceof PhaseResults);
		assertEquals("t0 = a - 1\nresult = t0", ((PhaseResults) phases).getIntermediate());
		assertTrue(result.toString(), result.toString().contains("MOV t0, a - 1"));
	}

	@Test
	public void testCompileErrorIsScriptException() {
		ScriptEngine engine = new ExprcScriptEngineFactory().getScriptEngine();
		ScriptException e = assertThrows(ScriptException.class, () -> engine.eval("(1"));
		assertTrue(e.getMessage(), e.getMessage().contains("Expected OPERATOR ')' but got EOF"));
		assertThrows(ScriptException.class, () -> engine.eval(""));
	}

	@Test
	public void testFactory() {
		ExprcScriptEngineFactory factory = new ExprcScriptEngineFactory();
		assertEquals("Exprc", factory.getParameter(ScriptEngine.ENGINE));
		assertEquals("x*2", factory.getProgram("x*2"));
		assertThrows(UnsupportedOperationException.class, () -> factory.getOutputStatement("x"));
	}
}
