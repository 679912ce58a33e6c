package org.jsguard.test.unit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jsguard.Analyzer;
import org.jsguard.AnalyzerOptions;
import org.jsguard.Issue;
import org.jsguard.JSGuard;
import org.jsguard.JSGuardException;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests for analyzer options and config loading
 */
public class TestOptions extends Assert {
	private static String readFile(String path) throws IOException {
		return new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
	}

	@Test
	public void testDefaults() {
		AnalyzerOptions options = new AnalyzerOptions();

		for (String rule : AnalyzerOptions.getRules()) {
			assertTrue(options.isEnabled(rule), rule);
		}
		assertEquals(options.getMaxStatements(), AnalyzerOptions.DEFAULT_MAX_STATEMENTS);
		assertEquals(AnalyzerOptions.DEFAULT_MAX_STATEMENTS, 30);
		assertFalse(options.iterator().hasNext());
		assertEquals(AnalyzerOptions.getRules().size(), 11);
	}

	@Test
	public void testSetAndRemove() {
		AnalyzerOptions options = new AnalyzerOptions()
			.set(AnalyzerOptions.NO_VAR, false)
			.set(AnalyzerOptions.MAX_STATEMENTS, 12);

		assertFalse(options.isEnabled(AnalyzerOptions.NO_VAR));
		assertTrue(options.hasOption(AnalyzerOptions.NO_VAR));
		assertEquals(options.getMaxStatements(), 12);

		options.remove(AnalyzerOptions.NO_VAR);
		assertTrue(options.isEnabled(AnalyzerOptions.NO_VAR));
		assertFalse(options.hasOption(AnalyzerOptions.NO_VAR));
	}

	@Test
	public void testCopyIsIndependent() {
		AnalyzerOptions original = new AnalyzerOptions().set(AnalyzerOptions.UNSAFE_EVAL, false);
		AnalyzerOptions copy = new AnalyzerOptions(original);

		copy.set(AnalyzerOptions.UNSAFE_EVAL, true);
		assertFalse(original.isEnabled(AnalyzerOptions.UNSAFE_EVAL));
		assertTrue(copy.isEnabled(AnalyzerOptions.UNSAFE_EVAL));
	}

	@Test
	public void testOptionsAreCopiedByAnalyzer() {
		AnalyzerOptions options = new AnalyzerOptions().set(AnalyzerOptions.UNSAFE_EVAL, false);
		Analyzer analyzer = new Analyzer(options);

		options.set(AnalyzerOptions.UNSAFE_EVAL, true);
		assertTrue(analyzer.analyze(JSGuard.parse("eval(x);").getProgram()).isEmpty());
	}

	@Test(expectedExceptions = JSGuardException.class, expectedExceptionsMessageRegExp = "Bad option value: 'maxstatements' = 'true'.")
	public void testBooleanForLimit() {
		new AnalyzerOptions().set(AnalyzerOptions.MAX_STATEMENTS, true);
	}

	@Test(expectedExceptions = JSGuardException.class)
	public void testNegativeLimit() {
		new AnalyzerOptions().set(AnalyzerOptions.MAX_STATEMENTS, -1);
	}

	@Test
	public void testSetUnknownOption() {
		try {
			new AnalyzerOptions().set("no-eval", false);
			fail("unknown flag accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option: 'no-eval'.");
		}

		try {
			new AnalyzerOptions().set("maxdepth", 3);
			fail("unknown limit accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option: 'maxdepth'.");
		}

		try {
			new AnalyzerOptions().set(AnalyzerOptions.NO_VAR, 3);
			fail("limit given for a rule");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option value: 'no-var' = '3'.");
		}
	}

	@Test
	public void testFromMap() {
		Map<String, Object> config = new LinkedHashMap<String, Object>();
		config.put("loose-equality", false);
		config.put("no-var", "false");
		config.put("maxstatements", "5");

		AnalyzerOptions options = AnalyzerOptions.fromMap(config);

		assertFalse(options.isEnabled(AnalyzerOptions.LOOSE_EQUALITY));
		assertFalse(options.isEnabled(AnalyzerOptions.NO_VAR));
		assertTrue(options.isEnabled(AnalyzerOptions.UNSAFE_EVAL));
		assertEquals(options.getMaxStatements(), 5);

		assertFalse(AnalyzerOptions.fromMap(null).iterator().hasNext());
	}

	@Test
	public void testUnknownOption() {
		try {
			AnalyzerOptions.load("{\"no-eval\": true}");
			fail("unknown option accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option: 'no-eval'.");
		}
	}

	@Test
	public void testBadValues() {
		try {
			AnalyzerOptions.load("maxstatements: many");
			fail("bad limit accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option value: 'maxstatements' = 'many'.");
		}

		try {
			AnalyzerOptions.load("unsafe-eval: sometimes");
			fail("bad flag accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Bad option value: 'unsafe-eval' = 'sometimes'.");
		}
	}

	@Test
	public void testLoadYaml() throws IOException {
		AnalyzerOptions options = AnalyzerOptions.load(readFile("src/test/resources/fixtures/config.yml"));

		assertFalse(options.isEnabled(AnalyzerOptions.NO_VAR));
		assertFalse(options.isEnabled(AnalyzerOptions.UNUSED_VARIABLE));
		assertTrue(options.isEnabled(AnalyzerOptions.UNSAFE_EVAL));
		assertEquals(options.getMaxStatements(), 10);
	}

	@Test
	public void testLoadJson() throws IOException {
		AnalyzerOptions options = AnalyzerOptions.load(readFile("src/test/resources/fixtures/config.json"));

		assertFalse(options.isEnabled(AnalyzerOptions.IMPLICIT_GLOBAL));
		assertFalse(options.isEnabled(AnalyzerOptions.LOOP_CONCAT));
		assertEquals(options.getMaxStatements(), 40);
	}

	@Test
	public void testLoadEmpty() {
		assertFalse(AnalyzerOptions.load("").iterator().hasNext());
		assertFalse(AnalyzerOptions.load(null).iterator().hasNext());
		assertFalse(AnalyzerOptions.load("# nothing here\n").iterator().hasNext());
	}

	@Test
	public void testLoadMalformed() {
		try {
			AnalyzerOptions.load("{\"no-var\": ");
			fail("malformed config accepted");
		} catch (JSGuardException e) {
			assertTrue(e.getMessage().startsWith("Can't parse config: "), e.getMessage());
			assertNotNull(e.getCause());
		}

		try {
			AnalyzerOptions.load("- no-var\n- unsafe-eval\n");
			fail("list config accepted");
		} catch (JSGuardException e) {
			assertEquals(e.getMessage(), "Config must be a map of option names to values.");
		}
	}

	@Test
	public void testConfigChangesAnalysis() throws IOException {
		String source = "var total = 1;";

		List<Issue> defaults = JSGuard.analyze(JSGuard.parse(source).getProgram());
		List<Issue> configured = JSGuard.analyze(JSGuard.parse(source).getProgram(),
			AnalyzerOptions.load(readFile("src/test/resources/fixtures/config.yml")));

		assertEquals(defaults.size(), 2);
		assertTrue(configured.isEmpty());
	}
}
