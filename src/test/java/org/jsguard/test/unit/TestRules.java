package org.jsguard.test.unit;

import java.util.ArrayList;
import java.util.List;

import org.jsguard.AnalyzerOptions;
import org.jsguard.IssueKind;
import org.jsguard.JSGuard;
import org.jsguard.Severity;
import org.jsguard.ast.FunctionDeclaration;
import org.jsguard.rules.ComplexityRules;
import org.jsguard.test.helpers.TestHelper;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests for the individual rules of the catalog
 */
public class TestRules extends Assert {
	private TestHelper th = new TestHelper();

	@BeforeMethod
	private void setupBeforeMethod() {
		th.newTest();
	}

	private static String[] functionWith(int statements) {
		List<String> lines = new ArrayList<String>();
		lines.add("function big() {");
		for (int i = 0; i < statements; i++) {
			lines.add("  foo();");
		}
		lines.add("}");
		return lines.toArray(new String[0]);
	}

	@Test
	public void testUnsafeEval() {
		String[] code = {
			"eval(\"alert(1)\");",
			"Function(\"return this\")();",
			"execScript(code);",
			"obj.eval(\"x\");",
			"evaluate(\"x\");"
		};

		th.addIssue(1, 1, "Unsafe use of eval() — can execute arbitrary code")
			.addIssue(2, 1, "Unsafe use of Function() — can execute arbitrary code")
			.addIssue(3, 1, "Unsafe use of execScript() — can execute arbitrary code")
			.test(code);

		assertEquals(th.getIssues().get(0).getKind(), IssueKind.SECURITY);
		assertEquals(th.getIssues().get(0).getSeverity(), Severity.HIGH);
	}

	@Test
	public void testStringTimer() {
		String[] code = {
			"setTimeout(\"tick()\", 100);",
			"setInterval(tick, 100);",
			"setInterval('poll()', 50);",
			"setTimeout();"
		};

		th.addIssue(1, 1, "Unsafe use of setTimeout with string argument — similar to eval()")
			.addIssue(3, 1, "Unsafe use of setInterval with string argument — similar to eval()")
			.test(code);

		assertEquals(th.getIssues().get(0).getSeverity(), Severity.HIGH);
	}

	@Test
	public void testHtmlInjection() {
		String[] code = {
			"el.innerHTML = html;",
			"let markup = el.outerHTML;",
			"el.textContent = text;",
			"show(markup);"
		};

		th.addIssue(1, 1, "Potential XSS vulnerability using innerHTML")
			.addIssue(2, 14, "Potential XSS vulnerability using outerHTML")
			.test(code);
	}

	@Test
	public void testDocumentWrite() {
		String[] code = {
			"document.write(\"<p>hi</p>\");",
			"document.writeln(html);",
			"stream.write(\"data\");",
			"document.body.write(html);"
		};

		th.addIssue(1, 1, "Insecure use of document.write() — can enable XSS attacks")
			.addIssue(2, 1, "Insecure use of document.writeln() — can enable XSS attacks")
			.test(code);
	}

	@Test
	public void testInsecureHttp() {
		String[] code = {
			"xhr.open(\"GET\", \"http://example.com/api\");",
			"xhr.open(\"GET\", \"https://example.com/api\");",
			"xhr.open(\"GET\", url);",
			"open(\"GET\", \"http://example.com\");"
		};

		th.addIssue(1, 1, "Using insecure HTTP protocol instead of HTTPS").test(code);

		assertEquals(th.getIssues().get(0).getSeverity(), Severity.MEDIUM);
	}

	@Test
	public void testLooseEquality() {
		String[] code = {
			"if (a == b) { run(); }",
			"if (a != b) { run(); }",
			"if (a === b) { run(); }",
			"if (a !== b) { run(); }"
		};

		th.addIssue(1, 5, "Unsafe equality comparison using == instead of ===")
			.addIssue(2, 5, "Unsafe equality comparison using != instead of !==")
			.test(code);

		assertEquals(th.getIssues().get(0).getKind(), IssueKind.ERROR);
	}

	@Test
	public void testImplicitGlobal() {
		String[] code = {
			"count = 5;",
			"let total = 0;",
			"total = 5;",
			"obj.prop = 1;"
		};

		// declared names are reported too, there is no scope analysis
		th.addIssue(1, 1, "Potential implicit global variable: count")
			.addIssue(3, 1, "Potential implicit global variable: total")
			.test(code);

		assertEquals(th.getIssues().get(0).getSeverity(), Severity.HIGH);
	}

	@Test
	public void testVarKeyword() {
		String[] code = {
			"var a = 1;",
			"let b = 2;",
			"const c = 3;",
			"use(a, b, c);"
		};

		th.addIssue(1, 1, "Use of 'var' keyword — consider using 'let' or 'const' instead").test(code);

		assertEquals(th.getIssues().get(0).getKind(), IssueKind.STYLE);
	}

	@Test
	public void testStringConcatenationInLoop() {
		String[] code = {
			"let s = \"\";",
			"for (let i = 0; i < 3; i++) {",
			"  s += \"x\";",
			"}",
			"while (more()) {",
			"  if (ready) { s += 'y'; }",
			"}",
			"s += \"z\";",
			"for (;;) s += suffix;"
		};

		th.addIssue(3, 3, "Potential implicit global variable: s")
			.addIssue(3, 3, "Inefficient string concatenation in loop — consider using array.join() instead")
			.addIssue(6, 16, "Potential implicit global variable: s")
			.addIssue(6, 16, "Inefficient string concatenation in loop — consider using array.join() instead")
			.addIssue(8, 1, "Potential implicit global variable: s")
			.addIssue(9, 10, "Potential implicit global variable: s")
			.test(code);
	}

	@Test
	public void testUnusedVariable() {
		String[] code = {
			"let unused = 1;",
			"let used = 2;",
			"log(used);",
			"function f(param) { return 1; }"
		};

		th.addIssue(1, 5, "Unused variable: unused").test(code);

		assertEquals(th.getIssues().get(0).getKind(), IssueKind.PERFORMANCE);
		assertEquals(th.getIssues().get(0).getSeverity(), Severity.LOW);
	}

	@Test
	public void testUnusedVariableComparesNames() {
		String[] code = {
			"let x = 1;",
			"function g() { let x = 2; }",
			"const a = 1, b = a;"
		};

		th.addIssue(3, 14, "Unused variable: b").test(code);
	}

	@Test
	public void testFunctionSize() {
		th.addIssue(1, 1, "Function is too large (31 statements) — consider refactoring").test(functionWith(31));

		assertEquals(th.getIssues().get(0).getKind(), IssueKind.COMPLEXITY);
		assertEquals(th.getIssues().get(0).getSeverity(), Severity.MEDIUM);

		th.newTest("thirty statements are fine");
		th.test(functionWith(30));
	}

	@Test
	public void testFunctionSizeLimitOption() {
		th.addIssue(1, 1, "Function is too large (3 statements) — consider refactoring")
			.test(functionWith(3), new AnalyzerOptions().set(AnalyzerOptions.MAX_STATEMENTS, 2));

		th.newTest("rule turned off");
		th.test(functionWith(50), new AnalyzerOptions().set(AnalyzerOptions.FUNCTION_SIZE, false));
	}

	@Test
	public void testStatementCounting() {
		String code = "function f() { foo(); if (a) { b(); c(); } else d(); while (x) { e(); } "
			+ "function inner() { g(); h(); } { i(); } }";

		FunctionDeclaration function = (FunctionDeclaration) JSGuard.parse(code).getProgram().getBody().get(0);

		// foo 1, if 1+2+1, while 1+1, inner 1, bare block 1
		assertEquals(ComplexityRules.countStatements(function.getBody().getBody()), 9);
	}

	@Test
	public void testNestedFunctionsAreMeasuredSeparately() {
		List<String> lines = new ArrayList<String>();
		lines.add("function outer() {");
		for (String line : functionWith(31)) {
			lines.add("  " + line);
		}
		lines.add("}");

		th.addIssue(2, 3, "Function is too large (31 statements) — consider refactoring").test(lines.toArray(new String[0]));
	}

	@Test
	public void testDisabledRules() {
		AnalyzerOptions options = new AnalyzerOptions()
			.set(AnalyzerOptions.NO_VAR, false)
			.set(AnalyzerOptions.UNUSED_VARIABLE, false);

		th.addIssue(1, 9, "Unsafe use of eval() — can execute arbitrary code").test("var x = eval(\"1\");", options);
	}

	@Test
	public void testAllRulesDisabled() {
		AnalyzerOptions options = new AnalyzerOptions();
		for (String rule : AnalyzerOptions.getRules()) {
			options.set(rule, false);
		}

		th.test(new String[] {
			"var x = eval(\"1\");",
			"document.write(x == y);",
			"el.innerHTML = z;",
			"for (;;) { s += 'a'; }"
		}, options);
	}
}
