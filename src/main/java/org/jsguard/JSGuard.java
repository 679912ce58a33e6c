package org.jsguard;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.jsguard.ast.Program;

/**
 * Entry points of the analysis pipeline: source text to tokens, tokens to a
 * syntax tree, tree to issues, issues to a report.
 *
 * <pre>
 *   ParseResult result = JSGuard.parse(source);
 *   List&lt;Issue&gt; issues = JSGuard.analyze(result.getProgram());
 *   System.out.println(JSGuard.formatIssues(issues));
 * </pre>
 *
 * None of these methods throws on bad input, and none keeps state between
 * calls.
 */
public final class JSGuard
{
	public static final String NO_ISSUES = "No issues detected.";

	private JSGuard() {}

	/**
	 * @return every token of the source, comments and newlines included,
	 *         ending with one EOF token.
	 */
	public static List<Token> tokenize(String source)
	{
		return new Lexer(source).tokenize();
	}

	public static ParseResult parse(String source)
	{
		return parse(tokenize(source));
	}

	public static ParseResult parse(List<Token> tokens)
	{
		return new Parser(tokens).parse();
	}

	public static List<Issue> analyze(Program program)
	{
		return analyze(program, null);
	}

	public static List<Issue> analyze(Program program, AnalyzerOptions options)
	{
		return new Analyzer(options).analyze(program);
	}

	/**
	 * Parses and analyzes in one step. Syntax errors are dropped; use
	 * {@link #parse(String)} to see them.
	 */
	public static List<Issue> analyze(String source)
	{
		return analyze(parse(source).getProgram());
	}

	/**
	 * One line per issue in the form
	 * {@code [SEVERITY] kind: message at line L, column C}, or
	 * {@value #NO_ISSUES} for an empty list.
	 */
	public static String formatIssues(List<Issue> issues)
	{
		if (issues == null || issues.isEmpty())
		{
			return NO_ISSUES;
		}

		List<String> lines = new ArrayList<String>();
		for (Issue issue : issues)
		{
			lines.add(issue.format());
		}

		return StringUtils.join(lines, "\n");
	}

	public static IssueSummary summarize(List<Issue> issues)
	{
		return new IssueSummary(issues);
	}
}
