package org.jsguard.rules;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.jsguard.Analyzer;
import org.jsguard.AnalyzerModule;
import org.jsguard.AnalyzerOptions;
import org.jsguard.IssueKind;
import org.jsguard.JSGuardException;
import org.jsguard.NodeContext;
import org.jsguard.NodeListener;
import org.jsguard.Severity;
import org.jsguard.ast.CallExpression;
import org.jsguard.ast.Identifier;
import org.jsguard.ast.Literal;
import org.jsguard.ast.MemberExpression;
import org.jsguard.ast.Node;
import org.jsguard.ast.NodeType;

/**
 * Code injection, XSS and transport security checks.
 */
public class SecurityRules implements AnalyzerModule
{
	private static final String[] CODE_EVALUATORS = {"eval", "Function", "execScript"};
	private static final String[] TIMERS = {"setTimeout", "setInterval"};
	private static final String[] HTML_SINKS = {"innerHTML", "outerHTML"};
	private static final String[] DOCUMENT_WRITERS = {"write", "writeln"};

	private static String calleeName(CallExpression call)
	{
		return call.getCallee() instanceof Identifier ? ((Identifier) call.getCallee()).getName() : null;
	}

	private static String propertyName(Node node)
	{
		if (!(node instanceof MemberExpression))
		{
			return null;
		}

		Node property = ((MemberExpression) node).getProperty();
		return property instanceof Identifier ? ((Identifier) property).getName() : null;
	}

	@Override
	public void execute(final Analyzer analyzer)
	{
		// Calls that turn a string into code: eval("..."), Function("...")
		analyzer.on(NodeType.CALL_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.UNSAFE_EVAL))
				{
					return;
				}

				String name = calleeName((CallExpression) context.getNode());
				if (ArrayUtils.contains(CODE_EVALUATORS, name))
				{
					context.report(IssueKind.SECURITY, Severity.HIGH, "Unsafe use of " + name + "() — can execute arbitrary code");
				}
			}
		});

		// Timers evaluate a string first argument the same way eval does
		analyzer.on(NodeType.CALL_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.STRING_TIMER))
				{
					return;
				}

				CallExpression call = (CallExpression) context.getNode();
				String name = calleeName(call);
				if (ArrayUtils.contains(TIMERS, name) && Literal.isStringLiteral(call.getArgument(0)))
				{
					context.report(IssueKind.SECURITY, Severity.HIGH, "Unsafe use of " + name + " with string argument — similar to eval()");
				}
			}
		});

		// Raw HTML sinks, read or written
		analyzer.on(NodeType.MEMBER_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.HTML_INJECTION))
				{
					return;
				}

				String name = propertyName(context.getNode());
				if (ArrayUtils.contains(HTML_SINKS, name))
				{
					context.report(IssueKind.SECURITY, Severity.HIGH, "Potential XSS vulnerability using " + name);
				}
			}
		});

		// document.write(...) and document.writeln(...)
		analyzer.on(NodeType.CALL_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.DOCUMENT_WRITE))
				{
					return;
				}

				Node callee = ((CallExpression) context.getNode()).getCallee();
				String name = propertyName(callee);
				if (ArrayUtils.contains(DOCUMENT_WRITERS, name) && Identifier.isNamed(((MemberExpression) callee).getObject(), "document"))
				{
					context.report(IssueKind.SECURITY, Severity.HIGH, "Insecure use of document." + name + "() — can enable XSS attacks");
				}
			}
		});

		// xhr.open("GET", "http://...")
		analyzer.on(NodeType.CALL_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.INSECURE_HTTP))
				{
					return;
				}

				CallExpression call = (CallExpression) context.getNode();
				Node url = call.getArgument(1);
				if ("open".equals(propertyName(call.getCallee())) && Literal.isStringLiteral(url)
					&& StringUtils.startsWith((String) ((Literal) url).getValue(), "http://"))
				{
					context.report(IssueKind.SECURITY, Severity.MEDIUM, "Using insecure HTTP protocol instead of HTTPS");
				}
			}
		});
	}
}
