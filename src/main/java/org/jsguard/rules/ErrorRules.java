package org.jsguard.rules;

import org.jsguard.Analyzer;
import org.jsguard.AnalyzerModule;
import org.jsguard.AnalyzerOptions;
import org.jsguard.IssueKind;
import org.jsguard.JSGuardException;
import org.jsguard.NodeContext;
import org.jsguard.NodeListener;
import org.jsguard.Severity;
import org.jsguard.ast.AssignmentExpression;
import org.jsguard.ast.BinaryExpression;
import org.jsguard.ast.Identifier;
import org.jsguard.ast.NodeType;

/**
 * Likely coding errors: coercing comparisons and assignments to undeclared
 * names.
 */
public class ErrorRules implements AnalyzerModule
{
	@Override
	public void execute(final Analyzer analyzer)
	{
		// == and != coerce their operands
		analyzer.on(NodeType.BINARY_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.LOOSE_EQUALITY))
				{
					return;
				}

				String operator = ((BinaryExpression) context.getNode()).getOperator();
				if (operator.equals("==") || operator.equals("!="))
				{
					context.report(IssueKind.ERROR, Severity.MEDIUM, "Unsafe equality comparison using " + operator + " instead of " + operator + "=");
				}
			}
		});

		// There is no scope table: every assignment to a bare name is reported,
		// declared or not.
		analyzer.on(NodeType.ASSIGNMENT_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.IMPLICIT_GLOBAL))
				{
					return;
				}

				AssignmentExpression assignment = (AssignmentExpression) context.getNode();
				if (assignment.getLeft() instanceof Identifier)
				{
					context.report(IssueKind.ERROR, Severity.HIGH, "Potential implicit global variable: " + ((Identifier) assignment.getLeft()).getName());
				}
			}
		});
	}
}
