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
import org.jsguard.ast.Literal;
import org.jsguard.ast.NodeType;
import org.jsguard.ast.VariableDeclarator;

public class PerformanceRules implements AnalyzerModule
{
	@Override
	public void execute(final Analyzer analyzer)
	{
		// s += "..." inside a while or for body
		analyzer.on(NodeType.ASSIGNMENT_EXPRESSION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.LOOP_CONCAT))
				{
					return;
				}

				AssignmentExpression assignment = (AssignmentExpression) context.getNode();
				if (assignment.getOperator().equals("+=") && Literal.isStringLiteral(assignment.getRight())
					&& context.hasAncestor(node -> node.getType().isLoop()))
				{
					context.report(IssueKind.PERFORMANCE, Severity.MEDIUM, "Inefficient string concatenation in loop — consider using array.join() instead");
				}
			}
		});

		// A declared name that no other Identifier in the program mentions.
		// Names are compared textually, shadowing is not taken into account.
		analyzer.on(NodeType.VARIABLE_DECLARATOR, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.UNUSED_VARIABLE))
				{
					return;
				}

				String name = ((VariableDeclarator) context.getNode()).getId().getName();

				// the declarator's own id is one of the occurrences
				if (context.countIdentifiers(name) <= 1)
				{
					context.report(IssueKind.PERFORMANCE, Severity.LOW, "Unused variable: " + name);
				}
			}
		});
	}
}
