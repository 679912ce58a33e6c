package org.jsguard.rules;

import java.util.List;

import org.jsguard.Analyzer;
import org.jsguard.AnalyzerModule;
import org.jsguard.AnalyzerOptions;
import org.jsguard.IssueKind;
import org.jsguard.JSGuardException;
import org.jsguard.NodeContext;
import org.jsguard.NodeListener;
import org.jsguard.Severity;
import org.jsguard.ast.BlockStatement;
import org.jsguard.ast.ForStatement;
import org.jsguard.ast.FunctionDeclaration;
import org.jsguard.ast.IfStatement;
import org.jsguard.ast.Node;
import org.jsguard.ast.NodeType;
import org.jsguard.ast.WhileStatement;

public class ComplexityRules implements AnalyzerModule
{
	/**
	 * Counts the statements of a list, descending into nested blocks and into
	 * the bodies of if/else and loops. A block is not a statement of its own;
	 * a nested function declaration counts once, its body belongs to that
	 * function.
	 *
	 * @param statements statement nodes of one block.
	 * @return number of statements.
	 */
	public static int countStatements(List<Node> statements)
	{
		int count = 0;
		for (Node statement : statements)
		{
			count += countStatements(statement);
		}
		return count;
	}

	private static int countStatements(Node statement)
	{
		if (statement == null)
		{
			return 0;
		}

		switch (statement.getType())
		{
		case BLOCK_STATEMENT:
			return countStatements(((BlockStatement) statement).getBody());
		case IF_STATEMENT:
			IfStatement ifStatement = (IfStatement) statement;
			return 1 + countStatements(ifStatement.getConsequent()) + countStatements(ifStatement.getAlternate());
		case WHILE_STATEMENT:
			return 1 + countStatements(((WhileStatement) statement).getBody());
		case FOR_STATEMENT:
			return 1 + countStatements(((ForStatement) statement).getBody());
		default:
			return 1;
		}
	}

	@Override
	public void execute(final Analyzer analyzer)
	{
		analyzer.on(NodeType.FUNCTION_DECLARATION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.FUNCTION_SIZE))
				{
					return;
				}

				FunctionDeclaration function = (FunctionDeclaration) context.getNode();
				int count = countStatements(function.getBody().getBody());

				if (count > context.getOptions().getMaxStatements())
				{
					context.report(IssueKind.COMPLEXITY, Severity.MEDIUM, "Function is too large (" + count + " statements) — consider refactoring");
				}
			}
		});
	}
}
