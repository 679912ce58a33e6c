package org.jsguard.rules;

import org.jsguard.Analyzer;
import org.jsguard.AnalyzerModule;
import org.jsguard.AnalyzerOptions;
import org.jsguard.IssueKind;
import org.jsguard.JSGuardException;
import org.jsguard.NodeContext;
import org.jsguard.NodeListener;
import org.jsguard.Severity;
import org.jsguard.ast.NodeType;
import org.jsguard.ast.VariableDeclaration;

public class StyleRules implements AnalyzerModule
{
	@Override
	public void execute(final Analyzer analyzer)
	{
		// var declarations
		analyzer.on(NodeType.VARIABLE_DECLARATION, new NodeListener()
		{
			@Override
			public void accept(NodeContext context) throws JSGuardException
			{
				if (!context.getOptions().isEnabled(AnalyzerOptions.NO_VAR))
				{
					return;
				}

				if (((VariableDeclaration) context.getNode()).getKind().equals("var"))
				{
					context.report(IssueKind.STYLE, Severity.MEDIUM, "Use of 'var' keyword — consider using 'let' or 'const' instead");
				}
			}
		});
	}
}
