package org.jsguard.reporters;

import java.util.List;

import org.jsguard.Issue;
import org.jsguard.IssueKind;
import org.jsguard.IssueSummary;
import org.jsguard.JSGuard;

public class DefaultReporter implements IssueReporter
{
	@Override
	public String generate(String file, List<Issue> issues)
	{
		StringBuilder str = new StringBuilder();

		str.append("Analysis Results:\n");
		str.append("----------------\n");
		str.append(JSGuard.formatIssues(issues)).append("\n");

		IssueSummary summary = JSGuard.summarize(issues);
		str.append("\nSummary:\n");
		str.append("Total issues: " + summary.getTotal() + "\n");

		for (IssueKind kind : IssueKind.values())
		{
			int count = summary.count(kind);
			if (count > 0)
			{
				str.append("- " + kind + ": " + count + "\n");
			}
		}

		return str.toString();
	}
}
