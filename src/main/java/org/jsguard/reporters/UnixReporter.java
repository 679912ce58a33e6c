package org.jsguard.reporters;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.jsguard.Issue;

//Reporter that respects Unix output conventions
//frequently employed by preprocessors and compilers.
//The format is "FILENAME:LINE:COL: MESSAGE".

public class UnixReporter implements IssueReporter
{
	@Override
	public String generate(String file, List<Issue> issues)
	{
		int len = issues.size();
		StringBuilder str = new StringBuilder();

		for (Issue issue : issues)
		{
			str.append(file + ":" + issue.getLine() + ":" + issue.getColumn() + ": "
				+ "[" + StringUtils.upperCase(issue.getSeverity().toString()) + "] " + issue.getKind() + ": " + issue.getMessage());
			str.append("\n");
		}

		if (str.length() > 0)
		{
			str.append("\n" + len + " issue" + (len == 1 ? "" : "s") + "\n");
		}

		return str.toString();
	}
}
