package org.jsguard.reporters;

import java.util.List;

import org.jsguard.Issue;

public interface IssueReporter
{
	/**
	 * @param file name of the analyzed file, as given on the command line.
	 * @param issues issues of that file in analyzer order.
	 * @return the report text.
	 */
	public String generate(String file, List<Issue> issues);
}
