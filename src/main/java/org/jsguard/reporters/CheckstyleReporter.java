package org.jsguard.reporters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.jsguard.Issue;

public class CheckstyleReporter implements IssueReporter
{
	private static final Map<String, String> pairs = new LinkedHashMap<String, String>();
	static
	{
		// & first, so the entities added by the other pairs are not escaped again
		pairs.put("&", "&amp;");
		pairs.put("\"", "&quot;");
		pairs.put("'", "&apos;");
		pairs.put("<", "&lt;");
		pairs.put(">", "&gt;");
	}

	private String encode(String s)
	{
		for (String r : pairs.keySet())
		{
			if (StringUtils.isNotEmpty(s))
			{
				s = StringUtils.replace(s, r, pairs.get(r));
			}
		}
		return s != null ? s : "";
	}

	private String severity(Issue issue)
	{
		switch (issue.getSeverity())
		{
		case HIGH:
			return "error";
		case MEDIUM:
			return "warning";
		default:
			return "info";
		}
	}

	@Override
	public String generate(String file, List<Issue> issues)
	{
		List<String> out = new ArrayList<String>();

		out.add("<?xml version=\"1.0\" encoding=\"utf-8\"?>");
		out.add("<checkstyle version=\"4.3\">");
		out.add("\t<file name=\"" + encode(StringUtils.removeStart(file, "./")) + "\">");

		for (Issue issue : issues)
		{
			out.add(
				"\t\t<error " +
				"line=\"" + issue.getLine() + "\" " +
				"column=\"" + issue.getColumn() + "\" " +
				"severity=\"" + severity(issue) + "\" " +
				"message=\"" + encode(issue.getMessage()) + "\" " +
				"source=\"" + encode("jsguard." + issue.getKind()) + "\" " +
				"/>"
			);
		}

		out.add("\t</file>");
		out.add("</checkstyle>");

		return StringUtils.join(out, "\n") + "\n";
	}
}
