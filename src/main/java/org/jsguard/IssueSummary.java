package org.jsguard;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Aggregate counts over an issue list: the total, and the number of issues per
 * severity and per kind. Every severity and kind is present, with zero when no
 * issue has it.
 */
public class IssueSummary
{
	private final int total;
	private final Map<Severity, Integer> bySeverity;
	private final Map<IssueKind, Integer> byKind;

	public IssueSummary(List<Issue> issues)
	{
		Map<Severity, Integer> severities = new EnumMap<Severity, Integer>(Severity.class);
		for (Severity s : Severity.values())
		{
			severities.put(s, 0);
		}

		Map<IssueKind, Integer> kinds = new EnumMap<IssueKind, Integer>(IssueKind.class);
		for (IssueKind k : IssueKind.values())
		{
			kinds.put(k, 0);
		}

		int count = 0;
		if (issues != null)
		{
			for (Issue issue : issues)
			{
				severities.merge(issue.getSeverity(), 1, Integer::sum);
				kinds.merge(issue.getKind(), 1, Integer::sum);
				count++;
			}
		}

		this.total = count;
		this.bySeverity = Collections.unmodifiableMap(severities);
		this.byKind = Collections.unmodifiableMap(kinds);
	}

	public int getTotal()
	{
		return total;
	}

	public Map<Severity, Integer> getBySeverity()
	{
		return bySeverity;
	}

	public Map<IssueKind, Integer> getByKind()
	{
		return byKind;
	}

	public int count(Severity severity)
	{
		return bySeverity.get(severity);
	}

	public int count(IssueKind kind)
	{
		return byKind.get(kind);
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder(17, 31) // two randomly chosen prime numbers
			.append(total)
			.append(bySeverity)
			.append(byKind)
			.toHashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof IssueSummary)) return false;
		if (obj == this) return true;

		IssueSummary other = (IssueSummary) obj;
		return new EqualsBuilder()
			.append(this.total, other.total)
			.append(this.bySeverity, other.bySeverity)
			.append(this.byKind, other.byKind)
			.isEquals();
	}

	@Override
	public String toString()
	{
		return "IssueSummary(total=" + total + ", bySeverity=" + bySeverity + ", byKind=" + byKind + ")";
	}
}
