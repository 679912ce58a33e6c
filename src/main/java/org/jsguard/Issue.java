package org.jsguard;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * One finding of the analyzer. Issues are plain values: two issues with the
 * same fields are equal.
 */
public final class Issue
{
	private final IssueKind kind;
	private final Severity severity;
	private final String message;
	private final int line;
	private final int column;

	public Issue(IssueKind kind, Severity severity, String message, int line, int column)
	{
		this.kind = kind;
		this.severity = severity;
		this.message = StringUtils.defaultString(message);
		this.line = line;
		this.column = column;
	}

	public IssueKind getKind()
	{
		return kind;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public String getMessage()
	{
		return message;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Renders the issue as {@code [SEVERITY] kind: message at line L, column C}.
	 */
	public String format()
	{
		return "[" + StringUtils.upperCase(severity.toString()) + "] " + kind + ": " + message
			+ " at line " + line + ", column " + column;
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder(17, 31) // two randomly chosen prime numbers
			.append(kind)
			.append(severity)
			.append(message)
			.append(line)
			.append(column)
			.toHashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof Issue)) return false;
		if (obj == this) return true;

		Issue other = (Issue) obj;
		return new EqualsBuilder()
			.append(this.kind, other.kind)
			.append(this.severity, other.severity)
			.append(this.message, other.message)
			.append(this.line, other.line)
			.append(this.column, other.column)
			.isEquals();
	}

	@Override
	public String toString()
	{
		return format();
	}
}
