package org.jsguard;

public enum IssueKind
{
	SECURITY("security"),
	ERROR("error"),
	PERFORMANCE("performance"),
	STYLE("style"),
	COMPLEXITY("complexity");

	private final String value;
	IssueKind(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
