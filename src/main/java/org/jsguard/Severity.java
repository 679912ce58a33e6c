package org.jsguard;

public enum Severity
{
	HIGH("high"),
	MEDIUM("medium"),
	LOW("low");

	private final String value;
	Severity(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
