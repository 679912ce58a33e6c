package org.jsguard;

import org.apache.commons.lang3.StringUtils;

public class JSGuardException extends RuntimeException
{
	private static final long serialVersionUID = -2398758215833728845L;

	private final int line;
	private final int column;

	public JSGuardException(String message)
	{
		this(message, 0, 0);
	}

	public JSGuardException(String message, int line, int column)
	{
		super(StringUtils.defaultString(message));
		this.line = line;
		this.column = column;
	}

	public JSGuardException(String message, Throwable cause)
	{
		super(StringUtils.defaultString(message), cause);
		this.line = 0;
		this.column = 0;
	}

	/**
	 * @return source line the failure refers to, or 0 when it has no position.
	 */
	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
