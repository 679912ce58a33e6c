package org.jsguard;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

public final class Token
{
	private final TokenKind kind;
	private final String text;
	private final int line;
	private final int column;

	public Token(TokenKind kind, String text, int line, int column)
	{
		this.kind = kind;
		this.text = StringUtils.defaultString(text);
		this.line = line;
		this.column = column;
	}

	public TokenKind getKind()
	{
		return kind;
	}

	public String getText()
	{
		return text;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean is(TokenKind kind)
	{
		return this.kind == kind;
	}

	public boolean is(TokenKind kind, String text)
	{
		return this.kind == kind && this.text.equals(text);
	}

	/**
	 * Describes the token the way parser diagnostics quote it: the raw text
	 * in quotes, or the kind name for tokens without text.
	 */
	public String describe()
	{
		return kind == TokenKind.EOF ? kind.toString() : "'" + text + "'";
	}

	@Override
	public int hashCode()
	{
		return new HashCodeBuilder(17, 31) // two randomly chosen prime numbers
			.append(kind)
			.append(text)
			.append(line)
			.append(column)
			.toHashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof Token)) return false;
		if (obj == this) return true;

		Token other = (Token) obj;
		return new EqualsBuilder()
			.append(this.kind, other.kind)
			.append(this.text, other.text)
			.append(this.line, other.line)
			.append(this.column, other.column)
			.isEquals();
	}

	@Override
	public String toString()
	{
		return "Token(" + kind.name() + ", \"" + text + "\", " + line + ":" + column + ")";
	}
}
