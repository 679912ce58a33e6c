package org.jsguard;

public enum TokenKind
{
	IDENTIFIER("(identifier)"),
	NUMBER("(number)"),
	STRING("(string)"),
	BOOLEAN("(boolean)"),
	NULL("(null)"),
	KEYWORD("(keyword)"),

	ASSIGNMENT("(assignment)"),
	ARITHMETIC("(arithmetic)"),
	COMPARISON("(comparison)"),
	LOGICAL("(logical)"),
	UNARY("(unary)"),

	SEMICOLON("';'"),
	COMMA("','"),
	DOT("'.'"),
	COLON("':'"),
	LPAREN("'('"),
	RPAREN("')'"),
	LBRACE("'{'"),
	RBRACE("'}'"),
	LBRACKET("'['"),
	RBRACKET("']'"),

	COMMENT("(comment)"),
	NEWLINE("(newline)"),
	EOF("(end)"),
	UNKNOWN("(unknown)");

	private final String value;
	TokenKind(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
