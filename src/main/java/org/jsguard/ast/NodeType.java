package org.jsguard.ast;

public enum NodeType
{
	PROGRAM("Program"),

	VARIABLE_DECLARATION("VariableDeclaration"),
	VARIABLE_DECLARATOR("VariableDeclarator"),
	FUNCTION_DECLARATION("FunctionDeclaration"),
	BLOCK_STATEMENT("BlockStatement"),
	EXPRESSION_STATEMENT("ExpressionStatement"),
	RETURN_STATEMENT("ReturnStatement"),
	IF_STATEMENT("IfStatement"),
	WHILE_STATEMENT("WhileStatement"),
	FOR_STATEMENT("ForStatement"),

	BINARY_EXPRESSION("BinaryExpression"),
	UNARY_EXPRESSION("UnaryExpression"),
	ASSIGNMENT_EXPRESSION("AssignmentExpression"),
	CALL_EXPRESSION("CallExpression"),
	MEMBER_EXPRESSION("MemberExpression"),
	IDENTIFIER("Identifier"),
	LITERAL("Literal"),
	ARRAY_EXPRESSION("ArrayExpression"),
	OBJECT_EXPRESSION("ObjectExpression"),
	PROPERTY("Property");

	private final String value;
	NodeType(String value)
	{
		this.value = value;
	}

	public boolean isLoop()
	{
		return this == WHILE_STATEMENT || this == FOR_STATEMENT;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
