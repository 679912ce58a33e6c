package org.jsguard.ast;

import java.util.List;

public final class ExpressionStatement extends Node
{
	private final Node expression;

	public ExpressionStatement(Node expression, int line, int column)
	{
		super(line, column);
		this.expression = expression;
	}

	public Node getExpression()
	{
		return expression;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.EXPRESSION_STATEMENT;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(expression);
	}
}
