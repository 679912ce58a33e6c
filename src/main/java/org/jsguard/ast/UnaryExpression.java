package org.jsguard.ast;

import java.util.List;

public final class UnaryExpression extends Node
{
	private final String operator;
	private final Node argument;
	private final boolean prefix;

	public UnaryExpression(String operator, Node argument, boolean prefix, int line, int column)
	{
		super(line, column);
		this.operator = operator;
		this.argument = argument;
		this.prefix = prefix;
	}

	public String getOperator()
	{
		return operator;
	}

	public Node getArgument()
	{
		return argument;
	}

	/**
	 * @return {@code false} only for a trailing {@code ++} or {@code --}.
	 */
	public boolean isPrefix()
	{
		return prefix;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.UNARY_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(argument);
	}
}
