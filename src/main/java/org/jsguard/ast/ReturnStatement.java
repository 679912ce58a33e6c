package org.jsguard.ast;

import java.util.List;

public final class ReturnStatement extends Node
{
	private final Node argument;

	public ReturnStatement(Node argument, int line, int column)
	{
		super(line, column);
		this.argument = argument;
	}

	/**
	 * @return the returned expression, or {@code null} for a bare return.
	 */
	public Node getArgument()
	{
		return argument;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.RETURN_STATEMENT;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(argument);
	}
}
