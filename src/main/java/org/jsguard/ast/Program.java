package org.jsguard.ast;

import java.util.List;

public final class Program extends Node
{
	private final List<Node> body;

	public Program(List<Node> body, int line, int column)
	{
		super(line, column);
		this.body = freeze(body);
	}

	public List<Node> getBody()
	{
		return body;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.PROGRAM;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(body);
	}
}
