package org.jsguard.ast;

import java.util.List;

public final class ArrayExpression extends Node
{
	private final List<Node> elements;

	public ArrayExpression(List<Node> elements, int line, int column)
	{
		super(line, column);
		this.elements = freeze(elements);
	}

	public List<Node> getElements()
	{
		return elements;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.ARRAY_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(elements);
	}
}
