package org.jsguard.ast;

import java.util.List;

public final class ObjectExpression extends Node
{
	private final List<Property> properties;

	public ObjectExpression(List<Property> properties, int line, int column)
	{
		super(line, column);
		this.properties = freeze(properties);
	}

	public List<Property> getProperties()
	{
		return properties;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.OBJECT_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(properties);
	}
}
