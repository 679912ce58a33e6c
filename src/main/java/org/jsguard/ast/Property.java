package org.jsguard.ast;

import java.util.List;

/**
 * One {@code key: value} entry of an object literal. The key is an
 * {@link Identifier} or a {@link Literal}.
 */
public final class Property extends Node
{
	private final Node key;
	private final Node value;

	public Property(Node key, Node value, int line, int column)
	{
		super(line, column);
		this.key = key;
		this.value = value;
	}

	public Node getKey()
	{
		return key;
	}

	public Node getValue()
	{
		return value;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.PROPERTY;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(key, value);
	}
}
