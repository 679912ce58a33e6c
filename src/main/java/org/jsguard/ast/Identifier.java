package org.jsguard.ast;

import java.util.Collections;
import java.util.List;

public final class Identifier extends Node
{
	private final String name;

	public Identifier(String name, int line, int column)
	{
		super(line, column);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	public static boolean isNamed(Node node, String name)
	{
		return node instanceof Identifier && ((Identifier) node).name.equals(name);
	}

	@Override
	public NodeType getType()
	{
		return NodeType.IDENTIFIER;
	}

	@Override
	public List<Node> getChildren()
	{
		return Collections.emptyList();
	}

	@Override
	public String toString()
	{
		return "Identifier(" + name + ", " + getLine() + ":" + getColumn() + ")";
	}
}
