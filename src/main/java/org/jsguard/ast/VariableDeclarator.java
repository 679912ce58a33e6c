package org.jsguard.ast;

import java.util.List;

public final class VariableDeclarator extends Node
{
	private final Identifier id;
	private final Node init;

	public VariableDeclarator(Identifier id, Node init, int line, int column)
	{
		super(line, column);
		this.id = id;
		this.init = init;
	}

	public Identifier getId()
	{
		return id;
	}

	/**
	 * @return the initializer, or {@code null} for a bare declaration.
	 */
	public Node getInit()
	{
		return init;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.VARIABLE_DECLARATOR;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(id, init);
	}
}
