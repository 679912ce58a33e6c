package org.jsguard.ast;

import java.util.List;

public final class FunctionDeclaration extends Node
{
	private final Identifier id;
	private final List<Identifier> params;
	private final BlockStatement body;

	public FunctionDeclaration(Identifier id, List<Identifier> params, BlockStatement body, int line, int column)
	{
		super(line, column);
		this.id = id;
		this.params = freeze(params);
		this.body = body;
	}

	public Identifier getId()
	{
		return id;
	}

	public List<Identifier> getParams()
	{
		return params;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.FUNCTION_DECLARATION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(id, params, body);
	}
}
