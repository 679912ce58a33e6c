package org.jsguard.ast;

import java.util.List;

public final class VariableDeclaration extends Node
{
	private final String kind;
	private final List<VariableDeclarator> declarations;

	/**
	 * @param kind one of {@code var}, {@code let} or {@code const}.
	 * @param declarations at least one declarator.
	 */
	public VariableDeclaration(String kind, List<VariableDeclarator> declarations, int line, int column)
	{
		super(line, column);
		this.kind = kind;
		this.declarations = freeze(declarations);
	}

	public String getKind()
	{
		return kind;
	}

	public List<VariableDeclarator> getDeclarations()
	{
		return declarations;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.VARIABLE_DECLARATION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(declarations);
	}
}
