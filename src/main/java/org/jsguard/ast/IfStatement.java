package org.jsguard.ast;

import java.util.List;

public final class IfStatement extends Node
{
	private final Node test;
	private final Node consequent;
	private final Node alternate;

	public IfStatement(Node test, Node consequent, Node alternate, int line, int column)
	{
		super(line, column);
		this.test = test;
		this.consequent = consequent;
		this.alternate = alternate;
	}

	public Node getTest()
	{
		return test;
	}

	public Node getConsequent()
	{
		return consequent;
	}

	public Node getAlternate()
	{
		return alternate;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.IF_STATEMENT;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(test, consequent, alternate);
	}
}
