package org.jsguard.ast;

import java.util.List;

/**
 * A {@code for} loop. The parenthesized header is skipped by the parser,
 * only the loop body is kept.
 */
public final class ForStatement extends Node
{
	private final Node body;

	public ForStatement(Node body, int line, int column)
	{
		super(line, column);
		this.body = body;
	}

	public Node getBody()
	{
		return body;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.FOR_STATEMENT;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(body);
	}
}
