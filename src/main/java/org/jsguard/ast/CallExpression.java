package org.jsguard.ast;

import java.util.List;

public final class CallExpression extends Node
{
	private final Node callee;
	private final List<Node> arguments;

	public CallExpression(Node callee, List<Node> arguments, int line, int column)
	{
		super(line, column);
		this.callee = callee;
		this.arguments = freeze(arguments);
	}

	public Node getCallee()
	{
		return callee;
	}

	public List<Node> getArguments()
	{
		return arguments;
	}

	/**
	 * @return the argument at the given index, or {@code null} if the call has
	 *         fewer arguments.
	 */
	public Node getArgument(int index)
	{
		return index < arguments.size() ? arguments.get(index) : null;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.CALL_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(callee, arguments);
	}
}
