package org.jsguard.ast;

import java.util.List;

public final class AssignmentExpression extends Node
{
	private final String operator;
	private final Node left;
	private final Node right;

	public AssignmentExpression(String operator, Node left, Node right, int line, int column)
	{
		super(line, column);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getOperator()
	{
		return operator;
	}

	public Node getLeft()
	{
		return left;
	}

	public Node getRight()
	{
		return right;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.ASSIGNMENT_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(left, right);
	}
}
