package org.jsguard.ast;

import java.util.List;

public final class MemberExpression extends Node
{
	private final Node object;
	private final Node property;
	private final boolean computed;

	/**
	 * @param computed {@code true} for {@code obj[expr]}, {@code false} for
	 *        {@code obj.prop}.
	 */
	public MemberExpression(Node object, Node property, boolean computed, int line, int column)
	{
		super(line, column);
		this.object = object;
		this.property = property;
		this.computed = computed;
	}

	public Node getObject()
	{
		return object;
	}

	public Node getProperty()
	{
		return property;
	}

	public boolean isComputed()
	{
		return computed;
	}

	@Override
	public NodeType getType()
	{
		return NodeType.MEMBER_EXPRESSION;
	}

	@Override
	public List<Node> getChildren()
	{
		return children(object, property);
	}
}
