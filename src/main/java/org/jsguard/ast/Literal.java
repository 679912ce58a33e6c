package org.jsguard.ast;

import java.util.Collections;
import java.util.List;

/**
 * A literal value: a {@link Double}, a {@link String}, a {@link Boolean} or
 * {@code null}. The raw token text is kept next to the value.
 */
public final class Literal extends Node
{
	private final Object value;
	private final String raw;

	public Literal(Object value, String raw, int line, int column)
	{
		super(line, column);
		this.value = value;
		this.raw = raw;
	}

	public Object getValue()
	{
		return value;
	}

	public String getRaw()
	{
		return raw;
	}

	public boolean isString()
	{
		return value instanceof String;
	}

	public static boolean isStringLiteral(Node node)
	{
		return node instanceof Literal && ((Literal) node).isString();
	}

	@Override
	public NodeType getType()
	{
		return NodeType.LITERAL;
	}

	@Override
	public List<Node> getChildren()
	{
		return Collections.emptyList();
	}
}
