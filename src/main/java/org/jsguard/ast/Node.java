package org.jsguard.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the syntax tree. Every node records the position of its
 * leftmost token and lists its child nodes in a fixed, node-specific order.
 * Nodes are immutable once the parser has built them.
 */
public abstract class Node
{
	private final int line;
	private final int column;

	protected Node(int line, int column)
	{
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public abstract NodeType getType();

	/**
	 * Child nodes in traversal order. Absent optional children are left out.
	 *
	 * @return unmodifiable list of the direct children of this node.
	 */
	public abstract List<Node> getChildren();

	public boolean is(NodeType type)
	{
		return getType() == type;
	}

	protected static List<Node> children(Object... parts)
	{
		List<Node> result = new ArrayList<Node>();
		for (Object part : parts)
		{
			if (part instanceof Node)
			{
				result.add((Node) part);
			}
			else if (part instanceof List)
			{
				for (Object item : (List<?>) part)
				{
					if (item instanceof Node)
					{
						result.add((Node) item);
					}
				}
			}
		}
		return Collections.unmodifiableList(result);
	}

	protected static <T extends Node> List<T> freeze(List<T> nodes)
	{
		return nodes != null ? Collections.unmodifiableList(new ArrayList<T>(nodes)) : Collections.<T>emptyList();
	}

	@Override
	public String toString()
	{
		return getType() + "(" + line + ":" + column + ")";
	}
}
