package org.jsguard.utils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.jsguard.JSGuardException;
import org.jsguard.NodeContext;
import org.jsguard.NodeListener;
import org.jsguard.ast.NodeType;

/**
 * Listener registry keyed by node type. Listeners of one type run in the
 * order they were registered.
 */
public class EventEmitter
{
	Map<NodeType, List<NodeListener>> events = new EnumMap<NodeType, List<NodeListener>>(NodeType.class);

	public void on(NodeType type, NodeListener listener)
	{
		if (!events.containsKey(type))
		{
			events.put(type, new ArrayList<NodeListener>());
		}

		events.get(type).add(listener);
	}

	public void emit(NodeType type, NodeContext context) throws JSGuardException
	{
		if (events.containsKey(type))
		{
			for (NodeListener listener : events.get(type))
			{
				listener.accept(context);
			}
		}
	}
}
