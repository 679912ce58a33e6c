package org.jsguard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import org.jsguard.ast.Node;
import org.jsguard.ast.Program;

import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;

/**
 * What a rule listener sees of the traversal: the visited node, the chain of
 * its ancestors, the whole program and the analyzer options. Issues reported
 * through the context are stamped with the node position.
 *
 * A context is only valid while its listener runs.
 */
public class NodeContext
{
	private final Node node;
	private final List<Node> path;
	private final Program program;
	private final AnalyzerOptions options;
	private final Multiset<String> identifiers;
	private final List<Issue> issues;

	NodeContext(Node node, List<Node> path, Program program, AnalyzerOptions options, Multiset<String> identifiers, List<Issue> issues)
	{
		this.node = node;
		this.path = path;
		this.program = program;
		this.options = options;
		this.identifiers = identifiers;
		this.issues = issues;
	}

	public Node getNode()
	{
		return node;
	}

	public Program getProgram()
	{
		return program;
	}

	public AnalyzerOptions getOptions()
	{
		return options;
	}

	/**
	 * @return the parent of the visited node, or {@code null} at the root.
	 */
	public Node getParent()
	{
		return path.isEmpty() ? null : path.get(path.size() - 1);
	}

	/**
	 * @return ancestors of the visited node, nearest first.
	 */
	public List<Node> getAncestors()
	{
		return Collections.unmodifiableList(Lists.reverse(new ArrayList<Node>(path)));
	}

	public boolean hasAncestor(Predicate<Node> predicate)
	{
		for (Node ancestor : path)
		{
			if (predicate.test(ancestor))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @return how many Identifier nodes of the whole program carry this name.
	 */
	public int countIdentifiers(String name)
	{
		return identifiers.count(name);
	}

	public void report(IssueKind kind, Severity severity, String message)
	{
		issues.add(new Issue(kind, severity, message, node.getLine(), node.getColumn()));
	}
}
