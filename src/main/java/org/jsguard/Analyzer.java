package org.jsguard;

import java.util.ArrayList;
import java.util.List;

import org.jsguard.ast.Identifier;
import org.jsguard.ast.Node;
import org.jsguard.ast.NodeType;
import org.jsguard.ast.Program;
import org.jsguard.rules.ComplexityRules;
import org.jsguard.rules.ErrorRules;
import org.jsguard.rules.PerformanceRules;
import org.jsguard.rules.SecurityRules;
import org.jsguard.rules.StyleRules;
import org.jsguard.utils.EventEmitter;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/*
 * Rule-based analyzer.
 *
 * The analyzer walks the tree once, depth first and in pre-order, and emits
 * every visited node to the listeners registered for its type. Rule modules
 * are registered in catalog order (security, error, style, performance,
 * complexity), so issues of one node come out in that order too.
 *
 *   List<Issue> issues = new Analyzer().analyze(program);
 *
 * The tree is never modified and no state survives an analyze() call, so an
 * analyzer may be reused and two analyzers may run in parallel.
 */
public class Analyzer
{
	private final EventEmitter emitter = new EventEmitter();
	private final List<AnalyzerModule> modules = new ArrayList<AnalyzerModule>();
	private final AnalyzerOptions options;

	public Analyzer()
	{
		this(null);
	}

	public Analyzer(AnalyzerOptions options)
	{
		this.options = new AnalyzerOptions(options);

		addModule(new SecurityRules());
		addModule(new ErrorRules());
		addModule(new StyleRules());
		addModule(new PerformanceRules());
		addModule(new ComplexityRules());
	}

	public AnalyzerOptions getOptions()
	{
		return options;
	}

	public void on(NodeType type, NodeListener listener)
	{
		emitter.on(type, listener);
	}

	// Modules.
	public void addModule(AnalyzerModule module)
	{
		modules.add(module);
		module.execute(this);
	}

	public List<AnalyzerModule> getModules()
	{
		return new ArrayList<AnalyzerModule>(modules);
	}

	public List<Issue> analyze(Program program)
	{
		List<Issue> issues = new ArrayList<Issue>();
		if (program == null)
		{
			return issues;
		}

		Multiset<String> identifiers = HashMultiset.create();
		collectIdentifiers(program, identifiers);

		walk(program, new ArrayList<Node>(), program, identifiers, issues);
		return issues;
	}

	private void walk(Node node, List<Node> path, Program program, Multiset<String> identifiers, List<Issue> issues)
	{
		emitter.emit(node.getType(), new NodeContext(node, path, program, options, identifiers, issues));

		path.add(node);
		for (Node child : node.getChildren())
		{
			walk(child, path, program, identifiers, issues);
		}
		path.remove(path.size() - 1);
	}

	private static void collectIdentifiers(Node node, Multiset<String> identifiers)
	{
		if (node instanceof Identifier)
		{
			identifiers.add(((Identifier) node).getName());
		}

		for (Node child : node.getChildren())
		{
			collectIdentifiers(child, identifiers);
		}
	}
}
