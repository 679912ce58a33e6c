package org.jsguard;

/**
 * A group of rules. A module registers its listeners on the analyzer, one per
 * node type it inspects.
 */
public interface AnalyzerModule
{
	public void execute(Analyzer analyzer);
}
