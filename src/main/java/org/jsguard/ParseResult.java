package org.jsguard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jsguard.ast.Program;

/**
 * Outcome of a parse: the program built from every statement that parsed
 * cleanly, and one message per recovered syntax error.
 */
public class ParseResult
{
	private final Program program;
	private final List<String> errors;

	public ParseResult(Program program, List<String> errors)
	{
		this.program = program;
		this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<String>(errors)) : Collections.<String>emptyList();
	}

	public Program getProgram()
	{
		return program;
	}

	public List<String> getErrors()
	{
		return errors;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}
}
