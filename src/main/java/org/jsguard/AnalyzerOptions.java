package org.jsguard;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

/**
 * Option table of the analyzer. Each rule has a boolean option that is on
 * unless set to {@code false}; {@code maxstatements} is the statement limit
 * of the function size rule. An empty table reproduces the default rule
 * catalog.
 */
public class AnalyzerOptions implements Iterable<String>
{
	public static final String UNSAFE_EVAL = "unsafe-eval";
	public static final String STRING_TIMER = "string-timer";
	public static final String HTML_INJECTION = "html-injection";
	public static final String DOCUMENT_WRITE = "document-write";
	public static final String INSECURE_HTTP = "insecure-http";
	public static final String LOOSE_EQUALITY = "loose-equality";
	public static final String IMPLICIT_GLOBAL = "implicit-global";
	public static final String NO_VAR = "no-var";
	public static final String LOOP_CONCAT = "loop-concat";
	public static final String FUNCTION_SIZE = "function-size";
	public static final String UNUSED_VARIABLE = "unused-variable";
	public static final String MAX_STATEMENTS = "maxstatements";

	public static final int DEFAULT_MAX_STATEMENTS = 30;

	private static final Set<String> RULES = ImmutableSet.of(
		UNSAFE_EVAL, STRING_TIMER, HTML_INJECTION, DOCUMENT_WRITE, INSECURE_HTTP,
		LOOSE_EQUALITY, IMPLICIT_GLOBAL, NO_VAR, LOOP_CONCAT, FUNCTION_SIZE, UNUSED_VARIABLE
	);

	private Map<String, Object> table;

	public AnalyzerOptions()
	{

	}

	public AnalyzerOptions(AnalyzerOptions original)
	{
		if (original != null && original.table != null)
		{
			table = new LinkedHashMap<String, Object>(original.table);
		}
	}

	private void initTable()
	{
		if (table == null)
		{
			table = new LinkedHashMap<String, Object>();
		}
	}

	public static boolean isRule(String name)
	{
		return RULES.contains(name);
	}

	public static boolean isOption(String name)
	{
		return isRule(name) || MAX_STATEMENTS.equals(name);
	}

	public static Set<String> getRules()
	{
		return RULES;
	}

	public AnalyzerOptions set(String name, boolean value) throws JSGuardException
	{
		if (!isOption(name))
		{
			throw unknownOption(name);
		}
		if (!isRule(name))
		{
			throw badOption(name, value);
		}

		initTable();
		table.put(name, value);
		return this;
	}

	public AnalyzerOptions set(String name, int value) throws JSGuardException
	{
		if (!isOption(name))
		{
			throw unknownOption(name);
		}
		if (!MAX_STATEMENTS.equals(name) || value < 0)
		{
			throw badOption(name, value);
		}

		initTable();
		table.put(name, value);
		return this;
	}

	public AnalyzerOptions remove(String name)
	{
		if (table != null)
		{
			table.remove(name);
		}

		return this;
	}

	public boolean hasOption(String name)
	{
		return table != null && table.containsKey(name);
	}

	/**
	 * @return {@code true} unless the rule option was explicitly turned off.
	 */
	public boolean isEnabled(String rule)
	{
		return !hasOption(rule) || (Boolean) table.get(rule);
	}

	public int getMaxStatements()
	{
		return hasOption(MAX_STATEMENTS) ? (Integer) table.get(MAX_STATEMENTS) : DEFAULT_MAX_STATEMENTS;
	}

	@Override
	public Iterator<String> iterator()
	{
		return table != null ? Collections.unmodifiableSet(table.keySet()).iterator() : Collections.<String>emptyIterator();
	}

	private static JSGuardException unknownOption(String name)
	{
		return new JSGuardException("Bad option: '" + name + "'.");
	}

	private static JSGuardException badOption(String name, Object value)
	{
		return new JSGuardException("Bad option value: '" + name + "' = '" + value + "'.");
	}

	// CONFIG LOADING

	/**
	 * Reads options from a flat map, as produced by a JSON or YAML config
	 * file. Booleans and integers may also be given as strings.
	 *
	 * @param config option names mapped to values; {@code null} means no options.
	 * @return the options.
	 * @throws JSGuardException if a name is unknown or a value has the wrong type.
	 */
	public static AnalyzerOptions fromMap(Map<?, ?> config) throws JSGuardException
	{
		AnalyzerOptions options = new AnalyzerOptions();
		if (config == null)
		{
			return options;
		}

		for (Map.Entry<?, ?> entry : config.entrySet())
		{
			String name = String.valueOf(entry.getKey());
			Object value = entry.getValue();

			if (isRule(name))
			{
				Boolean flag = value instanceof Boolean ? (Boolean) value : BooleanUtils.toBooleanObject(StringUtils.trimToNull(String.valueOf(value)));
				if (flag == null)
				{
					throw badOption(name, value);
				}
				options.set(name, flag);
			}
			else if (MAX_STATEMENTS.equals(name))
			{
				Integer limit = value instanceof Integer ? (Integer) value : Ints.tryParse(StringUtils.trimToEmpty(String.valueOf(value)));
				if (limit == null)
				{
					throw badOption(name, value);
				}
				options.set(name, limit);
			}
			else
			{
				throw unknownOption(name);
			}
		}

		return options;
	}

	/**
	 * Parses a JSON or YAML config document. An empty document yields the
	 * default options.
	 *
	 * @throws JSGuardException if the document is malformed, is not a map, or
	 *         holds a bad option.
	 */
	public static AnalyzerOptions load(String text) throws JSGuardException
	{
		Object config;
		try
		{
			config = new Yaml(new SafeConstructor(new LoaderOptions())).load(StringUtils.defaultString(text));
		}
		catch (YAMLException e)
		{
			throw new JSGuardException("Can't parse config: " + e.getMessage(), e);
		}

		if (config == null)
		{
			return new AnalyzerOptions();
		}

		if (!(config instanceof Map))
		{
			throw new JSGuardException("Config must be a map of option names to values.");
		}

		return fromMap((Map<?, ?>) config);
	}
}
