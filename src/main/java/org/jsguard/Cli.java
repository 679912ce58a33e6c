package org.jsguard;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.jsguard.reporters.CheckstyleReporter;
import org.jsguard.reporters.DefaultReporter;
import org.jsguard.reporters.IssueReporter;
import org.jsguard.reporters.UnixReporter;
import org.jsguard.utils.IOUtils;

/**
 * Command line front end: analyzes one file and prints or saves the report.
 *
 * <pre>
 *   jsguard [options] &lt;file&gt;
 * </pre>
 *
 * Findings never change the exit code. The tool exits with 1 only when the
 * arguments are wrong or a file or the config cannot be read or written.
 */
public class Cli
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;

	private static final String USAGE = "jsguard [options] <file>";

	private static final Map<String, IssueReporter> REPORTERS;
	static
	{
		Map<String, IssueReporter> reporters = new LinkedHashMap<String, IssueReporter>();
		reporters.put("default", new DefaultReporter());
		reporters.put("unix", new UnixReporter());
		reporters.put("checkstyle", new CheckstyleReporter());
		REPORTERS = Collections.unmodifiableMap(reporters);
	}

	private IOUtils.PathUtils path = IOUtils.getPathUtils();
	private IOUtils.ShellUtils shell = IOUtils.getShellUtils();
	private IOUtils.CliUtils cli = IOUtils.getCliUtils();

	public static void main(String... args)
	{
		Cli cli = new Cli();
		cli.exit(cli.interpret(args));
	}

	protected void setPathUtils(IOUtils.PathUtils path)
	{
		this.path = path;
	}

	protected void setShellUtils(IOUtils.ShellUtils shell)
	{
		this.shell = shell;
	}

	protected void setCliUtils(IOUtils.CliUtils cli)
	{
		this.cli = cli;
	}

	public void exit(int code)
	{
		System.exit(code);
	}

	protected Options getOptions()
	{
		Options options = new Options();

		options.addOption(Option.builder("o").longOpt("output").hasArg().argName("FILE")
			.desc("Write the report to FILE instead of standard output").build());
		options.addOption(Option.builder("c").longOpt("config").hasArg().argName("FILE")
			.desc("Read analyzer options from a JSON or YAML file").build());
		options.addOption(Option.builder("r").longOpt("reporter").hasArg().argName("NAME")
			.desc("Report format: " + StringUtils.join(REPORTERS.keySet(), ", ") + " (default: default)").build());
		options.addOption(Option.builder("h").longOpt("help").desc("Display this help").build());

		return options;
	}

	/**
	 * Runs the tool for one command line.
	 *
	 * @param args command line arguments, without the program name.
	 * @return the exit code.
	 */
	public int interpret(String... args)
	{
		Options options = getOptions();
		CommandLine cmd;

		try
		{
			cmd = cli.parse(options, args);
		}
		catch (ParseException e)
		{
			cli.error(e.getMessage());
			cli.error(cli.usage(USAGE, options));
			return EXIT_FAILURE;
		}

		if (cmd.hasOption("help"))
		{
			cli.print(cli.usage(USAGE, options));
			return EXIT_OK;
		}

		List<String> files = cmd.getArgList();
		if (files.size() != 1)
		{
			cli.error(files.isEmpty() ? "No file to analyze." : "Only one file can be analyzed at a time.");
			cli.error(cli.usage(USAGE, options));
			return EXIT_FAILURE;
		}

		String reporterName = cmd.getOptionValue("reporter", "default");
		IssueReporter reporter = REPORTERS.get(reporterName);
		if (reporter == null)
		{
			cli.error("Can't load reporter '" + reporterName + "'. Expected one of: " + StringUtils.join(REPORTERS.keySet(), ", ") + ".");
			return EXIT_FAILURE;
		}

		RunOptions opts = new RunOptions(files.get(0), reporter);
		opts.setOutput(cmd.getOptionValue("output"));

		if (cmd.hasOption("config"))
		{
			AnalyzerOptions config = loadConfig(cmd.getOptionValue("config"));
			if (config == null)
			{
				return EXIT_FAILURE;
			}
			opts.setConfig(config);
		}

		return run(opts) ? EXIT_OK : EXIT_FAILURE;
	}

	/**
	 * Reads and parses a config file, reporting any failure on the error
	 * stream.
	 *
	 * @return the options, or {@code null} when the config is unusable.
	 */
	public AnalyzerOptions loadConfig(String fp)
	{
		String file = path.resolve(fp);
		if (!shell.exists(file) || shell.isDirectory(file))
		{
			cli.error("Can't find config file: " + fp);
			return null;
		}

		try
		{
			return AnalyzerOptions.load(shell.cat(file));
		}
		catch (IOException e)
		{
			cli.error("Can't read config file: " + fp);
			cli.error(e.getMessage());
		}
		catch (JSGuardException e)
		{
			cli.error("Can't parse config file: " + fp);
			cli.error("Error: " + e.getMessage());
		}

		return null;
	}

	/**
	 * Analyzes the file named by the options and delivers the report. Syntax
	 * errors are printed to the error stream and do not stop the analysis.
	 *
	 * @return {@code false} if a file could not be read or written.
	 */
	public boolean run(RunOptions opts)
	{
		String file = path.resolve(opts.getFile());
		if (!shell.exists(file) || shell.isDirectory(file))
		{
			cli.error("Can't open " + opts.getFile());
			return false;
		}

		String source;
		try
		{
			source = shell.cat(file);
		}
		catch (IOException e)
		{
			cli.error("Can't read " + opts.getFile() + ": " + e.getMessage());
			return false;
		}

		ParseResult result = JSGuard.parse(source);
		for (String error : result.getErrors())
		{
			cli.error(opts.getFile() + ": parse error: " + error);
		}

		List<Issue> issues = JSGuard.analyze(result.getProgram(), opts.getConfig());
		String report = opts.getReporter().generate(opts.getFile(), issues);

		if (opts.getOutput() == null)
		{
			cli.print(report);
			return true;
		}

		String output = path.resolve(opts.getOutput());
		try
		{
			shell.write(output, report);
		}
		catch (IOException e)
		{
			cli.error("Can't write " + opts.getOutput() + ": " + e.getMessage());
			return false;
		}

		cli.println("Analysis complete. Results saved to " + opts.getOutput());
		return true;
	}

	public static class RunOptions
	{
		private final String file;
		private final IssueReporter reporter;
		private String output = null;
		private AnalyzerOptions config = null;

		public RunOptions(String file, IssueReporter reporter)
		{
			this.file = file;
			this.reporter = reporter;
		}

		public String getFile()
		{
			return file;
		}

		public IssueReporter getReporter()
		{
			return reporter;
		}

		public String getOutput()
		{
			return output;
		}

		public RunOptions setOutput(String output)
		{
			this.output = output;
			return this;
		}

		/**
		 * @return the analyzer options from the config file, or {@code null}
		 *         when none was given.
		 */
		public AnalyzerOptions getConfig()
		{
			return config;
		}

		public RunOptions setConfig(AnalyzerOptions config)
		{
			this.config = config;
			return this;
		}
	}
}
