package org.jsguard.utils;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * File system and console access of the command line tool, split into
 * overridable pieces so tests can replace them.
 */
public class IOUtils
{
	private static PathUtils path = new PathUtils();
	private static ShellUtils shell = new ShellUtils(path);
	private static CliUtils cli = new CliUtils();

	private static final CommandLineParser parser = new DefaultParser();

	private IOUtils() {}

	public static PathUtils getPathUtils()
	{
		return path;
	}

	public static ShellUtils getShellUtils()
	{
		return shell;
	}

	public static CliUtils getCliUtils()
	{
		return cli;
	}

	public static class PathUtils
	{
		//path.resolve(...)
		public String resolve(String... paths)
		{
			String[] parts = ArrayUtils.nullToEmpty(paths);
			return Paths.get(cwd()).resolve(Paths.get("", parts)).normalize().toString();
		}

		//process.cwd()
		public String cwd()
		{
			return System.getProperty("user.dir");
		}
	}

	public static class ShellUtils
	{
		private PathUtils pathUtils;

		public ShellUtils(PathUtils pathUtils)
		{
			this.pathUtils = pathUtils;
		}

		//shjs.cat(path)
		public String cat(String path) throws IOException
		{
			return new String(Files.readAllBytes(Paths.get(pathUtils.resolve(path))), StandardCharsets.UTF_8);
		}

		public void write(String path, String content) throws IOException
		{
			Files.write(Paths.get(pathUtils.resolve(path)), StringUtils.defaultString(content).getBytes(StandardCharsets.UTF_8));
		}

		//shjs.test("-e", path)
		public boolean exists(String path)
		{
			return Files.exists(Paths.get(pathUtils.resolve(path)));
		}

		//shjs.test("-d")
		public boolean isDirectory(String path)
		{
			return Files.isDirectory(Paths.get(pathUtils.resolve(path)));
		}
	}

	public static class CliUtils
	{
		public CommandLine parse(Options options, String... args) throws ParseException
		{
			return parser.parse(options, args);
		}

		public String usage(String syntax, Options options)
		{
			StringWriter out = new StringWriter();
			PrintWriter writer = new PrintWriter(out);
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, syntax, null, options,
				HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
			writer.flush();
			return out.toString();
		}

		public void print(String message)
		{
			System.out.print(message);
		}

		public void println(String message)
		{
			System.out.println(message);
		}

		public void error(String message)
		{
			System.err.println(message);
		}
	}
}
