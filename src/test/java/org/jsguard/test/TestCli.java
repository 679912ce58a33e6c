package org.jsguard.test;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.jsguard.AnalyzerOptions;
import org.jsguard.Cli;
import org.jsguard.reporters.CheckstyleReporter;
import org.jsguard.reporters.DefaultReporter;
import org.jsguard.reporters.UnixReporter;
import org.jsguard.test.helpers.CliWrapper;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

public class TestCli extends Assert
{
	private static final String VAR_REPORT =
		"Analysis Results:\n" +
		"----------------\n" +
		"[MEDIUM] style: Use of 'var' keyword — consider using 'let' or 'const' instead at line 1, column 1\n" +
		"\n" +
		"Summary:\n" +
		"Total issues: 1\n" +
		"- style: 1\n";

	public CliWrapper setUpCli()
	{
		CliWrapper cli = new CliWrapper();
		cli.stubCwd(() -> "/home/user/project");
		cli.stubWrite();

		cli.stubCat(path -> {
			if (path.endsWith("/app.js")) return "var a = 1;\nuse(a);";
			if (path.endsWith("/broken.js")) return "let x = ;\nlet y = 2;\nuse(y);";
			if (path.endsWith("/clean.json")) return "{\"no-var\": false}";
			if (path.endsWith("/bad.json")) return "{\"no-eval\": true}";
			if (path.endsWith("/limit.yml")) return "maxstatements: 1\n";
			throw new UncheckedIOException(new IOException("Permission denied"));
		});

		cli.stubExists(path -> path.endsWith("/app.js") || path.endsWith("/broken.js") || path.endsWith("/locked.js")
			|| path.endsWith(".json") || path.endsWith(".yml") || path.endsWith("/src"));
		cli.stubIsDirectory(path -> path.endsWith("/src"));

		return cli;
	}

	@Test
	public void testHelp()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("--help"), Cli.EXIT_OK);
		assertTrue(cli.getOutput().startsWith("usage: jsguard [options] <file>"), cli.getOutput());
		assertTrue(cli.getOutput().contains("--reporter"));
		assertTrue(cli.getErrorMessages().isEmpty());
	}

	@Test
	public void testNoFile()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret(), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages().get(0), "No file to analyze.");
		assertNull(cli.getRunOptions());
	}

	@Test
	public void testTooManyFiles()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("app.js", "broken.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages().get(0), "Only one file can be analyzed at a time.");
	}

	@Test
	public void testUnknownOption()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("--wat", "app.js"), Cli.EXIT_FAILURE);
		assertTrue(cli.getErrorMessages().get(0).contains("--wat"), cli.getErrorMessages().get(0));
	}

	@Test
	public void testMissingFile()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("missing.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't open missing.js"));
		assertEquals(cli.getOutput(), "");

		assertEquals(cli.interpret("src"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't open src"));
	}

	@Test
	public void testUnreadableFile()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("locked.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't read locked.js: Permission denied"));
	}

	@Test
	public void testDefaultReport()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("app.js"), Cli.EXIT_OK);
		assertEquals(cli.getOutput(), VAR_REPORT);
		assertTrue(cli.getErrorMessages().isEmpty());
		assertTrue(cli.getRunOptions().getReporter() instanceof DefaultReporter);
		assertNull(cli.getRunOptions().getConfig());
	}

	@Test
	public void testReporterOption()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-r", "unix", "app.js"), Cli.EXIT_OK);
		assertTrue(cli.getRunOptions().getReporter() instanceof UnixReporter);
		assertEquals(cli.getOutput(),
			"app.js:1:1: [MEDIUM] style: Use of 'var' keyword — consider using 'let' or 'const' instead\n\n1 issue\n");

		assertEquals(cli.interpret("--reporter", "checkstyle", "app.js"), Cli.EXIT_OK);
		assertTrue(cli.getRunOptions().getReporter() instanceof CheckstyleReporter);
		assertTrue(cli.getOutput().contains("source=\"jsguard.style\""));
	}

	@Test
	public void testUnknownReporter()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("--reporter", "html", "app.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't load reporter 'html'. Expected one of: default, unix, checkstyle."));
	}

	@Test
	public void testParseErrorsDoNotFail()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("broken.js"), Cli.EXIT_OK);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("broken.js: parse error: Expected expression, got ';' at 1:9"));
		assertTrue(cli.getOutput().contains("No issues detected."), cli.getOutput());
	}

	@Test
	public void testOutputFile()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-o", "report.txt", "app.js"), Cli.EXIT_OK);
		assertEquals(cli.getWrittenFiles().size(), 1);
		assertEquals(cli.getWrittenFiles().get("/home/user/project/report.txt"), VAR_REPORT);
		assertEquals(cli.getOutput(), "Analysis complete. Results saved to report.txt\n");
	}

	@Test
	public void testConfig()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("--config", "clean.json", "app.js"), Cli.EXIT_OK);

		AnalyzerOptions config = cli.getRunOptions().getConfig();
		assertNotNull(config);
		assertFalse(config.isEnabled(AnalyzerOptions.NO_VAR));
		assertTrue(cli.getOutput().contains("No issues detected."), cli.getOutput());
		assertTrue(cli.getOutput().contains("Total issues: 0"));
	}

	@Test
	public void testYamlConfig()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-c", "limit.yml", "app.js"), Cli.EXIT_OK);
		assertEquals(cli.getRunOptions().getConfig().getMaxStatements(), 1);
	}

	@Test
	public void testBadConfig()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-c", "bad.json", "app.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't parse config file: bad.json", "Error: Bad option: 'no-eval'."));
		assertNull(cli.getRunOptions());
	}

	@Test
	public void testMissingConfig()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-c", "nope.cfg", "app.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't find config file: nope.cfg"));
	}

	@Test
	public void testUnreadableConfig()
	{
		CliWrapper cli = setUpCli();

		assertEquals(cli.interpret("-c", "secret.json", "app.js"), Cli.EXIT_FAILURE);
		assertEquals(cli.getErrorMessages(), ImmutableList.of("Can't read config file: secret.json", "Permission denied"));
	}
}
