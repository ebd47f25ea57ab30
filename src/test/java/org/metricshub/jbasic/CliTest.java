package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jbasic.BasicTestSupport.cliTest;

import org.junit.Test;
import org.metricshub.jbasic.BasicTestSupport.TestResult;
import org.metricshub.jbasic.util.BasicSettings;

public class CliTest {

	@Test
	public void testRunProgramFile() throws Exception {
		cliTest("program file")
				.program("10 PRINT \"HI\"", "20 PRINT 1 + 1")
				.expectLines("HI", "2")
				.expectExitCode(0)
				.runAndAssert();
	}

	@Test
	public void testRunWithDashF() throws Exception {
		cliTest("-f program file")
				.argument("-f")
				.program("10 INPUT A", "20 PRINT A * 2")
				.input("21")
				.expectLines("? 42")
				.expectExitCode(0)
				.runAndAssert();
	}

	@Test
	public void testErrorIsReported() throws Exception {
		TestResult result = cliTest("undefined line").program("10 PRINT 1", "20 GOTO 99").expectLines("1").expectExitCode(1).run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("Undefined line (line 20): "));
	}

	@Test
	public void testGosubDepthOption() throws Exception {
		TestResult result = cliTest("--gosub-depth 1")
				.argument("--gosub-depth", "1")
				.program("10 GOSUB 20", "20 GOSUB 30", "30 RETURN")
				.expectExitCode(1)
				.run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("Stack exhausted (line 20): "));
	}

	@Test
	public void testMemoryOption() throws Exception {
		cliTest("--memory 8")
				.argument("--memory", "8")
				.program("10 POKE 7, 65", "20 PRINT PEEK(7)")
				.expectLines("65")
				.expectExitCode(0)
				.runAndAssert();
	}

	@Test
	public void testWithoutMemoryOption() throws Exception {
		cliTest("no --memory").program("10 POKE 7, 65").expectExitCode(1).runAndAssert();
	}

	@Test
	public void testUsage() throws Exception {
		TestResult result = cliTest("-h").withoutProgramFile().argument("-h").expectExitCode(0).run();
		result.assertExpected();
		assertTrue(result.output().startsWith("Usage:"));
	}

	@Test
	public void testUnknownOption() throws Exception {
		cliTest("unknown option").argument("--frobnicate").program("10 PRINT 1").expectExitCode(1).runAndAssert();
	}

	@Test
	public void testMissingProgram() throws Exception {
		cliTest("no program").withoutProgramFile().argument("--index-eagerly").expectExitCode(1).runAndAssert();
	}

	@Test
	public void testMissingProgramFile() throws Exception {
		TestResult result = cliTest("program file not found")
				.withoutProgramFile()
				.argument("/nonexistent/program.bas")
				.expectExitCode(1)
				.run();
		result.assertExpected();
		assertFalse(result.errorOutput().isEmpty());
	}

	@Test
	public void testParseSettings() {
		Cli cli = Cli
				.parseCommandLineArguments(
						new String[] {
								"--arena-size",
								"64",
								"--gosub-depth",
								"3",
								"--for-depth",
								"2",
								"--memory",
								"128",
								"--index-eagerly",
								"prog.bas" });
		BasicSettings settings = cli.getSettings();
		assertEquals(64, settings.getArenaCapacity());
		assertEquals(3, settings.getGosubDepth());
		assertEquals(2, settings.getForDepth());
		assertNotNull(settings.getHostMemory());
		assertTrue(settings.isEagerLineIndex());
		assertEquals("prog.bas", cli.getProgramSource().getDescription());
	}

	@Test
	public void testInvalidNumericOption() {
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--for-depth", "x", "p.bas" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--arena-size", "0", "p.bas" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--memory" }));
	}

	@Test
	public void testDefaults() {
		BasicSettings settings = new BasicSettings();
		assertEquals(512, settings.getArenaCapacity());
		assertEquals(10, settings.getGosubDepth());
		assertEquals(4, settings.getForDepth());
		assertFalse(settings.isEagerLineIndex());
		assertTrue(settings.toDescriptionString().contains("gosubDepth = 10"));
	}
}
