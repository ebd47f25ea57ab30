package org.metricshub.jbasic;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JBasic
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.jbasic.jrt.ArrayHostMemory;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ScriptFileSource;
import org.metricshub.jbasic.util.ScriptSource;

/**
 * Command-line interface for JBasic.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "JBasic.jar";
		}
		JAR_NAME = myName;
	}

	private final BasicSettings settings = new BasicSettings();
	private final PrintStream out;

	private ScriptSource programSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which INPUT reads
	 * @param out stream where PRINT writes
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link BasicSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public BasicSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program to run, {@code null} when only printing usage
	 */
	public ScriptSource getProgramSource() {
		return programSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the program file
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load the program from a file
				checkParameterHasArgument(args, argIdx);
				programSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("--arena-size")) {
				checkParameterHasArgument(args, argIdx);
				settings.setArenaCapacity(parsePositive(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--gosub-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setGosubDepth(parsePositive(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--for-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setForDepth(parsePositive(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--memory")) {
				// --memory n : n bytes of host memory for PEEK and POKE
				checkParameterHasArgument(args, argIdx);
				settings.setHostMemory(new ArrayHostMemory(parsePositive(args[argIdx], args[++argIdx])));
			} else if (arg.equals("--index-eagerly")) {
				settings.setEagerLineIndex(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (programSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("BASIC program not provided.");
			}
			programSource = new ScriptFileSource(args[argIdx++]);
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parsePositive(String option, String value) {
		int n;
		try {
			n = Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects a number, got '" + value + "'", e);
		}
		if (n <= 0) {
			throw new IllegalArgumentException(option + " must be positive, got " + n);
		}
		return n;
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if the program cannot be read or fails
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		try {
			new Basic(settings).invoke(programSource);
		} finally {
			out.flush();
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--arena-size n]" +
								" [--gosub-depth n]" +
								" [--for-depth n]" +
								" [--memory n]" +
								" [--index-eagerly]" +
								" (-f program-filename | program-filename)");
		dest.println();
		dest.println(" -f filename = Run the program in filename.");
		dest.println(" --arena-size n = Bytes of temporary string space (default 512).");
		dest.println(" --gosub-depth n = Maximum GOSUB nesting (default 10).");
		dest.println(" --for-depth n = Maximum FOR nesting (default 4).");
		dest.println(" --memory n = Provide n bytes of memory to PEEK and POKE.");
		dest.println(" --index-eagerly = Index all line numbers before running.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments into a new {@link Cli} instance without executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Parses arguments, runs the program and reports any failure.
	 *
	 * @param args command-line arguments
	 * @param in stream from which INPUT reads
	 * @param out stream where PRINT writes
	 * @param err stream where errors are reported
	 * @return the exit status: 0 on success, 1 on failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int invoke(String[] args, InputStream in, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(in, out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (BasicRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getKind().getDescription(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getKind().getDescription(), e.getMessage());
			}
			return 1;
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.println(e.getMessage());
			return 1;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(invoke(args, System.in, System.out, System.err));
	}
}
