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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.jbasic.backend.BasicVM;
import org.metricshub.jbasic.backend.ExpressionEvaluator;
import org.metricshub.jbasic.frontend.BasicTokenizer;
import org.metricshub.jbasic.frontend.Token;
import org.metricshub.jbasic.jrt.BSDRandom;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.StringArena;
import org.metricshub.jbasic.jrt.Value;
import org.metricshub.jbasic.jrt.VariableStore;
import org.metricshub.jbasic.util.BasicLogger;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into running BASIC programs from Java code.
 * <p>
 * A program is loaded into a {@link BasicVM}, which the caller may step one
 * line at a time, or run to completion with {@link #invoke(String)}.
 * <p>
 * Program text and I/O are handled as ISO-8859-1, one byte per character.
 */
public class Basic {

	private static final Logger LOG = BasicLogger.getLogger(Basic.class);

	private final BasicSettings settings;

	/**
	 * Creates a runner with the default settings: standard input and output,
	 * default capacities and no host memory.
	 */
	public Basic() {
		this(new BasicSettings());
	}

	/**
	 * @param settings I/O streams, capacities and host hooks of the runs
	 */
	public Basic(BasicSettings settings) {
		this.settings = settings;
	}

	/**
	 * Loads a program into a new VM positioned at its first line.
	 *
	 * @param program program text
	 * @return a VM ready to run the program
	 */
	public BasicVM load(String program) {
		return new BasicVM(new BasicTokenizer(program), settings);
	}

	/**
	 * Loads a program into a new VM positioned at its first line.
	 *
	 * @param source where the program text is read from
	 * @return a VM ready to run the program
	 * @throws IOException if the program cannot be read
	 */
	public BasicVM load(ScriptSource source) throws IOException {
		LOG.debug("Loading {}", source.getDescription());
		return load(source.readText());
	}

	/**
	 * Runs a program to completion.
	 *
	 * @param program program text
	 * @throws BasicRuntimeException on the first error of the program
	 */
	public void invoke(String program) {
		load(program).interpret();
	}

	/**
	 * Runs a program to completion.
	 *
	 * @param source where the program text is read from
	 * @throws IOException if the program cannot be read
	 * @throws BasicRuntimeException on the first error of the program
	 */
	public void invoke(ScriptSource source) throws IOException {
		load(source).interpret();
	}

	/**
	 * Runs a program against the given input and returns what it printed.
	 *
	 * @param program program text
	 * @param input lines read by INPUT
	 * @return the output of the program
	 */
	public static String run(String program, String input) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		run(program, new ByteArrayInputStream(input.getBytes(StandardCharsets.ISO_8859_1)), out);
		return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
	}

	/**
	 * Runs a program against the given input and writes what it printed to
	 * the given stream.
	 *
	 * @param program program text
	 * @param input stream read by INPUT
	 * @param output destination of PRINT
	 */
	public static void run(String program, InputStream input, OutputStream output) {
		BasicSettings settings = new BasicSettings();
		settings.setInput(input);
		PrintStream printStream = new PrintStream(output, false);
		settings.setOutputStream(printStream);
		try {
			new Basic(settings).invoke(program);
		} finally {
			printStream.flush();
		}
	}

	/**
	 * Evaluates a single expression, comparisons included, with all the
	 * variables unset.
	 *
	 * @param expression text of the expression
	 * @return an {@link Integer} or a {@link String}
	 * @throws BasicRuntimeException if the expression is invalid
	 */
	public static Object eval(String expression) {
		BasicTokenizer tokens = new BasicTokenizer(expression);
		ExpressionEvaluator evaluator = new ExpressionEvaluator(
				tokens,
				new StringArena(),
				new VariableStore(),
				null,
				new BSDRandom());
		Value value = evaluator.relation();
		if (tokens.token() != Token.CR && !tokens.isFinished()) {
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unexpected " + tokens.token().name() + " after expression");
		}
		return value.toJava();
	}
}
