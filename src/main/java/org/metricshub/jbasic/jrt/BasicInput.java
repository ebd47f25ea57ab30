package org.metricshub.jbasic.jrt;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented input source of the {@code INPUT} statement.
 */
public class BasicInput {

	private final BufferedReader reader;

	/**
	 * @param in stream to read lines from, decoded as ISO-8859-1
	 */
	public BasicInput(InputStream in) {
		reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.ISO_8859_1));
	}

	/**
	 * Reads one line, without its terminator.
	 *
	 * @return the line
	 * @throws BasicRuntimeException with {@link ErrorKind#END_OF_INPUT} at the
	 *         end of the stream
	 */
	public String readLine() {
		String line;
		try {
			line = reader.readLine();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read input", e);
		}
		if (line == null) {
			throw new BasicRuntimeException(ErrorKind.END_OF_INPUT, "EOF");
		}
		return line;
	}

	/**
	 * Converts an input line to a string value: the line is truncated to
	 * {@value BasicString#MAX_LENGTH} bytes.
	 *
	 * @param line the line, without terminator
	 * @return a standalone string
	 */
	public static BasicString toBasicString(String line) {
		byte[] bytes = line.getBytes(StandardCharsets.ISO_8859_1);
		return BasicString.of(bytes, 0, Math.min(bytes.length, BasicString.MAX_LENGTH));
	}

	/**
	 * Best-effort conversion of an input line to an integer: leading blanks
	 * are skipped, an optional sign and the digits that follow are used and
	 * the rest is ignored. A line with no digits gives 0.
	 *
	 * @param line the line, without terminator
	 * @return the integer
	 */
	public static int toInteger(String line) {
		int i = 0;
		int len = line.length();
		while (i < len && Character.isWhitespace(line.charAt(i))) {
			i++;
		}
		boolean negative = false;
		if (i < len && (line.charAt(i) == '-' || line.charAt(i) == '+')) {
			negative = line.charAt(i) == '-';
			i++;
		}
		int n = 0;
		while (i < len && line.charAt(i) >= '0' && line.charAt(i) <= '9') {
			n = 10 * n + line.charAt(i) - '0';
			i++;
		}
		return negative ? -n : n;
	}
}
