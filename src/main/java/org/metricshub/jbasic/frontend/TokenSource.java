package org.metricshub.jbasic.frontend;

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

import java.util.function.IntConsumer;

/**
 * The stream of tokens consumed by the interpreter.
 * <p>
 * Implementations report malformed input by throwing a
 * {@link org.metricshub.jbasic.jrt.BasicRuntimeException} of kind
 * {@link org.metricshub.jbasic.jrt.ErrorKind#SYNTAX}, which terminates the
 * run like any other error.
 */
public interface TokenSource {

	/**
	 * @return the current token
	 */
	Token token();

	/**
	 * Advances to the next token. Does nothing once the end of input is
	 * reached.
	 */
	void next();

	/**
	 * @return the value of the current {@link Token#NUMBER}, which is the line
	 *         number at the start of a line; 0 for any other token
	 */
	int number();

	/**
	 * @return the variable reference of the current {@link Token#INTVAR} or
	 *         {@link Token#STRINGVAR}, as encoded by
	 *         {@link org.metricshub.jbasic.jrt.VariableRef}
	 */
	int variableNumber();

	/**
	 * @return a copy of the bytes of the current {@link Token#STRING} literal
	 */
	byte[] string();

	/**
	 * Pushes the bytes of the current {@link Token#STRING} literal, one by one,
	 * through the specified sink.
	 *
	 * @param sink receives each byte as an unsigned value
	 */
	void stringTo(IntConsumer sink);

	/**
	 * @return an opaque position of the current token, to be given back to
	 *         {@link #seek(int)}
	 */
	int position();

	/**
	 * Repositions the stream on a token previously obtained with
	 * {@link #position()}.
	 *
	 * @param position a position
	 */
	void seek(int position);

	/**
	 * Repositions the stream on the first token of the program.
	 */
	void restart();

	/**
	 * Discards the rest of the current line, positioning the stream on the
	 * first token of the next line.
	 */
	void skipToEndOfLine();

	/**
	 * @return whether the current token is {@link Token#ENDOFINPUT}
	 */
	boolean isFinished();
}
