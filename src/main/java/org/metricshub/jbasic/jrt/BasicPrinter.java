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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * Character sink of {@code PRINT} and {@code INPUT} prompts.
 * <p>
 * Keeps track of the output column so that {@code TAB(n)} can pad to a
 * column: printable characters advance it, {@code \r} and {@code \n} reset
 * it, backspace and DEL step back. A tab character inside a string is
 * expanded to spaces up to the next multiple of {@value #TAB_WIDTH}.
 */
public class BasicPrinter {

	/** Width of a tab stop. */
	public static final int TAB_WIDTH = 8;

	private static final int BACKSPACE = 8;
	private static final int DELETE = 127;

	private final PrintStream out;
	private int column;

	/**
	 * @param out stream receiving the bytes
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Output goes to the caller-supplied stream")
	public BasicPrinter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Writes one character (a byte) and updates the column.
	 *
	 * @param c the character
	 */
	public void print(int c) {
		if (c == '\t') {
			do {
				print(' ');
			} while (column % TAB_WIDTH != 0);
			return;
		}
		out.write(c);
		if ((c == BACKSPACE || c == DELETE) && column > 0) {
			column--;
		} else if (c == '\r' || c == '\n') {
			column = 0;
		} else {
			column++;
		}
	}

	/**
	 * @param s string whose bytes are printed
	 */
	public void print(BasicString s) {
		for (int i = 0; i < s.length(); i++) {
			print(s.byteAt(i));
		}
	}

	/**
	 * @param value integer printed in decimal
	 */
	public void printNumber(int value) {
		String digits = Integer.toString(value);
		for (int i = 0; i < digits.length(); i++) {
			print(digits.charAt(i));
		}
	}

	/**
	 * Writes a literal tab character, as the {@code PRINT} comma separator
	 * does, and moves the column to the next tab stop.
	 */
	public void printTab() {
		out.write('\t');
		column += TAB_WIDTH - column % TAB_WIDTH;
	}

	/**
	 * Pads with spaces up to the specified column.
	 *
	 * @param target 0-based column
	 */
	public void tab(int target) {
		while (column < target) {
			print(' ');
		}
	}

	/**
	 * Ends the current output line.
	 */
	public void newline() {
		print('\n');
	}

	/**
	 * Moves the column back to the left margin, after the user typed a line.
	 */
	public void resetColumn() {
		column = 0;
	}

	/**
	 * @return the current 0-based output column
	 */
	public int getColumn() {
		return column;
	}

	public void flush() {
		out.flush();
	}
}
