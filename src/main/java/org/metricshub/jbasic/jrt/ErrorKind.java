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

/**
 * The conditions that terminate a running BASIC program.
 * <p>
 * None of them can be trapped by the program itself: once raised, the
 * interpreter stops and the error is handed over to the host.
 */
public enum ErrorKind {
	/** Unexpected token, or malformed program text. */
	SYNTAX("Syntax"),
	/** Operand or argument of the wrong type. */
	TYPE_MISMATCH("Type mismatch"),
	/** Integer division or modulo by zero. */
	DIVISION_BY_ZERO("Division by zero"),
	/** String longer than 255 bytes, or string arena exhausted. */
	OUT_OF_SPACE("Out of space"),
	/** Too many nested GOSUB calls. */
	STACK_EXHAUSTED("Stack exhausted"),
	/** NEXT does not match the innermost FOR. */
	MISMATCHED_NEXT("Mismatched NEXT"),
	/** Target line of GOTO, GOSUB, RETURN or RESTORE does not exist. */
	UNDEFINED_LINE("Undefined line"),
	/** OPTION BASE with a value other than 0 or 1. */
	INVALID_BASE("Invalid base"),
	/** Variable reference or array subscript out of range. */
	INVALID_VARIABLE("Invalid variable"),
	/** PEEK or POKE without host memory, or outside of it. */
	HOST_MEMORY("Host memory"),
	/** INPUT reached the end of its input stream. */
	END_OF_INPUT("End of input");

	private final String description;

	ErrorKind(String description) {
		this.description = description;
	}

	/**
	 * @return the human readable name of this error, as reported to the user
	 */
	public String getDescription() {
		return description;
	}
}
