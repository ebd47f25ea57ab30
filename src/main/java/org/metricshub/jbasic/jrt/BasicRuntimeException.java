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
 * A fatal condition raised while running a BASIC program.
 * <p>
 * The exception carries the {@link ErrorKind} and, when known, the number of
 * the BASIC line that was executing.
 */
public class BasicRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final int lineNumber;

	/**
	 * Constructor for BasicRuntimeException, without line number.
	 *
	 * @param kind what went wrong
	 * @param msg details about the error
	 */
	public BasicRuntimeException(ErrorKind kind, String msg) {
		this(kind, -1, msg, null);
	}

	/**
	 * Constructor for BasicRuntimeException.
	 *
	 * @param kind what went wrong
	 * @param lineno the BASIC line number, or {@code -1}
	 * @param msg details about the error
	 */
	public BasicRuntimeException(ErrorKind kind, int lineno, String msg) {
		this(kind, lineno, msg, null);
	}

	public BasicRuntimeException(ErrorKind kind, int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	/**
	 * @return the kind of error
	 */
	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns a copy of this exception attached to the specified line, unless
	 * the line is already known.
	 *
	 * @param lineno the BASIC line being executed
	 * @return this exception, or a new one carrying the line number
	 */
	public BasicRuntimeException atLine(int lineno) {
		if (lineNumber >= 0 || lineno <= 0) {
			return this;
		}
		return new BasicRuntimeException(kind, lineno, getMessage(), this);
	}

	/**
	 * Formats this error the way it is reported to the user, e.g.
	 * {@code Line 30: Type mismatch error (string + integer)}.
	 *
	 * @return the report line
	 */
	public String toReport() {
		StringBuilder report = new StringBuilder();
		if (lineNumber > 0) {
			report.append("Line ").append(lineNumber).append(": ");
		}
		report.append(kind.getDescription()).append(" error");
		if (getMessage() != null && !getMessage().isEmpty()) {
			report.append(" (").append(getMessage()).append(')');
		}
		return report.toString();
	}
}
