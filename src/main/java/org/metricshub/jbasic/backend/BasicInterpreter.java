package org.metricshub.jbasic.backend;

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
 * Interpret a BASIC program within this JVM, one line at a time.
 */
public interface BasicInterpreter {

	/**
	 * Executes the statement of exactly one program line. Does nothing once
	 * the program is finished.
	 *
	 * @throws org.metricshub.jbasic.jrt.BasicRuntimeException on any error,
	 *         which also finishes the program
	 */
	void run();

	/**
	 * @return whether the program stopped, failed or ran off its last line
	 */
	boolean isFinished();

	/**
	 * Runs the program until it is finished.
	 */
	default void interpret() {
		while (!isFinished()) {
			run();
		}
	}
}
