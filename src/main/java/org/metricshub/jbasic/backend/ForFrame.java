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
 * Descriptor of an active FOR loop.
 */
final class ForFrame {

	/** Line where the loop body resumes: the line after the FOR. */
	final int lineAfterFor;
	final int variable;
	final int limit;
	final int step;

	ForFrame(int lineAfterFor, int variable, int limit, int step) {
		this.lineAfterFor = lineAfterFor;
		this.variable = variable;
		this.limit = limit;
		this.step = step;
	}

	/**
	 * @param value value of the loop variable after stepping
	 * @return whether the loop runs once more
	 */
	boolean continues(int value) {
		return (step >= 0 && value <= limit) || (step < 0 && value >= limit);
	}
}
