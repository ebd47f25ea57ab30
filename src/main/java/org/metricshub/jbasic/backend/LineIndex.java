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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache of line number to source position, filled in as lines are reached.
 * <p>
 * Entries are kept in first-seen order and are never removed, except by
 * {@link #clear()} when a program is (re)loaded. A line that is only jumped
 * to, never reached by falling through, stays out of the index.
 */
class LineIndex {

	private final Map<Integer, Integer> positions = new LinkedHashMap<Integer, Integer>();

	/**
	 * Records the position of a line, unless already known.
	 *
	 * @param lineNumber BASIC line number
	 * @param position source position of its line number token
	 */
	void add(int lineNumber, int position) {
		positions.putIfAbsent(lineNumber, position);
	}

	/**
	 * @param lineNumber BASIC line number
	 * @return the source position of the line, or {@code null} if not indexed
	 */
	Integer find(int lineNumber) {
		return positions.get(lineNumber);
	}

	int size() {
		return positions.size();
	}

	void clear() {
		positions.clear();
	}
}
