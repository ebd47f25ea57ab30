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
 * Read position into the DATA statements of the program, moved by RESTORE.
 */
public final class DataCursor {

	private int position;
	private boolean seekPending;

	/**
	 * Moves the cursor and marks it as needing to be repositioned on the next
	 * DATA item before it is read.
	 *
	 * @param newPosition source position
	 */
	void moveTo(int newPosition) {
		position = newPosition;
		seekPending = true;
	}

	/**
	 * @return the source position of the cursor
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * @return whether the next read must first look for a DATA statement from
	 *         {@link #getPosition()}
	 */
	public boolean isSeekPending() {
		return seekPending;
	}
}
