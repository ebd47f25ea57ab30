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
 * {@link HostMemory} backed by a byte array.
 * <p>
 * Cells hold 8 bits: {@code poke} keeps the low byte of the value and
 * {@code peek} returns it unsigned. Addresses outside the array raise
 * {@link ErrorKind#HOST_MEMORY}.
 */
public class ArrayHostMemory implements HostMemory {

	private final byte[] cells;

	/**
	 * @param size number of cells
	 */
	public ArrayHostMemory(int size) {
		cells = new byte[size];
	}

	@Override
	public int peek(int address) {
		return cells[check(address)] & 0xFF;
	}

	@Override
	public void poke(int address, int value) {
		cells[check(address)] = (byte) value;
	}

	public int size() {
		return cells.length;
	}

	private int check(int address) {
		if (address < 0 || address >= cells.length) {
			throw new BasicRuntimeException(
					ErrorKind.HOST_MEMORY,
					"address " + address + " outside of 0.." + (cells.length - 1));
		}
		return address;
	}
}
