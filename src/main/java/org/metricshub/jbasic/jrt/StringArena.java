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

import java.util.Arrays;

/**
 * Bump allocator for the transient strings of one statement.
 * <p>
 * All temporary strings (literals, substrings, concatenations) are carved
 * out of a single fixed buffer. Each allocation of {@code n} bytes consumes
 * {@code n + 1} bytes, the first one holding the length. Nothing is ever
 * freed individually: {@link #reset()} rewinds the whole arena and is called
 * at the start of every statement, which invalidates every string handed
 * out before.
 */
public class StringArena {

	/** Default capacity, in bytes. */
	public static final int DEFAULT_CAPACITY = 512;

	private final byte[] blob;
	private int next;

	/**
	 * Creates an arena of {@link #DEFAULT_CAPACITY} bytes.
	 */
	public StringArena() {
		this(DEFAULT_CAPACITY);
	}

	/**
	 * Creates an arena of the specified capacity.
	 *
	 * @param capacity size of the buffer, in bytes
	 */
	public StringArena(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Arena capacity must be positive: " + capacity);
		}
		blob = new byte[capacity];
	}

	/**
	 * Reserves room for a string of the specified length and writes its
	 * length byte. The content bytes are zero.
	 *
	 * @param length length of the string
	 * @return the offset of the length byte in the arena
	 */
	private int reserve(int length) {
		if (length > BasicString.MAX_LENGTH) {
			throw new BasicRuntimeException(ErrorKind.OUT_OF_SPACE, "String too long");
		}
		if (next + length + 1 > blob.length) {
			throw new BasicRuntimeException(ErrorKind.OUT_OF_SPACE, "Out of temporary space");
		}
		int start = next;
		next += length + 1;
		blob[start] = (byte) length;
		Arrays.fill(blob, start + 1, next, (byte) 0);
		return start;
	}

	/**
	 * Allocates a string of the specified length, filled with zero bytes.
	 *
	 * @param length length of the string (0 to 255)
	 * @return the new string
	 * @throws BasicRuntimeException with {@link ErrorKind#OUT_OF_SPACE} if the
	 *         length is over 255 or the arena is full
	 */
	public BasicString allocate(int length) {
		return new BasicString(blob, reserve(length));
	}

	/**
	 * Allocates a string holding a copy of the specified bytes.
	 *
	 * @param bytes source
	 * @param from first byte to copy
	 * @param length number of bytes to copy
	 * @return the new string
	 */
	public BasicString copyOf(byte[] bytes, int from, int length) {
		int start = reserve(length);
		System.arraycopy(bytes, from, blob, start + 1, length);
		return new BasicString(blob, start);
	}

	/**
	 * Allocates a string holding {@code count} bytes of {@code source},
	 * starting at the 0-based position {@code from}. The range must lie within
	 * the source.
	 *
	 * @param source string to cut from
	 * @param from 0-based first byte
	 * @param count number of bytes
	 * @return the new string
	 */
	public BasicString substring(BasicString source, int from, int count) {
		int start = reserve(count);
		source.copyTo(from, blob, start + 1, count);
		return new BasicString(blob, start);
	}

	/**
	 * Allocates the concatenation of two strings. Neither operand is
	 * modified.
	 *
	 * @param left first part
	 * @param right second part
	 * @return the new string
	 * @throws BasicRuntimeException with {@link ErrorKind#OUT_OF_SPACE} if the
	 *         result is longer than 255 bytes or does not fit in the arena
	 */
	public BasicString concat(BasicString left, BasicString right) {
		int l = left.length();
		int r = right.length();
		int start = reserve(l + r);
		left.copyTo(0, blob, start + 1, l);
		right.copyTo(0, blob, start + 1 + l, r);
		return new BasicString(blob, start);
	}

	/**
	 * Rewinds the arena. Every string allocated so far becomes invalid.
	 */
	public void reset() {
		next = 0;
	}

	/**
	 * @return number of bytes allocated since the last reset
	 */
	public int used() {
		return next;
	}

	/**
	 * @return size of the arena, in bytes
	 */
	public int capacity() {
		return blob.length;
	}
}
