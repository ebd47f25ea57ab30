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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A length-prefixed BASIC string.
 * <p>
 * The string is a view over a byte buffer: the byte at {@code offset} holds
 * the length (0 to 255) and the content follows it, without terminator. The
 * buffer is either the {@link StringArena}, the buffer owned by a string
 * variable, a standalone buffer, or the shared {@link #EMPTY} sentinel.
 * <p>
 * A {@code BasicString} living in the arena is only valid until the arena is
 * reset, i.e. until the next statement starts.
 */
public final class BasicString implements Comparable<BasicString> {

	/** Maximum length of any string. */
	public static final int MAX_LENGTH = 255;

	/** The shared empty string. */
	public static final BasicString EMPTY = new BasicString(new byte[] { 0 }, 0);

	private final byte[] data;
	private final int offset;

	BasicString(byte[] data, int offset) {
		this.data = data;
		this.offset = offset;
	}

	/**
	 * Creates a standalone string holding the ISO-8859-1 bytes of the
	 * specified text.
	 *
	 * @param text the text, at most 255 characters
	 * @return a new string with its own buffer
	 * @throws BasicRuntimeException with {@link ErrorKind#OUT_OF_SPACE} if the
	 *         text is too long
	 */
	public static BasicString of(String text) {
		byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
		return of(bytes, 0, bytes.length);
	}

	/**
	 * Creates a standalone string from a range of bytes.
	 *
	 * @param bytes source bytes
	 * @param from first byte to copy
	 * @param length number of bytes, at most 255
	 * @return a new string with its own buffer
	 */
	public static BasicString of(byte[] bytes, int from, int length) {
		if (length > MAX_LENGTH) {
			throw new BasicRuntimeException(ErrorKind.OUT_OF_SPACE, "String too long");
		}
		if (length == 0) {
			return EMPTY;
		}
		byte[] buffer = new byte[length + 1];
		buffer[0] = (byte) length;
		System.arraycopy(bytes, from, buffer, 1, length);
		return new BasicString(buffer, 0);
	}

	/**
	 * Copies this string into a freshly allocated buffer that nobody else
	 * references.
	 *
	 * @return an owned copy, or {@link #EMPTY} for an empty string
	 */
	public BasicString save() {
		if (length() == 0) {
			return EMPTY;
		}
		return new BasicString(Arrays.copyOfRange(data, offset, offset + length() + 1), 0);
	}

	/**
	 * @return the number of bytes in this string
	 */
	public int length() {
		return data[offset] & 0xFF;
	}

	/**
	 * @param index 0-based position
	 * @return the unsigned byte at the specified position
	 */
	public int byteAt(int index) {
		if (index < 0 || index >= length()) {
			throw new IndexOutOfBoundsException("index " + index + " in string of length " + length());
		}
		return data[offset + 1 + index] & 0xFF;
	}

	/**
	 * Copies content bytes into another buffer.
	 *
	 * @param from first content byte (0-based)
	 * @param dest destination buffer
	 * @param destPos position in the destination
	 * @param count number of bytes
	 */
	void copyTo(int from, byte[] dest, int destPos, int count) {
		System.arraycopy(data, offset + 1 + from, dest, destPos, count);
	}

	/**
	 * @return the content bytes
	 */
	public byte[] toBytes() {
		return Arrays.copyOfRange(data, offset + 1, offset + 1 + length());
	}

	/**
	 * Byte-lexicographic comparison over the common prefix; on equal
	 * prefixes the longer string is greater.
	 *
	 * @param other string to compare with
	 * @return a negative number, zero or a positive number
	 */
	@Override
	public int compareTo(BasicString other) {
		int n = Math.min(length(), other.length());
		for (int i = 0; i < n; i++) {
			int diff = byteAt(i) - other.byteAt(i);
			if (diff != 0) {
				return diff;
			}
		}
		return length() - other.length();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof BasicString)) {
			return false;
		}
		return compareTo((BasicString) obj) == 0;
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (int i = 0; i < length(); i++) {
			h = 31 * h + byteAt(i);
		}
		return h;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return new String(data, offset + 1, length(), StandardCharsets.ISO_8859_1);
	}
}
