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
 * Encoding of variable references.
 * <p>
 * A reference is an {@code int}. Bit 15 tells a string variable from an
 * integer variable, the remaining bits are the slot index:
 * <ul>
 * <li>integer variables: {@code letter * 11 + slot}, where slot 0 is the
 * scalar and slots 1 to 10 are the array elements;
 * <li>string variables: {@code STRING_FLAG | letter}, scalars only.
 * </ul>
 */
public final class VariableRef {

	/** Number of variable names (A to Z). */
	public static final int LETTERS = 26;

	/** Scalar plus 10 array elements per integer variable. */
	public static final int SLOTS_PER_LETTER = 11;

	/** Number of array elements per integer variable. */
	public static final int ELEMENTS = SLOTS_PER_LETTER - 1;

	/** Total number of integer slots. */
	public static final int INTEGER_SLOTS = LETTERS * SLOTS_PER_LETTER;

	/** Marks a string variable reference. */
	public static final int STRING_FLAG = 0x8000;

	private VariableRef() {}

	/**
	 * @param letter 0 for A, 25 for Z
	 * @return reference to the integer scalar
	 */
	public static int integer(int letter) {
		return letter * SLOTS_PER_LETTER;
	}

	/**
	 * @param letter 0 for A, 25 for Z
	 * @param slot 1 to 10
	 * @return reference to an element of the integer array
	 */
	public static int element(int letter, int slot) {
		return letter * SLOTS_PER_LETTER + slot;
	}

	/**
	 * @param letter 0 for A, 25 for Z
	 * @return reference to the string variable
	 */
	public static int string(int letter) {
		return STRING_FLAG | letter;
	}

	public static boolean isString(int ref) {
		return (ref & STRING_FLAG) != 0;
	}

	/**
	 * @param ref a reference
	 * @return the slot index, without the string flag
	 */
	public static int index(int ref) {
		return ref & ~STRING_FLAG;
	}

	/**
	 * @param ref a reference
	 * @return the letter of the variable (0 for A)
	 */
	public static int letter(int ref) {
		return isString(ref) ? index(ref) : index(ref) / SLOTS_PER_LETTER;
	}

	/**
	 * @param ref a reference
	 * @return the source form of the reference: {@code A}, {@code A$} or
	 *         {@code A[3]} for the third element slot
	 */
	public static String name(int ref) {
		char c = (char) ('A' + letter(ref));
		if (isString(ref)) {
			return c + "$";
		}
		int slot = index(ref) % SLOTS_PER_LETTER;
		return slot == 0 ? String.valueOf(c) : c + "[" + slot + "]";
	}
}
