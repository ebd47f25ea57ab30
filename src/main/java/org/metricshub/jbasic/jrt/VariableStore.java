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
 * Storage for the integer and string variables of a program.
 * <p>
 * Integers are stored by value in {@link VariableRef#INTEGER_SLOTS} slots.
 * Each of the 26 string variables owns its buffer: assignment copies the
 * assigned bytes into a new buffer, so a variable never references the
 * {@link StringArena} or another variable. This is the only place where
 * string bytes outlive the statement that produced them.
 */
public class VariableStore {

	private final int[] integers = new int[VariableRef.INTEGER_SLOTS];
	private final BasicString[] strings = new BasicString[VariableRef.LETTERS];

	/**
	 * Creates a store with all integers at 0 and all strings empty.
	 */
	public VariableStore() {
		clear();
	}

	/**
	 * Resets all integers to 0 and all strings to the empty sentinel.
	 */
	public final void clear() {
		Arrays.fill(integers, 0);
		Arrays.fill(strings, BasicString.EMPTY);
	}

	/**
	 * Reads a variable.
	 *
	 * @param ref variable reference
	 * @return the integer value, or the string value (the empty string if never
	 *         assigned)
	 * @throws BasicRuntimeException with {@link ErrorKind#INVALID_VARIABLE} for
	 *         an out-of-range reference
	 */
	public Value get(int ref) {
		if (VariableRef.isString(ref)) {
			return Value.of(strings[checkString(ref)]);
		}
		return Value.of(integers[checkInteger(ref)]);
	}

	/**
	 * Assigns a variable. The value's type must match the kind of the
	 * reference; if it does not, the store is left unchanged.
	 *
	 * @param ref variable reference
	 * @param value new value
	 * @throws BasicRuntimeException with {@link ErrorKind#TYPE_MISMATCH} or
	 *         {@link ErrorKind#INVALID_VARIABLE}
	 */
	public void set(int ref, Value value) {
		if (VariableRef.isString(ref)) {
			if (!value.isString()) {
				throw new BasicRuntimeException(
						ErrorKind.TYPE_MISMATCH,
						"cannot assign an integer to " + VariableRef.name(ref));
			}
			strings[checkString(ref)] = value.stringValue().save();
		} else {
			if (!value.isInteger()) {
				throw new BasicRuntimeException(
						ErrorKind.TYPE_MISMATCH,
						"cannot assign a string to " + VariableRef.name(ref));
			}
			integers[checkInteger(ref)] = value.intValue();
		}
	}

	private static int checkInteger(int ref) {
		if (ref < 0 || ref >= VariableRef.INTEGER_SLOTS) {
			throw new BasicRuntimeException(ErrorKind.INVALID_VARIABLE, "bad integer variable " + ref);
		}
		return ref;
	}

	private static int checkString(int ref) {
		int index = VariableRef.index(ref);
		if (index >= VariableRef.LETTERS) {
			throw new BasicRuntimeException(ErrorKind.INVALID_VARIABLE, "bad string variable " + index);
		}
		return index;
	}
}
