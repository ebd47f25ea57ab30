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
 * A typed BASIC value: either an integer or a string.
 * <p>
 * Instances are immutable. A string value may reference the
 * {@link StringArena}, in which case it must not be kept across statements;
 * the {@link VariableStore} copies strings when they are assigned.
 */
public final class Value {

	/** The two value types of the language. */
	public enum Type {
		INTEGER,
		STRING
	}

	/** Integer 0, also the result of a false relation. */
	public static final Value FALSE = new Value(Type.INTEGER, 0, null);

	/** Integer 1, the result of a true relation. */
	public static final Value TRUE = new Value(Type.INTEGER, 1, null);

	private final Type type;
	private final int intValue;
	private final BasicString stringValue;

	private Value(Type type, int intValue, BasicString stringValue) {
		this.type = type;
		this.intValue = intValue;
		this.stringValue = stringValue;
	}

	/**
	 * @param value integer payload
	 * @return an integer value
	 */
	public static Value of(int value) {
		return new Value(Type.INTEGER, value, null);
	}

	/**
	 * @param value string payload, not {@code null}
	 * @return a string value
	 */
	public static Value of(BasicString value) {
		if (value == null) {
			throw new IllegalArgumentException("string value cannot be null");
		}
		return new Value(Type.STRING, 0, value);
	}

	/**
	 * @param value boolean
	 * @return {@link #TRUE} or {@link #FALSE}
	 */
	public static Value of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public Type getType() {
		return type;
	}

	public boolean isInteger() {
		return type == Type.INTEGER;
	}

	public boolean isString() {
		return type == Type.STRING;
	}

	/**
	 * @return the integer payload
	 * @throws BasicRuntimeException with {@link ErrorKind#TYPE_MISMATCH} if
	 *         this is a string
	 */
	public int intValue() {
		if (type != Type.INTEGER) {
			throw new BasicRuntimeException(ErrorKind.TYPE_MISMATCH, "integer expected");
		}
		return intValue;
	}

	/**
	 * @return the string payload
	 * @throws BasicRuntimeException with {@link ErrorKind#TYPE_MISMATCH} if
	 *         this is an integer
	 */
	public BasicString stringValue() {
		if (type != Type.STRING) {
			throw new BasicRuntimeException(ErrorKind.TYPE_MISMATCH, "string expected");
		}
		return stringValue;
	}

	/**
	 * @return an {@link Integer} or a {@link String}, for use outside of the
	 *         interpreter
	 */
	public Object toJava() {
		return type == Type.INTEGER ? (Object) Integer.valueOf(intValue) : stringValue.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return type == Type.INTEGER ? Integer.toString(intValue) : "\"" + stringValue + "\"";
	}
}
