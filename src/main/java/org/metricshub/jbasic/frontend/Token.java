package org.metricshub.jbasic.frontend;

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

/** Lexer token values. */
public enum Token {
	ENDOFINPUT,
	NUMBER,
	STRING,
	INTVAR,
	STRINGVAR,
	CR,

	// statements
	LET,
	PRINT,
	IF,
	THEN,
	ELSE,
	FOR,
	TO,
	STEP,
	NEXT,
	GO,
	SUB,
	RETURN,
	REM,
	POKE,
	STOP,
	END,
	DATA,
	RANDOMIZE,
	OPTION,
	BASE,
	INPUT,
	RESTORE,
	TAB,

	// integer functions
	PEEK,
	ABS,
	INT,
	SGN,
	LEN,
	CODE,
	VAL,
	RND,

	// string functions
	LEFTSTR,
	RIGHTSTR,
	MIDSTR,
	CHRSTR,

	COMMA,
	SEMICOLON,
	PLUS,
	MINUS,
	AND,
	OR,
	ASTR,
	SLASH,
	MOD,
	LEFTPAREN,
	RIGHTPAREN,
	LT,
	GT,
	EQ,
	NE,
	LE,
	GE;

	/**
	 * @return whether this token is a built-in function returning an integer
	 */
	public boolean isIntegerFunction() {
		switch (this) {
		case PEEK:
		case ABS:
		case INT:
		case SGN:
		case LEN:
		case CODE:
		case VAL:
		case RND:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @return whether this token is a built-in function returning a string
	 */
	public boolean isStringFunction() {
		switch (this) {
		case LEFTSTR:
		case RIGHTSTR:
		case MIDSTR:
		case CHRSTR:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @return whether an integer expression can start with this token
	 */
	public boolean startsIntegerExpression() {
		return this == NUMBER || this == INTVAR || this == LEFTPAREN || isIntegerFunction();
	}

	/**
	 * @return whether a string expression can start with this token
	 */
	public boolean startsStringExpression() {
		return this == STRING || this == STRINGVAR || isStringFunction();
	}

	/**
	 * @return whether this token is one of the six comparison operators
	 */
	public boolean isRelational() {
		return this == LT || this == GT || this == EQ || this == NE || this == LE || this == GE;
	}

	/**
	 * @return whether this token can end an operand, so that a following
	 *         {@code -} is a binary minus
	 */
	boolean endsOperand() {
		return this == NUMBER || this == STRING || this == INTVAR || this == STRINGVAR || this == RIGHTPAREN;
	}
}
