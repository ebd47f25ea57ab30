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

import org.metricshub.jbasic.frontend.Token;
import org.metricshub.jbasic.frontend.TokenSource;
import org.metricshub.jbasic.jrt.BSDRandom;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.BasicString;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.HostMemory;
import org.metricshub.jbasic.jrt.StringArena;
import org.metricshub.jbasic.jrt.Value;
import org.metricshub.jbasic.jrt.VariableRef;
import org.metricshub.jbasic.jrt.VariableStore;

/**
 * Recursive-descent evaluator of BASIC expressions, reading straight from
 * the token source.
 * <p>
 * Four left-associative precedence tiers, from the loosest to the tightest:
 * <ul>
 * <li>relation: {@code < > = <> <= >=}
 * <li>expr: {@code + - AND OR}
 * <li>term: {@code * / MOD}
 * <li>factor: literals, {@code ( expr )}, variables, built-in functions
 * </ul>
 * Temporary strings are allocated in the {@link StringArena}.
 */
public class ExpressionEvaluator {

	private static final Value.Type[] INTEGER_ARG = { Value.Type.INTEGER };
	private static final Value.Type[] STRING_ARG = { Value.Type.STRING };
	private static final Value.Type[] STRING_INTEGER_ARGS = { Value.Type.STRING, Value.Type.INTEGER };
	private static final Value.Type[] STRING_INTEGER_INTEGER_ARGS = {
			Value.Type.STRING,
			Value.Type.INTEGER,
			Value.Type.INTEGER };

	private final TokenSource tokens;
	private final StringArena arena;
	private final VariableStore variables;
	private final HostMemory hostMemory;
	private final BSDRandom random;

	private int arrayBase;

	/**
	 * @param tokens where expressions are read from
	 * @param arena allocator of temporary strings
	 * @param variables variable storage
	 * @param hostMemory PEEK hook, may be {@code null}
	 * @param random generator behind RND
	 */
	public ExpressionEvaluator(
			TokenSource tokens,
			StringArena arena,
			VariableStore variables,
			HostMemory hostMemory,
			BSDRandom random) {
		this.tokens = tokens;
		this.arena = arena;
		this.variables = variables;
		this.hostMemory = hostMemory;
		this.random = random;
	}

	/**
	 * @return the first array subscript, 0 or 1
	 */
	public int getArrayBase() {
		return arrayBase;
	}

	/**
	 * @param arrayBase the first array subscript, 0 or 1
	 */
	void setArrayBase(int arrayBase) {
		this.arrayBase = arrayBase;
	}

	/**
	 * Consumes the current token, which must be the expected one.
	 *
	 * @param expected expected token
	 * @return the token that follows
	 * @throws BasicRuntimeException with {@link ErrorKind#SYNTAX} on any other
	 *         token
	 */
	Token accept(Token expected) {
		if (tokens.token() != expected) {
			throw new BasicRuntimeException(
					ErrorKind.SYNTAX,
					"Expecting " + expected.name() + ". Found: " + tokens.token().name());
		}
		tokens.next();
		return tokens.token();
	}

	/**
	 * Consumes the current token, which must be one of the two expected ones.
	 *
	 * @return the token that was consumed
	 */
	Token acceptEither(Token first, Token second) {
		Token t = tokens.token();
		if (t == second) {
			accept(second);
		} else {
			accept(first);
		}
		return t;
	}

	HostMemory requireHostMemory() {
		if (hostMemory == null) {
			throw new BasicRuntimeException(ErrorKind.HOST_MEMORY, "no host memory attached");
		}
		return hostMemory;
	}

	/**
	 * Parses a variable, with its subscript for an array element, and returns
	 * its reference.
	 *
	 * @return the variable reference
	 * @throws BasicRuntimeException with {@link ErrorKind#INVALID_VARIABLE} for
	 *         a subscript outside of the array
	 */
	public int variableReference() {
		Token t = tokens.token();
		int ref = tokens.variableNumber();
		acceptEither(Token.INTVAR, Token.STRINGVAR);
		if (t == Token.INTVAR && tokens.token() == Token.LEFTPAREN) {
			int subscript = bracketedIntExpr();
			int slot = subscript - arrayBase + 1;
			if (slot < 1 || slot > VariableRef.ELEMENTS) {
				throw new BasicRuntimeException(
						ErrorKind.INVALID_VARIABLE,
						"subscript " + subscript + " out of range for " + VariableRef.name(ref));
			}
			ref = VariableRef.element(VariableRef.letter(ref), slot);
		}
		return ref;
	}

	/**
	 * @return the value of an additive expression that must be an integer
	 */
	public int intExpr() {
		Value v = expr();
		if (!v.isInteger()) {
			throw typeMismatch("integer expression expected");
		}
		return v.intValue();
	}

	/**
	 * @return the value of an additive expression that must be a string
	 */
	public BasicString stringExpr() {
		Value v = expr();
		if (!v.isString()) {
			throw typeMismatch("string expression expected");
		}
		return v.stringValue();
	}

	/**
	 * @return the value of {@code ( expr )}, which must be an integer
	 */
	public int bracketedIntExpr() {
		accept(Token.LEFTPAREN);
		int value = intExpr();
		accept(Token.RIGHTPAREN);
		return value;
	}

	/**
	 * Comparison tier. Operands of a comparison must have the same type; the
	 * result of a comparison is always the integer 0 or 1. Comparisons chain
	 * from left to right, each one comparing the previous result with the
	 * next operand. Without any comparison operator, the value of the
	 * additive expression is returned as is, so a lone string expression
	 * stays a string: {@code IF} rejects it with
	 * {@link ErrorKind#TYPE_MISMATCH} and {@code Basic.eval} returns it.
	 *
	 * @return the value of the relation
	 */
	public Value relation() {
		Value r1 = expr();
		Token op = tokens.token();
		while (op.isRelational()) {
			tokens.next();
			Value r2 = expr();
			requireSameType(r1, r2);
			int n;
			if (r1.isInteger()) {
				n = Integer.compare(r1.intValue(), r2.intValue());
			} else {
				n = Integer.signum(r1.stringValue().compareTo(r2.stringValue()));
			}
			switch (op) {
			case LT:
				r1 = Value.of(n < 0);
				break;
			case GT:
				r1 = Value.of(n > 0);
				break;
			case EQ:
				r1 = Value.of(n == 0);
				break;
			case LE:
				r1 = Value.of(n <= 0);
				break;
			case GE:
				r1 = Value.of(n >= 0);
				break;
			default:
				r1 = Value.of(n != 0);
				break;
			}
			op = tokens.token();
		}
		return r1;
	}

	/**
	 * Additive tier: {@code + - AND OR}. {@code +} adds integers or
	 * concatenates strings; the other operators take integers only.
	 *
	 * @return the value of the expression
	 */
	public Value expr() {
		Value v = term();
		Token op = tokens.token();
		while (op == Token.PLUS || op == Token.MINUS || op == Token.AND || op == Token.OR) {
			tokens.next();
			Value t2 = term();
			if (op != Token.PLUS && !v.isInteger()) {
				throw typeMismatch(op.name() + " needs integer operands");
			}
			requireSameType(v, t2);
			switch (op) {
			case PLUS:
				if (v.isInteger()) {
					v = Value.of(v.intValue() + t2.intValue());
				} else {
					v = Value.of(arena.concat(v.stringValue(), t2.stringValue()));
				}
				break;
			case MINUS:
				v = Value.of(v.intValue() - t2.intValue());
				break;
			case AND:
				v = Value.of(v.intValue() & t2.intValue());
				break;
			default:
				v = Value.of(v.intValue() | t2.intValue());
				break;
			}
			op = tokens.token();
		}
		return v;
	}

	/**
	 * Multiplicative tier: {@code * / MOD}, integers only, truncating
	 * division.
	 */
	private Value term() {
		Value v = factor();
		Token op = tokens.token();
		while (op == Token.ASTR || op == Token.SLASH || op == Token.MOD) {
			tokens.next();
			Value f2 = factor();
			if (!v.isInteger() || !f2.isInteger()) {
				throw typeMismatch(op.name() + " needs integer operands");
			}
			int left = v.intValue();
			int right = f2.intValue();
			switch (op) {
			case ASTR:
				v = Value.of(left * right);
				break;
			case SLASH:
				if (right == 0) {
					throw new BasicRuntimeException(ErrorKind.DIVISION_BY_ZERO, left + " / 0");
				}
				v = Value.of(left / right);
				break;
			default:
				if (right == 0) {
					throw new BasicRuntimeException(ErrorKind.DIVISION_BY_ZERO, left + " MOD 0");
				}
				v = Value.of(left % right);
				break;
			}
			op = tokens.token();
		}
		return v;
	}

	private Value factor() {
		Token t = tokens.token();
		switch (t) {
		case STRING:
			byte[] literal = tokens.string();
			BasicString s = arena.copyOf(literal, 0, literal.length);
			accept(Token.STRING);
			return Value.of(s);
		case NUMBER:
			int n = tokens.number();
			accept(Token.NUMBER);
			return Value.of(n);
		case LEFTPAREN:
			accept(Token.LEFTPAREN);
			Value v = expr();
			accept(Token.RIGHTPAREN);
			return v;
		case INTVAR:
		case STRINGVAR:
			return variables.get(variableReference());
		default:
			if (t.isIntegerFunction()) {
				accept(t);
				return Value.of(integerFunction(t));
			}
			if (t.isStringFunction()) {
				accept(t);
				return Value.of(stringFunction(t));
			}
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unexpected " + t.name() + " in expression");
		}
	}

	private int integerFunction(Token function) {
		switch (function) {
		case PEEK:
			return requireHostMemory().peek(arguments(INTEGER_ARG)[0].intValue());
		case ABS:
			int abs = arguments(INTEGER_ARG)[0].intValue();
			return abs < 0 ? -abs : abs;
		case INT:
			return arguments(INTEGER_ARG)[0].intValue();
		case SGN:
			int sgn = arguments(INTEGER_ARG)[0].intValue();
			if (sgn > 1) {
				sgn = 1;
			}
			if (sgn < 0) {
				sgn = -1;
			}
			return sgn;
		case LEN:
			return arguments(STRING_ARG)[0].stringValue().length();
		case CODE:
			BasicString code = arguments(STRING_ARG)[0].stringValue();
			return code.length() > 0 ? code.byteAt(0) : 0;
		case VAL:
			return stringToInteger(arguments(STRING_ARG)[0].stringValue());
		case RND:
			return random.nextInt(arguments(INTEGER_ARG)[0].intValue());
		default:
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unknown function " + function.name());
		}
	}

	private BasicString stringFunction(Token function) {
		Value[] args;
		switch (function) {
		case LEFTSTR:
			args = arguments(STRING_INTEGER_ARGS);
			return cut(args[0].stringValue(), 1, args[1].intValue());
		case RIGHTSTR:
			args = arguments(STRING_INTEGER_ARGS);
			return cutRight(args[0].stringValue(), args[1].intValue());
		case MIDSTR:
			args = arguments(STRING_INTEGER_INTEGER_ARGS);
			return cut(args[0].stringValue(), args[1].intValue(), args[2].intValue());
		case CHRSTR:
			args = arguments(INTEGER_ARG);
			// two bytes are allocated, only the first one carries the code
			BasicString chr = arena.copyOf(new byte[] { (byte) args[0].intValue(), 0 }, 0, 2);
			return chr;
		default:
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unknown function " + function.name());
		}
	}

	/**
	 * Parses the parenthesized arguments of a function and checks them
	 * against its signature.
	 */
	private Value[] arguments(Value.Type[] signature) {
		Value[] args = new Value[signature.length];
		accept(Token.LEFTPAREN);
		for (int i = 0; i < signature.length; i++) {
			args[i] = expr();
			if (args[i].getType() != signature[i]) {
				throw typeMismatch("argument " + (i + 1) + " must be " + signature[i].name().toLowerCase());
			}
			if (i + 1 < signature.length) {
				accept(Token.COMMA);
			}
		}
		accept(Token.RIGHTPAREN);
		return args;
	}

	/**
	 * {@code count} bytes of {@code s} from the 1-based position {@code start},
	 * clamped to the string.
	 */
	private BasicString cut(BasicString s, int start, int count) {
		int length = s.length();
		if (start < 1) {
			start = 1;
		}
		if (start > length || count <= 0) {
			return arena.allocate(0);
		}
		int remaining = length - (start - 1);
		return arena.substring(s, start - 1, Math.min(count, remaining));
	}

	/**
	 * The last {@code count} bytes of {@code s}. Empty when {@code count} is
	 * not smaller than the length of {@code s}.
	 */
	private BasicString cutRight(BasicString s, int count) {
		int remaining = s.length() - count;
		if (remaining <= 0) {
			return arena.allocate(0);
		}
		return cut(s, remaining + 1, count);
	}

	/**
	 * Parses an optionally negative decimal integer; anything else is a type
	 * mismatch.
	 */
	static int stringToInteger(BasicString s) {
		int i = 0;
		int length = s.length();
		boolean negative = false;
		if (length > 0 && s.byteAt(0) == '-') {
			negative = true;
			i++;
		}
		if (i == length) {
			throw typeMismatch("\"" + s + "\" is not a number");
		}
		int n = 0;
		for (; i < length; i++) {
			int c = s.byteAt(i);
			if (c < '0' || c > '9') {
				throw typeMismatch("\"" + s + "\" is not a number");
			}
			n = 10 * n + c - '0';
		}
		return negative ? -n : n;
	}

	private static void requireSameType(Value left, Value right) {
		if (left.getType() != right.getType()) {
			throw typeMismatch(
					left.getType().name().toLowerCase() + " and " + right.getType().name().toLowerCase() + " operands");
		}
	}

	private static BasicRuntimeException typeMismatch(String msg) {
		return new BasicRuntimeException(ErrorKind.TYPE_MISMATCH, msg);
	}
}
