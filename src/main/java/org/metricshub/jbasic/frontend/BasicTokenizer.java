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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntConsumer;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.VariableRef;

/**
 * Reference {@link TokenSource} over the text of a BASIC program.
 * <p>
 * Keywords are recognized case-insensitively as prefixes at the start of a
 * word, so {@code GOTO} reads as {@code GO TO} and {@code GOSUB} as
 * {@code GO SUB}. Any other letter is a variable name, made a string
 * variable by a trailing {@code $}. Positions are character offsets in the
 * program text.
 */
public class BasicTokenizer implements TokenSource {

	/**
	 * Keywords and their token values. No keyword is a prefix of another one,
	 * so the first match is the only possible match.
	 */
	private static final Map<String, Token> KEYWORDS = new LinkedHashMap<String, Token>();

	static {
		KEYWORDS.put("LET", Token.LET);
		KEYWORDS.put("PRINT", Token.PRINT);
		KEYWORDS.put("IF", Token.IF);
		KEYWORDS.put("THEN", Token.THEN);
		KEYWORDS.put("ELSE", Token.ELSE);
		KEYWORDS.put("FOR", Token.FOR);
		KEYWORDS.put("TO", Token.TO);
		KEYWORDS.put("STEP", Token.STEP);
		KEYWORDS.put("NEXT", Token.NEXT);
		KEYWORDS.put("GO", Token.GO);
		KEYWORDS.put("SUB", Token.SUB);
		KEYWORDS.put("RETURN", Token.RETURN);
		KEYWORDS.put("REM", Token.REM);
		KEYWORDS.put("POKE", Token.POKE);
		KEYWORDS.put("STOP", Token.STOP);
		KEYWORDS.put("END", Token.END);
		KEYWORDS.put("DATA", Token.DATA);
		KEYWORDS.put("RANDOMIZE", Token.RANDOMIZE);
		KEYWORDS.put("OPTION", Token.OPTION);
		KEYWORDS.put("BASE", Token.BASE);
		KEYWORDS.put("INPUT", Token.INPUT);
		KEYWORDS.put("RESTORE", Token.RESTORE);
		KEYWORDS.put("TAB", Token.TAB);
		KEYWORDS.put("AND", Token.AND);
		KEYWORDS.put("OR", Token.OR);
		KEYWORDS.put("MOD", Token.MOD);

		KEYWORDS.put("PEEK", Token.PEEK);
		KEYWORDS.put("ABS", Token.ABS);
		KEYWORDS.put("INT", Token.INT);
		KEYWORDS.put("SGN", Token.SGN);
		KEYWORDS.put("LEN", Token.LEN);
		KEYWORDS.put("CODE", Token.CODE);
		KEYWORDS.put("VAL", Token.VAL);
		KEYWORDS.put("RND", Token.RND);

		KEYWORDS.put("LEFT$", Token.LEFTSTR);
		KEYWORDS.put("RIGHT$", Token.RIGHTSTR);
		KEYWORDS.put("MID$", Token.MIDSTR);
		KEYWORDS.put("CHR$", Token.CHRSTR);
	}

	private final char[] program;

	/** Start of the current token. */
	private int start;
	/** First character after the current token. */
	private int end;

	private Token token;
	private Token previous;

	private int number;
	private int variable;
	private int stringStart;
	private int stringLength;

	/**
	 * Creates a tokenizer positioned on the first token of the program. A
	 * newline is appended to a program whose last line is not terminated.
	 *
	 * @param program text of the program
	 */
	public BasicTokenizer(String program) {
		String text = program.isEmpty() || program.endsWith("\n") ? program : program + "\n";
		this.program = text.toCharArray();
		restart();
	}

	@Override
	public Token token() {
		return token;
	}

	@Override
	public void next() {
		if (token == Token.ENDOFINPUT) {
			return;
		}
		previous = token;
		lexer();
	}

	@Override
	public int number() {
		return token == Token.NUMBER ? number : 0;
	}

	@Override
	public int variableNumber() {
		return variable;
	}

	@Override
	public byte[] string() {
		byte[] bytes = new byte[stringLength];
		for (int i = 0; i < stringLength; i++) {
			bytes[i] = (byte) program[stringStart + i];
		}
		return bytes;
	}

	@Override
	public void stringTo(IntConsumer sink) {
		for (int i = 0; i < stringLength; i++) {
			sink.accept(program[stringStart + i] & 0xFF);
		}
	}

	@Override
	public int position() {
		return start;
	}

	@Override
	public void seek(int position) {
		if (position < 0 || position > program.length) {
			throw new IllegalArgumentException("Position " + position + " outside of the program");
		}
		// seek targets are line starts
		previous = Token.CR;
		end = position;
		lexer();
	}

	@Override
	public void restart() {
		seek(0);
	}

	@Override
	public void skipToEndOfLine() {
		int i = start;
		while (i < program.length && program[i] != '\n') {
			i++;
		}
		end = Math.min(i + 1, program.length);
		previous = Token.CR;
		lexer();
	}

	@Override
	public boolean isFinished() {
		return token == Token.ENDOFINPUT;
	}

	private BasicRuntimeException lexerException(String msg) {
		int line = 1;
		for (int i = 0; i < start; i++) {
			if (program[i] == '\n') {
				line++;
			}
		}
		return new BasicRuntimeException(ErrorKind.SYNTAX, msg + " (text line " + line + ")");
	}

	private int charAt(int i) {
		return i < program.length ? program[i] : -1;
	}

	private void lexer() {
		int i = end;
		// clear whitespace
		while (i < program.length && (program[i] == ' ' || program[i] == '\t' || program[i] == '\r')) {
			i++;
		}
		start = i;
		int c = charAt(i);
		if (c < 0) {
			end = i;
			token = Token.ENDOFINPUT;
			return;
		}
		end = i + 1;
		if (c == '\n') {
			token = Token.CR;
			return;
		}
		if (c == ',') {
			token = Token.COMMA;
			return;
		}
		if (c == ';') {
			token = Token.SEMICOLON;
			return;
		}
		if (c == '(') {
			token = Token.LEFTPAREN;
			return;
		}
		if (c == ')') {
			token = Token.RIGHTPAREN;
			return;
		}
		if (c == '+') {
			token = Token.PLUS;
			return;
		}
		if (c == '-') {
			if (isDigit(charAt(i + 1)) && (previous == null || !previous.endsOperand())) {
				readNumber(i + 1, true);
				return;
			}
			token = Token.MINUS;
			return;
		}
		if (c == '*') {
			token = Token.ASTR;
			return;
		}
		if (c == '/') {
			token = Token.SLASH;
			return;
		}
		if (c == '%') {
			token = Token.MOD;
			return;
		}
		if (c == '&') {
			token = Token.AND;
			return;
		}
		if (c == '|') {
			token = Token.OR;
			return;
		}
		if (c == '=') {
			token = Token.EQ;
			return;
		}
		if (c == '<') {
			if (charAt(i + 1) == '=') {
				end = i + 2;
				token = Token.LE;
				return;
			} else if (charAt(i + 1) == '>') {
				end = i + 2;
				token = Token.NE;
				return;
			}
			token = Token.LT;
			return;
		}
		if (c == '>') {
			if (charAt(i + 1) == '=') {
				end = i + 2;
				token = Token.GE;
				return;
			}
			token = Token.GT;
			return;
		}
		if (c == '"') {
			int j = i + 1;
			while (j < program.length && program[j] != '"' && program[j] != '\n') {
				if (program[j] > 0xFF) {
					throw lexerException("Character outside ISO-8859-1 in string (" + (int) program[j] + ")");
				}
				j++;
			}
			if (charAt(j) != '"') {
				throw lexerException("Unterminated string");
			}
			stringStart = i + 1;
			stringLength = j - stringStart;
			end = j + 1;
			token = Token.STRING;
			return;
		}
		if (isDigit(c)) {
			readNumber(i, false);
			return;
		}
		if (Character.isLetter(c)) {
			for (Map.Entry<String, Token> keyword : KEYWORDS.entrySet()) {
				String text = keyword.getKey();
				if (new String(program, i, Math.min(text.length(), program.length - i)).equalsIgnoreCase(text)) {
					end = i + text.length();
					token = keyword.getValue();
					return;
				}
			}
			int letter = Character.toUpperCase(c) - 'A';
			if (letter < 0 || letter >= VariableRef.LETTERS) {
				throw lexerException("Invalid variable name: " + (char) c);
			}
			if (charAt(i + 1) == '$') {
				end = i + 2;
				variable = VariableRef.string(letter);
				token = Token.STRINGVAR;
				return;
			}
			variable = VariableRef.integer(letter);
			token = Token.INTVAR;
			return;
		}

		throw lexerException("Invalid character (" + c + "): " + ((char) c));
	}

	private void readNumber(int from, boolean negative) {
		int n = 0;
		int j = from;
		while (isDigit(charAt(j))) {
			n = 10 * n + program[j] - '0';
			j++;
		}
		end = j;
		number = negative ? -n : n;
		token = Token.NUMBER;
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}
}
