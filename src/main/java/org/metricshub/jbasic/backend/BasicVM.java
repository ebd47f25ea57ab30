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
import org.metricshub.jbasic.jrt.BasicInput;
import org.metricshub.jbasic.jrt.BasicPrinter;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.StringArena;
import org.metricshub.jbasic.jrt.Value;
import org.metricshub.jbasic.jrt.VariableRef;
import org.metricshub.jbasic.jrt.VariableStore;
import org.metricshub.jbasic.util.BasicLogger;
import org.metricshub.jbasic.util.BasicSettings;
import org.slf4j.Logger;

/**
 * The BASIC virtual machine: executes a program one line at a time, reading
 * its statements straight from a {@link TokenSource}.
 * <p>
 * Each line holds exactly one statement. All the state of a run lives in the
 * instance: variables, the string arena, the GOSUB and FOR stacks, the line
 * index and the DATA cursor. Any {@link BasicRuntimeException} is fatal: the
 * VM finishes and the exception reaches the host with the line number
 * attached.
 * <p>
 * Instances are not thread-safe.
 */
public class BasicVM implements BasicInterpreter {

	private static final Logger LOG = BasicLogger.getLogger(BasicVM.class);

	private final TokenSource tokens;
	private final BasicSettings settings;
	private final StringArena arena;
	private final VariableStore variables = new VariableStore();
	private final BSDRandom random = new BSDRandom();
	private final ExpressionEvaluator evaluator;
	private final BoundedStack<Integer> gosubStack;
	private final BoundedStack<ForFrame> forStack;
	private final LineIndex lineIndex = new LineIndex();
	private final DataCursor dataCursor = new DataCursor();
	private final BasicPrinter printer;
	private final BasicInput input;

	private int programStart;
	private int lineNumber;
	private boolean ended;

	/**
	 * Whether the statement being executed follows a THEN whose condition
	 * held; an ELSE then ends the statement.
	 */
	private boolean thenBranch;

	/**
	 * Creates a VM positioned at the start of the program.
	 *
	 * @param tokens the program
	 * @param settings I/O streams, capacities and host hooks
	 */
	public BasicVM(TokenSource tokens, BasicSettings settings) {
		this.tokens = tokens;
		this.settings = settings;
		this.arena = new StringArena(settings.getArenaCapacity());
		this.evaluator = new ExpressionEvaluator(tokens, arena, variables, settings.getHostMemory(), random);
		this.gosubStack = new BoundedStack<Integer>("GOSUB", settings.getGosubDepth(), OverflowPolicy.FAIL);
		this.forStack = new BoundedStack<ForFrame>("FOR", settings.getForDepth(), OverflowPolicy.IGNORE);
		this.printer = new BasicPrinter(settings.getOutputStream());
		this.input = new BasicInput(settings.getInput());
		init();
	}

	/**
	 * Resets the VM to run the program from its first line: variables are
	 * cleared, stacks and line index emptied, the DATA cursor rewound.
	 */
	public final void init() {
		tokens.restart();
		programStart = tokens.position();
		variables.clear();
		arena.reset();
		gosubStack.clear();
		forStack.clear();
		lineIndex.clear();
		dataCursor.moveTo(programStart);
		evaluator.setArrayBase(0);
		printer.resetColumn();
		lineNumber = 0;
		ended = false;
		thenBranch = false;
		if (settings.isEagerLineIndex()) {
			indexProgram();
		}
	}

	@Override
	public void run() {
		if (isFinished()) {
			LOG.debug("Program finished");
			return;
		}
		try {
			lineStatement();
		} catch (BasicRuntimeException e) {
			ended = true;
			throw e.atLine(lineNumber);
		} catch (RuntimeException e) {
			ended = true;
			throw e;
		} finally {
			printer.flush();
		}
	}

	@Override
	public boolean isFinished() {
		return ended || tokens.isFinished();
	}

	/**
	 * @return the number of the line executed last, 0 before the first one
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Reads a variable of the program, for the host.
	 *
	 * @param ref variable reference, see {@link VariableRef}
	 * @return the current value
	 */
	public Value getVariable(int ref) {
		return variables.get(ref);
	}

	/**
	 * Assigns a variable of the program, for the host. Strings are copied
	 * into the variable's own buffer.
	 *
	 * @param ref variable reference, see {@link VariableRef}
	 * @param value new value, of the kind of the reference
	 * @throws BasicRuntimeException with {@link ErrorKind#TYPE_MISMATCH},
	 *         leaving the variable unchanged, or
	 *         {@link ErrorKind#INVALID_VARIABLE}
	 */
	public void setVariable(int ref, Value value) {
		variables.set(ref, value);
	}

	/**
	 * @return the cursor that RESTORE moves
	 */
	public DataCursor getDataCursor() {
		return dataCursor;
	}

	/**
	 * @return the array base set by OPTION BASE
	 */
	public int getArrayBase() {
		return evaluator.getArrayBase();
	}

	int getIndexedLineCount() {
		return lineIndex.size();
	}

	int getGosubDepth() {
		return gosubStack.size();
	}

	int getForDepth() {
		return forStack.size();
	}

	private void lineStatement() {
		while (tokens.token() == Token.CR) {
			tokens.next();
		}
		if (tokens.isFinished()) {
			return;
		}
		if (tokens.token() != Token.NUMBER) {
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Line number expected. Found: " + tokens.token().name());
		}
		lineNumber = tokens.number();
		LOG.debug("----------- Line number {} ---------", lineNumber);
		lineIndex.add(lineNumber, tokens.position());
		accept(Token.NUMBER);
		thenBranch = false;
		statement();
	}

	private void statement() {
		arena.reset();
		Token token = tokens.token();
		switch (token) {
		case PRINT:
			printStatement();
			break;
		case IF:
			ifStatement();
			break;
		case GO:
			goStatement();
			break;
		case RETURN:
			returnStatement();
			break;
		case FOR:
			forStatement();
			break;
		case NEXT:
			nextStatement();
			break;
		case POKE:
			pokeStatement();
			break;
		case STOP:
		case END:
			stopStatement(token);
			break;
		case REM:
			// the comment text is not lexed
			tokens.skipToEndOfLine();
			break;
		case DATA:
			dataStatement();
			break;
		case RANDOMIZE:
			randomizeStatement();
			break;
		case OPTION:
			optionStatement();
			break;
		case INPUT:
			inputStatement();
			break;
		case RESTORE:
			restoreStatement();
			break;
		case LET:
			accept(Token.LET);
			letStatement();
			break;
		case INTVAR:
		case STRINGVAR:
			letStatement();
			break;
		default:
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unknown statement: " + token.name());
		}
	}

	private void accept(Token expected) {
		evaluator.accept(expected);
	}

	private boolean atEndOfStatement() {
		Token t = tokens.token();
		return t == Token.CR || t == Token.ENDOFINPUT || (thenBranch && t == Token.ELSE);
	}

	private void endStatement() {
		if (thenBranch && tokens.token() == Token.ELSE) {
			// the ELSE branch is not taken
			tokens.skipToEndOfLine();
		} else if (tokens.token() != Token.ENDOFINPUT) {
			accept(Token.CR);
		}
	}

	private void letStatement() {
		int ref = evaluator.variableReference();
		accept(Token.EQ);
		Value value = evaluator.expr();
		variables.set(ref, value);
		LOG.trace("{} = {}", VariableRef.name(ref), value);
		endStatement();
	}

	private void printStatement() {
		accept(Token.PRINT);
		boolean newline = true;
		while (!atEndOfStatement()) {
			Token t = tokens.token();
			newline = true;
			if (t == Token.STRING) {
				tokens.stringTo(printer::print);
				tokens.next();
			} else if (t.startsStringExpression()) {
				printer.print(evaluator.stringExpr());
			} else if (t == Token.COMMA) {
				printer.printTab();
				newline = false;
				tokens.next();
			} else if (t == Token.SEMICOLON) {
				newline = false;
				tokens.next();
			} else if (t == Token.TAB) {
				accept(Token.TAB);
				printer.tab(evaluator.bracketedIntExpr());
			} else if (t.startsIntegerExpression()) {
				printer.printNumber(evaluator.intExpr());
			} else {
				throw new BasicRuntimeException(ErrorKind.SYNTAX, "Unexpected " + t.name() + " in PRINT");
			}
		}
		if (newline) {
			printer.newline();
		}
		endStatement();
	}

	private void ifStatement() {
		accept(Token.IF);
		Value condition = evaluator.relation();
		if (!condition.isInteger()) {
			throw new BasicRuntimeException(ErrorKind.TYPE_MISMATCH, "IF needs a comparison or an integer expression");
		}
		accept(Token.THEN);
		if (condition.intValue() != 0) {
			thenBranch = true;
			statement();
			return;
		}
		Token t = tokens.token();
		while (t != Token.ELSE && t != Token.CR && t != Token.ENDOFINPUT) {
			if (t == Token.REM) {
				// the rest of the line is comment text
				tokens.skipToEndOfLine();
				return;
			}
			tokens.next();
			t = tokens.token();
		}
		if (t == Token.ELSE) {
			accept(Token.ELSE);
			thenBranch = false;
			statement();
		} else if (t == Token.CR) {
			accept(Token.CR);
		}
	}

	private void goStatement() {
		accept(Token.GO);
		Token kind = evaluator.acceptEither(Token.TO, Token.SUB);
		int target = evaluator.intExpr();
		endStatement();
		if (kind == Token.SUB) {
			int returnLine = tokens.number();
			gosubStack.push(returnLine);
			LOG.debug("GOSUB {}: return to line {} (depth {})", target, returnLine, gosubStack.size());
		}
		jump(target);
	}

	private void returnStatement() {
		accept(Token.RETURN);
		Integer returnLine = gosubStack.pop();
		if (returnLine == null) {
			LOG.debug("RETURN without GOSUB at line {} ignored", lineNumber);
			endStatement();
			return;
		}
		LOG.debug("RETURN to line {} (depth {})", returnLine, gosubStack.size());
		jump(returnLine);
	}

	private void forStatement() {
		accept(Token.FOR);
		if (tokens.token() != Token.INTVAR) {
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "FOR needs an integer variable");
		}
		int ref = evaluator.variableReference();
		accept(Token.EQ);
		variables.set(ref, Value.of(evaluator.intExpr()));
		accept(Token.TO);
		int limit = evaluator.intExpr();
		int step = 1;
		if (tokens.token() == Token.STEP) {
			accept(Token.STEP);
			step = evaluator.intExpr();
		}
		endStatement();
		ForFrame frame = new ForFrame(tokens.number(), ref, limit, step);
		if (forStack.push(frame)) {
			LOG.debug("FOR {} TO {} STEP {}: loop at line {} (depth {})", VariableRef.name(ref), limit, step, frame.lineAfterFor, forStack.size());
		} else {
			LOG.warn("FOR stack full (depth {}) at line {}: loop on {} is not tracked", forStack.getDepth(), lineNumber, VariableRef.name(ref));
		}
	}

	private void nextStatement() {
		accept(Token.NEXT);
		if (tokens.token() != Token.INTVAR) {
			throw new BasicRuntimeException(ErrorKind.SYNTAX, "NEXT needs an integer variable");
		}
		int ref = evaluator.variableReference();
		ForFrame frame = forStack.peek();
		if (frame == null || frame.variable != ref) {
			throw new BasicRuntimeException(ErrorKind.MISMATCHED_NEXT, "NEXT " + VariableRef.name(ref) + " without matching FOR");
		}
		int value = variables.get(ref).intValue() + frame.step;
		variables.set(ref, Value.of(value));
		if (frame.continues(value)) {
			jump(frame.lineAfterFor);
		} else {
			forStack.pop();
			LOG.debug("FOR loop on {} done (depth {})", VariableRef.name(ref), forStack.size());
			endStatement();
		}
	}

	private void pokeStatement() {
		accept(Token.POKE);
		int address = evaluator.intExpr();
		accept(Token.COMMA);
		int value = evaluator.intExpr();
		endStatement();
		evaluator.requireHostMemory().poke(address, value);
	}

	private void stopStatement(Token keyword) {
		accept(keyword);
		endStatement();
		ended = true;
		LOG.debug("{} at line {}", keyword.name(), lineNumber);
	}

	private void dataStatement() {
		accept(Token.DATA);
		while (true) {
			Token t = tokens.token();
			if (t != Token.STRING && t != Token.NUMBER) {
				throw new BasicRuntimeException(ErrorKind.SYNTAX, "DATA items must be literals. Found: " + t.name());
			}
			tokens.next();
			if (atEndOfStatement()) {
				break;
			}
			accept(Token.COMMA);
		}
		endStatement();
	}

	private void randomizeStatement() {
		accept(Token.RANDOMIZE);
		int seed = 0;
		if (!atEndOfStatement()) {
			seed = evaluator.intExpr();
		}
		endStatement();
		if (seed == 0) {
			seed = entropySeed();
		}
		LOG.debug("RANDOMIZE with seed {}", seed);
		random.setSeed(seed);
	}

	private static int entropySeed() {
		int seed = (int) ProcessHandle.current().pid();
		seed ^= System.getProperty("user.name", "").hashCode();
		seed ^= (int) (System.currentTimeMillis() / 1000L);
		return seed;
	}

	private void optionStatement() {
		accept(Token.OPTION);
		accept(Token.BASE);
		int base = evaluator.intExpr();
		endStatement();
		if (base != 0 && base != 1) {
			throw new BasicRuntimeException(ErrorKind.INVALID_BASE, "OPTION BASE " + base);
		}
		evaluator.setArrayBase(base);
	}

	private void inputStatement() {
		accept(Token.INPUT);
		Token t = tokens.token();
		if (t == Token.STRING) {
			tokens.stringTo(printer::print);
			tokens.next();
			evaluator.acceptEither(Token.COMMA, Token.SEMICOLON);
		} else if (t.isStringFunction()) {
			printer.print(evaluator.stringExpr());
			evaluator.acceptEither(Token.COMMA, Token.SEMICOLON);
		} else {
			printer.print('?');
			printer.print(' ');
		}
		printer.flush();
		while (true) {
			t = tokens.token();
			if (t != Token.INTVAR && t != Token.STRINGVAR) {
				throw new BasicRuntimeException(ErrorKind.SYNTAX, "INPUT needs a variable. Found: " + t.name());
			}
			int ref = evaluator.variableReference();
			String line = input.readLine();
			printer.resetColumn();
			if (VariableRef.isString(ref)) {
				variables.set(ref, Value.of(BasicInput.toBasicString(line)));
			} else {
				variables.set(ref, Value.of(BasicInput.toInteger(line)));
			}
			if (atEndOfStatement()) {
				break;
			}
			evaluator.acceptEither(Token.COMMA, Token.SEMICOLON);
		}
		endStatement();
	}

	private void restoreStatement() {
		accept(Token.RESTORE);
		int target = 0;
		if (!atEndOfStatement()) {
			target = evaluator.intExpr();
		}
		endStatement();
		if (target == 0) {
			dataCursor.moveTo(programStart);
		} else {
			int saved = tokens.position();
			jump(target);
			dataCursor.moveTo(tokens.position());
			tokens.seek(saved);
		}
		LOG.debug("RESTORE: DATA cursor at position {}", dataCursor.getPosition());
	}

	/**
	 * Moves the token source to the start of a line, through the line index
	 * when the line is known, scanning the program otherwise.
	 */
	private void jump(int target) {
		Integer position = lineIndex.find(target);
		if (position != null) {
			LOG.debug("Jump to line {}: indexed", target);
			tokens.seek(position);
		} else {
			LOG.debug("Jump to line {}: not indexed, scanning", target);
			jumpSlow(target);
		}
	}

	private void jumpSlow(int target) {
		tokens.restart();
		while (tokens.token() != Token.NUMBER || tokens.number() != target) {
			if (tokens.isFinished()) {
				throw new BasicRuntimeException(ErrorKind.UNDEFINED_LINE, "Line " + target + " not found");
			}
			if (tokens.token() == Token.CR) {
				tokens.next();
			} else {
				tokens.skipToEndOfLine();
			}
		}
	}

	private void indexProgram() {
		while (!tokens.isFinished()) {
			if (tokens.token() == Token.NUMBER) {
				lineIndex.add(tokens.number(), tokens.position());
			}
			if (tokens.token() == Token.CR) {
				tokens.next();
			} else {
				tokens.skipToEndOfLine();
			}
		}
		tokens.restart();
		LOG.debug("Indexed {} lines", lineIndex.size());
	}
}
