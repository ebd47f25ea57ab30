package org.metricshub.jbasic.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jbasic.frontend.BasicTokenizer;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.BasicString;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.Value;
import org.metricshub.jbasic.jrt.VariableRef;
import org.metricshub.jbasic.util.BasicSettings;

public class BasicVMTest {

	private ByteArrayOutputStream out;
	private BasicSettings settings;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		settings = new BasicSettings();
		settings.setOutputStream(new PrintStream(out, true));
	}

	private String output() {
		return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
	}

	private BasicVM load(String program) {
		return new BasicVM(new BasicTokenizer(program), settings);
	}

	@Test
	public void testOneLinePerRun() {
		BasicVM vm = load("10 PRINT 1\n20 PRINT 2\n");
		assertFalse(vm.isFinished());
		vm.run();
		assertEquals("1\n", output());
		assertEquals(10, vm.getLineNumber());
		assertFalse(vm.isFinished());
		vm.run();
		assertEquals("1\n2\n", output());
		assertEquals(20, vm.getLineNumber());
		assertTrue(vm.isFinished());
	}

	@Test
	public void testRunAfterFinishDoesNothing() {
		BasicVM vm = load("10 STOP\n20 PRINT 2\n");
		vm.interpret();
		assertTrue(vm.isFinished());
		vm.run();
		assertEquals("", output());
		assertEquals(10, vm.getLineNumber());
	}

	@Test
	public void testLoopIsSteppedLineByLine() {
		BasicVM vm = load("10 FOR I = 1 TO 2\n20 NEXT I\n30 PRINT I\n");
		vm.run();
		assertEquals(1, vm.getForDepth());
		vm.run();
		assertEquals(20, vm.getLineNumber());
		assertEquals(2, vm.getVariable(VariableRef.integer(8)).intValue());
		vm.run();
		assertEquals(20, vm.getLineNumber());
		assertEquals(0, vm.getForDepth());
		vm.run();
		assertEquals("3\n", output());
		assertTrue(vm.isFinished());
	}

	@Test
	public void testErrorFinishesAndCarriesLine() {
		BasicVM vm = load("10 LET A = 1\n20 LET A = A / 0\n30 PRINT A\n");
		vm.run();
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, vm::run);
		assertEquals(ErrorKind.DIVISION_BY_ZERO, e.getKind());
		assertEquals(20, e.getLineNumber());
		assertTrue(e.toReport().startsWith("Line 20: Division by zero error"));
		assertTrue(vm.isFinished());
	}

	@Test
	public void testLazyLineIndex() {
		BasicVM vm = load("10 GOTO 30\n20 PRINT 2\n30 PRINT 3\n");
		assertEquals(0, vm.getIndexedLineCount());
		vm.run();
		// the target of a scanned jump is indexed when it runs
		assertEquals(1, vm.getIndexedLineCount());
		vm.run();
		assertEquals(2, vm.getIndexedLineCount());
		assertEquals("3\n", output());
	}

	@Test
	public void testEagerLineIndex() {
		settings.setEagerLineIndex(true);
		BasicVM vm = load("10 GOTO 30\n20 PRINT 2\n\n30 PRINT 3\n");
		assertEquals(3, vm.getIndexedLineCount());
		assertEquals(0, vm.getLineNumber());
		vm.interpret();
		assertEquals("3\n", output());
	}

	@Test
	public void testGosubStackDepth() {
		BasicVM vm = load("10 GOSUB 100\n20 STOP\n100 GOSUB 200\n110 RETURN\n200 RETURN\n");
		vm.run();
		assertEquals(1, vm.getGosubDepth());
		vm.run();
		assertEquals(2, vm.getGosubDepth());
		vm.run();
		assertEquals(200, vm.getLineNumber());
		assertEquals(1, vm.getGosubDepth());
		vm.run();
		assertEquals(110, vm.getLineNumber());
		assertEquals(0, vm.getGosubDepth());
		vm.run();
		assertEquals(20, vm.getLineNumber());
		assertTrue(vm.isFinished());
	}

	@Test
	public void testRestoreMovesDataCursor() {
		BasicVM vm = load("10 DATA 1\n20 RESTORE 30\n30 DATA 2\n40 RESTORE\n");
		DataCursor cursor = vm.getDataCursor();
		assertEquals(0, cursor.getPosition());
		assertTrue(cursor.isSeekPending());
		vm.run();
		vm.run();
		assertEquals("10 DATA 1\n20 RESTORE 30\n".length(), cursor.getPosition());
		vm.run();
		assertEquals(30, vm.getLineNumber());
		vm.run();
		assertEquals(0, cursor.getPosition());
		assertTrue(vm.isFinished());
	}

	@Test
	public void testOptionBase() {
		BasicVM vm = load("10 OPTION BASE 1\n");
		assertEquals(0, vm.getArrayBase());
		vm.interpret();
		assertEquals(1, vm.getArrayBase());
	}

	@Test
	public void testInitRestartsProgram() {
		BasicVM vm = load("10 LET A = A + 1\n20 PRINT A\n");
		vm.interpret();
		vm.init();
		assertFalse(vm.isFinished());
		assertEquals(0, vm.getVariable(VariableRef.integer(0)).intValue());
		vm.interpret();
		assertEquals("1\n1\n", output());
	}

	@Test
	public void testForFrameDroppedWhenStackFull() {
		settings.setForDepth(1);
		BasicVM vm = load("10 FOR I = 1 TO 2\n20 FOR J = 1 TO 2\n30 PRINT J\n");
		vm.run();
		vm.run();
		assertEquals(1, vm.getForDepth());
	}

	@Test
	public void testHostSetsVariables() {
		BasicVM vm = load("10 PRINT A; \" \"; B$\n");
		vm.setVariable(VariableRef.integer(0), Value.of(41));
		vm.setVariable(VariableRef.string(1), Value.of(BasicString.of("HOST")));
		vm.interpret();
		assertEquals("41 HOST\n", output());
		assertEquals("HOST", vm.getVariable(VariableRef.string(1)).stringValue().toString());
	}

	@Test
	public void testHostSetVariableTypeMismatch() {
		BasicVM vm = load("10 END\n");
		vm.setVariable(VariableRef.integer(2), Value.of(7));
		vm.setVariable(VariableRef.string(2), Value.of(BasicString.of("KEEP")));

		BasicRuntimeException e = assertThrows(
				BasicRuntimeException.class,
				() -> vm.setVariable(VariableRef.integer(2), Value.of(BasicString.of("X"))));
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		e = assertThrows(BasicRuntimeException.class, () -> vm.setVariable(VariableRef.string(2), Value.of(1)));
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());

		assertEquals(7, vm.getVariable(VariableRef.integer(2)).intValue());
		assertEquals("KEEP", vm.getVariable(VariableRef.string(2)).stringValue().toString());
	}
}
