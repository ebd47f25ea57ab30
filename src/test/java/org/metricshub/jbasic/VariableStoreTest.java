package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.BasicString;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.StringArena;
import org.metricshub.jbasic.jrt.Value;
import org.metricshub.jbasic.jrt.VariableRef;
import org.metricshub.jbasic.jrt.VariableStore;

public class VariableStoreTest {

	private static final int A = VariableRef.integer(0);
	private static final int Z = VariableRef.integer(25);
	private static final int A_STRING = VariableRef.string(0);

	@Test
	public void testInitialValues() {
		VariableStore store = new VariableStore();
		assertEquals(0, store.get(A).intValue());
		assertEquals(0, store.get(Z).intValue());
		assertSame(BasicString.EMPTY, store.get(A_STRING).stringValue());
	}

	@Test
	public void testSetAndGet() {
		VariableStore store = new VariableStore();
		store.set(A, Value.of(42));
		store.set(A_STRING, Value.of(BasicString.of("HI")));
		assertEquals(42, store.get(A).intValue());
		assertEquals("HI", store.get(A_STRING).stringValue().toString());
	}

	@Test
	public void testArrayElementsAreSeparateSlots() {
		VariableStore store = new VariableStore();
		store.set(A, Value.of(1));
		store.set(VariableRef.element(0, 1), Value.of(2));
		store.set(VariableRef.element(0, 10), Value.of(3));
		assertEquals(1, store.get(A).intValue());
		assertEquals(2, store.get(VariableRef.element(0, 1)).intValue());
		assertEquals(3, store.get(VariableRef.element(0, 10)).intValue());
		assertEquals(0, store.get(VariableRef.integer(1)).intValue());
	}

	@Test
	public void testTypeMismatchLeavesStoreUnchanged() {
		VariableStore store = new VariableStore();
		store.set(A, Value.of(7));
		BasicRuntimeException e = assertThrows(
				BasicRuntimeException.class,
				() -> store.set(A, Value.of(BasicString.of("X"))));
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		assertEquals(7, store.get(A).intValue());

		e = assertThrows(BasicRuntimeException.class, () -> store.set(A_STRING, Value.of(1)));
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		assertSame(BasicString.EMPTY, store.get(A_STRING).stringValue());
	}

	@Test
	public void testInvalidReference() {
		VariableStore store = new VariableStore();
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> store.get(VariableRef.INTEGER_SLOTS));
		assertEquals(ErrorKind.INVALID_VARIABLE, e.getKind());
		e = assertThrows(BasicRuntimeException.class, () -> store.get(VariableRef.string(26)));
		assertEquals(ErrorKind.INVALID_VARIABLE, e.getKind());
	}

	@Test
	public void testStringAssignmentCopies() {
		VariableStore store = new VariableStore();
		StringArena arena = new StringArena();
		byte[] bytes = { 'A', 'B' };
		store.set(A_STRING, Value.of(arena.copyOf(bytes, 0, 2)));
		arena.reset();
		arena.copyOf(new byte[] { 'X', 'Y' }, 0, 2);
		assertEquals("AB", store.get(A_STRING).stringValue().toString());
	}

	@Test
	public void testClear() {
		VariableStore store = new VariableStore();
		store.set(A, Value.of(1));
		store.set(A_STRING, Value.of(BasicString.of("X")));
		store.clear();
		assertEquals(0, store.get(A).intValue());
		assertEquals(0, store.get(A_STRING).stringValue().length());
	}

	@Test
	public void testNames() {
		assertEquals("A", VariableRef.name(A));
		assertEquals("A$", VariableRef.name(A_STRING));
		assertEquals("Z[3]", VariableRef.name(VariableRef.element(25, 3)));
	}
}
