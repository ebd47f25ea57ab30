package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.BasicString;
import org.metricshub.jbasic.jrt.ErrorKind;
import org.metricshub.jbasic.jrt.StringArena;

public class StringArenaTest {

	private static BasicString copy(StringArena arena, String text) {
		byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
		return arena.copyOf(bytes, 0, bytes.length);
	}

	@Test
	public void testAllocationConsumesLengthPlusOne() {
		StringArena arena = new StringArena(8);
		arena.allocate(3);
		assertEquals(4, arena.used());
		arena.allocate(3);
		assertEquals(8, arena.used());
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> arena.allocate(0));
		assertEquals(ErrorKind.OUT_OF_SPACE, e.getKind());
	}

	@Test
	public void testAllocationIsZeroFilled() {
		StringArena arena = new StringArena(16);
		copy(arena, "ABCDEFGH");
		arena.reset();
		BasicString s = arena.allocate(4);
		for (int i = 0; i < 4; i++) {
			assertEquals(0, s.byteAt(i));
		}
	}

	@Test
	public void testTooLong() {
		StringArena arena = new StringArena(1024);
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> arena.allocate(256));
		assertEquals(ErrorKind.OUT_OF_SPACE, e.getKind());
		assertEquals(0, arena.used());
		assertEquals(255, arena.allocate(255).length());
	}

	@Test
	public void testConcat() {
		StringArena arena = new StringArena();
		BasicString s = arena.concat(copy(arena, "FOO"), copy(arena, "BAR"));
		assertEquals("FOOBAR", s.toString());
		assertEquals(4 + 4 + 7, arena.used());
	}

	@Test
	public void testConcatLeavesOperandsUnchanged() {
		StringArena arena = new StringArena();
		BasicString left = copy(arena, "FOO");
		BasicString right = copy(arena, "BAR");
		arena.concat(left, right);
		arena.concat(right, left);
		assertEquals("FOO", left.toString());
		assertEquals(3, left.length());
		assertEquals("BAR", right.toString());
		assertEquals(3, right.length());
	}

	@Test
	public void testConcatTooLong() {
		StringArena arena = new StringArena();
		BasicString half = arena.allocate(128);
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> arena.concat(half, half));
		assertEquals(ErrorKind.OUT_OF_SPACE, e.getKind());
	}

	@Test
	public void testSubstring() {
		StringArena arena = new StringArena();
		BasicString s = arena.substring(copy(arena, "HELLO"), 1, 3);
		assertEquals("ELL", s.toString());
		assertEquals(3, s.length());
	}

	@Test
	public void testReset() {
		StringArena arena = new StringArena();
		copy(arena, "HELLO");
		arena.reset();
		assertEquals(0, arena.used());
		assertEquals(StringArena.DEFAULT_CAPACITY, arena.capacity());
	}

	@Test
	public void testSavedCopySurvivesReset() {
		StringArena arena = new StringArena();
		BasicString saved = copy(arena, "KEEP").save();
		arena.reset();
		copy(arena, "XXXX");
		assertEquals("KEEP", saved.toString());
	}
}
