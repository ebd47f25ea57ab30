package org.metricshub.jbasic.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;

public class BoundedStackTest {

	@Test
	public void testLastInFirstOut() {
		BoundedStack<Integer> stack = new BoundedStack<Integer>("GOSUB", 3, OverflowPolicy.FAIL);
		assertTrue(stack.push(1));
		assertTrue(stack.push(2));
		assertEquals(Integer.valueOf(2), stack.peek());
		assertEquals(Integer.valueOf(2), stack.pop());
		assertEquals(Integer.valueOf(1), stack.pop());
		assertNull(stack.pop());
		assertNull(stack.peek());
		assertTrue(stack.isEmpty());
	}

	@Test
	public void testFailWhenFull() {
		BoundedStack<Integer> stack = new BoundedStack<Integer>("GOSUB", 2, OverflowPolicy.FAIL);
		stack.push(1);
		stack.push(2);
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> stack.push(3));
		assertEquals(ErrorKind.STACK_EXHAUSTED, e.getKind());
		assertEquals(2, stack.size());
	}

	@Test
	public void testIgnoreWhenFull() {
		BoundedStack<String> stack = new BoundedStack<String>("FOR", 1, OverflowPolicy.IGNORE);
		assertTrue(stack.push("I"));
		assertFalse(stack.push("J"));
		assertEquals(1, stack.size());
		assertEquals("I", stack.peek());
	}

	@Test
	public void testClear() {
		BoundedStack<Integer> stack = new BoundedStack<Integer>("GOSUB", 2, OverflowPolicy.FAIL);
		stack.push(1);
		stack.clear();
		assertTrue(stack.isEmpty());
		assertEquals(2, stack.getDepth());
	}

	@Test
	public void testDepthMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new BoundedStack<Integer>("GOSUB", 0, OverflowPolicy.FAIL));
	}
}
