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

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.ErrorKind;

/**
 * Fixed-depth stack of control-flow frames (GOSUB return lines, FOR loop
 * descriptors). The stack never grows beyond its depth; what happens on
 * overflow is given by its {@link OverflowPolicy}.
 *
 * @param <T> frame type
 */
class BoundedStack<T> {

	private final String name;
	private final int depth;
	private final OverflowPolicy policy;
	private final Deque<T> frames = new ArrayDeque<T>();

	/**
	 * @param name name of the stack, for error messages
	 * @param depth maximum number of frames
	 * @param policy behavior of a push on a full stack
	 */
	BoundedStack(String name, int depth, OverflowPolicy policy) {
		if (depth < 1) {
			throw new IllegalArgumentException(name + " stack depth must be positive: " + depth);
		}
		this.name = name;
		this.depth = depth;
		this.policy = policy;
	}

	/**
	 * Pushes a frame.
	 *
	 * @param frame the new top frame
	 * @return {@code true} if pushed, {@code false} if dropped under
	 *         {@link OverflowPolicy#IGNORE}
	 * @throws BasicRuntimeException with {@link ErrorKind#STACK_EXHAUSTED} if
	 *         full under {@link OverflowPolicy#FAIL}
	 */
	boolean push(T frame) {
		if (frames.size() >= depth) {
			if (policy == OverflowPolicy.FAIL) {
				throw new BasicRuntimeException(ErrorKind.STACK_EXHAUSTED, name + " stack exhausted (depth " + depth + ")");
			}
			return false;
		}
		frames.push(frame);
		return true;
	}

	/**
	 * @return the top frame, removed from the stack, or {@code null} if empty
	 */
	T pop() {
		return frames.poll();
	}

	/**
	 * @return the top frame, or {@code null} if empty
	 */
	T peek() {
		return frames.peek();
	}

	boolean isEmpty() {
		return frames.isEmpty();
	}

	int size() {
		return frames.size();
	}

	int getDepth() {
		return depth;
	}

	void clear() {
		frames.clear();
	}
}
