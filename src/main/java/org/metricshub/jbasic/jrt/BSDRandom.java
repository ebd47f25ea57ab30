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
 * Pseudo-random number generator compatible with the C library
 * {@code random()} function, behind {@code RANDOMIZE} and {@code RND}.
 * <p>
 * A fresh generator behaves like an unseeded C program, i.e. as if seeded
 * with 1.
 */
public class BSDRandom {

	private static final int RAND_DEG = 31;
	private static final int RAND_SEP = 3;
	private final int[] state = new int[RAND_DEG];
	private int fptr;
	private int rptr;

	/** Create a generator in the state of an unseeded C program. */
	public BSDRandom() {
		this(1);
	}

	/** Create a new generator with the specified seed. */
	public BSDRandom(int seed) {
		setSeed(seed);
	}

	/**
	 * Seed the generator. A seed of {@code 0} is transformed to {@code 1}
	 * as in the C library.
	 *
	 * @param seed the new seed
	 */
	public final void setSeed(int seed) {
		if (seed == 0) {
			seed = 1;
		}
		state[0] = seed;
		for (int i = 1; i < RAND_DEG; i++) {
			long val = 16807L * state[i - 1] % 2147483647L;
			state[i] = (int) val;
		}
		fptr = RAND_SEP;
		rptr = 0;
		for (int i = 0; i < 10 * RAND_DEG; i++) {
			next();
		}
	}

	/**
	 * @return the next value, in {@code [0, 2^31)}
	 */
	public int next() {
		int val = state[fptr] + state[rptr];
		state[fptr] = val;
		if (++fptr >= RAND_DEG) {
			fptr = 0;
		}
		if (++rptr >= RAND_DEG) {
			rptr = 0;
		}
		return (val >>> 1) & 0x7fffffff;
	}

	/**
	 * Value of {@code RND(bound)}.
	 *
	 * @param bound exclusive upper limit
	 * @return the next value modulo {@code bound}, or 0 (without consuming a
	 *         value) if {@code bound} is not positive
	 */
	public int nextInt(int bound) {
		if (bound <= 0) {
			return 0;
		}
		return next() % bound;
	}
}
