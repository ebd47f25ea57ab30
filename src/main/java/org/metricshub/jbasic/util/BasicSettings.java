package org.metricshub.jbasic.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.jbasic.jrt.HostMemory;
import org.metricshub.jbasic.jrt.StringArena;

/**
 * A simple container for the parameters of a single BASIC run.
 * These values have defaults, which may be changed through command line
 * arguments or when running BASIC programs from within Java code.
 */
public class BasicSettings {

	/** Default maximum number of nested GOSUB calls. */
	public static final int DEFAULT_GOSUB_DEPTH = 10;

	/** Default maximum number of nested FOR loops. */
	public static final int DEFAULT_FOR_DEPTH = 4;

	/**
	 * Where INPUT reads from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Where PRINT writes to.
	 * By default, this is {@link System#out}.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Size in bytes of the temporary string space.
	 */
	private int arenaCapacity = StringArena.DEFAULT_CAPACITY;

	private int gosubDepth = DEFAULT_GOSUB_DEPTH;

	private int forDepth = DEFAULT_FOR_DEPTH;

	/**
	 * Target of PEEK and POKE;
	 * <code>null</code> by default, which makes both fail.
	 */
	private HostMemory hostMemory = null;

	/**
	 * Whether all the line numbers of the program are indexed when it is
	 * loaded, instead of as they are executed;
	 * <code>false</code> by default.
	 */
	private boolean eagerLineIndex = false;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("arenaCapacity = ").append(getArenaCapacity()).append(newLine);
		desc.append("gosubDepth = ").append(getGosubDepth()).append(newLine);
		desc.append("forDepth = ").append(getForDepth()).append(newLine);
		desc.append("hostMemory = ").append(getHostMemory()).append(newLine);
		desc.append("eagerLineIndex = ").append(isEagerLineIndex()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where INPUT reads from.
	 * By default, this is {@link java.lang.System#in}.
	 *
	 * @return the input
	 */
	public InputStream getInput() {
		return input;
	}

	/**
	 * @param input the input to set
	 */
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for PRINT statements
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	public int getArenaCapacity() {
		return arenaCapacity;
	}

	public void setArenaCapacity(int arenaCapacity) {
		this.arenaCapacity = arenaCapacity;
	}

	public int getGosubDepth() {
		return gosubDepth;
	}

	public void setGosubDepth(int gosubDepth) {
		this.gosubDepth = gosubDepth;
	}

	public int getForDepth() {
		return forDepth;
	}

	public void setForDepth(int forDepth) {
		this.forDepth = forDepth;
	}

	/**
	 * @return the target of PEEK and POKE, or <code>null</code>
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Host memory is shared with the host by design of PEEK and POKE.")
	public HostMemory getHostMemory() {
		return hostMemory;
	}

	/**
	 * @param hostMemory the target of PEEK and POKE
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Host memory is shared with the host by design of PEEK and POKE.")
	public void setHostMemory(HostMemory hostMemory) {
		this.hostMemory = hostMemory;
	}

	/**
	 * @return whether the whole program is indexed when loaded
	 */
	public boolean isEagerLineIndex() {
		return eagerLineIndex;
	}

	/**
	 * @param eagerLineIndex whether the whole program is indexed when loaded
	 */
	public void setEagerLineIndex(boolean eagerLineIndex) {
		this.eagerLineIndex = eagerLineIndex;
	}
}
