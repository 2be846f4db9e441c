package org.metricshub.sqlscript.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * SqlScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import java.io.PrintStream;

/**
 * A simple container for the parameters of script compilation and execution.
 * These values have defaults, which may be changed programmatically before
 * the settings are handed over to {@link org.metricshub.sqlscript.SqlScript}.
 */
public class ScriptSettings {

	/**
	 * Settings used when none are provided.
	 */
	public static final ScriptSettings DEFAULT_SETTINGS = new ScriptSettings();

	/**
	 * Whether casts performed while comparing values are strict;
	 * <code>true</code> by default.
	 * In strict mode, a value that cannot be coerced raises
	 * <code>CAST_INVALID_INPUT</code>, otherwise it becomes <code>NULL</code>.
	 */
	private boolean ansiMode = true;

	/**
	 * Whether to print the compiled plan when a script is compiled;
	 * <code>false</code> by default.
	 */
	private boolean dumpPlan = false;

	/**
	 * Where the compiled plan is printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("ansiMode = ").append(isAnsiMode()).append(newLine);
		desc.append("dumpPlan = ").append(isDumpPlan()).append(newLine);

		return desc.toString();
	}

	/**
	 * Whether casts performed while comparing values are strict;
	 * <code>true</code> by default.
	 *
	 * @return the ansiMode
	 */
	public boolean isAnsiMode() {
		return ansiMode;
	}

	/**
	 * Whether casts performed while comparing values are strict;
	 * <code>true</code> by default.
	 *
	 * @param ansiMode the ansiMode to set
	 */
	public void setAnsiMode(boolean ansiMode) {
		this.ansiMode = ansiMode;
	}

	/**
	 * @return {@code true} to print the compiled plan
	 */
	public boolean isDumpPlan() {
		return dumpPlan;
	}

	/**
	 * @param dumpPlan {@code true} to print the compiled plan
	 */
	public void setDumpPlan(boolean dumpPlan) {
		this.dumpPlan = dumpPlan;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the stream the compiled plan is printed to (instead of System.out by default)
	 *
	 * @param pOutputStream PrintStream to use
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
