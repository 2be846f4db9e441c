package org.metricshub.sqlscript.frontend;

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

/**
 * Position of a script element within the source text, as reported by the
 * parser. Lines are 1-based; start and stop are 0-based character offsets
 * (inclusive). Unknown values are {@code -1}.
 */
public final class Origin {

	/** Origin used when the parser provides no position. */
	public static final Origin UNKNOWN = new Origin(-1, -1, -1);

	private final int line;
	private final int startIndex;
	private final int stopIndex;

	public Origin(int line, int startIndex, int stopIndex) {
		this.line = line;
		this.startIndex = startIndex;
		this.stopIndex = stopIndex;
	}

	/**
	 * Creates an origin that only knows its line.
	 *
	 * @param line 1-based line number
	 * @return the new origin
	 */
	public static Origin atLine(int line) {
		return new Origin(line, -1, -1);
	}

	public int getLine() {
		return line;
	}

	public int getStartIndex() {
		return startIndex;
	}

	public int getStopIndex() {
		return stopIndex;
	}

	public boolean isKnown() {
		return line >= 0;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Origin)) {
			return false;
		}
		Origin that = (Origin) other;
		return line == that.line && startIndex == that.startIndex && stopIndex == that.stopIndex;
	}

	@Override
	public int hashCode() {
		return (line * 31 + startIndex) * 31 + stopIndex;
	}

	@Override
	public String toString() {
		if (!isKnown()) {
			return "unknown position";
		}
		if (startIndex < 0) {
			return "line " + line;
		}
		return "line " + line + ", position " + startIndex + "-" + stopIndex;
	}
}
