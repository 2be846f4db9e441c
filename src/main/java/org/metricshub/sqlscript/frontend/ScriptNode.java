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
 * Base class of the parsed script tree handed over by the parser.
 * The tree is plain data: it is never executed directly, but compiled into
 * a {@link org.metricshub.sqlscript.intermediate.CompiledScript} first.
 */
public abstract class ScriptNode {

	private final Origin origin;

	protected ScriptNode(Origin origin) {
		this.origin = origin == null ? Origin.UNKNOWN : origin;
	}

	public final Origin getOrigin() {
		return origin;
	}

	/**
	 * Double-dispatch entry point for tree walkers.
	 *
	 * @param <R> type of the visitor result
	 * @param visitor the walker
	 * @return whatever the visitor returns for this node
	 */
	public abstract <R> R accept(ScriptNodeVisitor<R> visitor);

	@Override
	public String toString() {
		return getClass().getName().replaceFirst(".*[$.]", "");
	}
}
