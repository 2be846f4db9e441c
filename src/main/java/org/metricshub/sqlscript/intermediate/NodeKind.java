package org.metricshub.sqlscript.intermediate;

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
 * Kinds of nodes of a compiled script.
 *
 * @see StatementNode
 */
public enum NodeKind {
	/** A statement handed to the query evaluator. */
	LEAF,
	/** A compound body, opening a scope with its handlers. */
	BLOCK,
	/** <code>IF</code> and searched <code>CASE</code>: one boolean guard per branch. */
	SEARCHED_CONDITIONAL,
	/** Simple <code>CASE</code>: one scrutinee compared with each branch value. */
	SIMPLE_CONDITIONAL,
	/** <code>WHILE</code>. */
	PRETEST_LOOP,
	/** <code>REPEAT ... UNTIL</code>. */
	POSTTEST_LOOP,
	/** <code>LOOP</code>. */
	UNCONDITIONAL_LOOP,
	/** <code>FOR ... AS query DO</code>. */
	CURSOR_LOOP,
	LEAVE,
	ITERATE;

	/**
	 * @return {@code true} for the kinds an <code>ITERATE</code> may target
	 */
	public boolean isLoop() {
		return this == PRETEST_LOOP || this == POSTTEST_LOOP || this == UNCONDITIONAL_LOOP || this == CURSOR_LOOP;
	}
}
