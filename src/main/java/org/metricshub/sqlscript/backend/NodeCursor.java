package org.metricshub.sqlscript.backend;

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

import org.metricshub.sqlscript.intermediate.StatementNode;
import org.metricshub.sqlscript.jrt.QueryResult;
import org.metricshub.sqlscript.jrt.Scope;

/**
 * The progress of one open statement: which node, in which phase, and the
 * state needed to resume it (branch or child position, CASE operand, FOR
 * rows).
 */
final class NodeCursor {

	enum Phase {
		/** Not started yet. */
		ENTER,
		/** Next step evaluates a guard. */
		CONDITION,
		/** Next step enters a body or the next child. */
		BODY,
		/** Next step moves a FOR loop to its next row. */
		ROW,
		/** A condition handler body is running on top of this block. */
		HANDLER,
		/** Nothing left; the cursor is closed at the next step. */
		DONE
	}

	private final StatementNode node;
	private Phase phase = Phase.ENTER;
	private int position;
	private Object scrutinee;
	private QueryResult rows;
	private int rowIndex;
	private Scope scope;

	NodeCursor(StatementNode node) {
		this.node = node;
	}

	StatementNode getNode() {
		return node;
	}

	int getNodeIndex() {
		return node.getIndex();
	}

	Phase getPhase() {
		return phase;
	}

	void setPhase(Phase phase) {
		this.phase = phase;
	}

	int getPosition() {
		return position;
	}

	void setPosition(int position) {
		this.position = position;
	}

	int nextPosition() {
		return position++;
	}

	Object getScrutinee() {
		return scrutinee;
	}

	void setScrutinee(Object scrutinee) {
		this.scrutinee = scrutinee;
	}

	QueryResult getRows() {
		return rows;
	}

	void setRows(QueryResult rows) {
		this.rows = rows;
	}

	int nextRowIndex() {
		return rowIndex++;
	}

	boolean hasMoreRows() {
		return rows != null && rowIndex < rows.getRowCount();
	}

	/**
	 * @return the scope opened by this cursor, or {@code null}
	 */
	Scope getScope() {
		return scope;
	}

	void setScope(Scope scope) {
		this.scope = scope;
	}

	@Override
	public String toString() {
		return node.getIndex() + ":" + node.getKind() + "/" + phase;
	}
}
