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

import org.metricshub.sqlscript.frontend.Origin;
import org.metricshub.sqlscript.frontend.SingleStatement;

/**
 * A statement produced by the {@link StatementIterator}.
 * <p>
 * Statements the engine already ran itself (conditions, CASE operands, FOR
 * queries) are marked executed and must not be run again by the caller.
 */
public final class ExecutableStatement {

	private final int nodeIndex;
	private final SingleStatement statement;
	private final boolean executed;
	private final Boolean guardResult;

	ExecutableStatement(int nodeIndex, SingleStatement statement, boolean executed, Boolean guardResult) {
		this.nodeIndex = nodeIndex;
		this.statement = statement;
		this.executed = executed;
		this.guardResult = guardResult;
	}

	public int getNodeIndex() {
		return nodeIndex;
	}

	public SingleStatement getStatement() {
		return statement;
	}

	/**
	 * @return {@code true} when the engine already ran this statement
	 */
	public boolean isExecuted() {
		return executed;
	}

	/**
	 * @return the outcome of a condition check or a CASE comparison,
	 *         {@code null} for other statements
	 */
	public Boolean getGuardResult() {
		return guardResult;
	}

	public Origin getOrigin() {
		return statement.getOrigin();
	}

	@Override
	public String toString() {
		return (executed ? "[executed] " : "") + statement.getText();
	}
}
