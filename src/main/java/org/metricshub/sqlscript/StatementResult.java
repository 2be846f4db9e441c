package org.metricshub.sqlscript;

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

import org.metricshub.sqlscript.frontend.SingleStatement;
import org.metricshub.sqlscript.jrt.QueryResult;

/**
 * A statement run by {@link SqlScript#run(org.metricshub.sqlscript.backend.ExecutionPlan)}
 * and the rows it produced.
 */
public final class StatementResult {

	private final SingleStatement statement;
	private final QueryResult result;

	public StatementResult(SingleStatement statement, QueryResult result) {
		this.statement = statement;
		this.result = result == null ? QueryResult.EMPTY : result;
	}

	public SingleStatement getStatement() {
		return statement;
	}

	public QueryResult getResult() {
		return result;
	}

	@Override
	public String toString() {
		return statement.getText() + " => " + result;
	}
}
