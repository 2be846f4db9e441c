package org.metricshub.sqlscript.jrt;

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

import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.frontend.SingleStatement;

/**
 * Runs the leaf statements of a script.
 * <p>
 * The script engine decides which statement runs next; the evaluator only
 * runs it, against the variables currently in scope. Failures must be
 * reported as {@link org.metricshub.sqlscript.SqlScriptException} so that
 * condition handlers can catch them.
 */
public interface QueryEvaluator {

	/**
	 * Runs one statement.
	 *
	 * @param statement the statement to run
	 * @param scopes variables visible to the statement
	 * @return the rows produced, {@link QueryResult#EMPTY} when there are none
	 */
	QueryResult execute(SingleStatement statement, ScopeStack scopes);

	/**
	 * Runs a statement expected to produce a single value.
	 *
	 * @param statement the statement to run
	 * @param scopes variables visible to the statement
	 * @return the value, {@code null} when no row is produced
	 */
	default Object evaluate(SingleStatement statement, ScopeStack scopes) {
		QueryResult result = execute(statement, scopes);
		if (result.getColumnCount() > 1) {
			throw ScriptErrors.scalarSubqueryMultiColumn(result.getColumnCount(), statement.getOrigin());
		}
		if (result.getRowCount() > 1) {
			throw ScriptErrors.scalarSubqueryTooManyRows(statement.getOrigin());
		}
		if (result.getRowCount() == 0 || result.getColumnCount() == 0) {
			return null;
		}
		return result.getRows().get(0).get(0);
	}
}
