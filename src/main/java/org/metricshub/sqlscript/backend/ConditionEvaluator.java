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

import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.frontend.Origin;
import org.metricshub.sqlscript.frontend.SingleStatement;
import org.metricshub.sqlscript.jrt.QueryEvaluator;
import org.metricshub.sqlscript.jrt.QueryResult;
import org.metricshub.sqlscript.jrt.ScopeStack;
import org.metricshub.sqlscript.jrt.SqlType;
import org.metricshub.sqlscript.jrt.SqlValues;
import org.metricshub.sqlscript.util.ScriptSettings;

/**
 * Evaluates the conditions of IF, CASE, WHILE and REPEAT, and the operands of
 * simple CASE, through the query evaluator.
 */
public class ConditionEvaluator {

	private final QueryEvaluator evaluator;
	private final ScopeStack scopes;
	private final ScriptSettings settings;

	public ConditionEvaluator(QueryEvaluator evaluator, ScopeStack scopes, ScriptSettings settings) {
		this.evaluator = evaluator;
		this.scopes = scopes;
		this.settings = settings;
	}

	/**
	 * Runs a condition. <code>NULL</code> and an empty result count as false.
	 *
	 * @param condition the condition
	 * @return whether the condition holds
	 * @throws org.metricshub.sqlscript.SqlScriptException when the condition
	 *         is not a single boolean value
	 */
	public boolean evaluateGuard(SingleStatement condition) {
		QueryResult result = evaluator.execute(condition, scopes);
		if (result.getColumnCount() > 1) {
			throw ScriptErrors.scalarSubqueryMultiColumn(result.getColumnCount(), condition.getOrigin());
		}
		if (result.getRowCount() > 1) {
			throw ScriptErrors.scalarSubqueryTooManyRows(condition.getOrigin());
		}
		if (result.getColumnCount() == 0) {
			throw ScriptErrors.invalidBooleanStatement(condition);
		}
		SqlType type = result.getColumns().get(0).getType();
		if (type != SqlType.BOOLEAN && type != SqlType.STRING) {
			throw ScriptErrors.invalidBooleanStatement(condition);
		}
		if (result.getRowCount() == 0) {
			return false;
		}
		Object value = result.getRows().get(0).get(0);
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean) {
			return ((Boolean) value).booleanValue();
		}
		Boolean parsed = SqlValues.parseBoolean(value.toString());
		if (parsed == null) {
			throw ScriptErrors.invalidBooleanStatement(condition);
		}
		return parsed.booleanValue();
	}

	/**
	 * @param expression a CASE operand or WHEN value
	 * @return its value, {@code null} when it produces no row
	 */
	public Object evaluateScalar(SingleStatement expression) {
		return evaluator.evaluate(expression, scopes);
	}

	/**
	 * Compares a CASE operand with a WHEN value. An unknown comparison does
	 * not match.
	 *
	 * @param scrutinee the CASE operand
	 * @param value the WHEN value
	 * @param origin position of the WHEN value
	 * @return whether the branch is taken
	 */
	public boolean matches(Object scrutinee, Object value, Origin origin) {
		return Boolean.TRUE.equals(SqlValues.sqlEquals(scrutinee, value, settings.isAnsiMode(), origin));
	}
}
