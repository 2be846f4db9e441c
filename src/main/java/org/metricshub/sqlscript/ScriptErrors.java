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

import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.sqlscript.frontend.Origin;
import org.metricshub.sqlscript.frontend.SingleStatement;

/**
 * Creates the classified errors of the script engine.
 * <p>
 * Build errors (labels, handlers) are detected before anything runs. Run-time
 * errors (conditions, casts, variables) are raised while statements are
 * produced, and can be caught by the handlers declared in the script.
 */
public final class ScriptErrors {

	public static final String LABEL_DOES_NOT_EXIST = "INVALID_LABEL_USAGE.DOES_NOT_EXIST";
	public static final String ITERATE_IN_COMPOUND = "INVALID_LABEL_USAGE.ITERATE_IN_COMPOUND";
	public static final String LABEL_ALREADY_EXISTS = "LABEL_ALREADY_EXISTS";
	public static final String DUPLICATE_HANDLER = "DUPLICATE_EXCEPTION_HANDLER.CONDITION";
	public static final String CONTINUE_HANDLER_NOT_SUPPORTED = "UNSUPPORTED_FEATURE.CONTINUE_EXCEPTION_HANDLER";
	public static final String INVALID_SQLSTATE = "INVALID_SQLSTATE";
	public static final String INVALID_BOOLEAN_STATEMENT = "INVALID_BOOLEAN_STATEMENT";
	public static final String SCALAR_SUBQUERY_TOO_MANY_ROWS = "SCALAR_SUBQUERY_TOO_MANY_ROWS";
	public static final String SCALAR_SUBQUERY_MULTI_COLUMN =
			"INVALID_SUBQUERY_EXPRESSION.SCALAR_SUBQUERY_RETURN_MORE_THAN_ONE_OUTPUT_COLUMN";
	public static final String CAST_INVALID_INPUT = "CAST_INVALID_INPUT";
	public static final String VARIABLE_ALREADY_EXISTS = "VARIABLE_ALREADY_EXISTS";
	public static final String UNRESOLVED_VARIABLE = "UNRESOLVED_VARIABLE";

	private ScriptErrors() {}

	public static SqlScriptException labelDoesNotExist(String labelName, String statementType, Origin origin) {
		return create(
				LABEL_DOES_NOT_EXIST,
				"42K0L",
				origin,
				"The label <labelName> used in the <statementType> statement does not exist.",
				"labelName",
				labelName,
				"statementType",
				statementType);
	}

	public static SqlScriptException iterateInCompound(String labelName, Origin origin) {
		return create(
				ITERATE_IN_COMPOUND,
				"42K0L",
				origin,
				"The ITERATE statement cannot be used with a label <labelName> that belongs to a compound (BEGIN...END) body.",
				"labelName",
				labelName);
	}

	public static SqlScriptException labelAlreadyExists(String label, Origin origin) {
		return create(
				LABEL_ALREADY_EXISTS,
				"42K0L",
				origin,
				"The label <label> already exists in the same body. Choose another name or rename the existing label.",
				"label",
				label);
	}

	public static SqlScriptException duplicateHandler(String condition, Origin origin) {
		return create(
				DUPLICATE_HANDLER,
				"42734",
				origin,
				"Found duplicate handlers for the same condition <condition>.",
				"condition",
				condition);
	}

	public static SqlScriptException continueHandlerNotSupported(Origin origin) {
		return create(
				CONTINUE_HANDLER_NOT_SUPPORTED,
				"0A000",
				origin,
				"CONTINUE exception handler is not supported. Use EXIT handler.");
	}

	public static SqlScriptException invalidSqlState(String sqlState, Origin origin) {
		return create(
				INVALID_SQLSTATE,
				"428B3",
				origin,
				"Invalid SQLSTATE value: '<sqlState>'. SQLSTATE must be exactly 5 characters long, "
						+ "contain only A-Z and 0-9, and must not start with '00'.",
				"sqlState",
				sqlState);
	}

	public static SqlScriptException invalidBooleanStatement(SingleStatement statement) {
		return create(
				INVALID_BOOLEAN_STATEMENT,
				"22546",
				statement.getOrigin(),
				"Boolean statement is expected in the condition, but <invalidStatement> was found.",
				"invalidStatement",
				statement.getText());
	}

	public static SqlScriptException scalarSubqueryTooManyRows(Origin origin) {
		return create(
				SCALAR_SUBQUERY_TOO_MANY_ROWS,
				"21000",
				origin,
				"More than one row returned by a subquery used as an expression.");
	}

	public static SqlScriptException scalarSubqueryMultiColumn(int number, Origin origin) {
		return create(
				SCALAR_SUBQUERY_MULTI_COLUMN,
				"42823",
				origin,
				"Scalar subquery must return only one column, but got <number>.",
				"number",
				Integer.toString(number));
	}

	/**
	 * @param expression the value that could not be cast, as a SQL literal
	 * @param sourceType SQL name of the value type
	 * @param targetType SQL name of the requested type
	 * @param origin where the cast happened
	 * @return the error
	 */
	public static SqlScriptException castInvalidInput(String expression, String sourceType, String targetType, Origin origin) {
		return create(
				CAST_INVALID_INPUT,
				"22018",
				origin,
				"The value <expression> of the type <sourceType> cannot be cast to <targetType> because it is malformed.",
				"expression",
				expression,
				"sourceType",
				"\"" + sourceType + "\"",
				"targetType",
				"\"" + targetType + "\"");
	}

	public static SqlScriptException variableAlreadyExists(String variableName) {
		return create(
				VARIABLE_ALREADY_EXISTS,
				"42723",
				Origin.UNKNOWN,
				"Cannot create the variable <variableName> because it already exists.",
				"variableName",
				"`" + variableName + "`");
	}

	public static SqlScriptException unresolvedVariable(String variableName) {
		return create(
				UNRESOLVED_VARIABLE,
				"42883",
				Origin.UNKNOWN,
				"Cannot resolve variable <variableName>.",
				"variableName",
				"`" + variableName + "`");
	}

	/**
	 * Renders a message template and creates the exception.
	 *
	 * @param condition error condition
	 * @param sqlState SQLSTATE of the condition
	 * @param origin where the error comes from
	 * @param template message with <code>&lt;name&gt;</code> placeholders
	 * @param keyValues parameter names and values, alternating
	 * @return the error
	 */
	public static SqlScriptException create(
			String condition,
			String sqlState,
			Origin origin,
			String template,
			String... keyValues) {
		if (keyValues.length % 2 != 0) {
			throw new IllegalArgumentException("Parameters must come as name/value pairs");
		}
		Map<String, String> parameters = new LinkedHashMap<String, String>();
		String message = template;
		for (int i = 0; i < keyValues.length; i += 2) {
			parameters.put(keyValues[i], keyValues[i + 1]);
			message = message.replace("<" + keyValues[i] + ">", String.valueOf(keyValues[i + 1]));
		}
		StringBuilder text = new StringBuilder("[").append(condition).append("] ").append(message);
		if (origin != null && origin.isKnown()) {
			text.append(" (").append(origin).append(')');
		}
		return new SqlScriptException(condition, sqlState, parameters, origin, text.toString());
	}
}
