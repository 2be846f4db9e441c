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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.sqlscript.frontend.Origin;

/**
 * A classified error raised while building or running a script.
 * <p>
 * Every error carries a condition (for example
 * <code>INVALID_LABEL_USAGE.DOES_NOT_EXIST</code>), a five-character
 * SQLSTATE, the parameters used to render its message, and the position of
 * the script element that caused it. Condition handlers declared in the
 * script match errors on their condition and SQLSTATE.
 * <p>
 * The query evaluator is expected to report its own failures with this
 * exception too, so that they can be caught by handlers.
 *
 * @see ScriptErrors
 */
public class SqlScriptException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String condition;
	private final String sqlState;
	private final Map<String, String> parameters;
	private final transient Origin origin;

	/**
	 * Creates a new classified error.
	 *
	 * @param condition error condition, <code>MAIN</code> or <code>MAIN.SUB</code>
	 * @param sqlState five-character SQLSTATE, may be {@code null}
	 * @param parameters values substituted in the message
	 * @param origin where the error comes from
	 * @param message human readable description
	 */
	public SqlScriptException(String condition, String sqlState, Map<String, String> parameters, Origin origin, String message) {
		this(condition, sqlState, parameters, origin, message, null);
	}

	/**
	 * Creates a new classified error with its cause.
	 *
	 * @param condition error condition, <code>MAIN</code> or <code>MAIN.SUB</code>
	 * @param sqlState five-character SQLSTATE, may be {@code null}
	 * @param parameters values substituted in the message
	 * @param origin where the error comes from
	 * @param message human readable description
	 * @param cause underlying cause
	 */
	public SqlScriptException(
			String condition,
			String sqlState,
			Map<String, String> parameters,
			Origin origin,
			String message,
			Throwable cause) {
		super(message, cause);
		if (condition == null) {
			throw new IllegalArgumentException("An error condition is required");
		}
		this.condition = condition;
		this.sqlState = sqlState;
		this.parameters = parameters == null ?
				Collections.<String, String>emptyMap() :
				Collections.unmodifiableMap(new LinkedHashMap<String, String>(parameters));
		this.origin = origin == null ? Origin.UNKNOWN : origin;
	}

	public String getCondition() {
		return condition;
	}

	/**
	 * @return the part of the condition before the first dot
	 */
	public String getMainCondition() {
		int dot = condition.indexOf('.');
		return dot < 0 ? condition : condition.substring(0, dot);
	}

	public String getSqlState() {
		return sqlState;
	}

	public Map<String, String> getParameters() {
		return parameters;
	}

	public Origin getOrigin() {
		return origin;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return origin.getLine();
	}
}
