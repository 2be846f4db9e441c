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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.sqlscript.SqlScriptException;
import org.metricshub.sqlscript.intermediate.CompiledScript;
import org.metricshub.sqlscript.jrt.QueryEvaluator;
import org.metricshub.sqlscript.jrt.Scope;
import org.metricshub.sqlscript.jrt.ScopeStack;
import org.metricshub.sqlscript.util.ScriptSettings;

/**
 * One execution of a compiled script: its arguments, its scopes and its
 * statement iterator.
 * <p>
 * {@link #enterScope()} must be called before the statements are pulled.
 */
public class ExecutionPlan {

	private final CompiledScript script;
	private final Map<String, Object> arguments;
	private final QueryEvaluator evaluator;
	private final ScriptSettings settings;
	private final ScopeStack scopes = new ScopeStack();
	private StatementIterator statements;

	/**
	 * @param script the compiled script
	 * @param arguments named arguments, declared as variables of the root scope
	 * @param evaluator runs the statements
	 * @param settings execution settings
	 */
	public ExecutionPlan(CompiledScript script, Map<String, Object> arguments, QueryEvaluator evaluator, ScriptSettings settings) {
		this.script = script;
		this.arguments = arguments == null ?
				Collections.<String, Object>emptyMap() :
				Collections.unmodifiableMap(new LinkedHashMap<String, Object>(arguments));
		this.evaluator = evaluator;
		this.settings = settings == null ? ScriptSettings.DEFAULT_SETTINGS : settings;
	}

	/**
	 * Opens the root scope and declares the arguments in it, in the order
	 * they were given.
	 */
	public void enterScope() {
		if (statements != null) {
			throw new IllegalStateException("The root scope is already open");
		}
		scopes.push(new Scope(-1, null, null));
		try {
			for (Map.Entry<String, Object> argument : arguments.entrySet()) {
				scopes.declare(argument.getKey(), argument.getValue());
			}
		} catch (SqlScriptException e) {
			scopes.pop();
			throw e;
		}
		statements = new StatementIterator(script, scopes, evaluator, settings);
	}

	/**
	 * @return the statements of this execution; every call returns the same
	 *         iterator
	 */
	public StatementIterator statements() {
		if (statements == null) {
			throw new IllegalStateException("enterScope() must be called first");
		}
		return statements;
	}

	public CompiledScript getScript() {
		return script;
	}

	public Map<String, Object> getArguments() {
		return arguments;
	}

	public QueryEvaluator getEvaluator() {
		return evaluator;
	}

	public ScriptSettings getSettings() {
		return settings;
	}

	public ScopeStack getScopes() {
		return scopes;
	}
}
