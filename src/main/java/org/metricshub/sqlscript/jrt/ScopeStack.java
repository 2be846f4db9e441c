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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import org.metricshub.sqlscript.ScriptErrors;

/**
 * The stack of open scopes of a running script.
 * <p>
 * Name resolution walks the stack from the innermost scope outwards, so a
 * declaration in an inner scope shadows one with the same name further out.
 * Names are case-insensitive.
 */
public class ScopeStack implements Iterable<Scope> {

	private final Deque<Scope> scopes = new ArrayDeque<Scope>();

	public void push(Scope scope) {
		scopes.push(scope);
	}

	public Scope pop() {
		if (scopes.isEmpty()) {
			throw new IllegalStateException("No scope to close");
		}
		return scopes.pop();
	}

	public Scope peek() {
		return scopes.peek();
	}

	public int depth() {
		return scopes.size();
	}

	/**
	 * Iterates the open scopes, innermost first.
	 */
	@Override
	public Iterator<Scope> iterator() {
		return scopes.iterator();
	}

	/**
	 * Declares a variable in the innermost scope, its type inferred from the
	 * value.
	 *
	 * @param name variable name
	 * @param value initial value
	 * @return the new variable
	 */
	public Variable declare(String name, Object value) {
		return declare(name, null, value);
	}

	/**
	 * Declares a variable in the innermost scope.
	 *
	 * @param name variable name
	 * @param type declared type, inferred from the value when {@code null}
	 * @param value initial value
	 * @return the new variable
	 * @throws org.metricshub.sqlscript.SqlScriptException
	 *         <code>VARIABLE_ALREADY_EXISTS</code> when the innermost scope
	 *         already declares that name
	 */
	public Variable declare(String name, SqlType type, Object value) {
		Scope current = scopes.peek();
		if (current == null) {
			throw new IllegalStateException("No open scope to declare " + name + " in");
		}
		if (current.contains(name)) {
			throw ScriptErrors.variableAlreadyExists(name);
		}
		Variable variable = new Variable(name, type, value);
		current.put(variable);
		return variable;
	}

	/**
	 * Changes the value of the innermost visible variable with that name.
	 *
	 * @param name variable name
	 * @param value new value
	 * @throws org.metricshub.sqlscript.SqlScriptException
	 *         <code>UNRESOLVED_VARIABLE</code> when no such variable is visible
	 */
	public void assign(String name, Object value) {
		Variable variable = find(name);
		if (variable == null) {
			throw ScriptErrors.unresolvedVariable(name);
		}
		variable.setValue(value);
	}

	/**
	 * Resolves a variable. A dotted name <code>record.field</code> that is not
	 * itself declared reads the field of a STRUCT variable.
	 *
	 * @param name variable name
	 * @return the variable, or {@code null} when nothing is visible under that name
	 */
	public Variable lookup(String name) {
		Variable variable = find(name);
		if (variable != null) {
			return variable;
		}
		int dot = name.indexOf('.');
		if (dot <= 0) {
			return null;
		}
		Variable record = find(name.substring(0, dot));
		if (record == null || !(record.getValue() instanceof Map)) {
			return null;
		}
		String field = name.substring(dot + 1);
		for (Map.Entry<?, ?> entry : ((Map<?, ?>) record.getValue()).entrySet()) {
			if (String.valueOf(entry.getKey()).equalsIgnoreCase(field)) {
				return new Variable(name, null, entry.getValue());
			}
		}
		return null;
	}

	/**
	 * @param name variable name
	 * @return the value of the variable
	 * @throws org.metricshub.sqlscript.SqlScriptException
	 *         <code>UNRESOLVED_VARIABLE</code> when no such variable is visible
	 */
	public Object getValue(String name) {
		Variable variable = lookup(name);
		if (variable == null) {
			throw ScriptErrors.unresolvedVariable(name);
		}
		return variable.getValue();
	}

	private Variable find(String name) {
		for (Scope scope : scopes) {
			Variable variable = scope.get(name);
			if (variable != null) {
				return variable;
			}
		}
		return null;
	}
}
