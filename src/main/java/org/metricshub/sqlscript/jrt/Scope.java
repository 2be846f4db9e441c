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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.metricshub.sqlscript.intermediate.HandlerTable;

/**
 * The variables declared by one open compound body, FOR loop or FOR
 * iteration, together with the condition handlers of that body.
 */
public final class Scope {

	private final int ownerIndex;
	private final String label;
	private final HandlerTable handlers;
	private final Map<String, Variable> variables = new LinkedHashMap<String, Variable>();
	private boolean handling;

	/**
	 * @param ownerIndex arena index of the node that opened the scope, or -1
	 *        for the root scope holding the script arguments
	 * @param label label of the owner, may be {@code null}
	 * @param handlers handlers declared by the owner, may be {@code null}
	 */
	public Scope(int ownerIndex, String label, HandlerTable handlers) {
		this.ownerIndex = ownerIndex;
		this.label = label;
		this.handlers = handlers == null ? HandlerTable.EMPTY : handlers;
	}

	public int getOwnerIndex() {
		return ownerIndex;
	}

	public String getLabel() {
		return label;
	}

	public HandlerTable getHandlers() {
		return handlers;
	}

	/**
	 * @return {@code true} while one of this scope's handlers is running
	 */
	public boolean isHandling() {
		return handling;
	}

	public void setHandling(boolean handling) {
		this.handling = handling;
	}

	Variable get(String name) {
		return variables.get(key(name));
	}

	boolean contains(String name) {
		return variables.containsKey(key(name));
	}

	void put(Variable variable) {
		variables.put(key(variable.getName()), variable);
	}

	public Collection<Variable> getVariables() {
		return Collections.unmodifiableCollection(variables.values());
	}

	static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return "Scope[" + (label == null ? ownerIndex : label) + "] " + variables.values();
	}
}
