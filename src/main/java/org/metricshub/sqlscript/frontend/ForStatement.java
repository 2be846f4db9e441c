package org.metricshub.sqlscript.frontend;

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

/**
 * <code>[label:] FOR [variable AS] query DO ... END FOR</code>
 * <p>
 * The body runs once per row of the query result. Columns are visible as
 * variables under their own names and, when a variable name is given, as
 * fields of that variable (<code>variable.column</code>).
 */
public final class ForStatement extends LabeledLoop {

	private final SingleStatement query;
	private final String variableName;

	public ForStatement(String label, String variableName, SingleStatement query, CompoundBody body, Origin origin) {
		super(label, body, origin);
		if (query == null) {
			throw new IllegalArgumentException("FOR needs a query");
		}
		this.query = query;
		this.variableName = variableName;
	}

	public SingleStatement getQuery() {
		return query;
	}

	/**
	 * @return the name of the row variable, or {@code null}
	 */
	public String getVariableName() {
		return variableName;
	}

	@Override
	public <R> R accept(ScriptNodeVisitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
