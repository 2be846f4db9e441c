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
 * One non-control statement of the script (a query, a DECLARE, a SET...), or
 * an expression used as the guard of a conditional or a loop.
 * The text is opaque to the engine and only interpreted by the
 * {@link org.metricshub.sqlscript.jrt.QueryEvaluator}.
 */
public final class SingleStatement extends ScriptNode {

	private final String text;

	public SingleStatement(String text, Origin origin) {
		super(origin);
		if (text == null) {
			throw new IllegalArgumentException("Statement text must not be null");
		}
		this.text = text;
	}

	/**
	 * @return the statement text, as written in the script
	 */
	public String getText() {
		return text;
	}

	@Override
	public <R> R accept(ScriptNodeVisitor<R> visitor) {
		return visitor.visitSingleStatement(this);
	}

	@Override
	public String toString() {
		return text;
	}
}
