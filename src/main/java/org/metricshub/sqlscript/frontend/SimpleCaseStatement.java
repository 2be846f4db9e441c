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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>CASE expr WHEN value THEN ... [WHEN value THEN ...]* [ELSE ...] END CASE</code>
 * <p>
 * The case expression is evaluated once and compared for equality with each
 * branch value, in order.
 */
public final class SimpleCaseStatement extends ScriptNode {

	private final SingleStatement caseExpression;
	private final List<SingleStatement> values;
	private final List<CompoundBody> bodies;
	private final CompoundBody elseBody;

	public SimpleCaseStatement(
			SingleStatement caseExpression,
			List<SingleStatement> values,
			List<CompoundBody> bodies,
			CompoundBody elseBody,
			Origin origin) {
		super(origin);
		if (caseExpression == null) {
			throw new IllegalArgumentException("A simple CASE needs a case expression");
		}
		if (values == null || bodies == null || values.size() != bodies.size() || values.isEmpty()) {
			throw new IllegalArgumentException("Each WHEN value must have exactly one body");
		}
		this.caseExpression = caseExpression;
		this.values = Collections.unmodifiableList(new ArrayList<SingleStatement>(values));
		this.bodies = Collections.unmodifiableList(new ArrayList<CompoundBody>(bodies));
		this.elseBody = elseBody;
	}

	public SingleStatement getCaseExpression() {
		return caseExpression;
	}

	public List<SingleStatement> getValues() {
		return values;
	}

	public List<CompoundBody> getBodies() {
		return bodies;
	}

	public CompoundBody getElseBody() {
		return elseBody;
	}

	@Override
	public <R> R accept(ScriptNodeVisitor<R> visitor) {
		return visitor.visitSimpleCase(this);
	}
}
