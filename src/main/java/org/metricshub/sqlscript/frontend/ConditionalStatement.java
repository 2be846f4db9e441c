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
 * Conditional whose branches each carry their own boolean condition
 * (<code>IF ... ELSEIF ... ELSE</code> and searched <code>CASE WHEN</code>).
 * The first branch whose condition holds is executed; otherwise the else
 * body, when there is one.
 */
public abstract class ConditionalStatement extends ScriptNode {

	private final List<SingleStatement> conditions;
	private final List<CompoundBody> bodies;
	private final CompoundBody elseBody;

	protected ConditionalStatement(
			List<SingleStatement> conditions,
			List<CompoundBody> bodies,
			CompoundBody elseBody,
			Origin origin) {
		super(origin);
		if (conditions == null || bodies == null || conditions.size() != bodies.size()) {
			throw new IllegalArgumentException("Each condition must have exactly one body");
		}
		if (conditions.isEmpty()) {
			throw new IllegalArgumentException("A conditional needs at least one branch");
		}
		this.conditions = Collections.unmodifiableList(new ArrayList<SingleStatement>(conditions));
		this.bodies = Collections.unmodifiableList(new ArrayList<CompoundBody>(bodies));
		this.elseBody = elseBody;
	}

	public List<SingleStatement> getConditions() {
		return conditions;
	}

	public List<CompoundBody> getBodies() {
		return bodies;
	}

	/**
	 * @return the else body, or {@code null} when there is no ELSE
	 */
	public CompoundBody getElseBody() {
		return elseBody;
	}
}
