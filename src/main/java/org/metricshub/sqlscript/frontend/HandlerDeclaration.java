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
 * <code>DECLARE EXIT HANDLER FOR condition [, condition...] body</code>.
 * <p>
 * A condition is either <code>SQLEXCEPTION</code>, <code>NOT FOUND</code>,
 * <code>SQLSTATE 'xxxxx'</code> or the name of an error condition.
 * Handler declarations are not statements: they are attached to the
 * {@link CompoundBody} that declares them.
 */
public final class HandlerDeclaration {

	/**
	 * What happens once the handler body has run.
	 */
	public enum HandlerType {
		/** The declaring block is exited. */
		EXIT,
		/** Execution resumes after the failed statement. */
		CONTINUE
	}

	private final HandlerType type;
	private final List<String> conditions;
	private final CompoundBody body;
	private final Origin origin;

	public HandlerDeclaration(HandlerType type, List<String> conditions, CompoundBody body, Origin origin) {
		if (conditions == null || conditions.isEmpty()) {
			throw new IllegalArgumentException("A handler must declare at least one condition");
		}
		this.type = type;
		this.conditions = Collections.unmodifiableList(new ArrayList<String>(conditions));
		this.body = body;
		this.origin = origin == null ? Origin.UNKNOWN : origin;
	}

	public HandlerType getType() {
		return type;
	}

	public List<String> getConditions() {
		return conditions;
	}

	public CompoundBody getBody() {
		return body;
	}

	public Origin getOrigin() {
		return origin;
	}

	@Override
	public String toString() {
		return type + " HANDLER FOR " + String.join(", ", conditions);
	}
}
