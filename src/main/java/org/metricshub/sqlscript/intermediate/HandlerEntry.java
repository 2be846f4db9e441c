package org.metricshub.sqlscript.intermediate;

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

import org.metricshub.sqlscript.frontend.HandlerDeclaration.HandlerType;
import org.metricshub.sqlscript.frontend.Origin;

/**
 * One condition of a handler declaration, bound to the compiled handler body.
 */
public final class HandlerEntry {

	private final String condition;
	private final HandlerType type;
	private final int bodyIndex;
	private final int blockIndex;
	private final Origin origin;

	/**
	 * @param condition normalized condition, see {@link HandlerTable#normalizeCondition(String, Origin)}
	 * @param type handler type
	 * @param bodyIndex arena index of the handler body
	 * @param blockIndex arena index of the block declaring the handler
	 * @param origin position of the declaration
	 */
	public HandlerEntry(String condition, HandlerType type, int bodyIndex, int blockIndex, Origin origin) {
		this.condition = condition;
		this.type = type;
		this.bodyIndex = bodyIndex;
		this.blockIndex = blockIndex;
		this.origin = origin;
	}

	public String getCondition() {
		return condition;
	}

	public HandlerType getType() {
		return type;
	}

	public int getBodyIndex() {
		return bodyIndex;
	}

	public int getBlockIndex() {
		return blockIndex;
	}

	public Origin getOrigin() {
		return origin;
	}

	@Override
	public String toString() {
		return type + " " + condition + " -> " + bodyIndex;
	}
}
