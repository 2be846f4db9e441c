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

/**
 * A <code>LEAVE</code> or <code>ITERATE</code> travelling up the stack of
 * open statements until it reaches the statement it targets.
 */
final class ControlSignal {

	enum Type {
		LEAVE,
		ITERATE
	}

	private final Type type;
	private final String label;
	private final int target;

	ControlSignal(Type type, String label, int target) {
		this.type = type;
		this.label = label;
		this.target = target;
	}

	Type getType() {
		return type;
	}

	String getLabel() {
		return label;
	}

	int getTarget() {
		return target;
	}

	@Override
	public String toString() {
		return type + " " + label + " (" + target + ")";
	}
}
