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
 * An {@link ExecutionPlan} running in an {@link ExecutionContext}.
 */
public class ExecutionFrame {

	/**
	 * What started the frame.
	 */
	public enum FrameType {
		/** A script run by the host. */
		SQL_SCRIPT,
		/** A script started from another script. */
		NESTED_SCRIPT
	}

	private final ExecutionPlan plan;
	private final FrameType type;

	public ExecutionFrame(ExecutionPlan plan, FrameType type) {
		this.plan = plan;
		this.type = type;
	}

	public ExecutionPlan getPlan() {
		return plan;
	}

	public FrameType getType() {
		return type;
	}

	@Override
	public String toString() {
		return type + " frame of " + plan.getScript().size() + " nodes";
	}
}
