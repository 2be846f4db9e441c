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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The stack of frames of the scripts currently running on one thread of the
 * host.
 */
public class ExecutionContext {

	private final Deque<ExecutionFrame> frames = new ArrayDeque<ExecutionFrame>();

	public void pushFrame(ExecutionFrame frame) {
		frames.push(frame);
	}

	/**
	 * @return the frame removed
	 * @throws IllegalStateException when no frame is open
	 */
	public ExecutionFrame popFrame() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("No frame to pop");
		}
		return frames.pop();
	}

	/**
	 * @return the innermost frame, or {@code null}
	 */
	public ExecutionFrame currentFrame() {
		return frames.peek();
	}

	public int depth() {
		return frames.size();
	}
}
