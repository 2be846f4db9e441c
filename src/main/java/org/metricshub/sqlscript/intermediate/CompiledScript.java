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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The compiled form of a script: all of its nodes in one list, addressed by
 * index. The root compound body is at index 0.
 * <p>
 * A compiled script is immutable and can be shared by any number of
 * executions.
 *
 * @see PlanBuilder
 */
public final class CompiledScript {

	private final List<StatementNode> nodes;

	CompiledScript(List<StatementNode> nodes) {
		this.nodes = Collections.unmodifiableList(new ArrayList<StatementNode>(nodes));
	}

	public StatementNode node(int index) {
		return nodes.get(index);
	}

	public int size() {
		return nodes.size();
	}

	public StatementNode root() {
		return nodes.get(0);
	}

	/**
	 * Outputs the nodes to a PrintStream, one per line.
	 *
	 * @param ps The PrintStream to which to dump the nodes.
	 */
	public void dump(PrintStream ps) {
		for (StatementNode node : nodes) {
			ps.println(node.getIndex() + " : " + node + " (" + node.getOrigin() + ")");
		}
	}
}
