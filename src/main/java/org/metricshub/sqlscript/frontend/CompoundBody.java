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
 * A <code>BEGIN ... END</code> block: the unit of scoping.
 * It owns an optional label, the condition handlers declared at its top,
 * and the ordered list of its statements.
 */
public final class CompoundBody extends ScriptNode {

	private final String label;
	private final List<HandlerDeclaration> handlers;
	private final List<ScriptNode> statements;

	public CompoundBody(String label, List<HandlerDeclaration> handlers, List<ScriptNode> statements, Origin origin) {
		super(origin);
		this.label = label;
		this.handlers = handlers == null ?
				Collections.<HandlerDeclaration>emptyList() :
				Collections.unmodifiableList(new ArrayList<HandlerDeclaration>(handlers));
		this.statements = statements == null ?
				Collections.<ScriptNode>emptyList() :
				Collections.unmodifiableList(new ArrayList<ScriptNode>(statements));
	}

	/**
	 * @return the label as written in the script, or {@code null}
	 */
	public String getLabel() {
		return label;
	}

	public List<HandlerDeclaration> getHandlers() {
		return handlers;
	}

	public List<ScriptNode> getStatements() {
		return statements;
	}

	@Override
	public <R> R accept(ScriptNodeVisitor<R> visitor) {
		return visitor.visitCompoundBody(this);
	}
}
