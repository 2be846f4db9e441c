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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.frontend.Origin;

/**
 * Tracks the labeled statements enclosing the node being compiled, so that
 * <code>LEAVE</code> and <code>ITERATE</code> can be bound to their target.
 * <p>
 * A label may be reused by a nested statement, which then shadows the outer
 * one, but not by two statements of the same body.
 */
final class LabelRegistry {

	static final class Target {
		private final String label;
		private final int index;
		private final NodeKind kind;

		Target(String label, int index, NodeKind kind) {
			this.label = label;
			this.index = index;
			this.kind = kind;
		}

		String getLabel() {
			return label;
		}

		int getIndex() {
			return index;
		}

		NodeKind getKind() {
			return kind;
		}
	}

	private final Deque<Target> open = new ArrayDeque<Target>();
	private final Deque<Set<String>> bodies = new ArrayDeque<Set<String>>();

	LabelRegistry() {
		bodies.push(new HashSet<String>());
	}

	/**
	 * @param label label as written, may be {@code null}
	 * @return the label in lower case, or {@code null}
	 */
	static String normalize(String label) {
		return label == null ? null : label.trim().toLowerCase(Locale.ROOT);
	}

	void enterBody() {
		bodies.push(new HashSet<String>());
	}

	void exitBody() {
		bodies.pop();
	}

	/**
	 * Opens a labeled statement of the current body.
	 *
	 * @param label normalized label, {@code null} when the statement is not labeled
	 * @param index arena index of the statement
	 * @param kind kind of the statement
	 * @param origin position of the statement
	 */
	void open(String label, int index, NodeKind kind, Origin origin) {
		if (label != null && !bodies.peek().add(label)) {
			throw ScriptErrors.labelAlreadyExists(label.toUpperCase(Locale.ROOT), origin);
		}
		open.push(new Target(label, index, kind));
	}

	void close() {
		open.pop();
	}

	/**
	 * @param label normalized label
	 * @return the innermost open statement with that label, or {@code null}
	 */
	Target resolve(String label) {
		if (label == null) {
			return null;
		}
		for (Target target : open) {
			if (label.equals(target.getLabel())) {
				return target;
			}
		}
		return null;
	}
}
