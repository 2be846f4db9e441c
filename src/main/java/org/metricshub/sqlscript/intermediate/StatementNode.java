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

import java.util.Arrays;
import org.metricshub.sqlscript.frontend.Origin;
import org.metricshub.sqlscript.frontend.SingleStatement;

/**
 * A node of a {@link CompiledScript}.
 * <p>
 * Nodes reference each other by their index in the script, never by object
 * reference. Which fields are meaningful depends on the {@link NodeKind}:
 * <ul>
 * <li>{@link NodeKind#LEAF}: {@link #getStatement()}, and {@link #isGuard()}
 * for conditions, CASE operands and FOR queries evaluated by the engine
 * <li>{@link NodeKind#BLOCK}: {@link #getChildren()}, {@link #getHandlers()}
 * <li>{@link NodeKind#SEARCHED_CONDITIONAL}: {@link #getGuards()},
 * {@link #getBodies()}, {@link #getElseBody()}
 * <li>{@link NodeKind#SIMPLE_CONDITIONAL}: {@link #getGuard()} is the case
 * expression, {@link #getGuards()} the WHEN values
 * <li>loops: {@link #getGuard()} (no guard for <code>LOOP</code>),
 * {@link #getBody()}, and {@link #getVariableName()} for <code>FOR</code>
 * <li>{@link NodeKind#LEAVE}, {@link NodeKind#ITERATE}: {@link #getTarget()}
 * </ul>
 * Absent indexes are -1.
 */
public final class StatementNode {

	private static final int[] NONE = new int[0];

	private final int index;
	private final NodeKind kind;
	private final String label;
	private final Origin origin;

	private SingleStatement statement;
	private boolean guard;

	private int[] children = NONE;
	private HandlerTable handlers = HandlerTable.EMPTY;

	private int[] guards = NONE;
	private int[] bodies = NONE;
	private int elseBody = -1;

	private int guardIndex = -1;
	private int body = -1;
	private String variableName;

	private int target = -1;
	private String targetLabel;

	private StatementNode(int index, NodeKind kind, String label, Origin origin) {
		this.index = index;
		this.kind = kind;
		this.label = label;
		this.origin = origin == null ? Origin.UNKNOWN : origin;
	}

	static StatementNode leaf(int index, SingleStatement statement, boolean guard) {
		StatementNode node = new StatementNode(index, NodeKind.LEAF, null, statement.getOrigin());
		node.statement = statement;
		node.guard = guard;
		return node;
	}

	static StatementNode block(int index, String label, Origin origin, int[] children, HandlerTable handlers) {
		StatementNode node = new StatementNode(index, NodeKind.BLOCK, label, origin);
		node.children = children;
		node.handlers = handlers;
		return node;
	}

	static StatementNode searched(int index, Origin origin, int[] guards, int[] bodies, int elseBody) {
		StatementNode node = new StatementNode(index, NodeKind.SEARCHED_CONDITIONAL, null, origin);
		node.guards = guards;
		node.bodies = bodies;
		node.elseBody = elseBody;
		return node;
	}

	static StatementNode simple(int index, Origin origin, int scrutinee, int[] values, int[] bodies, int elseBody) {
		StatementNode node = new StatementNode(index, NodeKind.SIMPLE_CONDITIONAL, null, origin);
		node.guardIndex = scrutinee;
		node.guards = values;
		node.bodies = bodies;
		node.elseBody = elseBody;
		return node;
	}

	static StatementNode loop(int index, NodeKind kind, String label, Origin origin, int guard, int body) {
		StatementNode node = new StatementNode(index, kind, label, origin);
		node.guardIndex = guard;
		node.body = body;
		return node;
	}

	static StatementNode cursor(int index, String label, Origin origin, int query, String variableName, int body) {
		StatementNode node = loop(index, NodeKind.CURSOR_LOOP, label, origin, query, body);
		node.variableName = variableName;
		return node;
	}

	static StatementNode jump(int index, NodeKind kind, Origin origin, int target, String targetLabel) {
		StatementNode node = new StatementNode(index, kind, null, origin);
		node.target = target;
		node.targetLabel = targetLabel;
		return node;
	}

	public int getIndex() {
		return index;
	}

	public NodeKind getKind() {
		return kind;
	}

	/**
	 * @return the label, lower-cased, or {@code null}
	 */
	public String getLabel() {
		return label;
	}

	public Origin getOrigin() {
		return origin;
	}

	public SingleStatement getStatement() {
		return statement;
	}

	public boolean isGuard() {
		return guard;
	}

	public int[] getChildren() {
		return children.clone();
	}

	public int getChildCount() {
		return children.length;
	}

	public int getChild(int position) {
		return children[position];
	}

	public HandlerTable getHandlers() {
		return handlers;
	}

	public int[] getGuards() {
		return guards.clone();
	}

	public int getBranchCount() {
		return guards.length;
	}

	public int getGuard(int branch) {
		return guards[branch];
	}

	public int getBody(int branch) {
		return bodies[branch];
	}

	public int[] getBodies() {
		return bodies.clone();
	}

	public int getElseBody() {
		return elseBody;
	}

	/**
	 * @return the loop condition, the case expression or the FOR query
	 */
	public int getGuard() {
		return guardIndex;
	}

	public int getBody() {
		return body;
	}

	public String getVariableName() {
		return variableName;
	}

	public int getTarget() {
		return target;
	}

	public String getTargetLabel() {
		return targetLabel;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(kind.name());
		if (label != null) {
			sb.append(" [").append(label).append(']');
		}
		switch (kind) {
		case LEAF:
			sb.append(guard ? " ? " : " : ").append(statement.getText());
			break;
		case BLOCK:
			sb.append(", children ").append(Arrays.toString(children));
			if (!handlers.isEmpty()) {
				sb.append(", handlers ").append(handlers);
			}
			break;
		case SEARCHED_CONDITIONAL:
		case SIMPLE_CONDITIONAL:
			if (guardIndex >= 0) {
				sb.append(", case ").append(guardIndex);
			}
			sb.append(", when ").append(Arrays.toString(guards));
			sb.append(", then ").append(Arrays.toString(bodies));
			if (elseBody >= 0) {
				sb.append(", else ").append(elseBody);
			}
			break;
		case CURSOR_LOOP:
			sb.append(", query ").append(guardIndex);
			if (variableName != null) {
				sb.append(", variable ").append(variableName);
			}
			sb.append(", body ").append(body);
			break;
		case PRETEST_LOOP:
		case POSTTEST_LOOP:
			sb.append(", condition ").append(guardIndex);
			sb.append(", body ").append(body);
			break;
		case UNCONDITIONAL_LOOP:
			sb.append(", body ").append(body);
			break;
		case LEAVE:
		case ITERATE:
			sb.append(' ').append(targetLabel).append(" -> ").append(target);
			break;
		default:
			throw new Error("Unknown node kind: " + kind);
		}
		return sb.toString();
	}
}
