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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.metricshub.sqlscript.SqlScriptException;
import org.metricshub.sqlscript.frontend.SingleStatement;
import org.metricshub.sqlscript.intermediate.CompiledScript;
import org.metricshub.sqlscript.intermediate.HandlerEntry;
import org.metricshub.sqlscript.intermediate.StatementNode;
import org.metricshub.sqlscript.jrt.QueryEvaluator;
import org.metricshub.sqlscript.jrt.QueryResult;
import org.metricshub.sqlscript.jrt.Scope;
import org.metricshub.sqlscript.jrt.ScopeStack;
import org.metricshub.sqlscript.jrt.SqlType;
import org.metricshub.sqlscript.util.ScriptLogger;
import org.metricshub.sqlscript.util.ScriptSettings;
import org.slf4j.Logger;

/**
 * Walks a compiled script and produces, one at a time, the statements to run.
 * <p>
 * The iterator keeps a stack of {@link NodeCursor}s, one per open statement.
 * Each call to {@link #hasNext()} advances the top cursor until a statement
 * is produced: either a leaf the caller must run, or a condition the engine
 * ran itself (marked {@linkplain ExecutableStatement#isExecuted() executed}).
 * <code>LEAVE</code> and <code>ITERATE</code> pop the cursors up to their
 * target, closing the scopes those cursors opened.
 * <p>
 * When the statement returned last fails, the caller reports the error with
 * {@link #handleError(SqlScriptException)}: the innermost matching condition
 * handler takes over, or the error ends the run.
 * <p>
 * Not thread-safe.
 */
public class StatementIterator implements Iterator<ExecutableStatement> {

	private static final Logger LOG = ScriptLogger.getLogger(StatementIterator.class);

	private final CompiledScript script;
	private final ScopeStack scopes;
	private final QueryEvaluator evaluator;
	private final ConditionEvaluator conditions;
	private final Deque<NodeCursor> cursors = new ArrayDeque<NodeCursor>();

	private ExecutableStatement pending;
	private boolean terminated;

	/**
	 * @param script the compiled script
	 * @param scopes the scopes of the run, with the root scope already open
	 * @param evaluator runs the conditions and the FOR queries
	 * @param settings comparison settings
	 */
	public StatementIterator(CompiledScript script, ScopeStack scopes, QueryEvaluator evaluator, ScriptSettings settings) {
		this.script = script;
		this.scopes = scopes;
		this.evaluator = evaluator;
		this.conditions = new ConditionEvaluator(evaluator, scopes, settings);
		cursors.push(new NodeCursor(script.root()));
	}

	@Override
	public boolean hasNext() {
		if (pending == null && !terminated) {
			pending = advance();
		}
		return pending != null;
	}

	@Override
	public ExecutableStatement next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		ExecutableStatement statement = pending;
		pending = null;
		return statement;
	}

	/**
	 * @return {@code true} once the script completed or failed
	 */
	public boolean isTerminated() {
		return terminated;
	}

	/**
	 * @return number of statements currently open
	 */
	public int depth() {
		return cursors.size();
	}

	/**
	 * Reports the failure of the statement returned last by {@link #next()}.
	 * <p>
	 * The open blocks are searched from the innermost one for a handler
	 * matching the error. The blocks and loops nested in the block declaring
	 * that handler are closed and the handler body runs next; when it
	 * completes, the declaring block is exited. Without a matching handler,
	 * every open statement is closed and the error is rethrown.
	 *
	 * @param error the failure
	 * @throws SqlScriptException the same error, when no handler matches
	 */
	public void handleError(SqlScriptException error) {
		if (pending != null) {
			throw new IllegalStateException("An error can only be reported for the statement returned last");
		}
		if (terminated) {
			throw error;
		}
		route(error);
	}

	private ExecutableStatement advance() {
		while (!cursors.isEmpty()) {
			NodeCursor cursor = cursors.peek();
			try {
				ExecutableStatement statement = step(cursor);
				if (statement != null) {
					LOG.trace("Next statement: {}", statement);
					return statement;
				}
			} catch (SqlScriptException e) {
				route(e);
			}
		}
		terminated = true;
		LOG.debug("Script completed");
		return null;
	}

	/**
	 * Moves a cursor one step forward.
	 *
	 * @param cursor the top cursor
	 * @return the statement produced by this step, or {@code null}
	 */
	private ExecutableStatement step(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (node.getKind()) {
		case BLOCK:
			return stepBlock(cursor);
		case SEARCHED_CONDITIONAL:
			return stepSearched(cursor);
		case SIMPLE_CONDITIONAL:
			return stepSimple(cursor);
		case PRETEST_LOOP:
			return stepWhile(cursor);
		case POSTTEST_LOOP:
			return stepRepeat(cursor);
		case UNCONDITIONAL_LOOP:
			return stepLoop(cursor);
		case CURSOR_LOOP:
			return stepFor(cursor);
		default:
			throw new IllegalStateException("No cursor expected for " + node);
		}
	}

	private ExecutableStatement stepBlock(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
			Scope scope = new Scope(node.getIndex(), node.getLabel(), node.getHandlers());
			scopes.push(scope);
			cursor.setScope(scope);
			cursor.setPhase(NodeCursor.Phase.BODY);
			return null;
		case BODY:
			if (cursor.getPosition() < node.getChildCount()) {
				return enter(node.getChild(cursor.nextPosition()));
			}
			close(cursor);
			return null;
		case HANDLER:
			LOG.debug("Handler completed, exiting block {}", node.getIndex());
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	private ExecutableStatement stepSearched(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
			cursor.setPhase(NodeCursor.Phase.CONDITION);
			return null;
		case CONDITION:
			if (cursor.getPosition() >= node.getBranchCount()) {
				cursor.setPhase(NodeCursor.Phase.BODY);
				return null;
			}
			int guard = node.getGuard(cursor.getPosition());
			boolean holds = conditions.evaluateGuard(statement(guard));
			if (holds) {
				cursor.setPhase(NodeCursor.Phase.BODY);
			} else {
				cursor.nextPosition();
			}
			return executed(guard, Boolean.valueOf(holds));
		case BODY:
			return enterBranch(cursor);
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	private ExecutableStatement stepSimple(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
			cursor.setScrutinee(conditions.evaluateScalar(statement(node.getGuard())));
			cursor.setPhase(NodeCursor.Phase.CONDITION);
			return executed(node.getGuard(), null);
		case CONDITION:
			if (cursor.getPosition() >= node.getBranchCount()) {
				cursor.setPhase(NodeCursor.Phase.BODY);
				return null;
			}
			int guard = node.getGuard(cursor.getPosition());
			SingleStatement value = statement(guard);
			boolean matches = conditions.matches(cursor.getScrutinee(), conditions.evaluateScalar(value), value.getOrigin());
			if (matches) {
				cursor.setPhase(NodeCursor.Phase.BODY);
			} else {
				cursor.nextPosition();
			}
			return executed(guard, Boolean.valueOf(matches));
		case BODY:
			return enterBranch(cursor);
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	/**
	 * Enters the branch selected by a conditional, the ELSE body when the
	 * position went past the last branch.
	 */
	private ExecutableStatement enterBranch(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		cursor.setPhase(NodeCursor.Phase.DONE);
		int body = cursor.getPosition() < node.getBranchCount() ? node.getBody(cursor.getPosition()) : node.getElseBody();
		return body < 0 ? null : enter(body);
	}

	private ExecutableStatement stepWhile(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
		case CONDITION:
			boolean holds = conditions.evaluateGuard(statement(node.getGuard()));
			cursor.setPhase(holds ? NodeCursor.Phase.BODY : NodeCursor.Phase.DONE);
			return executed(node.getGuard(), Boolean.valueOf(holds));
		case BODY:
			cursor.setPhase(NodeCursor.Phase.CONDITION);
			return enter(node.getBody());
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	private ExecutableStatement stepRepeat(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
		case BODY:
			cursor.setPhase(NodeCursor.Phase.CONDITION);
			return enter(node.getBody());
		case CONDITION:
			boolean until = conditions.evaluateGuard(statement(node.getGuard()));
			cursor.setPhase(until ? NodeCursor.Phase.DONE : NodeCursor.Phase.BODY);
			return executed(node.getGuard(), Boolean.valueOf(until));
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	private ExecutableStatement stepLoop(NodeCursor cursor) {
		switch (cursor.getPhase()) {
		case ENTER:
		case BODY:
			cursor.setPhase(NodeCursor.Phase.BODY);
			return enter(cursor.getNode().getBody());
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	private ExecutableStatement stepFor(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		switch (cursor.getPhase()) {
		case ENTER:
			cursor.setRows(evaluator.execute(statement(node.getGuard()), scopes));
			cursor.setPhase(NodeCursor.Phase.ROW);
			return executed(node.getGuard(), null);
		case ROW:
			closeScope(cursor);
			if (!cursor.hasMoreRows()) {
				close(cursor);
				return null;
			}
			openRow(cursor);
			cursor.setPhase(NodeCursor.Phase.BODY);
			return null;
		case BODY:
			cursor.setPhase(NodeCursor.Phase.ROW);
			return enter(node.getBody());
		case DONE:
			close(cursor);
			return null;
		default:
			throw new IllegalStateException("Unexpected phase for " + cursor);
		}
	}

	/**
	 * Opens the scope of the next FOR row: the row variable first, then one
	 * variable per column.
	 */
	private void openRow(NodeCursor cursor) {
		StatementNode node = cursor.getNode();
		QueryResult rows = cursor.getRows();
		List<Object> row = rows.getRows().get(cursor.nextRowIndex());
		Scope scope = new Scope(node.getIndex(), node.getLabel(), null);
		scopes.push(scope);
		cursor.setScope(scope);
		if (node.getVariableName() != null) {
			Map<String, Object> record = new LinkedHashMap<String, Object>();
			for (int i = 0; i < rows.getColumnCount(); i++) {
				record.put(rows.getColumns().get(i).getName(), row.get(i));
			}
			scopes.declare(node.getVariableName(), SqlType.STRUCT, record);
		}
		for (int i = 0; i < rows.getColumnCount(); i++) {
			QueryResult.Column column = rows.getColumns().get(i);
			scopes.declare(column.getName(), column.getType(), row.get(i));
		}
	}

	/**
	 * Starts a child statement.
	 *
	 * @param index arena index of the child
	 * @return the child itself when it is a leaf, {@code null} otherwise
	 */
	private ExecutableStatement enter(int index) {
		StatementNode node = script.node(index);
		switch (node.getKind()) {
		case LEAF:
			return new ExecutableStatement(index, node.getStatement(), false, null);
		case LEAVE:
			unwind(new ControlSignal(ControlSignal.Type.LEAVE, node.getTargetLabel(), node.getTarget()));
			return null;
		case ITERATE:
			unwind(new ControlSignal(ControlSignal.Type.ITERATE, node.getTargetLabel(), node.getTarget()));
			return null;
		default:
			cursors.push(new NodeCursor(node));
			return null;
		}
	}

	/**
	 * Closes the statements nested in the target of a signal, then exits the
	 * target (<code>LEAVE</code>) or moves it to its next iteration
	 * (<code>ITERATE</code>).
	 */
	private void unwind(ControlSignal signal) {
		LOG.debug("Unwinding {}", signal);
		while (!cursors.isEmpty()) {
			NodeCursor cursor = cursors.peek();
			if (cursor.getNodeIndex() != signal.getTarget()) {
				close(cursor);
				continue;
			}
			if (signal.getType() == ControlSignal.Type.LEAVE) {
				close(cursor);
				return;
			}
			switch (cursor.getNode().getKind()) {
			case PRETEST_LOOP:
			case POSTTEST_LOOP:
				cursor.setPhase(NodeCursor.Phase.CONDITION);
				break;
			case UNCONDITIONAL_LOOP:
				cursor.setPhase(NodeCursor.Phase.BODY);
				break;
			case CURSOR_LOOP:
				cursor.setPhase(NodeCursor.Phase.ROW);
				break;
			default:
				throw new IllegalStateException("ITERATE cannot target " + cursor.getNode());
			}
			return;
		}
		throw new IllegalStateException("Target of " + signal + " is not open");
	}

	/**
	 * Transfers control to the innermost handler matching the error, or ends
	 * the run.
	 */
	private void route(SqlScriptException error) {
		for (NodeCursor cursor : cursors) {
			Scope scope = cursor.getScope();
			if (scope == null || scope.isHandling() || cursor.getNode().getHandlers().isEmpty()) {
				continue;
			}
			HandlerEntry handler = scope.getHandlers().find(error);
			if (handler == null) {
				continue;
			}
			LOG.debug("Handling {} with handler {} of block {}", error.getCondition(), handler, cursor.getNodeIndex());
			while (cursors.peek() != cursor) {
				close(cursors.peek());
			}
			scope.setHandling(true);
			cursor.setPhase(NodeCursor.Phase.HANDLER);
			cursors.push(new NodeCursor(script.node(handler.getBodyIndex())));
			return;
		}
		LOG.debug("No handler for {}, stopping the script", error.getCondition());
		while (!cursors.isEmpty()) {
			close(cursors.peek());
		}
		terminated = true;
		throw error;
	}

	/**
	 * Pops a cursor, closing the scope it opened.
	 */
	private void close(NodeCursor cursor) {
		if (cursors.peek() != cursor) {
			throw new IllegalStateException("Only the innermost statement can be closed: " + cursor);
		}
		closeScope(cursor);
		cursors.pop();
	}

	private void closeScope(NodeCursor cursor) {
		if (cursor.getScope() == null) {
			return;
		}
		Scope popped = scopes.pop();
		if (popped != cursor.getScope()) {
			throw new IllegalStateException("Scope " + popped + " closed out of order");
		}
		cursor.setScope(null);
	}

	private SingleStatement statement(int index) {
		return script.node(index).getStatement();
	}

	private ExecutableStatement executed(int index, Boolean guardResult) {
		return new ExecutableStatement(index, statement(index), true, guardResult);
	}
}
