package org.metricshub.sqlscript;

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
import java.util.Map;
import org.metricshub.sqlscript.backend.ExecutableStatement;
import org.metricshub.sqlscript.backend.ExecutionContext;
import org.metricshub.sqlscript.backend.ExecutionFrame;
import org.metricshub.sqlscript.backend.ExecutionPlan;
import org.metricshub.sqlscript.backend.StatementIterator;
import org.metricshub.sqlscript.frontend.CompoundBody;
import org.metricshub.sqlscript.intermediate.CompiledScript;
import org.metricshub.sqlscript.intermediate.PlanBuilder;
import org.metricshub.sqlscript.jrt.QueryEvaluator;
import org.metricshub.sqlscript.jrt.QueryResult;
import org.metricshub.sqlscript.util.ScriptLogger;
import org.metricshub.sqlscript.util.ScriptSettings;
import org.slf4j.Logger;

/**
 * Entry point into the compilation and execution of a SQL script.
 * <p>
 * The overall process to execute a script is as follows:
 * <ul>
 * <li>The host parser produces the tree of the script, a {@link CompoundBody}.
 * <li>The tree is compiled into a {@link CompiledScript}, where labels and
 * condition handlers are checked.
 * <li>An {@link ExecutionPlan} binds the compiled script to arguments and to
 * a {@link QueryEvaluator}; its statement iterator decides which statement
 * runs next, and the evaluator runs it.
 * </ul>
 * Hosts that run statements themselves use {@link #build(CompoundBody, Map)}
 * and pull from {@link ExecutionPlan#statements()}; the <code>run</code>
 * methods do it for them and collect the results.
 *
 * @see StatementIterator
 */
public class SqlScript {

	private static final Logger LOG = ScriptLogger.getLogger(SqlScript.class);

	private final QueryEvaluator evaluator;
	private final ScriptSettings settings;
	private final ExecutionContext context = new ExecutionContext();

	/**
	 * Creates an engine with the default settings.
	 *
	 * @param evaluator runs the statements of the scripts
	 */
	public SqlScript(QueryEvaluator evaluator) {
		this(evaluator, ScriptSettings.DEFAULT_SETTINGS);
	}

	/**
	 * @param evaluator runs the statements of the scripts
	 * @param settings compilation and execution settings
	 */
	public SqlScript(QueryEvaluator evaluator, ScriptSettings settings) {
		if (evaluator == null) {
			throw new IllegalArgumentException("A query evaluator is required");
		}
		this.evaluator = evaluator;
		this.settings = settings == null ? ScriptSettings.DEFAULT_SETTINGS : settings;
	}

	/**
	 * Compiles a script, printing the result when
	 * {@link ScriptSettings#isDumpPlan()} is set.
	 *
	 * @param tree the script
	 * @return the compiled script
	 * @throws SqlScriptException on label or handler errors
	 */
	public CompiledScript compile(CompoundBody tree) {
		CompiledScript script = new PlanBuilder().compile(tree);
		if (settings.isDumpPlan()) {
			script.dump(settings.getOutputStream());
		}
		return script;
	}

	/**
	 * Compiles a script without arguments into an execution plan.
	 *
	 * @param tree the script
	 * @return the plan, its root scope not open yet
	 */
	public ExecutionPlan build(CompoundBody tree) {
		return build(tree, Collections.<String, Object>emptyMap());
	}

	/**
	 * Compiles a script into an execution plan.
	 *
	 * @param tree the script
	 * @param arguments named arguments, visible to the script as variables
	 * @return the plan, its root scope not open yet
	 */
	public ExecutionPlan build(CompoundBody tree, Map<String, Object> arguments) {
		return new ExecutionPlan(compile(tree), arguments, evaluator, settings);
	}

	public List<StatementResult> run(CompoundBody tree) {
		return run(build(tree));
	}

	public List<StatementResult> run(CompoundBody tree, Map<String, Object> arguments) {
		return run(build(tree, arguments));
	}

	/**
	 * Runs a plan to completion.
	 *
	 * @param plan a plan whose root scope is not open yet
	 * @return the statements run by the evaluator and their results, in order
	 * @throws SqlScriptException the error that no condition handler caught
	 */
	public List<StatementResult> run(ExecutionPlan plan) {
		List<StatementResult> results = new ArrayList<StatementResult>();
		ExecutionFrame.FrameType type = context.depth() == 0 ?
				ExecutionFrame.FrameType.SQL_SCRIPT :
				ExecutionFrame.FrameType.NESTED_SCRIPT;
		context.pushFrame(new ExecutionFrame(plan, type));
		try {
			plan.enterScope();
			StatementIterator statements = plan.statements();
			LOG.debug("Running script of {} nodes", plan.getScript().size());
			while (statements.hasNext()) {
				ExecutableStatement statement = statements.next();
				if (statement.isExecuted()) {
					continue;
				}
				QueryResult result;
				try {
					result = evaluator.execute(statement.getStatement(), plan.getScopes());
				} catch (SqlScriptException e) {
					LOG.debug("Statement failed: {}", e.getMessage());
					statements.handleError(e);
					continue;
				}
				results.add(new StatementResult(statement.getStatement(), result));
			}
			LOG.debug("Script completed after {} statements", results.size());
			return results;
		} finally {
			context.popFrame();
		}
	}

	/**
	 * @return the frames of the scripts being run by this engine
	 */
	public ExecutionContext getContext() {
		return context;
	}

	public ScriptSettings getSettings() {
		return settings;
	}
}
