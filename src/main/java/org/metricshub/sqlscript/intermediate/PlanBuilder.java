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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.frontend.CompoundBody;
import org.metricshub.sqlscript.frontend.ForStatement;
import org.metricshub.sqlscript.frontend.HandlerDeclaration;
import org.metricshub.sqlscript.frontend.IfElseStatement;
import org.metricshub.sqlscript.frontend.IterateStatement;
import org.metricshub.sqlscript.frontend.LeaveStatement;
import org.metricshub.sqlscript.frontend.LoopStatement;
import org.metricshub.sqlscript.frontend.Origin;
import org.metricshub.sqlscript.frontend.RepeatStatement;
import org.metricshub.sqlscript.frontend.ScriptNodeVisitor;
import org.metricshub.sqlscript.frontend.SearchedCaseStatement;
import org.metricshub.sqlscript.frontend.SimpleCaseStatement;
import org.metricshub.sqlscript.frontend.SingleStatement;
import org.metricshub.sqlscript.frontend.WhileStatement;
import org.metricshub.sqlscript.util.ScriptLogger;
import org.slf4j.Logger;

/**
 * Compiles a parsed script into a {@link CompiledScript}.
 * <p>
 * Nodes are numbered in depth-first order: a node's slot is reserved before
 * its children are compiled, so the root compound body gets index 0. Labels
 * of <code>LEAVE</code> and <code>ITERATE</code> are resolved here, and
 * handler declarations are validated, so that a script with such errors
 * never starts running.
 * <p>
 * A builder compiles a single script.
 */
public class PlanBuilder implements ScriptNodeVisitor<Integer> {

	private static final Logger LOG = ScriptLogger.getLogger(PlanBuilder.class);

	private final List<StatementNode> nodes = new ArrayList<StatementNode>();
	private final LabelRegistry labels = new LabelRegistry();
	private boolean used;

	/**
	 * Compiles a script.
	 *
	 * @param root the outermost compound body
	 * @return the compiled script
	 * @throws org.metricshub.sqlscript.SqlScriptException on label or
	 *         handler errors
	 */
	public CompiledScript compile(CompoundBody root) {
		if (used) {
			throw new IllegalStateException("A PlanBuilder compiles a single script");
		}
		used = true;
		root.accept(this);
		CompiledScript script = new CompiledScript(nodes);
		LOG.debug("Compiled script into {} nodes", script.size());
		return script;
	}

	private int reserve() {
		nodes.add(null);
		return nodes.size() - 1;
	}

	private int set(StatementNode node) {
		nodes.set(node.getIndex(), node);
		return node.getIndex();
	}

	private int guard(SingleStatement statement) {
		int index = reserve();
		return set(StatementNode.leaf(index, statement, true));
	}

	private int[] compileAll(List<? extends SingleStatement> statements) {
		int[] indexes = new int[statements.size()];
		for (int i = 0; i < indexes.length; i++) {
			indexes[i] = guard(statements.get(i));
		}
		return indexes;
	}

	private int[] compileBodies(List<CompoundBody> bodies) {
		int[] indexes = new int[bodies.size()];
		for (int i = 0; i < indexes.length; i++) {
			indexes[i] = bodies.get(i).accept(this);
		}
		return indexes;
	}

	@Override
	public Integer visitSingleStatement(SingleStatement statement) {
		int index = reserve();
		return set(StatementNode.leaf(index, statement, false));
	}

	@Override
	public Integer visitCompoundBody(CompoundBody body) {
		int index = reserve();
		String label = LabelRegistry.normalize(body.getLabel());
		labels.open(label, index, NodeKind.BLOCK, body.getOrigin());

		HandlerTable handlers = new HandlerTable();
		for (HandlerDeclaration declaration : body.getHandlers()) {
			if (declaration.getType() != HandlerDeclaration.HandlerType.EXIT) {
				throw ScriptErrors.continueHandlerNotSupported(declaration.getOrigin());
			}
			List<String> conditions = new ArrayList<String>();
			for (String condition : declaration.getConditions()) {
				conditions.add(HandlerTable.normalizeCondition(condition, declaration.getOrigin()));
			}
			labels.enterBody();
			int handlerBody = declaration.getBody().accept(this);
			labels.exitBody();
			for (String condition : conditions) {
				handlers.register(new HandlerEntry(condition, declaration.getType(), handlerBody, index, declaration.getOrigin()));
			}
		}
		handlers.seal();

		labels.enterBody();
		int[] children = new int[body.getStatements().size()];
		for (int i = 0; i < children.length; i++) {
			children[i] = body.getStatements().get(i).accept(this);
		}
		labels.exitBody();

		labels.close();
		return set(StatementNode.block(index, label, body.getOrigin(), children, handlers));
	}

	@Override
	public Integer visitIfElse(IfElseStatement statement) {
		int index = reserve();
		int[] guards = compileAll(statement.getConditions());
		int[] bodies = compileBodies(statement.getBodies());
		int elseBody = statement.getElseBody() == null ? -1 : statement.getElseBody().accept(this);
		return set(StatementNode.searched(index, statement.getOrigin(), guards, bodies, elseBody));
	}

	@Override
	public Integer visitSearchedCase(SearchedCaseStatement statement) {
		int index = reserve();
		int[] guards = compileAll(statement.getConditions());
		int[] bodies = compileBodies(statement.getBodies());
		int elseBody = statement.getElseBody() == null ? -1 : statement.getElseBody().accept(this);
		return set(StatementNode.searched(index, statement.getOrigin(), guards, bodies, elseBody));
	}

	@Override
	public Integer visitSimpleCase(SimpleCaseStatement statement) {
		int index = reserve();
		int scrutinee = guard(statement.getCaseExpression());
		int[] values = compileAll(statement.getValues());
		int[] bodies = compileBodies(statement.getBodies());
		int elseBody = statement.getElseBody() == null ? -1 : statement.getElseBody().accept(this);
		return set(StatementNode.simple(index, statement.getOrigin(), scrutinee, values, bodies, elseBody));
	}

	@Override
	public Integer visitWhile(WhileStatement statement) {
		int index = reserve();
		String label = LabelRegistry.normalize(statement.getLabel());
		labels.open(label, index, NodeKind.PRETEST_LOOP, statement.getOrigin());
		int condition = guard(statement.getCondition());
		int body = statement.getBody().accept(this);
		labels.close();
		return set(StatementNode.loop(index, NodeKind.PRETEST_LOOP, label, statement.getOrigin(), condition, body));
	}

	@Override
	public Integer visitRepeat(RepeatStatement statement) {
		int index = reserve();
		String label = LabelRegistry.normalize(statement.getLabel());
		labels.open(label, index, NodeKind.POSTTEST_LOOP, statement.getOrigin());
		int body = statement.getBody().accept(this);
		int condition = guard(statement.getCondition());
		labels.close();
		return set(StatementNode.loop(index, NodeKind.POSTTEST_LOOP, label, statement.getOrigin(), condition, body));
	}

	@Override
	public Integer visitLoop(LoopStatement statement) {
		int index = reserve();
		String label = LabelRegistry.normalize(statement.getLabel());
		labels.open(label, index, NodeKind.UNCONDITIONAL_LOOP, statement.getOrigin());
		int body = statement.getBody().accept(this);
		labels.close();
		return set(StatementNode.loop(index, NodeKind.UNCONDITIONAL_LOOP, label, statement.getOrigin(), -1, body));
	}

	@Override
	public Integer visitFor(ForStatement statement) {
		int index = reserve();
		String label = LabelRegistry.normalize(statement.getLabel());
		labels.open(label, index, NodeKind.CURSOR_LOOP, statement.getOrigin());
		int query = guard(statement.getQuery());
		int body = statement.getBody().accept(this);
		labels.close();
		return set(StatementNode.cursor(index, label, statement.getOrigin(), query, statement.getVariableName(), body));
	}

	@Override
	public Integer visitLeave(LeaveStatement statement) {
		int index = reserve();
		LabelRegistry.Target target = resolve(statement.getLabel(), "LEAVE", statement.getOrigin());
		return set(StatementNode.jump(index, NodeKind.LEAVE, statement.getOrigin(), target.getIndex(), target.getLabel()));
	}

	@Override
	public Integer visitIterate(IterateStatement statement) {
		int index = reserve();
		LabelRegistry.Target target = resolve(statement.getLabel(), "ITERATE", statement.getOrigin());
		if (!target.getKind().isLoop()) {
			throw ScriptErrors.iterateInCompound(upperCase(statement.getLabel()), statement.getOrigin());
		}
		return set(StatementNode.jump(index, NodeKind.ITERATE, statement.getOrigin(), target.getIndex(), target.getLabel()));
	}

	private LabelRegistry.Target resolve(String label, String statementType, Origin origin) {
		LabelRegistry.Target target = labels.resolve(LabelRegistry.normalize(label));
		if (target == null) {
			throw ScriptErrors.labelDoesNotExist(upperCase(label), statementType, origin);
		}
		return target;
	}

	private static String upperCase(String label) {
		return label == null ? "NULL" : label.trim().toUpperCase(Locale.ROOT);
	}
}
