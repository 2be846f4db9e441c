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
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods to assemble script trees in Java code, for parsers and for
 * embedding applications that generate scripts programmatically.
 * <p>
 * Example:
 *
 * <pre>
 * CompoundBody script = begin(
 * 		sql("DECLARE i = 0"),
 * 		whileLoop("i &lt; 3",
 * 				sql("SELECT i"),
 * 				sql("SET i = i + 1")));
 * </pre>
 *
 * Bodies given as varargs are wrapped into unlabeled {@link CompoundBody}
 * instances, just like a parser wraps the statement list of a loop.
 */
public final class ScriptTrees {

	private ScriptTrees() {}

	public static SingleStatement sql(String text) {
		return new SingleStatement(text, Origin.UNKNOWN);
	}

	public static SingleStatement sql(String text, int line) {
		return new SingleStatement(text, Origin.atLine(line));
	}

	public static CompoundBody begin(ScriptNode... statements) {
		return new CompoundBody(null, null, Arrays.asList(statements), Origin.UNKNOWN);
	}

	public static CompoundBody begin(String label, ScriptNode... statements) {
		return new CompoundBody(label, null, Arrays.asList(statements), Origin.UNKNOWN);
	}

	/**
	 * @return a builder for blocks that declare condition handlers
	 */
	public static BlockBuilder block() {
		return new BlockBuilder();
	}

	public static HandlerDeclaration exitHandler(CompoundBody body, String... conditions) {
		return new HandlerDeclaration(HandlerDeclaration.HandlerType.EXIT, Arrays.asList(conditions), body, Origin.UNKNOWN);
	}

	public static HandlerDeclaration continueHandler(CompoundBody body, String... conditions) {
		return new HandlerDeclaration(HandlerDeclaration.HandlerType.CONTINUE, Arrays.asList(conditions), body, Origin.UNKNOWN);
	}

	public static ConditionalBuilder ifThen(String condition, ScriptNode... body) {
		return ifThen(sql(condition), body);
	}

	public static ConditionalBuilder ifThen(SingleStatement condition, ScriptNode... body) {
		return new ConditionalBuilder(true).when(condition, body);
	}

	public static ConditionalBuilder searchedCase() {
		return new ConditionalBuilder(false);
	}

	public static SimpleCaseBuilder simpleCase(String caseExpression) {
		return new SimpleCaseBuilder(sql(caseExpression));
	}

	public static WhileStatement whileLoop(String condition, ScriptNode... body) {
		return whileLoop(null, condition, body);
	}

	public static WhileStatement whileLoop(String label, String condition, ScriptNode... body) {
		return new WhileStatement(label, sql(condition), body(body), Origin.UNKNOWN);
	}

	public static RepeatStatement repeat(String untilCondition, ScriptNode... body) {
		return repeat(null, untilCondition, body);
	}

	public static RepeatStatement repeat(String label, String untilCondition, ScriptNode... body) {
		return new RepeatStatement(label, body(body), sql(untilCondition), Origin.UNKNOWN);
	}

	public static LoopStatement loop(ScriptNode... body) {
		return new LoopStatement(null, body(body), Origin.UNKNOWN);
	}

	public static LoopStatement loop(String label, ScriptNode... body) {
		return new LoopStatement(label, body(body), Origin.UNKNOWN);
	}

	/**
	 * FOR loop without label.
	 *
	 * @param variableName name of the row variable, may be {@code null}
	 * @param query query producing the rows
	 * @param body statements executed for each row
	 * @return the FOR statement
	 */
	public static ForStatement forLoop(String variableName, String query, ScriptNode... body) {
		return forLoop(null, variableName, query, body);
	}

	public static ForStatement forLoop(String label, String variableName, String query, ScriptNode... body) {
		return new ForStatement(label, variableName, sql(query), body(body), Origin.UNKNOWN);
	}

	public static LeaveStatement leave(String label) {
		return new LeaveStatement(label, Origin.UNKNOWN);
	}

	public static IterateStatement iterate(String label) {
		return new IterateStatement(label, Origin.UNKNOWN);
	}

	static CompoundBody body(ScriptNode... statements) {
		return new CompoundBody(null, null, Arrays.asList(statements), Origin.UNKNOWN);
	}

	/**
	 * Builds a {@link CompoundBody} with a label and handlers.
	 */
	public static final class BlockBuilder {

		private String label;
		private Origin origin = Origin.UNKNOWN;
		private final List<HandlerDeclaration> handlers = new ArrayList<HandlerDeclaration>();
		private final List<ScriptNode> statements = new ArrayList<ScriptNode>();

		private BlockBuilder() {}

		public BlockBuilder label(String pLabel) {
			this.label = pLabel;
			return this;
		}

		public BlockBuilder origin(Origin pOrigin) {
			this.origin = pOrigin;
			return this;
		}

		public BlockBuilder handler(HandlerDeclaration handler) {
			handlers.add(handler);
			return this;
		}

		public BlockBuilder statements(ScriptNode... nodes) {
			statements.addAll(Arrays.asList(nodes));
			return this;
		}

		public CompoundBody build() {
			return new CompoundBody(label, handlers, statements, origin);
		}
	}

	/**
	 * Builds an IF statement or a searched CASE.
	 */
	public static final class ConditionalBuilder {

		private final boolean ifElse;
		private final List<SingleStatement> conditions = new ArrayList<SingleStatement>();
		private final List<CompoundBody> bodies = new ArrayList<CompoundBody>();
		private CompoundBody elseBody;

		private ConditionalBuilder(boolean ifElse) {
			this.ifElse = ifElse;
		}

		public ConditionalBuilder when(String condition, ScriptNode... body) {
			return when(sql(condition), body);
		}

		public ConditionalBuilder when(SingleStatement condition, ScriptNode... body) {
			conditions.add(condition);
			bodies.add(body(body));
			return this;
		}

		/**
		 * Same as {@link #when(String, ScriptNode...)}, reads better for IF.
		 *
		 * @param condition ELSEIF condition
		 * @param body ELSEIF body
		 * @return this builder
		 */
		public ConditionalBuilder elseIf(String condition, ScriptNode... body) {
			return when(condition, body);
		}

		public ConditionalBuilder orElse(ScriptNode... body) {
			elseBody = body(body);
			return this;
		}

		public ConditionalStatement build() {
			if (ifElse) {
				return new IfElseStatement(conditions, bodies, elseBody, Origin.UNKNOWN);
			}
			return new SearchedCaseStatement(conditions, bodies, elseBody, Origin.UNKNOWN);
		}
	}

	/**
	 * Builds a simple CASE.
	 */
	public static final class SimpleCaseBuilder {

		private final SingleStatement caseExpression;
		private final List<SingleStatement> values = new ArrayList<SingleStatement>();
		private final List<CompoundBody> bodies = new ArrayList<CompoundBody>();
		private CompoundBody elseBody;

		private SimpleCaseBuilder(SingleStatement caseExpression) {
			this.caseExpression = caseExpression;
		}

		public SimpleCaseBuilder when(String value, ScriptNode... body) {
			values.add(sql(value));
			bodies.add(body(body));
			return this;
		}

		public SimpleCaseBuilder orElse(ScriptNode... body) {
			elseBody = body(body);
			return this;
		}

		public SimpleCaseStatement build() {
			return new SimpleCaseStatement(caseExpression, values, bodies, elseBody, Origin.UNKNOWN);
		}
	}
}
