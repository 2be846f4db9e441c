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

/**
 * Walks a parsed script tree, one method per kind of node.
 *
 * @param <R> type of the value produced for each node
 */
public interface ScriptNodeVisitor<R> {

	R visitSingleStatement(SingleStatement statement);

	R visitCompoundBody(CompoundBody body);

	R visitIfElse(IfElseStatement statement);

	R visitSearchedCase(SearchedCaseStatement statement);

	R visitSimpleCase(SimpleCaseStatement statement);

	R visitWhile(WhileStatement statement);

	R visitRepeat(RepeatStatement statement);

	R visitLoop(LoopStatement statement);

	R visitFor(ForStatement statement);

	R visitLeave(LeaveStatement statement);

	R visitIterate(IterateStatement statement);
}
