package org.metricshub.sqlscript.jrt;

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
import java.util.Collections;
import java.util.List;

/**
 * The tabular result of a statement run by the {@link QueryEvaluator}.
 */
public final class QueryResult {

	/** Statements that return no rows, such as <code>SET</code>. */
	public static final QueryResult EMPTY = new QueryResult(
			Collections.<Column>emptyList(),
			Collections.<List<Object>>emptyList());

	/**
	 * Name and type of a result column.
	 */
	public static final class Column {
		private final String name;
		private final SqlType type;

		public Column(String name, SqlType type) {
			this.name = name;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		public SqlType getType() {
			return type;
		}

		@Override
		public String toString() {
			return name + " " + type;
		}
	}

	private final List<Column> columns;
	private final List<List<Object>> rows;

	public QueryResult(List<Column> columns, List<List<Object>> rows) {
		this.columns = Collections.unmodifiableList(new ArrayList<Column>(columns));
		List<List<Object>> copy = new ArrayList<List<Object>>(rows.size());
		for (List<Object> row : rows) {
			if (row.size() != columns.size()) {
				throw new IllegalArgumentException("Row " + row + " does not match columns " + columns);
			}
			copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
		}
		this.rows = Collections.unmodifiableList(copy);
	}

	/**
	 * Creates a one-column, one-row result.
	 *
	 * @param name column name
	 * @param value the value, its type inferred
	 * @return the result
	 */
	public static QueryResult scalar(String name, Object value) {
		return scalar(name, SqlType.of(value), value);
	}

	/**
	 * Creates a one-column, one-row result.
	 *
	 * @param name column name
	 * @param type column type
	 * @param value the value
	 * @return the result
	 */
	public static QueryResult scalar(String name, SqlType type, Object value) {
		return new QueryResult(
				Collections.singletonList(new Column(name, type)),
				Collections.singletonList(Collections.singletonList(value)));
	}

	/**
	 * Creates a result with the given columns and no rows yet.
	 *
	 * @param columns the columns
	 * @return a builder
	 */
	public static Builder withColumns(Column... columns) {
		return new Builder(Arrays.asList(columns));
	}

	public List<Column> getColumns() {
		return columns;
	}

	public List<List<Object>> getRows() {
		return rows;
	}

	public int getColumnCount() {
		return columns.size();
	}

	public int getRowCount() {
		return rows.size();
	}

	@Override
	public String toString() {
		return columns + " " + rows;
	}

	/**
	 * Collects rows for a {@link QueryResult}.
	 */
	public static final class Builder {
		private final List<Column> columns;
		private final List<List<Object>> rows = new ArrayList<List<Object>>();

		private Builder(List<Column> columns) {
			this.columns = columns;
		}

		public Builder row(Object... values) {
			rows.add(Arrays.asList(values));
			return this;
		}

		public QueryResult build() {
			return new QueryResult(columns, rows);
		}
	}
}
