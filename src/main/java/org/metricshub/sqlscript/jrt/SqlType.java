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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * SQL types of the values that flow between the script engine and the query
 * evaluator.
 */
public enum SqlType {
	NULL,
	BOOLEAN,
	INT,
	BIGINT,
	DOUBLE,
	DECIMAL,
	STRING,
	ARRAY,
	MAP,
	/** Row value: an ordered map of field name to value. */
	STRUCT;

	/**
	 * Infers the SQL type of a Java value.
	 *
	 * @param value the value, may be {@code null}
	 * @return the matching SQL type
	 */
	public static SqlType of(Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof Boolean) {
			return BOOLEAN;
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return INT;
		} else if (value instanceof Long || value instanceof BigInteger) {
			return BIGINT;
		} else if (value instanceof Double || value instanceof Float) {
			return DOUBLE;
		} else if (value instanceof BigDecimal) {
			return DECIMAL;
		} else if (value instanceof CharSequence || value instanceof Character) {
			return STRING;
		} else if (value instanceof List || value.getClass().isArray()) {
			return ARRAY;
		} else if (value instanceof Map) {
			return STRUCT;
		}
		throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
	}

	public boolean isNumeric() {
		return this == INT || this == BIGINT || this == DOUBLE || this == DECIMAL;
	}
}
