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
import java.util.Locale;
import java.util.Objects;
import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.frontend.Origin;

/**
 * SQL value semantics needed by the script engine: three-valued equality and
 * the implicit casts it relies on.
 */
public final class SqlValues {

	private SqlValues() {}

	/**
	 * Compares two values with SQL <code>=</code>.
	 * <p>
	 * A string compared with a number is cast to <code>BIGINT</code> when the
	 * number is integral, to <code>DECIMAL</code> otherwise. A string compared
	 * with a boolean is cast to <code>BOOLEAN</code>.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @param ansi whether a failed cast raises an error (otherwise it yields
	 *        <code>NULL</code>)
	 * @param origin position reported in cast errors
	 * @return {@code TRUE}, {@code FALSE}, or {@code null} when the result is
	 *         unknown
	 */
	public static Boolean sqlEquals(Object left, Object right, boolean ansi, Origin origin) {
		if (left == null || right == null) {
			return null;
		}
		if (left instanceof Number && right instanceof Number) {
			return Boolean.valueOf(toBigDecimal(left).compareTo(toBigDecimal(right)) == 0);
		}
		if (left instanceof Number && isString(right)) {
			return compareNumberToString((Number) left, right.toString(), ansi, origin);
		}
		if (isString(left) && right instanceof Number) {
			return compareNumberToString((Number) right, left.toString(), ansi, origin);
		}
		if (left instanceof Boolean && isString(right)) {
			Boolean cast = castToBoolean(right.toString(), ansi, origin);
			return cast == null ? null : Boolean.valueOf(left.equals(cast));
		}
		if (isString(left) && right instanceof Boolean) {
			Boolean cast = castToBoolean(left.toString(), ansi, origin);
			return cast == null ? null : Boolean.valueOf(right.equals(cast));
		}
		if (left instanceof Boolean && right instanceof Number) {
			return Boolean.valueOf(left.equals(Boolean.valueOf(toBigDecimal(right).signum() != 0)));
		}
		if (left instanceof Number && right instanceof Boolean) {
			return Boolean.valueOf(right.equals(Boolean.valueOf(toBigDecimal(left).signum() != 0)));
		}
		if (isString(left) && isString(right)) {
			return Boolean.valueOf(left.toString().equals(right.toString()));
		}
		return Boolean.valueOf(Objects.equals(left, right));
	}

	/**
	 * Casts a string to <code>BOOLEAN</code>. Accepted literals are
	 * <code>true</code>, <code>false</code>, <code>t</code>, <code>f</code>,
	 * <code>yes</code>, <code>no</code>, <code>y</code>, <code>n</code>,
	 * <code>1</code> and <code>0</code>, in any case and surrounded by blanks.
	 *
	 * @param text the string
	 * @param ansi whether a malformed string raises an error
	 * @param origin position reported in cast errors
	 * @return the boolean, or {@code null} when malformed and not strict
	 */
	public static Boolean castToBoolean(String text, boolean ansi, Origin origin) {
		Boolean value = parseBoolean(text);
		if (value == null && ansi) {
			throw ScriptErrors.castInvalidInput(quote(text), "STRING", "BOOLEAN", origin);
		}
		return value;
	}

	/**
	 * @param text the string
	 * @return the boolean it spells, or {@code null} when it is not a boolean literal
	 */
	public static Boolean parseBoolean(String text) {
		switch (text.trim().toLowerCase(Locale.ROOT)) {
		case "true":
		case "t":
		case "yes":
		case "y":
		case "1":
			return Boolean.TRUE;
		case "false":
		case "f":
		case "no":
		case "n":
		case "0":
			return Boolean.FALSE;
		default:
			return null;
		}
	}

	/**
	 * Converts a number to {@link BigDecimal} without losing precision.
	 *
	 * @param number the number
	 * @return its exact decimal value
	 */
	public static BigDecimal toBigDecimal(Object number) {
		if (number instanceof BigDecimal) {
			return (BigDecimal) number;
		}
		if (number instanceof BigInteger) {
			return new BigDecimal((BigInteger) number);
		}
		if (number instanceof Double || number instanceof Float) {
			return BigDecimal.valueOf(((Number) number).doubleValue());
		}
		if (number instanceof Number) {
			return BigDecimal.valueOf(((Number) number).longValue());
		}
		return new BigDecimal(number.toString().trim());
	}

	private static Boolean compareNumberToString(Number number, String text, boolean ansi, Origin origin) {
		BigDecimal numeric = toBigDecimal(number);
		boolean integral = isIntegral(number);
		BigDecimal cast;
		try {
			cast = new BigDecimal(text.trim());
			if (integral) {
				// a BIGINT cast rejects fractions and values out of range
				cast = new BigDecimal(cast.toBigIntegerExact().longValueExact());
			}
		} catch (NumberFormatException | ArithmeticException e) {
			if (ansi) {
				throw ScriptErrors.castInvalidInput(quote(text), "STRING", integral ? "BIGINT" : "DECIMAL", origin);
			}
			return null;
		}
		return Boolean.valueOf(numeric.compareTo(cast) == 0);
	}

	private static boolean isIntegral(Number number) {
		return number instanceof Integer
				|| number instanceof Long
				|| number instanceof Short
				|| number instanceof Byte
				|| number instanceof BigInteger;
	}

	private static boolean isString(Object value) {
		return value instanceof CharSequence || value instanceof Character;
	}

	private static String quote(String text) {
		return "'" + text.replace("'", "''") + "'";
	}
}
