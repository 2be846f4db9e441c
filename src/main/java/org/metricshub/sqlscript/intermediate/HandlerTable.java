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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.sqlscript.ScriptErrors;
import org.metricshub.sqlscript.SqlScriptException;
import org.metricshub.sqlscript.frontend.Origin;

/**
 * The condition handlers declared by one compound body, keyed by their
 * normalized condition.
 * <p>
 * A table is filled while the body is compiled, then sealed.
 */
public final class HandlerTable {

	/** Table of a body declaring no handler. */
	public static final HandlerTable EMPTY = new HandlerTable().seal();

	public static final String SQLEXCEPTION = "SQLEXCEPTION";
	public static final String NOT_FOUND = "NOT FOUND";

	private static final Pattern SQLSTATE_CONDITION = Pattern.compile("SQLSTATE(?: VALUE)? ?'([^']*)'");
	private static final Pattern SQLSTATE_VALUE = Pattern.compile("[A-Z0-9]{5}");

	private final Map<String, HandlerEntry> entries = new LinkedHashMap<String, HandlerEntry>();
	private boolean sealed;

	/**
	 * Adds a handler condition.
	 *
	 * @param entry the condition and its handler body
	 * @throws SqlScriptException <code>DUPLICATE_EXCEPTION_HANDLER.CONDITION</code>
	 *         when the condition is already handled by this body
	 */
	public void register(HandlerEntry entry) {
		if (sealed) {
			throw new IllegalStateException("Handler table is sealed");
		}
		if (entries.containsKey(entry.getCondition())) {
			throw ScriptErrors.duplicateHandler(entry.getCondition(), entry.getOrigin());
		}
		entries.put(entry.getCondition(), entry);
	}

	public HandlerTable seal() {
		sealed = true;
		return this;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Collection<HandlerEntry> getEntries() {
		return Collections.unmodifiableCollection(entries.values());
	}

	/**
	 * Finds the handler for an error. The most specific declaration wins:
	 * <ol>
	 * <li>the exact error condition
	 * <li>its main condition (before the first dot)
	 * <li>its SQLSTATE
	 * <li><code>NOT FOUND</code>, for SQLSTATE class 02
	 * <li><code>SQLEXCEPTION</code>, for anything but classes 00, 01 and 02
	 * </ol>
	 *
	 * @param error the error to handle
	 * @return the matching handler, or {@code null}
	 */
	public HandlerEntry find(SqlScriptException error) {
		if (entries.isEmpty()) {
			return null;
		}
		String condition = error.getCondition().toUpperCase(Locale.ROOT);
		HandlerEntry entry = entries.get(condition);
		if (entry != null) {
			return entry;
		}
		int dot = condition.indexOf('.');
		if (dot > 0) {
			entry = entries.get(condition.substring(0, dot));
			if (entry != null) {
				return entry;
			}
		}
		String sqlState = error.getSqlState();
		if (sqlState != null) {
			entry = entries.get(sqlStateCondition(sqlState.toUpperCase(Locale.ROOT)));
			if (entry != null) {
				return entry;
			}
			if (sqlState.startsWith("02")) {
				return entries.get(NOT_FOUND);
			}
			if (sqlState.startsWith("00") || sqlState.startsWith("01")) {
				return null;
			}
		}
		return entries.get(SQLEXCEPTION);
	}

	/**
	 * Normalizes a declared condition: blanks are trimmed and collapsed, the
	 * text is upper-cased and <code>SQLSTATE VALUE 'xxxxx'</code> is rewritten
	 * <code>SQLSTATE 'xxxxx'</code>.
	 *
	 * @param raw condition as written
	 * @param origin position of the declaration
	 * @return the normalized condition
	 * @throws SqlScriptException <code>INVALID_SQLSTATE</code> for a malformed
	 *         SQLSTATE value
	 */
	public static String normalizeCondition(String raw, Origin origin) {
		String condition = raw.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
		if (!condition.startsWith("SQLSTATE")) {
			return condition;
		}
		Matcher matcher = SQLSTATE_CONDITION.matcher(condition);
		if (!matcher.matches()) {
			throw ScriptErrors.invalidSqlState(condition.substring("SQLSTATE".length()).trim(), origin);
		}
		String sqlState = matcher.group(1);
		if (!SQLSTATE_VALUE.matcher(sqlState).matches() || sqlState.startsWith("00")) {
			throw ScriptErrors.invalidSqlState(sqlState, origin);
		}
		return sqlStateCondition(sqlState);
	}

	private static String sqlStateCondition(String sqlState) {
		return "SQLSTATE '" + sqlState + "'";
	}

	@Override
	public String toString() {
		return entries.values().toString();
	}
}
