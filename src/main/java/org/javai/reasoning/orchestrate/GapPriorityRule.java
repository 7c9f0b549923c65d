package org.javai.reasoning.orchestrate;

import java.util.Locale;

/**
 * Assigns a priority and the field that matters most to tables matching {@code tablePattern}.
 *
 * @param tablePattern exact table name, or a prefix followed by {@code *}
 * @param field field whose absence the gap stands for
 * @param priority ranking of gaps in matching tables
 */
public record GapPriorityRule(String tablePattern, String field, GapPriority priority) {

	public GapPriorityRule {
		if (tablePattern == null || tablePattern.isBlank()) {
			throw new IllegalArgumentException("tablePattern must not be blank");
		}
		if (priority == null) {
			throw new IllegalArgumentException("priority must not be null");
		}
		field = field == null || field.isBlank() ? "*" : field;
	}

	public boolean matches(String table) {
		if (table == null) {
			return false;
		}
		String pattern = tablePattern.toLowerCase(Locale.ROOT);
		String name = table.toLowerCase(Locale.ROOT);
		if (pattern.endsWith("*")) {
			return name.startsWith(pattern.substring(0, pattern.length() - 1));
		}
		return name.equals(pattern);
	}
}
