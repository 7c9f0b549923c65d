package org.javai.reasoning.investigate;

/**
 * A column the investigator holds responsible for a failure.
 *
 * @param alias alias the query uses for the column's table
 * @param table table the alias resolves to, or null when it could not be resolved
 * @param column column name as written in the query
 * @param function function wrapping the column reference, or null for a bare reference
 * @param expression exact text of the wrapping call (or of the bare reference) in the query
 * @param formatLiteral format string passed to the wrapping function, or null
 */
public record ImplicatedField(String alias, String table, String column, String function, String expression,
		String formatLiteral) {

	public String qualifiedName() {
		return alias != null ? alias + "." + column : column;
	}

	public boolean isTableResolved() {
		return table != null;
	}
}
