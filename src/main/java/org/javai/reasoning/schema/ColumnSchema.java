package org.javai.reasoning.schema;

/**
 * A single column of a {@link TableSchema}.
 *
 * @param name column name as declared in the schema source
 * @param declaredType engine type, e.g. {@code varchar} or {@code bigint}
 * @param ordinalPosition 1-based position within the table
 * @param nullable whether the source declared the column nullable
 */
public record ColumnSchema(String name, String declaredType, int ordinalPosition, boolean nullable) {

	public ColumnSchema {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("column name must not be blank");
		}
		declaredType = declaredType != null ? declaredType.trim() : "";
	}

	/**
	 * Returns true if the given name matches this column's name. Comparison is case-insensitive.
	 */
	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate.trim());
	}
}
