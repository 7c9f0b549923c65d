package org.javai.reasoning.schema;

import java.util.List;
import java.util.Optional;

/**
 * Immutable description of one relational table.
 *
 * <p>The entity reference column and style are inferred once, structurally, when the catalog
 * is loaded. Empirical confirmation of the style is done on demand through
 * {@link SchemaCatalog#confirmReferenceStyle(String, java.util.Collection)}.</p>
 *
 * @param name table name
 * @param columns columns ordered by ordinal position
 * @param referenceColumn name of the entity reference column, or null when the table is not entity-scoped
 * @param entityReferenceStyle structural guess of the reference style
 */
public record TableSchema(String name, List<ColumnSchema> columns, String referenceColumn,
		EntityReferenceStyle entityReferenceStyle) {

	public TableSchema {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("table name must not be blank");
		}
		columns = columns != null ? List.copyOf(columns) : List.of();
		if (entityReferenceStyle == null) {
			entityReferenceStyle = EntityReferenceStyle.NONE;
		}
		if (referenceColumn == null && entityReferenceStyle != EntityReferenceStyle.NONE) {
			throw new IllegalArgumentException("a reference style requires a reference column");
		}
	}

	public boolean isEntityScoped() {
		return referenceColumn != null;
	}

	public Optional<String> entityReferenceColumn() {
		return Optional.ofNullable(referenceColumn);
	}

	/**
	 * Returns true if the given name matches this table's name. Comparison is case-insensitive.
	 */
	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate.trim());
	}

	public Optional<ColumnSchema> findColumn(String columnName) {
		if (columnName == null || columnName.isBlank()) {
			return Optional.empty();
		}
		return columns.stream()
				.filter(c -> c.matchesName(columnName))
				.findFirst();
	}

	public boolean hasColumn(String columnName) {
		return findColumn(columnName).isPresent();
	}

	public List<String> columnNames() {
		return columns.stream().map(ColumnSchema::name).toList();
	}
}
