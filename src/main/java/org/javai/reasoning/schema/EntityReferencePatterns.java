package org.javai.reasoning.schema;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Column naming conventions that mark a column as referencing the scoped entity.
 *
 * <p>A column matches when its name is one of {@code exactColumns}, or when it contains one of
 * {@code stems} and ends with one of {@code suffixes}. Matching is case-insensitive.</p>
 *
 * @param prefix prefix used by prefixed references, e.g. {@code Patient/}
 * @param exactColumns names that always count as entity references, in preference order
 * @param suffixes accepted suffixes for stem-matched columns
 * @param stems words a stem-matched column must contain
 */
public record EntityReferencePatterns(String prefix, List<String> exactColumns, List<String> suffixes,
		List<String> stems) {

	private static final String REFERENCE_MARKER = "reference";

	public EntityReferencePatterns {
		prefix = prefix != null ? prefix : "";
		exactColumns = lower(exactColumns);
		suffixes = lower(suffixes);
		stems = lower(stems);
	}

	public static EntityReferencePatterns defaults() {
		return new EntityReferencePatterns(
				"Patient/",
				List.of("subject_reference", "patient_reference", "patient_id", "patient_fhir_id"),
				List.of("_reference", "_id"),
				List.of("patient", "subject"));
	}

	public boolean matches(String columnName) {
		if (columnName == null || columnName.isBlank()) {
			return false;
		}
		String lower = columnName.trim().toLowerCase(Locale.ROOT);
		if (exactColumns.contains(lower)) {
			return true;
		}
		return stems.stream().anyMatch(lower::contains) && suffixes.stream().anyMatch(lower::endsWith);
	}

	/**
	 * Picks the entity reference column among the given columns: exact names first, in preference
	 * order, then the first stem-matched column in column order.
	 */
	public Optional<ColumnSchema> selectReferenceColumn(List<ColumnSchema> columns) {
		for (String exact : exactColumns) {
			for (ColumnSchema column : columns) {
				if (column.matchesName(exact)) {
					return Optional.of(column);
				}
			}
		}
		return columns.stream().filter(c -> matches(c.name())).findFirst();
	}

	/**
	 * Structural guess of the reference style from the column name alone.
	 */
	public EntityReferenceStyle styleFor(String columnName) {
		if (columnName == null) {
			return EntityReferenceStyle.NONE;
		}
		return columnName.toLowerCase(Locale.ROOT).contains(REFERENCE_MARKER)
				? EntityReferenceStyle.PREFIXED_REFERENCE
				: EntityReferenceStyle.BARE_ID;
	}

	private static List<String> lower(List<String> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream()
				.filter(v -> v != null && !v.isBlank())
				.map(v -> v.trim().toLowerCase(Locale.ROOT))
				.toList();
	}
}
