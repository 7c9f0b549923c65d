package org.javai.reasoning.schema;

import java.util.List;

/**
 * Compact description of a table for reports and diagnostics.
 */
public record TableSummary(String table, int columnCount, List<String> columns, List<String> dateColumns,
		String entityReferenceColumn, EntityReferenceStyle entityReferenceStyle) {

	public TableSummary {
		columns = columns != null ? List.copyOf(columns) : List.of();
		dateColumns = dateColumns != null ? List.copyOf(dateColumns) : List.of();
	}
}
