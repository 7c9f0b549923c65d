package org.javai.reasoning.schema;

import java.util.List;
import java.util.Map;

/**
 * Outcome of checking a set of column names against one table.
 *
 * @param table the table that was checked
 * @param unknownColumns requested columns the table does not have, in request order
 * @param suggestions nearest existing column for each unknown column that has one
 */
public record ColumnValidation(String table, List<String> unknownColumns, Map<String, String> suggestions) {

	public ColumnValidation {
		unknownColumns = unknownColumns != null ? List.copyOf(unknownColumns) : List.of();
		suggestions = suggestions != null ? Map.copyOf(suggestions) : Map.of();
	}

	public boolean isValid() {
		return unknownColumns.isEmpty();
	}
}
