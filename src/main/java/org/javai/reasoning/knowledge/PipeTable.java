package org.javai.reasoning.knowledge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The first pipe table in a block of Markdown lines.
 *
 * <p>The table must have a header row followed by a {@code |---|} separator row. Every body row
 * must have as many cells as the header. Header names are matched case-insensitively.</p>
 */
final class PipeTable {

	private final List<String> headers;
	private final List<Map<String, String>> rows;

	private PipeTable(List<String> headers, List<Map<String, String>> rows) {
		this.headers = headers;
		this.rows = rows;
	}

	static PipeTable parse(List<String> lines) {
		List<String> tableLines = new ArrayList<>();
		for (String line : lines) {
			String trimmed = line.trim();
			if (trimmed.startsWith("|")) {
				tableLines.add(trimmed);
			} else if (!tableLines.isEmpty()) {
				break;
			}
		}
		if (tableLines.size() < 2) {
			throw new IllegalArgumentException("no pipe table found");
		}
		List<String> headers = cells(tableLines.get(0)).stream()
				.map(h -> h.toLowerCase(Locale.ROOT))
				.toList();
		if (!tableLines.get(1).matches("\\|[\\s:|-]+\\|?")) {
			throw new IllegalArgumentException("table header is not followed by a separator row");
		}
		List<Map<String, String>> rows = new ArrayList<>();
		for (int i = 2; i < tableLines.size(); i++) {
			List<String> cells = cells(tableLines.get(i));
			if (cells.size() != headers.size()) {
				throw new IllegalArgumentException("row %d has %d cells, expected %d"
						.formatted(i - 1, cells.size(), headers.size()));
			}
			Map<String, String> row = new LinkedHashMap<>();
			for (int c = 0; c < headers.size(); c++) {
				row.put(headers.get(c), cells.get(c));
			}
			rows.add(row);
		}
		return new PipeTable(headers, rows);
	}

	private static List<String> cells(String line) {
		String body = line.substring(1);
		if (body.endsWith("|")) {
			body = body.substring(0, body.length() - 1);
		}
		return Arrays.stream(body.split("\\|", -1)).map(String::trim).toList();
	}

	void requireColumns(String... names) {
		for (String name : names) {
			if (!headers.contains(name.toLowerCase(Locale.ROOT))) {
				throw new IllegalArgumentException("missing column '" + name + "'");
			}
		}
	}

	List<Map<String, String>> rows() {
		return rows;
	}

	/**
	 * Cell value, or null when the column is absent or the cell is blank.
	 */
	static String cell(Map<String, String> row, String column) {
		String value = row.get(column.toLowerCase(Locale.ROOT));
		return value == null || value.isBlank() ? null : value;
	}

	/**
	 * A {@code ;}-separated list cell.
	 */
	static List<String> listCell(Map<String, String> row, String column) {
		String value = cell(row, column);
		if (value == null) {
			return List.of();
		}
		return Arrays.stream(value.split(";")).map(String::trim).filter(s -> !s.isEmpty()).toList();
	}
}
