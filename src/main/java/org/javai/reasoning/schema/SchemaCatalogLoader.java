package org.javai.reasoning.schema;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SchemaCatalog} from a CSV schema description.
 *
 * <p>The source must have a header row with {@code table_name}, {@code column_name} and
 * {@code data_type}; {@code ordinal_position} and {@code is_nullable} are optional. Loading is
 * all-or-nothing: any malformed row fails the whole load with a {@link SchemaLoadException}.</p>
 */
public class SchemaCatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(SchemaCatalogLoader.class);

	static final String TABLE_NAME = "table_name";
	static final String COLUMN_NAME = "column_name";
	static final String DATA_TYPE = "data_type";
	static final String ORDINAL_POSITION = "ordinal_position";
	static final String IS_NULLABLE = "is_nullable";

	private static final Set<String> REQUIRED_HEADERS = Set.of(TABLE_NAME, COLUMN_NAME, DATA_TYPE);

	private final EntityReferencePatterns patterns;
	private final String database;

	public SchemaCatalogLoader() {
		this(EntityReferencePatterns.defaults(), null);
	}

	/**
	 * @param patterns entity reference conventions applied to every loaded table
	 * @param database optional schema qualifier for generated SQL (may be null)
	 */
	public SchemaCatalogLoader(EntityReferencePatterns patterns, String database) {
		this.patterns = patterns != null ? patterns : EntityReferencePatterns.defaults();
		this.database = database;
	}

	public SchemaCatalog load(Path path) {
		if (path == null || !Files.isReadable(path)) {
			throw new SchemaLoadException("Schema source is not readable: " + path);
		}
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader, path.toString());
		} catch (IOException e) {
			throw new SchemaLoadException("Failed to read schema source: " + path, e);
		}
	}

	/**
	 * @param reader CSV content; not closed by this method
	 * @param sourceName name used in log and error messages
	 */
	public SchemaCatalog load(Reader reader, String sourceName) {
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.setTrim(true)
				.setIgnoreEmptyLines(true)
				.build();

		Map<String, TableRows> rowsByTable = new LinkedHashMap<>();
		try {
			CSVParser parser = format.parse(reader);
			Map<String, String> headers = normalizedHeaders(parser.getHeaderNames());
			for (String required : REQUIRED_HEADERS) {
				if (!headers.containsKey(required)) {
					throw new SchemaLoadException(
							"Schema source %s is missing required column '%s'".formatted(sourceName, required));
				}
			}
			for (CSVRecord record : parser) {
				addRow(rowsByTable, record, headers, sourceName);
			}
		} catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
			throw new SchemaLoadException("Failed to parse schema source " + sourceName + ": " + e.getMessage(), e);
		}

		if (rowsByTable.isEmpty()) {
			throw new SchemaLoadException("Schema source " + sourceName + " contains no columns");
		}

		List<TableSchema> tables = new ArrayList<>();
		for (TableRows rows : rowsByTable.values()) {
			tables.add(rows.build(patterns));
		}
		SchemaCatalog catalog = new SchemaCatalog(tables, patterns, database);
		logger.info("Loaded schema from {} with {} tables ({} entity-scoped)",
				sourceName, catalog.size(), catalog.findEntityScopedTables().size());
		return catalog;
	}

	private static Map<String, String> normalizedHeaders(List<String> headerNames) {
		Map<String, String> headers = new LinkedHashMap<>();
		for (String header : headerNames) {
			if (header != null) {
				headers.put(header.trim().toLowerCase(Locale.ROOT), header);
			}
		}
		return headers;
	}

	private static void addRow(Map<String, TableRows> rowsByTable, CSVRecord record, Map<String, String> headers,
			String sourceName) {
		String tableName = value(record, headers, TABLE_NAME);
		String columnName = value(record, headers, COLUMN_NAME);
		if (tableName.isEmpty() || columnName.isEmpty()) {
			throw new SchemaLoadException("Blank table or column name at line %d of %s"
					.formatted(record.getRecordNumber() + 1, sourceName));
		}
		TableRows rows = rowsByTable.computeIfAbsent(tableName.toLowerCase(Locale.ROOT), k -> new TableRows(tableName));

		int ordinal = rows.columns.size() + 1;
		String position = value(record, headers, ORDINAL_POSITION);
		if (!position.isEmpty()) {
			try {
				ordinal = Integer.parseInt(position);
			} catch (NumberFormatException e) {
				throw new SchemaLoadException("Invalid ordinal_position '%s' at line %d of %s"
						.formatted(position, record.getRecordNumber() + 1, sourceName), e);
			}
		}
		String nullable = value(record, headers, IS_NULLABLE);
		ColumnSchema column = new ColumnSchema(columnName, value(record, headers, DATA_TYPE), ordinal,
				nullable.isEmpty() || nullable.equalsIgnoreCase("YES"));

		if (rows.columns.stream().anyMatch(c -> c.matchesName(columnName))) {
			throw new SchemaLoadException("Duplicate column %s.%s in %s".formatted(tableName, columnName, sourceName));
		}
		rows.columns.add(column);
	}

	private static String value(CSVRecord record, Map<String, String> headers, String name) {
		String header = headers.get(name);
		if (header == null || !record.isSet(header)) {
			return "";
		}
		String value = record.get(header);
		return value != null ? value.trim() : "";
	}

	private static final class TableRows {
		private final String name;
		private final List<ColumnSchema> columns = new ArrayList<>();

		TableRows(String name) {
			this.name = name;
		}

		TableSchema build(EntityReferencePatterns patterns) {
			List<ColumnSchema> ordered = columns.stream()
					.sorted(Comparator.comparingInt(ColumnSchema::ordinalPosition))
					.toList();
			return patterns.selectReferenceColumn(ordered)
					.map(c -> new TableSchema(name, ordered, c.name(), patterns.styleFor(c.name())))
					.orElseGet(() -> new TableSchema(name, ordered, null, EntityReferenceStyle.NONE));
		}
	}
}
