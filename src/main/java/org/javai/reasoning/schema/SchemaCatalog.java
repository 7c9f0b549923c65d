package org.javai.reasoning.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of the target database's tables, built once per process from a schema
 * description source (see {@link SchemaCatalogLoader}).
 *
 * <p>Lookups are case-insensitive and accept schema-qualified names ({@code db.table}); an unknown
 * table always yields {@link Optional#empty()}, which callers must treat as "not applicable"
 * rather than as a failure. The catalog holds no mutable state and can be shared freely between
 * concurrent investigations and orchestrator runs.</p>
 *
 * <pre>{@code
 * SchemaCatalog catalog = new SchemaCatalogLoader(EntityReferencePatterns.defaults(), "fhir_prd_db")
 *     .load(Path.of("schema.csv"));
 * catalog.generateCountQuery("encounter", "abc123");
 * // SELECT COUNT(*) AS count FROM fhir_prd_db.encounter WHERE subject_reference = 'Patient/abc123'
 * }</pre>
 */
public final class SchemaCatalog {

	/** Default number of distinct values requested by a sample query. */
	public static final int DEFAULT_SAMPLE_LIMIT = 20;
	static final int MAX_SAMPLE_LIMIT = 1000;

	private static final List<String> DATE_WORDS = List.of("date", "time", "period");
	private static final List<String> DATE_SUFFIXES = List.of("_at", "_on");
	private static final List<String> IDENTIFIER_SUFFIXES = List.of("_id", "_reference");

	private final Map<String, TableSchema> tables;
	private final List<TableSchema> entityScopedTables;
	private final EntityReferencePatterns patterns;
	private final String database;

	/**
	 * @param tables tables in source order; names must be unique ignoring case
	 * @param patterns entity reference conventions used by count queries
	 * @param database optional schema qualifier for generated SQL (may be null)
	 */
	public SchemaCatalog(Collection<TableSchema> tables, EntityReferencePatterns patterns, String database) {
		Map<String, TableSchema> byName = new LinkedHashMap<>();
		for (TableSchema table : tables) {
			TableSchema previous = byName.putIfAbsent(key(table.name()), table);
			if (previous != null) {
				throw new IllegalArgumentException("Duplicate table '%s'".formatted(table.name()));
			}
		}
		this.tables = Collections.unmodifiableMap(byName);
		this.entityScopedTables = byName.values().stream().filter(TableSchema::isEntityScoped).toList();
		this.patterns = patterns != null ? patterns : EntityReferencePatterns.defaults();
		this.database = database != null && !database.isBlank() ? database.trim() : null;
	}

	/**
	 * @return all tables in source order
	 */
	public Collection<TableSchema> tables() {
		return tables.values();
	}

	public List<String> tableNames() {
		return tables.values().stream().map(TableSchema::name).toList();
	}

	public int size() {
		return tables.size();
	}

	public EntityReferencePatterns referencePatterns() {
		return patterns;
	}

	public Optional<String> database() {
		return Optional.ofNullable(database);
	}

	public Optional<TableSchema> table(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(tables.get(key(unqualified(tableName))));
	}

	public Optional<String> columnType(String tableName, String columnName) {
		return table(tableName)
				.flatMap(t -> t.findColumn(columnName))
				.map(ColumnSchema::declaredType);
	}

	/**
	 * Tables containing at least one entity reference column. The list is computed once at
	 * construction; repeated calls return the same result.
	 */
	public List<TableSchema> findEntityScopedTables() {
		return entityScopedTables;
	}

	/**
	 * Tables with a column whose name contains {@code fragment}, ignoring case.
	 */
	public List<String> findTablesWithColumn(String fragment) {
		if (fragment == null || fragment.isBlank()) {
			return List.of();
		}
		String needle = fragment.trim().toLowerCase(Locale.ROOT);
		return tables.values().stream()
				.filter(t -> t.columns().stream()
						.anyMatch(c -> c.name().toLowerCase(Locale.ROOT).contains(needle)))
				.map(TableSchema::name)
				.toList();
	}

	/**
	 * Count query for one entity using the table's structural reference style.
	 *
	 * @return the query, or empty if the table is unknown or not entity-scoped
	 */
	public Optional<String> generateCountQuery(String tableName, String entityId) {
		return table(tableName).flatMap(t -> generateCountQuery(t, entityId, t.entityReferenceStyle()));
	}

	/**
	 * Count query for one entity using an empirically confirmed reference style.
	 */
	public Optional<String> generateCountQuery(String tableName, String entityId, EntityReferenceStyle style) {
		return table(tableName).flatMap(t -> generateCountQuery(t, entityId, style));
	}

	private Optional<String> generateCountQuery(TableSchema table, String entityId, EntityReferenceStyle style) {
		if (entityId == null || entityId.isBlank()) {
			throw new IllegalArgumentException("entityId must not be blank");
		}
		if (!table.isEntityScoped() || style == EntityReferenceStyle.NONE) {
			return Optional.empty();
		}
		String column = table.referenceColumn();
		String id = escapeLiteral(entityId.trim());
		String prefixed = escapeLiteral(patterns.prefix()) + id;
		String where = switch (style) {
			case BARE_ID -> "%s = '%s'".formatted(column, id);
			case PREFIXED_REFERENCE -> "%s = '%s'".formatted(column, prefixed);
			case MIXED -> "%s = '%s' OR %s = '%s'".formatted(column, prefixed, column, id);
			case NONE -> throw new IllegalStateException("unreachable");
		};
		return Optional.of("SELECT COUNT(*) AS count FROM %s WHERE %s".formatted(qualify(table.name()), where));
	}

	public Optional<String> generateSampleQuery(String tableName, String columnName) {
		return generateSampleQuery(tableName, columnName, DEFAULT_SAMPLE_LIMIT);
	}

	/**
	 * Distinct non-null values of one column, for empirical inspection.
	 *
	 * @param limit requested number of values; clamped to [1, 1000]
	 * @return the query, or empty if the table or column is unknown
	 */
	public Optional<String> generateSampleQuery(String tableName, String columnName, int limit) {
		Optional<TableSchema> table = table(tableName);
		Optional<ColumnSchema> column = table.flatMap(t -> t.findColumn(columnName));
		if (column.isEmpty()) {
			return Optional.empty();
		}
		int bounded = Math.max(1, Math.min(limit, MAX_SAMPLE_LIMIT));
		String name = column.get().name();
		return Optional.of("SELECT DISTINCT %s FROM %s WHERE %s IS NOT NULL LIMIT %d"
				.formatted(name, qualify(table.get().name()), name, bounded));
	}

	/**
	 * Columns whose names suggest date or time content. Advisory only: false positives and
	 * negatives are expected.
	 *
	 * @return the date-like columns (possibly none), or empty if the table is unknown
	 */
	public Optional<List<String>> identifyDateColumns(String tableName) {
		return table(tableName).map(SchemaCatalog::dateColumns);
	}

	private static List<String> dateColumns(TableSchema table) {
		List<String> result = new ArrayList<>();
		for (ColumnSchema column : table.columns()) {
			String lower = column.name().toLowerCase(Locale.ROOT);
			if (lower.equals("id") || IDENTIFIER_SUFFIXES.stream().anyMatch(lower::endsWith)) {
				continue;
			}
			if (DATE_WORDS.stream().anyMatch(lower::contains) || DATE_SUFFIXES.stream().anyMatch(lower::endsWith)) {
				result.add(column.name());
			}
		}
		return List.copyOf(result);
	}

	/**
	 * Nearest existing column to a name the table does not have.
	 */
	public Optional<ColumnNameMatcher.Suggestion> suggestColumn(String tableName, String columnName) {
		return table(tableName).flatMap(t -> ColumnNameMatcher.bestMatch(
				columnName, t.columnNames(), ColumnNameMatcher.DEFAULT_CUTOFF));
	}

	/**
	 * Checks that every requested column exists in the table.
	 *
	 * @return the validation, or empty if the table is unknown
	 */
	public Optional<ColumnValidation> validateColumns(String tableName, Collection<String> columnNames) {
		Optional<TableSchema> table = table(tableName);
		if (table.isEmpty()) {
			return Optional.empty();
		}
		List<String> unknown = new ArrayList<>();
		Map<String, String> suggestions = new LinkedHashMap<>();
		for (String columnName : columnNames) {
			if (!table.get().hasColumn(columnName)) {
				unknown.add(columnName);
				suggestColumn(tableName, columnName)
						.ifPresent(s -> suggestions.put(columnName, s.column()));
			}
		}
		return Optional.of(new ColumnValidation(table.get().name(), unknown, suggestions));
	}

	public Optional<TableSummary> summarize(String tableName) {
		return table(tableName).map(t -> new TableSummary(
				t.name(),
				t.columns().size(),
				t.columnNames(),
				dateColumns(t),
				t.referenceColumn(),
				t.entityReferenceStyle()));
	}

	/**
	 * Confirms a table's reference style from values actually stored in its reference column.
	 * Blank values are ignored; when no usable value is given the structural guess is returned.
	 *
	 * @return the observed style, or empty if the table is unknown
	 */
	public Optional<EntityReferenceStyle> confirmReferenceStyle(String tableName, Collection<String> sampleValues) {
		Optional<TableSchema> table = table(tableName);
		if (table.isEmpty()) {
			return Optional.empty();
		}
		if (!table.get().isEntityScoped()) {
			return Optional.of(EntityReferenceStyle.NONE);
		}
		boolean prefixed = false;
		boolean bare = false;
		String prefix = patterns.prefix();
		for (String value : sampleValues) {
			if (value == null || value.isBlank()) {
				continue;
			}
			if (!prefix.isEmpty() && value.trim().startsWith(prefix)) {
				prefixed = true;
			} else {
				bare = true;
			}
		}
		if (prefixed && bare) {
			return Optional.of(EntityReferenceStyle.MIXED);
		}
		if (prefixed) {
			return Optional.of(EntityReferenceStyle.PREFIXED_REFERENCE);
		}
		if (bare) {
			return Optional.of(EntityReferenceStyle.BARE_ID);
		}
		return Optional.of(table.get().entityReferenceStyle());
	}

	private String qualify(String tableName) {
		return database != null ? database + "." + tableName : tableName;
	}

	static String unqualified(String tableName) {
		String trimmed = tableName.trim();
		int dot = trimmed.lastIndexOf('.');
		return dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
	}

	private static String key(String tableName) {
		return tableName.trim().toLowerCase(Locale.ROOT);
	}

	private static String escapeLiteral(String value) {
		return value.replace("'", "''");
	}
}
