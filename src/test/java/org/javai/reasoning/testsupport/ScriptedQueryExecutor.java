package org.javai.reasoning.testsupport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.reasoning.query.QueryExecutor;
import org.javai.reasoning.query.QueryResult;

/**
 * Test-only {@link QueryExecutor} that answers queries from registered scripts without touching an
 * engine. A script is selected by the first registered fragment the query text contains (ignoring
 * case); every executed query is recorded for assertions.
 */
public final class ScriptedQueryExecutor implements QueryExecutor {

	private final Map<String, Supplier<QueryResult>> scripts = new LinkedHashMap<>();
	private final List<String> executed = new ArrayList<>();
	private Supplier<QueryResult> fallback = () -> QueryResult.failed("NOT_SCRIPTED", "No script for query");

	public ScriptedQueryExecutor on(String fragment, QueryResult result) {
		return on(fragment, () -> result);
	}

	public ScriptedQueryExecutor on(String fragment, Supplier<QueryResult> result) {
		scripts.put(Objects.requireNonNull(fragment, "fragment must not be null").toLowerCase(Locale.ROOT),
				Objects.requireNonNull(result, "result must not be null"));
		return this;
	}

	/**
	 * Answers each matching query with the next result in turn; the last one repeats.
	 */
	public ScriptedQueryExecutor onSequence(String fragment, QueryResult... results) {
		List<QueryResult> queue = new ArrayList<>(List.of(results));
		return on(fragment, () -> queue.size() > 1 ? queue.remove(0) : queue.get(0));
	}

	public ScriptedQueryExecutor otherwise(QueryResult result) {
		this.fallback = () -> result;
		return this;
	}

	@Override
	public QueryResult execute(String queryText, Duration timeout) {
		executed.add(queryText);
		String lower = queryText.toLowerCase(Locale.ROOT);
		for (Map.Entry<String, Supplier<QueryResult>> script : scripts.entrySet()) {
			if (lower.contains(script.getKey())) {
				return script.getValue().get();
			}
		}
		return fallback.get();
	}

	public List<String> executedQueries() {
		return List.copyOf(executed);
	}

	public long countExecuted(String fragment) {
		String needle = fragment.toLowerCase(Locale.ROOT);
		return executed.stream().filter(q -> q.toLowerCase(Locale.ROOT).contains(needle)).count();
	}

	public static QueryResult column(String name, String... values) {
		List<Map<String, String>> rows = new ArrayList<>();
		for (String value : values) {
			Map<String, String> row = new LinkedHashMap<>();
			row.put(name, value);
			rows.add(row);
		}
		return QueryResult.rows(rows);
	}

	public static QueryResult count(long value) {
		return column("count", Long.toString(value));
	}
}
