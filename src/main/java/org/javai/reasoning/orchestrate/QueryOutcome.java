package org.javai.reasoning.orchestrate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.reasoning.investigate.FailureReport;
import org.javai.reasoning.query.ErrorKind;
import org.javai.reasoning.query.QueryExecutionException;

/**
 * Result of {@link ReasoningOrchestrator#executeWithInvestigation}: the rows of the last attempt
 * when it succeeded, and every attempt made on the way.
 *
 * @param queryId identifier under which failures were investigated and persisted
 * @param description caller's description of the query
 * @param rows rows of the successful attempt, empty otherwise
 * @param finalReport last investigation, null when nothing was investigated
 * @param attempts attempts in execution order, never empty
 */
public record QueryOutcome(String queryId, String description, List<Map<String, String>> rows,
		FailureReport finalReport, List<QueryAttempt> attempts) {

	public QueryOutcome {
		if (attempts == null || attempts.isEmpty()) {
			throw new IllegalArgumentException("an outcome has at least one attempt");
		}
		rows = rows != null ? List.copyOf(rows) : List.of();
		attempts = List.copyOf(attempts);
	}

	public QueryAttempt lastAttempt() {
		return attempts.get(attempts.size() - 1);
	}

	public boolean succeeded() {
		return lastAttempt().isSuccess();
	}

	public boolean timedOut() {
		return lastAttempt().outcome() == AttemptOutcome.TIMEOUT;
	}

	/**
	 * Whether an auto-fixed retry was needed to succeed.
	 */
	public boolean wasFixed() {
		return succeeded() && attempts.size() > 1;
	}

	public String finalQuery() {
		return lastAttempt().queryText();
	}

	public Optional<FailureReport> report() {
		return Optional.ofNullable(finalReport);
	}

	/**
	 * The rows, or a {@link QueryExecutionException} describing why there are none.
	 */
	public List<Map<String, String>> orElseThrow() {
		if (succeeded()) {
			return rows;
		}
		if (timedOut()) {
			throw new QueryExecutionException(ErrorKind.TIMEOUT, "Query '%s' timed out".formatted(description));
		}
		ErrorKind kind = finalReport != null ? finalReport.errorKind() : ErrorKind.UNCLASSIFIED;
		throw new QueryExecutionException(kind, "Query '%s' failed after %d attempt(s): %s"
				.formatted(description, attempts.size(), lastAttempt().errorText()));
	}
}
