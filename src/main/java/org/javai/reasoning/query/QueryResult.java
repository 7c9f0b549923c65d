package org.javai.reasoning.query;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * What a {@link QueryExecutor} returns: rows, an engine failure, or a timeout.
 */
public sealed interface QueryResult {

	static QueryResult rows(List<Map<String, String>> rows) {
		return new Rows(rows);
	}

	static QueryResult failed(String errorType, String message) {
		return new Failed(errorType, message);
	}

	static QueryResult timedOut(Duration after) {
		return new TimedOut(after);
	}

	/**
	 * Successful execution. Each row maps column label to its raw string value (which may be null).
	 */
	record Rows(List<Map<String, String>> rows) implements QueryResult {
		public Rows {
			rows = rows != null ? List.copyOf(rows) : List.of();
		}
	}

	/**
	 * Engine-reported failure.
	 *
	 * @param errorType the engine's own error category, e.g. {@code INVALID_FUNCTION_ARGUMENT} (may be null)
	 * @param message the engine's error message
	 */
	record Failed(String errorType, String message) implements QueryResult {
		public Failed {
			message = message != null ? message : "";
		}

		/**
		 * Error text as engines usually print it: {@code TYPE: message}.
		 */
		public String errorText() {
			if (errorType == null || errorType.isBlank() || message.startsWith(errorType)) {
				return message;
			}
			return errorType + ": " + message;
		}
	}

	/**
	 * The executor gave up after the caller-supplied timeout.
	 */
	record TimedOut(Duration after) implements QueryResult {
	}
}
