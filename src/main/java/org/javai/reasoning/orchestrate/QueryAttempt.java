package org.javai.reasoning.orchestrate;

import org.javai.reasoning.investigate.FailureReport;

/**
 * Record of a single execution attempt for observability.
 *
 * @param retryDepth 0 for the original query, n for the n-th auto-fixed retry
 * @param queryText the query as executed
 * @param outcome result of the attempt
 * @param durationMillis time taken by the executor
 * @param errorText engine or executor error text, null on success
 * @param report investigation of this attempt's failure, null when not investigated
 */
public record QueryAttempt(
		int retryDepth,
		String queryText,
		AttemptOutcome outcome,
		long durationMillis,
		String errorText,
		FailureReport report
) {

	public QueryAttempt {
		if (retryDepth < 0) {
			throw new IllegalArgumentException("retryDepth must be >= 0");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
