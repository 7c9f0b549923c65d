package org.javai.reasoning.orchestrate;

/**
 * Outcome of a single query execution attempt.
 */
public enum AttemptOutcome {
	/**
	 * The engine returned rows.
	 */
	SUCCESS,

	/**
	 * The engine reported an error.
	 */
	ENGINE_ERROR,

	/**
	 * The executor gave up waiting. Never investigated or retried.
	 */
	TIMEOUT,

	/**
	 * The executor itself threw. Handled like an engine error.
	 */
	EXECUTOR_ERROR
}
