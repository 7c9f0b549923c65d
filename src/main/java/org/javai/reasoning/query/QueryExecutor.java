package org.javai.reasoning.query;

import java.time.Duration;

/**
 * Capability that runs a query against the target engine.
 *
 * <p>Implementations may hide a submit/poll/fetch cycle against a remote service; callers treat
 * the call as blocking. Engine errors are reported as {@link QueryResult.Failed} and an expired
 * wait as {@link QueryResult.TimedOut}. A thrown runtime exception is tolerated by callers and
 * handled like an engine failure.</p>
 */
@FunctionalInterface
public interface QueryExecutor {

	/**
	 * @param queryText SQL to run
	 * @param timeout maximum time to wait for the result
	 */
	QueryResult execute(String queryText, Duration timeout);
}
