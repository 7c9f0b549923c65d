package org.javai.reasoning.query;

/**
 * Raised when a caller insists on the rows of a query that ultimately failed.
 */
public class QueryExecutionException extends RuntimeException {

	private final ErrorKind kind;

	public QueryExecutionException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind != null ? kind : ErrorKind.UNCLASSIFIED;
	}

	public ErrorKind kind() {
		return kind;
	}
}
