package org.javai.reasoning.query;

/**
 * Classification of a failed query execution.
 */
public enum ErrorKind {
	/** A date/time parsing function met a value in a shape its format does not accept. */
	DATE_FORMAT_MISMATCH,
	/** A function or operator received an argument of the wrong type. */
	TYPE_MISMATCH,
	/** The query references a column the table does not have. */
	UNKNOWN_COLUMN,
	/** Generic syntax error. Diagnosed but never fixed automatically. */
	SYNTAX_ERROR,
	/** The executor gave up waiting. No error text exists, so it is never investigated. */
	TIMEOUT,
	/** None of the known patterns matched. */
	UNCLASSIFIED
}
