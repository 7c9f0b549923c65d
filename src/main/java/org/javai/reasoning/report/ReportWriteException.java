package org.javai.reasoning.report;

/**
 * A report artifact could not be written.
 */
public class ReportWriteException extends RuntimeException {

	public ReportWriteException(String message, Throwable cause) {
		super(message, cause);
	}
}
