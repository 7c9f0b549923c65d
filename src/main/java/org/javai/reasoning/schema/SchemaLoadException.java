package org.javai.reasoning.schema;

/**
 * Thrown when a schema description source is unreadable, empty or malformed.
 * A catalog is never partially loaded.
 */
public class SchemaLoadException extends RuntimeException {

	public SchemaLoadException(String message) {
		super(message);
	}

	public SchemaLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
