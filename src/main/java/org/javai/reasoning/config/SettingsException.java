package org.javai.reasoning.config;

/**
 * Settings could not be read or contain an invalid value.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
