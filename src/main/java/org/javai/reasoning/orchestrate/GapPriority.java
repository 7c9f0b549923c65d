package org.javai.reasoning.orchestrate;

import java.util.Locale;

/**
 * Clinical importance of filling a gap. Declaration order is ranking order.
 */
public enum GapPriority {
	HIGHEST,
	HIGH,
	MEDIUM,
	LOW;

	public static GapPriority parse(String text) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("priority must not be blank");
		}
		try {
			return valueOf(text.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown gap priority '%s', expected one of HIGHEST, HIGH, MEDIUM, LOW"
					.formatted(text), e);
		}
	}
}
