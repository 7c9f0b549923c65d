package org.javai.reasoning.knowledge;

import java.util.Locale;

final class Names {

	private Names() {
	}

	/**
	 * Lower-cased, trimmed, with internal whitespace collapsed.
	 */
	static String normalize(String value) {
		if (value == null) {
			return "";
		}
		return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
	}
}
