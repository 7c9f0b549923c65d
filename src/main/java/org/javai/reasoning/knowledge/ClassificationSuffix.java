package org.javai.reasoning.knowledge;

import java.util.Locale;

/**
 * Qualifier for a deliberately under-specified classification.
 */
public enum ClassificationSuffix {
	/** Not otherwise specified: the required secondary testing was not performed. */
	NOS("not otherwise specified"),
	/** Not elsewhere classified: testing was performed but the results do not fit a defined type. */
	NEC("not elsewhere classified");

	private final String meaning;

	ClassificationSuffix(String meaning) {
		this.meaning = meaning;
	}

	public String meaning() {
		return meaning;
	}

	public String applyTo(String name) {
		return name + ", " + name();
	}

	static boolean isPresentOn(String name) {
		String normalized = Names.normalize(name);
		for (ClassificationSuffix suffix : values()) {
			String tag = suffix.name().toLowerCase(Locale.ROOT);
			if (normalized.endsWith(" " + tag) || normalized.endsWith("," + tag)) {
				return true;
			}
		}
		return false;
	}
}
