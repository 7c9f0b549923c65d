package org.javai.reasoning.knowledge;

import java.util.Locale;
import java.util.Optional;

/**
 * Named {@code ##} sections of the domain reference document.
 */
public enum KnowledgeSection {

	CONTEXT_RULES("Context Rules", true),
	GRADING_OVERRIDES("Grading Overrides", true),
	NOMENCLATURE_CHANGES("Nomenclature Changes", true),
	MARKER_REQUIREMENTS("Marker Requirements", false),
	DIAGNOSTIC_PRINCIPLES("Diagnostic Principles", false);

	private final String heading;
	private final boolean required;

	KnowledgeSection(String heading, boolean required) {
		this.heading = heading;
		this.required = required;
	}

	public String heading() {
		return heading;
	}

	/**
	 * Whether a document lacking this section is reported as incomplete.
	 */
	public boolean required() {
		return required;
	}

	/**
	 * The section a heading names. Matching is case-insensitive and by containment, so
	 * {@code "3. Grading Overrides (molecular)"} is recognised.
	 */
	public static Optional<KnowledgeSection> forHeading(String heading) {
		if (heading == null) {
			return Optional.empty();
		}
		String lower = heading.toLowerCase(Locale.ROOT);
		for (KnowledgeSection section : values()) {
			if (lower.contains(section.heading.toLowerCase(Locale.ROOT))) {
				return Optional.of(section);
			}
		}
		return Optional.empty();
	}
}
