package org.javai.reasoning.knowledge;

/**
 * A section of the domain reference document is missing or could not be parsed.
 *
 * <p>During loading these are collected per section rather than thrown, so one malformed section
 * only disables its own rule category.</p>
 */
public class KnowledgeParseException extends RuntimeException {

	private final KnowledgeSection section;

	public KnowledgeParseException(KnowledgeSection section, String message) {
		super(message);
		this.section = section;
	}

	public KnowledgeParseException(KnowledgeSection section, String message, Throwable cause) {
		super(message, cause);
		this.section = section;
	}

	/**
	 * The section concerned, or null when the whole document is unusable.
	 */
	public KnowledgeSection section() {
		return section;
	}
}
