package org.javai.reasoning.knowledge;

import java.util.List;

/**
 * Typical age and location for a classification, from the Context Rules section.
 *
 * @param diagnosis current classification name
 * @param constraints typical context
 * @param aliases informal short names (e.g. {@code GBM}) that resolve to {@code diagnosis}
 */
public record ContextRule(String diagnosis, ContextConstraints constraints, List<String> aliases)
		implements KnowledgeRule {

	public ContextRule {
		if (diagnosis == null || diagnosis.isBlank()) {
			throw new IllegalArgumentException("diagnosis must not be blank");
		}
		constraints = constraints != null ? constraints : ContextConstraints.none();
		aliases = aliases != null ? List.copyOf(aliases) : List.of();
	}

	@Override
	public KnowledgeSection section() {
		return KnowledgeSection.CONTEXT_RULES;
	}
}
