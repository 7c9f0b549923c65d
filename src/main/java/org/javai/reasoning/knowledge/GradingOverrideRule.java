package org.javai.reasoning.knowledge;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A secondary finding that supersedes the default grade or name of a classification.
 *
 * @param appliesTo classification the rule is restricted to, or null for any
 * @param triggerMarkers markers any one of which activates the rule
 * @param resultingGradeOrName the override outcome
 * @param rationale why the marker forces the change
 */
public record GradingOverrideRule(String appliesTo, Set<String> triggerMarkers, String resultingGradeOrName,
		String rationale) implements KnowledgeRule {

	public GradingOverrideRule {
		if (triggerMarkers == null || triggerMarkers.isEmpty()) {
			throw new IllegalArgumentException("An override rule needs at least one trigger marker");
		}
		if (resultingGradeOrName == null || resultingGradeOrName.isBlank()) {
			throw new IllegalArgumentException("An override rule needs a result");
		}
		appliesTo = appliesTo == null || appliesTo.isBlank() ? null : appliesTo.trim();
		triggerMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(triggerMarkers));
		rationale = rationale != null ? rationale : "";
	}

	@Override
	public KnowledgeSection section() {
		return KnowledgeSection.GRADING_OVERRIDES;
	}

	public boolean appliesTo(String canonicalName) {
		return appliesTo == null || Names.normalize(appliesTo).equals(Names.normalize(canonicalName));
	}

	/**
	 * Trigger markers present in {@code findings}, compared ignoring case and whitespace, in the
	 * rule's own order.
	 */
	public Set<String> triggeredBy(Set<String> findings) {
		Set<String> normalizedFindings = new LinkedHashSet<>();
		for (String finding : findings) {
			normalizedFindings.add(Names.normalize(finding));
		}
		Set<String> triggered = new LinkedHashSet<>();
		for (String marker : triggerMarkers) {
			if (normalizedFindings.contains(Names.normalize(marker))) {
				triggered.add(marker);
			}
		}
		return triggered;
	}
}
