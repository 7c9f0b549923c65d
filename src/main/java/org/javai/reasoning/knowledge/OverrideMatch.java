package org.javai.reasoning.knowledge;

import java.util.Set;

/**
 * An override rule activated by a set of findings.
 *
 * @param rule the matched rule
 * @param triggeringMarkers the rule's markers found among the findings
 * @param previousValue classification before the override
 * @param newValue the rule's outcome
 */
public record OverrideMatch(GradingOverrideRule rule, Set<String> triggeringMarkers, String previousValue,
		String newValue) {

	public OverrideMatch {
		triggeringMarkers = Set.copyOf(triggeringMarkers);
	}

	public String rationale() {
		return rule.rationale();
	}
}
