package org.javai.reasoning.knowledge;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Rules parsed from one reference document, with a record of what could not be parsed.
 */
record KnowledgeDocument(
		List<ContextRule> contextRules,
		List<GradingOverrideRule> overrideRules,
		List<NomenclatureRule> nomenclatureRules,
		List<MarkerRequirementRule> markerRequirements,
		List<String> principles,
		Set<KnowledgeSection> missingSections,
		List<KnowledgeParseException> issues
) {

	KnowledgeDocument {
		contextRules = List.copyOf(contextRules);
		overrideRules = List.copyOf(overrideRules);
		nomenclatureRules = List.copyOf(nomenclatureRules);
		markerRequirements = List.copyOf(markerRequirements);
		principles = List.copyOf(principles);
		missingSections = missingSections.isEmpty()
				? Set.of()
				: Collections.unmodifiableSet(EnumSet.copyOf(missingSections));
		issues = List.copyOf(issues);
	}
}
