package org.javai.reasoning.knowledge;

import java.util.List;

/**
 * Everything the knowledge base knows about one current classification, assembled from the
 * context, nomenclature and marker requirement sections.
 *
 * @param name current classification name
 * @param contextConstraints typical age and location
 * @param requiredSecondaryTests tests from every marker requirement whose fragment the name contains
 * @param obsoleteAliases superseded names and informal aliases that resolve to {@code name}
 */
public record DiagnosisRule(String name, ContextConstraints contextConstraints, List<String> requiredSecondaryTests,
		List<String> obsoleteAliases) {

	public DiagnosisRule {
		contextConstraints = contextConstraints != null ? contextConstraints : ContextConstraints.none();
		requiredSecondaryTests = requiredSecondaryTests != null ? List.copyOf(requiredSecondaryTests) : List.of();
		obsoleteAliases = obsoleteAliases != null ? List.copyOf(obsoleteAliases) : List.of();
	}
}
