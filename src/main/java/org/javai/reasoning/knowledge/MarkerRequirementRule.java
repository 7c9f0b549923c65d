package org.javai.reasoning.knowledge;

import java.util.List;
import java.util.Set;

/**
 * Secondary tests a classification needs when its name contains {@code nameFragment}. Any one of
 * the listed tests satisfies the requirement.
 */
public record MarkerRequirementRule(String nameFragment, List<String> requiredTests) implements KnowledgeRule {

	public MarkerRequirementRule {
		if (nameFragment == null || nameFragment.isBlank()) {
			throw new IllegalArgumentException("nameFragment must not be blank");
		}
		if (requiredTests == null || requiredTests.isEmpty()) {
			throw new IllegalArgumentException("A marker requirement needs at least one test");
		}
		requiredTests = List.copyOf(requiredTests);
	}

	@Override
	public KnowledgeSection section() {
		return KnowledgeSection.MARKER_REQUIREMENTS;
	}

	public boolean appliesTo(String name) {
		return Names.normalize(name).contains(Names.normalize(nameFragment));
	}

	public boolean satisfiedBy(Set<String> findings) {
		for (String finding : findings) {
			for (String test : requiredTests) {
				if (Names.normalize(finding).equals(Names.normalize(test))) {
					return true;
				}
			}
		}
		return false;
	}
}
