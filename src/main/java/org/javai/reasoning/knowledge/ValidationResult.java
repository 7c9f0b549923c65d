package org.javai.reasoning.knowledge;

import java.util.List;

/**
 * Verdict on one classification name.
 *
 * @param valid false only when the name is unusable; implausible context yields warnings instead
 * @param canonicalName name after alias resolution, or null when the name is unknown
 * @param warnings context and verification warnings
 * @param requiredTestsMissing secondary tests the classification needs that the findings lack
 * @param suggestedRewrite current name when the given name is obsolete or an abbreviation, else null
 * @param override first override activated by the findings, else null
 * @param suffixSuggestion NOS/NEC qualifier when testing information calls for one, else null
 */
public record ValidationResult(boolean valid, String canonicalName, List<String> warnings,
		List<String> requiredTestsMissing, String suggestedRewrite, OverrideMatch override,
		ClassificationSuffix suffixSuggestion) {

	public ValidationResult {
		warnings = warnings != null ? List.copyOf(warnings) : List.of();
		requiredTestsMissing = requiredTestsMissing != null ? List.copyOf(requiredTestsMissing) : List.of();
	}

	static ValidationResult invalid(String warning) {
		return new ValidationResult(false, null, List.of(warning), List.of(), null, null, null);
	}
}
