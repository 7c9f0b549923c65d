package org.javai.reasoning.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Where and in whom a classification is typically seen. Violations are warnings only, since rare
 * presentations exist.
 *
 * @param ageGroup typical age group
 * @param minAge lowest typical age in years, or null
 * @param maxAge highest typical age in years, or null
 * @param locations typical anatomical locations (empty means any)
 * @param rarityNote text appended to warnings
 */
public record ContextConstraints(AgeGroup ageGroup, Integer minAge, Integer maxAge, List<String> locations,
		String rarityNote) {

	public ContextConstraints {
		ageGroup = ageGroup != null ? ageGroup : AgeGroup.ANY;
		locations = locations != null ? List.copyOf(locations) : List.of();
		if (minAge != null && maxAge != null && minAge > maxAge) {
			throw new IllegalArgumentException("minAge must not exceed maxAge");
		}
	}

	public static ContextConstraints none() {
		return new ContextConstraints(AgeGroup.ANY, null, null, List.of(), null);
	}

	/**
	 * Warnings for the parts of {@code context} that fall outside these constraints.
	 */
	public List<String> check(String name, ValidationContext context) {
		List<String> warnings = new ArrayList<>();
		Integer age = context.ageYears();
		if (age != null && ((minAge != null && age < minAge) || (maxAge != null && age > maxAge))) {
			warnings.add(withNote("%s is unusual at age %d (typically %s%s)".formatted(name, age,
					ageGroup.name().toLowerCase(Locale.ROOT), ageRange())));
		}
		String location = context.location();
		if (location != null && !location.isBlank() && !locations.isEmpty() && !matchesLocation(location)) {
			warnings.add(withNote("%s is unusual in location '%s' (typically %s)".formatted(name, location,
					String.join(", ", locations))));
		}
		return warnings;
	}

	private boolean matchesLocation(String location) {
		String given = Names.normalize(location).replace('_', ' ');
		for (String typical : locations) {
			String expected = Names.normalize(typical).replace('_', ' ');
			if (given.contains(expected) || expected.contains(given)) {
				return true;
			}
		}
		return false;
	}

	private String ageRange() {
		if (minAge != null && maxAge != null) {
			return ", ages %d-%d".formatted(minAge, maxAge);
		}
		if (minAge != null) {
			return ", ages %d+".formatted(minAge);
		}
		if (maxAge != null) {
			return ", ages up to %d".formatted(maxAge);
		}
		return "";
	}

	private String withNote(String warning) {
		return rarityNote == null || rarityNote.isBlank() ? warning : warning + ": " + rarityNote;
	}
}
