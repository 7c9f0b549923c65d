package org.javai.reasoning.knowledge;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What is known about the case a classification was extracted from.
 *
 * @param ageYears age at diagnosis, or null
 * @param location anatomical location, or null
 * @param secondaryFindings markers and test results reported for the case
 * @param secondaryTestingPerformed whether the required secondary testing was done, or null if unknown
 * @param secondaryResultsContradictory whether the secondary results contradict each other, or null if unknown
 */
public record ValidationContext(Integer ageYears, String location, Set<String> secondaryFindings,
		Boolean secondaryTestingPerformed, Boolean secondaryResultsContradictory) {

	public ValidationContext {
		if (ageYears != null && ageYears < 0) {
			throw new IllegalArgumentException("ageYears must be >= 0");
		}
		secondaryFindings = secondaryFindings != null ? Set.copyOf(secondaryFindings) : Set.of();
	}

	public static ValidationContext empty() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {

		private Integer ageYears;
		private String location;
		private final Set<String> findings = new LinkedHashSet<>();
		private Boolean testingPerformed;
		private Boolean contradictory;

		private Builder() {
		}

		public Builder age(int years) {
			this.ageYears = years;
			return this;
		}

		public Builder location(String location) {
			this.location = location;
			return this;
		}

		public Builder finding(String finding) {
			this.findings.add(finding);
			return this;
		}

		public Builder findings(Set<String> findings) {
			this.findings.addAll(findings);
			return this;
		}

		public Builder secondaryTesting(boolean performed, boolean contradictory) {
			this.testingPerformed = performed;
			this.contradictory = contradictory;
			return this;
		}

		public ValidationContext build() {
			return new ValidationContext(ageYears, location, findings, testingPerformed, contradictory);
		}
	}
}
