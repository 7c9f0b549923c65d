package org.javai.reasoning.orchestrate;

import java.util.List;

/**
 * Summary of one gap-filling run.
 *
 * @param termination why the loop stopped
 * @param cycles cycles that attempted re-extraction
 * @param resolvedCount gaps resolved over all cycles
 * @param assessments initial assessment followed by one per cycle
 * @param coverageHistory coverage percentage of each assessment, non-decreasing
 */
public record GapFillingResult(GapFillingTermination termination, int cycles, int resolvedCount,
		List<CoverageAssessment> assessments, List<Double> coverageHistory) {

	public GapFillingResult {
		if (assessments == null || assessments.isEmpty()) {
			throw new IllegalArgumentException("a run has at least its initial assessment");
		}
		assessments = List.copyOf(assessments);
		coverageHistory = List.copyOf(coverageHistory);
	}

	public CoverageAssessment finalAssessment() {
		return assessments.get(assessments.size() - 1);
	}

	public List<CoverageGap> unresolvedGaps() {
		return finalAssessment().gaps();
	}
}
