package org.javai.reasoning.orchestrate;

import org.javai.reasoning.investigate.FailureReport;

/**
 * Destination for the two report artifacts: failure reports that need manual review and coverage
 * reports at the end of a gap-filling run.
 */
public interface ReportSink {

	void recordFailure(FailureReport report);

	void recordCoverage(CoverageAssessment assessment);

	/**
	 * Sink that drops everything, for callers that read reports from the returned results only.
	 */
	static ReportSink discarding() {
		return new ReportSink() {
			@Override
			public void recordFailure(FailureReport report) {
			}

			@Override
			public void recordCoverage(CoverageAssessment assessment) {
			}
		};
	}
}
