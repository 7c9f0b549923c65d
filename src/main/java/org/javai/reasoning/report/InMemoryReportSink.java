package org.javai.reasoning.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.reasoning.investigate.FailureReport;
import org.javai.reasoning.orchestrate.CoverageAssessment;
import org.javai.reasoning.orchestrate.ReportSink;

/**
 * Keeps reports in memory.
 */
public class InMemoryReportSink implements ReportSink {

	private final List<FailureReport> failures = new ArrayList<>();
	private final List<CoverageAssessment> coverageReports = new ArrayList<>();

	@Override
	public void recordFailure(FailureReport report) {
		failures.add(report);
	}

	@Override
	public void recordCoverage(CoverageAssessment assessment) {
		coverageReports.add(assessment);
	}

	public List<FailureReport> failures() {
		return List.copyOf(failures);
	}

	public List<CoverageAssessment> coverageReports() {
		return List.copyOf(coverageReports);
	}

	public Optional<FailureReport> failure(String queryId) {
		return failures.stream().filter(r -> r.queryId().equals(queryId)).findFirst();
	}

	public void clear() {
		failures.clear();
		coverageReports.clear();
	}
}
