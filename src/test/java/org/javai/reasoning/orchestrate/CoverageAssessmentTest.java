package org.javai.reasoning.orchestrate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Coverage types")
class CoverageAssessmentTest {

	@Test
	@DisplayName("Coverage is covered over raw records, ignoring over-extraction")
	void coveragePct() {
		List<TableCoverage> tables = List.of(
				new TableCoverage("t1", 10, 7),
				new TableCoverage("t2", 0, 0),
				new TableCoverage("t3", 10, 15));

		assertThat(CoverageAssessment.coveragePct(tables)).isEqualTo(85.0);
	}

	@Test
	@DisplayName("Coverage of nothing is complete")
	void emptyCoverage() {
		assertThat(CoverageAssessment.coveragePct(List.of(new TableCoverage("t2", 0, 0)))).isEqualTo(100.0);
	}

	@Test
	@DisplayName("Missing and covered counts never go negative")
	void tableCoverage() {
		TableCoverage over = new TableCoverage("t1", 3, 5);

		assertThat(over.missingCount()).isZero();
		assertThat(over.coveredCount()).isEqualTo(3);
		assertThatThrownBy(() -> new TableCoverage("t1", -1, 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("An assessment is complete when it has no gaps and every table was counted")
	void completeness() {
		CoverageGap gap = new CoverageGap("t1", "*", "t1?subject_reference=Patient/p1", GapPriority.LOW, 3);
		CoverageAssessment open = new CoverageAssessment("p1", Map.of(), 70.0, List.of(gap), List.of(), null);
		CoverageAssessment done = new CoverageAssessment("p1", Map.of(), 100.0, List.of(), List.of(), null);

		assertThat(open.isComplete()).isFalse();
		assertThat(open.totalMissing()).isEqualTo(3);
		assertThat(open.assessedAt()).isNotNull();
		assertThat(done.isComplete()).isTrue();
	}

	@Test
	@DisplayName("An assessment with unassessed tables is never complete")
	void unassessedIsIncomplete() {
		CoverageAssessment partial = new CoverageAssessment("p1", Map.of(), 100.0, List.of(), List.of("t2"), null);

		assertThat(partial.gaps()).isEmpty();
		assertThat(partial.hasUnassessedTables()).isTrue();
		assertThat(partial.isComplete()).isFalse();
	}

	@Test
	@DisplayName("Rejects a gap without missing records and an out-of-range percentage")
	void validation() {
		assertThatThrownBy(() -> new CoverageGap("t1", "*", "ref", GapPriority.LOW, 0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new CoverageAssessment("p1", Map.of(), 101.0, List.of(), List.of(), null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Priority rules match exact names and trailing wildcards")
	void priorityRules() {
		GapPriorityRule radiation = new GapPriorityRule("radiation_*", "total_dose_cgy", GapPriority.HIGHEST);

		assertThat(radiation.matches("Radiation_Course")).isTrue();
		assertThat(radiation.matches("radiology")).isFalse();
		assertThat(new GapPriorityRule("condition", null, GapPriority.HIGH).field()).isEqualTo("*");
		assertThat(GapPriority.parse("medium")).isEqualTo(GapPriority.MEDIUM);
		assertThatThrownBy(() -> GapPriority.parse("urgent")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Unmatched tables rank last")
	void prioritizer() {
		GapPrioritizer prioritizer = new GapPrioritizer(OrchestratorSettings.DEFAULT_GAP_PRIORITIES);

		assertThat(prioritizer.rank("procedure").priority()).isEqualTo(GapPriority.HIGHEST);
		assertThat(prioritizer.rank("radiation_fraction").field()).isEqualTo("total_dose_cgy");
		assertThat(prioritizer.rank("encounter")).isEqualTo(
				new GapPrioritizer.Ranking(GapPriority.LOW, "*", OrchestratorSettings.DEFAULT_GAP_PRIORITIES.size()));
	}
}
