package org.javai.reasoning.orchestrate;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of extraction completeness for one entity. Rebuilt every gap-filling cycle.
 *
 * @param entityId entity the counts are for
 * @param perTable coverage of every assessed table
 * @param coveragePct covered records as a percentage of raw records over the assessed tables, 100
 *     when they hold none and 0 when no table could be assessed
 * @param gaps gaps in priority order
 * @param unassessedTables entity-scoped tables whose count query failed
 * @param assessedAt when the snapshot was taken
 */
public record CoverageAssessment(String entityId, Map<String, TableCoverage> perTable, double coveragePct,
		List<CoverageGap> gaps, List<String> unassessedTables, Instant assessedAt) {

	public CoverageAssessment {
		perTable = perTable != null ? Collections.unmodifiableMap(new LinkedHashMap<>(perTable)) : Map.of();
		gaps = gaps != null ? List.copyOf(gaps) : List.of();
		unassessedTables = unassessedTables != null ? List.copyOf(unassessedTables) : List.of();
		if (Double.isNaN(coveragePct) || coveragePct < 0.0 || coveragePct > 100.0) {
			throw new IllegalArgumentException("coveragePct must be in [0, 100]");
		}
		assessedAt = assessedAt != null ? assessedAt : Instant.now();
	}

	/**
	 * No gaps and no unassessed tables. An assessment that could not count a table never claims
	 * completeness.
	 */
	public boolean isComplete() {
		return gaps.isEmpty() && unassessedTables.isEmpty();
	}

	public boolean hasUnassessedTables() {
		return !unassessedTables.isEmpty();
	}

	public long totalMissing() {
		return gaps.stream().mapToLong(CoverageGap::missingCount).sum();
	}

	static double coveragePct(Iterable<TableCoverage> tables) {
		long raw = 0;
		long covered = 0;
		for (TableCoverage table : tables) {
			raw += table.rawCount();
			covered += table.coveredCount();
		}
		if (raw == 0) {
			return 100.0;
		}
		return covered * 100.0 / raw;
	}
}
