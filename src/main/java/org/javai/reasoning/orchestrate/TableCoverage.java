package org.javai.reasoning.orchestrate;

/**
 * Raw records available for the entity in one table versus records extracted from it.
 */
public record TableCoverage(String table, long rawCount, long extractedCount) {

	public TableCoverage {
		if (rawCount < 0 || extractedCount < 0) {
			throw new IllegalArgumentException("counts must be >= 0");
		}
	}

	public long missingCount() {
		return Math.max(0, rawCount - extractedCount);
	}

	/**
	 * Extracted records that count towards coverage; extraction beyond the raw count does not.
	 */
	public long coveredCount() {
		return Math.min(rawCount, extractedCount);
	}
}
