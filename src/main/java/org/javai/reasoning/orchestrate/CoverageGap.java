package org.javai.reasoning.orchestrate;

/**
 * A table where raw records exceed extracted ones.
 *
 * @param table table holding the unextracted records
 * @param field field the gap stands for, {@code *} when no priority rule names one
 * @param eventReference locator of the entity's records, {@code table?column=reference}
 * @param priority ranking of this gap
 * @param missingCount raw minus extracted records
 */
public record CoverageGap(String table, String field, String eventReference, GapPriority priority,
		long missingCount) {

	public CoverageGap {
		if (missingCount < 1) {
			throw new IllegalArgumentException("a gap has at least one missing record");
		}
	}
}
