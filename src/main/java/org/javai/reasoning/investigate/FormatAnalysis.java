package org.javai.reasoning.investigate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Shapes found in a column's sampled values.
 *
 * @param hasMultipleFormats true when more than one canonical shape was observed
 * @param detectedFormats distinct shapes observed, iterated most-specific first
 * @param sampleCount number of values analysed
 * @param unrecognizedCount values that matched no canonical shape
 */
public record FormatAnalysis(boolean hasMultipleFormats, Set<DateShape> detectedFormats, int sampleCount,
		int unrecognizedCount) {

	public FormatAnalysis {
		detectedFormats = detectedFormats == null || detectedFormats.isEmpty()
				? Set.of()
				: Collections.unmodifiableSet(EnumSet.copyOf(detectedFormats));
		if (hasMultipleFormats != (detectedFormats.size() > 1)) {
			throw new IllegalArgumentException("hasMultipleFormats must reflect the detected formats");
		}
	}
}
