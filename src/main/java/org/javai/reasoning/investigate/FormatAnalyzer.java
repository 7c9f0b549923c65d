package org.javai.reasoning.investigate;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies sampled string values against the canonical {@link DateShape}s.
 */
public class FormatAnalyzer {

	public FormatAnalysis analyze(Collection<String> values) {
		Set<DateShape> shapes = EnumSet.noneOf(DateShape.class);
		int count = 0;
		int unrecognized = 0;
		for (String value : values) {
			if (value == null || value.isBlank()) {
				continue;
			}
			count++;
			Optional<DateShape> shape = DateShape.classify(value);
			if (shape.isPresent()) {
				shapes.add(shape.get());
			} else {
				unrecognized++;
			}
		}
		return new FormatAnalysis(shapes.size() > 1, shapes, count, unrecognized);
	}
}
