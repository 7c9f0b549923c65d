package org.javai.reasoning.investigate;

import java.util.List;

/**
 * A rewrite of one expression in a failed query.
 *
 * @param strategy how the fix was derived
 * @param target exact text in the failing query that the fix replaces
 * @param replacement SQL that replaces {@code target}
 * @param shapes date shapes the replacement parses, in attempt order (empty for non-date fixes)
 * @param similarity name similarity for column suggestions, 1.0 otherwise
 */
public record ProposedFix(FixStrategy strategy, String target, String replacement, List<DateShape> shapes,
		double similarity) {

	public ProposedFix {
		if (strategy == null || strategy == FixStrategy.NONE) {
			throw new IllegalArgumentException("A proposed fix needs a concrete strategy");
		}
		if (target == null || target.isBlank() || replacement == null || replacement.isBlank()) {
			throw new IllegalArgumentException("A proposed fix needs a target and a replacement");
		}
		shapes = shapes != null ? List.copyOf(shapes) : List.of();
	}
}
