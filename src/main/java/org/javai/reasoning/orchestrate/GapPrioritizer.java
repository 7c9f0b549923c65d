package org.javai.reasoning.orchestrate;

import java.util.Comparator;
import java.util.List;

/**
 * Ranks coverage gaps by the first matching {@link GapPriorityRule}. Tables no rule matches get
 * {@link GapPriority#LOW} and field {@code *}.
 */
class GapPrioritizer {

	record Ranking(GapPriority priority, String field, int ruleIndex) {
	}

	private final List<GapPriorityRule> rules;

	GapPrioritizer(List<GapPriorityRule> rules) {
		this.rules = List.copyOf(rules);
	}

	Ranking rank(String table) {
		for (int i = 0; i < rules.size(); i++) {
			GapPriorityRule rule = rules.get(i);
			if (rule.matches(table)) {
				return new Ranking(rule.priority(), rule.field(), i);
			}
		}
		return new Ranking(GapPriority.LOW, "*", rules.size());
	}

	/**
	 * Priority first, then rule order, then most missing records, then table name.
	 */
	Comparator<CoverageGap> order() {
		return Comparator.comparing(CoverageGap::priority)
				.thenComparingInt(gap -> rank(gap.table()).ruleIndex())
				.thenComparing(Comparator.comparingLong(CoverageGap::missingCount).reversed())
				.thenComparing(CoverageGap::table);
	}
}
