package org.javai.reasoning.knowledge;

import java.util.Locale;

/**
 * Typical age group of a classification.
 */
public enum AgeGroup {
	PEDIATRIC,
	ADULT,
	ANY;

	static AgeGroup parse(String text) {
		if (text == null || text.isBlank()) {
			return ANY;
		}
		return switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "pediatric", "paediatric", "child", "children" -> PEDIATRIC;
			case "adult", "adults" -> ADULT;
			case "any", "all" -> ANY;
			default -> throw new IllegalArgumentException("Unknown age group: " + text);
		};
	}
}
