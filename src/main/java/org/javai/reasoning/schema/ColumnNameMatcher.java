package org.javai.reasoning.schema;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Fuzzy matching of a misspelled or invented column name against the columns a table actually has.
 */
public final class ColumnNameMatcher {

	/** Similarity below which no suggestion is offered. */
	public static final double DEFAULT_CUTOFF = 0.6;

	private static final double CONTAINMENT_SCORE = 0.8;
	private static final int MIN_CONTAINMENT_LENGTH = 3;

	private ColumnNameMatcher() {
	}

	/**
	 * A suggested column and how similar it is to the requested name.
	 */
	public record Suggestion(String column, double similarity) {
	}

	/**
	 * Similarity in [0, 1]. Underscores and case are ignored; containment of one name in the other
	 * scores {@value #CONTAINMENT_SCORE}; otherwise normalized Levenshtein distance.
	 */
	public static double similarity(String first, String second) {
		if (first == null || second == null) {
			return 0.0;
		}
		String a = normalize(first);
		String b = normalize(second);
		if (a.isEmpty() || b.isEmpty()) {
			return 0.0;
		}
		if (a.equals(b)) {
			return 1.0;
		}
		double edit = 1.0 - ((double) levenshteinDistance(a, b) / Math.max(a.length(), b.length()));
		if (Math.min(a.length(), b.length()) >= MIN_CONTAINMENT_LENGTH && (a.contains(b) || b.contains(a))) {
			return Math.max(CONTAINMENT_SCORE, edit);
		}
		return edit;
	}

	public static Optional<Suggestion> bestMatch(String requested, Collection<String> candidates, double cutoff) {
		if (requested == null || candidates == null) {
			return Optional.empty();
		}
		Suggestion best = null;
		for (String candidate : candidates) {
			if (candidate.equalsIgnoreCase(requested)) {
				continue;
			}
			double score = similarity(requested, candidate);
			if (score >= cutoff && (best == null || score > best.similarity())) {
				best = new Suggestion(candidate, score);
			}
		}
		return Optional.ofNullable(best);
	}

	private static String normalize(String value) {
		return value.trim().toLowerCase(Locale.ROOT).replace("_", "");
	}

	private static int levenshteinDistance(String s1, String s2) {
		int[][] dp = new int[s1.length() + 1][s2.length() + 1];

		for (int i = 0; i <= s1.length(); i++) {
			dp[i][0] = i;
		}
		for (int j = 0; j <= s2.length(); j++) {
			dp[0][j] = j;
		}

		for (int i = 1; i <= s1.length(); i++) {
			for (int j = 1; j <= s2.length(); j++) {
				int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
				dp[i][j] = Math.min(Math.min(
						dp[i - 1][j] + 1,
						dp[i][j - 1] + 1),
						dp[i - 1][j - 1] + cost);
			}
		}
		return dp[s1.length()][s2.length()];
	}
}
