package org.javai.reasoning.investigate;

/**
 * Scores a proposed fix and decides whether it may be applied without review.
 *
 * <p>The base score depends on the fix strategy. Thin samples lower it for strategies that rely on
 * samples, sampled values no known shape accepts lower date fixes, and an ambiguous field
 * resolution lowers it for every strategy. Scores are clamped to [0, 1] and rounded to three
 * decimals before comparing against the threshold.</p>
 *
 * <p>A date fix whose chain cannot parse the value the engine rejected is never auto-fixable: its
 * {@code TRY(...)} parses would turn that value into NULL. Its confidence is capped at the
 * threshold.</p>
 */
public class ConfidenceScorer {

	static final double THIN_SAMPLE_PENALTY = 0.1;
	static final double AMBIGUITY_PENALTY = 0.15;
	static final double UNRECOGNIZED_VALUES_PENALTY = 0.1;
	static final double COLUMN_SUGGESTION_CAP = 0.6;

	private final double autoFixThreshold;
	private final int minSampleSize;

	public ConfidenceScorer(double autoFixThreshold, int minSampleSize) {
		if (Double.isNaN(autoFixThreshold) || autoFixThreshold < 0.0 || autoFixThreshold >= 1.0) {
			throw new IllegalArgumentException("autoFixThreshold must be in [0, 1)");
		}
		this.autoFixThreshold = autoFixThreshold;
		this.minSampleSize = minSampleSize;
	}

	public record Score(double confidence, boolean autoFixable) {
	}

	/**
	 * @param fix the proposed fix, or null when none could be synthesized
	 * @param sampleCount values sampled for the implicated field
	 * @param ambiguous whether more than one field remained an equally likely culprit
	 */
	public Score score(ProposedFix fix, int sampleCount, boolean ambiguous) {
		return score(fix, sampleCount, ambiguous, 0, true);
	}

	/**
	 * @param fix the proposed fix, or null when none could be synthesized
	 * @param sampleCount values sampled for the implicated field
	 * @param ambiguous whether more than one field remained an equally likely culprit
	 * @param unrecognizedCount sampled values that matched no known date shape
	 * @param rejectedValueParsed whether the fix parses the value named in the error text, true when
	 *     the error named none
	 */
	public Score score(ProposedFix fix, int sampleCount, boolean ambiguous, int unrecognizedCount,
			boolean rejectedValueParsed) {
		if (fix == null) {
			return new Score(0.0, false);
		}
		double confidence = base(fix);
		if (fix.strategy().usesSamples() && sampleCount < minSampleSize) {
			confidence -= THIN_SAMPLE_PENALTY;
		}
		if (fix.strategy().isDateFix() && unrecognizedCount > 0) {
			confidence -= UNRECOGNIZED_VALUES_PENALTY;
		}
		if (ambiguous) {
			confidence -= AMBIGUITY_PENALTY;
		}
		confidence = Math.round(Math.max(0.0, Math.min(1.0, confidence)) * 1000.0) / 1000.0;
		if (fix.strategy().isDateFix() && !rejectedValueParsed) {
			return new Score(Math.min(confidence, autoFixThreshold), false);
		}
		return new Score(confidence, confidence > autoFixThreshold);
	}

	public double autoFixThreshold() {
		return autoFixThreshold;
	}

	private static double base(ProposedFix fix) {
		return switch (fix.strategy()) {
			case MULTI_FORMAT_DATE -> 0.95;
			case SINGLE_FORMAT_DATE -> 0.8;
			case EXPLICIT_CAST -> 0.75;
			case LITERAL_DERIVED_DATE -> 0.6;
			case COLUMN_SUGGESTION -> Math.min(COLUMN_SUGGESTION_CAP, COLUMN_SUGGESTION_CAP * fix.similarity());
			case NONE -> 0.0;
		};
	}
}
