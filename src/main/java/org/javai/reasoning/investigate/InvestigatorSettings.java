package org.javai.reasoning.investigate;

import java.time.Duration;

/**
 * Tuning for {@link QueryFailureInvestigator}.
 *
 * @param sampleLimit distinct values fetched per implicated column
 * @param minSampleSize below this many sampled values the sample counts as thin
 * @param autoFixThreshold a fix is auto-fixable only when its confidence is strictly above this
 * @param sampleTimeout timeout handed to the executor for each sampling query
 */
public record InvestigatorSettings(int sampleLimit, int minSampleSize, double autoFixThreshold,
		Duration sampleTimeout) {

	public static final int DEFAULT_SAMPLE_LIMIT = 20;
	public static final int DEFAULT_MIN_SAMPLE_SIZE = 5;
	public static final double DEFAULT_AUTO_FIX_THRESHOLD = 0.9;
	public static final Duration DEFAULT_SAMPLE_TIMEOUT = Duration.ofSeconds(60);

	public InvestigatorSettings {
		if (sampleLimit < 1) {
			throw new IllegalArgumentException("sampleLimit must be >= 1");
		}
		if (minSampleSize < 0) {
			throw new IllegalArgumentException("minSampleSize must be >= 0");
		}
		if (Double.isNaN(autoFixThreshold) || autoFixThreshold < 0.0 || autoFixThreshold >= 1.0) {
			throw new IllegalArgumentException("autoFixThreshold must be in [0, 1)");
		}
		if (sampleTimeout == null || sampleTimeout.isNegative() || sampleTimeout.isZero()) {
			throw new IllegalArgumentException("sampleTimeout must be positive");
		}
	}

	public static InvestigatorSettings defaults() {
		return new InvestigatorSettings(DEFAULT_SAMPLE_LIMIT, DEFAULT_MIN_SAMPLE_SIZE, DEFAULT_AUTO_FIX_THRESHOLD,
				DEFAULT_SAMPLE_TIMEOUT);
	}

	public InvestigatorSettings withAutoFixThreshold(double threshold) {
		return new InvestigatorSettings(sampleLimit, minSampleSize, threshold, sampleTimeout);
	}
}
