package org.javai.reasoning.orchestrate;

import java.time.Duration;
import java.util.List;

/**
 * Limits and ranking for {@link ReasoningOrchestrator}.
 *
 * @param maxRetryDepth how many auto-fixed retries one query may get
 * @param maxCycles upper bound on gap-filling cycles per run
 * @param maxGapsPerCycle re-extraction requests per cycle
 * @param queryTimeout timeout handed to the executor for every query
 * @param autoFixThreshold a fix is applied automatically only when its confidence is strictly above this
 * @param gapPriorities ordered priority rules; the first match wins
 */
public record OrchestratorSettings(int maxRetryDepth, int maxCycles, int maxGapsPerCycle, Duration queryTimeout,
		double autoFixThreshold, List<GapPriorityRule> gapPriorities) {

	public static final int DEFAULT_MAX_RETRY_DEPTH = 2;
	public static final int DEFAULT_MAX_CYCLES = 5;
	public static final int DEFAULT_MAX_GAPS_PER_CYCLE = 10;
	public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(300);
	public static final double DEFAULT_AUTO_FIX_THRESHOLD = 0.9;

	public static final List<GapPriorityRule> DEFAULT_GAP_PRIORITIES = List.of(
			new GapPriorityRule("condition", "diagnosis", GapPriority.HIGHEST),
			new GapPriorityRule("procedure", "extent_of_resection", GapPriority.HIGHEST),
			new GapPriorityRule("radiation_*", "total_dose_cgy", GapPriority.HIGHEST),
			new GapPriorityRule("medication_request", "protocol_name", GapPriority.HIGH),
			new GapPriorityRule("observation", "molecular_marker", GapPriority.HIGH),
			new GapPriorityRule("diagnostic_report", "report_conclusion", GapPriority.MEDIUM),
			new GapPriorityRule("imaging_study", "imaging_modality", GapPriority.MEDIUM));

	public OrchestratorSettings {
		if (maxRetryDepth < 0) {
			throw new IllegalArgumentException("maxRetryDepth must be >= 0");
		}
		if (maxCycles < 1) {
			throw new IllegalArgumentException("maxCycles must be >= 1");
		}
		if (maxGapsPerCycle < 1) {
			throw new IllegalArgumentException("maxGapsPerCycle must be >= 1");
		}
		if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
			throw new IllegalArgumentException("queryTimeout must be positive");
		}
		if (Double.isNaN(autoFixThreshold) || autoFixThreshold < 0.0 || autoFixThreshold >= 1.0) {
			throw new IllegalArgumentException("autoFixThreshold must be in [0, 1)");
		}
		gapPriorities = gapPriorities != null ? List.copyOf(gapPriorities) : List.of();
	}

	public static OrchestratorSettings defaults() {
		return new OrchestratorSettings(DEFAULT_MAX_RETRY_DEPTH, DEFAULT_MAX_CYCLES, DEFAULT_MAX_GAPS_PER_CYCLE,
				DEFAULT_QUERY_TIMEOUT, DEFAULT_AUTO_FIX_THRESHOLD, DEFAULT_GAP_PRIORITIES);
	}

	public OrchestratorSettings withAutoFixThreshold(double threshold) {
		return new OrchestratorSettings(maxRetryDepth, maxCycles, maxGapsPerCycle, queryTimeout, threshold,
				gapPriorities);
	}
}
