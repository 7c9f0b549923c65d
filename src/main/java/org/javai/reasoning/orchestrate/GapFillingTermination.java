package org.javai.reasoning.orchestrate;

/**
 * Why a gap-filling run stopped.
 */
public enum GapFillingTermination {
	/** No gaps remain and every entity-scoped table was counted. */
	COMPLETE,
	/** No gaps remain among the counted tables, but at least one table could not be counted. */
	UNASSESSED,
	/** The cycle limit was reached with gaps remaining. */
	MAX_CYCLES,
	/** A cycle resolved nothing, so further cycles cannot help. */
	NO_PROGRESS,
	/** The caller's cancellation signal was raised between cycles. */
	CANCELLED
}
