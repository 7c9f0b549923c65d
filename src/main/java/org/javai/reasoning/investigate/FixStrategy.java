package org.javai.reasoning.investigate;

/**
 * How a proposed fix was derived. Each strategy carries its own base confidence in
 * {@link ConfidenceScorer}.
 */
public enum FixStrategy {
	/** Samples show several date shapes; the fix tries each of them in turn. */
	MULTI_FORMAT_DATE,
	/** Samples show one shape that differs from the format the query assumed. */
	SINGLE_FORMAT_DATE,
	/** No samples; shapes come from the query's own format string and the literal in the error. */
	LITERAL_DERIVED_DATE,
	/** Wrap the implicated column in a cast to the type the function expects. */
	EXPLICIT_CAST,
	/** Replace an unknown column with the nearest existing column name. */
	COLUMN_SUGGESTION,
	NONE;

	boolean usesSamples() {
		return this == MULTI_FORMAT_DATE || this == SINGLE_FORMAT_DATE;
	}

	boolean isDateFix() {
		return usesSamples() || this == LITERAL_DERIVED_DATE;
	}
}
