package org.javai.reasoning.orchestrate;

/**
 * External store that receives values recovered by re-extraction.
 */
@FunctionalInterface
public interface ExtractedDataStore {

	void merge(CoverageGap gap, String value);
}
