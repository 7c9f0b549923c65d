package org.javai.reasoning.orchestrate;

import java.util.Optional;

/**
 * External capability that retries extraction for one gap, e.g. by retrieving source documents
 * and prompting an extraction model.
 */
@FunctionalInterface
public interface ReExtractionCapability {

	/**
	 * @return the extracted value, or empty when nothing was found
	 */
	Optional<String> reExtract(CoverageGap gap);
}
