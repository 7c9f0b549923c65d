package org.javai.reasoning.investigate;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.reasoning.query.ErrorKind;

/**
 * Diagnosis of one failed query. Immutable once returned by the investigator.
 *
 * @param queryId caller-supplied identifier, also used to name the persisted report
 * @param queryText the query as it failed
 * @param errorText raw engine error text
 * @param errorKind classified failure kind
 * @param implicatedFields columns held responsible, most likely first
 * @param sampleValues distinct raw values sampled per implicated field, keyed by {@code alias.column}
 * @param formatAnalysis shape analysis of the sampled values (date failures only, may be null)
 * @param proposedFix SQL replacing {@code fixTarget}, or null
 * @param fixStrategy how the fix was derived
 * @param fixTarget expression in {@code queryText} that {@code proposedFix} replaces, or null
 * @param confidence fix confidence in [0, 1]; 0 when there is no fix
 * @param autoFixable whether the fix may be applied without review
 * @param rootCause one-line cause
 * @param explanation human-readable account of the investigation
 * @param createdAt when the report was produced
 */
public record FailureReport(
		String queryId,
		String queryText,
		String errorText,
		ErrorKind errorKind,
		List<ImplicatedField> implicatedFields,
		Map<String, List<String>> sampleValues,
		FormatAnalysis formatAnalysis,
		String proposedFix,
		FixStrategy fixStrategy,
		String fixTarget,
		double confidence,
		boolean autoFixable,
		String rootCause,
		String explanation,
		Instant createdAt
) {

	public FailureReport {
		if (queryId == null || queryId.isBlank()) {
			throw new IllegalArgumentException("queryId must not be blank");
		}
		if (errorKind == null) {
			throw new IllegalArgumentException("errorKind must not be null");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be in [0, 1]");
		}
		if (autoFixable && proposedFix == null) {
			throw new IllegalArgumentException("a report without a fix cannot be auto-fixable");
		}
		implicatedFields = implicatedFields != null ? List.copyOf(implicatedFields) : List.of();
		Map<String, List<String>> samples = new LinkedHashMap<>();
		if (sampleValues != null) {
			sampleValues.forEach((field, values) -> samples.put(field, List.copyOf(values)));
		}
		sampleValues = Collections.unmodifiableMap(samples);
		fixStrategy = fixStrategy != null ? fixStrategy : FixStrategy.NONE;
		createdAt = createdAt != null ? createdAt : Instant.now();
	}

	public boolean hasFix() {
		return proposedFix != null && fixTarget != null;
	}

	/**
	 * The failing query with {@code fixTarget} replaced by {@code proposedFix}.
	 */
	public Optional<String> rewrittenQuery() {
		if (!hasFix() || queryText == null) {
			return Optional.empty();
		}
		Matcher matcher = Pattern.compile("(?<![\\w.])" + Pattern.quote(fixTarget) + "(?!\\w)").matcher(queryText);
		if (!matcher.find()) {
			return Optional.empty();
		}
		return Optional.of(matcher.replaceAll(Matcher.quoteReplacement(proposedFix)));
	}

	public int sampleCount() {
		return sampleValues.values().stream().mapToInt(List::size).sum();
	}
}
