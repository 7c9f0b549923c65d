package org.javai.reasoning.investigate;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.reasoning.schema.ColumnNameMatcher;

/**
 * Builds replacement SQL for the three fixable failure kinds: date format mismatch, type mismatch
 * and unknown column.
 */
public class FixSynthesizer {

	/**
	 * Type each function expects for its first argument, used when the engine does not echo it.
	 */
	private static final Map<String, String> FIRST_ARGUMENT_TYPES = Map.ofEntries(
			Map.entry("date_parse", "VARCHAR"),
			Map.entry("parse_datetime", "VARCHAR"),
			Map.entry("from_iso8601_timestamp", "VARCHAR"),
			Map.entry("from_iso8601_date", "VARCHAR"),
			Map.entry("date_format", "TIMESTAMP"),
			Map.entry("format_datetime", "TIMESTAMP"),
			Map.entry("to_unixtime", "TIMESTAMP"),
			Map.entry("year", "TIMESTAMP"),
			Map.entry("month", "TIMESTAMP"),
			Map.entry("day", "TIMESTAMP"),
			Map.entry("length", "VARCHAR"),
			Map.entry("lower", "VARCHAR"),
			Map.entry("upper", "VARCHAR"),
			Map.entry("trim", "VARCHAR"),
			Map.entry("substr", "VARCHAR"),
			Map.entry("regexp_like", "VARCHAR"),
			Map.entry("split", "VARCHAR"),
			Map.entry("abs", "DOUBLE"),
			Map.entry("round", "DOUBLE"),
			Map.entry("ceil", "DOUBLE"),
			Map.entry("floor", "DOUBLE"));

	static final String FALLBACK_TYPE = "VARCHAR";

	public static Optional<String> expectedFirstArgumentType(String function) {
		if (function == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(FIRST_ARGUMENT_TYPES.get(function.toLowerCase(Locale.ROOT)));
	}

	/**
	 * Replaces the date-parsing call around {@code field} with a fallback chain over every shape in
	 * evidence: shapes found in the samples, the shape the query's format string describes, and the
	 * shape of the literal the engine rejected.
	 *
	 * @param analysis format analysis of the sampled values, or null when nothing was sampled
	 * @param offendingLiteral value echoed in the error text, or null
	 */
	public Optional<ProposedFix> dateFix(ImplicatedField field, FormatAnalysis analysis, String offendingLiteral) {
		Set<DateShape> shapes = EnumSet.noneOf(DateShape.class);
		boolean sampled = analysis != null && !analysis.detectedFormats().isEmpty();
		if (sampled) {
			shapes.addAll(analysis.detectedFormats());
		}
		DateShape.forSqlFormat(field.formatLiteral()).ifPresent(shapes::add);
		DateShape.classify(offendingLiteral).ifPresent(shapes::add);
		if (shapes.isEmpty()) {
			return Optional.empty();
		}

		FixStrategy strategy;
		if (sampled && analysis.hasMultipleFormats()) {
			strategy = FixStrategy.MULTI_FORMAT_DATE;
		} else if (sampled) {
			strategy = FixStrategy.SINGLE_FORMAT_DATE;
		} else {
			strategy = FixStrategy.LITERAL_DERIVED_DATE;
		}
		DateFallbackChain chain = DateFallbackChain.of(shapes);
		return Optional.of(new ProposedFix(strategy, field.expression(), chain.toSql(field.qualifiedName()),
				chain.shapes(), 1.0));
	}

	/**
	 * Wraps the first argument of the call around {@code field} in {@code CAST(... AS type)}.
	 */
	public Optional<ProposedFix> castFix(ImplicatedField field, String targetType) {
		if (field.function() == null || targetType == null || targetType.isBlank()) {
			return Optional.empty();
		}
		String expression = field.expression();
		Matcher argument = Pattern.compile("\\(\\s*(" + Pattern.quote(field.qualifiedName()) + ")\\b")
				.matcher(expression);
		if (!argument.find()) {
			return Optional.empty();
		}
		String cast = "CAST(%s AS %s)".formatted(field.qualifiedName(), targetType.toUpperCase(Locale.ROOT));
		String replacement = expression.substring(0, argument.start(1)) + cast + expression.substring(argument.end(1));
		return Optional.of(new ProposedFix(FixStrategy.EXPLICIT_CAST, expression, replacement, List.of(), 1.0));
	}

	/**
	 * Renames an unknown column reference to the nearest existing column.
	 */
	public Optional<ProposedFix> columnFix(ImplicatedField field, ColumnNameMatcher.Suggestion suggestion) {
		if (suggestion == null) {
			return Optional.empty();
		}
		String replacement = field.alias() != null
				? field.alias() + "." + suggestion.column()
				: suggestion.column();
		return Optional.of(new ProposedFix(FixStrategy.COLUMN_SUGGESTION, field.qualifiedName(), replacement,
				List.of(), suggestion.similarity()));
	}
}
