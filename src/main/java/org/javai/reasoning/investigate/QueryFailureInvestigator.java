package org.javai.reasoning.investigate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.reasoning.investigate.QueryFieldResolver.ColumnReference;
import org.javai.reasoning.investigate.QueryFieldResolver.FunctionCall;
import org.javai.reasoning.investigate.QueryFieldResolver.ResolvedQuery;
import org.javai.reasoning.query.ErrorKind;
import org.javai.reasoning.query.QueryExecutor;
import org.javai.reasoning.query.QueryResult;
import org.javai.reasoning.schema.ColumnNameMatcher;
import org.javai.reasoning.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnoses a failed query and proposes a confidence-scored fix.
 *
 * <p>The steps are: classify the error text, resolve the implicated fields from the query text,
 * sample the stored values of those fields through the {@link QueryExecutor}, analyse value
 * shapes for date failures, synthesize a fix and score it. A failing sampling query only removes
 * the sample from the report. {@link #investigate} never throws.</p>
 *
 * <p>Instances hold no per-investigation state and can be shared.</p>
 */
public class QueryFailureInvestigator {

	private static final Logger logger = LoggerFactory.getLogger(QueryFailureInvestigator.class);

	private static final Set<String> DATE_FUNCTIONS = Set.of(
			"date_parse", "parse_datetime", "from_iso8601_timestamp", "from_iso8601_date", "date",
			"cast", "try_cast", "to_date", "to_timestamp", "date_format", "format_datetime");

	private final SchemaCatalog catalog;
	private final QueryExecutor executor;
	private final InvestigatorSettings settings;
	private final ErrorClassifier classifier = new ErrorClassifier();
	private final QueryFieldResolver resolver = new QueryFieldResolver();
	private final FormatAnalyzer formatAnalyzer = new FormatAnalyzer();
	private final FixSynthesizer synthesizer = new FixSynthesizer();
	private final ConfidenceScorer scorer;

	public QueryFailureInvestigator(SchemaCatalog catalog, QueryExecutor executor) {
		this(catalog, executor, InvestigatorSettings.defaults());
	}

	public QueryFailureInvestigator(SchemaCatalog catalog, QueryExecutor executor, InvestigatorSettings settings) {
		if (catalog == null || executor == null || settings == null) {
			throw new IllegalArgumentException("catalog, executor and settings are required");
		}
		this.catalog = catalog;
		this.executor = executor;
		this.settings = settings;
		this.scorer = new ConfidenceScorer(settings.autoFixThreshold(), settings.minSampleSize());
	}

	public InvestigatorSettings settings() {
		return settings;
	}

	public FailureReport investigate(String queryId, String queryText, String errorText) {
		ErrorKind kind = classifier.classify(errorText);
		try {
			FailureReport report = doInvestigate(queryId, queryText, errorText, kind);
			logger.info("Investigated {}: kind={}, fields={}, confidence={}, autoFixable={}", queryId,
					report.errorKind(), report.implicatedFields().size(), report.confidence(), report.autoFixable());
			return report;
		} catch (RuntimeException e) {
			logger.warn("Investigation of {} aborted: {}", queryId, e.getMessage(), e);
			return new FailureReport(queryId, queryText, errorText, kind, List.of(), Map.of(), null, null,
					FixStrategy.NONE, null, 0.0, false, "Investigation aborted",
					"Investigation aborted before a fix could be proposed: " + e.getMessage(), null);
		}
	}

	private FailureReport doInvestigate(String queryId, String queryText, String errorText, ErrorKind kind) {
		ResolvedQuery resolved = resolver.resolve(queryText);
		if (!resolved.isResolvable()) {
			return new FailureReport(queryId, queryText, errorText, kind, List.of(), Map.of(), null, null,
					FixStrategy.NONE, null, 0.0, false, describeKind(kind),
					"Query shape not analysed (%s); classified as %s only.".formatted(resolved.unresolvableReason(), kind),
					null);
		}

		String literal = classifier.offendingLiteral(errorText).orElse(null);
		List<ImplicatedField> candidates = candidatesFor(kind, resolved, errorText);

		Map<String, List<String>> samples = new LinkedHashMap<>();
		if (kind == ErrorKind.DATE_FORMAT_MISMATCH || kind == ErrorKind.TYPE_MISMATCH) {
			for (ImplicatedField field : candidates) {
				sample(field).ifPresent(values -> samples.put(field.qualifiedName(), values));
			}
		}

		List<ImplicatedField> ranked = rank(candidates, samples, literal);
		boolean ambiguous = isAmbiguous(ranked, samples, literal);
		ImplicatedField chosen = ranked.isEmpty() ? null : ranked.get(0);

		FormatAnalysis analysis = null;
		ProposedFix fix = null;
		String rootCause = describeKind(kind);
		if (chosen != null) {
			List<String> chosenSamples = samples.getOrDefault(chosen.qualifiedName(), List.of());
			switch (kind) {
				case DATE_FORMAT_MISMATCH -> {
					if (!chosenSamples.isEmpty()) {
						analysis = formatAnalyzer.analyze(chosenSamples);
					}
					fix = synthesizer.dateFix(chosen, analysis, literal).orElse(null);
					rootCause = dateRootCause(chosen, analysis, literal);
				}
				case TYPE_MISMATCH -> {
					String type = classifier.expectedArgumentType(errorText)
							.or(() -> FixSynthesizer.expectedFirstArgumentType(chosen.function()))
							.orElse(FixSynthesizer.FALLBACK_TYPE);
					fix = synthesizer.castFix(chosen, type).orElse(null);
					rootCause = "%s passes %s where %s is expected".formatted(chosen.function(),
							chosen.qualifiedName(), type);
				}
				case UNKNOWN_COLUMN -> {
					Optional<ColumnNameMatcher.Suggestion> suggestion = chosen.isTableResolved()
							? catalog.suggestColumn(chosen.table(), chosen.column())
							: Optional.empty();
					fix = suggestion.flatMap(s -> synthesizer.columnFix(chosen, s)).orElse(null);
					rootCause = "Column %s does not exist in %s".formatted(chosen.column(),
							chosen.isTableResolved() ? chosen.table() : "the referenced table");
				}
				default -> {
				}
			}
		}

		int sampleCount = chosen != null ? samples.getOrDefault(chosen.qualifiedName(), List.of()).size() : 0;
		int unrecognized = analysis != null ? analysis.unrecognizedCount() : 0;
		boolean rejectedValueParsed = parsesRejectedValue(fix, literal);
		ConfidenceScorer.Score score = scorer.score(fix, sampleCount, ambiguous, unrecognized, rejectedValueParsed);
		return new FailureReport(queryId, queryText, errorText, kind, ranked, samples, analysis,
				fix != null ? fix.replacement() : null,
				fix != null ? fix.strategy() : FixStrategy.NONE,
				fix != null ? fix.target() : null,
				score.confidence(), score.autoFixable(), rootCause,
				explain(kind, ranked, samples, analysis, fix, score, ambiguous, rejectedValueParsed ? null : literal),
				null);
	}

	private static boolean parsesRejectedValue(ProposedFix fix, String literal) {
		if (fix == null || literal == null || fix.shapes().isEmpty()) {
			return true;
		}
		return DateFallbackChain.of(fix.shapes()).parse(literal).isPresent();
	}

	private List<ImplicatedField> candidatesFor(ErrorKind kind, ResolvedQuery resolved, String errorText) {
		List<ImplicatedField> fields = new ArrayList<>();
		switch (kind) {
			case DATE_FORMAT_MISMATCH -> {
				for (FunctionCall call : resolved.functionCalls()) {
					if (DATE_FUNCTIONS.contains(call.function())) {
						fields.add(fromCall(call, resolved));
					}
				}
			}
			case TYPE_MISMATCH -> {
				Optional<String> function = classifier.failingFunction(errorText);
				for (FunctionCall call : resolved.functionCalls()) {
					if (function.isEmpty() || function.get().equals(call.function())) {
						fields.add(fromCall(call, resolved));
					}
				}
			}
			case UNKNOWN_COLUMN -> classifier.offendingColumn(errorText)
					.ifPresent(column -> unknownColumnField(column, resolved).ifPresent(fields::add));
			default -> {
			}
		}
		return dedupe(fields);
	}

	private Optional<ImplicatedField> unknownColumnField(String offending, ResolvedQuery resolved) {
		int dot = offending.lastIndexOf('.');
		String alias = dot > 0 ? offending.substring(0, dot) : null;
		String column = dot > 0 ? offending.substring(dot + 1) : offending;
		for (ColumnReference reference : resolved.columnReferences()) {
			boolean aliasMatches = alias == null || reference.alias().equalsIgnoreCase(alias);
			if (aliasMatches && reference.column().equalsIgnoreCase(column)) {
				String table = resolved.tableFor(reference.alias()).orElse(null);
				return Optional.of(new ImplicatedField(reference.alias(), table, reference.column(), null,
						reference.alias() + "." + reference.column(), null));
			}
		}
		Set<String> tables = new LinkedHashSet<>(resolved.aliasToTable().values());
		if (alias == null && tables.size() == 1) {
			return Optional.of(new ImplicatedField(null, tables.iterator().next(), column, null, column, null));
		}
		return Optional.empty();
	}

	private static ImplicatedField fromCall(FunctionCall call, ResolvedQuery resolved) {
		return new ImplicatedField(call.alias(), resolved.tableFor(call.alias()).orElse(null), call.column(),
				call.function(), call.expression(), call.formatLiteral());
	}

	private static List<ImplicatedField> dedupe(List<ImplicatedField> fields) {
		Map<String, ImplicatedField> unique = new LinkedHashMap<>();
		for (ImplicatedField field : fields) {
			unique.putIfAbsent(field.expression(), field);
		}
		return List.copyOf(unique.values());
	}

	private Optional<List<String>> sample(ImplicatedField field) {
		if (!field.isTableResolved()) {
			return Optional.empty();
		}
		Optional<String> sampleQuery = catalog.generateSampleQuery(field.table(), field.column(),
				settings.sampleLimit());
		if (sampleQuery.isEmpty()) {
			logger.debug("No sample query for {}.{}", field.table(), field.column());
			return Optional.empty();
		}
		QueryResult result;
		try {
			result = executor.execute(sampleQuery.get(), settings.sampleTimeout());
		} catch (RuntimeException e) {
			logger.warn("Sampling {} threw, continuing without samples: {}", field.qualifiedName(), e.getMessage());
			return Optional.empty();
		}
		if (result instanceof QueryResult.Rows rows) {
			List<String> values = new ArrayList<>();
			for (Map<String, String> row : rows.rows()) {
				String value = valueOf(row, field.column());
				if (value != null && !values.contains(value)) {
					values.add(value);
				}
			}
			logger.debug("Sampled {} distinct values for {}", values.size(), field.qualifiedName());
			return Optional.of(values);
		}
		if (result instanceof QueryResult.Failed failed) {
			logger.warn("Sampling {} failed, continuing without samples: {}", field.qualifiedName(), failed.errorText());
		} else {
			logger.warn("Sampling {} timed out, continuing without samples", field.qualifiedName());
		}
		return Optional.empty();
	}

	private static String valueOf(Map<String, String> row, String column) {
		for (Map.Entry<String, String> entry : row.entrySet()) {
			if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(column)) {
				return entry.getValue();
			}
		}
		return row.size() == 1 ? row.values().iterator().next() : null;
	}

	/**
	 * Fields whose samples contain the offending literal move to the front.
	 */
	private static List<ImplicatedField> rank(List<ImplicatedField> candidates, Map<String, List<String>> samples,
			String literal) {
		if (literal == null || candidates.size() < 2) {
			return candidates;
		}
		List<ImplicatedField> ranked = new ArrayList<>();
		List<ImplicatedField> rest = new ArrayList<>();
		for (ImplicatedField field : candidates) {
			if (samples.getOrDefault(field.qualifiedName(), List.of()).contains(literal)) {
				ranked.add(field);
			} else {
				rest.add(field);
			}
		}
		ranked.addAll(rest);
		return ranked;
	}

	private static boolean isAmbiguous(List<ImplicatedField> ranked, Map<String, List<String>> samples,
			String literal) {
		if (ranked.size() < 2) {
			return false;
		}
		if (literal == null) {
			return true;
		}
		long holdingLiteral = ranked.stream()
				.filter(f -> samples.getOrDefault(f.qualifiedName(), List.of()).contains(literal))
				.count();
		return holdingLiteral != 1;
	}

	private static String dateRootCause(ImplicatedField field, FormatAnalysis analysis, String literal) {
		String where = field.isTableResolved() ? field.table() + "." + field.column() : field.qualifiedName();
		if (analysis != null && analysis.hasMultipleFormats()) {
			return "Column %s stores %d date formats (%s)".formatted(where, analysis.detectedFormats().size(),
					analysis.detectedFormats().stream().map(DateShape::tag).collect(Collectors.joining(", ")));
		}
		if (literal != null) {
			return "Column %s holds '%s', which the format in %s does not accept".formatted(where, literal,
					field.function());
		}
		return "Column %s holds values %s cannot parse".formatted(where, field.function());
	}

	private static String describeKind(ErrorKind kind) {
		return switch (kind) {
			case DATE_FORMAT_MISMATCH -> "Date value does not match the expected format";
			case TYPE_MISMATCH -> "Function argument has the wrong type";
			case UNKNOWN_COLUMN -> "Query references a column that does not exist";
			case SYNTAX_ERROR -> "Query has a syntax error";
			case TIMEOUT -> "Query timed out";
			case UNCLASSIFIED -> "Unrecognised error";
		};
	}

	private static String explain(ErrorKind kind, List<ImplicatedField> fields, Map<String, List<String>> samples,
			FormatAnalysis analysis, ProposedFix fix, ConfidenceScorer.Score score, boolean ambiguous,
			String unparsedLiteral) {
		StringBuilder sb = new StringBuilder();
		sb.append("Classified as ").append(kind.name().toLowerCase(Locale.ROOT)).append(". ");
		if (fields.isEmpty()) {
			sb.append("No implicated field could be resolved from the query. ");
		} else {
			sb.append("Implicated: ")
					.append(fields.stream().map(ImplicatedField::qualifiedName).collect(Collectors.joining(", ")))
					.append(ambiguous ? " (ambiguous). " : ". ");
		}
		if (!fields.isEmpty() && (kind == ErrorKind.DATE_FORMAT_MISMATCH || kind == ErrorKind.TYPE_MISMATCH)) {
			if (samples.isEmpty()) {
				sb.append("Investigated, no sample available. ");
			} else {
				sb.append("Sampled ").append(samples.values().stream().mapToInt(List::size).sum())
						.append(" distinct values. ");
			}
		}
		if (analysis != null) {
			sb.append("Detected formats: ")
					.append(analysis.detectedFormats().stream().map(DateShape::tag).collect(Collectors.joining(", ")))
					.append(". ");
		}
		if (analysis != null && analysis.unrecognizedCount() > 0) {
			sb.append(analysis.unrecognizedCount()).append(" sampled value(s) match no known date format. ");
		}
		if (unparsedLiteral != null) {
			sb.append("The proposed chain cannot parse the rejected value '").append(unparsedLiteral)
					.append("', which it would turn into NULL. ");
		}
		if (fix == null) {
			sb.append("No fix proposed; manual review required.");
		} else {
			sb.append("Proposed ").append(fix.strategy().name().toLowerCase(Locale.ROOT).replace('_', ' '))
					.append(" fix with confidence ").append(score.confidence())
					.append(score.autoFixable() ? "; safe to apply automatically." : "; manual review required.");
		}
		return sb.toString();
	}
}
