package org.javai.reasoning.orchestrate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.javai.reasoning.investigate.FailureReport;
import org.javai.reasoning.investigate.InvestigatorSettings;
import org.javai.reasoning.investigate.QueryFailureInvestigator;
import org.javai.reasoning.query.QueryExecutor;
import org.javai.reasoning.query.QueryResult;
import org.javai.reasoning.schema.EntityReferenceStyle;
import org.javai.reasoning.schema.SchemaCatalog;
import org.javai.reasoning.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Control loop for one entity's extraction run.
 *
 * <p>Every query goes through {@link #executeWithInvestigation}, which investigates failures and
 * retries with an auto-fixable fix up to {@link OrchestratorSettings#maxRetryDepth()} times.
 * {@link #runGapFilling} compares extracted counts with the live counts of every entity-scoped
 * table and requests targeted re-extraction for the shortfalls until coverage is complete, the
 * cycle limit is reached, a cycle makes no progress, or the caller cancels. A run that could not
 * count some table never reports completion.</p>
 *
 * <p>An instance holds per-run state and must not be shared between concurrent runs. The catalog
 * and investigator it is given may be.</p>
 */
public final class ReasoningOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(ReasoningOrchestrator.class);

	/** Error type given to failures raised by the executor itself rather than the engine. */
	static final String EXECUTOR_ERROR_TYPE = "EXECUTOR_ERROR";

	private final SchemaCatalog catalog;
	private final QueryExecutor executor;
	private final QueryFailureInvestigator investigator;
	private final ReportSink reportSink;
	private final ReExtractionCapability reExtraction;
	private final ExtractedDataStore dataStore;
	private final String entityId;
	private final OrchestratorSettings settings;
	private final GapPrioritizer prioritizer;

	private final Map<String, EntityReferenceStyle> confirmedStyles = new LinkedHashMap<>();
	private CoverageAssessment currentAssessment;
	private int querySequence;

	private ReasoningOrchestrator(Builder builder) {
		this.catalog = builder.catalog;
		this.executor = builder.executor;
		this.settings = builder.settings;
		this.investigator = builder.investigator != null
				? builder.investigator
				: new QueryFailureInvestigator(catalog, executor,
						builder.investigatorSettings.withAutoFixThreshold(settings.autoFixThreshold()));
		this.reportSink = builder.reportSink;
		this.reExtraction = builder.reExtraction;
		this.dataStore = builder.dataStore;
		this.entityId = builder.entityId;
		this.prioritizer = new GapPrioritizer(settings.gapPriorities());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Runs a query, investigating each failure and retrying with the proposed fix while the fix is
	 * auto-fixable and the retry depth allows. A timeout is returned at once without investigation.
	 * A failure that cannot be fixed automatically has its report persisted for review.
	 */
	public QueryOutcome executeWithInvestigation(String queryText, String description) {
		String queryId = nextQueryId(description);
		List<QueryAttempt> attempts = new ArrayList<>();
		FailureReport lastReport = null;
		String currentQuery = queryText;

		for (int depth = 0; ; depth++) {
			long start = System.nanoTime();
			QueryResult result = execute(currentQuery);
			long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

			if (result instanceof QueryResult.Rows rows) {
				attempts.add(new QueryAttempt(depth, currentQuery, AttemptOutcome.SUCCESS, durationMillis, null, null));
				if (depth > 0) {
					logger.info("{} succeeded after {} auto-fixed retr{}", queryId, depth, depth == 1 ? "y" : "ies");
				}
				return new QueryOutcome(queryId, description, rows.rows(), lastReport, attempts);
			}
			if (result instanceof QueryResult.TimedOut timedOut) {
				attempts.add(new QueryAttempt(depth, currentQuery, AttemptOutcome.TIMEOUT, durationMillis,
						"Timed out after " + timedOut.after(), null));
				logger.warn("{} timed out after {}; not investigated", queryId, timedOut.after());
				return new QueryOutcome(queryId, description, List.of(), lastReport, attempts);
			}

			QueryResult.Failed failed = (QueryResult.Failed) result;
			AttemptOutcome outcome = EXECUTOR_ERROR_TYPE.equals(failed.errorType())
					? AttemptOutcome.EXECUTOR_ERROR
					: AttemptOutcome.ENGINE_ERROR;
			if (depth >= settings.maxRetryDepth()) {
				attempts.add(new QueryAttempt(depth, currentQuery, outcome, durationMillis, failed.errorText(), null));
				logger.warn("{} still failing at retry depth {}; giving up", queryId, depth);
				if (lastReport != null) {
					persist(lastReport);
				}
				return new QueryOutcome(queryId, description, List.of(), lastReport, attempts);
			}

			String reportId = depth == 0 ? queryId : queryId + "-retry" + depth;
			FailureReport report = investigator.investigate(reportId, currentQuery, failed.errorText());
			attempts.add(new QueryAttempt(depth, currentQuery, outcome, durationMillis, failed.errorText(), report));
			lastReport = report;

			Optional<String> rewritten = report.rewrittenQuery();
			if (report.autoFixable() && rewritten.isPresent() && !rewritten.get().equals(currentQuery)) {
				logger.info("{} failed ({}); applying {} fix with confidence {}", reportId, report.errorKind(),
						report.fixStrategy(), report.confidence());
				currentQuery = rewritten.get();
				continue;
			}
			logger.info("{} failed ({}); fix confidence {} needs manual review", reportId, report.errorKind(),
					report.confidence());
			persist(report);
			return new QueryOutcome(queryId, description, List.of(), report, attempts);
		}
	}

	/**
	 * Queries the live count of every entity-scoped table and compares it with
	 * {@code extractedCounts}. Tables missing from {@code extractedCounts} count as nothing
	 * extracted.
	 */
	public CoverageAssessment assessCompleteness(Map<String, Long> extractedCounts) {
		currentAssessment = assess(queryRawCounts(), extractedCounts);
		return currentAssessment;
	}

	/**
	 * Requests re-extraction for the highest-priority gaps, at most {@code maxGapsPerCycle} of them,
	 * and merges every value found into the data store.
	 *
	 * @return number of gaps resolved
	 */
	public int attemptGapFilling(CoverageAssessment assessment, int maxGapsPerCycle) {
		return fillGaps(assessment, maxGapsPerCycle).size();
	}

	/**
	 * Runs assessment and gap-filling cycles until no gaps remain, the cycle limit is reached,
	 * a cycle resolves nothing, or {@code cancelled} returns true at a cycle boundary. Live counts
	 * are queried once, and each resolved gap adds one extracted record, so coverage never
	 * decreases within a run. The final assessment is recorded with the report sink.
	 */
	public GapFillingResult runGapFilling(Map<String, Long> extractedCounts, BooleanSupplier cancelled) {
		Map<String, Long> raw = queryRawCounts();
		Map<String, Long> extracted = new LinkedHashMap<>();
		if (extractedCounts != null) {
			extractedCounts.forEach((table, count) -> extracted.put(table.toLowerCase(Locale.ROOT), count));
		}
		List<CoverageAssessment> assessments = new ArrayList<>();
		List<Double> coverage = new ArrayList<>();
		CoverageAssessment assessment = assess(raw, extracted);
		assessments.add(assessment);
		coverage.add(assessment.coveragePct());

		int cycles = 0;
		int resolvedTotal = 0;
		GapFillingTermination termination;
		while (true) {
			if (assessment.gaps().isEmpty()) {
				termination = assessment.hasUnassessedTables()
						? GapFillingTermination.UNASSESSED
						: GapFillingTermination.COMPLETE;
				break;
			}
			if (cycles >= settings.maxCycles()) {
				termination = GapFillingTermination.MAX_CYCLES;
				break;
			}
			if (cancelled != null && cancelled.getAsBoolean()) {
				termination = GapFillingTermination.CANCELLED;
				break;
			}
			cycles++;
			List<CoverageGap> resolved = fillGaps(assessment, settings.maxGapsPerCycle());
			for (CoverageGap gap : resolved) {
				extracted.merge(gap.table().toLowerCase(Locale.ROOT), 1L, Long::sum);
			}
			resolvedTotal += resolved.size();
			assessment = assess(raw, extracted);
			assessments.add(assessment);
			coverage.add(assessment.coveragePct());
			logger.info("Gap-filling cycle {} for {}: resolved {}, coverage {}%", cycles, entityId, resolved.size(),
					String.format(Locale.ROOT, "%.1f", assessment.coveragePct()));
			if (resolved.isEmpty()) {
				termination = GapFillingTermination.NO_PROGRESS;
				break;
			}
		}

		currentAssessment = assessment;
		if (!assessment.isComplete()) {
			logger.warn("Gap filling for {} stopped ({}) with {} unresolved gap(s) and {} unassessed table(s)",
					entityId, termination, assessment.gaps().size(), assessment.unassessedTables().size());
		}
		try {
			reportSink.recordCoverage(assessment);
		} catch (RuntimeException e) {
			logger.warn("Could not record coverage report for {}: {}", entityId, e.getMessage());
		}
		return new GapFillingResult(termination, cycles, resolvedTotal, assessments, coverage);
	}

	/**
	 * Samples the entity-reference column of {@code table} and remembers the observed reference
	 * style for later count queries.
	 */
	public Optional<EntityReferenceStyle> confirmReferenceStyle(String table) {
		Optional<TableSchema> schema = catalog.table(table).filter(TableSchema::isEntityScoped);
		if (schema.isEmpty()) {
			return Optional.empty();
		}
		String column = schema.get().entityReferenceColumn().orElseThrow();
		Optional<String> sampleQuery = catalog.generateSampleQuery(schema.get().name(), column);
		if (sampleQuery.isEmpty()) {
			return Optional.empty();
		}
		QueryOutcome outcome = executeWithInvestigation(sampleQuery.get(), "sample " + schema.get().name());
		if (!outcome.succeeded()) {
			return Optional.empty();
		}
		List<String> values = outcome.rows().stream()
				.flatMap(row -> row.values().stream())
				.filter(Objects::nonNull)
				.toList();
		Optional<EntityReferenceStyle> style = catalog.confirmReferenceStyle(schema.get().name(), values);
		style.ifPresent(s -> confirmedStyles.put(schema.get().name().toLowerCase(Locale.ROOT), s));
		return style;
	}

	/**
	 * The latest assessment of this run, if any.
	 */
	public Optional<CoverageAssessment> currentAssessment() {
		return Optional.ofNullable(currentAssessment);
	}

	public String entityId() {
		return entityId;
	}

	public OrchestratorSettings settings() {
		return settings;
	}

	private Map<String, Long> queryRawCounts() {
		Map<String, Long> counts = new LinkedHashMap<>();
		for (TableSchema table : catalog.findEntityScopedTables()) {
			EntityReferenceStyle style = confirmedStyles.getOrDefault(table.name().toLowerCase(Locale.ROOT),
					table.entityReferenceStyle());
			Optional<String> countQuery = catalog.generateCountQuery(table.name(), entityId, style);
			if (countQuery.isEmpty()) {
				continue;
			}
			QueryOutcome outcome = executeWithInvestigation(countQuery.get(), "count " + table.name());
			Optional<Long> count = outcome.succeeded() ? parseCount(outcome.rows()) : Optional.empty();
			if (count.isPresent()) {
				counts.put(table.name().toLowerCase(Locale.ROOT), count.get());
			} else {
				logger.warn("No count for {}; table left unassessed", table.name());
				counts.put(table.name().toLowerCase(Locale.ROOT), null);
			}
		}
		return counts;
	}

	private static Optional<Long> parseCount(List<Map<String, String>> rows) {
		if (rows.isEmpty()) {
			return Optional.empty();
		}
		Map<String, String> row = rows.get(0);
		if (row == null || row.isEmpty()) {
			return Optional.empty();
		}
		String value = row.containsKey("count") ? row.get("count") : row.values().iterator().next();
		if (value == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(Long.parseLong(value.trim()));
		} catch (NumberFormatException e) {
			logger.warn("Count result '{}' is not a number", value);
			return Optional.empty();
		}
	}

	private CoverageAssessment assess(Map<String, Long> rawCounts, Map<String, Long> extractedCounts) {
		Map<String, Long> extracted = new LinkedHashMap<>();
		if (extractedCounts != null) {
			extractedCounts.forEach((table, count) -> extracted.put(table.toLowerCase(Locale.ROOT), count));
		}
		Map<String, TableCoverage> perTable = new LinkedHashMap<>();
		List<String> unassessed = new ArrayList<>();
		List<CoverageGap> gaps = new ArrayList<>();
		for (Map.Entry<String, Long> entry : rawCounts.entrySet()) {
			String table = catalog.table(entry.getKey()).map(TableSchema::name).orElse(entry.getKey());
			if (entry.getValue() == null) {
				unassessed.add(table);
				continue;
			}
			long extractedCount = Math.max(0, extracted.getOrDefault(entry.getKey(), 0L));
			TableCoverage coverage = new TableCoverage(table, entry.getValue(), extractedCount);
			perTable.put(table, coverage);
			if (coverage.rawCount() > 0 && coverage.missingCount() > 0) {
				GapPrioritizer.Ranking ranking = prioritizer.rank(table);
				gaps.add(new CoverageGap(table, ranking.field(), eventReference(table), ranking.priority(),
						coverage.missingCount()));
			}
		}
		gaps.sort(prioritizer.order());
		double coveragePct = perTable.isEmpty() && !unassessed.isEmpty()
				? 0.0
				: CoverageAssessment.coveragePct(perTable.values());
		return new CoverageAssessment(entityId, perTable, coveragePct, gaps, unassessed, null);
	}

	private List<CoverageGap> fillGaps(CoverageAssessment assessment, int maxGapsPerCycle) {
		List<CoverageGap> resolved = new ArrayList<>();
		List<CoverageGap> selected = assessment.gaps().stream().limit(Math.max(0, maxGapsPerCycle)).toList();
		for (CoverageGap gap : selected) {
			Optional<String> value;
			try {
				value = reExtraction.reExtract(gap);
			} catch (RuntimeException e) {
				logger.warn("Re-extraction for {} ({}) failed: {}", gap.table(), gap.field(), e.getMessage());
				continue;
			}
			if (value.isEmpty()) {
				logger.debug("Re-extraction for {} ({}) found nothing", gap.table(), gap.field());
				continue;
			}
			try {
				dataStore.merge(gap, value.get());
				resolved.add(gap);
			} catch (RuntimeException e) {
				logger.warn("Merging re-extracted value for {} failed: {}", gap.table(), e.getMessage());
			}
		}
		return resolved;
	}

	private String eventReference(String table) {
		String prefix = catalog.referencePatterns().prefix();
		String column = catalog.table(table).flatMap(TableSchema::entityReferenceColumn).orElse("entity");
		return "%s?%s=%s%s".formatted(table, column, prefix, entityId);
	}

	private QueryResult execute(String queryText) {
		try {
			QueryResult result = executor.execute(queryText, settings.queryTimeout());
			return result != null ? result : QueryResult.failed(EXECUTOR_ERROR_TYPE, "executor returned no result");
		} catch (RuntimeException e) {
			logger.warn("Query executor threw: {}", e.getMessage());
			return QueryResult.failed(EXECUTOR_ERROR_TYPE, String.valueOf(e.getMessage()));
		}
	}

	private void persist(FailureReport report) {
		try {
			reportSink.recordFailure(report);
		} catch (RuntimeException e) {
			logger.warn("Could not persist failure report {}: {}", report.queryId(), e.getMessage());
		}
	}

	private String nextQueryId(String description) {
		querySequence++;
		String slug = description == null ? "" : description.toLowerCase(Locale.ROOT)
				.replaceAll("[^a-z0-9]+", "-")
				.replaceAll("(^-+|-+$)", "");
		return "%s-%03d".formatted(slug.isEmpty() ? "query" : slug, querySequence);
	}

	public static final class Builder {
		private SchemaCatalog catalog;
		private QueryExecutor executor;
		private QueryFailureInvestigator investigator;
		private InvestigatorSettings investigatorSettings = InvestigatorSettings.defaults();
		private ReportSink reportSink = ReportSink.discarding();
		private ReExtractionCapability reExtraction = gap -> Optional.empty();
		private ExtractedDataStore dataStore = (gap, value) -> {
		};
		private String entityId;
		private OrchestratorSettings settings = OrchestratorSettings.defaults();

		private Builder() {
		}

		public Builder catalog(SchemaCatalog catalog) {
			this.catalog = catalog;
			return this;
		}

		public Builder executor(QueryExecutor executor) {
			this.executor = executor;
			return this;
		}

		/**
		 * Uses a pre-built investigator instead of one created from the catalog and executor. Its
		 * auto-fix threshold must equal the orchestrator's.
		 */
		public Builder investigator(QueryFailureInvestigator investigator) {
			this.investigator = investigator;
			return this;
		}

		public Builder investigatorSettings(InvestigatorSettings investigatorSettings) {
			if (investigatorSettings != null) {
				this.investigatorSettings = investigatorSettings;
			}
			return this;
		}

		public Builder reportSink(ReportSink reportSink) {
			if (reportSink != null) {
				this.reportSink = reportSink;
			}
			return this;
		}

		public Builder reExtraction(ReExtractionCapability reExtraction) {
			if (reExtraction != null) {
				this.reExtraction = reExtraction;
			}
			return this;
		}

		public Builder dataStore(ExtractedDataStore dataStore) {
			if (dataStore != null) {
				this.dataStore = dataStore;
			}
			return this;
		}

		public Builder entityId(String entityId) {
			this.entityId = entityId;
			return this;
		}

		public Builder settings(OrchestratorSettings settings) {
			if (settings != null) {
				this.settings = settings;
			}
			return this;
		}

		public Builder autoFixThreshold(double threshold) {
			this.settings = settings.withAutoFixThreshold(threshold);
			return this;
		}

		public ReasoningOrchestrator build() {
			if (catalog == null) {
				throw new IllegalStateException("A schema catalog is required");
			}
			if (executor == null) {
				throw new IllegalStateException("A query executor is required");
			}
			if (entityId == null || entityId.isBlank()) {
				throw new IllegalStateException("An entity id is required");
			}
			if (investigator != null
					&& Double.compare(investigator.settings().autoFixThreshold(), settings.autoFixThreshold()) != 0) {
				throw new IllegalStateException("Investigator auto-fix threshold %s differs from the orchestrator's %s"
						.formatted(investigator.settings().autoFixThreshold(), settings.autoFixThreshold()));
			}
			return new ReasoningOrchestrator(this);
		}
	}
}
