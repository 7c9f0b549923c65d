package org.javai.reasoning.investigate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.time.Duration;
import java.util.List;
import org.javai.reasoning.query.ErrorKind;
import org.javai.reasoning.query.QueryExecutor;
import org.javai.reasoning.query.QueryResult;
import org.javai.reasoning.schema.SchemaCatalog;
import org.javai.reasoning.testsupport.ScriptedQueryExecutor;
import org.javai.reasoning.testsupport.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueryFailureInvestigator")
class QueryFailureInvestigatorTest {

	private static final String DATE_QUERY = "SELECT e.id, date_parse(e.period_start, '%Y-%m-%dT%H:%i:%sZ') AS started "
			+ "FROM encounter e WHERE e.subject_reference = 'Patient/abc123'";
	private static final String DATE_ERROR =
			"INVALID_FUNCTION_ARGUMENT: Invalid format: \"2018-08-07\" is too short";

	private final SchemaCatalog catalog = TestCatalogs.fhir();

	private static QueryResult periodStarts(String... values) {
		return ScriptedQueryExecutor.column("period_start", values);
	}

	@Nested
	@DisplayName("Date format mismatches")
	class DateFormatMismatch {

		@Test
		@DisplayName("Detects mixed stored formats and proposes a chain that parses all of them")
		void mixedFormats() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT period_start", periodStarts("2018-08-07", "2018-08-07T10:30:00Z"));
			QueryFailureInvestigator investigator = new QueryFailureInvestigator(catalog, executor);

			FailureReport report = investigator.investigate("q-001", DATE_QUERY, DATE_ERROR);

			assertThat(report.errorKind()).isEqualTo(ErrorKind.DATE_FORMAT_MISMATCH);
			assertThat(report.implicatedFields()).extracting(ImplicatedField::qualifiedName)
					.containsExactly("e.period_start");
			assertThat(report.implicatedFields().get(0).table()).isEqualTo("encounter");
			assertThat(report.sampleValues()).containsKey("e.period_start");
			assertThat(report.formatAnalysis().hasMultipleFormats()).isTrue();
			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.MULTI_FORMAT_DATE);
			assertThat(report.fixTarget()).isEqualTo("date_parse(e.period_start, '%Y-%m-%dT%H:%i:%sZ')");

			DateFallbackChain chain = DateFallbackChain.of(report.formatAnalysis().detectedFormats());
			assertThat(chain.parse("2018-08-07")).isPresent();
			assertThat(chain.parse("2018-08-07T10:30:00Z")).isPresent();
			assertThat(report.proposedFix()).isEqualTo(chain.toSql("e.period_start"));
		}

		@Test
		@DisplayName("Scores a thin sample below the default threshold")
		void thinSampleNeedsReview() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT period_start", periodStarts("2018-08-07", "2018-08-07T10:30:00Z"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor)
					.investigate("q-001", DATE_QUERY, DATE_ERROR);

			assertThat(report.confidence()).isEqualTo(0.85);
			assertThat(report.autoFixable()).isFalse();
			assertThat(report.explanation()).contains("manual review required");
		}

		@Test
		@DisplayName("Auto-fixes a well-sampled multi-format column and rewrites the query")
		void wellSampledIsAutoFixable() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT period_start", periodStarts("2018-08-07", "2018-09-01", "2019-01-15",
							"2018-08-07T10:30:00Z", "2020-02-02T08:00:00Z", "2021-03-03T09:15:00Z"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor)
					.investigate("q-001", DATE_QUERY, DATE_ERROR);

			assertThat(report.confidence()).isEqualTo(0.95);
			assertThat(report.autoFixable()).isTrue();
			assertThat(report.rewrittenQuery()).hasValueSatisfying(q -> assertThat(q)
					.startsWith("SELECT e.id, COALESCE(")
					.contains("TRY(date_parse(e.period_start, '%Y-%m-%d'))")
					.endsWith("AS started FROM encounter e WHERE e.subject_reference = 'Patient/abc123'"));
		}

		@Test
		@DisplayName("Does not auto-fix when the chain would null out the rejected value")
		void unparsableRejectedValue() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT period_start", periodStarts("2018-08-07", "2018-09-01", "2019-01-15",
							"2018-08-07T10:30:00Z", "2020-02-02T08:00:00Z", "2018/08/07"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor).investigate("q-001", DATE_QUERY,
					"INVALID_FUNCTION_ARGUMENT: Invalid format: \"2018/08/07\" is malformed at \"/08/07\"");

			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.MULTI_FORMAT_DATE);
			assertThat(report.formatAnalysis().unrecognizedCount()).isEqualTo(1);
			assertThat(DateFallbackChain.of(report.formatAnalysis().detectedFormats()).parse("2018/08/07")).isEmpty();
			assertThat(report.confidence()).isEqualTo(0.85);
			assertThat(report.autoFixable()).isFalse();
			assertThat(report.explanation())
					.contains("1 sampled value(s) match no known date format")
					.contains("cannot parse the rejected value '2018/08/07'");
		}

		@Test
		@DisplayName("Puts the field whose samples hold the rejected literal first")
		void ranksByLiteral() {
			String query = "SELECT date_parse(e.period_start, '%Y-%m-%dT%H:%i:%sZ'), "
					+ "date_parse(e.period_end, '%Y-%m-%dT%H:%i:%sZ') FROM encounter e";
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT period_start", periodStarts("2018-08-07T10:30:00Z"))
					.on("DISTINCT period_end", ScriptedQueryExecutor.column("period_end",
							"2018-08-07", "2018-08-09T10:30:00Z"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor)
					.investigate("q-002", query, DATE_ERROR);

			assertThat(report.implicatedFields()).extracting(ImplicatedField::column)
					.containsExactly("period_end", "period_start");
			assertThat(report.fixTarget()).startsWith("date_parse(e.period_end");
		}

		@Test
		@DisplayName("Lowers confidence when no sample singles out a field")
		void ambiguousFields() {
			String query = "SELECT date_parse(e.period_start, '%Y-%m-%d'), "
					+ "date_parse(e.period_end, '%Y-%m-%d') FROM encounter e";
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.otherwise(QueryResult.failed("ACCESS_DENIED", "no"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor)
					.investigate("q-003", query, "Invalid format: \"08/07/2018\" is malformed at \"/07/2018\"");

			assertThat(report.implicatedFields()).hasSize(2);
			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.LITERAL_DERIVED_DATE);
			assertThat(report.confidence()).isEqualTo(0.45);
			assertThat(report.explanation()).contains("(ambiguous)");
		}
	}

	@Nested
	@DisplayName("Sampling failures")
	class SamplingFailures {

		@Test
		@DisplayName("Continues without samples when the sampling query fails")
		void samplingFails() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.otherwise(QueryResult.failed("ACCESS_DENIED", "Access Denied"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor)
					.investigate("q-004", DATE_QUERY, DATE_ERROR);

			assertThat(report.sampleValues()).isEmpty();
			assertThat(report.formatAnalysis()).isNull();
			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.LITERAL_DERIVED_DATE);
			assertThat(report.confidence()).isEqualTo(0.6);
			assertThat(report.explanation()).contains("Investigated, no sample available.");
		}

		@Test
		@DisplayName("Continues without samples when the executor throws or times out")
		void executorThrowsOrTimesOut() {
			QueryExecutor throwing = mock(QueryExecutor.class);
			when(throwing.execute(anyString(), any(Duration.class))).thenThrow(new IllegalStateException("down"));
			QueryExecutor slow = (query, timeout) -> QueryResult.timedOut(timeout);

			FailureReport afterThrow = new QueryFailureInvestigator(catalog, throwing)
					.investigate("q-005", DATE_QUERY, DATE_ERROR);
			FailureReport afterTimeout = new QueryFailureInvestigator(catalog, slow)
					.investigate("q-006", DATE_QUERY, DATE_ERROR);

			assertThat(afterThrow.explanation()).contains("Investigated, no sample available.");
			assertThat(afterTimeout.explanation()).contains("Investigated, no sample available.");
			assertThat(afterThrow.hasFix()).isTrue();
		}

		@Test
		@DisplayName("Hands the configured limit and timeout to the sampling query")
		void usesSettings() {
			QueryExecutor executor = mock(QueryExecutor.class);
			when(executor.execute(anyString(), any(Duration.class))).thenReturn(periodStarts("2018-08-07"));
			InvestigatorSettings settings = new InvestigatorSettings(7, 1, 0.9, Duration.ofSeconds(3));

			new QueryFailureInvestigator(catalog, executor, settings).investigate("q-007", DATE_QUERY, DATE_ERROR);

			verify(executor).execute(
					"SELECT DISTINCT period_start FROM encounter WHERE period_start IS NOT NULL LIMIT 7",
					Duration.ofSeconds(3));
		}
	}

	@Nested
	@DisplayName("Other failure kinds")
	class OtherKinds {

		@Test
		@DisplayName("Casts the argument of a mistyped function call")
		void typeMismatch() {
			ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
					.on("DISTINCT value_string", ScriptedQueryExecutor.column("value_string", "12.5", "7"));

			FailureReport report = new QueryFailureInvestigator(catalog, executor).investigate("q-010",
					"SELECT abs(o.value_string) FROM observation o",
					"TYPE_MISMATCH: line 1:8: Unexpected parameters (varchar) for function abs. "
							+ "Expected: abs(double), abs(bigint)");

			assertThat(report.errorKind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.EXPLICIT_CAST);
			assertThat(report.proposedFix()).isEqualTo("abs(CAST(o.value_string AS DOUBLE))");
			assertThat(report.confidence()).isEqualTo(0.75);
			assertThat(report.rewrittenQuery()).contains("SELECT abs(CAST(o.value_string AS DOUBLE)) FROM observation o");
		}

		@Test
		@DisplayName("Suggests the nearest column for an unknown one without sampling")
		void unknownColumn() {
			QueryExecutor executor = mock(QueryExecutor.class);

			FailureReport report = new QueryFailureInvestigator(catalog, executor).investigate("q-011",
					"SELECT e.perod_start FROM encounter e",
					"COLUMN_NOT_FOUND: line 1:8: Column 'e.perod_start' cannot be resolved");

			assertThat(report.errorKind()).isEqualTo(ErrorKind.UNKNOWN_COLUMN);
			assertThat(report.fixStrategy()).isEqualTo(FixStrategy.COLUMN_SUGGESTION);
			assertThat(report.rewrittenQuery()).contains("SELECT e.period_start FROM encounter e");
			assertThat(report.confidence()).isLessThanOrEqualTo(0.6);
			assertThat(report.autoFixable()).isFalse();
			verify(executor, never()).execute(anyString(), any(Duration.class));
		}

		@Test
		@DisplayName("Reports an unclassified error without a fix")
		void unclassified() {
			FailureReport report = new QueryFailureInvestigator(catalog, new ScriptedQueryExecutor())
					.investigate("q-012", "SELECT e.id FROM encounter e", "Something went sideways");

			assertThat(report.errorKind()).isEqualTo(ErrorKind.UNCLASSIFIED);
			assertThat(report.hasFix()).isFalse();
			assertThat(report.confidence()).isZero();
			assertThat(report.autoFixable()).isFalse();
		}

		@Test
		@DisplayName("Classifies but does not analyse a subquery")
		void subquery() {
			FailureReport report = new QueryFailureInvestigator(catalog, new ScriptedQueryExecutor())
					.investigate("q-013", "SELECT s.d FROM (SELECT date_parse(e.period_start, '%Y') d FROM encounter e) s",
							DATE_ERROR);

			assertThat(report.errorKind()).isEqualTo(ErrorKind.DATE_FORMAT_MISMATCH);
			assertThat(report.implicatedFields()).isEmpty();
			assertThat(report.explanation()).contains("subquery");
		}
	}

	@Test
	@DisplayName("A report is auto-fixable exactly when its confidence exceeds the threshold")
	void autoFixableMatchesThreshold() {
		ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
				.on("DISTINCT period_start", periodStarts("2018-08-07", "2018-08-07T10:30:00Z"))
				.on("DISTINCT value_string", ScriptedQueryExecutor.column("value_string", "1"));
		List<String[]> failures = List.of(
				new String[] { DATE_QUERY, DATE_ERROR },
				new String[] { "SELECT abs(o.value_string) FROM observation o",
						"Unexpected parameters (varchar) for function abs" },
				new String[] { "SELECT e.perod_start FROM encounter e", "Column 'e.perod_start' cannot be resolved" },
				new String[] { "SELECT 1", "boom" });

		for (double threshold : new double[] { 0.0, 0.5, 0.75, 0.85, 0.9 }) {
			InvestigatorSettings settings = InvestigatorSettings.defaults().withAutoFixThreshold(threshold);
			QueryFailureInvestigator investigator = new QueryFailureInvestigator(catalog, executor, settings);
			for (String[] failure : failures) {
				FailureReport report = investigator.investigate("q-100", failure[0], failure[1]);
				assertThat(report.autoFixable())
						.as("threshold %s, query %s", threshold, failure[0])
						.isEqualTo(report.hasFix() && report.confidence() > threshold);
			}
		}
	}
}
