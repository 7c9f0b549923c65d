package org.javai.reasoning.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.javai.reasoning.investigate.FailureReport;
import org.javai.reasoning.investigate.FixStrategy;
import org.javai.reasoning.investigate.ImplicatedField;
import org.javai.reasoning.orchestrate.CoverageAssessment;
import org.javai.reasoning.orchestrate.CoverageGap;
import org.javai.reasoning.orchestrate.GapPriority;
import org.javai.reasoning.orchestrate.TableCoverage;
import org.javai.reasoning.query.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Report sinks")
class JsonFileReportSinkTest {

	private static final Instant ASSESSED_AT = Instant.parse("2026-03-04T05:06:07Z");

	private static FailureReport report(String queryId) {
		return new FailureReport(queryId, "SELECT date_parse(e.period_start, '%Y') FROM encounter e",
				"INVALID_FUNCTION_ARGUMENT: Invalid format: \"2018-08-07\" is too short",
				ErrorKind.DATE_FORMAT_MISMATCH,
				List.of(new ImplicatedField("e", "encounter", "period_start", "date_parse",
						"date_parse(e.period_start, '%Y')", "%Y")),
				Map.of("e.period_start", List.of("2018-08-07")),
				null, null, FixStrategy.NONE, null, 0.0, false,
				"Stored values do not match the format", "No fix proposed.", ASSESSED_AT);
	}

	private static CoverageAssessment assessment() {
		return new CoverageAssessment("abc/123",
				Map.of("procedure", new TableCoverage("procedure", 4, 1)),
				25.0,
				List.of(new CoverageGap("procedure", "extent_of_resection", "procedure?subject_reference=Patient/abc/123",
						GapPriority.HIGHEST, 3)),
				List.of("condition"),
				ASSESSED_AT);
	}

	@Nested
	@DisplayName("JSON files")
	class JsonFiles {

		@Test
		@DisplayName("Writes a failure report named after its query id")
		void writesFailureReport(@TempDir Path dir) throws IOException {
			JsonFileReportSink sink = new JsonFileReportSink(dir.resolve("reports"));

			sink.recordFailure(report("encounter-starts-001"));

			Path file = dir.resolve("reports").resolve("encounter-starts-001.json");
			assertThat(sink.writtenFiles()).containsExactly(file);
			JsonNode json = ReportJson.mapper().readTree(file.toFile());
			assertThat(json.get("queryId").asText()).isEqualTo("encounter-starts-001");
			assertThat(json.get("errorKind").asText()).isEqualTo("DATE_FORMAT_MISMATCH");
			assertThat(json.get("sampleValues").get("e.period_start").get(0).asText()).isEqualTo("2018-08-07");
			assertThat(json.get("createdAt").asText()).isEqualTo("2026-03-04T05:06:07Z");
		}

		@Test
		@DisplayName("Writes a coverage report named after entity and time")
		void writesCoverageReport(@TempDir Path dir) throws IOException {
			JsonFileReportSink sink = new JsonFileReportSink(dir);

			sink.recordCoverage(assessment());

			Path file = dir.resolve("coverage-abc_123-20260304T050607Z.json");
			assertThat(file).exists();
			JsonNode json = ReportJson.mapper().readTree(file.toFile());
			assertThat(json.get("coveragePct").asDouble()).isEqualTo(25.0);
			assertThat(json.get("gaps").get(0).get("priority").asText()).isEqualTo("HIGHEST");
			assertThat(json.get("unassessedTables").get(0).asText()).isEqualTo("condition");
		}

		@Test
		@DisplayName("Reduces names to safe file names")
		void safeFileNames() {
			assertThat(JsonFileReportSink.safeFileName("a/b c?.json")).isEqualTo("a_b_c_.json");
			assertThat(JsonFileReportSink.safeFileName(" ")).isEqualTo("unnamed");
			assertThat(JsonFileReportSink.safeFileName(null)).isEqualTo("unnamed");
		}

		@Test
		@DisplayName("Fails with a report write exception when the directory cannot be created")
		void writeFailure(@TempDir Path dir) throws IOException {
			Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");
			JsonFileReportSink sink = new JsonFileReportSink(blocker.resolve("reports"));

			assertThatThrownBy(() -> sink.recordFailure(report("q-1")))
					.isInstanceOf(ReportWriteException.class)
					.hasMessageContaining("q-1.json");
		}
	}

	@Nested
	@DisplayName("In memory")
	class InMemory {

		@Test
		@DisplayName("Keeps reports until cleared")
		void keepsReports() {
			InMemoryReportSink sink = new InMemoryReportSink();

			sink.recordFailure(report("q-1"));
			sink.recordFailure(report("q-2"));
			sink.recordCoverage(assessment());

			assertThat(sink.failures()).extracting(FailureReport::queryId).containsExactly("q-1", "q-2");
			assertThat(sink.failure("q-2")).isPresent();
			assertThat(sink.failure("q-3")).isEmpty();
			assertThat(sink.coverageReports()).hasSize(1);

			sink.clear();

			assertThat(sink.failures()).isEmpty();
			assertThat(sink.coverageReports()).isEmpty();
		}
	}
}
