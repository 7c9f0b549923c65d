package org.javai.reasoning.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.javai.reasoning.investigate.FailureReport;
import org.javai.reasoning.orchestrate.CoverageAssessment;
import org.javai.reasoning.orchestrate.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each report as a JSON file for human review.
 *
 * <p>Failure reports go to {@code <dir>/<queryId>.json}; coverage reports to
 * {@code <dir>/coverage-<entity>-<yyyyMMdd'T'HHmmss'Z'>.json}. The directory is created on first
 * write. File names are reduced to letters, digits, dot, dash and underscore.</p>
 */
public class JsonFileReportSink implements ReportSink {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileReportSink.class);

	private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
			.withZone(ZoneOffset.UTC);

	private final Path directory;
	private final ObjectMapper mapper = ReportJson.mapper();
	private final List<Path> written = new ArrayList<>();

	public JsonFileReportSink(Path directory) {
		if (directory == null) {
			throw new IllegalArgumentException("directory must not be null");
		}
		this.directory = directory;
	}

	@Override
	public void recordFailure(FailureReport report) {
		Path file = directory.resolve(safeFileName(report.queryId()) + ".json");
		write(file, report);
		logger.info("Failure report for {} written to {}", report.queryId(), file);
	}

	@Override
	public void recordCoverage(CoverageAssessment assessment) {
		String name = "coverage-%s-%s.json".formatted(safeFileName(assessment.entityId()),
				FILE_TIMESTAMP.format(assessment.assessedAt()));
		Path file = directory.resolve(name);
		write(file, assessment);
		logger.info("Coverage report for {} written to {} ({} gaps)", assessment.entityId(), file,
				assessment.gaps().size());
	}

	/**
	 * Files written so far, in order.
	 */
	public List<Path> writtenFiles() {
		return List.copyOf(written);
	}

	public Path directory() {
		return directory;
	}

	private void write(Path file, Object report) {
		try {
			Files.createDirectories(directory);
			mapper.writeValue(file.toFile(), report);
			written.add(file);
		} catch (IOException e) {
			throw new ReportWriteException("Failed to write report " + file, e);
		}
	}

	static String safeFileName(String name) {
		if (name == null || name.isBlank()) {
			return "unnamed";
		}
		return name.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
	}
}
