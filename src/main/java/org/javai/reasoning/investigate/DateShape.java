package org.javai.reasoning.investigate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Canonical shapes of stored date/time strings, declared from most to least specific.
 *
 * <p>Each shape knows the SQL expression that parses it on the query engine and an equivalent
 * in-process parser, so a fallback chain built from shapes can be evaluated locally.</p>
 */
public enum DateShape {

	ISO_FRACTIONAL_ZONED("YYYY-MM-DDTHH:MM:SS.fff+HH:MM",
			"^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{1,9}(Z|[+-]\\d{2}:\\d{2})$",
			null,
			v -> OffsetDateTime.parse(v).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime()),

	ISO_OFFSET("YYYY-MM-DDTHH:MM:SS+HH:MM",
			"^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}[+-]\\d{2}:\\d{2}$",
			null,
			v -> OffsetDateTime.parse(v).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime()),

	ISO_ZULU("YYYY-MM-DDTHH:MM:SSZ",
			"^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z$",
			"%Y-%m-%dT%H:%i:%sZ",
			v -> LocalDateTime.parse(v, DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'"))),

	ISO_FRACTIONAL("YYYY-MM-DDTHH:MM:SS.fff",
			"^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{1,6}$",
			"%Y-%m-%dT%H:%i:%s.%f",
			v -> LocalDateTime.parse(v, DateTimeFormatter.ISO_LOCAL_DATE_TIME)),

	ISO_LOCAL("YYYY-MM-DDTHH:MM:SS",
			"^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}$",
			"%Y-%m-%dT%H:%i:%s",
			v -> LocalDateTime.parse(v, DateTimeFormatter.ISO_LOCAL_DATE_TIME)),

	SPACE_SEPARATED("YYYY-MM-DD HH:MM:SS",
			"^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}$",
			"%Y-%m-%d %H:%i:%s",
			v -> LocalDateTime.parse(v, DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss"))),

	DATE_ONLY("YYYY-MM-DD",
			"^\\d{4}-\\d{2}-\\d{2}$",
			"%Y-%m-%d",
			v -> LocalDate.parse(v).atStartOfDay()),

	YEAR_MONTH("YYYY-MM",
			"^\\d{4}-\\d{2}$",
			"%Y-%m",
			v -> YearMonth.parse(v).atDay(1).atStartOfDay()),

	US_DATE("MM/DD/YYYY",
			"^\\d{2}/\\d{2}/\\d{4}$",
			"%m/%d/%Y",
			v -> LocalDate.parse(v, DateTimeFormatter.ofPattern("MM/dd/uuuu")).atStartOfDay());

	private final String tag;
	private final Pattern pattern;
	private final String sqlFormat;
	private final Function<String, LocalDateTime> parser;

	DateShape(String tag, String regex, String sqlFormat, Function<String, LocalDateTime> parser) {
		this.tag = tag;
		this.pattern = Pattern.compile(regex);
		this.sqlFormat = sqlFormat;
		this.parser = parser;
	}

	/**
	 * Human-readable canonical tag, e.g. {@code YYYY-MM-DD}.
	 */
	public String tag() {
		return tag;
	}

	/**
	 * Engine format string for {@code date_parse}, or empty for shapes parsed as ISO-8601 with offset.
	 */
	public Optional<String> sqlFormat() {
		return Optional.ofNullable(sqlFormat);
	}

	public boolean matches(String value) {
		return value != null && pattern.matcher(value.trim()).matches();
	}

	/**
	 * SQL expression that parses {@code fieldExpression} in this shape, yielding a timestamp or
	 * failing. Callers wrap it in {@code TRY(...)} to make it non-throwing.
	 */
	public String sqlParseExpression(String fieldExpression) {
		if (sqlFormat == null) {
			return "CAST(from_iso8601_timestamp(%s) AS TIMESTAMP)".formatted(fieldExpression);
		}
		return "date_parse(%s, '%s')".formatted(fieldExpression, sqlFormat);
	}

	/**
	 * Parses a value of this shape in-process, mirroring what {@link #sqlParseExpression} does on
	 * the engine. Values of any other shape yield empty.
	 */
	public Optional<LocalDateTime> parse(String value) {
		if (!matches(value)) {
			return Optional.empty();
		}
		try {
			return Optional.of(parser.apply(value.trim()));
		} catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	/**
	 * The most specific shape matching the value.
	 */
	public static Optional<DateShape> classify(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		for (DateShape shape : values()) {
			if (shape.matches(value)) {
				return Optional.of(shape);
			}
		}
		return Optional.empty();
	}

	/**
	 * The shape whose engine format string equals {@code format}.
	 */
	public static Optional<DateShape> forSqlFormat(String format) {
		if (format == null) {
			return Optional.empty();
		}
		for (DateShape shape : values()) {
			if (format.equals(shape.sqlFormat)) {
				return Optional.of(shape);
			}
		}
		return Optional.empty();
	}
}
