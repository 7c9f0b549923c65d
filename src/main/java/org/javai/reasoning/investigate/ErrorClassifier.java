package org.javai.reasoning.investigate;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.reasoning.query.ErrorKind;

/**
 * Classifies engine error text and pulls out the details the engine echoes back: the offending
 * literal, the unresolved column, the failing function and the argument type it expected.
 *
 * <p>Rules are tried in order and the first match wins. Unknown-column patterns come before the
 * generic syntax pattern because some engines report unresolved columns as syntax errors.</p>
 */
public class ErrorClassifier {

	private record Rule(ErrorKind kind, Pattern pattern) {
	}

	private static final List<Rule> RULES = List.of(
			new Rule(ErrorKind.DATE_FORMAT_MISMATCH, Pattern.compile(
					"invalid format:|is too short|is malformed at|cannot parse .*(date|time)"
							+ "|invalid (date|time|timestamp)|INVALID_FUNCTION_ARGUMENT.*(date|time|format)",
					Pattern.CASE_INSENSITIVE)),
			new Rule(ErrorKind.UNKNOWN_COLUMN, Pattern.compile(
					"COLUMN_NOT_FOUND|column '[^']+' cannot be resolved|unknown column"
							+ "|column \"?[\\w.]+\"? does not exist",
					Pattern.CASE_INSENSITIVE)),
			new Rule(ErrorKind.TYPE_MISMATCH, Pattern.compile(
					"TYPE_MISMATCH|unexpected parameters \\(|cannot be applied to|type mismatch",
					Pattern.CASE_INSENSITIVE)),
			new Rule(ErrorKind.SYNTAX_ERROR, Pattern.compile(
					"SYNTAX_ERROR|mismatched input|syntax error",
					Pattern.CASE_INSENSITIVE)));

	private static final List<Pattern> LITERAL_PATTERNS = List.of(
			Pattern.compile("Invalid format: [\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
			Pattern.compile("[\"']([^\"']+)[\"'] is (?:too short|malformed)", Pattern.CASE_INSENSITIVE),
			Pattern.compile("cannot parse [\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE));

	private static final Pattern COLUMN_PATTERN = Pattern.compile(
			"column [\"']([\\w.]+)[\"']|unknown column [\"']?([\\w.]+)[\"']?",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern FUNCTION_PATTERN = Pattern.compile(
			"for function (\\w+)|function (\\w+)\\s*\\(", Pattern.CASE_INSENSITIVE);

	private static final Pattern EXPECTED_TYPE_PATTERN = Pattern.compile(
			"Expected: \\w+\\(\\s*([a-z ]+?)\\s*(?:\\(|,|\\))", Pattern.CASE_INSENSITIVE);

	public ErrorKind classify(String errorText) {
		if (errorText == null || errorText.isBlank()) {
			return ErrorKind.UNCLASSIFIED;
		}
		for (Rule rule : RULES) {
			if (rule.pattern().matcher(errorText).find()) {
				return rule.kind();
			}
		}
		return ErrorKind.UNCLASSIFIED;
	}

	/**
	 * The value the engine failed on, e.g. {@code 2018-08-07} from
	 * {@code Invalid format: "2018-08-07" is too short}.
	 */
	public Optional<String> offendingLiteral(String errorText) {
		return firstGroup(LITERAL_PATTERNS, errorText);
	}

	/**
	 * The column the engine could not resolve, as written (possibly alias-qualified).
	 */
	public Optional<String> offendingColumn(String errorText) {
		return firstGroup(List.of(COLUMN_PATTERN), errorText);
	}

	/**
	 * The function the engine names as the failure site.
	 */
	public Optional<String> failingFunction(String errorText) {
		return firstGroup(List.of(FUNCTION_PATTERN), errorText).map(f -> f.toLowerCase(Locale.ROOT));
	}

	/**
	 * First argument type from an {@code Expected: fn(varchar(x), ...)} echo, upper-cased.
	 */
	public Optional<String> expectedArgumentType(String errorText) {
		return firstGroup(List.of(EXPECTED_TYPE_PATTERN), errorText)
				.map(t -> t.trim().toUpperCase(Locale.ROOT));
	}

	private static Optional<String> firstGroup(List<Pattern> patterns, String text) {
		if (text == null) {
			return Optional.empty();
		}
		for (Pattern pattern : patterns) {
			Matcher matcher = pattern.matcher(text);
			if (matcher.find()) {
				for (int i = 1; i <= matcher.groupCount(); i++) {
					if (matcher.group(i) != null) {
						return Optional.of(matcher.group(i));
					}
				}
			}
		}
		return Optional.empty();
	}
}
