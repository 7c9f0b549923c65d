package org.javai.reasoning.investigate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexical analysis of a failed query: alias-to-table map, function calls wrapping a qualified
 * column, and every qualified column reference.
 *
 * <p>This is not a SQL parser. It handles the flat SELECT shapes the pipeline generates. The alias
 * map comes from JSqlParser when the statement parses as a plain SELECT and from a FROM/JOIN scan
 * otherwise. Subqueries and multi-statement batches are reported as unresolvable.</p>
 */
public class QueryFieldResolver {

	private static final Logger logger = LoggerFactory.getLogger(QueryFieldResolver.class);

	private static final Pattern SUBQUERY = Pattern.compile("\\(\\s*select\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern FUNCTION_CALL = Pattern.compile(
			"\\b([A-Za-z_]\\w*)\\s*\\(\\s*([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*)\\b");
	private static final Pattern COLUMN_REFERENCE = Pattern.compile(
			"\\b([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*)\\b");
	private static final Pattern FROM_OR_JOIN = Pattern.compile(
			"\\b(?:FROM|JOIN)\\s+([\\w.\"]+)(?:\\s+(?:AS\\s+)?([A-Za-z_]\\w*))?", Pattern.CASE_INSENSITIVE);
	private static final Pattern FORMAT_ARGUMENT = Pattern.compile(",\\s*'([^']*)'");

	private static final Set<String> KEYWORDS = Set.of(
			"select", "from", "where", "join", "on", "and", "or", "not", "in", "exists", "when", "then",
			"else", "case", "as", "by", "using", "values", "left", "right", "inner", "outer", "full", "cross",
			"natural", "group", "order", "limit", "union", "having", "offset", "lateral", "with");

	/**
	 * A function call whose first argument is a qualified column reference.
	 *
	 * @param function lower-cased function name
	 * @param expression exact call text, including the closing parenthesis
	 * @param formatLiteral second argument when it is a string literal, else null
	 */
	public record FunctionCall(String function, String alias, String column, String expression,
			String formatLiteral) {
	}

	public record ColumnReference(String alias, String column) {
	}

	/**
	 * @param aliasToTable lower-cased alias (and table name) to unqualified table name
	 * @param unresolvableReason why the query shape is out of reach, or null when it was analysed
	 */
	public record ResolvedQuery(Map<String, String> aliasToTable, List<FunctionCall> functionCalls,
			List<ColumnReference> columnReferences, String unresolvableReason) {

		public ResolvedQuery {
			aliasToTable = aliasToTable != null ? Map.copyOf(aliasToTable) : Map.of();
			functionCalls = functionCalls != null ? List.copyOf(functionCalls) : List.of();
			columnReferences = columnReferences != null ? List.copyOf(columnReferences) : List.of();
		}

		static ResolvedQuery unresolvable(String reason) {
			return new ResolvedQuery(Map.of(), List.of(), List.of(), reason);
		}

		public boolean isResolvable() {
			return unresolvableReason == null;
		}

		public Optional<String> tableFor(String alias) {
			if (alias == null) {
				return Optional.empty();
			}
			return Optional.ofNullable(aliasToTable.get(alias.toLowerCase(Locale.ROOT)));
		}
	}

	public ResolvedQuery resolve(String queryText) {
		if (queryText == null || queryText.isBlank()) {
			return ResolvedQuery.unresolvable("empty query");
		}
		String masked = maskLiterals(queryText);
		if (statementCount(masked) > 1) {
			return ResolvedQuery.unresolvable("multi-statement batch");
		}
		if (SUBQUERY.matcher(masked).find()) {
			return ResolvedQuery.unresolvable("subquery");
		}

		Map<String, String> aliases = aliasesFromParser(queryText)
				.orElseGet(() -> aliasesFromText(masked));

		List<FunctionCall> calls = new ArrayList<>();
		Matcher call = FUNCTION_CALL.matcher(masked);
		while (call.find()) {
			String function = call.group(1).toLowerCase(Locale.ROOT);
			if (KEYWORDS.contains(function) || !aliases.containsKey(call.group(2).toLowerCase(Locale.ROOT))) {
				continue;
			}
			int open = masked.indexOf('(', call.start(1) + call.group(1).length());
			int close = closingParenthesis(masked, open);
			if (close < 0) {
				continue;
			}
			String expression = queryText.substring(call.start(), close + 1);
			Matcher format = FORMAT_ARGUMENT.matcher(expression);
			calls.add(new FunctionCall(function, call.group(2), call.group(3), expression,
					format.find() ? format.group(1) : null));
		}

		List<ColumnReference> references = new ArrayList<>();
		Matcher reference = COLUMN_REFERENCE.matcher(masked);
		while (reference.find()) {
			if (aliases.containsKey(reference.group(1).toLowerCase(Locale.ROOT))) {
				ColumnReference ref = new ColumnReference(reference.group(1), reference.group(2));
				if (!references.contains(ref)) {
					references.add(ref);
				}
			}
		}
		return new ResolvedQuery(aliases, calls, references, null);
	}

	private Optional<Map<String, String>> aliasesFromParser(String queryText) {
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(queryText);
		} catch (JSQLParserException | RuntimeException e) {
			logger.debug("Query did not parse, falling back to FROM/JOIN scan: {}", e.getMessage());
			return Optional.empty();
		}
		if (!(statement instanceof PlainSelect plainSelect)) {
			return Optional.empty();
		}
		Map<String, String> aliases = new LinkedHashMap<>();
		register(plainSelect.getFromItem(), aliases);
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				register(join.getRightItem(), aliases);
			}
		}
		return aliases.isEmpty() ? Optional.empty() : Optional.of(aliases);
	}

	private static void register(FromItem item, Map<String, String> aliases) {
		if (item instanceof Table table) {
			String name = unquote(table.getName());
			aliases.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
			if (table.getAlias() != null && table.getAlias().getName() != null) {
				aliases.put(unquote(table.getAlias().getName()).toLowerCase(Locale.ROOT), name);
			}
		}
	}

	private static Map<String, String> aliasesFromText(String masked) {
		Map<String, String> aliases = new LinkedHashMap<>();
		Matcher matcher = FROM_OR_JOIN.matcher(masked);
		while (matcher.find()) {
			String qualified = unquote(matcher.group(1));
			String name = qualified.substring(qualified.lastIndexOf('.') + 1);
			if (name.isEmpty()) {
				continue;
			}
			aliases.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
			String alias = matcher.group(2);
			if (alias != null && !KEYWORDS.contains(alias.toLowerCase(Locale.ROOT))) {
				aliases.put(alias.toLowerCase(Locale.ROOT), name);
			}
		}
		return aliases;
	}

	/**
	 * Replaces the content of single-quoted literals with spaces, keeping every index stable.
	 */
	static String maskLiterals(String text) {
		StringBuilder out = new StringBuilder(text.length());
		boolean inLiteral = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\'') {
				inLiteral = !inLiteral;
				out.append(c);
			} else {
				out.append(inLiteral ? ' ' : c);
			}
		}
		return out.toString();
	}

	private static int statementCount(String masked) {
		int count = 0;
		for (String segment : masked.split(";")) {
			if (!segment.isBlank()) {
				count++;
			}
		}
		return count;
	}

	private static int closingParenthesis(String masked, int open) {
		if (open < 0) {
			return -1;
		}
		int depth = 0;
		for (int i = open; i < masked.length(); i++) {
			char c = masked.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	private static String unquote(String name) {
		return name.replace("\"", "").replace("`", "");
	}
}
