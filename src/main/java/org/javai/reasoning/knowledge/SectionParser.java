package org.javai.reasoning.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the lines of one reference-document section into rules of a single variant.
 *
 * <p>Any structural problem fails the whole section with a {@link KnowledgeParseException} naming
 * the section and the offending row, so a reformatted section is rejected rather than half read.</p>
 */
abstract class SectionParser<T extends KnowledgeRule> {

	abstract KnowledgeSection section();

	abstract String[] requiredColumns();

	abstract T parseRow(Map<String, String> row);

	List<T> parse(List<String> lines) {
		PipeTable table;
		try {
			table = PipeTable.parse(lines);
			table.requireColumns(requiredColumns());
		} catch (IllegalArgumentException e) {
			throw new KnowledgeParseException(section(),
					"Section '%s' is malformed: %s".formatted(section().heading(), e.getMessage()), e);
		}
		List<T> rules = new ArrayList<>();
		int rowNumber = 0;
		for (Map<String, String> row : table.rows()) {
			rowNumber++;
			try {
				rules.add(parseRow(row));
			} catch (IllegalArgumentException e) {
				throw new KnowledgeParseException(section(),
						"Section '%s' row %d: %s".formatted(section().heading(), rowNumber, e.getMessage()), e);
			}
		}
		if (rules.isEmpty()) {
			throw new KnowledgeParseException(section(), "Section '%s' has no rows".formatted(section().heading()));
		}
		return rules;
	}
}
