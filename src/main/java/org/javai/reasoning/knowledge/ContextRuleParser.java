package org.javai.reasoning.knowledge;

import java.util.Map;

class ContextRuleParser extends SectionParser<ContextRule> {

	@Override
	KnowledgeSection section() {
		return KnowledgeSection.CONTEXT_RULES;
	}

	@Override
	String[] requiredColumns() {
		return new String[] { "Diagnosis", "Age Group" };
	}

	@Override
	ContextRule parseRow(Map<String, String> row) {
		ContextConstraints constraints = new ContextConstraints(
				AgeGroup.parse(PipeTable.cell(row, "Age Group")),
				age(PipeTable.cell(row, "Min Age")),
				age(PipeTable.cell(row, "Max Age")),
				PipeTable.listCell(row, "Locations"),
				PipeTable.cell(row, "Rarity Note"));
		return new ContextRule(PipeTable.cell(row, "Diagnosis"), constraints, PipeTable.listCell(row, "Aliases"));
	}

	private static Integer age(String text) {
		if (text == null) {
			return null;
		}
		try {
			return Integer.valueOf(text.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("'" + text + "' is not an age in years", e);
		}
	}
}
