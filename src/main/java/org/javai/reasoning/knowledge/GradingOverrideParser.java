package org.javai.reasoning.knowledge;

import java.util.LinkedHashSet;
import java.util.Map;

class GradingOverrideParser extends SectionParser<GradingOverrideRule> {

	@Override
	KnowledgeSection section() {
		return KnowledgeSection.GRADING_OVERRIDES;
	}

	@Override
	String[] requiredColumns() {
		return new String[] { "Trigger Markers", "Result", "Rationale" };
	}

	@Override
	GradingOverrideRule parseRow(Map<String, String> row) {
		return new GradingOverrideRule(
				PipeTable.cell(row, "Applies To"),
				new LinkedHashSet<>(PipeTable.listCell(row, "Trigger Markers")),
				PipeTable.cell(row, "Result"),
				PipeTable.cell(row, "Rationale"));
	}
}
