package org.javai.reasoning.knowledge;

import java.util.Map;

class MarkerRequirementParser extends SectionParser<MarkerRequirementRule> {

	@Override
	KnowledgeSection section() {
		return KnowledgeSection.MARKER_REQUIREMENTS;
	}

	@Override
	String[] requiredColumns() {
		return new String[] { "Name Fragment", "Required Tests" };
	}

	@Override
	MarkerRequirementRule parseRow(Map<String, String> row) {
		return new MarkerRequirementRule(PipeTable.cell(row, "Name Fragment"),
				PipeTable.listCell(row, "Required Tests"));
	}
}
