package org.javai.reasoning.knowledge;

import java.util.Map;

class NomenclatureParser extends SectionParser<NomenclatureRule> {

	@Override
	KnowledgeSection section() {
		return KnowledgeSection.NOMENCLATURE_CHANGES;
	}

	@Override
	String[] requiredColumns() {
		return new String[] { "Obsolete Name", "Current Name" };
	}

	@Override
	NomenclatureRule parseRow(Map<String, String> row) {
		return new NomenclatureRule(PipeTable.cell(row, "Obsolete Name"), PipeTable.cell(row, "Current Name"),
				PipeTable.cell(row, "Note"));
	}
}
