package org.javai.reasoning.knowledge;

/**
 * An obsolete classification name and the name that replaced it.
 */
public record NomenclatureRule(String obsoleteName, String currentName, String note) implements KnowledgeRule {

	public NomenclatureRule {
		if (obsoleteName == null || obsoleteName.isBlank() || currentName == null || currentName.isBlank()) {
			throw new IllegalArgumentException("Nomenclature rules need both an obsolete and a current name");
		}
		note = note != null ? note : "";
	}

	@Override
	public KnowledgeSection section() {
		return KnowledgeSection.NOMENCLATURE_CHANGES;
	}
}
