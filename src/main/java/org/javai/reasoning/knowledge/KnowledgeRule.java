package org.javai.reasoning.knowledge;

/**
 * One row of the reference document. Each section produces exactly one variant.
 */
public sealed interface KnowledgeRule
		permits ContextRule, GradingOverrideRule, NomenclatureRule, MarkerRequirementRule {

	KnowledgeSection section();
}
