package org.javai.reasoning.config;

import org.javai.reasoning.investigate.InvestigatorSettings;
import org.javai.reasoning.orchestrate.OrchestratorSettings;
import org.javai.reasoning.schema.EntityReferencePatterns;
import org.javai.reasoning.schema.SchemaCatalogLoader;

/**
 * All settings of the reasoning core, passed explicitly to the components that need them.
 *
 * @param database schema qualifier for generated SQL, or null
 * @param entity entity reference naming conventions
 * @param investigation investigator tuning
 * @param orchestration orchestrator limits and gap ranking
 */
public record ReasoningSettings(String database, EntityReferencePatterns entity, InvestigatorSettings investigation,
		OrchestratorSettings orchestration) {

	public ReasoningSettings {
		database = database == null || database.isBlank() ? null : database.trim();
		entity = entity != null ? entity : EntityReferencePatterns.defaults();
		investigation = investigation != null ? investigation : InvestigatorSettings.defaults();
		orchestration = orchestration != null ? orchestration : OrchestratorSettings.defaults();
	}

	public static ReasoningSettings defaults() {
		return new ReasoningSettings(null, null, null, null);
	}

	public SchemaCatalogLoader schemaCatalogLoader() {
		return new SchemaCatalogLoader(entity, database);
	}
}
