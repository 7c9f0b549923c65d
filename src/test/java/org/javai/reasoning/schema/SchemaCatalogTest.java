package org.javai.reasoning.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.reasoning.testsupport.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaCatalog")
class SchemaCatalogTest {

	private final SchemaCatalog catalog = TestCatalogs.fhir("fhir_prd_db");

	@Nested
	@DisplayName("Table lookup")
	class Lookup {

		@Test
		@DisplayName("Finds tables ignoring case and schema qualifier")
		void findsTablesIgnoringCaseAndQualifier() {
			assertThat(catalog.table("ENCOUNTER")).isPresent();
			assertThat(catalog.table("fhir_prd_db.encounter")).isPresent();
			assertThat(catalog.table("unknown_table")).isEmpty();
			assertThat(catalog.table(" ")).isEmpty();
		}

		@Test
		@DisplayName("Reports declared column types")
		void reportsColumnType() {
			assertThat(catalog.columnType("observation", "value_quantity")).contains("bigint");
			assertThat(catalog.columnType("observation", "nope")).isEmpty();
		}

		@Test
		@DisplayName("Finds tables having a column fragment")
		void findsTablesWithColumn() {
			assertThat(catalog.findTablesWithColumn("code_text"))
					.containsExactly("condition", "procedure");
			assertThat(catalog.findTablesWithColumn("")).isEmpty();
		}

		@Test
		@DisplayName("Rejects duplicate table names")
		void rejectsDuplicateTables() {
			TableSchema first = new TableSchema("note", List.of(), null, null);
			TableSchema second = new TableSchema("NOTE", List.of(), null, null);

			assertThatThrownBy(() -> new SchemaCatalog(List.of(first, second), null, null))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("Duplicate table");
		}
	}

	@Nested
	@DisplayName("Entity-scoped tables")
	class EntityScoped {

		@Test
		@DisplayName("Lists tables with an entity reference column")
		void listsScopedTables() {
			assertThat(catalog.findEntityScopedTables()).extracting(TableSchema::name)
					.containsExactly("encounter", "condition", "procedure", "observation", "medication_request");
		}

		@Test
		@DisplayName("Returns the same result on every call")
		void isIdempotent() {
			assertThat(catalog.findEntityScopedTables()).isEqualTo(catalog.findEntityScopedTables());
		}
	}

	@Nested
	@DisplayName("Count queries")
	class CountQueries {

		@Test
		@DisplayName("Uses the prefixed reference for reference columns")
		void prefixedReference() {
			assertThat(catalog.generateCountQuery("encounter", "abc123")).contains(
					"SELECT COUNT(*) AS count FROM fhir_prd_db.encounter WHERE subject_reference = 'Patient/abc123'");
		}

		@Test
		@DisplayName("Uses the bare id for id columns")
		void bareId() {
			assertThat(catalog.generateCountQuery("observation", "abc123")).contains(
					"SELECT COUNT(*) AS count FROM fhir_prd_db.observation WHERE patient_id = 'abc123'");
		}

		@Test
		@DisplayName("Matches both forms for a mixed table")
		void mixedStyle() {
			assertThat(catalog.generateCountQuery("encounter", "abc123", EntityReferenceStyle.MIXED)).contains(
					"SELECT COUNT(*) AS count FROM fhir_prd_db.encounter"
							+ " WHERE subject_reference = 'Patient/abc123' OR subject_reference = 'abc123'");
		}

		@Test
		@DisplayName("Escapes quotes in the entity id")
		void escapesQuotes() {
			assertThat(catalog.generateCountQuery("observation", "o'brien").orElseThrow())
					.endsWith("patient_id = 'o''brien'");
		}

		@Test
		@DisplayName("Is not applicable to unknown or unscoped tables")
		void notApplicable() {
			assertThat(catalog.generateCountQuery("organization", "abc123")).isEmpty();
			assertThat(catalog.generateCountQuery("unknown_table", "abc123")).isEmpty();
		}

		@Test
		@DisplayName("Rejects a blank entity id")
		void rejectsBlankEntityId() {
			assertThatThrownBy(() -> catalog.generateCountQuery("encounter", " "))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Sample queries")
	class SampleQueries {

		@Test
		@DisplayName("Selects distinct non-null values with the default limit")
		void defaultLimit() {
			assertThat(catalog.generateSampleQuery("encounter", "period_start")).contains(
					"SELECT DISTINCT period_start FROM fhir_prd_db.encounter WHERE period_start IS NOT NULL LIMIT 20");
		}

		@Test
		@DisplayName("Clamps the limit into range")
		void clampsLimit() {
			assertThat(catalog.generateSampleQuery("encounter", "status", 0).orElseThrow()).endsWith("LIMIT 1");
			assertThat(catalog.generateSampleQuery("encounter", "status", 50_000).orElseThrow())
					.endsWith("LIMIT 1000");
		}

		@Test
		@DisplayName("Is not applicable to unknown columns")
		void unknownColumn() {
			assertThat(catalog.generateSampleQuery("encounter", "perod_start")).isEmpty();
			assertThat(catalog.generateSampleQuery("unknown_table", "id")).isEmpty();
		}
	}

	@Nested
	@DisplayName("Column analysis")
	class ColumnAnalysis {

		@Test
		@DisplayName("Identifies date-like columns by name")
		void identifiesDateColumns() {
			assertThat(catalog.identifyDateColumns("encounter")).contains(List.of("period_start", "period_end"));
			assertThat(catalog.identifyDateColumns("medication_request")).contains(List.of("authored_on"));
			assertThat(catalog.identifyDateColumns("organization")).contains(List.of());
			assertThat(catalog.identifyDateColumns("unknown_table")).isEmpty();
		}

		@Test
		@DisplayName("Suggests the nearest existing column")
		void suggestsColumn() {
			assertThat(catalog.suggestColumn("encounter", "perod_start"))
					.map(ColumnNameMatcher.Suggestion::column)
					.contains("period_start");
			assertThat(catalog.suggestColumn("encounter", "zzz")).isEmpty();
		}

		@Test
		@DisplayName("Validates requested columns and suggests replacements")
		void validatesColumns() {
			ColumnValidation validation = catalog
					.validateColumns("encounter", List.of("status", "perod_start", "zzz"))
					.orElseThrow();

			assertThat(validation.isValid()).isFalse();
			assertThat(validation.unknownColumns()).containsExactly("perod_start", "zzz");
			assertThat(validation.suggestions()).containsEntry("perod_start", "period_start")
					.doesNotContainKey("zzz");
		}

		@Test
		@DisplayName("Summarizes a table")
		void summarizes() {
			TableSummary summary = catalog.summarize("condition").orElseThrow();

			assertThat(summary.columnCount()).isEqualTo(5);
			assertThat(summary.dateColumns()).containsExactly("onset_date_time", "recorded_date");
			assertThat(summary.entityReferenceColumn()).isEqualTo("subject_reference");
			assertThat(summary.entityReferenceStyle()).isEqualTo(EntityReferenceStyle.PREFIXED_REFERENCE);
		}
	}

	@Nested
	@DisplayName("Reference style confirmation")
	class StyleConfirmation {

		@Test
		@DisplayName("Reports MIXED when both reference forms are stored")
		void mixed() {
			assertThat(catalog.confirmReferenceStyle("encounter", List.of("Patient/abc", "abc")))
					.contains(EntityReferenceStyle.MIXED);
		}

		@Test
		@DisplayName("Reports the single observed form")
		void singleForm() {
			assertThat(catalog.confirmReferenceStyle("encounter", List.of("abc", "def")))
					.contains(EntityReferenceStyle.BARE_ID);
			assertThat(catalog.confirmReferenceStyle("observation", List.of("Patient/abc")))
					.contains(EntityReferenceStyle.PREFIXED_REFERENCE);
		}

		@Test
		@DisplayName("Falls back to the structural guess without usable samples")
		void fallsBack() {
			assertThat(catalog.confirmReferenceStyle("observation", List.of(" ", "")))
					.contains(EntityReferenceStyle.BARE_ID);
		}

		@Test
		@DisplayName("Reports NONE for unscoped tables and nothing for unknown ones")
		void unscoped() {
			assertThat(catalog.confirmReferenceStyle("organization", List.of("x")))
					.contains(EntityReferenceStyle.NONE);
			assertThat(catalog.confirmReferenceStyle("unknown_table", List.of("x"))).isEmpty();
		}
	}
}
