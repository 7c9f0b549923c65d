package org.javai.reasoning.schema;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EntityReferencePatterns")
class EntityReferencePatternsTest {

	private final EntityReferencePatterns patterns = EntityReferencePatterns.defaults();

	@Test
	@DisplayName("Matches exact names and stem-plus-suffix names")
	void matches() {
		assertThat(patterns.matches("SUBJECT_REFERENCE")).isTrue();
		assertThat(patterns.matches("performer_patient_reference")).isTrue();
		assertThat(patterns.matches("encounter_reference")).isFalse();
		assertThat(patterns.matches("patient_name")).isFalse();
	}

	@Test
	@DisplayName("Prefers exact names over stem matches regardless of column order")
	void prefersExactNames() {
		List<ColumnSchema> columns = List.of(
				new ColumnSchema("other_patient_id", "varchar", 1, true),
				new ColumnSchema("patient_id", "varchar", 2, true));

		assertThat(patterns.selectReferenceColumn(columns)).map(ColumnSchema::name).contains("patient_id");
	}

	@Test
	@DisplayName("Guesses the style from the column name")
	void guessesStyle() {
		assertThat(patterns.styleFor("subject_reference")).isEqualTo(EntityReferenceStyle.PREFIXED_REFERENCE);
		assertThat(patterns.styleFor("patient_id")).isEqualTo(EntityReferenceStyle.BARE_ID);
	}
}
