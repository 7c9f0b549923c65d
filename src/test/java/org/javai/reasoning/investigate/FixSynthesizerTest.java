package org.javai.reasoning.investigate;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Set;
import org.javai.reasoning.schema.ColumnNameMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FixSynthesizer")
class FixSynthesizerTest {

	private final FixSynthesizer synthesizer = new FixSynthesizer();

	private static ImplicatedField dateField() {
		return new ImplicatedField("e", "encounter", "period_start", "date_parse",
				"date_parse(e.period_start, '%Y-%m-%d')", "%Y-%m-%d");
	}

	@Nested
	@DisplayName("Date fixes")
	class DateFixes {

		@Test
		@DisplayName("Covers every sampled shape with a multi-format chain")
		void multiFormat() {
			FormatAnalysis analysis = new FormatAnalysis(true, Set.of(DateShape.DATE_ONLY, DateShape.ISO_ZULU), 2, 0);

			ProposedFix fix = synthesizer.dateFix(dateField(), analysis, "2018-08-07T10:30:00Z").orElseThrow();

			assertThat(fix.strategy()).isEqualTo(FixStrategy.MULTI_FORMAT_DATE);
			assertThat(fix.target()).isEqualTo("date_parse(e.period_start, '%Y-%m-%d')");
			assertThat(fix.shapes()).containsExactly(DateShape.ISO_ZULU, DateShape.DATE_ONLY);
			assertThat(fix.replacement()).startsWith("COALESCE(");
		}

		@Test
		@DisplayName("Adds the query's own format to a single sampled shape")
		void singleFormat() {
			FormatAnalysis analysis = new FormatAnalysis(false, Set.of(DateShape.SPACE_SEPARATED), 6, 0);

			ProposedFix fix = synthesizer.dateFix(dateField(), analysis, null).orElseThrow();

			assertThat(fix.strategy()).isEqualTo(FixStrategy.SINGLE_FORMAT_DATE);
			assertThat(fix.shapes()).containsExactly(DateShape.SPACE_SEPARATED, DateShape.DATE_ONLY);
		}

		@Test
		@DisplayName("Falls back to the rejected literal without samples")
		void literalDerived() {
			ProposedFix fix = synthesizer.dateFix(dateField(), null, "08/07/2018").orElseThrow();

			assertThat(fix.strategy()).isEqualTo(FixStrategy.LITERAL_DERIVED_DATE);
			assertThat(fix.shapes()).containsExactly(DateShape.DATE_ONLY, DateShape.US_DATE);
		}

		@Test
		@DisplayName("Proposes nothing without any shape in evidence")
		void nothingInEvidence() {
			ImplicatedField field = new ImplicatedField("e", "encounter", "period_start", "cast",
					"cast(e.period_start AS date)", null);

			assertThat(synthesizer.dateFix(field, null, "soon")).isEmpty();
		}
	}

	@Test
	@DisplayName("Casts the first argument of a mistyped call")
	void castFix() {
		ImplicatedField field = new ImplicatedField("o", "observation", "value_string", "abs",
				"abs(o.value_string)", null);

		ProposedFix fix = synthesizer.castFix(field, "double").orElseThrow();

		assertThat(fix.strategy()).isEqualTo(FixStrategy.EXPLICIT_CAST);
		assertThat(fix.replacement()).isEqualTo("abs(CAST(o.value_string AS DOUBLE))");
	}

	@Test
	@DisplayName("Renames an unknown column keeping its alias")
	void columnFix() {
		ImplicatedField field = new ImplicatedField("e", "encounter", "perod_start", null, "e.perod_start", null);

		ProposedFix fix = synthesizer.columnFix(field, new ColumnNameMatcher.Suggestion("period_start", 0.9))
				.orElseThrow();

		assertThat(fix.target()).isEqualTo("e.perod_start");
		assertThat(fix.replacement()).isEqualTo("e.period_start");
		assertThat(fix.similarity()).isEqualTo(0.9);
		assertThat(fix.shapes()).isEqualTo(List.of());
	}

	@Test
	@DisplayName("Knows the expected first-argument type of common functions")
	void expectedTypes() {
		assertThat(FixSynthesizer.expectedFirstArgumentType("DATE_PARSE")).contains("VARCHAR");
		assertThat(FixSynthesizer.expectedFirstArgumentType("date_format")).contains("TIMESTAMP");
		assertThat(FixSynthesizer.expectedFirstArgumentType("mystery")).isEmpty();
	}
}
