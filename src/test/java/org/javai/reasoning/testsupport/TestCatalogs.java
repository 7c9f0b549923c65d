package org.javai.reasoning.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.javai.reasoning.schema.EntityReferencePatterns;
import org.javai.reasoning.schema.SchemaCatalog;
import org.javai.reasoning.schema.SchemaCatalogLoader;

/**
 * Loads the FHIR-shaped schema fixture shared by the tests.
 */
public final class TestCatalogs {

	public static final String FHIR_SCHEMA = "schema/fhir_schema.csv";

	private TestCatalogs() {
	}

	public static SchemaCatalog fhir() {
		return fhir(null);
	}

	public static SchemaCatalog fhir(String database) {
		InputStream stream = TestCatalogs.class.getClassLoader().getResourceAsStream(FHIR_SCHEMA);
		if (stream == null) {
			throw new IllegalStateException("Could not load schema resource: " + FHIR_SCHEMA);
		}
		try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
			return new SchemaCatalogLoader(EntityReferencePatterns.defaults(), database).load(reader, FHIR_SCHEMA);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
