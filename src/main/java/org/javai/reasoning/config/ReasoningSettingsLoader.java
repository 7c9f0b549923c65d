package org.javai.reasoning.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.reasoning.investigate.InvestigatorSettings;
import org.javai.reasoning.orchestrate.GapPriority;
import org.javai.reasoning.orchestrate.GapPriorityRule;
import org.javai.reasoning.orchestrate.OrchestratorSettings;
import org.javai.reasoning.schema.EntityReferencePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link ReasoningSettings} from YAML. Every key is optional; absent keys keep their
 * defaults.
 *
 * <pre>{@code
 * database: fhir_prd_db
 * entity:
 *   prefix: Patient/
 *   reference-columns: [subject_reference, patient_reference]
 * investigation:
 *   sample-limit: 20
 *   auto-fix-threshold: 0.9
 * orchestration:
 *   max-retry-depth: 2
 *   gap-priorities:
 *     - {table: procedure, field: extent_of_resection, priority: HIGHEST}
 * }</pre>
 */
public class ReasoningSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(ReasoningSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "reasoning.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Settings from {@value #DEFAULT_RESOURCE} on the classpath, or defaults when there is none.
	 */
	public ReasoningSettings loadDefault() {
		InputStream stream = ReasoningSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			logger.info("No {} on the classpath; using default settings", DEFAULT_RESOURCE);
			return ReasoningSettings.defaults();
		}
		return load(new InputStreamReader(stream, StandardCharsets.UTF_8));
	}

	public ReasoningSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader);
		} catch (IOException e) {
			throw new SettingsException("Failed to read settings from " + path, e);
		}
	}

	public ReasoningSettings load(Reader reader) {
		Object data;
		try (reader) {
			data = yaml.load(reader);
		} catch (YAMLException | IOException e) {
			throw new SettingsException("Settings are not valid YAML", e);
		}
		return build(data);
	}

	public ReasoningSettings loadString(String yamlContent) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		} catch (YAMLException e) {
			throw new SettingsException("Settings are not valid YAML", e);
		}
		return build(data);
	}

	private ReasoningSettings build(Object data) {
		if (data == null) {
			return ReasoningSettings.defaults();
		}
		Map<String, Object> root = asMap(data, "settings");
		try {
			ReasoningSettings settings = new ReasoningSettings(
					string(root, "database", null),
					buildEntity(section(root, "entity")),
					buildInvestigation(section(root, "investigation")),
					buildOrchestration(section(root, "orchestration"), section(root, "investigation")));
			logger.debug("Loaded settings: {}", settings);
			return settings;
		} catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private EntityReferencePatterns buildEntity(Map<String, Object> entity) {
		EntityReferencePatterns defaults = EntityReferencePatterns.defaults();
		return new EntityReferencePatterns(
				string(entity, "prefix", defaults.prefix()),
				stringList(entity, "reference-columns", defaults.exactColumns()),
				stringList(entity, "reference-suffixes", defaults.suffixes()),
				stringList(entity, "reference-stems", defaults.stems()));
	}

	private InvestigatorSettings buildInvestigation(Map<String, Object> investigation) {
		InvestigatorSettings defaults = InvestigatorSettings.defaults();
		return new InvestigatorSettings(
				integer(investigation, "sample-limit", defaults.sampleLimit()),
				integer(investigation, "min-sample-size", defaults.minSampleSize()),
				decimal(investigation, "auto-fix-threshold", defaults.autoFixThreshold()),
				Duration.ofSeconds(integer(investigation, "sample-timeout-seconds",
						(int) defaults.sampleTimeout().toSeconds())));
	}

	private OrchestratorSettings buildOrchestration(Map<String, Object> orchestration,
			Map<String, Object> investigation) {
		OrchestratorSettings defaults = OrchestratorSettings.defaults();
		List<GapPriorityRule> priorities = defaults.gapPriorities();
		if (orchestration.containsKey("gap-priorities")) {
			priorities = new ArrayList<>();
			Object raw = orchestration.get("gap-priorities");
			if (!(raw instanceof List<?> entries)) {
				throw new SettingsException("orchestration.gap-priorities must be a list");
			}
			for (Object entry : entries) {
				Map<String, Object> rule = asMap(entry, "orchestration.gap-priorities entry");
				priorities.add(new GapPriorityRule(
						string(rule, "table", null),
						string(rule, "field", null),
						GapPriority.parse(string(rule, "priority", null))));
			}
		}
		return new OrchestratorSettings(
				integer(orchestration, "max-retry-depth", defaults.maxRetryDepth()),
				integer(orchestration, "max-cycles", defaults.maxCycles()),
				integer(orchestration, "max-gaps-per-cycle", defaults.maxGapsPerCycle()),
				Duration.ofSeconds(integer(orchestration, "query-timeout-seconds",
						(int) defaults.queryTimeout().toSeconds())),
				decimal(investigation, "auto-fix-threshold", defaults.autoFixThreshold()),
				priorities);
	}

	private static Map<String, Object> section(Map<String, Object> root, String key) {
		Object value = root.get(key);
		return value == null ? Map.of() : asMap(value, key);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String what) {
		if (!(value instanceof Map<?, ?>)) {
			throw new SettingsException(what + " must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static String string(Map<String, Object> map, String key, String defaultValue) {
		Object value = map.get(key);
		return value == null ? defaultValue : String.valueOf(value);
	}

	private static int integer(Map<String, Object> map, String key, int defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer || value instanceof Long) {
			return ((Number) value).intValue();
		}
		throw new SettingsException("'%s' must be an integer but was '%s'".formatted(key, value));
	}

	private static double decimal(Map<String, Object> map, String key, double defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		throw new SettingsException("'%s' must be a number but was '%s'".formatted(key, value));
	}

	private static List<String> stringList(Map<String, Object> map, String key, List<String> defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof List<?> list)) {
			throw new SettingsException("'%s' must be a list".formatted(key));
		}
		return list.stream().map(String::valueOf).toList();
	}
}
