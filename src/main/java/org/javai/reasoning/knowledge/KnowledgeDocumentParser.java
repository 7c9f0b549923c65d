package org.javai.reasoning.knowledge;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the Markdown domain reference document.
 *
 * <p>Each recognised {@code ##} section is handed to its own {@link SectionParser}. A section that
 * is missing or malformed is recorded as an issue and contributes no rules; the remaining sections
 * still load. Only a document with no recognisable section at all is rejected outright.</p>
 */
class KnowledgeDocumentParser {

	private static final Logger logger = LoggerFactory.getLogger(KnowledgeDocumentParser.class);

	KnowledgeDocument parse(String document) {
		if (document == null || document.isBlank()) {
			throw new KnowledgeParseException(null, "Reference document is empty");
		}
		Map<KnowledgeSection, List<String>> sections = new EnumMap<>(KnowledgeSection.class);
		for (Map.Entry<String, List<String>> entry : MarkdownSections.split(document).entrySet()) {
			KnowledgeSection.forHeading(entry.getKey()).ifPresent(section -> {
				if (sections.putIfAbsent(section, entry.getValue()) != null) {
					logger.warn("Ignoring repeated section '{}'", entry.getKey());
				}
			});
		}
		if (sections.isEmpty()) {
			throw new KnowledgeParseException(null, "Reference document has no recognised sections");
		}

		Set<KnowledgeSection> missing = EnumSet.noneOf(KnowledgeSection.class);
		List<KnowledgeParseException> issues = new ArrayList<>();
		List<ContextRule> contextRules = parseSection(new ContextRuleParser(), sections, missing, issues);
		List<GradingOverrideRule> overrideRules = parseSection(new GradingOverrideParser(), sections, missing, issues);
		List<NomenclatureRule> nomenclature = parseSection(new NomenclatureParser(), sections, missing, issues);
		List<MarkerRequirementRule> markers = parseSection(new MarkerRequirementParser(), sections, missing, issues);
		List<String> principles = sections.containsKey(KnowledgeSection.DIAGNOSTIC_PRINCIPLES)
				? MarkdownSections.bullets(sections.get(KnowledgeSection.DIAGNOSTIC_PRINCIPLES))
				: List.of();

		logger.info("Loaded reference document: {} context rules, {} overrides, {} nomenclature changes, "
				+ "{} marker requirements, {} principles, {} issues", contextRules.size(), overrideRules.size(),
				nomenclature.size(), markers.size(), principles.size(), issues.size());
		return new KnowledgeDocument(contextRules, overrideRules, nomenclature, markers, principles, missing, issues);
	}

	private <T extends KnowledgeRule> List<T> parseSection(SectionParser<T> parser,
			Map<KnowledgeSection, List<String>> sections, Set<KnowledgeSection> missing,
			List<KnowledgeParseException> issues) {
		KnowledgeSection section = parser.section();
		List<String> lines = sections.get(section);
		if (lines == null) {
			if (section.required()) {
				missing.add(section);
				issues.add(new KnowledgeParseException(section,
						"Required section '%s' is missing".formatted(section.heading())));
				logger.warn("Reference document has no '{}' section; those rules are unavailable", section.heading());
			}
			return List.of();
		}
		try {
			List<T> rules = parser.parse(lines);
			logger.debug("Parsed {} rules from '{}'", rules.size(), section.heading());
			return rules;
		} catch (KnowledgeParseException e) {
			issues.add(e);
			logger.warn("{}; those rules are unavailable", e.getMessage());
			return List.of();
		}
	}
}
