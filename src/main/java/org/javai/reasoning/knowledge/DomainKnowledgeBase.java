package org.javai.reasoning.knowledge;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Queryable domain rules: typical context per classification, grading overrides triggered by
 * secondary findings, obsolete-to-current nomenclature and secondary testing requirements.
 *
 * <p>Read-only after construction and safe to share between concurrent runs. Sections that failed
 * to load leave their category empty; {@link #loadIssues()} says which.</p>
 */
public final class DomainKnowledgeBase {

	private enum MatchKind { CURRENT, ABBREVIATION, OBSOLETE }

	private record NameMatch(String canonical, MatchKind kind) {
	}

	private final KnowledgeDocument document;
	private final Map<String, String> canonicalByExact = new LinkedHashMap<>();
	private final Map<String, String> canonicalByNormalized = new LinkedHashMap<>();
	private final Map<String, String> canonicalByAbbreviation = new LinkedHashMap<>();
	private final Map<String, String> canonicalByObsolete = new LinkedHashMap<>();
	private final Map<String, DiagnosisRule> rules = new LinkedHashMap<>();

	private DomainKnowledgeBase(KnowledgeDocument document) {
		this.document = document;
		Set<String> names = new LinkedHashSet<>();
		document.contextRules().forEach(r -> names.add(r.diagnosis()));
		document.nomenclatureRules().forEach(r -> names.add(r.currentName()));
		document.overrideRules().stream()
				.map(GradingOverrideRule::appliesTo)
				.filter(Objects::nonNull)
				.forEach(names::add);
		for (String name : names) {
			canonicalByExact.putIfAbsent(name, name);
			canonicalByNormalized.putIfAbsent(Names.normalize(name), name);
		}
		for (ContextRule rule : document.contextRules()) {
			rule.aliases().forEach(alias -> canonicalByAbbreviation.putIfAbsent(Names.normalize(alias), rule.diagnosis()));
		}
		for (NomenclatureRule rule : document.nomenclatureRules()) {
			canonicalByObsolete.putIfAbsent(Names.normalize(rule.obsoleteName()), rule.currentName());
		}
		for (String name : names) {
			rules.put(Names.normalize(name), buildRule(name));
		}
	}

	public static DomainKnowledgeBase load(String document) {
		return new DomainKnowledgeBase(new KnowledgeDocumentParser().parse(document));
	}

	public static DomainKnowledgeBase load(Path path) {
		try {
			return load(Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new KnowledgeParseException(null, "Failed to read reference document: " + path, e);
		}
	}

	public static DomainKnowledgeBase load(Reader reader) {
		try (reader) {
			StringWriter text = new StringWriter();
			reader.transferTo(text);
			return load(text.toString());
		} catch (IOException | UncheckedIOException e) {
			throw new KnowledgeParseException(null, "Failed to read reference document", e);
		}
	}

	/**
	 * Checks a classification name against the reference.
	 *
	 * <p>Blank names are invalid. Unknown names are valid but carry a warning that they could not
	 * be verified. Implausible age or location only adds warnings. An obsolete name yields the
	 * current name as {@code suggestedRewrite}. Override and suffix checks run on the current
	 * name.</p>
	 */
	public ValidationResult validate(String name, ValidationContext context) {
		if (name == null || name.isBlank()) {
			return ValidationResult.invalid("Classification name is blank");
		}
		ValidationContext ctx = context != null ? context : ValidationContext.empty();
		Optional<NameMatch> match = resolve(name);
		List<String> warnings = new ArrayList<>();
		String canonical = match.map(NameMatch::canonical).orElse(null);
		String rewrite = null;
		if (match.isEmpty()) {
			warnings.add("'%s' is not in the reference and could not be verified".formatted(name.trim()));
		} else {
			DiagnosisRule rule = rules.get(Names.normalize(canonical));
			warnings.addAll(rule.contextConstraints().check(canonical, ctx));
			if (match.get().kind() == MatchKind.OBSOLETE) {
				rewrite = canonical;
				warnings.add("'%s' is obsolete; current name is '%s'".formatted(name.trim(), canonical));
			} else if (match.get().kind() == MatchKind.ABBREVIATION) {
				rewrite = canonical;
				warnings.add("'%s' is an abbreviation; full name is '%s'".formatted(name.trim(), canonical));
			}
		}
		String effective = canonical != null ? canonical : name.trim();

		List<String> missingTests = new ArrayList<>();
		for (MarkerRequirementRule requirement : document.markerRequirements()) {
			if (requirement.appliesTo(effective) && !requirement.satisfiedBy(ctx.secondaryFindings())) {
				requirement.requiredTests().stream()
						.filter(test -> !missingTests.contains(test))
						.forEach(missingTests::add);
			}
		}

		OverrideMatch override = checkOverride(effective, ctx.secondaryFindings()).stream().findFirst().orElse(null);
		ClassificationSuffix suffix = null;
		if (ctx.secondaryTestingPerformed() != null) {
			suffix = suggestSuffix(effective, ctx.secondaryTestingPerformed(),
					Boolean.TRUE.equals(ctx.secondaryResultsContradictory())).orElse(null);
		}
		return new ValidationResult(true, canonical, warnings, missingTests, rewrite, override, suffix);
	}

	/**
	 * Every override rule applicable to {@code name} whose triggers intersect {@code findings}, in
	 * rule definition order. The order of {@code findings} has no effect.
	 */
	public List<OverrideMatch> checkOverride(String name, Collection<String> findings) {
		if (findings == null || findings.isEmpty()) {
			return List.of();
		}
		String effective = canonicalName(name).orElse(name != null ? name.trim() : "");
		Set<String> findingSet = new LinkedHashSet<>(findings);
		List<OverrideMatch> matches = new ArrayList<>();
		for (GradingOverrideRule rule : document.overrideRules()) {
			if (!rule.appliesTo(effective)) {
				continue;
			}
			Set<String> triggered = rule.triggeredBy(findingSet);
			if (!triggered.isEmpty()) {
				matches.add(new OverrideMatch(rule, triggered, effective, rule.resultingGradeOrName()));
			}
		}
		return matches;
	}

	/**
	 * NOS when the secondary testing a name requires was not performed, NEC when it was performed
	 * but contradictory, otherwise empty. Names needing no secondary testing, and names already
	 * carrying a suffix, get nothing.
	 */
	public Optional<ClassificationSuffix> suggestSuffix(String name, boolean secondaryTestingPerformed,
			boolean secondaryResultsContradictory) {
		if (name == null || name.isBlank() || ClassificationSuffix.isPresentOn(name)) {
			return Optional.empty();
		}
		String effective = canonicalName(name).orElse(name.trim());
		boolean needsTesting = document.markerRequirements().stream()
				.anyMatch(r -> r.appliesTo(effective) || r.appliesTo(name));
		if (!needsTesting) {
			return Optional.empty();
		}
		if (!secondaryTestingPerformed) {
			return Optional.of(ClassificationSuffix.NOS);
		}
		if (secondaryResultsContradictory) {
			return Optional.of(ClassificationSuffix.NEC);
		}
		return Optional.empty();
	}

	public Optional<DiagnosisRule> findRule(String name) {
		return canonicalName(name).map(c -> rules.get(Names.normalize(c)));
	}

	/**
	 * Current name for {@code name}: exact match, then case-insensitive match, then abbreviation, then obsolete name.
	 */
	public Optional<String> canonicalName(String name) {
		return resolve(name).map(NameMatch::canonical);
	}

	public boolean isObsolete(String name) {
		return resolve(name).map(m -> m.kind() == MatchKind.OBSOLETE).orElse(false);
	}

	public List<ContextRule> contextRules() {
		return document.contextRules();
	}

	public List<GradingOverrideRule> overrideRules() {
		return document.overrideRules();
	}

	public List<NomenclatureRule> nomenclatureRules() {
		return document.nomenclatureRules();
	}

	public List<MarkerRequirementRule> markerRequirements() {
		return document.markerRequirements();
	}

	public List<String> principles() {
		return document.principles();
	}

	/**
	 * Required sections absent from the document.
	 */
	public Set<KnowledgeSection> missingSections() {
		return document.missingSections();
	}

	/**
	 * Missing and malformed sections, one exception per affected category.
	 */
	public List<KnowledgeParseException> loadIssues() {
		return document.issues();
	}

	public boolean isComplete() {
		return document.issues().isEmpty();
	}

	/**
	 * Fails when any section is missing or malformed.
	 */
	public DomainKnowledgeBase requireComplete() {
		if (!isComplete()) {
			KnowledgeParseException first = document.issues().get(0);
			throw new KnowledgeParseException(first.section(), "Reference document is incomplete: "
					+ document.issues().stream().map(Throwable::getMessage).collect(Collectors.joining("; ")), first);
		}
		return this;
	}

	private Optional<NameMatch> resolve(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		String exact = canonicalByExact.get(name.trim());
		if (exact != null) {
			return Optional.of(new NameMatch(exact, MatchKind.CURRENT));
		}
		String normalized = Names.normalize(name);
		String caseInsensitive = canonicalByNormalized.get(normalized);
		if (caseInsensitive != null) {
			return Optional.of(new NameMatch(caseInsensitive, MatchKind.CURRENT));
		}
		String abbreviated = canonicalByAbbreviation.get(normalized);
		if (abbreviated != null) {
			return Optional.of(new NameMatch(abbreviated, MatchKind.ABBREVIATION));
		}
		return Optional.ofNullable(canonicalByObsolete.get(normalized)).map(c -> new NameMatch(c, MatchKind.OBSOLETE));
	}

	private DiagnosisRule buildRule(String name) {
		ContextConstraints constraints = document.contextRules().stream()
				.filter(r -> Names.normalize(r.diagnosis()).equals(Names.normalize(name)))
				.map(ContextRule::constraints)
				.findFirst()
				.orElse(ContextConstraints.none());
		List<String> tests = new ArrayList<>();
		for (MarkerRequirementRule requirement : document.markerRequirements()) {
			if (requirement.appliesTo(name)) {
				requirement.requiredTests().stream().filter(t -> !tests.contains(t)).forEach(tests::add);
			}
		}
		List<String> aliases = new ArrayList<>();
		document.contextRules().stream()
				.filter(r -> r.diagnosis().equals(name))
				.forEach(r -> aliases.addAll(r.aliases()));
		document.nomenclatureRules().stream()
				.filter(r -> r.currentName().equals(name))
				.forEach(r -> aliases.add(r.obsoleteName()));
		return new DiagnosisRule(name, constraints, tests, aliases);
	}
}
