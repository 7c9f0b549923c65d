package org.javai.reasoning.investigate;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Short-circuiting "try this format, else that one" parse over several {@link DateShape}s,
 * ordered from most to least specific.
 *
 * <p>{@link #toSql(String)} renders the chain as a {@code COALESCE} of {@code TRY(...)} parses;
 * {@link #parse(String)} evaluates the same chain in-process.</p>
 */
public final class DateFallbackChain {

	private final List<DateShape> shapes;

	private DateFallbackChain(List<DateShape> shapes) {
		this.shapes = shapes;
	}

	public static DateFallbackChain of(Collection<DateShape> shapes) {
		if (shapes == null || shapes.isEmpty()) {
			throw new IllegalArgumentException("A fallback chain needs at least one shape");
		}
		return new DateFallbackChain(List.copyOf(EnumSet.copyOf(shapes)));
	}

	public List<DateShape> shapes() {
		return shapes;
	}

	public String toSql(String fieldExpression) {
		List<String> tries = shapes.stream()
				.map(s -> "TRY(" + s.sqlParseExpression(fieldExpression) + ")")
				.toList();
		if (tries.size() == 1) {
			return tries.get(0);
		}
		return tries.stream().collect(Collectors.joining(",\n    ", "COALESCE(\n    ", "\n)"));
	}

	/**
	 * First successful parse, or empty if no shape in the chain accepts the value.
	 */
	public Optional<LocalDateTime> parse(String value) {
		for (DateShape shape : shapes) {
			Optional<LocalDateTime> parsed = shape.parse(value);
			if (parsed.isPresent()) {
				return parsed;
			}
		}
		return Optional.empty();
	}
}
