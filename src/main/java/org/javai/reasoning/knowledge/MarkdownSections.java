package org.javai.reasoning.knowledge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a Markdown document into its level-two sections.
 */
final class MarkdownSections {

	private MarkdownSections() {
	}

	/**
	 * Heading text to the lines beneath it, in document order. Text before the first {@code ##}
	 * heading and deeper headings inside a section are kept with the enclosing section.
	 */
	static Map<String, List<String>> split(String document) {
		Map<String, List<String>> sections = new LinkedHashMap<>();
		List<String> current = null;
		for (String line : document.split("\\R")) {
			if (line.startsWith("## ")) {
				current = new ArrayList<>();
				sections.put(line.substring(3).trim(), current);
			} else if (current != null) {
				current.add(line);
			}
		}
		return sections;
	}

	/**
	 * Text of every {@code -} or {@code *} bullet in {@code lines}.
	 */
	static List<String> bullets(List<String> lines) {
		List<String> bullets = new ArrayList<>();
		for (String line : lines) {
			String trimmed = line.trim();
			if ((trimmed.startsWith("- ") || trimmed.startsWith("* ")) && trimmed.length() > 2) {
				bullets.add(trimmed.substring(2).trim());
			}
		}
		return bullets;
	}
}
