package org.springaicommunity.github.changelog;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of a successful AI analysis.
 *
 * <p>
 * Only produced when the analysis response was parsed; a failed analysis yields no
 * result at all rather than a partially filled one.
 *
 * @param categories analyzed items per category (categories may be absent)
 * @param summary one-paragraph release summary
 * @param highlights notable changes, possibly empty
 */
public record AnalysisResult(Map<CommitCategory, List<Item>> categories, String summary, List<String> highlights) {

	public AnalysisResult {
		Map<CommitCategory, List<Item>> copy = new EnumMap<>(CommitCategory.class);
		categories.forEach((category, items) -> copy.put(category, List.copyOf(items)));
		categories = copy;
		highlights = List.copyOf(highlights);
	}

	/**
	 * Returns the items reported for a category.
	 * @param category the category
	 * @return items in document order, empty when the category is absent
	 */
	public List<Item> itemsFor(CommitCategory category) {
		return categories.getOrDefault(category, List.of());
	}

	/**
	 * A single changelog entry proposed by the analysis.
	 *
	 * @param commitId the commit the entry refers to (may be empty when not supplied)
	 * @param message the rewritten changelog message
	 * @param importance importance rank used for ordering and icon lookup
	 */
	public record Item(String commitId, String message, int importance) {
	}

}
