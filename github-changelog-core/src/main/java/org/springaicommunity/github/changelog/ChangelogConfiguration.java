package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validated changelog configuration: category definitions, subject cleanup patterns,
 * document templates, importance icons, analysis prompts and model parameters.
 *
 * <p>
 * Instances are created by {@link ChangelogConfigurationLoader}, which rejects incomplete
 * configurations up front so that no lookup here needs a silent default.
 *
 * @param categories definition of every category of the closed set
 * @param classificationOrder categories tested by the classifier, in priority order
 * (never contains {@link CommitCategory#OTHER})
 * @param cleanupPatterns prefixes stripped from subjects by the rule-based changelog
 * @param importanceIcons icon per importance rank
 * @param defaultIcon icon used for an unrecognized importance
 * @param aiTemplate templates of the AI-backed changelog
 * @param basicTemplate templates of the rule-based changelog
 * @param appendix title and placeholder of the original commits appendix
 * @param prompts system and user prompts of the analysis request
 * @param analysis model parameters of the analysis request
 * @param generatedMarker text identifying a body this tool already generated
 */
public record ChangelogConfiguration(Map<CommitCategory, CategoryDefinition> categories,
		List<CommitCategory> classificationOrder, List<Pattern> cleanupPatterns, Map<Integer, String> importanceIcons,
		String defaultIcon, DocumentTemplate aiTemplate, DocumentTemplate basicTemplate, Appendix appendix,
		Prompts prompts, AnalysisSettings analysis, String generatedMarker) {

	public ChangelogConfiguration {
		categories = new EnumMap<>(categories);
		classificationOrder = List.copyOf(classificationOrder);
		cleanupPatterns = List.copyOf(cleanupPatterns);
		importanceIcons = Map.copyOf(importanceIcons);
	}

	/**
	 * Returns the display title of a category.
	 * @param category the category
	 * @return the configured title
	 */
	public String titleOf(CommitCategory category) {
		return categories.get(category).title();
	}

	/**
	 * Returns the icon for an importance rank.
	 * @param importance the importance
	 * @return configured icon, or the default icon when the rank is unknown
	 */
	public String iconFor(int importance) {
		return importanceIcons.getOrDefault(importance, defaultIcon);
	}

	/**
	 * Title and matching pattern of a category.
	 *
	 * @param title display title used as section header
	 * @param pattern case-insensitive subject prefix pattern (null only for OTHER)
	 */
	public record CategoryDefinition(String title, @Nullable Pattern pattern) {
	}

	/**
	 * Fragments of a changelog document with named {@code {placeholder}} slots.
	 *
	 * @param header document header, {@code {version}}
	 * @param overview overview block, {@code {summary}} in the AI template
	 * @param highlights highlights block, {@code {highlights}} (null when unused)
	 * @param divider separator between overview and categories
	 * @param categoryHeader section header, {@code {title}}
	 * @param itemFormat entry line, {@code {message}}, {@code {hash}} and in the AI
	 * template {@code {icon}}
	 */
	public record DocumentTemplate(String header, String overview, @Nullable String highlights, String divider,
			String categoryHeader, String itemFormat) {
	}

	/**
	 * Collapsible appendix listing the original commits.
	 *
	 * @param title summary line of the collapsible block
	 * @param emptyPlaceholder text shown when the range holds no commits
	 */
	public record Appendix(String title, String emptyPlaceholder) {
	}

	/**
	 * Prompts sent to the analysis service.
	 *
	 * @param systemPrompt system instruction
	 * @param userPromptTemplate user prompt with a {@code {commits_text}} slot
	 */
	public record Prompts(String systemPrompt, String userPromptTemplate) {
	}

	/**
	 * Model parameters of the analysis request.
	 *
	 * @param model model name
	 * @param temperature sampling temperature
	 * @param maxTokens maximum output size
	 * @param timeout request timeout
	 */
	public record AnalysisSettings(String model, double temperature, int maxTokens, Duration timeout) {
	}

}
