package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads and validates the changelog configuration document.
 *
 * <p>
 * The bundled default lives on the classpath as {@value #DEFAULT_RESOURCE}; a file given
 * with {@code --config} replaces it entirely. Every problem found is collected and
 * reported at once in a {@link ChangelogConfigurationException}.
 */
public class ChangelogConfigurationLoader {

	private static final Logger logger = LoggerFactory.getLogger(ChangelogConfigurationLoader.class);

	public static final String DEFAULT_RESOURCE = "/changelog-config.json";

	private final ObjectMapper objectMapper;

	public ChangelogConfigurationLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Load the bundled default configuration.
	 * @return validated configuration
	 * @throws ChangelogConfigurationException if the resource is missing or invalid
	 */
	public ChangelogConfiguration loadDefault() {
		try (InputStream in = ChangelogConfigurationLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new ChangelogConfigurationException("Configuration resource not found: " + DEFAULT_RESOURCE);
			}
			return load(in, "classpath:" + DEFAULT_RESOURCE);
		}
		catch (IOException e) {
			throw new ChangelogConfigurationException("Failed to read configuration resource " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Load a configuration file.
	 * @param file path to a JSON configuration file
	 * @return validated configuration
	 * @throws ChangelogConfigurationException if the file is missing or invalid
	 */
	public ChangelogConfiguration load(Path file) {
		if (!Files.isRegularFile(file)) {
			throw new ChangelogConfigurationException("Configuration file not found: " + file);
		}
		try (InputStream in = Files.newInputStream(file)) {
			return load(in, file.toString());
		}
		catch (IOException e) {
			throw new ChangelogConfigurationException("Failed to read configuration file " + file, e);
		}
	}

	/**
	 * Load a configuration document from a stream.
	 * @param in the JSON document
	 * @param source description of the source used in error messages
	 * @return validated configuration
	 * @throws ChangelogConfigurationException if the document is malformed or invalid
	 */
	public ChangelogConfiguration load(InputStream in, String source) {
		JsonNode root;
		try {
			root = objectMapper.readTree(in);
		}
		catch (IOException e) {
			throw new ChangelogConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(),
					e);
		}
		if (root == null || !root.isObject()) {
			throw new ChangelogConfigurationException("Configuration in " + source + " must be a JSON object");
		}

		List<String> errors = new ArrayList<>();

		Map<CommitCategory, ChangelogConfiguration.CategoryDefinition> categories = new EnumMap<>(
				CommitCategory.class);
		List<CommitCategory> classificationOrder = new ArrayList<>();
		parseCategories(root.path("categories"), categories, classificationOrder, errors);

		List<Pattern> cleanupPatterns = parseCleanupPatterns(root.path("cleanup_patterns"), errors);

		Map<Integer, String> icons = new HashMap<>();
		String defaultIcon = parseIcons(root.path("importance_icons"), icons, errors);

		JsonNode templates = root.path("templates");
		ChangelogConfiguration.DocumentTemplate aiTemplate = parseTemplate(templates.path("ai_generated"),
				"templates.ai_generated", true, errors);
		ChangelogConfiguration.DocumentTemplate basicTemplate = parseTemplate(templates.path("basic_generated"),
				"templates.basic_generated", false, errors);
		ChangelogConfiguration.Appendix appendix = new ChangelogConfiguration.Appendix(
				requiredText(templates.path("appendix"), "title", "templates.appendix", errors),
				requiredText(templates.path("appendix"), "empty", "templates.appendix", errors));

		JsonNode promptsNode = root.path("prompts");
		ChangelogConfiguration.Prompts prompts = new ChangelogConfiguration.Prompts(
				requiredText(promptsNode, "system_prompt", "prompts", errors),
				requiredTemplate(promptsNode, "user_prompt_template", "prompts", Set.of("commits_text"), errors));

		ChangelogConfiguration.AnalysisSettings analysis = parseAnalysis(root.path("analysis"), errors);

		String marker = requiredText(root.path("markers"), "ai_generated", "markers", errors);
		if (!marker.isEmpty() && !aiTemplate.header().contains(marker) && !aiTemplate.overview().contains(marker)) {
			errors.add("templates.ai_generated: header or overview must contain the marker '" + marker + "'");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Changelog configuration validation failed (" + source + "):");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new ChangelogConfigurationException(errorMsg.toString());
		}

		logger.info("Loaded changelog configuration from {} ({} categories, {} cleanup patterns)", source,
				categories.size(), cleanupPatterns.size());
		return new ChangelogConfiguration(categories, classificationOrder, cleanupPatterns, icons, defaultIcon,
				aiTemplate, basicTemplate, appendix, prompts, analysis, marker);
	}

	private void parseCategories(JsonNode node, Map<CommitCategory, ChangelogConfiguration.CategoryDefinition> target,
			List<CommitCategory> order, List<String> errors) {
		if (!node.isObject()) {
			errors.add("categories: must be an object of category definitions");
			return;
		}
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			String key = field.getKey();
			CommitCategory category = CommitCategory.fromKey(key).orElse(null);
			if (category == null) {
				errors.add("categories." + key + ": unknown category");
				continue;
			}
			if (target.containsKey(category)) {
				errors.add("categories." + key + ": duplicate definition of " + category);
				continue;
			}
			String path = "categories." + key;
			String title = requiredText(field.getValue(), "title", path, errors);
			String patternText = field.getValue().path("pattern").asText("");

			Pattern pattern = null;
			if (category == CommitCategory.OTHER) {
				if (!patternText.isEmpty()) {
					errors.add(path + ": OTHER is the fallback category and must not define a pattern");
				}
			}
			else if (patternText.isEmpty()) {
				errors.add(path + ": pattern is required");
			}
			else {
				pattern = compile(patternText, path + ".pattern", errors);
				order.add(category);
			}
			target.put(category, new ChangelogConfiguration.CategoryDefinition(title, pattern));
		}
		for (CommitCategory category : CommitCategory.values()) {
			if (!target.containsKey(category)) {
				errors.add("categories: missing definition for " + category.key());
			}
		}
	}

	private List<Pattern> parseCleanupPatterns(JsonNode node, List<String> errors) {
		List<Pattern> patterns = new ArrayList<>();
		if (!node.isArray()) {
			errors.add("cleanup_patterns: must be an array of regular expressions");
			return patterns;
		}
		for (int i = 0; i < node.size(); i++) {
			Pattern pattern = compile(node.get(i).asText(""), "cleanup_patterns[" + i + "]", errors);
			if (pattern != null) {
				patterns.add(pattern);
			}
		}
		return patterns;
	}

	private String parseIcons(JsonNode node, Map<Integer, String> target, List<String> errors) {
		if (!node.isObject()) {
			errors.add("importance_icons: must be an object mapping importance to icon");
			return "";
		}
		String defaultIcon = "";
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if ("default_icon".equals(field.getKey())) {
				defaultIcon = field.getValue().asText("");
				continue;
			}
			try {
				target.put(Integer.parseInt(field.getKey().trim()), field.getValue().asText(""));
			}
			catch (NumberFormatException e) {
				errors.add("importance_icons." + field.getKey() + ": key must be an integer importance");
			}
		}
		if (defaultIcon.isEmpty()) {
			errors.add("importance_icons.default_icon: is required");
		}
		return defaultIcon;
	}

	private ChangelogConfiguration.DocumentTemplate parseTemplate(JsonNode node, String path, boolean aiBacked,
			List<String> errors) {
		if (!node.isObject()) {
			errors.add(path + ": template set is required");
		}
		String header = requiredTemplate(node, "header", path, Set.of("version"), errors);
		String overview = aiBacked ? requiredTemplate(node, "overview", path, Set.of("summary"), errors)
				: requiredText(node, "overview", path, errors);
		String highlights = aiBacked ? requiredTemplate(node, "highlights", path, Set.of("highlights"), errors) : null;
		String divider = requiredText(node, "divider", path, errors);
		String categoryHeader = requiredTemplate(node, "category_header", path, Set.of("title"), errors);
		Set<String> itemPlaceholders = aiBacked ? Set.of("icon", "message", "hash") : Set.of("message", "hash");
		String itemFormat = requiredTemplate(node, "item_format", path, itemPlaceholders, errors);
		return new ChangelogConfiguration.DocumentTemplate(header, overview, highlights, divider, categoryHeader,
				itemFormat);
	}

	private ChangelogConfiguration.AnalysisSettings parseAnalysis(JsonNode node, List<String> errors) {
		String model = requiredText(node, "model", "analysis", errors);
		double temperature = node.path("temperature").asDouble(-1);
		if (temperature < 0 || temperature > 2) {
			errors.add("analysis.temperature: must be between 0 and 2");
		}
		int maxTokens = node.path("max_tokens").asInt(0);
		if (maxTokens <= 0) {
			errors.add("analysis.max_tokens: must be positive");
		}
		int timeoutSeconds = node.path("timeout_seconds").asInt(0);
		if (timeoutSeconds <= 0) {
			errors.add("analysis.timeout_seconds: must be positive");
		}
		return new ChangelogConfiguration.AnalysisSettings(model, temperature, maxTokens,
				Duration.ofSeconds(Math.max(timeoutSeconds, 1)));
	}

	private String requiredText(JsonNode node, String field, String path, List<String> errors) {
		JsonNode value = node.path(field);
		if (!value.isTextual() || value.asText().isEmpty()) {
			errors.add(path + "." + field + ": is required");
			return "";
		}
		return value.asText();
	}

	private String requiredTemplate(JsonNode node, String field, String path, Set<String> placeholders,
			List<String> errors) {
		String template = requiredText(node, field, path, errors);
		if (!template.isEmpty()) {
			Set<String> present = TemplateRenderer.placeholders(template);
			for (String placeholder : placeholders) {
				if (!present.contains(placeholder)) {
					errors.add(path + "." + field + ": missing placeholder {" + placeholder + "}");
				}
			}
		}
		return template;
	}

	@Nullable
	private Pattern compile(String regex, String path, List<String> errors) {
		if (regex.isEmpty()) {
			errors.add(path + ": empty pattern");
			return null;
		}
		try {
			return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		}
		catch (PatternSyntaxException e) {
			errors.add(path + ": invalid pattern '" + regex + "' (" + e.getDescription() + ")");
			return null;
		}
	}

}
