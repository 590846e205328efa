package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the free-form text returned by the analysis service into an
 * {@link AnalysisResult}.
 *
 * <p>
 * Extraction strategies are tried in order, the first one yielding a JSON object wins:
 * <ol>
 * <li>the whole response</li>
 * <li>the content of a {@code ```json} fenced block</li>
 * <li>the content of any fenced block</li>
 * </ol>
 * When none applies the result is empty and the caller falls back to the rule-based
 * changelog. Malformed input never raises.
 */
public class AnalysisResponseInterpreter {

	private static final Logger logger = LoggerFactory.getLogger(AnalysisResponseInterpreter.class);

	public static final String DEFAULT_SUMMARY = "AI-assisted release analysis";

	private static final Pattern JSON_FENCE = Pattern.compile("```json[ \\t]*\\R?(.*?)```",
			Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

	private static final Pattern ANY_FENCE = Pattern.compile("```[\\w+-]*[ \\t]*\\R?(.*?)```", Pattern.DOTALL);

	private static final List<String> ITEM_ID_FIELDS = List.of("hash", "commit_id", "id");

	private final ObjectMapper objectMapper;

	private final List<ExtractionStrategy> strategies = List.of(
			new ExtractionStrategy("direct", text -> Optional.of(text.trim())),
			new ExtractionStrategy("json code block", text -> fenced(JSON_FENCE, text)),
			new ExtractionStrategy("code block", text -> fenced(ANY_FENCE, text)));

	public AnalysisResponseInterpreter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Interpret an analysis response.
	 * @param rawText the response content
	 * @return the structured result, or empty if no JSON document could be found
	 */
	public Optional<AnalysisResult> interpret(String rawText) {
		for (ExtractionStrategy strategy : strategies) {
			Optional<JsonNode> document = strategy.extractor().apply(rawText).flatMap(this::parseObject);
			if (document.isPresent()) {
				logger.debug("Analysis response parsed using strategy '{}'", strategy.name());
				return Optional.of(toResult(document.get()));
			}
		}
		logger.warn("Analysis response contains no JSON document ({} characters)", rawText.length());
		return Optional.empty();
	}

	private static Optional<String> fenced(Pattern fence, String text) {
		Matcher matcher = fence.matcher(text);
		return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
	}

	private Optional<JsonNode> parseObject(String candidate) {
		if (candidate.isEmpty()) {
			return Optional.empty();
		}
		try {
			JsonNode node = objectMapper.readTree(candidate);
			return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
		}
		catch (JsonProcessingException e) {
			logger.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
			return Optional.empty();
		}
	}

	private AnalysisResult toResult(JsonNode document) {
		String summary = document.path("summary").asText("").trim();
		if (summary.isEmpty()) {
			summary = DEFAULT_SUMMARY;
		}

		List<String> highlights = new ArrayList<>();
		for (JsonNode highlight : document.path("highlights")) {
			String text = highlight.isValueNode() ? highlight.asText("").trim() : "";
			if (!text.isEmpty()) {
				highlights.add(text);
			}
		}

		Map<CommitCategory, List<AnalysisResult.Item>> categories = new EnumMap<>(CommitCategory.class);
		Iterator<Map.Entry<String, JsonNode>> fields = document.path("categories").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			Optional<CommitCategory> category = CommitCategory.fromKey(field.getKey());
			if (category.isEmpty()) {
				logger.debug("Ignoring unknown analysis category '{}'", field.getKey());
				continue;
			}
			List<AnalysisResult.Item> items = categories.computeIfAbsent(category.get(), c -> new ArrayList<>());
			for (JsonNode itemNode : field.getValue()) {
				toItem(itemNode).ifPresent(items::add);
			}
		}
		return new AnalysisResult(categories, summary, highlights);
	}

	private Optional<AnalysisResult.Item> toItem(JsonNode node) {
		String message = node.path("message").asText("").trim();
		if (message.isEmpty()) {
			return Optional.empty();
		}
		String commitId = "";
		for (String field : ITEM_ID_FIELDS) {
			String value = node.path(field).asText("").trim();
			if (!value.isEmpty()) {
				commitId = value;
				break;
			}
		}
		int importance = node.path("importance").asInt(1);
		return Optional.of(new AnalysisResult.Item(commitId, message, importance));
	}

	private record ExtractionStrategy(String name, Function<String, Optional<String>> extractor) {
	}

}
