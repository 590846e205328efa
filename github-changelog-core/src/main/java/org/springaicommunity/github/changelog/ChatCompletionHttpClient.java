package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link AnalysisClient} for OpenAI-compatible {@code chat/completions} endpoints such
 * as DeepSeek, using the JDK {@link HttpClient}.
 */
public class ChatCompletionHttpClient implements AnalysisClient {

	private static final Logger logger = LoggerFactory.getLogger(ChatCompletionHttpClient.class);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI endpoint;

	private final String apiKey;

	/**
	 * Create the client.
	 * @throws ChangelogConfigurationException if the base URL is not a valid absolute
	 * HTTP(S) URL
	 */
	public ChatCompletionHttpClient(String apiKey, String baseUrl, Duration connectTimeout,
			ObjectMapper objectMapper) {
		this.apiKey = apiKey;
		this.endpoint = endpointUri(completionsUrl(baseUrl));
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
	}

	/**
	 * Build the completions URL, accepting base URLs with or without the {@code /v1}
	 * segment.
	 */
	static String completionsUrl(String baseUrl) {
		String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		return base.endsWith("/v1") ? base + "/chat/completions" : base + "/v1/chat/completions";
	}

	private static URI endpointUri(String url) {
		URI uri;
		try {
			uri = URI.create(url);
		}
		catch (IllegalArgumentException e) {
			throw new ChangelogConfigurationException("Invalid analysis API base URL: " + url, e);
		}
		if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())
				|| uri.getHost() == null) {
			throw new ChangelogConfigurationException("Analysis API base URL must be an absolute HTTP(S) URL: " + url);
		}
		return uri;
	}

	@Override
	public String complete(String systemPrompt, String userPrompt, ChangelogConfiguration.AnalysisSettings settings) {
		String body = requestBody(systemPrompt, userPrompt, settings);
		logger.debug("POST {} (model {}, {} bytes)", endpoint, settings.model(), body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.timeout(settings.timeout())
			.header("Authorization", "Bearer " + apiKey)
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw new AnalysisServiceException("Analysis request timed out after " + settings.timeout().toSeconds()
					+ "s", e);
		}
		catch (IOException e) {
			throw new AnalysisServiceException("Analysis request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AnalysisServiceException("Analysis request interrupted", e);
		}

		logger.debug("POST {} returned {} in {}ms", endpoint, response.statusCode(),
				System.currentTimeMillis() - start);
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new AnalysisServiceException("Analysis service returned " + response.statusCode() + ": "
					+ GitHubHttpClient.errorMessage(response.body()), response.statusCode());
		}
		return extractContent(response.body());
	}

	private String requestBody(String systemPrompt, String userPrompt,
			ChangelogConfiguration.AnalysisSettings settings) {
		ObjectNode root = objectMapper.createObjectNode();
		root.put("model", settings.model());
		ArrayNode messages = root.putArray("messages");
		messages.addObject().put("role", "system").put("content", systemPrompt);
		messages.addObject().put("role", "user").put("content", userPrompt);
		root.put("temperature", settings.temperature());
		root.put("max_tokens", settings.maxTokens());
		try {
			return objectMapper.writeValueAsString(root);
		}
		catch (JsonProcessingException e) {
			throw new AnalysisServiceException("Failed to serialize analysis request", e);
		}
	}

	private String extractContent(String responseBody) {
		JsonNode root;
		try {
			root = objectMapper.readTree(responseBody);
		}
		catch (JsonProcessingException e) {
			throw new AnalysisServiceException("Analysis response is not JSON: " + e.getOriginalMessage(), e);
		}
		String content = root.path("choices").path(0).path("message").path("content").asText("");
		if (content.isBlank()) {
			throw new AnalysisServiceException("Analysis response has no message content");
		}
		return content;
	}

}
