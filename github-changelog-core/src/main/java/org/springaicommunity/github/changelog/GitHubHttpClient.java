package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the GitHub REST API using the JDK {@link HttpClient}.
 *
 * <p>
 * Authenticates with a bearer token and logs the rate limit headers of every response.
 * Non-2xx responses become a {@link GitHubApiException} carrying the rate limit state,
 * with the {@code message} field of the GitHub error document when one is present.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final ObjectMapper ERROR_MAPPER = ObjectMapperFactory.create();

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	private final Duration requestTimeout;

	public GitHubHttpClient(String token) {
		this(token, "https://api.github.com", Duration.ofSeconds(30), Duration.ofSeconds(60));
	}

	public GitHubHttpClient(String token, String baseUrl, Duration connectTimeout, Duration requestTimeout) {
		this.token = token;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		String url = resolve(path);
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = baseRequest(url).GET().build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = resolve(path);
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	@Override
	public String patch(String path, String body) {
		String url = resolve(path);
		logger.debug("PATCH {} ({} bytes)", url, body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = baseRequest(url).header("Content-Type", "application/json")
			.method("PATCH", HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("PATCH {} completed in {}ms", url, System.currentTimeMillis() - start);
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("PATCH {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String resolve(String path) {
		return path.startsWith("http") ? path : baseUrl + path;
	}

	private HttpRequest.Builder baseRequest(String url) {
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("User-Agent", "github-changelog");
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Rate limit headers come with every response, 2xx included
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);

			if (remaining >= 0) {
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			String detail = errorMessage(response.body());
			if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: " + detail + ". Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							response.body(), remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + detail, statusCode, response.body(), remaining, reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error " + statusCode + ": " + detail, statusCode,
						response.body(), remaining, reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Extract the {@code message} field of a GitHub error document, falling back to the
	 * raw body.
	 */
	static String errorMessage(@Nullable String body) {
		if (body == null || body.isBlank()) {
			return "(empty response)";
		}
		try {
			JsonNode node = ERROR_MAPPER.readTree(body);
			if (node != null && node.hasNonNull("message")) {
				return node.get("message").asText();
			}
		}
		catch (IOException e) {
			logger.debug("Error response is not JSON: {}", e.getMessage());
		}
		return body;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries rate limit information when available, enabling smart retry logic in
	 * {@link RetryingGitHubClient}.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

	}

}
