package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ReleaseService} backed by the GitHub REST releases API.
 *
 * <p>
 * Converts GitHub API JSON responses to {@link Release} records at the service boundary.
 */
public class GitHubReleaseService implements ReleaseService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubReleaseService.class);

	/**
	 * Accepted repository format: {@code owner/repo}.
	 */
	static final String REPOSITORY_PATTERN = "^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final String releasesPath;

	/**
	 * Create a release service for one repository.
	 * @param httpClient GitHub client (reads may be retried by a decorator)
	 * @param objectMapper mapper used to read and write payloads
	 * @param repository repository in "owner/repo" format
	 */
	public GitHubReleaseService(GitHubClient httpClient, ObjectMapper objectMapper, String repository) {
		if (!repository.matches(REPOSITORY_PATTERN)) {
			throw new IllegalArgumentException("Repository must be in format 'owner/repo': " + repository);
		}
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.releasesPath = "/repos/" + repository + "/releases";
	}

	@Override
	public SearchResult<Release> listReleases(int page, int perPage) {
		String response = httpClient.getWithQuery(releasesPath, "per_page=" + perPage + "&page=" + page);
		JsonNode nodes = readTree(response);

		List<Release> releases = new ArrayList<>();
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				releases.add(parseRelease(node));
			}
		}
		boolean hasMore = releases.size() >= perPage;
		logger.debug("Listed {} releases on page {}", releases.size(), page);
		return new SearchResult<>(releases, hasMore ? page + 1 : null, hasMore);
	}

	@Override
	public Release getReleaseById(String releaseId) {
		return parseRelease(readTree(httpClient.get(releasesPath + "/" + releaseId)));
	}

	@Override
	public Optional<Release> getReleaseByTag(String tag) {
		try {
			String response = httpClient.get(releasesPath + "/tags/" + URLEncoder.encode(tag, StandardCharsets.UTF_8));
			return Optional.of(parseRelease(readTree(response)));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 404) {
				logger.info("No release found for tag {}", tag);
				return Optional.empty();
			}
			throw e;
		}
	}

	@Override
	public Optional<Release> getLatestRelease() {
		try {
			return Optional.of(parseRelease(readTree(httpClient.get(releasesPath + "/latest"))));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 404) {
				logger.info("Repository has no published release");
				return Optional.empty();
			}
			throw e;
		}
	}

	@Override
	public boolean updateReleaseBody(long releaseId, String body) {
		ObjectNode payload = objectMapper.createObjectNode();
		payload.put("body", body);
		try {
			httpClient.patch(releasesPath + "/" + releaseId, objectMapper.writeValueAsString(payload));
			logger.info("Updated body of release {} ({} characters)", releaseId, body.length());
			return true;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			logger.error("Failed to update release {}: {}", releaseId, e.getMessage());
			return false;
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to serialize body of release {}: {}", releaseId, e.getMessage());
			return false;
		}
	}

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GitHub response: " + e.getOriginalMessage(), e);
		}
	}

	private Release parseRelease(JsonNode node) {
		return new Release(node.path("id").asLong(), node.path("tag_name").asText(""),
				node.path("body").asText(null));
	}

}
