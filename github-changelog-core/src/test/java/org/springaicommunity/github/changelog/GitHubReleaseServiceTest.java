package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GitHubReleaseService} with a mocked {@link GitHubClient}. No real
 * GitHub API calls.
 */
@DisplayName("GitHubReleaseService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubReleaseServiceTest {

	private static final String RELEASE_JSON = """
			{
			    "id": 42,
			    "tag_name": "v1.1.0",
			    "name": "Version 1.1.0",
			    "body": "Initial notes",
			    "draft": false,
			    "prerelease": true,
			    "published_at": "2024-05-01T10:15:30Z",
			    "html_url": "https://github.com/owner/repo/releases/tag/v1.1.0"
			}
			""";

	@Mock
	private GitHubClient httpClient;

	private ObjectMapper objectMapper;

	private GitHubReleaseService service;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		service = new GitHubReleaseService(httpClient, objectMapper, "owner/repo");
	}

	@ParameterizedTest
	@ValueSource(strings = { "owner", "owner/repo/extra", "owner/", "/repo", "owner repo" })
	@DisplayName("Should reject malformed repository names")
	void shouldRejectMalformedRepository(String repository) {
		assertThatThrownBy(() -> new GitHubReleaseService(httpClient, objectMapper, repository))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("owner/repo");
	}

	@Nested
	@DisplayName("Lookup")
	class LookupTest {

		@Test
		@DisplayName("Should map the release document")
		void shouldParseRelease() {
			when(httpClient.get("/repos/owner/repo/releases/42")).thenReturn(RELEASE_JSON);

			Release release = service.getReleaseById("42");

			assertThat(release.id()).isEqualTo(42L);
			assertThat(release.tagName()).isEqualTo("v1.1.0");
			assertThat(release.body()).isEqualTo("Initial notes");
		}

		@Test
		@DisplayName("Should treat a null body as empty")
		void shouldHandleNullBody() {
			when(httpClient.get("/repos/owner/repo/releases/latest"))
				.thenReturn("{\"id\": 7, \"tag_name\": \"v2.0.0\", \"body\": null, \"published_at\": null}");

			Optional<Release> release = service.getLatestRelease();

			assertThat(release).isPresent();
			assertThat(release.get().body()).isNull();
			assertThat(release.get().existingBody()).isEmpty();
		}

		@Test
		@DisplayName("Should find a release by tag")
		void shouldFindByTag() {
			when(httpClient.get("/repos/owner/repo/releases/tags/v1.1.0")).thenReturn(RELEASE_JSON);

			assertThat(service.getReleaseByTag("v1.1.0")).map(Release::id).contains(42L);
		}

		@Test
		@DisplayName("Should return empty for an unknown tag")
		void shouldReturnEmptyForUnknownTag() {
			when(httpClient.get(anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Not found", 404, "{}"));

			assertThat(service.getReleaseByTag("v9.9.9")).isEmpty();
			assertThat(service.getLatestRelease()).isEmpty();
		}

		@Test
		@DisplayName("Should propagate other upstream errors")
		void shouldPropagateServerErrors() {
			when(httpClient.get(anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error 502", 502, "{}"));

			assertThatThrownBy(() -> service.getReleaseByTag("v1.0.0"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		}

		@Test
		@DisplayName("Should reject a malformed response")
		void shouldRejectMalformedResponse() {
			when(httpClient.get("/repos/owner/repo/releases/1")).thenReturn("<html>");

			assertThatThrownBy(() -> service.getReleaseById("1")).isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.hasMessageContaining("Malformed");
		}

	}

	@Nested
	@DisplayName("Listing")
	class ListingTest {

		@Test
		@DisplayName("Should report another page when the page is full")
		void shouldReportMorePages() {
			when(httpClient.getWithQuery("/repos/owner/repo/releases", "per_page=2&page=1"))
				.thenReturn("[" + RELEASE_JSON + "," + RELEASE_JSON + "]");

			SearchResult<Release> page = service.listReleases(1, 2);

			assertThat(page.items()).hasSize(2);
			assertThat(page.hasMore()).isTrue();
			assertThat(page.nextPage()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should stop on a partial page")
		void shouldStopOnPartialPage() {
			when(httpClient.getWithQuery("/repos/owner/repo/releases", "per_page=30&page=3"))
				.thenReturn("[" + RELEASE_JSON + "]");

			SearchResult<Release> page = service.listReleases(3, 30);

			assertThat(page.hasMore()).isFalse();
			assertThat(page.nextPage()).isNull();
		}

	}

	@Nested
	@DisplayName("Publishing")
	class PublishingTest {

		@Test
		@DisplayName("Should replace the body with a JSON-escaped document")
		void shouldUpdateBody() throws Exception {
			when(httpClient.patch(eq("/repos/owner/repo/releases/42"), anyString())).thenReturn(RELEASE_JSON);

			boolean updated = service.updateReleaseBody(42, "## Notes\n- \"quoted\" item");

			assertThat(updated).isTrue();
			ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
			verify(httpClient).patch(eq("/repos/owner/repo/releases/42"), payload.capture());
			assertThat(objectMapper.readTree(payload.getValue()).path("body").asText())
				.isEqualTo("## Notes\n- \"quoted\" item");
		}

		@Test
		@DisplayName("Should report a rejected update as false")
		void shouldReportRejectedUpdate() {
			when(httpClient.patch(anyString(), anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Forbidden: not allowed", 403, "{}"));

			assertThat(service.updateReleaseBody(42, "body")).isFalse();
		}

	}

}
