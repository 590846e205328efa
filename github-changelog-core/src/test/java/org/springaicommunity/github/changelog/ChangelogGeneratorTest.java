package org.springaicommunity.github.changelog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.changelog.GitHistoryProvider.LogQuery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ChangelogGenerator Tests")
@ExtendWith(MockitoExtension.class)
class ChangelogGeneratorTest {

	@Mock
	private ReleaseService releaseService;

	@Mock
	private ProgressListener listener;

	private static Release release(String tag) {
		return new Release(42, tag, "");
	}

	@Nested
	@DisplayName("Mode Dispatch")
	class DispatchTest {

		@Mock
		private ReleaseChangelogService releaseChangelogService;

		@Mock
		private BatchChangelogService batchChangelogService;

		private ChangelogGenerator generator;

		@BeforeEach
		void setUp() {
			generator = new ChangelogGenerator(releaseService, releaseChangelogService, batchChangelogService,
					listener, new ChangelogProperties(), Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
		}

		@Test
		@DisplayName("Should process the release given by id in workflow_call mode")
		void shouldProcessReleaseById() {
			Release release = release("v1.2.0");
			ReleaseReport report = ReleaseReport.of(ReleaseOutcome.succeeded("v1.2.0", false, 3), 42L);
			when(releaseService.getReleaseById("42")).thenReturn(release);
			when(releaseChangelogService.process(release, false)).thenReturn(report);

			RunResult result = generator.run(RunRequest.explicit(RunMode.WORKFLOW_CALL, "v1.2.0", "42"));

			assertThat(result.successful()).isTrue();
			assertThat(result.exitCode()).isZero();
			assertThat(result.release()).isSameAs(report);
			verify(listener).releaseCompleted(RunMode.WORKFLOW_CALL, report);
		}

		@Test
		@DisplayName("Should use the requested version over the release tag")
		void shouldOverrideTagWithVersion() {
			when(releaseService.getReleaseById("42")).thenReturn(release("untagged-draft"));
			when(releaseChangelogService.process(any(), anyBoolean()))
				.thenReturn(ReleaseReport.of(ReleaseOutcome.succeeded("v1.2.0", false, 1), 42L));

			generator.run(RunRequest.explicit(RunMode.AUTO_RELEASE, "v1.2.0", "42"));

			ArgumentCaptor<Release> processed = ArgumentCaptor.forClass(Release.class);
			verify(releaseChangelogService).process(processed.capture(), eq(false));
			assertThat(processed.getValue().tagName()).isEqualTo("v1.2.0");
			assertThat(processed.getValue().id()).isEqualTo(42L);
		}

		@Test
		@DisplayName("Should force regeneration of a named release")
		void shouldForceNamedRelease() {
			Release release = release("v1.1.0");
			when(releaseService.getReleaseByTag("v1.1.0")).thenReturn(Optional.of(release));
			when(releaseChangelogService.process(release, true))
				.thenReturn(ReleaseReport.of(ReleaseOutcome.succeeded("v1.1.0", true, 5), 42L));

			RunResult result = generator.run(RunRequest.named("v1.1.0"));

			assertThat(result.mode()).isEqualTo(RunMode.NAMED);
			assertThat(result.successful()).isTrue();
		}

		@Test
		@DisplayName("Should fail when the latest release does not exist")
		void shouldFailWhenReleaseMissing() {
			when(releaseService.getLatestRelease()).thenReturn(Optional.empty());

			RunResult result = generator.run(RunRequest.latest());

			assertThat(result.exitCode()).isEqualTo(1);
			assertThat(result.release().outcome().reason()).isEqualTo("release not found");
			verifyNoInteractions(releaseChangelogService);
			verify(listener).releaseCompleted(eq(RunMode.LATEST), any());
		}

		@Test
		@DisplayName("Should report a lookup failure instead of throwing")
		void shouldReportLookupFailure() {
			when(releaseService.getReleaseById("42"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Not found: /releases/42", 404, "{}"));

			RunResult result = generator.run(RunRequest.explicit(RunMode.WORKFLOW_CALL, "v1.2.0", "42"));

			assertThat(result.successful()).isFalse();
			assertThat(result.release().outcome().tag()).isEqualTo("v1.2.0");
			assertThat(result.release().outcome().reason()).startsWith("release lookup failed: Not found");
		}

		@Test
		@DisplayName("Should delegate batch runs")
		void shouldDelegateBatch() {
			BatchResult batch = new BatchResult(BatchStats.start(0, Instant.EPOCH), List.of(), 0.8, true,
					Duration.ZERO);
			when(batchChangelogService.run(true)).thenReturn(batch);

			RunResult result = generator.run(RunRequest.batch(true));

			assertThat(result.batch()).isSameAs(batch);
			assertThat(result.successful()).isTrue();
		}

		@Test
		@DisplayName("Should fail the batch when releases cannot be listed")
		void shouldFailBatchOnEnumerationError() {
			when(batchChangelogService.run(false))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error 500: boom", 500, ""));

			RunResult result = generator.run(RunRequest.batch(false));

			assertThat(result.successful()).isFalse();
			assertThat(result.batch().stats().totalReleases()).isZero();
			verify(listener).batchCompleted(result.batch());
		}

	}

	@Nested
	@DisplayName("Builder")
	class BuilderTest {

		@Mock
		private GitHistoryProvider history;

		@Test
		@DisplayName("Should require a repository")
		void shouldRequireRepository() {
			assertThatThrownBy(() -> ChangelogGeneratorBuilder.create().token("ghp_x").build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Repository");
		}

		@Test
		@DisplayName("Should require a token")
		void shouldRequireToken() {
			assertThatThrownBy(() -> ChangelogGeneratorBuilder.create().repository("owner/repo").build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("token");
		}

		@Test
		@DisplayName("Should publish a rule-based changelog without an analysis key")
		void shouldRunEndToEnd() {
			when(releaseService.getLatestRelease()).thenReturn(Optional.of(release("v1.1.0")));
			when(history.listTags()).thenReturn(List.of("v1.0.0", "v1.1.0"));
			when(history.log(LogQuery.range("v1.0.0", "v1.1.0", false)))
				.thenReturn(List.of("a1|feat: add X|", "b2|fix: bug Y|"));
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			ChangelogGenerator generator = ChangelogGeneratorBuilder.create()
				.releaseService(releaseService)
				.historyProvider(history)
				.listener(listener)
				.sleeper(ms -> {
				})
				.build();
			RunResult result = generator.run(RunRequest.latest());

			assertThat(result.successful()).isTrue();
			assertThat(result.release().outcome().aiUsed()).isFalse();
			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(releaseService).updateReleaseBody(eq(42L), body.capture());
			assertThat(body.getValue()).contains("✨ New Features").contains("add X").contains("🐛 Bug Fixes");
		}

	}

}
