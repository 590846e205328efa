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

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ReleaseChangelogService Tests")
@ExtendWith(MockitoExtension.class)
class ReleaseChangelogServiceTest {

	private static final String AI_RESPONSE = """
			{"summary": "Adds X and fixes Y.",
			 "highlights": ["X"],
			 "categories": {"FEATURE": [{"hash": "a1", "message": "Feature X", "importance": 4}]}}
			""";

	@Mock
	private GitHistoryProvider history;

	@Mock
	private AnalysisClient analysisClient;

	@Mock
	private ReleaseService releaseService;

	private ChangelogConfiguration configuration;

	@BeforeEach
	void setUp() {
		configuration = TestConfigurations.defaults();
	}

	private ReleaseChangelogService service(AnalysisClient client) {
		return new ReleaseChangelogService(new CommitRangeResolver(history), new CommitClassifier(configuration),
				new CommitAnalysisService(client, new AnalysisResponseInterpreter(ObjectMapperFactory.create()),
						configuration),
				new ChangelogAssembler(configuration), releaseService, configuration);
	}

	private static Release release(String body) {
		return new Release(42, "v1.1.0", body);
	}

	private void givenThreeCommits() {
		when(history.listTags()).thenReturn(List.of("v1.0.0", "v1.1.0"));
		when(history.log(LogQuery.range("v1.0.0", "v1.1.0", false)))
			.thenReturn(List.of("a1|feat: add X|", "b2|fix: bug Y|", "c3|update docs|"));
	}

	private String publishedBody() {
		ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
		verify(releaseService).updateReleaseBody(eq(42L), body.capture());
		return body.getValue();
	}

	@Nested
	@DisplayName("Publishing")
	class PublishingTest {

		@Test
		@DisplayName("Should publish the AI-backed document when the analysis succeeds")
		void shouldPublishAiDocument() {
			givenThreeCommits();
			when(analysisClient.complete(anyString(), anyString(), any())).thenReturn(AI_RESPONSE);
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			ReleaseReport report = service(analysisClient).process(release(""), false);

			assertThat(report.outcome().isSucceeded()).isTrue();
			assertThat(report.outcome().aiUsed()).isTrue();
			assertThat(report.outcome().commitCount()).isEqualTo(3);
			assertThat(report.generationMode()).isEqualTo("ai");
			assertThat(report.rangeLabel()).isEqualTo("v1.0.0..v1.1.0");
			assertThat(report.categoryCounts()).containsEntry(CommitCategory.FEATURE, 1)
				.containsEntry(CommitCategory.FIX, 1)
				.containsEntry(CommitCategory.OTHER, 1);
			assertThat(publishedBody()).contains(configuration.generatedMarker())
				.contains("- ⭐ Feature X (a1)")
				.contains("- feat: add X (a1)");
		}

		@Test
		@DisplayName("Should send the commit digest in the prompt")
		void shouldSendDigest() {
			givenThreeCommits();
			when(analysisClient.complete(anyString(), anyString(), any())).thenReturn(AI_RESPONSE);
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			service(analysisClient).process(release(""), false);

			ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
			verify(analysisClient).complete(eq(configuration.prompts().systemPrompt()), prompt.capture(),
					eq(configuration.analysis()));
			assertThat(prompt.getValue()).contains("a1|feat: add X\nb2|fix: bug Y\nc3|update docs")
				.doesNotContain("{commits_text}");
		}

		@Test
		@DisplayName("Should fall back to the rule-based document when the analysis fails")
		void shouldFallBackOnAnalysisFailure() {
			givenThreeCommits();
			when(analysisClient.complete(anyString(), anyString(), any()))
				.thenThrow(new AnalysisServiceException("Analysis request timed out"));
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			ReleaseReport report = service(analysisClient).process(release(""), false);

			assertThat(report.outcome().isSucceeded()).isTrue();
			assertThat(report.outcome().aiUsed()).isFalse();
			assertThat(report.generationMode()).isEqualTo("basic");
			assertThat(report.analysisFailure()).isEqualTo("Analysis request timed out");
			assertThat(publishedBody()).contains("- add X (a1)").contains("- bug Y (b2)");
		}

		@Test
		@DisplayName("Should fall back when the analysis response is unparseable")
		void shouldFallBackOnUnparseableResponse() {
			givenThreeCommits();
			when(analysisClient.complete(anyString(), anyString(), any())).thenReturn("I am not JSON");
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			ReleaseReport report = service(analysisClient).process(release(""), false);

			assertThat(report.outcome().aiUsed()).isFalse();
			assertThat(report.analysisFailure()).isEqualTo("unparseable analysis response");
		}

		@Test
		@DisplayName("Should use the rule-based document without an analysis client")
		void shouldWorkWithoutAnalysisClient() {
			givenThreeCommits();
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);

			ReleaseReport report = service(null).process(release(""), false);

			assertThat(report.outcome().isSucceeded()).isTrue();
			assertThat(report.analysisFailure()).isEqualTo("no analysis API key configured");
		}

		@Test
		@DisplayName("Should fail the release when the update is rejected")
		void shouldFailWhenUpdateRejected() {
			givenThreeCommits();
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(false);

			ReleaseReport report = service(null).process(release(""), false);

			assertThat(report.outcome().isFailed()).isTrue();
			assertThat(report.outcome().reason()).isEqualTo("failed to update release body");
			assertThat(report.outcome().commitCount()).isEqualTo(3);
		}

	}

	@Nested
	@DisplayName("Skipping and Failures")
	class SkipAndFailureTest {

		@Test
		@DisplayName("Should skip an already generated release unless regeneration is forced")
		void shouldSkipGeneratedRelease() {
			Release generated = release("## v1.1.0\n### 📋 " + "AI-generated changelog summary\n");

			ReleaseReport report = service(null).process(generated, false);

			assertThat(report.outcome().isSkipped()).isTrue();
			assertThat(report.outcome().reason()).isEqualTo(ReleaseOutcome.NO_OPTIMIZATION_NEEDED);
			verifyNoInteractions(history, releaseService);
		}

		@Test
		@DisplayName("Should regenerate an already generated release when forced")
		void shouldRegenerateWhenForced() {
			givenThreeCommits();
			when(releaseService.updateReleaseBody(eq(42L), anyString())).thenReturn(true);
			Release generated = release("AI-generated changelog summary");

			ReleaseReport report = service(null).process(generated, true);

			assertThat(report.outcome().isSucceeded()).isTrue();
		}

		@Test
		@DisplayName("Should skip an empty commit range without publishing")
		void shouldSkipEmptyRange() {
			when(history.listTags()).thenReturn(List.of("v1.0.0", "v1.1.0"));

			ReleaseReport report = service(analysisClient).process(release(null), false);

			assertThat(report.outcome().isSkipped()).isTrue();
			assertThat(report.outcome().reason()).isEqualTo(ReleaseOutcome.EMPTY_COMMIT_RANGE);
			verifyNoInteractions(releaseService, analysisClient);
		}

		@Test
		@DisplayName("Should turn history failures into a failed outcome")
		void shouldCatchHistoryFailure() {
			when(history.listTags()).thenThrow(new GitHistoryException("git tag --list exited with status 128"));

			ReleaseReport report = service(null).process(release(""), false);

			assertThat(report.outcome().isFailed()).isTrue();
			assertThat(report.outcome().reason()).contains("status 128");
			assertThat(report.releaseId()).isEqualTo(42);
		}

		@Test
		@DisplayName("Should turn publish errors into a failed outcome")
		void shouldCatchPublishFailure() {
			givenThreeCommits();
			when(releaseService.updateReleaseBody(eq(42L), anyString()))
				.thenThrow(new IllegalStateException("unexpected"));

			ReleaseReport report = service(null).process(release(""), false);

			assertThat(report.outcome().isFailed()).isTrue();
			assertThat(report.outcome().reason()).isEqualTo("unexpected");
		}

	}

}
