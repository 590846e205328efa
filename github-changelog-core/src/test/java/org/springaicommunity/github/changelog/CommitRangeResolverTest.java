package org.springaicommunity.github.changelog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springaicommunity.github.changelog.GitHistoryProvider.LogQuery;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CommitRangeResolver Tests")
@ExtendWith(MockitoExtension.class)
class CommitRangeResolverTest {

	@Mock
	private GitHistoryProvider history;

	private CommitRangeResolver resolver;

	@BeforeEach
	void setUp() {
		resolver = new CommitRangeResolver(history);
	}

	@Nested
	@DisplayName("Previous Tag Lookup")
	class PreviousTagTest {

		@Test
		@DisplayName("Should pick the next older version regardless of input order")
		void shouldPickNextOlderVersion() {
			List<String> tags = List.of("v1.1.0", "v1.10.0", "v1.2.0", "v1.9.0");

			assertThat(resolver.findPreviousTag("v1.10.0", tags)).contains("v1.9.0");
			assertThat(resolver.findPreviousTag("v1.2.0", tags)).contains("v1.1.0");
		}

		@Test
		@DisplayName("Should order a pre-release before its final version")
		void shouldOrderPreReleaseFirst() {
			List<String> tags = List.of("v2.0.0", "v2.0.0-rc1", "v1.5.0");

			assertThat(resolver.findPreviousTag("v2.0.0", tags)).contains("v2.0.0-rc1");
			assertThat(resolver.findPreviousTag("v2.0.0-rc1", tags)).contains("v1.5.0");
		}

		@Test
		@DisplayName("Should compare numeric pre-release identifiers as numbers")
		void shouldComparePreReleaseNumerically() {
			List<String> tags = List.of("v2.0.0-rc.10", "v2.0.0-rc.2", "v2.0.0-rc.1", "v2.0.0-beta.3", "v2.0.0");

			assertThat(resolver.findPreviousTag("v2.0.0-rc.2", tags)).contains("v2.0.0-rc.1");
			assertThat(resolver.findPreviousTag("v2.0.0-rc.10", tags)).contains("v2.0.0-rc.2");
			assertThat(resolver.findPreviousTag("v2.0.0-rc.1", tags)).contains("v2.0.0-beta.3");
			assertThat(resolver.findPreviousTag("v2.0.0", tags)).contains("v2.0.0-rc.10");
		}

		@Test
		@DisplayName("Should rank extra numeric components above the shorter version")
		void shouldRankExtraComponentsHigher() {
			List<String> tags = List.of("1.2.3", "1.2.3.1", "1.2.3.2", "1.2.4");

			assertThat(resolver.findPreviousTag("1.2.3.1", tags)).contains("1.2.3");
			assertThat(resolver.findPreviousTag("1.2.4", tags)).contains("1.2.3.2");
		}

		@Test
		@DisplayName("Should not treat build metadata as a pre-release")
		void shouldIgnoreBuildMetadata() {
			List<String> tags = List.of("v1.0.0", "v1.1.0+build.7", "v1.1.0-rc.1");

			assertThat(resolver.findPreviousTag("v1.1.0+build.7", tags)).contains("v1.1.0-rc.1");
		}

		@Test
		@DisplayName("Should ignore tags that are not version-shaped")
		void shouldIgnoreNonVersionTags() {
			List<String> tags = List.of("v1.0.0", "nightly", "release-candidate", "v1.1");

			assertThat(resolver.findPreviousTag("v1.1", tags)).contains("v1.0.0");
		}

		@Test
		@DisplayName("Should report no previous tag for the oldest version")
		void shouldHaveNoPreviousForOldest() {
			assertThat(resolver.findPreviousTag("v1.0.0", List.of("v1.0.0", "v1.1.0"))).isEmpty();
		}

		@Test
		@DisplayName("Should report no previous tag for an unknown target")
		void shouldHaveNoPreviousForUnknownTarget() {
			assertThat(resolver.findPreviousTag("v9.9.9", List.of("v1.0.0", "v1.1.0"))).isEmpty();
		}

	}

	@Nested
	@DisplayName("Range Resolution")
	@MockitoSettings(strictness = Strictness.LENIENT)
	class RangeResolutionTest {

		@Test
		@DisplayName("Should resolve the commits between two tags")
		void shouldResolveRangeBetweenTags() {
			when(history.listTags()).thenReturn(List.of("v1.1.0", "v1.0.0"));
			when(history.log(LogQuery.range("v1.0.0", "v1.1.0", false)))
				.thenReturn(List.of("a1|feat: add X|", "b2|fix: bug Y|details", "c3|update docs|"));

			CommitRange range = resolver.resolve("v1.1.0");

			assertThat(range.previousTag()).isEqualTo("v1.0.0");
			assertThat(range.rangeLabel()).isEqualTo("v1.0.0..v1.1.0");
			assertThat(range.isInitialVersion()).isFalse();
			assertThat(range.commits()).extracting(Commit::id).containsExactly("a1", "b2", "c3");
			assertThat(range.commits().get(1).body()).isEqualTo("details");
		}

		@Test
		@DisplayName("Should use the full history for an initial version")
		void shouldUseFullHistoryForInitialVersion() {
			when(history.log(LogQuery.range(null, "v1.0.0", false))).thenReturn(List.of("a1|initial commit|"));

			CommitRange range = resolver.resolve("v1.0.0", List.of("v1.0.0"));

			assertThat(range.previousTag()).isNull();
			assertThat(range.isInitialVersion()).isTrue();
			assertThat(range.rangeLabel()).contains("initial version");
			assertThat(range.commits()).hasSize(1);
		}

		@Test
		@DisplayName("Should widen the query until commits are found")
		void shouldWidenQueryInOrder() {
			when(history.log(LogQuery.singleCommit("v1.1.0"))).thenReturn(List.of("m1|Merge pull request #4|"));

			CommitRange range = resolver.resolve("v1.1.0", List.of("v1.0.0", "v1.1.0"));

			InOrder inOrder = inOrder(history);
			inOrder.verify(history).log(LogQuery.range("v1.0.0", "v1.1.0", false));
			inOrder.verify(history).log(LogQuery.range("v1.0.0", "v1.1.0", true));
			inOrder.verify(history).log(LogQuery.singleCommit("v1.1.0"));
			assertThat(range.commits()).extracting(Commit::subject).containsExactly("Merge pull request #4");
		}

		@Test
		@DisplayName("Should stop widening once merge commits are found")
		void shouldStopAfterMergeQuery() {
			when(history.log(LogQuery.range("v1.0.0", "v1.1.0", true))).thenReturn(List.of("m1|Merge branch 'x'|"));

			CommitRange range = resolver.resolve("v1.1.0", List.of("v1.0.0", "v1.1.0"));

			assertThat(range.commits()).hasSize(1);
			verify(history, never()).log(LogQuery.singleCommit("v1.1.0"));
		}

		@Test
		@DisplayName("Should return an empty range when nothing is found")
		void shouldReturnEmptyRange() {
			CommitRange range = resolver.resolve("v1.1.0", List.of("v1.0.0", "v1.1.0"));

			assertThat(range.isEmpty()).isTrue();
			verify(history, times(3)).log(any());
		}

		@Test
		@DisplayName("Should drop malformed log lines")
		void shouldDropMalformedLines() {
			when(history.log(LogQuery.range("v1.0.0", "v1.1.0", false)))
				.thenReturn(List.of("no separator", "|missing id|", "abc|", "d4|keep me|body|with|pipes"));

			CommitRange range = resolver.resolve("v1.1.0", List.of("v1.0.0", "v1.1.0"));

			assertThat(range.commits()).singleElement().satisfies(commit -> {
				assertThat(commit.id()).isEqualTo("d4");
				assertThat(commit.subject()).isEqualTo("keep me");
				assertThat(commit.body()).isEqualTo("body|with|pipes");
			});
		}

		@Test
		@DisplayName("Should propagate history failures")
		void shouldPropagateHistoryFailure() {
			when(history.listTags()).thenThrow(new GitHistoryException("git tag failed"));

			assertThatThrownBy(() -> resolver.resolve("v1.0.0")).isInstanceOf(GitHistoryException.class)
				.hasMessageContaining("git tag failed");
		}

	}

	@Nested
	@DisplayName("Log Query")
	class LogQueryTest {

		@Test
		@DisplayName("Should render revision ranges")
		void shouldRenderRevisionRange() {
			assertThat(LogQuery.range("v1.0.0", "v1.1.0", false).revisionRange()).isEqualTo("v1.0.0..v1.1.0");
			assertThat(LogQuery.range(null, "v1.1.0", false).revisionRange()).isEqualTo("v1.1.0");
			assertThat(LogQuery.singleCommit("v1.1.0").maxCount()).isEqualTo(1);
		}

	}

}
