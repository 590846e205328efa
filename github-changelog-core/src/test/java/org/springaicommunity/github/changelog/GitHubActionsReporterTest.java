package org.springaicommunity.github.changelog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubActionsReporter Tests")
class GitHubActionsReporterTest {

	@TempDir
	Path tempDir;

	private Path summaryFile;

	private Path outputFile;

	private GitHubActionsReporter reporter;

	@BeforeEach
	void setUp() {
		summaryFile = tempDir.resolve("summary.md");
		outputFile = tempDir.resolve("output.txt");
		reporter = new GitHubActionsReporter(summaryFile, outputFile, TestConfigurations.defaults());
	}

	@Nested
	@DisplayName("Single Release")
	class SingleReleaseTest {

		@Test
		@DisplayName("Should write the release table and outputs")
		void shouldWriteReleaseReport() throws IOException {
			ReleaseReport report = new ReleaseReport(ReleaseOutcome.succeeded("v1.1.0", true, 3), 42L,
					"v1.0.0..v1.1.0", Map.of(CommitCategory.FEATURE, 2, CommitCategory.FIX, 1), null);

			reporter.releaseCompleted(RunMode.WORKFLOW_CALL, report);

			String summary = Files.readString(summaryFile);
			assertThat(summary).contains("## Changelog generation: v1.1.0")
				.contains("| Mode | workflow_call |")
				.contains("| Release ID | 42 |")
				.contains("| Status | succeeded |")
				.contains("| AI analysis | used |")
				.contains("| Total commits | 3 |")
				.contains("- ✨ New Features: 2")
				.contains("- 🐛 Bug Fixes: 1");
			assertThat(Files.readAllLines(outputFile)).containsExactly("ai_success=true", "total_commits=3",
					"generation_mode=ai");
		}

		@Test
		@DisplayName("Should report a skipped release with its reason")
		void shouldWriteSkippedRelease() throws IOException {
			reporter.releaseCompleted(RunMode.AUTO_RELEASE,
					ReleaseReport.of(ReleaseOutcome.skipped("v1.1.0", ReleaseOutcome.NO_OPTIMIZATION_NEEDED, 0), 42L));

			assertThat(Files.readString(summaryFile)).contains("| Status | skipped |")
				.contains("| Reason | no optimization needed |")
				.doesNotContain("Commits by category");
			assertThat(Files.readAllLines(outputFile)).contains("ai_success=false", "generation_mode=basic");
		}

		@Test
		@DisplayName("Should append to existing files")
		void shouldAppend() throws IOException {
			Files.writeString(outputFile, "earlier=1\n");

			reporter.releaseCompleted(RunMode.NAMED,
					ReleaseReport.of(ReleaseOutcome.succeeded("v1.0.0", false, 1), 7L));

			assertThat(Files.readAllLines(outputFile)).first().isEqualTo("earlier=1");
		}

	}

	@Nested
	@DisplayName("Batch")
	class BatchTest {

		@Test
		@DisplayName("Should write the batch table, failures and outputs")
		void shouldWriteBatchReport() throws IOException {
			ReleaseOutcome ok = ReleaseOutcome.succeeded("v1.1.0", true, 4);
			ReleaseOutcome failed = ReleaseOutcome.failed("v1.0.0", "history unavailable", 0);
			BatchStats stats = BatchStats.start(2, Instant.EPOCH).record(ok).record(failed);
			BatchResult result = new BatchResult(stats, List.of(ok, failed), 0.8, false, Duration.ofSeconds(75));

			reporter.batchCompleted(result);

			assertThat(Files.readString(summaryFile)).contains("## Batch changelog generation")
				.contains("| Processed | 2 |")
				.contains("| Failed | 1 |")
				.contains("| Success rate | 50.0% |")
				.contains("| Duration | 1m15s |")
				.contains("| Result | failure |")
				.contains("- v1.0.0: history unavailable");
			assertThat(Files.readAllLines(outputFile)).containsExactly("ai_success=true", "total_commits=4",
					"generation_mode=batch", "processed_releases=2");
		}

	}

	@Test
	@DisplayName("Should skip output when the files are not configured")
	void shouldSkipMissingFiles() {
		GitHubActionsReporter silent = new GitHubActionsReporter(null, null, TestConfigurations.defaults());

		assertThatCode(() -> silent.releaseCompleted(RunMode.LATEST,
				ReleaseReport.of(ReleaseOutcome.succeeded("v1.0.0", false, 1), 1L)))
			.doesNotThrowAnyException();
		assertThat(tempDir.toFile().list()).isEmpty();
	}

	@Test
	@DisplayName("Should not fail the run when a file cannot be written")
	void shouldTolerateWriteFailure() {
		GitHubActionsReporter broken = new GitHubActionsReporter(tempDir, tempDir.resolve("missing/dir/out"),
				TestConfigurations.defaults());

		assertThatCode(() -> broken.releaseCompleted(RunMode.LATEST,
				ReleaseReport.of(ReleaseOutcome.succeeded("v1.0.0", false, 1), 1L)))
			.doesNotThrowAnyException();
	}

}
