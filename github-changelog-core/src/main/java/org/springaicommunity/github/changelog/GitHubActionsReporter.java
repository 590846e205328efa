package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes run results to the GitHub Actions side channels: Markdown to the step summary
 * file ({@code GITHUB_STEP_SUMMARY}) and {@code key=value} lines to the step output file
 * ({@code GITHUB_OUTPUT}).
 *
 * <p>
 * Either file may be absent, in which case the corresponding output is skipped. Write
 * failures are logged and never fail the run.
 */
public class GitHubActionsReporter implements ProgressListener {

	private static final Logger logger = LoggerFactory.getLogger(GitHubActionsReporter.class);

	@Nullable
	private final Path stepSummaryFile;

	@Nullable
	private final Path outputFile;

	private final ChangelogConfiguration configuration;

	public GitHubActionsReporter(@Nullable Path stepSummaryFile, @Nullable Path outputFile,
			ChangelogConfiguration configuration) {
		this.stepSummaryFile = stepSummaryFile;
		this.outputFile = outputFile;
		this.configuration = configuration;
	}

	/**
	 * Create a reporter from the {@code GITHUB_STEP_SUMMARY} and {@code GITHUB_OUTPUT}
	 * environment variables.
	 * @param configuration configuration used for category titles
	 * @return the reporter
	 */
	public static GitHubActionsReporter fromEnvironment(ChangelogConfiguration configuration) {
		String summary = EnvironmentSupport.get("GITHUB_STEP_SUMMARY");
		String output = EnvironmentSupport.get("GITHUB_OUTPUT");
		return new GitHubActionsReporter(summary != null ? Path.of(summary) : null,
				output != null ? Path.of(output) : null, configuration);
	}

	@Override
	public void releaseCompleted(RunMode mode, ReleaseReport report) {
		ReleaseOutcome outcome = report.outcome();
		StringBuilder summary = new StringBuilder();
		summary.append("## Changelog generation: ").append(outcome.tag()).append("\n\n");
		summary.append("| Item | Value |\n|------|-------|\n");
		summary.append("| Mode | ").append(mode.value()).append(" |\n");
		summary.append("| Release ID | ").append(report.releaseId()).append(" |\n");
		summary.append("| Status | ").append(outcome.status().name().toLowerCase(Locale.ROOT)).append(" |\n");
		if (outcome.reason() != null) {
			summary.append("| Reason | ").append(outcome.reason()).append(" |\n");
		}
		summary.append("| AI analysis | ").append(outcome.aiUsed() ? "used" : "not used").append(" |\n");
		if (report.analysisFailure() != null && outcome.isSucceeded()) {
			summary.append("| AI failure | ").append(report.analysisFailure()).append(" |\n");
		}
		summary.append("| Total commits | ").append(outcome.commitCount()).append(" |\n");
		if (!report.categoryCounts().isEmpty()) {
			summary.append("\n### Commits by category\n\n");
			report.categoryCounts()
				.forEach((category, count) -> summary.append("- ")
					.append(configuration.titleOf(category))
					.append(": ")
					.append(count)
					.append('\n'));
		}
		appendSummary(summary.toString());

		Map<String, String> outputs = new LinkedHashMap<>();
		outputs.put("ai_success", String.valueOf(outcome.aiUsed()));
		outputs.put("total_commits", String.valueOf(outcome.commitCount()));
		outputs.put("generation_mode", report.generationMode());
		appendOutputs(outputs);
	}

	@Override
	public void batchCompleted(BatchResult result) {
		BatchStats stats = result.stats();
		StringBuilder summary = new StringBuilder();
		summary.append("## Batch changelog generation\n\n");
		summary.append("| Item | Value |\n|------|-------|\n");
		summary.append("| Releases | ").append(stats.totalReleases()).append(" |\n");
		summary.append("| Processed | ").append(stats.processed()).append(" |\n");
		summary.append("| Succeeded | ").append(stats.succeeded()).append(" |\n");
		summary.append("| AI-backed | ").append(stats.aiSucceeded()).append(" |\n");
		summary.append("| Skipped | ").append(stats.skipped()).append(" |\n");
		summary.append("| Failed | ").append(stats.failed()).append(" |\n");
		summary.append("| Success rate | ")
			.append(String.format(Locale.ROOT, "%.1f%%", stats.successRate() * 100))
			.append(" |\n");
		summary.append("| Total commits | ").append(stats.totalCommits()).append(" |\n");
		summary.append("| Duration | ").append(ConsoleProgressReporter.format(result.elapsed())).append(" |\n");
		summary.append("| Result | ").append(result.successful() ? "success" : "failure").append(" |\n");
		if (stats.failed() > 0) {
			summary.append("\n### Failed releases\n\n");
			for (ReleaseOutcome outcome : result.outcomes()) {
				if (outcome.isFailed()) {
					summary.append("- ").append(outcome.tag()).append(": ").append(outcome.reason()).append('\n');
				}
			}
		}
		appendSummary(summary.toString());

		Map<String, String> outputs = new LinkedHashMap<>();
		outputs.put("ai_success", String.valueOf(stats.aiSucceeded() > 0));
		outputs.put("total_commits", String.valueOf(stats.totalCommits()));
		outputs.put("generation_mode", "batch");
		outputs.put("processed_releases", String.valueOf(stats.processed()));
		appendOutputs(outputs);
	}

	private void appendSummary(String markdown) {
		if (stepSummaryFile != null) {
			append(stepSummaryFile, markdown + "\n");
		}
	}

	private void appendOutputs(Map<String, String> outputs) {
		if (outputFile == null) {
			return;
		}
		StringBuilder lines = new StringBuilder();
		outputs.forEach((key, value) -> lines.append(key).append('=').append(value).append('\n'));
		append(outputFile, lines.toString());
	}

	private void append(Path file, String content) {
		try {
			Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
		}
		catch (IOException e) {
			logger.warn("Failed to write {}: {}", file, e.getMessage());
		}
	}

}
