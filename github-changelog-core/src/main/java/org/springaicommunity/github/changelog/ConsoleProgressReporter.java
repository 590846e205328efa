package org.springaicommunity.github.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Renders progress events and final reports to the log.
 */
public class ConsoleProgressReporter implements ProgressListener {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleProgressReporter.class);

	private final ChangelogConfiguration configuration;

	public ConsoleProgressReporter(ChangelogConfiguration configuration) {
		this.configuration = configuration;
	}

	@Override
	public void batchStarted(int totalReleases) {
		logger.info("Batch mode: {} releases to process", totalReleases);
	}

	@Override
	public void releaseProcessed(BatchProgress progress) {
		BatchStats stats = progress.stats();
		logger.info("[{}/{}] {}% {} | succeeded {} (AI {}), skipped {}, failed {} | elapsed {}, remaining ~{}",
				progress.index(), progress.total(), String.format(Locale.ROOT, "%.1f", progress.percentComplete()),
				describe(progress.outcome()), stats.succeeded(), stats.aiSucceeded(), stats.skipped(), stats.failed(),
				format(progress.elapsed()), format(progress.estimatedRemaining()));
	}

	@Override
	public void batchCompleted(BatchResult result) {
		BatchStats stats = result.stats();
		logger.info("==================== Batch summary ====================");
		logger.info("Releases:      {} total, {} processed", stats.totalReleases(), stats.processed());
		logger.info("Succeeded:     {} ({}% of total)", stats.succeeded(), percent(stats.successRate()));
		logger.info("AI-backed:     {} ({}% of succeeded)", stats.aiSucceeded(), percent(stats.aiRate()));
		logger.info("Skipped:       {}", stats.skipped());
		logger.info("Failed:        {}", stats.failed());
		logger.info("Commits:       {}", stats.totalCommits());
		logger.info("Time:          {} total, {} per release", format(result.elapsed()),
				format(result.averagePerRelease()));
		for (ReleaseOutcome outcome : result.outcomes()) {
			if (outcome.isFailed()) {
				logger.info("  failed: {} ({})", outcome.tag(), outcome.reason());
			}
		}
		if (result.successful()) {
			logger.info("Batch succeeded (threshold {}%)", percent(result.threshold()));
		}
		else {
			logger.error("Batch failed: success rate {}% below threshold {}%", percent(stats.successRate()),
					percent(result.threshold()));
		}
	}

	@Override
	public void releaseCompleted(RunMode mode, ReleaseReport report) {
		ReleaseOutcome outcome = report.outcome();
		logger.info("==================== Release report ====================");
		logger.info("Mode:          {}", mode.value());
		logger.info("Version:       {}", outcome.tag());
		logger.info("Release ID:    {}", report.releaseId());
		if (report.rangeLabel() != null) {
			logger.info("Range:         {}", report.rangeLabel());
		}
		logger.info("Status:        {}", describe(outcome));
		if (outcome.isSucceeded()) {
			logger.info("AI analysis:   {}", outcome.aiUsed() ? "used" : "not used (" + report.analysisFailure() + ")");
		}
		for (Map.Entry<CommitCategory, Integer> entry : report.categoryCounts().entrySet()) {
			logger.info("  {}: {}", configuration.titleOf(entry.getKey()), entry.getValue());
		}
		logger.info("Total commits: {}", outcome.commitCount());
	}

	static String describe(ReleaseOutcome outcome) {
		switch (outcome.status()) {
			case SUCCEEDED:
				return outcome.tag() + " succeeded" + (outcome.aiUsed() ? " (AI)" : " (basic)");
			case SKIPPED:
				return outcome.tag() + " skipped: " + outcome.reason();
			default:
				return outcome.tag() + " failed: " + outcome.reason();
		}
	}

	static String format(Duration duration) {
		long seconds = duration.toSeconds();
		if (seconds < 60) {
			return seconds + "s";
		}
		return (seconds / 60) + "m" + (seconds % 60) + "s";
	}

	private static String percent(double rate) {
		return String.format(Locale.ROOT, "%.1f", rate * 100);
	}

}
