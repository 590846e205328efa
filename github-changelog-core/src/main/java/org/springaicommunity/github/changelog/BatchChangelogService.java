package org.springaicommunity.github.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Regenerates the changelog of every release of the repository.
 *
 * <p>
 * All release pages are listed before processing starts. Releases are then processed
 * sequentially in listing order with a fixed delay between two releases. A failing
 * release is recorded and the batch moves on; the run succeeds when the share of
 * succeeded releases reaches the configured threshold.
 */
public class BatchChangelogService {

	private static final Logger logger = LoggerFactory.getLogger(BatchChangelogService.class);

	private final ReleaseService releaseService;

	private final ReleaseChangelogService releaseChangelogService;

	private final ProgressListener listener;

	private final ChangelogProperties properties;

	private final Sleeper sleeper;

	private final Clock clock;

	public BatchChangelogService(ReleaseService releaseService, ReleaseChangelogService releaseChangelogService,
			ProgressListener listener, ChangelogProperties properties, Sleeper sleeper, Clock clock) {
		this.releaseService = releaseService;
		this.releaseChangelogService = releaseChangelogService;
		this.listener = listener;
		this.properties = properties;
		this.sleeper = sleeper;
		this.clock = clock;
	}

	/**
	 * Run the batch.
	 * @param skipGenerated skip releases that already carry a generated changelog
	 * @return the batch result
	 * @throws GitHubHttpClient.GitHubApiException if the releases cannot be listed
	 */
	public BatchResult run(boolean skipGenerated) {
		List<Release> releases = listAllReleases();
		Instant startedAt = clock.instant();
		logger.info("Starting batch regeneration of {} releases", releases.size());
		listener.batchStarted(releases.size());

		BatchStats stats = BatchStats.start(releases.size(), startedAt);
		List<ReleaseOutcome> outcomes = new ArrayList<>();
		for (int i = 0; i < releases.size(); i++) {
			Release release = releases.get(i);
			logger.info("[{}/{}] Processing {}", i + 1, releases.size(), release.tagName());

			ReleaseOutcome outcome = releaseChangelogService.process(release, !skipGenerated).outcome();
			stats = stats.record(outcome);
			outcomes.add(outcome);
			listener.releaseProcessed(progress(i + 1, outcome, stats));

			if (i < releases.size() - 1 && !pause()) {
				logger.warn("Batch interrupted after {} of {} releases", i + 1, releases.size());
				break;
			}
		}

		Duration elapsed = stats.elapsed(clock.instant());
		boolean successful = stats.isSuccessful(properties.getBatchSuccessThreshold());
		BatchResult result = new BatchResult(stats, outcomes, properties.getBatchSuccessThreshold(), successful,
				elapsed);
		logger.info("Batch completed: {}/{} succeeded ({} AI-backed), {} skipped, {} failed in {}s", stats.succeeded(),
				stats.totalReleases(), stats.aiSucceeded(), stats.skipped(), stats.failed(), elapsed.toSeconds());
		listener.batchCompleted(result);
		return result;
	}

	private List<Release> listAllReleases() {
		List<Release> releases = new ArrayList<>();
		int pageSize = properties.getReleasesPageSize();
		Integer page = 1;
		while (page != null) {
			SearchResult<Release> result = releaseService.listReleases(page, pageSize);
			releases.addAll(result.items());
			page = (result.hasMore() && !result.items().isEmpty()) ? result.nextPage() : null;
		}
		logger.info("Found {} releases", releases.size());
		return releases;
	}

	private BatchProgress progress(int index, ReleaseOutcome outcome, BatchStats stats) {
		Duration elapsed = stats.elapsed(clock.instant());
		Duration remaining = elapsed.dividedBy(index).multipliedBy(stats.totalReleases() - index);
		return new BatchProgress(index, outcome, stats, elapsed, remaining);
	}

	/**
	 * Wait between two releases.
	 * @return false if the thread was interrupted
	 */
	private boolean pause() {
		long delay = properties.getInterReleaseDelayMillis();
		if (delay <= 0) {
			return true;
		}
		try {
			sleeper.sleep(delay);
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

}
