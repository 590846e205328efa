package org.springaicommunity.github.changelog;

import java.time.Duration;
import java.time.Instant;

/**
 * Accumulated counters of one batch run.
 *
 * <p>
 * Immutable: {@link #record(ReleaseOutcome)} returns the next accumulator, so the batch
 * controller folds outcomes over the release list instead of mutating shared state.
 *
 * @param totalReleases number of releases enumerated for the batch
 * @param processed number of releases processed so far
 * @param succeeded releases whose changelog was published
 * @param aiSucceeded succeeded releases that used the AI analysis
 * @param skipped releases skipped (no optimization needed, empty commit range)
 * @param failed releases that failed
 * @param totalCommits commits resolved across all processed releases
 * @param startedAt when the batch started
 */
public record BatchStats(int totalReleases, int processed, int succeeded, int aiSucceeded, int skipped, int failed,
		int totalCommits, Instant startedAt) {

	/**
	 * Create the initial accumulator for a batch.
	 * @param totalReleases number of releases to process
	 * @param startedAt batch start time
	 * @return empty statistics
	 */
	public static BatchStats start(int totalReleases, Instant startedAt) {
		return new BatchStats(totalReleases, 0, 0, 0, 0, 0, 0, startedAt);
	}

	/**
	 * Fold one release outcome into the statistics.
	 * @param outcome the outcome of the release just processed
	 * @return the updated statistics
	 */
	public BatchStats record(ReleaseOutcome outcome) {
		int newSucceeded = succeeded;
		int newAi = aiSucceeded;
		int newSkipped = skipped;
		int newFailed = failed;
		switch (outcome.status()) {
			case SUCCEEDED:
				newSucceeded++;
				if (outcome.aiUsed()) {
					newAi++;
				}
				break;
			case SKIPPED:
				newSkipped++;
				break;
			default:
				newFailed++;
				break;
		}
		return new BatchStats(totalReleases, processed + 1, newSucceeded, newAi, newSkipped, newFailed,
				totalCommits + outcome.commitCount(), startedAt);
	}

	/**
	 * Returns the ratio of succeeded releases to total releases.
	 * @return success rate between 0 and 1 (1 for an empty batch)
	 */
	public double successRate() {
		if (totalReleases == 0) {
			return 1.0;
		}
		return (double) succeeded / totalReleases;
	}

	/**
	 * Returns the ratio of AI-backed releases among succeeded releases.
	 * @return AI rate between 0 and 1
	 */
	public double aiRate() {
		return (double) aiSucceeded / Math.max(1, succeeded);
	}

	/**
	 * Returns true when the success rate reaches the threshold.
	 * @param threshold minimum success rate (e.g. 0.8)
	 * @return true if {@code succeeded / totalReleases >= threshold}
	 */
	public boolean isSuccessful(double threshold) {
		if (totalReleases == 0) {
			return true;
		}
		// integer comparison keeps the 0.8 boundary exact
		return succeeded * 1_000_000L >= Math.round(threshold * 1_000_000L) * totalReleases;
	}

	/**
	 * Returns the elapsed time since the batch started.
	 * @param now the current instant
	 * @return elapsed duration
	 */
	public Duration elapsed(Instant now) {
		return Duration.between(startedAt, now);
	}

}
