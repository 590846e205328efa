package org.springaicommunity.github.changelog;

import java.time.Duration;

/**
 * Progress event emitted after each release of a batch run.
 *
 * @param index 1-based position of the release just processed
 * @param outcome outcome of that release
 * @param stats accumulated statistics including that release
 * @param elapsed time since the batch started
 * @param estimatedRemaining estimated time until the batch completes
 */
public record BatchProgress(int index, ReleaseOutcome outcome, BatchStats stats, Duration elapsed,
		Duration estimatedRemaining) {

	public int total() {
		return stats.totalReleases();
	}

	/**
	 * Returns the completed share of the batch.
	 * @return percentage between 0 and 100
	 */
	public double percentComplete() {
		return total() == 0 ? 100.0 : index * 100.0 / total();
	}

}
