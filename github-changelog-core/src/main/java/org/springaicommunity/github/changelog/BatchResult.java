package org.springaicommunity.github.changelog;

import java.time.Duration;
import java.util.List;

/**
 * Final result of a batch run.
 *
 * @param stats final statistics
 * @param outcomes per-release outcomes in listing order
 * @param threshold success rate the run had to reach
 * @param successful whether the success rate reached the threshold
 * @param elapsed total run time
 */
public record BatchResult(BatchStats stats, List<ReleaseOutcome> outcomes, double threshold, boolean successful,
		Duration elapsed) {

	public BatchResult {
		outcomes = List.copyOf(outcomes);
	}

	/**
	 * Returns the average processing time per release.
	 * @return average duration, zero when nothing was processed
	 */
	public Duration averagePerRelease() {
		return stats.processed() == 0 ? Duration.ZERO : elapsed.dividedBy(stats.processed());
	}

}
