package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Result of one generator run.
 *
 * @param mode the run mode
 * @param successful whether the run succeeded
 * @param release report of a single-release run (null for batch runs)
 * @param batch result of a batch run (null for single-release runs)
 */
public record RunResult(RunMode mode, boolean successful, @Nullable ReleaseReport release,
		@Nullable BatchResult batch) {

	public static RunResult single(RunMode mode, ReleaseReport report) {
		return new RunResult(mode, !report.outcome().isFailed(), report, null);
	}

	public static RunResult batch(BatchResult result) {
		return new RunResult(RunMode.BATCH_ALL, result.successful(), null, result);
	}

	/**
	 * Returns the process exit code for this result.
	 * @return 0 on success, 1 on failure
	 */
	public int exitCode() {
		return successful ? 0 : 1;
	}

}
