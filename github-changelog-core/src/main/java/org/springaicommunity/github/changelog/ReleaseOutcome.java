package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of processing a single release.
 *
 * @param tag the release tag
 * @param status succeeded, skipped or failed
 * @param aiUsed whether the published changelog was AI-backed (only for succeeded)
 * @param commitCount number of commits in the resolved range (0 when not resolved)
 * @param reason skip reason or failure message, null when succeeded
 */
public record ReleaseOutcome(String tag, Status status, boolean aiUsed, int commitCount, @Nullable String reason) {

	public static final String NO_OPTIMIZATION_NEEDED = "no optimization needed";

	public static final String EMPTY_COMMIT_RANGE = "empty commit range";

	public static ReleaseOutcome succeeded(String tag, boolean aiUsed, int commitCount) {
		return new ReleaseOutcome(tag, Status.SUCCEEDED, aiUsed, commitCount, null);
	}

	public static ReleaseOutcome skipped(String tag, String reason, int commitCount) {
		return new ReleaseOutcome(tag, Status.SKIPPED, false, commitCount, reason);
	}

	public static ReleaseOutcome failed(String tag, String error, int commitCount) {
		return new ReleaseOutcome(tag, Status.FAILED, false, commitCount, error);
	}

	public boolean isSucceeded() {
		return status == Status.SUCCEEDED;
	}

	public boolean isSkipped() {
		return status == Status.SKIPPED;
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

	public enum Status {

		SUCCEEDED, SKIPPED, FAILED

	}

}
