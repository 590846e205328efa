package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a best-effort commit analysis.
 *
 * @param result the analysis result, null when the analysis was unavailable
 * @param failureReason why no result is available, null on success
 */
public record AnalysisOutcome(@Nullable AnalysisResult result, @Nullable String failureReason) {

	public static AnalysisOutcome success(AnalysisResult result) {
		return new AnalysisOutcome(result, null);
	}

	public static AnalysisOutcome unavailable(String reason) {
		return new AnalysisOutcome(null, reason);
	}

	public boolean isSuccess() {
		return result != null;
	}

}
