package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Details of one processed release, rendered by the single-release report.
 *
 * @param outcome the release outcome
 * @param releaseId the GitHub release ID
 * @param rangeLabel the resolved commit range, null when resolution did not happen
 * @param categoryCounts commit counts of the non-empty categories
 * @param analysisFailure why the AI analysis was not used, null when it was used or not
 * attempted
 */
public record ReleaseReport(ReleaseOutcome outcome, long releaseId, @Nullable String rangeLabel,
		Map<CommitCategory, Integer> categoryCounts, @Nullable String analysisFailure) {

	public ReleaseReport {
		categoryCounts = categoryCounts.isEmpty() ? Map.of()
				: Collections.unmodifiableMap(new EnumMap<>(categoryCounts));
	}

	static ReleaseReport of(ReleaseOutcome outcome, long releaseId) {
		return new ReleaseReport(outcome, releaseId, null, Map.of(), null);
	}

	/**
	 * Returns the generation mode published in the step outputs.
	 * @return "ai" when the AI-backed document was published, otherwise "basic"
	 */
	public String generationMode() {
		return outcome.aiUsed() ? "ai" : "basic";
	}

}
