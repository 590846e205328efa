package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Validated run target derived from command-line inputs before any network activity.
 *
 * @param mode the run mode
 * @param version the version tag to process (null for latest and batch modes)
 * @param releaseId the release ID (only for explicit modes)
 * @param skipGenerated in batch mode, skip releases that already carry a generated
 * changelog
 */
public record RunRequest(RunMode mode, @Nullable String version, @Nullable String releaseId, boolean skipGenerated) {

	public static RunRequest explicit(RunMode mode, String version, String releaseId) {
		return new RunRequest(mode, version, releaseId, false);
	}

	public static RunRequest named(String version) {
		return new RunRequest(RunMode.NAMED, version, null, false);
	}

	public static RunRequest latest() {
		return new RunRequest(RunMode.LATEST, null, null, false);
	}

	public static RunRequest batch(boolean skipGenerated) {
		return new RunRequest(RunMode.BATCH_ALL, null, null, skipGenerated);
	}

}
