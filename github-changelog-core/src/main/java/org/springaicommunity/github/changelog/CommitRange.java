package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Resolved commit range of a release.
 *
 * <p>
 * An empty commit list is a valid outcome (a point release with no new commits), not an
 * error.
 *
 * @param previousTag the previous comparable version tag, or null for an initial version
 * @param commits the commits of the range in history order
 * @param rangeLabel human-readable description of the range (e.g. "v1.0.0..v1.1.0")
 */
public record CommitRange(@Nullable String previousTag, List<Commit> commits, String rangeLabel) {

	public CommitRange {
		commits = List.copyOf(commits);
	}

	/**
	 * Returns true if the range holds no commits.
	 * @return true for an empty range
	 */
	public boolean isEmpty() {
		return commits.isEmpty();
	}

	/**
	 * Returns true if no previous tag was found and the full history was used.
	 * @return true for an initial version
	 */
	public boolean isInitialVersion() {
		return previousTag == null;
	}

}
