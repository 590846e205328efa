package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the commits that make up a release.
 *
 * <p>
 * The previous tag is the next older version-shaped tag in descending semantic version
 * order. Tags that are not version-shaped are ignored. When the target tag is unknown or
 * has no older version, the full history up to the target is used.
 *
 * <p>
 * An empty range is widened step by step: merge commits are included, then the single
 * commit at the tag is taken. If that still yields nothing, an empty range is returned.
 */
public class CommitRangeResolver {

	private static final Logger logger = LoggerFactory.getLogger(CommitRangeResolver.class);

	private final GitHistoryProvider historyProvider;

	public CommitRangeResolver(GitHistoryProvider historyProvider) {
		this.historyProvider = historyProvider;
	}

	/**
	 * Resolve the range of a tag against the tags of the repository.
	 * @param targetTag the release tag
	 * @return the resolved range, possibly empty
	 * @throws GitHistoryException if the history cannot be read
	 */
	public CommitRange resolve(String targetTag) {
		return resolve(targetTag, historyProvider.listTags());
	}

	/**
	 * Resolve the range of a tag against a given tag list.
	 * @param targetTag the release tag
	 * @param allTags all tags of the repository, in any order
	 * @return the resolved range, possibly empty
	 * @throws GitHistoryException if the history cannot be read
	 */
	public CommitRange resolve(String targetTag, List<String> allTags) {
		String previousTag = findPreviousTag(targetTag, allTags).orElse(null);
		String rangeLabel = previousTag != null ? previousTag + ".." + targetTag : "initial version to " + targetTag;
		logger.info("Resolving commits for {} ({})", targetTag, rangeLabel);

		List<Commit> commits = collect(previousTag, targetTag);
		if (commits.isEmpty()) {
			logger.warn("No commits found in {}", rangeLabel);
		}
		else {
			logger.info("Found {} commits in {}", commits.size(), rangeLabel);
		}
		return new CommitRange(previousTag, commits, rangeLabel);
	}

	/**
	 * Find the version-shaped tag directly older than the target.
	 * @param targetTag the release tag
	 * @param allTags all tags of the repository
	 * @return the previous tag, or empty for an initial version or an unknown target
	 */
	Optional<String> findPreviousTag(String targetTag, List<String> allTags) {
		List<VersionTag> versions = new ArrayList<>();
		for (String tag : allTags) {
			VersionTag.parse(tag).ifPresent(versions::add);
		}
		versions.sort(Comparator.reverseOrder());

		for (int i = 0; i < versions.size(); i++) {
			if (versions.get(i).name().equals(targetTag.trim())) {
				if (i + 1 < versions.size()) {
					return Optional.of(versions.get(i + 1).name());
				}
				logger.info("{} is the oldest version tag", targetTag);
				return Optional.empty();
			}
		}
		logger.info("{} is not among the {} version tags, using full history", targetTag, versions.size());
		return Optional.empty();
	}

	private List<Commit> collect(@Nullable String previousTag, String targetTag) {
		List<Commit> commits = query(GitHistoryProvider.LogQuery.range(previousTag, targetTag, false));
		if (!commits.isEmpty()) {
			return commits;
		}
		logger.debug("Range {} has no non-merge commits, including merges", targetTag);
		commits = query(GitHistoryProvider.LogQuery.range(previousTag, targetTag, true));
		if (!commits.isEmpty()) {
			return commits;
		}
		logger.debug("Range {} has no commits, using the commit at the tag", targetTag);
		return query(GitHistoryProvider.LogQuery.singleCommit(targetTag));
	}

	private List<Commit> query(GitHistoryProvider.LogQuery query) {
		return CommitLogParser.parse(historyProvider.log(query));
	}

}
