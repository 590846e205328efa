package org.springaicommunity.github.changelog;

import java.util.Optional;

/**
 * Read and write access to the releases of one repository.
 *
 * <p>
 * Returns strongly-typed {@link Release} records instead of raw JSON. Read failures
 * propagate as {@link GitHubHttpClient.GitHubApiException}; the body update reports
 * failure through its return value.
 */
public interface ReleaseService {

	/**
	 * List one page of releases, newest first.
	 * @param page page number, starting at 1
	 * @param perPage releases per page
	 * @return the page, with the next page number when more releases exist
	 */
	SearchResult<Release> listReleases(int page, int perPage);

	/**
	 * Get a release by its storage ID.
	 * @param releaseId GitHub release ID
	 * @return the release
	 * @throws GitHubHttpClient.GitHubApiException if the release does not exist or the
	 * call fails
	 */
	Release getReleaseById(String releaseId);

	/**
	 * Get the release attached to a tag.
	 * @param tag tag name
	 * @return the release, or empty when the tag has no release
	 */
	Optional<Release> getReleaseByTag(String tag);

	/**
	 * Get the latest published release.
	 * @return the release, or empty when the repository has none
	 */
	Optional<Release> getLatestRelease();

	/**
	 * Replace the body of a release. A single write: failures are logged and reported,
	 * never retried.
	 * @param releaseId GitHub release ID
	 * @param body new Markdown body
	 * @return true if the release was updated
	 */
	boolean updateReleaseBody(long releaseId, String body);

}
