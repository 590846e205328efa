package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * A GitHub release whose body the generator replaces.
 *
 * <p>
 * The existing {@code body} is read once per release. It is only inspected for the marker
 * of a previously generated changelog; the new document always replaces it entirely.
 *
 * @param id the unique GitHub release ID, used as the storage identifier for updates
 * @param tagName the Git tag name (e.g., "v1.0.0", "1.0.0-M1")
 * @param body the release notes in Markdown format (may be null for empty releases)
 * @see <a href="https://docs.github.com/en/rest/releases/releases">GitHub Releases
 * API</a>
 */
public record Release(long id, String tagName, @Nullable String body) {

	/**
	 * Returns the existing body, or an empty string when the release has none.
	 * @return the existing release body
	 */
	public String existingBody() {
		return body != null ? body : "";
	}

}
