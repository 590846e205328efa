package org.springaicommunity.github.changelog;

/**
 * A single commit parsed from the repository history.
 *
 * <p>
 * Commits are created unclassified ({@link CommitCategory#OTHER}, importance 1) and
 * receive their final category exactly once through {@link #classifiedAs}.
 *
 * @param id the abbreviated commit hash, the identity of the commit
 * @param subject the first line of the commit message
 * @param body the remainder of the commit message (empty when absent)
 * @param category the assigned changelog category
 * @param importance the importance rank, at least 1
 */
public record Commit(String id, String subject, String body, CommitCategory category, int importance) {

	public Commit {
		if (importance < 1) {
			throw new IllegalArgumentException("Commit importance must be at least 1 (got: " + importance + ")");
		}
	}

	/**
	 * Create an unclassified commit.
	 * @param id the abbreviated commit hash
	 * @param subject the subject line
	 * @param body the message body
	 * @return a commit in the OTHER category with importance 1
	 */
	public static Commit of(String id, String subject, String body) {
		return new Commit(id, subject, body, CommitCategory.OTHER, 1);
	}

	/**
	 * Returns a copy of this commit assigned to the given category.
	 * @param category the category chosen by the classifier
	 * @return the classified commit
	 */
	public Commit classifiedAs(CommitCategory category) {
		return new Commit(id, subject, body, category, importance);
	}

	/**
	 * Render the verbatim appendix entry for this commit.
	 * @return {@code "subject (id)"}
	 */
	public String toAppendixEntry() {
		return subject + " (" + id + ")";
	}

}
