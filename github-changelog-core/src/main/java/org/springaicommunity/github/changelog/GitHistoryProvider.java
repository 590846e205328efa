package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Read access to the local repository history.
 */
public interface GitHistoryProvider {

	/**
	 * List all tags, newest version first.
	 * @return tag names
	 * @throws GitHistoryException if the history cannot be read
	 */
	List<String> listTags();

	/**
	 * List the commits of a revision range, one {@code id|subject|body} line per commit
	 * in history order (newest first), with multi-line bodies collapsed onto the line.
	 * @param query the range and filters
	 * @return raw log lines
	 * @throws GitHistoryException if the history cannot be read
	 */
	List<String> log(LogQuery query);

	/**
	 * A revision range query.
	 *
	 * @param from exclusive start revision, or null for the full history up to {@code to}
	 * @param to inclusive end revision
	 * @param includeMerges whether merge commits are listed
	 * @param maxCount maximum number of commits, or null for no limit
	 */
	record LogQuery(@Nullable String from, String to, boolean includeMerges, @Nullable Integer maxCount) {

		public static LogQuery range(@Nullable String from, String to, boolean includeMerges) {
			return new LogQuery(from, to, includeMerges, null);
		}

		public static LogQuery singleCommit(String to) {
			return new LogQuery(null, to, true, 1);
		}

		/**
		 * Returns the revision expression ({@code from..to} or {@code to}).
		 * @return the revision range
		 */
		public String revisionRange() {
			return from != null ? from + ".." + to : to;
		}

	}

}
