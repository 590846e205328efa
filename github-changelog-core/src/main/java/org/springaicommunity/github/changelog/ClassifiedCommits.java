package org.springaicommunity.github.changelog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Partition of a commit list by {@link CommitCategory}.
 *
 * <p>
 * Every category is present as a key, possibly with an empty list. Each input commit
 * appears in exactly one list, and each list keeps history order.
 */
public final class ClassifiedCommits {

	private final Map<CommitCategory, List<Commit>> commitsByCategory;

	private ClassifiedCommits(Map<CommitCategory, List<Commit>> commitsByCategory) {
		this.commitsByCategory = commitsByCategory;
	}

	/**
	 * Create a new builder with every category initialized to an empty list.
	 * @return new Builder
	 */
	static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the commits assigned to a category, in history order.
	 * @param category the category
	 * @return unmodifiable list (empty when no commit matched)
	 */
	public List<Commit> get(CommitCategory category) {
		return commitsByCategory.get(category);
	}

	/**
	 * Returns the number of commits in a category.
	 * @param category the category
	 * @return commit count
	 */
	public int count(CommitCategory category) {
		return commitsByCategory.get(category).size();
	}

	/**
	 * Returns the total number of commits across all categories.
	 * @return total commit count
	 */
	public int totalCount() {
		int total = 0;
		for (List<Commit> commits : commitsByCategory.values()) {
			total += commits.size();
		}
		return total;
	}

	/**
	 * Returns the per-category counts of non-empty categories, in priority order.
	 * @return category counts
	 */
	public Map<CommitCategory, Integer> nonEmptyCounts() {
		Map<CommitCategory, Integer> counts = new EnumMap<>(CommitCategory.class);
		commitsByCategory.forEach((category, commits) -> {
			if (!commits.isEmpty()) {
				counts.put(category, commits.size());
			}
		});
		return counts;
	}

	/**
	 * Returns an unmodifiable view of the full mapping.
	 * @return category to commits mapping, covering every category
	 */
	public Map<CommitCategory, List<Commit>> asMap() {
		return Collections.unmodifiableMap(commitsByCategory);
	}

	@Override
	public String toString() {
		return "ClassifiedCommits" + nonEmptyCounts();
	}

	static final class Builder {

		private final Map<CommitCategory, List<Commit>> commitsByCategory = new EnumMap<>(CommitCategory.class);

		private Builder() {
			for (CommitCategory category : CommitCategory.values()) {
				commitsByCategory.put(category, new ArrayList<>());
			}
		}

		Builder add(Commit commit) {
			commitsByCategory.get(commit.category()).add(commit);
			return this;
		}

		ClassifiedCommits build() {
			Map<CommitCategory, List<Commit>> frozen = new EnumMap<>(CommitCategory.class);
			commitsByCategory.forEach((category, commits) -> frozen.put(category, List.copyOf(commits)));
			return new ClassifiedCommits(frozen);
		}

	}

}
