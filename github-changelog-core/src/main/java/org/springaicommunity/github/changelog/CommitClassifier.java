package org.springaicommunity.github.changelog;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Assigns each commit to exactly one {@link CommitCategory}.
 *
 * <p>
 * Categories are tested in the configured order against the subject line only; the first
 * pattern matching at the start of the subject wins. Commits matching no pattern land in
 * {@link CommitCategory#OTHER}.
 */
public class CommitClassifier {

	private final ChangelogConfiguration configuration;

	public CommitClassifier(ChangelogConfiguration configuration) {
		this.configuration = configuration;
	}

	/**
	 * Partition commits by category.
	 * @param commits commits in history order
	 * @return classified commits covering every category
	 */
	public ClassifiedCommits classify(List<Commit> commits) {
		ClassifiedCommits.Builder builder = ClassifiedCommits.builder();
		for (Commit commit : commits) {
			builder.add(commit.classifiedAs(categoryOf(commit.subject())));
		}
		return builder.build();
	}

	CommitCategory categoryOf(String subject) {
		String trimmed = subject.trim();
		for (CommitCategory category : configuration.classificationOrder()) {
			Pattern pattern = configuration.categories().get(category).pattern();
			if (pattern != null && pattern.matcher(trimmed).lookingAt()) {
				return category;
			}
		}
		return CommitCategory.OTHER;
	}

}
