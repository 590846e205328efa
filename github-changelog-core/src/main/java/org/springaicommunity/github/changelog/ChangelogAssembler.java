package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders the Markdown changelog of a release.
 *
 * <p>
 * With an {@link AnalysisResult} the AI-backed document is produced: summary, highlights
 * and the analyzed items per category, ordered by importance. Without one the rule-based
 * document lists the classified commits with their conventional prefixes stripped. Both
 * end with a collapsible appendix listing the original commits.
 *
 * <p>
 * Output depends only on the arguments: the same commits always produce the same
 * document, and the existing release body is never merged in.
 */
public class ChangelogAssembler {

	private static final Comparator<AnalysisResult.Item> BY_IMPORTANCE_DESC = Comparator
		.comparingInt(AnalysisResult.Item::importance)
		.reversed();

	private final ChangelogConfiguration configuration;

	public ChangelogAssembler(ChangelogConfiguration configuration) {
		this.configuration = configuration;
	}

	/**
	 * Assemble the changelog document.
	 * @param version the release version shown in the header
	 * @param classified the classified commits (used by the rule-based document)
	 * @param analysis the analysis result, or null for the rule-based document
	 * @param commits the resolved commits listed in the appendix
	 * @return the Markdown document
	 */
	public String assemble(String version, ClassifiedCommits classified, @Nullable AnalysisResult analysis,
			List<Commit> commits) {
		String body = analysis != null ? renderAnalysis(version, analysis) : renderRuleBased(version, classified);
		return body.stripTrailing() + renderAppendix(commits);
	}

	private String renderAnalysis(String version, AnalysisResult analysis) {
		ChangelogConfiguration.DocumentTemplate template = configuration.aiTemplate();
		StringBuilder document = new StringBuilder();
		document.append(TemplateRenderer.render(template.header(), Map.of("version", version)));
		document.append(TemplateRenderer.render(template.overview(), Map.of("summary", analysis.summary())));
		if (!analysis.highlights().isEmpty() && template.highlights() != null) {
			List<String> bullets = new ArrayList<>();
			for (String highlight : analysis.highlights()) {
				bullets.add("- " + highlight);
			}
			document.append(
					TemplateRenderer.render(template.highlights(), Map.of("highlights", String.join("\n", bullets))));
		}
		document.append(template.divider());

		for (CommitCategory category : CommitCategory.values()) {
			List<AnalysisResult.Item> items = new ArrayList<>(analysis.itemsFor(category));
			if (items.isEmpty()) {
				continue;
			}
			items.sort(BY_IMPORTANCE_DESC);
			document.append(renderCategoryHeader(template, category));
			for (AnalysisResult.Item item : items) {
				String format = item.commitId().isEmpty() ? withoutHashSlot(template.itemFormat()) : template.itemFormat();
				document.append(TemplateRenderer.render(format, Map.of("icon", configuration.iconFor(item.importance()),
						"message", item.message(), "hash", item.commitId())));
			}
		}
		return document.toString();
	}

	private String renderRuleBased(String version, ClassifiedCommits classified) {
		ChangelogConfiguration.DocumentTemplate template = configuration.basicTemplate();
		StringBuilder document = new StringBuilder();
		document.append(TemplateRenderer.render(template.header(), Map.of("version", version)));
		document.append(template.overview());
		document.append(template.divider());

		for (CommitCategory category : CommitCategory.values()) {
			List<Commit> commits = classified.get(category);
			if (commits.isEmpty()) {
				continue;
			}
			document.append(renderCategoryHeader(template, category));
			for (Commit commit : commits) {
				document.append(TemplateRenderer.render(template.itemFormat(),
						Map.of("message", cleanSubject(commit.subject()), "hash", commit.id())));
			}
		}
		return document.toString();
	}

	/**
	 * Remove the {@code {hash}} placeholder and the parentheses around it from an item
	 * template.
	 */
	static String withoutHashSlot(String itemFormat) {
		return itemFormat.replace(" ({hash})", "").replace("({hash})", "").replace("{hash}", "");
	}

	private String renderCategoryHeader(ChangelogConfiguration.DocumentTemplate template, CommitCategory category) {
		return TemplateRenderer.render(template.categoryHeader(), Map.of("title", configuration.titleOf(category)));
	}

	/**
	 * Strip the configured prefixes from a subject, keeping the original subject when
	 * nothing would remain.
	 * @param subject the commit subject
	 * @return the cleaned message, never blank for a non-blank subject
	 */
	String cleanSubject(String subject) {
		String message = subject.trim();
		for (Pattern pattern : configuration.cleanupPatterns()) {
			message = pattern.matcher(message).replaceFirst("").trim();
		}
		return message.isEmpty() ? subject.trim() : message;
	}

	private String renderAppendix(List<Commit> commits) {
		ChangelogConfiguration.Appendix appendix = configuration.appendix();
		StringBuilder section = new StringBuilder();
		section.append("\n\n<details>\n<summary>").append(appendix.title()).append("</summary>\n\n");
		if (commits.isEmpty()) {
			section.append(appendix.emptyPlaceholder()).append('\n');
		}
		else {
			for (Commit commit : commits) {
				section.append("- ").append(commit.toAppendixEntry()).append('\n');
			}
		}
		section.append("\n</details>\n");
		return section.toString();
	}

}
