package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the analysis service to categorize and summarize a commit range.
 *
 * <p>
 * Never fails: a missing API key, a service or client error, or an unparseable response yield an
 * {@link AnalysisOutcome} without result, which selects the rule-based changelog.
 */
public class CommitAnalysisService {

	private static final Logger logger = LoggerFactory.getLogger(CommitAnalysisService.class);

	@Nullable
	private final AnalysisClient client;

	private final AnalysisResponseInterpreter interpreter;

	private final ChangelogConfiguration configuration;

	/**
	 * Create the analysis service.
	 * @param client the analysis client, or null when no API key is configured
	 * @param interpreter the response interpreter
	 * @param configuration prompts and model parameters
	 */
	public CommitAnalysisService(@Nullable AnalysisClient client, AnalysisResponseInterpreter interpreter,
			ChangelogConfiguration configuration) {
		this.client = client;
		this.interpreter = interpreter;
		this.configuration = configuration;
	}

	/**
	 * Analyze the commits of a release.
	 * @param commits the resolved commits
	 * @return the outcome, with a result only when the analysis succeeded
	 */
	public AnalysisOutcome analyze(List<Commit> commits) {
		if (client == null) {
			return AnalysisOutcome.unavailable("no analysis API key configured");
		}
		if (commits.isEmpty()) {
			return AnalysisOutcome.unavailable("no commits to analyze");
		}

		String userPrompt = TemplateRenderer.render(configuration.prompts().userPromptTemplate(),
				Map.of("commits_text", digest(commits)));
		String response;
		try {
			response = client.complete(configuration.prompts().systemPrompt(), userPrompt, configuration.analysis());
		}
		catch (AnalysisServiceException e) {
			logger.warn("Analysis unavailable, falling back to rule-based changelog: {}", e.getMessage());
			return AnalysisOutcome.unavailable(e.getMessage());
		}
		catch (RuntimeException e) {
			logger.warn("Analysis client failed unexpectedly, falling back to rule-based changelog", e);
			return AnalysisOutcome.unavailable("analysis client error: " + e.getMessage());
		}

		return interpreter.interpret(response).map(result -> {
			logger.info("Analysis succeeded: {} categories, {} highlights", result.categories().size(),
					result.highlights().size());
			return AnalysisOutcome.success(result);
		}).orElseGet(() -> {
			logger.warn("Analysis response could not be parsed, falling back to rule-based changelog");
			return AnalysisOutcome.unavailable("unparseable analysis response");
		});
	}

	/**
	 * Build the newline-delimited {@code id|subject} digest sent in the prompt.
	 * @param commits the commits
	 * @return one line per commit
	 */
	static String digest(List<Commit> commits) {
		return commits.stream().map(commit -> commit.id() + "|" + commit.subject()).collect(Collectors.joining("\n"));
	}

}
