package org.springaicommunity.github.changelog;

/**
 * Single-shot chat completion against an external language model.
 */
public interface AnalysisClient {

	/**
	 * Send one system instruction and one user prompt.
	 * @param systemPrompt the system instruction
	 * @param userPrompt the user prompt
	 * @param settings model name, temperature, output size and timeout
	 * @return the text content of the first completion choice
	 * @throws AnalysisServiceException if the service fails, times out or returns no
	 * content
	 */
	String complete(String systemPrompt, String userPrompt, ChangelogConfiguration.AnalysisSettings settings);

}
