package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Process settings for changelog generation.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link ChangelogGeneratorBuilder}. The content of the generated documents (categories,
 * templates, prompts) is not configured here but in the changelog configuration file read
 * by {@link ChangelogConfigurationLoader}.
 *
 * <p>
 * Default values are suitable for GitHub-hosted runners.
 */
public class ChangelogProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String githubApiBaseUrl = "https://api.github.com";

	/**
	 * Base URL of the chat-completion API used for commit analysis.
	 */
	private String analysisApiBaseUrl = "https://api.deepseek.com/v1";

	/**
	 * Number of releases requested per page when listing releases.
	 */
	private int releasesPageSize = 30;

	/**
	 * Delay in milliseconds between two releases of a batch run.
	 */
	private long interReleaseDelayMillis = 2000;

	/**
	 * Share of succeeded releases required for a batch run to count as successful.
	 */
	private double batchSuccessThreshold = 0.8;

	/**
	 * Connect timeout in seconds for HTTP calls.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Request timeout in seconds for GitHub API calls.
	 */
	private int requestTimeoutSeconds = 60;

	/**
	 * Git executable used to read the commit history.
	 */
	private String gitExecutable = "git";

	/**
	 * Working directory of the git repository (current directory when not set).
	 */
	@Nullable
	private String gitWorkingDirectory;

	/**
	 * Timeout in seconds for a single git command.
	 */
	private int gitTimeoutSeconds = 60;

	/**
	 * Maximum number of retry attempts for failed GitHub read requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay in milliseconds before retrying a failed GitHub read request.
	 */
	private long retryInitialDelayMillis = 1000;

	/**
	 * Changelog configuration file replacing the bundled default (bundled default when
	 * not set).
	 */
	@Nullable
	private String configFile;

	public String getGithubApiBaseUrl() {
		return githubApiBaseUrl;
	}

	public void setGithubApiBaseUrl(String githubApiBaseUrl) {
		this.githubApiBaseUrl = githubApiBaseUrl;
	}

	public String getAnalysisApiBaseUrl() {
		return analysisApiBaseUrl;
	}

	public void setAnalysisApiBaseUrl(String analysisApiBaseUrl) {
		this.analysisApiBaseUrl = analysisApiBaseUrl;
	}

	/**
	 * Returns the number of releases requested per page.
	 * @return the page size
	 */
	public int getReleasesPageSize() {
		return releasesPageSize;
	}

	/**
	 * Sets the number of releases requested per page (GitHub caps it at 100).
	 * @param releasesPageSize the page size
	 */
	public void setReleasesPageSize(int releasesPageSize) {
		this.releasesPageSize = releasesPageSize;
	}

	/**
	 * Returns the delay between two releases of a batch run.
	 * @return the delay in milliseconds
	 */
	public long getInterReleaseDelayMillis() {
		return interReleaseDelayMillis;
	}

	/**
	 * Sets the delay between two releases of a batch run.
	 * @param interReleaseDelayMillis the delay in milliseconds, 0 to disable
	 */
	public void setInterReleaseDelayMillis(long interReleaseDelayMillis) {
		this.interReleaseDelayMillis = interReleaseDelayMillis;
	}

	/**
	 * Returns the share of succeeded releases a batch run needs.
	 * @return threshold between 0 and 1
	 */
	public double getBatchSuccessThreshold() {
		return batchSuccessThreshold;
	}

	/**
	 * Sets the share of succeeded releases a batch run needs.
	 * @param batchSuccessThreshold threshold between 0 and 1
	 */
	public void setBatchSuccessThreshold(double batchSuccessThreshold) {
		this.batchSuccessThreshold = batchSuccessThreshold;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public String getGitExecutable() {
		return gitExecutable;
	}

	public void setGitExecutable(String gitExecutable) {
		this.gitExecutable = gitExecutable;
	}

	@Nullable
	public String getGitWorkingDirectory() {
		return gitWorkingDirectory;
	}

	public void setGitWorkingDirectory(@Nullable String gitWorkingDirectory) {
		this.gitWorkingDirectory = gitWorkingDirectory;
	}

	public int getGitTimeoutSeconds() {
		return gitTimeoutSeconds;
	}

	public void setGitTimeoutSeconds(int gitTimeoutSeconds) {
		this.gitTimeoutSeconds = gitTimeoutSeconds;
	}

	/**
	 * Returns the maximum number of retry attempts for GitHub reads.
	 * @return the maximum retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum number of retry attempts for GitHub reads.
	 * @param maxRetries the maximum retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryInitialDelayMillis() {
		return retryInitialDelayMillis;
	}

	public void setRetryInitialDelayMillis(long retryInitialDelayMillis) {
		this.retryInitialDelayMillis = retryInitialDelayMillis;
	}

	/**
	 * Returns the changelog configuration file path.
	 * @return the file path, or null to use the bundled default
	 */
	@Nullable
	public String getConfigFile() {
		return configFile;
	}

	/**
	 * Sets the changelog configuration file path.
	 * @param configFile the file path, or null to use the bundled default
	 */
	public void setConfigFile(@Nullable String configFile) {
		this.configFile = configFile;
	}

}
