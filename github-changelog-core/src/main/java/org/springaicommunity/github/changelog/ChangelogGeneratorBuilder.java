package org.springaicommunity.github.changelog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Builder wiring the changelog generator without a DI container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Secrets and repository from the environment (.env or process env)
 * ChangelogGenerator generator = ChangelogGeneratorBuilder.create()
 *     .tokenFromEnv()
 *     .apiKeyFromEnv()
 *     .repository("owner/repo")
 *     .build();
 * RunResult result = generator.run(RunRequest.latest());
 *
 * // For testing with mock collaborators
 * ChangelogGenerator testGenerator = ChangelogGeneratorBuilder.create()
 *     .releaseService(mockReleaseService)
 *     .historyProvider(mockHistory)
 *     .analysisClient(mockAnalysis)
 *     .sleeper(millis -> {})
 *     .build();
 * }
 * </pre>
 */
public class ChangelogGeneratorBuilder {

	@Nullable
	private String token;

	@Nullable
	private String apiKey;

	@Nullable
	private String repository;

	private ChangelogProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ChangelogConfiguration configuration;

	@Nullable
	private GitHubClient httpClient;

	@Nullable
	private ReleaseService releaseService;

	@Nullable
	private GitHistoryProvider historyProvider;

	@Nullable
	private AnalysisClient analysisClient;

	@Nullable
	private ProgressListener listener;

	private Sleeper sleeper = Sleeper.SYSTEM;

	private Clock clock = Clock.systemUTC();

	private ChangelogGeneratorBuilder() {
		this.properties = new ChangelogProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ChangelogGeneratorBuilder
	 */
	public static ChangelogGeneratorBuilder create() {
		return new ChangelogGeneratorBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub token with write access to releases
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public ChangelogGeneratorBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get("GITHUB_TOKEN");
		if (this.token == null) {
			throw new IllegalStateException("GITHUB_TOKEN environment variable is required.");
		}
		return this;
	}

	/**
	 * Set the analysis API key. Without a key the rule-based changelog is always used.
	 * @param apiKey the API key (null to disable the AI analysis)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder apiKey(@Nullable String apiKey) {
		this.apiKey = apiKey;
		return this;
	}

	/**
	 * Read the analysis API key from {@code DEEPSEEK_API_KEY} if it is set.
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder apiKeyFromEnv() {
		this.apiKey = EnvironmentSupport.get("DEEPSEEK_API_KEY");
		return this;
	}

	/**
	 * Set the repository whose releases are updated.
	 * @param repository repository in "owner/repo" format
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder repository(@Nullable String repository) {
		this.repository = repository;
		return this;
	}

	/**
	 * Set process properties.
	 * @param properties properties (null to use defaults)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder properties(@Nullable ChangelogProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public ChangelogGeneratorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use an already loaded configuration instead of loading it from
	 * {@link ChangelogProperties#getConfigFile()} or the bundled default.
	 * @param configuration the configuration (null to load it)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder configuration(@Nullable ChangelogConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When set, the token is not required.
	 * @param httpClient custom client (null to use {@link GitHubHttpClient} with retries)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom ReleaseService. When set, neither token nor repository is required.
	 * @param releaseService custom release service (null to use default)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder releaseService(@Nullable ReleaseService releaseService) {
		this.releaseService = releaseService;
		return this;
	}

	public ChangelogGeneratorBuilder historyProvider(@Nullable GitHistoryProvider historyProvider) {
		this.historyProvider = historyProvider;
		return this;
	}

	/**
	 * Set a custom AnalysisClient. When set, the API key is not required.
	 * @param analysisClient custom analysis client (null to use default)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder analysisClient(@Nullable AnalysisClient analysisClient) {
		this.analysisClient = analysisClient;
		return this;
	}

	/**
	 * Set the progress listener. Defaults to console logging plus the GitHub Actions
	 * side channels found in the environment.
	 * @param listener custom listener (null to use default)
	 * @return this builder
	 */
	public ChangelogGeneratorBuilder listener(@Nullable ProgressListener listener) {
		this.listener = listener;
		return this;
	}

	public ChangelogGeneratorBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	public ChangelogGeneratorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the generator.
	 * @return configured ChangelogGenerator
	 * @throws IllegalStateException if the token or repository is missing
	 * @throws ChangelogConfigurationException if the configuration is invalid
	 */
	public ChangelogGenerator build() {
		validate();
		Components components = buildComponents();

		CommitRangeResolver resolver = new CommitRangeResolver(components.historyProvider());
		CommitClassifier classifier = new CommitClassifier(components.configuration());
		CommitAnalysisService analysisService = new CommitAnalysisService(components.analysisClient(),
				new AnalysisResponseInterpreter(components.objectMapper()), components.configuration());
		ChangelogAssembler assembler = new ChangelogAssembler(components.configuration());
		ReleaseChangelogService releaseChangelogService = new ReleaseChangelogService(resolver, classifier,
				analysisService, assembler, components.releaseService(), components.configuration());
		BatchChangelogService batchChangelogService = new BatchChangelogService(components.releaseService(),
				releaseChangelogService, components.listener(), properties, sleeper, clock);

		return new ChangelogGenerator(components.releaseService(), releaseChangelogService, batchChangelogService,
				components.listener(), properties, clock);
	}

	/**
	 * Load the changelog configuration the generator will use.
	 * @return the configuration
	 * @throws ChangelogConfigurationException if the configuration is invalid
	 */
	public ChangelogConfiguration buildConfiguration() {
		if (configuration != null) {
			return configuration;
		}
		ChangelogConfigurationLoader loader = new ChangelogConfigurationLoader(mapper());
		String configFile = properties.getConfigFile();
		return configFile != null ? loader.load(Path.of(configFile)) : loader.loadDefault();
	}

	private void validate() {
		if (releaseService != null) {
			return;
		}
		if (repository == null || repository.isBlank()) {
			throw new IllegalStateException("Repository is required. Call repository() first.");
		}
		// A custom httpClient carries its own credentials
		if (httpClient == null && (token == null || token.isBlank())) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private ObjectMapper mapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		ChangelogConfiguration config = buildConfiguration();

		ReleaseService releases = this.releaseService;
		if (releases == null) {
			GitHubClient client = this.httpClient != null ? this.httpClient : defaultHttpClient();
			releases = new GitHubReleaseService(client, mapper, repository);
		}

		GitHistoryProvider history = this.historyProvider != null ? this.historyProvider
				: new GitCommandHistoryProvider(properties.getGitExecutable(), properties.getGitWorkingDirectory(),
						Duration.ofSeconds(properties.getGitTimeoutSeconds()));

		AnalysisClient analysis = this.analysisClient;
		if (analysis == null && apiKey != null && !apiKey.isBlank()) {
			analysis = new ChatCompletionHttpClient(apiKey, properties.getAnalysisApiBaseUrl(),
					Duration.ofSeconds(properties.getConnectTimeoutSeconds()), mapper);
		}

		ProgressListener progress = this.listener != null ? this.listener : ProgressListener
			.composite(List.of(new ConsoleProgressReporter(config), GitHubActionsReporter.fromEnvironment(config)));

		return new Components(mapper, config, releases, history, analysis, progress);
	}

	private GitHubClient defaultHttpClient() {
		GitHubHttpClient client = new GitHubHttpClient(token, properties.getGithubApiBaseUrl(),
				Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
				Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
		return RetryingGitHubClient.builder()
			.wrapping(client)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryInitialDelayMillis())
			.sleeper(sleeper)
			.build();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, ChangelogConfiguration configuration,
			ReleaseService releaseService, GitHistoryProvider historyProvider, @Nullable AnalysisClient analysisClient,
			ProgressListener listener) {
	}

}
