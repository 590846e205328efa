package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Command-line argument parser for the changelog generator. Resolves the run mode from
 * the workflow inputs and checks secrets before any network activity.
 */
public class ArgumentParser {

	static final String WORKFLOW_CALL_EVENT = "workflow_call";

	private final ChangelogProperties defaultProperties;

	private final Function<String, @Nullable String> environment;

	public ArgumentParser(ChangelogProperties defaultProperties) {
		this(defaultProperties, EnvironmentSupport::get);
	}

	/**
	 * Create a parser reading secrets through the given lookup instead of the process
	 * environment.
	 * @param defaultProperties default properties
	 * @param environment variable lookup returning null for unset variables
	 */
	public ArgumentParser(ChangelogProperties defaultProperties, Function<String, @Nullable String> environment) {
		this.defaultProperties = defaultProperties;
		this.environment = environment;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--target":
					config.target = getRequiredValue(args, i, "target");
					i++; // Skip next argument since we consumed it
					break;

				case "--version":
					config.version = getRequiredValue(args, i, "version");
					i++;
					break;

				case "--release-id":
					config.releaseId = getRequiredValue(args, i, "release-id");
					i++;
					break;

				case "--tag":
					config.tag = getRequiredValue(args, i, "tag");
					i++;
					break;

				case "--event-name":
					config.eventName = getRequiredValue(args, i, "event-name");
					i++;
					break;

				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++;
					break;

				case "--github-token":
					config.githubToken = getRequiredValue(args, i, "github-token");
					i++;
					break;

				case "--api-key", "--deepseek-api-key":
					config.apiKey = getRequiredValue(args, i, "api-key");
					i++;
					break;

				case "-c", "--config":
					config.configFile = getRequiredValue(args, i, "config");
					i++;
					break;

				case "--skip-generated":
					config.skipGenerated = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Determine the run mode. Checked in order: the {@code workflow_call} event, the
	 * target, the legacy tag, then a bare release ID (legacy automatic release).
	 * @param config parsed configuration
	 * @return the run request
	 * @throws IllegalArgumentException if the identifiers required by the mode are missing
	 */
	public RunRequest resolveRunRequest(ParsedConfiguration config) {
		if (WORKFLOW_CALL_EVENT.equals(config.eventName)) {
			if (isBlank(config.version) || isBlank(config.releaseId)) {
				throw new IllegalArgumentException("Workflow call mode requires both --version and --release-id");
			}
			return RunRequest.explicit(RunMode.WORKFLOW_CALL, config.version, config.releaseId);
		}
		if (!isBlank(config.target)) {
			String target = config.target.trim();
			String normalized = target.toLowerCase(Locale.ROOT);
			if ("latest".equals(normalized)) {
				return RunRequest.latest();
			}
			if ("all".equals(normalized)) {
				return RunRequest.batch(config.skipGenerated);
			}
			return RunRequest.named(target);
		}
		if (!isBlank(config.tag)) {
			String tag = config.tag.trim();
			if ("all".equals(tag.toLowerCase(Locale.ROOT))) {
				return RunRequest.batch(config.skipGenerated);
			}
			return RunRequest.named(tag);
		}
		if (!isBlank(config.releaseId)) {
			if (isBlank(config.version)) {
				throw new IllegalArgumentException("Auto release mode requires --version with --release-id");
			}
			return RunRequest.explicit(RunMode.AUTO_RELEASE, config.version, config.releaseId);
		}
		throw new IllegalArgumentException(
				"No release selected: provide --target, --tag, or --release-id with --version");
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: java -jar github-changelog-cli.jar [OPTIONS]\n");
		help.append("\n");
		help.append("Generate a categorized changelog for GitHub releases and publish it as the release body.\n");
		help.append("\n");
		help.append("MODE SELECTION:\n");
		help.append("    --target <target>       Version tag to regenerate, 'latest', or 'all' for every release\n");
		help.append("    --version <version>     Version being released (automatic modes)\n");
		help.append("    --release-id <id>       ID of the release to update (automatic modes)\n");
		help.append("    --tag <tag>             Legacy alias of --target (a tag or 'all')\n");
		help.append("    --event-name <name>     Triggering event; 'workflow_call' requires --version and\n");
		help.append("                            --release-id (default: workflow_dispatch)\n");
		help.append("    --skip-generated        In batch mode, skip releases that already carry a generated\n");
		help.append("                            changelog\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo (default: $GITHUB_REPOSITORY)\n");
		help.append("    --github-token TOKEN    GitHub token (default: $GITHUB_TOKEN)\n");
		help.append("    --api-key KEY           Analysis API key (default: $DEEPSEEK_API_KEY); without a key the\n");
		help.append("                            rule-based changelog is used\n");
		help.append("    -c, --config FILE       Changelog configuration file (default: bundled configuration)\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN            GitHub token with write access to releases (required)\n");
		help.append("    GITHUB_REPOSITORY       Repository in format owner/repo\n");
		help.append("    DEEPSEEK_API_KEY        Analysis API key (optional)\n");
		help.append("    GITHUB_STEP_SUMMARY     Step summary file receiving the Markdown report\n");
		help.append("    GITHUB_OUTPUT           Step output file receiving key=value results\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Called from the release workflow\n");
		help.append("    java -jar github-changelog-cli.jar --event-name workflow_call --version v1.2.0 "
				+ "--release-id 123456\n");
		help.append("\n");
		help.append("    # Regenerate the latest release or a named one\n");
		help.append("    java -jar github-changelog-cli.jar --target latest\n");
		help.append("    java -jar github-changelog-cli.jar --target v1.1.0 --repo owner/repo\n");
		help.append("\n");
		help.append("    # Regenerate every release that has no generated changelog yet\n");
		help.append("    java -jar github-changelog-cli.jar --target all --skip-generated\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment and complete missing secrets and repository from it.
	 * @param config parsed configuration, updated in place
	 * @throws IllegalStateException if the token or the repository is missing
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (isBlank(config.githubToken)) {
			config.githubToken = environment.apply("GITHUB_TOKEN");
		}
		if (isBlank(config.githubToken)) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set a token with write access to releases: export GITHUB_TOKEN=your_token_here");
		}
		if (isBlank(config.repository)) {
			config.repository = environment.apply("GITHUB_REPOSITORY");
		}
		if (isBlank(config.repository)) {
			throw new IllegalStateException(
					"Repository is required. Pass --repo owner/repo or set the GITHUB_REPOSITORY environment variable");
		}
		if (!config.repository.matches(GitHubReleaseService.REPOSITORY_PATTERN)) {
			throw new IllegalStateException("Repository must be in format 'owner/repo' (got: " + config.repository + ")");
		}
		if (isBlank(config.apiKey)) {
			config.apiKey = environment.apply("DEEPSEEK_API_KEY");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.repository != null && !config.repository.matches(GitHubReleaseService.REPOSITORY_PATTERN)) {
			errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
		}

		if (!isBlank(config.releaseId) && !config.releaseId.trim().matches("\\d+")) {
			errors.add("Release ID must be numeric (got: " + config.releaseId + ")");
		}

		if (config.eventName.isBlank()) {
			errors.add("Event name cannot be empty");
		}

		try {
			resolveRunRequest(config);
		}
		catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
