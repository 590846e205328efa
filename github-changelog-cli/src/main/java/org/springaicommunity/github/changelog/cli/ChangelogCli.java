package org.springaicommunity.github.changelog.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.changelog.ArgumentParser;
import org.springaicommunity.github.changelog.ChangelogConfigurationException;
import org.springaicommunity.github.changelog.ChangelogGenerator;
import org.springaicommunity.github.changelog.ChangelogGeneratorBuilder;
import org.springaicommunity.github.changelog.ChangelogProperties;
import org.springaicommunity.github.changelog.ParsedConfiguration;
import org.springaicommunity.github.changelog.RunRequest;
import org.springaicommunity.github.changelog.RunResult;

/**
 * GitHub Changelog CLI Application
 *
 * Plain Java command-line application that regenerates the body of GitHub releases from
 * the commits between consecutive version tags. Uses ChangelogGeneratorBuilder for
 * service wiring.
 *
 * Usage: java -jar github-changelog-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN, GITHUB_REPOSITORY, DEEPSEEK_API_KEY,
 * GITHUB_STEP_SUMMARY, GITHUB_OUTPUT
 *
 * Examples: java -jar github-changelog-cli.jar --target latest java -jar
 * github-changelog-cli.jar --event-name workflow_call --version v1.2.0 --release-id 42
 * java -jar github-changelog-cli.jar --target all --skip-generated
 */
public class ChangelogCli {

	private static final Logger logger = LoggerFactory.getLogger(ChangelogCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Changelog generation failed: {}", e.getMessage(), e);
			System.exit(1);
		}
	}

	/**
	 * Run the CLI without exiting the JVM.
	 * @param args command-line arguments
	 * @return process exit code
	 */
	public static int run(String[] args) {
		ChangelogProperties properties = new ChangelogProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		RunRequest request;
		ChangelogGenerator generator;
		try {
			config = argumentParser.parseAndValidate(args);
			if (config.verbose) {
				enableVerboseLogging();
			}
			argumentParser.validateEnvironment(config);
			request = argumentParser.resolveRunRequest(config);
			properties.setConfigFile(config.configFile);

			logConfiguration(config, request);

			generator = ChangelogGeneratorBuilder.create()
				.token(config.githubToken)
				.apiKey(config.apiKey)
				.repository(config.repository)
				.properties(properties)
				.build();
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error("{}", e.getMessage());
			return 1;
		}
		catch (ChangelogConfigurationException e) {
			logger.error("Invalid changelog configuration: {}", e.getMessage());
			return 1;
		}

		RunResult result = generator.run(request);
		logger.info("Run {} in mode {}", result.successful() ? "succeeded" : "failed", result.mode().value());
		return result.exitCode();
	}

	private static void enableVerboseLogging() {
		Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
			logbackRoot.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config, RunRequest request) {
		logger.info("Configuration:");
		logger.info("  Repository: {}", config.repository);
		logger.info("  Event: {}", config.eventName);
		logger.info("  Mode: {}", request.mode().value());
		logger.info("  Version: {}", request.version() != null ? request.version() : "(resolved at run time)");
		logger.info("  Release ID: {}", request.releaseId() != null ? request.releaseId() : "(looked up)");
		logger.info("  Skip generated: {}", request.skipGenerated());
		logger.info("  AI analysis: {}", config.apiKey != null ? "enabled" : "disabled (no API key)");
		logger.info("  Config file: {}", config.configFile != null ? config.configFile : "(bundled)");
	}

}
