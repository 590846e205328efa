package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Mode selection
	@Nullable
	public String target;

	@Nullable
	public String version;

	@Nullable
	public String releaseId;

	@Nullable
	public String tag; // legacy manual trigger

	public String eventName = "workflow_dispatch";

	public boolean skipGenerated = false;

	// Repository and secrets, completed from the environment by validateEnvironment
	@Nullable
	public String repository;

	@Nullable
	public String githubToken;

	@Nullable
	public String apiKey;

	@Nullable
	public String configFile;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ChangelogProperties defaultProperties) {
		this.configFile = defaultProperties.getConfigFile();
	}

	@Override
	public String toString() {
		// Secrets are reported by presence only
		return "ParsedConfiguration{" + "target='" + target + '\'' + ", version='" + version + '\'' + ", releaseId='"
				+ releaseId + '\'' + ", tag='" + tag + '\'' + ", eventName='" + eventName + '\'' + ", skipGenerated="
				+ skipGenerated + ", repository='" + repository + '\'' + ", githubToken="
				+ (githubToken != null ? "***" : "null") + ", apiKey=" + (apiKey != null ? "***" : "null")
				+ ", configFile='" + configFile + '\'' + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ '}';
	}

}
