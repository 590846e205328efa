package org.springaicommunity.github.changelog;

/**
 * Thrown when the changelog configuration is missing or malformed. Always fatal: the
 * generator refuses to start with an invalid configuration.
 */
public class ChangelogConfigurationException extends RuntimeException {

	public ChangelogConfigurationException(String message) {
		super(message);
	}

	public ChangelogConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
