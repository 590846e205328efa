package org.springaicommunity.github.changelog;

/**
 * Shared access to the bundled changelog configuration for tests.
 */
final class TestConfigurations {

	private static ChangelogConfiguration defaults;

	private TestConfigurations() {
	}

	static synchronized ChangelogConfiguration defaults() {
		if (defaults == null) {
			defaults = new ChangelogConfigurationLoader(ObjectMapperFactory.create()).loadDefault();
		}
		return defaults;
	}

}
