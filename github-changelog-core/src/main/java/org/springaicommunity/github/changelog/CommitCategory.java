package org.springaicommunity.github.changelog;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of changelog categories, declared in rendering priority order.
 *
 * <p>
 * {@link #OTHER} is the catch-all: it never carries a matching pattern and receives every
 * commit no other category claims.
 */
public enum CommitCategory {

	FEATURE("FEATURE"),

	FIX("FIX"),

	PERFORMANCE("PERF", "PERFORMANCE"),

	STYLE("STYLE"),

	REFACTOR("REFACTOR"),

	DOCS("DOCS"),

	BUILD("BUILD"),

	OTHER("OTHER");

	private final String key;

	private final String[] aliases;

	CommitCategory(String key, String... aliases) {
		this.key = key;
		this.aliases = aliases;
	}

	/**
	 * Returns the key used for this category in configuration files and AI documents.
	 * @return the configuration key (e.g. "PERF")
	 */
	public String key() {
		return key;
	}

	/**
	 * Look up a category by configuration key or alias, ignoring case.
	 * @param key the key to resolve
	 * @return the matching category, or empty if the key is unknown
	 */
	public static Optional<CommitCategory> fromKey(String key) {
		String normalized = key.trim().toUpperCase(Locale.ROOT);
		for (CommitCategory category : values()) {
			if (category.key.equals(normalized)) {
				return Optional.of(category);
			}
			for (String alias : category.aliases) {
				if (alias.equals(normalized)) {
					return Optional.of(category);
				}
			}
		}
		return Optional.empty();
	}

}
