package org.springaicommunity.github.changelog;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves secrets and runner settings such as {@code GITHUB_TOKEN},
 * {@code DEEPSEEK_API_KEY} or {@code GITHUB_OUTPUT}. Dotenv files are loaded once and
 * cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present), which also exposes
 * the system environment</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 * Blank values count as absent, since GitHub Actions passes unset secrets as empty
 * strings.
 */
public final class EnvironmentSupport {

	private static final Dotenv WORKING_DIR_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return WORKING_DIR_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR_DOTENV.get(name);
		if (value == null || value.isBlank()) {
			value = HOME_DOTENV.get(name);
		}
		return (value == null || value.isBlank()) ? null : value;
	}

}
