package org.springaicommunity.github.changelog;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {name}} placeholders of configuration templates.
 */
public final class TemplateRenderer {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

	private TemplateRenderer() {
	}

	/**
	 * Replace every known placeholder with its value. Unknown placeholders are left as
	 * they are.
	 * @param template the template text
	 * @param values placeholder values by name
	 * @return the rendered text
	 */
	public static String render(String template, Map<String, String> values) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	/**
	 * List the placeholder names used by a template.
	 * @param template the template text
	 * @return placeholder names in order of first appearance
	 */
	public static Set<String> placeholders(String template) {
		Set<String> names = new LinkedHashSet<>();
		Matcher matcher = PLACEHOLDER.matcher(template);
		while (matcher.find()) {
			names.add(matcher.group(1));
		}
		return names;
	}

}
