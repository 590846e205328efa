package org.springaicommunity.github.changelog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A version-shaped tag such as {@code v1.2}, {@code 1.2.3.1} or
 * {@code v2.0.0-rc.1+build.5}.
 *
 * <p>
 * Natural order is ascending semantic version. Missing numeric components count as 0
 * and extra ones ({@code 1.2.3.1}) rank below the patch. Only a {@code -} suffix marks
 * a pre-release; it sorts before the plain version with the same numbers and its
 * dot-separated identifiers compare numerically when both are numeric. Build metadata
 * after {@code +} and any other trailing text are ignored.
 *
 * @param name the original tag name
 * @param numbers the numeric components, at least two
 * @param preRelease the pre-release identifiers (empty for a final version)
 */
record VersionTag(String name, List<Integer> numbers, List<String> preRelease) implements Comparable<VersionTag> {

	private static final Pattern VERSION = Pattern.compile("^v?(\\d+(?:\\.\\d+)+)(?:-([^+]*))?(.*)$");

	private static final Pattern NUMERIC = Pattern.compile("\\d+");

	private static final Comparator<VersionTag> ORDER = Comparator
		.<VersionTag, List<Integer>>comparing(VersionTag::numbers, VersionTag::compareNumbers)
		.thenComparing(VersionTag::preRelease, VersionTag::comparePreRelease)
		.thenComparing(VersionTag::name);

	/**
	 * Parse a tag name.
	 * @param name the tag name
	 * @return the version, or empty when the tag is not version-shaped
	 */
	static Optional<VersionTag> parse(String name) {
		Matcher matcher = VERSION.matcher(name.trim());
		if (!matcher.matches()) {
			return Optional.empty();
		}
		List<Integer> numbers = new ArrayList<>();
		try {
			for (String part : matcher.group(1).split("\\.")) {
				numbers.add(Integer.parseInt(part));
			}
		}
		catch (NumberFormatException e) {
			// numeric part overflows int
			return Optional.empty();
		}
		String preRelease = matcher.group(2);
		List<String> identifiers = preRelease == null || preRelease.isEmpty() ? List.of()
				: List.copyOf(Arrays.asList(preRelease.split("\\.")));
		return Optional.of(new VersionTag(name.trim(), List.copyOf(numbers), identifiers));
	}

	@Override
	public int compareTo(VersionTag other) {
		return ORDER.compare(this, other);
	}

	private static int compareNumbers(List<Integer> a, List<Integer> b) {
		int length = Math.max(a.size(), b.size());
		for (int i = 0; i < length; i++) {
			int result = Integer.compare(i < a.size() ? a.get(i) : 0, i < b.size() ? b.get(i) : 0);
			if (result != 0) {
				return result;
			}
		}
		return 0;
	}

	private static int comparePreRelease(List<String> a, List<String> b) {
		if (a.isEmpty() || b.isEmpty()) {
			return Boolean.compare(a.isEmpty(), b.isEmpty());
		}
		for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
			int result = compareIdentifier(a.get(i), b.get(i));
			if (result != 0) {
				return result;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	private static int compareIdentifier(String a, String b) {
		boolean aNumeric = NUMERIC.matcher(a).matches();
		boolean bNumeric = NUMERIC.matcher(b).matches();
		if (aNumeric && bNumeric) {
			String x = stripLeadingZeros(a);
			String y = stripLeadingZeros(b);
			return x.length() != y.length() ? Integer.compare(x.length(), y.length()) : x.compareTo(y);
		}
		if (aNumeric != bNumeric) {
			// numeric identifiers rank below alphanumeric ones
			return aNumeric ? -1 : 1;
		}
		return a.compareTo(b);
	}

	private static String stripLeadingZeros(String digits) {
		int i = 0;
		while (i < digits.length() - 1 && digits.charAt(i) == '0') {
			i++;
		}
		return digits.substring(i);
	}

}
