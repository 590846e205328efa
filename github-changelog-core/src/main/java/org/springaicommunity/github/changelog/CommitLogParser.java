package org.springaicommunity.github.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code id|subject|body} log lines into unclassified commits.
 *
 * <p>
 * Lines are split on the first two pipes only, so a body may itself contain pipes. A line
 * without an id or a subject is dropped.
 */
final class CommitLogParser {

	private static final Logger logger = LoggerFactory.getLogger(CommitLogParser.class);

	private CommitLogParser() {
	}

	static List<Commit> parse(List<String> lines) {
		List<Commit> commits = new ArrayList<>();
		int dropped = 0;
		for (String line : lines) {
			String[] parts = line.split("\\|", 3);
			String id = parts[0].trim();
			String subject = parts.length > 1 ? parts[1].trim() : "";
			if (id.isEmpty() || subject.isEmpty()) {
				dropped++;
				continue;
			}
			String body = parts.length > 2 ? parts[2].trim() : "";
			commits.add(Commit.of(id, subject, body));
		}
		if (dropped > 0) {
			logger.debug("Dropped {} malformed log lines", dropped);
		}
		return commits;
	}

}
