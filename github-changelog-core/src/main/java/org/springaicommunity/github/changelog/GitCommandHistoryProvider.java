package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitHistoryProvider} that runs the {@code git} executable.
 *
 * <p>
 * Commits are printed with the format {@code %h|%s|%b} terminated by a record separator,
 * so that a multi-line body can be collapsed onto the commit's line.
 */
public class GitCommandHistoryProvider implements GitHistoryProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitCommandHistoryProvider.class);

	private static final String RECORD_SEPARATOR = "\u001e";

	private static final String LOG_FORMAT = "--pretty=format:%h|%s|%b%x1e";

	private final String gitExecutable;

	@Nullable
	private final File workingDirectory;

	private final Duration timeout;

	public GitCommandHistoryProvider(String gitExecutable, @Nullable String workingDirectory, Duration timeout) {
		this.gitExecutable = gitExecutable;
		this.workingDirectory = workingDirectory != null ? new File(workingDirectory) : null;
		this.timeout = timeout;
	}

	@Override
	public List<String> listTags() {
		String output = run(List.of(gitExecutable, "tag", "--list", "--sort=-v:refname"));
		List<String> tags = new ArrayList<>();
		for (String line : output.split("\\R")) {
			if (!line.isBlank()) {
				tags.add(line.trim());
			}
		}
		return tags;
	}

	@Override
	public List<String> log(LogQuery query) {
		List<String> command = new ArrayList<>(List.of(gitExecutable, "log", LOG_FORMAT));
		if (!query.includeMerges()) {
			command.add("--no-merges");
		}
		if (query.maxCount() != null) {
			command.add("-n");
			command.add(String.valueOf(query.maxCount()));
		}
		command.add(query.revisionRange());
		command.add("--");

		String output = run(command);
		List<String> lines = new ArrayList<>();
		for (String record : output.split(RECORD_SEPARATOR)) {
			String line = record.strip().replaceAll("\\s*\\R\\s*", " ");
			if (!line.isEmpty()) {
				lines.add(line);
			}
		}
		return lines;
	}

	private String run(List<String> command) {
		String description = String.join(" ", command);
		logger.debug("Running {}", description);
		long start = System.currentTimeMillis();

		ProcessBuilder builder = new ProcessBuilder(command);
		if (workingDirectory != null) {
			builder.directory(workingDirectory);
		}

		Process process;
		try {
			process = builder.start();
		}
		catch (IOException e) {
			throw new GitHistoryException("Failed to start '" + description + "': " + e.getMessage(), e);
		}

		CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
		CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
		try {
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				throw new GitHistoryException("'" + description + "' timed out after " + timeout.toSeconds() + "s");
			}
			int exitCode = process.exitValue();
			if (exitCode != 0) {
				throw new GitHistoryException(
						"'" + description + "' failed with exit code " + exitCode + ": " + stderr.get().strip());
			}
			String output = stdout.get();
			logger.debug("{} completed in {}ms", description, System.currentTimeMillis() - start);
			return output;
		}
		catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new GitHistoryException("'" + description + "' interrupted", e);
		}
		catch (ExecutionException e) {
			throw new GitHistoryException("Failed to read output of '" + description + "'", e.getCause());
		}
	}

	private static String readFully(InputStream in) {
		try (in) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
