package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of changelog generation: runs a {@link RunRequest} in its mode.
 *
 * <p>
 * Single-release modes look the release up (by ID, by tag or as the latest release) and
 * hand it to {@link ReleaseChangelogService}; batch mode delegates to
 * {@link BatchChangelogService}. Upstream failures end the run with a failed result and a
 * report; they are never thrown from {@link #run(RunRequest)}.
 *
 * <p>
 * Instances are created with {@link ChangelogGeneratorBuilder}.
 */
public class ChangelogGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChangelogGenerator.class);

	private final ReleaseService releaseService;

	private final ReleaseChangelogService releaseChangelogService;

	private final BatchChangelogService batchChangelogService;

	private final ProgressListener listener;

	private final ChangelogProperties properties;

	private final Clock clock;

	ChangelogGenerator(ReleaseService releaseService, ReleaseChangelogService releaseChangelogService,
			BatchChangelogService batchChangelogService, ProgressListener listener, ChangelogProperties properties,
			Clock clock) {
		this.releaseService = releaseService;
		this.releaseChangelogService = releaseChangelogService;
		this.batchChangelogService = batchChangelogService;
		this.listener = listener;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Run a request.
	 * @param request the validated run request
	 * @return the run result
	 */
	public RunResult run(RunRequest request) {
		logger.info("Running changelog generation in mode {}", request.mode().value());
		if (request.mode() == RunMode.BATCH_ALL) {
			return runBatch(request.skipGenerated());
		}
		return runSingle(request);
	}

	private RunResult runSingle(RunRequest request) {
		RunMode mode = request.mode();
		String target = request.version() != null ? request.version() : "latest";
		ReleaseReport report;
		try {
			Optional<Release> release = findRelease(request);
			if (release.isPresent()) {
				report = releaseChangelogService.process(release.get(), mode.forcesRegeneration());
			}
			else {
				logger.error("No release found for {}", target);
				report = ReleaseReport.of(ReleaseOutcome.failed(target, "release not found", 0), 0);
			}
		}
		catch (RuntimeException e) {
			logger.error("Failed to look up release {}: {}", target, e.getMessage());
			ReleaseOutcome outcome = ReleaseOutcome.failed(target, "release lookup failed: " + e.getMessage(), 0);
			report = ReleaseReport.of(outcome, 0);
		}
		listener.releaseCompleted(mode, report);
		return RunResult.single(mode, report);
	}

	private Optional<Release> findRelease(RunRequest request) {
		switch (request.mode()) {
			case WORKFLOW_CALL:
			case AUTO_RELEASE: {
				Release release = releaseService.getReleaseById(requireValue(request.releaseId(), "release ID"));
				String version = requireValue(request.version(), "version");
				if (!release.tagName().equals(version)) {
					logger.warn("Release {} is tagged {}, using requested version {}", release.id(),
							release.tagName(), version);
					release = new Release(release.id(), version, release.body());
				}
				return Optional.of(release);
			}
			case NAMED:
				return releaseService.getReleaseByTag(requireValue(request.version(), "version"));
			case LATEST:
				return releaseService.getLatestRelease();
			default:
				throw new IllegalArgumentException("Not a single-release mode: " + request.mode());
		}
	}

	private RunResult runBatch(boolean skipGenerated) {
		Instant start = clock.instant();
		try {
			return RunResult.batch(batchChangelogService.run(skipGenerated));
		}
		catch (RuntimeException e) {
			logger.error("Failed to enumerate releases: {}", e.getMessage());
			BatchResult result = new BatchResult(BatchStats.start(0, start), List.of(),
					properties.getBatchSuccessThreshold(), false, Duration.between(start, clock.instant()));
			listener.batchCompleted(result);
			return RunResult.batch(result);
		}
	}

	private static String requireValue(@Nullable String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Missing " + name);
		}
		return value;
	}

}
