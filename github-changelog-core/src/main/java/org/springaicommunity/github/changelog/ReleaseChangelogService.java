package org.springaicommunity.github.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Regenerates the changelog of a single release.
 *
 * <p>
 * Pipeline: optimization check, commit range resolution, classification, best-effort AI
 * analysis, assembly and publication. Every failure is caught here and recorded as a
 * {@link ReleaseOutcome.Status#FAILED} outcome of this release only.
 */
public class ReleaseChangelogService {

	private static final Logger logger = LoggerFactory.getLogger(ReleaseChangelogService.class);

	private final CommitRangeResolver rangeResolver;

	private final CommitClassifier classifier;

	private final CommitAnalysisService analysisService;

	private final ChangelogAssembler assembler;

	private final ReleaseService releaseService;

	private final ChangelogConfiguration configuration;

	public ReleaseChangelogService(CommitRangeResolver rangeResolver, CommitClassifier classifier,
			CommitAnalysisService analysisService, ChangelogAssembler assembler, ReleaseService releaseService,
			ChangelogConfiguration configuration) {
		this.rangeResolver = rangeResolver;
		this.classifier = classifier;
		this.analysisService = analysisService;
		this.assembler = assembler;
		this.releaseService = releaseService;
		this.configuration = configuration;
	}

	/**
	 * Process one release.
	 * @param release the release to regenerate
	 * @param forceRegeneration regenerate even if the body already carries a generated
	 * changelog
	 * @return the report of this release, never null and never thrown
	 */
	public ReleaseReport process(Release release, boolean forceRegeneration) {
		String tag = release.tagName();
		int commitCount = 0;
		try {
			if (!forceRegeneration && isGenerated(release)) {
				logger.info("Release {} already carries a generated changelog, skipping", tag);
				return ReleaseReport.of(ReleaseOutcome.skipped(tag, ReleaseOutcome.NO_OPTIMIZATION_NEEDED, 0),
						release.id());
			}

			CommitRange range = rangeResolver.resolve(tag);
			commitCount = range.commits().size();
			if (range.isEmpty()) {
				return new ReleaseReport(ReleaseOutcome.skipped(tag, ReleaseOutcome.EMPTY_COMMIT_RANGE, 0),
						release.id(), range.rangeLabel(), Map.of(), null);
			}

			ClassifiedCommits classified = classifier.classify(range.commits());
			logger.info("Classified {} commits of {}: {}", classified.totalCount(), tag, classified.nonEmptyCounts());

			AnalysisOutcome analysis = analysisService.analyze(range.commits());
			String document = assembler.assemble(tag, classified, analysis.result(), range.commits());

			ReleaseOutcome outcome;
			if (releaseService.updateReleaseBody(release.id(), document)) {
				logger.info("Published {} changelog for {} ({} commits)", analysis.isSuccess() ? "AI-backed" : "basic",
						tag, commitCount);
				outcome = ReleaseOutcome.succeeded(tag, analysis.isSuccess(), commitCount);
			}
			else {
				outcome = ReleaseOutcome.failed(tag, "failed to update release body", commitCount);
			}
			return new ReleaseReport(outcome, release.id(), range.rangeLabel(), classified.nonEmptyCounts(),
					analysis.failureReason());
		}
		catch (RuntimeException e) {
			logger.error("Failed to process release {}: {}", tag, e.getMessage(), e);
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			return ReleaseReport.of(ReleaseOutcome.failed(tag, message, commitCount), release.id());
		}
	}

	boolean isGenerated(Release release) {
		return release.existingBody().contains(configuration.generatedMarker());
	}

}
