package org.springaicommunity.github.changelog;

import java.util.List;

/**
 * Receives structured progress events from the generator.
 *
 * <p>
 * The pipeline only emits events; rendering them to the console or to GitHub Actions
 * files is left to implementations. All methods default to doing nothing.
 */
public interface ProgressListener {

	/**
	 * Listener that ignores every event.
	 */
	ProgressListener NONE = new ProgressListener() {
	};

	/**
	 * Called once the releases of a batch run are enumerated.
	 * @param totalReleases number of releases to process
	 */
	default void batchStarted(int totalReleases) {
	}

	/**
	 * Called after each release of a batch run.
	 * @param progress the progress snapshot
	 */
	default void releaseProcessed(BatchProgress progress) {
	}

	/**
	 * Called when a batch run completes.
	 * @param result the final result
	 */
	default void batchCompleted(BatchResult result) {
	}

	/**
	 * Called when a single-release run completes.
	 * @param mode the run mode
	 * @param report the release report
	 */
	default void releaseCompleted(RunMode mode, ReleaseReport report) {
	}

	/**
	 * Combine listeners, notified in the given order.
	 * @param listeners the listeners
	 * @return a listener forwarding every event
	 */
	static ProgressListener composite(List<ProgressListener> listeners) {
		List<ProgressListener> targets = List.copyOf(listeners);
		return new ProgressListener() {

			@Override
			public void batchStarted(int totalReleases) {
				targets.forEach(listener -> listener.batchStarted(totalReleases));
			}

			@Override
			public void releaseProcessed(BatchProgress progress) {
				targets.forEach(listener -> listener.releaseProcessed(progress));
			}

			@Override
			public void batchCompleted(BatchResult result) {
				targets.forEach(listener -> listener.batchCompleted(result));
			}

			@Override
			public void releaseCompleted(RunMode mode, ReleaseReport report) {
				targets.forEach(listener -> listener.releaseCompleted(mode, report));
			}

		};
	}

}
