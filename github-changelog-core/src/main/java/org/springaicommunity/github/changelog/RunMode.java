package org.springaicommunity.github.changelog;

/**
 * Run modes of the changelog generator.
 */
public enum RunMode {

	/**
	 * Invoked by a release workflow with an explicit version and release ID.
	 */
	WORKFLOW_CALL("workflow_call", false),

	/**
	 * Legacy automatic trigger: release ID plus version without the workflow event.
	 */
	AUTO_RELEASE("auto_release", false),

	/**
	 * Manual regeneration of the latest release.
	 */
	LATEST("manual_latest", true),

	/**
	 * Manual regeneration of a named release.
	 */
	NAMED("manual_optimize", true),

	/**
	 * Regeneration of every release of the repository.
	 */
	BATCH_ALL("batch_all", true);

	private final String value;

	private final boolean forcesRegeneration;

	RunMode(String value, boolean forcesRegeneration) {
		this.value = value;
		this.forcesRegeneration = forcesRegeneration;
	}

	/**
	 * Returns the mode name shown in reports.
	 * @return report value (e.g. "batch_all")
	 */
	public String value() {
		return value;
	}

	/**
	 * Returns true if releases that already carry a generated changelog are regenerated
	 * anyway. Automatic modes skip them.
	 * @return true for manual modes
	 */
	public boolean forcesRegeneration() {
		return forcesRegeneration;
	}

}
