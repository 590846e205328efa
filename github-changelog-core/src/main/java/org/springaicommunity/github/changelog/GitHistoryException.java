package org.springaicommunity.github.changelog;

/**
 * Thrown when a git command fails, times out or cannot be started.
 */
public class GitHistoryException extends RuntimeException {

	public GitHistoryException(String message) {
		super(message);
	}

	public GitHistoryException(String message, Throwable cause) {
		super(message, cause);
	}

}
