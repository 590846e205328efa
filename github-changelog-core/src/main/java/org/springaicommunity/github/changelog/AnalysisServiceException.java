package org.springaicommunity.github.changelog;

/**
 * Thrown when the analysis service cannot produce a completion. Always recoverable: the
 * changelog falls back to the rule-based document.
 */
public class AnalysisServiceException extends RuntimeException {

	private final int statusCode;

	public AnalysisServiceException(String message) {
		this(message, -1);
	}

	public AnalysisServiceException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public AnalysisServiceException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
	}

	/**
	 * Returns the HTTP status of the failed call.
	 * @return the status code, or -1 when no response was received
	 */
	public int getStatusCode() {
		return statusCode;
	}

}
