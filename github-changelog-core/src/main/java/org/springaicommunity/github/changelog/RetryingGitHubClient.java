package org.springaicommunity.github.changelog;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Decorator that retries GitHub reads with backoff.
 *
 * <p>
 * Behavior:
 * <ul>
 * <li>GET requests are retried on server errors, network failures and rate limit errors
 * (403 with remaining=0, 429) with exponential backoff</li>
 * <li>Rate limit errors with a known reset sleep until {@code X-RateLimit-Reset} when the
 * reset is less than an hour away</li>
 * <li>PATCH requests are sent exactly once; a failed release update is reported to the
 * caller, never replayed</li>
 * </ul>
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(3)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final Sleeper sleeper;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	public String patch(String path, String body) {
		return delegate.patch(path, body);
	}

	private String executeWithRetry(Supplier<String> request, String description) {
		RuntimeException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return request.get();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				lastException = e;

				// Client errors are final, except rate limiting
				if (e.getStatusCode() >= 400 && e.getStatusCode() < 500 && !e.isRateLimitError()) {
					throw e;
				}

				if (attempt < maxRetries) {
					long waitMs = computeWaitTime(e, delay);
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), waitMs);
					sleep(waitMs);
					delay *= 2;
				}
			}
			catch (RuntimeException e) {
				lastException = e;

				if (attempt < maxRetries) {
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), delay);
					sleep(delay);
					delay *= 2;
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	/**
	 * Wait until the rate limit reset (+1s) when it is known and near, otherwise use the
	 * exponential delay.
	 */
	private long computeWaitTime(GitHubHttpClient.GitHubApiException e, long defaultDelay) {
		if (e.isRateLimitError() && e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;

			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			else if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away (> 1hr), using exponential backoff instead",
						waitSeconds);
			}
		}
		return defaultDelay;
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 3 retries, 1 second initial
	 * delay, {@link Sleeper#SYSTEM}.
	 */
	public static class Builder {

		@Nullable
		private GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
