package org.springaicommunity.github.changelog;

/**
 * Blocking pause used for retry backoff and the inter-release delay, replaceable in
 * tests.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = Thread::sleep;

	/**
	 * Block the calling thread.
	 * @param millis pause in milliseconds
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	void sleep(long millis) throws InterruptedException;

}
