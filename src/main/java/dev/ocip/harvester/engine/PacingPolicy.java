package dev.ocip.harvester.engine;

import java.time.Duration;

/**
 * Timing policy for portal requests.
 *
 * @param requestDelay pause before every request
 * @param batchSize number of processed units between longer pauses, 0 disables batch pauses
 * @param batchPause the longer pause
 * @param baseBackoff backoff after the first failed attempt, doubled per further attempt
 * @param maxBackoff upper bound for a single backoff
 * @param maxAttempts attempts per request including the first one
 */
public record PacingPolicy(
		Duration requestDelay,
		int batchSize,
		Duration batchPause,
		Duration baseBackoff,
		Duration maxBackoff,
		int maxAttempts) {

	public static final PacingPolicy DEFAULT = new PacingPolicy(
			Duration.ofMillis(1000), 50, Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(30), 3);

	/** No waiting at all, retries still happen */
	public static PacingPolicy immediate(int maxAttempts) {
		return new PacingPolicy(Duration.ZERO, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO, maxAttempts);
	}

	public PacingPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		if (batchSize < 0) {
			throw new IllegalArgumentException("batchSize must not be negative");
		}
	}
}
