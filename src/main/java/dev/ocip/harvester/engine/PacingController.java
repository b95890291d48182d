package dev.ocip.harvester.engine;

import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.TransientPortalException;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * Spaces out portal requests and retries transient failures with capped exponential backoff. An
 * interrupt while waiting stops the phase at the current unit boundary.
 */
public class PacingController {
	private final PacingPolicy policy;
	private final Sleeper sleeper;
	private final Logger logger;

	public PacingController(PacingPolicy policy, Sleeper sleeper, Logger logger) {
		this.policy = policy;
		this.sleeper = sleeper;
		this.logger = logger;
	}

	public PacingPolicy policy() {
		return policy;
	}

	/** A call to the portal */
	@FunctionalInterface
	public interface FetchCall<T> {
		T fetch() throws PortalException;
	}

	public void beforeRequest() {
		pause(policy.requestDelay());
	}

	/** Takes the longer batch pause whenever {@code processed} reaches a multiple of the batch size */
	public void onBatchBoundary(int processed) {
		if (policy.batchSize() > 0 && processed > 0 && processed % policy.batchSize() == 0) {
			logger.info("Processed {} items, pausing for {} ms", processed, policy.batchPause().toMillis());
			pause(policy.batchPause());
		}
	}

	/** Backoff after the given failed attempt (1-based); never decreases as attempts grow */
	public Duration onFailure(int attempt) {
		long base = policy.baseBackoff().toMillis();
		long max = policy.maxBackoff().toMillis();
		int shift = Math.min(Math.max(0, attempt - 1), 30);
		long delay = base * (1L << shift);
		if (delay < 0 || delay > max) {
			delay = max;
		}
		return Duration.ofMillis(delay);
	}

	/**
	 * Runs the call, retrying transient failures until the attempt cap. Non-transient failures are
	 * passed through at once.
	 */
	public <T> T execute(FetchCall<T> call) throws PortalException {
		for (int attempt = 1; ; attempt++) {
			beforeRequest();
			try {
				return call.fetch();
			} catch (TransientPortalException e) {
				if (attempt >= policy.maxAttempts()) {
					throw new RetriesExhaustedException(attempt, e);
				}
				Duration backoff = onFailure(attempt);
				logger.warn(
						"Attempt {}/{} failed ({}): {}, retrying in {} ms",
						attempt,
						policy.maxAttempts(),
						e.reason(),
						e.getMessage(),
						backoff.toMillis());
				pause(backoff);
			}
		}
	}

	private void pause(Duration duration) {
		if (duration.isZero() || duration.isNegative()) {
			return;
		}
		try {
			sleeper.sleep(duration);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedProgressException("Interrupted while waiting");
		}
	}
}
