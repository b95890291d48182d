package dev.ocip.harvester.engine;

import dev.ocip.harvester.portal.PortalException;

/** A retryable failure that kept failing until the attempt cap was reached */
public class RetriesExhaustedException extends PortalException {
	private final int attempts;

	public RetriesExhaustedException(int attempts, PortalException lastFailure) {
		super(
				lastFailure.reason(),
				"Giving up after " + attempts + " attempts: " + lastFailure.getMessage(),
				lastFailure);
		this.attempts = attempts;
	}

	public int attempts() {
		return attempts;
	}
}
