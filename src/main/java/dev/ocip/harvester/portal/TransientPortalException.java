package dev.ocip.harvester.portal;

import dev.ocip.harvester.model.FailureReason;

/** A failure that may clear up when the request is repeated (timeout, render failure, rate limit) */
public class TransientPortalException extends PortalException {

	public TransientPortalException(FailureReason reason, String message) {
		super(reason, message);
	}

	public TransientPortalException(FailureReason reason, String message, Throwable cause) {
		super(reason, message, cause);
	}

	public static TransientPortalException timeout(String message) {
		return new TransientPortalException(FailureReason.TIMEOUT, message);
	}

	public static TransientPortalException rateLimited(String message) {
		return new TransientPortalException(FailureReason.RATE_LIMITED, message);
	}

	public static TransientPortalException renderFailure(String message) {
		return new TransientPortalException(FailureReason.RENDER_FAILURE, message);
	}
}
