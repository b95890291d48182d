package dev.ocip.harvester.portal;

import dev.ocip.harvester.model.FailureReason;

/** Failure reported by the page automation layer */
public class PortalException extends Exception {
	private final FailureReason reason;

	public PortalException(FailureReason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public PortalException(FailureReason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	public FailureReason reason() {
		return reason;
	}
}
