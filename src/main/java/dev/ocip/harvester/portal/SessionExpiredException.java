package dev.ocip.harvester.portal;

import dev.ocip.harvester.model.FailureReason;

/** The authenticated session is gone; the phase cannot continue */
public class SessionExpiredException extends PortalException {

	public SessionExpiredException(String message) {
		super(FailureReason.SESSION_LOST, message);
	}
}
