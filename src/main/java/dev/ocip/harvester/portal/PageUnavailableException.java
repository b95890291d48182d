package dev.ocip.harvester.portal;

import dev.ocip.harvester.model.FailureReason;

/** The requested page does not exist or cannot be shown; repeating the request will not help */
public class PageUnavailableException extends PortalException {

	public PageUnavailableException(String message) {
		super(FailureReason.PAGE_UNAVAILABLE, message);
	}

	public PageUnavailableException(String message, Throwable cause) {
		super(FailureReason.PAGE_UNAVAILABLE, message, cause);
	}
}
