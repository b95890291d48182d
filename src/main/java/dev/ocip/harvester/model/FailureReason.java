package dev.ocip.harvester.model;

/** Why a unit of work (or one section of it) failed */
public enum FailureReason {
	TIMEOUT(true),
	RENDER_FAILURE(true),
	RATE_LIMITED(true),
	PAGE_UNAVAILABLE(false),
	MISSING_LOCATOR(false),
	SECTION_FAILED(false),
	MALFORMED_SECTION(false),
	PARTITION_ABANDONED(false),
	SESSION_LOST(false),
	PERSISTENCE_FAILURE(false),
	MISSING_PREREQUISITE(false),
	UNKNOWN(false);

	private final boolean retryable;

	FailureReason(boolean retryable) {
		this.retryable = retryable;
	}

	/** True for failures that may clear up when the same request is repeated */
	public boolean retryable() {
		return retryable;
	}
}
