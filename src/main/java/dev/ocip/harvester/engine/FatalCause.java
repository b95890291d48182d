package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.FailureReason;

/** Conditions that abort a phase */
public enum FatalCause {
	SESSION_LOST(FailureReason.SESSION_LOST),
	PERSISTENCE_FAILURE(FailureReason.PERSISTENCE_FAILURE),
	MISSING_PREREQUISITE(FailureReason.MISSING_PREREQUISITE);

	private final FailureReason reason;

	FatalCause(FailureReason reason) {
		this.reason = reason;
	}

	public FailureReason reason() {
		return reason;
	}
}
