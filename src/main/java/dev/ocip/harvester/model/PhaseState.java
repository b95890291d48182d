package dev.ocip.harvester.model;

/** Lifecycle of a phase run */
public enum PhaseState {
	INIT,
	RESUMING,
	FRESH,
	RUNNING,
	/** Stopped cleanly at a unit boundary before the traversal was exhausted */
	INTERRUPTED,
	COMPLETE,
	FATAL;

	public boolean isTerminal() {
		return this == COMPLETE || this == FATAL || this == INTERRUPTED;
	}
}
