package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.Counters;
import dev.ocip.harvester.model.PhaseState;

/** Result of a phase execution */
public record PhaseResult(
		String phaseId,
		PhaseState state,
		int succeeded,
		int partial,
		int failed,
		int skipped,
		int ledgerEntries,
		Exception error) {

	public static PhaseResult completed(String phaseId, Counters counters, int ledgerEntries) {
		return of(phaseId, PhaseState.COMPLETE, counters, ledgerEntries);
	}

	public static PhaseResult interrupted(String phaseId, Counters counters, int ledgerEntries) {
		return of(phaseId, PhaseState.INTERRUPTED, counters, ledgerEntries);
	}

	public static PhaseResult failure(String phaseId, Exception error) {
		return new PhaseResult(phaseId, PhaseState.FATAL, 0, 0, 0, 0, 0, error);
	}

	/** The operator declined to run the phase; it never left {@link PhaseState#INIT} */
	public static PhaseResult cancelled(String phaseId) {
		return new PhaseResult(phaseId, PhaseState.INIT, 0, 0, 0, 0, 0, null);
	}

	private static PhaseResult of(String phaseId, PhaseState state, Counters counters, int ledgerEntries) {
		return new PhaseResult(
				phaseId,
				state,
				counters.succeeded(),
				counters.partial(),
				counters.failed(),
				counters.skipped(),
				ledgerEntries,
				null);
	}

	public boolean success() {
		return state != PhaseState.FATAL;
	}

	@Override
	public String toString() {
		return switch (state) {
			case COMPLETE -> "COMPLETE (%d succeeded, %d partial, %d failed, %d skipped)"
					.formatted(succeeded, partial, failed, skipped);
			case INTERRUPTED -> "INTERRUPTED (%d succeeded, %d partial, %d failed, %d skipped so far)"
					.formatted(succeeded, partial, failed, skipped);
			case FATAL -> "FATAL - %s".formatted(error != null ? error.getMessage() : "Unknown error");
			default -> "CANCELLED";
		};
	}
}
