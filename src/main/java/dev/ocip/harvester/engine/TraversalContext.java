package dev.ocip.harvester.engine;

import dev.ocip.harvester.category.Category;
import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.portal.PageFetcher;
import dev.ocip.harvester.portal.Session;
import dev.ocip.harvester.store.Store;
import org.slf4j.Logger;

/**
 * Everything a traversal works with. The checkpoint state is owned by the traversal while it runs
 * and saved through the checkpoint store after every unit.
 */
public record TraversalContext(
		String phaseId,
		Category category,
		Session session,
		PageFetcher fetcher,
		Store store,
		CheckpointStore checkpoints,
		CheckpointState state,
		PacingController pacing,
		ErrorLedger ledger,
		Logger logger) {

	/** Aborts the phase when the session is gone */
	void checkSession() {
		if (!session.isValid()) {
			throw new FatalPhaseException(FatalCause.SESSION_LOST, "Session is no longer valid");
		}
	}

	/** Flushes the checkpoint after a unit of work */
	void flush() {
		checkpoints.save(state);
	}
}
