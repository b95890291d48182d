package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.model.IdentityKey;
import java.util.Map;

/** Durable progress of one phase */
public interface CheckpointStore {

	/** True when a previous run left a checkpoint behind */
	boolean exists();

	/** The saved state, or an empty state when there is none */
	CheckpointState load();

	/**
	 * Replaces the saved state atomically. Failure to save is fatal to the phase and surfaces as a
	 * {@link FatalPhaseException}.
	 */
	void save(CheckpointState state);

	/**
	 * Idempotent upsert of one record into an identity-keyed collection. Returns true when the
	 * collection changed. Merging the same record twice leaves the collection as after the first
	 * merge.
	 */
	static <R> boolean merge(Map<IdentityKey, R> existing, IdentityKey identity, R record, DuplicatePolicy policy) {
		R current = existing.get(identity);
		if (current == null) {
			existing.put(identity, record);
			return true;
		}
		if (policy == DuplicatePolicy.KEEP_LATEST && !current.equals(record)) {
			existing.put(identity, record);
			return true;
		}
		return false;
	}
}
