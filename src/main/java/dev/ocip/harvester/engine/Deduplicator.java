package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.IdentityKey;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Admits records by identity. Under {@link DuplicatePolicy#KEEP_FIRST} an identity is admitted once
 * per run and never when it was completed by an earlier run. Under {@link DuplicatePolicy#KEEP_LATEST}
 * an identity completed earlier is admitted again as a replacement, still at most once per run.
 */
public class Deduplicator {

	public enum Admission {
		ACCEPTED,
		REPLACED,
		SKIPPED_DUPLICATE;

		public boolean admitted() {
			return this != SKIPPED_DUPLICATE;
		}
	}

	private final DuplicatePolicy policy;
	private final Set<IdentityKey> previous;
	private final Set<IdentityKey> seen = new HashSet<>();

	public Deduplicator(DuplicatePolicy policy, Collection<IdentityKey> previouslyCompleted) {
		this.policy = policy;
		this.previous = Set.copyOf(previouslyCompleted);
	}

	public static Deduplicator keepFirst(Collection<IdentityKey> previouslyCompleted) {
		return new Deduplicator(DuplicatePolicy.KEEP_FIRST, previouslyCompleted);
	}

	public static Deduplicator keepLatest(Collection<IdentityKey> previouslyCompleted) {
		return new Deduplicator(DuplicatePolicy.KEEP_LATEST, previouslyCompleted);
	}

	public Admission admit(IdentityKey identity) {
		if (!seen.add(identity)) {
			return Admission.SKIPPED_DUPLICATE;
		}
		if (previous.contains(identity)) {
			return policy == DuplicatePolicy.KEEP_LATEST ? Admission.REPLACED : Admission.SKIPPED_DUPLICATE;
		}
		return Admission.ACCEPTED;
	}

	public DuplicatePolicy policy() {
		return policy;
	}
}
