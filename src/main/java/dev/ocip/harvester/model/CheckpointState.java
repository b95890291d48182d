package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Durable progress of one phase: the traversal cursor, the identities whose units are complete,
 * the counters and the time of the last save. The set of completed identities only ever grows.
 */
@JsonPropertyOrder({"phase_id", "status", "cursor", "counters", "completed", "timestamp"})
public class CheckpointState {
	private final String phaseId;
	private final Set<IdentityKey> completed;
	private Cursor cursor;
	private Counters counters;
	private PhaseState status;
	private Instant timestamp;

	@JsonCreator
	public CheckpointState(
			@JsonProperty("phase_id") String phaseId,
			@JsonProperty("status") PhaseState status,
			@JsonProperty("cursor") Cursor cursor,
			@JsonProperty("counters") Counters counters,
			@JsonProperty("completed") Collection<IdentityKey> completed,
			@JsonProperty("timestamp") Instant timestamp) {
		this.phaseId = Objects.requireNonNull(phaseId, "phaseId");
		this.status = status == null ? PhaseState.RUNNING : status;
		this.cursor = cursor == null ? Cursor.start() : cursor;
		this.counters = counters == null ? Counters.zero() : counters;
		this.completed = completed == null ? new LinkedHashSet<>() : new LinkedHashSet<>(completed);
		this.timestamp = timestamp;
	}

	/** State of a phase that has not processed anything yet */
	public static CheckpointState empty(String phaseId) {
		return new CheckpointState(phaseId, PhaseState.RUNNING, Cursor.start(), Counters.zero(), null, null);
	}

	@JsonProperty("phase_id")
	public String phaseId() {
		return phaseId;
	}

	@JsonProperty("status")
	public PhaseState status() {
		return status;
	}

	public CheckpointState status(PhaseState status) {
		this.status = status;
		return this;
	}

	@JsonProperty("cursor")
	public Cursor cursor() {
		return cursor;
	}

	public CheckpointState advance(Cursor cursor) {
		this.cursor = Objects.requireNonNull(cursor, "cursor");
		return this;
	}

	@JsonProperty("counters")
	public Counters counters() {
		return counters;
	}

	public CheckpointState counters(Counters counters) {
		this.counters = Objects.requireNonNull(counters, "counters");
		return this;
	}

	@JsonProperty("completed")
	public Set<IdentityKey> completed() {
		return Collections.unmodifiableSet(completed);
	}

	public boolean isCompleted(IdentityKey identity) {
		return completed.contains(identity);
	}

	/** Records a unit as complete; returns false if it already was */
	public boolean markCompleted(IdentityKey identity) {
		return completed.add(Objects.requireNonNull(identity, "identity"));
	}

	@JsonProperty("timestamp")
	public Instant timestamp() {
		return timestamp;
	}

	public CheckpointState timestamp(Instant timestamp) {
		this.timestamp = timestamp;
		return this;
	}

	@Override
	public String toString() {
		return "CheckpointState[%s, %s, cursor=%s, %s, %d completed]"
				.formatted(phaseId, status, cursor, counters, completed.size());
	}
}
