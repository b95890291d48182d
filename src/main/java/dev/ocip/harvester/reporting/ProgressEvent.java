package dev.ocip.harvester.reporting;

import dev.ocip.harvester.model.Counters;
import java.time.Instant;

/** Represents a progress event from a phase */
public record ProgressEvent(
		String phaseId, EventType eventType, String message, Counters counters, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		PROGRESS,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String phaseId) {
		return new ProgressEvent(phaseId, EventType.STARTED, "Phase started", null, Instant.now(), null);
	}

	public static ProgressEvent progress(String phaseId, Counters counters) {
		return new ProgressEvent(phaseId, EventType.PROGRESS, counters.toString(), counters, Instant.now(), null);
	}

	public static ProgressEvent completed(String phaseId, String message) {
		return new ProgressEvent(phaseId, EventType.COMPLETED, message, null, Instant.now(), null);
	}

	public static ProgressEvent failed(String phaseId, String message, Throwable error) {
		return new ProgressEvent(phaseId, EventType.FAILED, message, null, Instant.now(), error);
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, phaseId, eventType, message);
	}
}
