package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress tally of a phase. {@code processed} counts completed units, including the ones that
 * were only partially extracted; {@code partial} is the subset with failed sections. {@code total}
 * is zero when the number of units is not known up front, as for a listing.
 */
public record Counters(
		@JsonProperty("processed") int processed,
		@JsonProperty("partial") int partial,
		@JsonProperty("failed") int failed,
		@JsonProperty("skipped") int skipped,
		@JsonProperty("total") int total) {

	public static Counters zero() {
		return new Counters(0, 0, 0, 0, 0);
	}

	public Counters plusProcessed(int count) {
		return new Counters(processed + count, partial, failed, skipped, total);
	}

	public Counters plusPartial() {
		return new Counters(processed + 1, partial + 1, failed, skipped, total);
	}

	public Counters plusFailed() {
		return new Counters(processed, partial, failed + 1, skipped, total);
	}

	public Counters plusSkipped() {
		return new Counters(processed, partial, failed, skipped + 1, total);
	}

	/** Keeps the completed units only, for a pass that visits every unfinished unit again */
	public Counters completedOnly() {
		return new Counters(processed, partial, 0, 0, total);
	}

	public Counters withTotal(int total) {
		return new Counters(processed, partial, failed, skipped, total);
	}

	@JsonIgnore
	public int succeeded() {
		return processed - partial;
	}

	@Override
	public String toString() {
		String done = total > 0 ? processed + "/" + total : String.valueOf(processed);
		return "%s processed (%d partial, %d failed, %d skipped)".formatted(done, partial, failed, skipped);
	}
}
