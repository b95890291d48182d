package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

/** One entry of a phase's error ledger */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"phase", "kind", "reason", "identity", "locator", "section", "message", "retries", "timestamp"})
public record ErrorEntry(
		@JsonProperty("phase") String phase,
		@JsonProperty("kind") ErrorKind kind,
		@JsonProperty("reason") FailureReason reason,
		@JsonProperty("identity") IdentityKey identity,
		@JsonProperty("locator") String locator,
		@JsonProperty("section") String section,
		@JsonProperty("message") String message,
		@JsonProperty("retries") int retries,
		@JsonProperty("timestamp") Instant timestamp) {

	public ErrorEntry {
		Objects.requireNonNull(phase, "phase");
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(reason, "reason");
	}

	public static ErrorEntry terminal(
			String phase, FailureReason reason, IdentityKey identity, String locator, String message, int retries) {
		return new ErrorEntry(
				phase, ErrorKind.TERMINAL_ITEM, reason, identity, locator, null, message, retries, Instant.now());
	}

	public static ErrorEntry partial(
			String phase, FailureReason reason, IdentityKey identity, String locator, String section, String message) {
		return new ErrorEntry(
				phase, ErrorKind.PARTIAL_ITEM, reason, identity, locator, section, message, 0, Instant.now());
	}

	public static ErrorEntry fatal(String phase, FailureReason reason, String message) {
		return new ErrorEntry(phase, ErrorKind.FATAL, reason, null, null, null, message, 0, Instant.now());
	}
}
