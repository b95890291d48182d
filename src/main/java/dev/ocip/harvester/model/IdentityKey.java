package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Stable key that distinguishes one entity across runs. Either the portal's own identifier for the
 * entity, or the pair of partition label and detail locator when no identifier is exposed.
 */
public record IdentityKey(String value) implements Comparable<IdentityKey> {
	private static final String SEPARATOR = "|";

	public IdentityKey {
		Objects.requireNonNull(value, "value");
		if (value.isBlank()) {
			throw new IllegalArgumentException("Identity key must not be blank");
		}
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static IdentityKey of(String value) {
		return new IdentityKey(value);
	}

	/** Key built from an identifier the portal exposes for the entity */
	public static IdentityKey natural(String id) {
		return new IdentityKey(id.trim());
	}

	/** Key built from the partition the entity was listed under and its detail locator */
	public static IdentityKey locator(String partitionLabel, String locator) {
		String partition = partitionLabel == null ? "*" : partitionLabel;
		return new IdentityKey(partition + SEPARATOR + locator);
	}

	@JsonValue
	@Override
	public String value() {
		return value;
	}

	@Override
	public int compareTo(IdentityKey other) {
		return value.compareTo(other.value);
	}

	@Override
	public String toString() {
		return value;
	}
}
