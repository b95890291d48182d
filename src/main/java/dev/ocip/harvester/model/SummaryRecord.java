package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One row of a category listing, as persisted in the master list */
@JsonPropertyOrder({"identity", "partition", "name", "type", "detail_url", "fields", "harvested_at"})
public record SummaryRecord(
		@JsonProperty("identity") IdentityKey identity,
		@JsonProperty("partition") String partition,
		@JsonProperty("name") String name,
		@JsonProperty("type") String type,
		@JsonProperty("detail_url") String detailUrl,
		@JsonProperty("fields") Map<String, String> fields,
		@JsonProperty("harvested_at") Instant harvestedAt) {

	/** Placeholder the portal listing shows when a row has no detail link */
	public static final String NO_LOCATOR = "Not Found";

	public SummaryRecord {
		Objects.requireNonNull(identity, "identity");
		fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	/** True when the row carries a usable detail locator */
	@JsonIgnore
	public boolean hasDetailLocator() {
		return detailUrl != null && !detailUrl.isBlank() && !NO_LOCATOR.equalsIgnoreCase(detailUrl.trim());
	}

	public String field(String key) {
		return fields.get(key);
	}
}
