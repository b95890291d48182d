package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Full profile of one entity. Carries the identity fields of its {@link SummaryRecord} in
 * {@link Meta} and one payload per section, in the category's declared section order. A detail
 * record is always replaced as a whole, never patched.
 */
@JsonPropertyOrder({"identity", "meta", "sections", "failed_sections"})
public record DetailRecord(
		@JsonProperty("identity") IdentityKey identity,
		@JsonProperty("meta") Meta meta,
		@JsonProperty("sections") Map<String, SectionPayload> sections,
		@JsonProperty("failed_sections") List<String> failedSections) {

	public DetailRecord {
		Objects.requireNonNull(identity, "identity");
		Objects.requireNonNull(meta, "meta");
		sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
		failedSections = failedSections == null ? List.of() : List.copyOf(failedSections);
	}

	/** True when at least one section could not be extracted */
	@JsonIgnore
	public boolean isPartial() {
		return !failedSections.isEmpty();
	}

	public SectionPayload section(String name) {
		return sections.get(name);
	}

	@JsonPropertyOrder({"partition", "name", "type", "source_url", "scraped_at", "fields"})
	public record Meta(
			@JsonProperty("partition") String partition,
			@JsonProperty("name") String name,
			@JsonProperty("type") String type,
			@JsonProperty("source_url") String sourceUrl,
			@JsonProperty("scraped_at") Instant scrapedAt,
			@JsonProperty("fields") Map<String, String> fields) {

		public Meta {
			fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
		}

		/** Copies the identity fields of a listing row */
		public static Meta of(SummaryRecord summary, Instant scrapedAt) {
			return new Meta(
					summary.partition(),
					summary.name(),
					summary.type(),
					summary.detailUrl(),
					scrapedAt,
					summary.fields());
		}
	}
}
