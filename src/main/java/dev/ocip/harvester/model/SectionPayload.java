package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracted content of one detail section. Either a flat record of fields or a list of flat rows;
 * both serialize to plain JSON objects and arrays.
 */
@JsonDeserialize(using = SectionPayloadDeserializer.class)
public sealed interface SectionPayload permits SectionPayload.FlatRecord, SectionPayload.RecordList {

	boolean isEmpty();

	SectionShape shape();

	static SectionPayload emptyOf(SectionShape shape) {
		return shape == SectionShape.ROWS ? new RecordList(List.of()) : new FlatRecord(Map.of());
	}

	record FlatRecord(Map<String, String> fields) implements SectionPayload {
		public FlatRecord {
			fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
		}

		@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
		public static FlatRecord of(Map<String, String> fields) {
			return new FlatRecord(fields);
		}

		@JsonValue
		@Override
		public Map<String, String> fields() {
			return fields;
		}

		public String get(String field) {
			return fields.get(field);
		}

		@Override
		public boolean isEmpty() {
			return fields.isEmpty();
		}

		@Override
		public SectionShape shape() {
			return SectionShape.FIELDS;
		}
	}

	record RecordList(List<FlatRecord> rows) implements SectionPayload {
		public RecordList {
			rows = rows == null ? List.of() : List.copyOf(rows);
		}

		@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
		public static RecordList of(List<FlatRecord> rows) {
			return new RecordList(rows);
		}

		@JsonValue
		@Override
		public List<FlatRecord> rows() {
			return rows;
		}

		public int size() {
			return rows.size();
		}

		@Override
		public boolean isEmpty() {
			return rows.isEmpty();
		}

		@Override
		public SectionShape shape() {
			return SectionShape.ROWS;
		}
	}
}
