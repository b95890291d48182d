package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.SectionPayload;
import dev.ocip.harvester.model.SectionShape;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Turns a raw section payload from the fetcher into a typed {@link SectionPayload} */
public final class SectionParser {

	private SectionParser() {}

	/** Thrown when the raw content does not fit the declared shape */
	public static class MalformedSectionException extends Exception {
		public MalformedSectionException(String message) {
			super(message);
		}
	}

	public static SectionPayload parse(Object raw, SectionShape shape) throws MalformedSectionException {
		if (raw == null) {
			return SectionPayload.emptyOf(shape);
		}
		if (raw instanceof List<?> list && list.isEmpty()) {
			return SectionPayload.emptyOf(shape);
		}
		return switch (shape) {
			case FIELDS -> {
				if (!(raw instanceof Map<?, ?> map)) {
					throw new MalformedSectionException("Expected fields but got " + describe(raw));
				}
				yield new SectionPayload.FlatRecord(toFields(map));
			}
			case ROWS -> {
				if (!(raw instanceof List<?> list)) {
					throw new MalformedSectionException("Expected rows but got " + describe(raw));
				}
				List<SectionPayload.FlatRecord> rows = new ArrayList<>();
				for (Object row : list) {
					if (!(row instanceof Map<?, ?> map)) {
						throw new MalformedSectionException("Expected row fields but got " + describe(row));
					}
					rows.add(new SectionPayload.FlatRecord(toFields(map)));
				}
				yield new SectionPayload.RecordList(rows);
			}
		};
	}

	/** Shape of an undeclared section, guessed from its content */
	public static SectionShape shapeOf(Object raw) {
		return raw instanceof List<?> ? SectionShape.ROWS : SectionShape.FIELDS;
	}

	private static Map<String, String> toFields(Map<?, ?> raw) throws MalformedSectionException {
		Map<String, String> fields = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : raw.entrySet()) {
			Object value = entry.getValue();
			if (value instanceof Map<?, ?> || value instanceof List<?>) {
				throw new MalformedSectionException("Nested value in field " + entry.getKey());
			}
			fields.put(String.valueOf(entry.getKey()), value == null ? "" : value.toString().trim());
		}
		return fields;
	}

	private static String describe(Object raw) {
		return raw.getClass().getSimpleName();
	}
}
