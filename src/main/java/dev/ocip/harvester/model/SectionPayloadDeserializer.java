package dev.ocip.harvester.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads a JSON object back as a {@link SectionPayload.FlatRecord} and an array as a list */
public class SectionPayloadDeserializer extends StdDeserializer<SectionPayload> {

	public SectionPayloadDeserializer() {
		super(SectionPayload.class);
	}

	@Override
	public SectionPayload deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
		JsonNode node = p.getCodec().readTree(p);
		if (node.isObject()) {
			return toFlat(node, ctxt);
		}
		if (node.isArray()) {
			List<SectionPayload.FlatRecord> rows = new ArrayList<>();
			for (JsonNode row : node) {
				if (!row.isObject()) {
					return ctxt.reportInputMismatch(SectionPayload.class, "Section rows must be JSON objects");
				}
				rows.add(toFlat(row, ctxt));
			}
			return new SectionPayload.RecordList(rows);
		}
		return ctxt.reportInputMismatch(SectionPayload.class, "Section must be a JSON object or array");
	}

	private static SectionPayload.FlatRecord toFlat(JsonNode node, DeserializationContext ctxt) throws IOException {
		Map<String, String> fields = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> it = node.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> field = it.next();
			JsonNode value = field.getValue();
			if (value.isContainerNode()) {
				return ctxt.reportInputMismatch(
						SectionPayload.class, "Nested value in section field '%s'", field.getKey());
			}
			fields.put(field.getKey(), value.isNull() ? "" : value.asText());
		}
		return new SectionPayload.FlatRecord(fields);
	}
}
