package dev.ocip.harvester.engine;

import static org.assertj.core.api.Assertions.*;

import dev.ocip.harvester.model.SectionPayload;
import dev.ocip.harvester.model.SectionShape;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SectionParserTest {

	@Test
	void testParsesFlatSection() throws Exception {
		// Given
		Map<String, Object> raw = new LinkedHashMap<>();
		raw.put("Status", "  Active ");
		raw.put("Since", 2019);
		raw.put("Notes", null);

		// When
		SectionPayload payload = SectionParser.parse(raw, SectionShape.FIELDS);

		// Then
		assertThat(payload).isInstanceOf(SectionPayload.FlatRecord.class);
		assertThat(((SectionPayload.FlatRecord) payload).fields())
				.containsExactly(Map.entry("Status", "Active"), Map.entry("Since", "2019"), Map.entry("Notes", ""));
	}

	@Test
	void testParsesRepeatingSection() throws Exception {
		// When
		SectionPayload payload = SectionParser.parse(
				List.of(Map.of("Sector", "Health"), Map.of("Sector", "Energy")), SectionShape.ROWS);

		// Then
		assertThat(payload.shape()).isEqualTo(SectionShape.ROWS);
		assertThat(((SectionPayload.RecordList) payload).rows())
				.extracting(row -> row.get("Sector"))
				.containsExactly("Health", "Energy");
	}

	@Test
	void testAbsentContentIsEmptyOfDeclaredShape() throws Exception {
		// When/Then
		assertThat(SectionParser.parse(null, SectionShape.ROWS)).isEqualTo(SectionPayload.emptyOf(SectionShape.ROWS));
		assertThat(SectionParser.parse(List.of(), SectionShape.FIELDS))
				.isEqualTo(SectionPayload.emptyOf(SectionShape.FIELDS));
		assertThat(SectionParser.parse(Map.of(), SectionShape.FIELDS).isEmpty()).isTrue();
	}

	@Test
	void testWrongShapeIsMalformed() {
		// When/Then
		assertThatThrownBy(() -> SectionParser.parse(Map.of("a", "b"), SectionShape.ROWS))
				.isInstanceOf(SectionParser.MalformedSectionException.class);
		assertThatThrownBy(() -> SectionParser.parse(List.of(Map.of("a", "b")), SectionShape.FIELDS))
				.isInstanceOf(SectionParser.MalformedSectionException.class);
		assertThatThrownBy(() -> SectionParser.parse(List.of("text"), SectionShape.ROWS))
				.isInstanceOf(SectionParser.MalformedSectionException.class);
	}

	@Test
	void testNestedValueIsMalformed() {
		// When/Then
		assertThatThrownBy(() -> SectionParser.parse(Map.of("Inner", Map.of("a", "b")), SectionShape.FIELDS))
				.isInstanceOf(SectionParser.MalformedSectionException.class)
				.hasMessageContaining("Inner");
	}

	@Test
	void testShapeOfUndeclaredSection() {
		// When/Then
		assertThat(SectionParser.shapeOf(List.of())).isEqualTo(SectionShape.ROWS);
		assertThat(SectionParser.shapeOf(Map.of())).isEqualTo(SectionShape.FIELDS);
	}
}
