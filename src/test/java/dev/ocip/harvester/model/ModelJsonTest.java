package dev.ocip.harvester.model;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import dev.ocip.harvester.util.JsonFiles;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelJsonTest {

	@Test
	void testCheckpointDocumentLayout() throws Exception {
		// Given
		CheckpointState state = CheckpointState.empty("experts-metadata");
		state.markCompleted(IdentityKey.of("1042"));
		state.advance(Cursor.page(2, "Inst-C", 4)).counters(new Counters(5, 0, 1, 0, 9));

		// When
		JsonNode json = JsonFiles.mapper().readTree(JsonFiles.toJson(state));

		// Then
		assertThat(json.get("phase_id").asText()).isEqualTo("experts-metadata");
		assertThat(json.get("status").asText()).isEqualTo("RUNNING");
		assertThat(json.get("completed").get(0).asText()).isEqualTo("1042");
		assertThat(json.get("cursor").get("partition_label").asText()).isEqualTo("Inst-C");
		assertThat(json.get("cursor").get("page_index").asInt()).isEqualTo(4);
		assertThat(json.get("cursor").has("start")).isFalse();
		assertThat(json.get("counters").get("processed").asInt()).isEqualTo(5);
		assertThat(json.get("counters").has("succeeded")).isFalse();
	}

	@Test
	void testSectionPayloadShapes() throws Exception {
		// Given
		String json = "{\"A\": {\"k\": \"v\"}, \"B\": [{\"k\": 1}], \"C\": []}";

		// When
		Map<String, SectionPayload> sections =
				JsonFiles.mapper().readValue(json, new TypeReference<Map<String, SectionPayload>>() {});

		// Then
		assertThat(sections.get("A")).isEqualTo(SectionPayload.FlatRecord.of(Map.of("k", "v")));
		assertThat(sections.get("B").shape()).isEqualTo(SectionShape.ROWS);
		assertThat(((SectionPayload.RecordList) sections.get("B")).rows().get(0).get("k")).isEqualTo("1");
		assertThat(sections.get("C").isEmpty()).isTrue();
	}

	@Test
	void testNestedSectionValueIsRejected() {
		// When/Then
		assertThatThrownBy(() -> JsonFiles.mapper().readValue("{\"k\": {\"x\": 1}}", SectionPayload.class))
				.isInstanceOf(MismatchedInputException.class);
		assertThatThrownBy(() -> JsonFiles.mapper().readValue("\"text\"", SectionPayload.class))
				.isInstanceOf(MismatchedInputException.class);
	}

	@Test
	void testErrorEntryOmitsAbsentFields() throws Exception {
		// Given
		ErrorEntry entry = ErrorEntry.fatal("experts-details", FailureReason.SESSION_LOST, "Session is no longer valid");

		// When
		JsonNode json = JsonFiles.mapper().readTree(JsonFiles.toJson(entry));

		// Then
		assertThat(json.get("kind").asText()).isEqualTo("FATAL");
		assertThat(json.has("identity")).isFalse();
		assertThat(json.has("section")).isFalse();
	}

	@Test
	void testCursorPositions() {
		// When/Then
		assertThat(Cursor.start().isStart()).isTrue();
		assertThat(Cursor.page(0, "Inst-A", 0).isStart()).isFalse();
		assertThat(Cursor.endOfPartition(1, "Inst-B", 3)).hasToString("partition 1 (Inst-B) page 3 [done]");
		assertThat(Cursor.item(7)).hasToString("item 7");
	}

	@Test
	void testCountersTally() {
		// When
		Counters counters = Counters.zero().withTotal(4).plusProcessed(2).plusPartial().plusFailed().plusSkipped();

		// Then
		assertThat(counters).isEqualTo(new Counters(3, 1, 1, 1, 4));
		assertThat(counters.succeeded()).isEqualTo(2);
		assertThat(counters.completedOnly()).isEqualTo(new Counters(3, 1, 0, 0, 4));
	}

	@Test
	void testCountersWithoutTotal() {
		// When/Then
		assertThat(Counters.zero().plusProcessed(4)).hasToString("4 processed (0 partial, 0 failed, 0 skipped)");
		assertThat(Counters.zero().withTotal(5).plusProcessed(4).plusFailed())
				.hasToString("4/5 processed (0 partial, 1 failed, 0 skipped)");
	}

	@Test
	void testIdentityKeys() {
		// When/Then
		assertThat(IdentityKey.natural(" 42 ")).isEqualTo(IdentityKey.of("42"));
		assertThat(IdentityKey.locator(null, "u")).hasToString("*|u");
		assertThatThrownBy(() -> IdentityKey.of(" ")).isInstanceOf(IllegalArgumentException.class);
		assertThat(List.of(IdentityKey.of("b"), IdentityKey.of("a")).stream().sorted().toList())
				.containsExactly(IdentityKey.of("a"), IdentityKey.of("b"));
	}

	@Test
	void testRetryableReasons() {
		// When/Then
		assertThat(FailureReason.TIMEOUT.retryable()).isTrue();
		assertThat(FailureReason.RATE_LIMITED.retryable()).isTrue();
		assertThat(FailureReason.PAGE_UNAVAILABLE.retryable()).isFalse();
		assertThat(PhaseState.COMPLETE.isTerminal()).isTrue();
		assertThat(PhaseState.RUNNING.isTerminal()).isFalse();
	}
}
