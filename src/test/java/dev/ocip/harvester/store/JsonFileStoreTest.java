package dev.ocip.harvester.store;

import static org.assertj.core.api.Assertions.*;

import dev.ocip.harvester.model.DetailRecord;
import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.SectionPayload;
import dev.ocip.harvester.model.SummaryRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileStoreTest {
	private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

	@TempDir
	Path tempDir;

	@Test
	void testSummariesKeepFirst() throws IOException {
		// Given
		JsonFileStore store = store(false);

		// When
		store.writeSummary(List.of(summary("1", "First"), summary("2", "Second")));
		store.writeSummary(List.of(summary("1", "Changed"), summary("3", "Third")));

		// Then
		assertThat(JsonFileStore.readMasterList(masterList()))
				.extracting(SummaryRecord::name)
				.containsExactly("First", "Second", "Third");
	}

	@Test
	void testDetailsKeepLatest() throws IOException {
		// Given
		JsonFileStore store = store(false);
		store.writeDetail(detail("1", "Old"));
		store.writeDetail(detail("2", "Other"));

		// When
		store.writeDetail(detail("1", "New"));

		// Then
		List<DetailRecord> details = JsonFileStore.readDetails(detailsFile());
		assertThat(details).extracting(DetailRecord::identity).containsExactly(IdentityKey.of("1"), IdentityKey.of("2"));
		assertThat(details.get(0).meta().name()).isEqualTo("New");
	}

	@Test
	void testDetailsSurviveRoundTrip() throws IOException {
		// Given
		DetailRecord record = new DetailRecord(
				IdentityKey.of("1"),
				new DetailRecord.Meta("Inst-A", "Name", "Academic", "https://x/1", NOW, Map.of("Name", "Name")),
				Map.of(
						"Overview",
						SectionPayload.FlatRecord.of(Map.of("Status", "Active")),
						"Web_Presence",
						SectionPayload.RecordList.of(List.of(SectionPayload.FlatRecord.of(Map.of("Url", "u"))))),
				List.of("Contacts"));

		// When
		store(false).writeDetail(record);

		// Then
		assertThat(JsonFileStore.readDetails(detailsFile())).containsExactly(record);
		String json = Files.readString(detailsFile());
		assertThat(json).contains("\"failed_sections\"").contains("\"scraped_at\" : \"2025-03-01T10:15:30Z\"");
	}

	@Test
	void testWritingTheSameRecordTwiceChangesNothing() throws IOException {
		// Given
		JsonFileStore store = store(false);
		store.writeDetail(detail("1", "Same"));
		String before = Files.readString(detailsFile());

		// When
		store(false).writeDetail(detail("1", "Same"));

		// Then
		assertThat(Files.readString(detailsFile())).isEqualTo(before);
	}

	@Test
	void testFreshStoreIgnoresOldDocument() throws IOException {
		// Given
		store(false).writeSummary(List.of(summary("1", "Old")));

		// When
		JsonFileStore fresh = store(true);
		fresh.writeSummary(List.of(summary("2", "New")));

		// Then
		assertThat(fresh.summaryRecords()).extracting(SummaryRecord::name).containsExactly("New");
		assertThat(JsonFileStore.readMasterList(masterList())).hasSize(1);
	}

	@Test
	void testAbsentDocumentsReadEmpty() throws IOException {
		// When/Then
		assertThat(JsonFileStore.readMasterList(masterList())).isEmpty();
		assertThat(store(false).detailRecords()).isEmpty();
	}

	private JsonFileStore store(boolean fresh) {
		return new JsonFileStore(masterList(), detailsFile(), fresh);
	}

	private Path masterList() {
		return tempDir.resolve("output/dummy_master_list.json");
	}

	private Path detailsFile() {
		return tempDir.resolve("output/dummy_full_details.json");
	}

	private static SummaryRecord summary(String id, String name) {
		return new SummaryRecord(
				IdentityKey.of(id), "Inst-A", name, null, "https://x/" + id, Map.of("id", id, "name", name), NOW);
	}

	private static DetailRecord detail(String id, String name) {
		return new DetailRecord(
				IdentityKey.of(id),
				DetailRecord.Meta.of(summary(id, name), NOW),
				Map.of("Overview", SectionPayload.FlatRecord.of(Map.of("Status", "Active"))),
				List.of());
	}
}
