package dev.ocip.harvester.engine;

import static dev.ocip.harvester.engine.Rows.row;
import static dev.ocip.harvester.engine.Rows.url;
import static org.assertj.core.api.Assertions.*;

import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.model.DetailRecord;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.ErrorKind;
import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.model.PhaseState;
import dev.ocip.harvester.model.SummaryRecord;
import dev.ocip.harvester.portal.ListPage;
import dev.ocip.harvester.portal.PageUnavailableException;
import dev.ocip.harvester.store.JsonFileStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BasePhaseTest {

	@TempDir
	Path tempDir;

	@Test
	void testMetadataPhaseCompletes() throws IOException {
		// Given
		TraversalFixture fixture = scripted(tempDir.resolve("run"));

		// When
		PhaseResult result =
				new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.FRESH, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(result.state()).isEqualTo(PhaseState.COMPLETE);
		assertThat(result.success()).isTrue();
		assertThat(result.succeeded()).isEqualTo(4);
		assertThat(JsonFileStore.readMasterList(fixture.layout(fixture.metadata).masterListFile()))
				.hasSize(4);
		CheckpointState saved = fixture.checkpoints(fixture.metadata).load();
		assertThat(saved.status()).isEqualTo(PhaseState.COMPLETE);
		assertThat(saved.counters().total()).isZero();
	}

	@Test
	void testInterruptedRunResumesToSameState() throws IOException {
		// Given
		TraversalFixture straight = scripted(tempDir.resolve("straight"));
		TraversalFixture stopped = scripted(tempDir.resolve("stopped"));
		new MetadataPhase(straight.config(straight.metadata, ResumeMode.FRESH, 0, false), straight.fetcher).call();

		// When
		PhaseResult first =
				new MetadataPhase(stopped.config(stopped.metadata, ResumeMode.FRESH, 2, false), stopped.fetcher)
						.call();
		PhaseResult second =
				new MetadataPhase(stopped.config(stopped.metadata, ResumeMode.RESUME, 0, false), stopped.fetcher)
						.call();

		// Then
		assertThat(first.state()).isEqualTo(PhaseState.INTERRUPTED);
		assertThat(stopped.checkpoints(stopped.metadata).load().status()).isEqualTo(PhaseState.COMPLETE);
		assertThat(second.state()).isEqualTo(PhaseState.COMPLETE);

		CheckpointState expected = straight.checkpoints(straight.metadata).load();
		CheckpointState actual = stopped.checkpoints(stopped.metadata).load();
		assertThat(actual.cursor()).isEqualTo(expected.cursor());
		assertThat(actual.completed()).containsExactlyElementsOf(expected.completed());
		assertThat(actual.counters().processed()).isEqualTo(expected.counters().processed());
		assertThat(names(stopped)).containsExactlyElementsOf(names(straight));
		assertThat(stopped.fetcher.listFetchCount("Inst-A", 0)).isEqualTo(1);
	}

	@Test
	void testDetailsPhaseRequiresMasterList() throws IOException {
		// Given
		TraversalFixture fixture = new TraversalFixture(tempDir);

		// When
		PhaseResult result =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.FRESH, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(result.state()).isEqualTo(PhaseState.FATAL);
		assertThat(result.error()).hasMessageContaining("dummy-metadata");
		List<ErrorEntry> entries = ErrorLedger.read(fixture.layout(fixture.details).ledgerFile());
		assertThat(entries).singleElement().satisfies(entry -> {
			assertThat(entry.kind()).isEqualTo(ErrorKind.FATAL);
			assertThat(entry.reason()).isEqualTo(FailureReason.MISSING_PREREQUISITE);
		});
		assertThat(fixture.fetcher.totalDetailFetches()).isZero();
	}

	@Test
	void testDetailsPhaseAfterMetadata() throws IOException {
		// Given
		TraversalFixture fixture = scripted(tempDir);
		new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.FRESH, 0, false), fixture.fetcher).call();

		// When
		PhaseResult result =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.FRESH, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(result.state()).isEqualTo(PhaseState.COMPLETE);
		assertThat(result.succeeded()).isEqualTo(4);
		assertThat(result.ledgerEntries()).isZero();
		assertThat(JsonFileStore.readDetails(fixture.layout(fixture.details).detailsFile()))
				.extracting(record -> record.meta().name())
				.containsExactly("A", "B", "C", "D");
	}

	@Test
	void testForceRescrapesCompletedDetails() throws IOException {
		// Given
		TraversalFixture fixture = scripted(tempDir);
		new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.FRESH, 0, false), fixture.fetcher).call();
		new DetailsPhase(fixture.config(fixture.details, ResumeMode.FRESH, 0, false), fixture.fetcher).call();

		// When
		PhaseResult resumed =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.RESUME, 0, false), fixture.fetcher)
						.call();
		PhaseResult forced =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.RESUME, 0, true), fixture.fetcher)
						.call();

		// Then
		assertThat(resumed.succeeded()).isEqualTo(4);
		assertThat(resumed.skipped()).isZero();
		assertThat(forced.state()).isEqualTo(PhaseState.COMPLETE);
		assertThat(forced.succeeded()).isEqualTo(4);
		assertThat(fixture.fetcher.detailFetchCount(url("1"))).isEqualTo(2);
		List<DetailRecord> details = JsonFileStore.readDetails(fixture.layout(fixture.details).detailsFile());
		assertThat(details).hasSize(4);
	}

	@Test
	void testFailedDetailSucceedsOnResume() throws IOException {
		// Given
		TraversalFixture fixture = scripted(tempDir);
		new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.FRESH, 0, false), fixture.fetcher).call();
		fixture.fetcher.failDetail(url("1"), new PageUnavailableException("Page not found"));
		PhaseResult first =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.FRESH, 0, false), fixture.fetcher)
						.call();
		assertThat(first.succeeded()).isEqualTo(3);
		assertThat(first.failed()).isEqualTo(1);

		// When
		PhaseResult second =
				new DetailsPhase(fixture.config(fixture.details, ResumeMode.RESUME, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(second.state()).isEqualTo(PhaseState.COMPLETE);
		assertThat(second.succeeded()).isEqualTo(4);
		assertThat(second.failed()).isZero();
		assertThat(second.skipped()).isZero();
		CheckpointState saved = fixture.checkpoints(fixture.details).load();
		assertThat(saved.counters().processed()).isEqualTo(4);
		assertThat(saved.counters().failed()).isZero();
		assertThat(saved.completed()).hasSize(4);
		assertThat(fixture.fetcher.detailFetchCount(url("1"))).isEqualTo(2);
		assertThat(fixture.fetcher.detailFetchCount(url("2"))).isEqualTo(1);
	}

	@Test
	void testResumeModeWithoutCheckpointStartsFresh() {
		// Given
		TraversalFixture fixture = scripted(tempDir);

		// When
		MetadataPhase phase =
				new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.RESUME, 0, false), fixture.fetcher);
		PhaseResult result = phase.call();

		// Then
		assertThat(result.state()).isEqualTo(PhaseState.COMPLETE);
		assertThat(phase.state()).isEqualTo(PhaseState.COMPLETE);
	}

	@Test
	void testCorruptCheckpointIsFatal() throws IOException {
		// Given
		TraversalFixture fixture = scripted(tempDir);
		Path checkpoint = fixture.layout(fixture.metadata).checkpointFile();
		Files.createDirectories(checkpoint.getParent());
		Files.writeString(checkpoint, "{ not json");

		// When
		PhaseResult result =
				new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.RESUME, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(result.state()).isEqualTo(PhaseState.FATAL);
		assertThat(fixture.fetcher.totalListFetches()).isZero();
	}

	@Test
	void testLostSessionIsFatal() {
		// Given
		TraversalFixture fixture = scripted(tempDir);
		fixture.fetcher.invalidate();

		// When
		PhaseResult result =
				new MetadataPhase(fixture.config(fixture.metadata, ResumeMode.FRESH, 0, false), fixture.fetcher)
						.call();

		// Then
		assertThat(result.success()).isFalse();
		assertThat(result.error()).isInstanceOf(FatalPhaseException.class);
	}

	/** Two partitions, Inst-A over two pages */
	private static TraversalFixture scripted(Path dir) {
		TraversalFixture fixture = new TraversalFixture(dir);
		fixture.fetcher
				.partitions("Inst-A", "Inst-B")
				.page("Inst-A", 0, ListPage.more(List.of(row("1", "A"), row("2", "B"))))
				.page("Inst-A", 1, ListPage.last(List.of(row("3", "C"))))
				.page("Inst-B", 0, ListPage.last(List.of(row("4", "D"))));
		for (String id : List.of("1", "2", "3", "4")) {
			fixture.fetcher.detail(
					url(id), Map.of("Overview", Map.of("Status", "Active"), "Web_Presence", List.of()));
		}
		return fixture;
	}

	private static List<String> names(TraversalFixture fixture) throws IOException {
		return JsonFileStore.readMasterList(fixture.layout(fixture.metadata).masterListFile()).stream()
				.map(SummaryRecord::name)
				.toList();
	}
}
