package dev.ocip.harvester.engine;

import dev.ocip.harvester.category.DummyCategory;
import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.store.JsonFileStore;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires traversal components over a temporary directory */
class TraversalFixture {
	static final Logger LOGGER = LoggerFactory.getLogger("test");

	final Path dir;
	final DummyCategory category = new DummyCategory();
	final DummyPageFetcher fetcher = new DummyPageFetcher();
	final RecordingSleeper sleeper = new RecordingSleeper();
	final HarvestDirs dirs;
	final PhaseDefinition metadata = new PhaseDefinition(category, Phase.Stage.METADATA, 1);
	final PhaseDefinition details = new PhaseDefinition(category, Phase.Stage.DETAILS, 2);

	TraversalFixture(Path dir) {
		this.dir = dir;
		this.dirs = HarvestDirs.under(dir);
	}

	PhaseLayout layout(PhaseDefinition definition) {
		return dirs.layout(definition);
	}

	FileCheckpointStore checkpoints(PhaseDefinition definition) {
		return new FileCheckpointStore(layout(definition).checkpointFile(), definition.id(), LOGGER);
	}

	ErrorLedger ledger(PhaseDefinition definition) {
		return new ErrorLedger(layout(definition).ledgerFile(), true, LOGGER);
	}

	JsonFileStore store() {
		PhaseLayout layout = layout(metadata);
		return new JsonFileStore(layout.masterListFile(), layout.detailsFile(), false);
	}

	TraversalContext context(PhaseDefinition definition, CheckpointStore checkpoints, ErrorLedger ledger) {
		return context(definition, checkpoints, checkpoints.load(), ledger);
	}

	TraversalContext context(
			PhaseDefinition definition, CheckpointStore checkpoints, CheckpointState state, ErrorLedger ledger) {
		return new TraversalContext(
				definition.id(),
				category,
				fetcher,
				fetcher,
				store(),
				checkpoints,
				state,
				new PacingController(PacingPolicy.immediate(3), sleeper, LOGGER),
				ledger,
				LOGGER);
	}

	PhaseConfig config(PhaseDefinition definition, ResumeMode mode, int limitProgress, boolean force) {
		return new PhaseConfig(
				definition,
				layout(definition),
				mode,
				force,
				limitProgress,
				PacingPolicy.immediate(3),
				sleeper,
				TraversalLimits.DEFAULT,
				PhaseProgress.NONE,
				LOGGER);
	}
}
