package dev.ocip.harvester;

import dev.ocip.harvester.engine.ErrorLedger;
import dev.ocip.harvester.engine.FileCheckpointStore;
import dev.ocip.harvester.engine.HarvestDirs;
import dev.ocip.harvester.engine.PhaseDefinition;
import dev.ocip.harvester.engine.PhaseFactory;
import dev.ocip.harvester.engine.PhaseLayout;
import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.PhaseState;
import dev.ocip.harvester.util.FileUtils;
import dev.ocip.harvester.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Status command showing the state of every phase */
@Command(
		name = "status",
		description = "Show progress, output and errors of every phase",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	public enum Status {
		PENDING("Pending"),
		PAUSED("Paused"),
		PARTIAL("Partial"),
		COMPLETE("Complete");

		private final String label;

		Status(String label) {
			this.label = label;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding output/, checkpoints/ and logs/ (default: current directory)",
			defaultValue = ".")
	Path dataDir;

	@Override
	public Integer call() throws Exception {
		var dirs = HarvestDirs.under(dataDir);
		logger.info("OCIP Portal Harvester - Status");
		logger.info("==============================");
		logger.info("");

		for (PhaseDefinition definition : PhaseFactory.getAvailablePhases().values()) {
			reportPhase(definition, dirs.layout(definition));
		}

		logger.info("Folders");
		logger.info("=======");
		for (Path dir : List.of(dirs.outputDir(), dirs.checkpointDir(), dirs.logsDir())) {
			logger.info("  {}: {}", dir, folderSummary(dir));
		}
		return 0;
	}

	private void reportPhase(PhaseDefinition definition, PhaseLayout layout) {
		CheckpointState checkpoint = null;
		if (Files.exists(layout.checkpointFile())) {
			try {
				checkpoint = FileCheckpointStore.read(layout.checkpointFile());
			} catch (IOException e) {
				logger.warn("  Unreadable checkpoint {}: {}", layout.checkpointFile(), e.getMessage());
			}
		}
		Path output = layout.outputFile();
		Status status = statusOf(
				Files.exists(layout.checkpointFile()),
				checkpoint == null ? null : checkpoint.status(),
				Files.exists(output));

		logger.info("{} [{}]: {}", definition.description(), definition.id(), status);
		if (Files.exists(output)) {
			try {
				logger.info(
						"  Output: {} records in {} ({})",
						JsonFiles.countEntries(output),
						output.getFileName(),
						FileUtils.formatSize(FileUtils.getFileSize(output)));
			} catch (IOException e) {
				logger.warn("  Output: unreadable {} ({})", output.getFileName(), e.getMessage());
			}
		}
		if (checkpoint != null) {
			logger.info("  Progress: {}", checkpoint.counters());
			logger.info("  Position: {}", checkpoint.cursor());
			logger.info("  Saved: {}", checkpoint.timestamp());
		}
		if (Files.exists(layout.ledgerFile())) {
			try {
				List<ErrorEntry> entries = ErrorLedger.read(layout.ledgerFile());
				logger.info("  Errors: {} {}", entries.size(), ErrorLedger.summarize(entries));
			} catch (IOException e) {
				logger.warn("  Errors: unreadable ledger ({})", e.getMessage());
			}
		}
		logger.info("");
	}

	/** Dashboard status of a phase from what is on disk */
	static Status statusOf(boolean checkpointExists, PhaseState checkpointStatus, boolean outputExists) {
		if (checkpointExists) {
			if (checkpointStatus == PhaseState.COMPLETE) {
				return Status.COMPLETE;
			}
			return outputExists ? Status.PARTIAL : Status.PAUSED;
		}
		return outputExists ? Status.COMPLETE : Status.PENDING;
	}

	private static String folderSummary(Path dir) {
		if (!Files.isDirectory(dir)) {
			return "missing";
		}
		long files = 0;
		long bytes = 0;
		try (Stream<Path> children = Files.list(dir)) {
			for (Path file : children.filter(Files::isRegularFile).toList()) {
				files++;
				bytes += FileUtils.getFileSize(file);
			}
		} catch (IOException e) {
			return "unreadable (" + e.getMessage() + ")";
		}
		return files + " files, " + FileUtils.formatSize(bytes);
	}
}
