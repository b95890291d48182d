package dev.ocip.harvester;

import dev.ocip.harvester.engine.HarvestDirs;
import dev.ocip.harvester.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Clean command to remove checkpoints or all harvested data */
@Command(
		name = "clean",
		description = "Remove checkpoints, or checkpoints together with output and error logs",
		mixinStandardHelpOptions = true)
public class CleanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding output/, checkpoints/ and logs/ (default: current directory)",
			defaultValue = ".")
	Path dataDir;

	@Option(
			names = {"--checkpoints"},
			description = "Remove all checkpoints so every phase starts fresh")
	boolean checkpoints;

	@Option(
			names = {"--all"},
			description = "Remove checkpoints, output and error logs")
	boolean all;

	@Option(
			names = {"--dry-run"},
			description = "Show what would be deleted without deleting anything")
	boolean dryRun;

	@Override
	public Integer call() throws Exception {
		var dirs = HarvestDirs.under(dataDir);
		logger.info("OCIP Portal Harvester - Clean");
		logger.info("=============================");

		// Apply default values if no options specified
		if (!checkpoints && !all && !dryRun) {
			logger.info("No options specified, using defaults: --checkpoints --dry-run");
			checkpoints = true;
			dryRun = true;
		}
		logger.info("Remove checkpoints: {}", checkpoints || all);
		logger.info("Remove output and logs: {}", all);
		logger.info("Dry run: {}", dryRun);
		logger.info("");

		List<Path> filesToDelete = new ArrayList<>();
		collectJsonFiles(dirs.checkpointDir(), filesToDelete);
		if (all) {
			collectJsonFiles(dirs.outputDir(), filesToDelete);
			collectJsonFiles(dirs.logsDir(), filesToDelete);
		}

		if (filesToDelete.isEmpty()) {
			logger.info("No files to delete.");
			return 0;
		}

		long totalBytes = 0;
		for (Path file : filesToDelete) {
			long size = FileUtils.getFileSize(file);
			totalBytes += size;
			logger.info("  {} ({})", file, FileUtils.formatSize(size));
		}
		logger.info("Files to delete: {} ({})", filesToDelete.size(), FileUtils.formatSize(totalBytes));

		if (dryRun) {
			logger.info("");
			logger.info("DRY RUN - No files were actually deleted.");
			logger.info("Run without --dry-run to perform actual deletion.");
			return 0;
		}

		logger.info("");
		logger.info("Deleting files...");
		int deletedCount = 0;
		int failedCount = 0;
		for (Path file : filesToDelete) {
			try {
				Files.delete(file);
				deletedCount++;
				logger.info("  Deleted: {}", file.getFileName());
			} catch (IOException e) {
				logger.error("  Failed to delete {}: {}", file.getFileName(), e.getMessage());
				failedCount++;
			}
		}

		logger.info("");
		logger.info("Deleted: {} files", deletedCount);
		if (failedCount > 0) {
			logger.info("Failed: {} files", failedCount);
			return 1;
		}
		return 0;
	}

	private static void collectJsonFiles(Path dir, List<Path> files) throws IOException {
		if (!Files.isDirectory(dir)) {
			return;
		}
		try (Stream<Path> children = Files.list(dir)) {
			children.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(".json"))
					.sorted()
					.forEach(files::add);
		}
	}
}
