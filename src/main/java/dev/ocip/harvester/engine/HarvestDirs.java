package dev.ocip.harvester.engine;

import java.nio.file.Path;

/** The three directories a harvest writes to */
public record HarvestDirs(Path outputDir, Path checkpointDir, Path logsDir) {

	public static HarvestDirs under(Path dataDir) {
		return new HarvestDirs(dataDir.resolve("output"), dataDir.resolve("checkpoints"), dataDir.resolve("logs"));
	}

	public PhaseLayout layout(PhaseDefinition phase) {
		String category = phase.category().id();
		String prefix = "phase" + phase.number() + "_" + category;
		return new PhaseLayout(
				phase.stage(),
				checkpointDir.resolve(prefix + "_checkpoint.json"),
				outputDir.resolve(category + "_master_list.json"),
				outputDir.resolve(category + "_full_details.json"),
				logsDir.resolve(prefix + "_errors.json"));
	}
}
