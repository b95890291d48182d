package dev.ocip.harvester.engine;

import java.nio.file.Path;

/** Files belonging to one phase */
public record PhaseLayout(
		Phase.Stage stage, Path checkpointFile, Path masterListFile, Path detailsFile, Path ledgerFile) {

	/** The document this phase produces */
	public Path outputFile() {
		return stage == Phase.Stage.METADATA ? masterListFile : detailsFile;
	}
}
