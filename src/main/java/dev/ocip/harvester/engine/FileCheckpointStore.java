package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.slf4j.Logger;

/** Keeps the checkpoint of one phase in a JSON document that is replaced atomically on every save */
public class FileCheckpointStore implements CheckpointStore {
	private final Path file;
	private final String phaseId;
	private final Logger logger;

	public FileCheckpointStore(Path file, String phaseId, Logger logger) {
		this.file = file;
		this.phaseId = phaseId;
		this.logger = logger;
	}

	public Path file() {
		return file;
	}

	@Override
	public boolean exists() {
		return Files.exists(file);
	}

	@Override
	public CheckpointState load() {
		if (!exists()) {
			return CheckpointState.empty(phaseId);
		}
		CheckpointState state;
		try {
			state = JsonFiles.read(file, CheckpointState.class);
		} catch (IOException e) {
			throw new FatalPhaseException(
					FatalCause.PERSISTENCE_FAILURE, "Cannot read checkpoint " + file + ": " + e.getMessage(), e);
		}
		if (!phaseId.equals(state.phaseId())) {
			throw new FatalPhaseException(
					FatalCause.PERSISTENCE_FAILURE,
					"Checkpoint " + file + " belongs to phase " + state.phaseId() + ", not " + phaseId);
		}
		logger.debug("Loaded checkpoint {}", state);
		return state;
	}

	@Override
	public void save(CheckpointState state) {
		state.timestamp(Instant.now());
		try {
			JsonFiles.writeAtomically(file, state);
		} catch (IOException e) {
			throw new FatalPhaseException(
					FatalCause.PERSISTENCE_FAILURE, "Cannot save checkpoint " + file + ": " + e.getMessage(), e);
		}
	}

	/** Read a checkpoint without a phase attached, for status reporting */
	public static CheckpointState read(Path file) throws IOException {
		return JsonFiles.read(file, CheckpointState.class);
	}
}
