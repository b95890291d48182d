package dev.ocip.harvester.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Append-only record of the failures of one phase. Each entry is written through to a JSON
 * document right away. Recording never throws: if the document cannot be written the entry is kept
 * in memory and the next write carries it along.
 */
public class ErrorLedger {
	private static final TypeReference<List<ErrorEntry>> ENTRIES = new TypeReference<>() {};

	private final Path file;
	private final Logger logger;
	private final List<ErrorEntry> entries = new ArrayList<>();
	private boolean dirty;

	/**
	 * @param keepExisting continue the document left by an earlier run instead of starting a new one
	 */
	public ErrorLedger(Path file, boolean keepExisting, Logger logger) {
		this.file = file;
		this.logger = logger;
		if (keepExisting) {
			try {
				entries.addAll(JsonFiles.readList(file, ENTRIES));
			} catch (IOException e) {
				logger.error("Cannot read error ledger {}, starting a new one: {}", file, e.getMessage());
			}
		}
	}

	public synchronized void record(ErrorEntry entry) {
		entries.add(entry);
		dirty = true;
		try {
			JsonFiles.writeAtomically(file, entries);
			dirty = false;
		} catch (IOException | RuntimeException e) {
			logger.error("Failed to write error ledger {} ({} entries pending)", file, entries.size(), e);
		}
	}

	/** Entry counts by failure reason */
	public synchronized Map<FailureReason, Integer> summary() {
		return summarize(entries);
	}

	public synchronized List<ErrorEntry> entries() {
		return List.copyOf(entries);
	}

	public synchronized int size() {
		return entries.size();
	}

	/** True while some entries have not reached the document */
	public synchronized boolean hasPendingWrites() {
		return dirty;
	}

	public static Map<FailureReason, Integer> summarize(List<ErrorEntry> entries) {
		Map<FailureReason, Integer> counts = new EnumMap<>(FailureReason.class);
		for (ErrorEntry entry : entries) {
			counts.merge(entry.reason(), 1, Integer::sum);
		}
		return counts;
	}

	/** Read a ledger document, for status reporting */
	public static List<ErrorEntry> read(Path file) throws IOException {
		return JsonFiles.readList(file, ENTRIES);
	}
}
