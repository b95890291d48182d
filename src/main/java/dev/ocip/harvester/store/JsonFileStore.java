package dev.ocip.harvester.store;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.ocip.harvester.engine.CheckpointStore;
import dev.ocip.harvester.engine.DuplicatePolicy;
import dev.ocip.harvester.model.DetailRecord;
import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.SummaryRecord;
import dev.ocip.harvester.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Keeps the master list and the full details of one category as JSON array documents. Every write
 * merges into the in-memory copy and replaces the whole document atomically. A summary that is
 * already present is kept; a detail record replaces the earlier one.
 *
 * <p>When started fresh the existing documents are ignored, but they stay on disk until the first
 * write replaces them.
 */
public class JsonFileStore implements Store {
	private static final TypeReference<List<SummaryRecord>> SUMMARIES = new TypeReference<>() {};
	private static final TypeReference<List<DetailRecord>> DETAILS = new TypeReference<>() {};

	private final Path masterListFile;
	private final Path detailsFile;
	private final boolean fresh;
	private Map<IdentityKey, SummaryRecord> summaries;
	private Map<IdentityKey, DetailRecord> details;

	public JsonFileStore(Path masterListFile, Path detailsFile, boolean fresh) {
		this.masterListFile = masterListFile;
		this.detailsFile = detailsFile;
		this.fresh = fresh;
	}

	@Override
	public synchronized void writeSummary(List<SummaryRecord> records) throws IOException {
		Map<IdentityKey, SummaryRecord> current = summaries();
		boolean changed = false;
		for (SummaryRecord record : records) {
			changed |= CheckpointStore.merge(current, record.identity(), record, DuplicatePolicy.KEEP_FIRST);
		}
		if (changed || records.isEmpty()) {
			JsonFiles.writeAtomically(masterListFile, new ArrayList<>(current.values()));
		}
	}

	@Override
	public synchronized void writeDetail(DetailRecord record) throws IOException {
		Map<IdentityKey, DetailRecord> current = details();
		if (CheckpointStore.merge(current, record.identity(), record, DuplicatePolicy.KEEP_LATEST)) {
			JsonFiles.writeAtomically(detailsFile, new ArrayList<>(current.values()));
		}
	}

	public synchronized List<SummaryRecord> summaryRecords() throws IOException {
		return List.copyOf(summaries().values());
	}

	public synchronized List<DetailRecord> detailRecords() throws IOException {
		return List.copyOf(details().values());
	}

	private Map<IdentityKey, SummaryRecord> summaries() throws IOException {
		if (summaries == null) {
			summaries = index(fresh ? List.of() : readMasterList(masterListFile), SummaryRecord::identity);
		}
		return summaries;
	}

	private Map<IdentityKey, DetailRecord> details() throws IOException {
		if (details == null) {
			details = index(fresh ? List.of() : readDetails(detailsFile), DetailRecord::identity);
		}
		return details;
	}

	private static <R> Map<IdentityKey, R> index(List<R> records, Function<R, IdentityKey> key) {
		Map<IdentityKey, R> map = new LinkedHashMap<>();
		for (R record : records) {
			map.putIfAbsent(key.apply(record), record);
		}
		return map;
	}

	/** Read a master list document, an absent file reads as empty */
	public static List<SummaryRecord> readMasterList(Path file) throws IOException {
		return JsonFiles.readList(file, SUMMARIES);
	}

	/** Read a full details document, an absent file reads as empty */
	public static List<DetailRecord> readDetails(Path file) throws IOException {
		return JsonFiles.readList(file, DETAILS);
	}
}
