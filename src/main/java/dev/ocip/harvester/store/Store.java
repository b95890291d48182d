package dev.ocip.harvester.store;

import dev.ocip.harvester.model.DetailRecord;
import dev.ocip.harvester.model.SummaryRecord;
import java.io.IOException;
import java.util.List;

/** Output of the harvest. Both writes are idempotent upserts by identity. */
public interface Store {

	void writeSummary(List<SummaryRecord> records) throws IOException;

	void writeDetail(DetailRecord record) throws IOException;
}
