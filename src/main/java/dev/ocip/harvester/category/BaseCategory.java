package dev.ocip.harvester.category;

import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.model.SummaryRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base class for categories that map listing columns by field name */
public abstract class BaseCategory implements Category {
	public static final String LOCATOR_FIELD = "Manage_URL";

	/** Field holding an identifier the portal exposes, or null when rows have none */
	protected abstract String naturalIdField();

	protected abstract String nameField();

	protected abstract String typeField();

	protected String locatorField() {
		return LOCATOR_FIELD;
	}

	@Override
	public SummaryRecord toSummary(PartitionRef partition, Map<String, String> row, Instant harvestedAt) {
		Map<String, String> fields = new LinkedHashMap<>();
		row.forEach((key, value) -> fields.put(key, clean(value)));

		String locator = fields.getOrDefault(locatorField(), "");
		if (locator.isEmpty()) {
			locator = SummaryRecord.NO_LOCATOR;
			fields.put(locatorField(), locator);
		}
		String name = fields.getOrDefault(nameField(), "");

		return new SummaryRecord(
				identityOf(partition, fields, locator, name),
				partition.label(),
				name,
				typeField() == null ? null : fields.get(typeField()),
				locator,
				fields,
				harvestedAt);
	}

	protected IdentityKey identityOf(PartitionRef partition, Map<String, String> fields, String locator, String name) {
		if (naturalIdField() != null) {
			String id = fields.get(naturalIdField());
			if (id != null && !id.isEmpty()) {
				return IdentityKey.natural(id);
			}
		}
		if (!SummaryRecord.NO_LOCATOR.equals(locator)) {
			return IdentityKey.locator(partition.label(), locator);
		}
		// No link to tell rows apart, fall back to the display name
		return IdentityKey.locator(partition.label(), "name:" + name);
	}

	/** Collapse whitespace the way the listing renders it */
	protected static String clean(String value) {
		if (value == null) {
			return "";
		}
		return value.replaceAll("\\s+", " ").trim();
	}

	@Override
	public String toString() {
		return id();
	}
}
