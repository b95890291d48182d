package dev.ocip.harvester.category;

import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.model.SectionSpec;
import dev.ocip.harvester.model.SummaryRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * One entity category of the portal. Knows how a listing row maps onto a {@link SummaryRecord} and
 * which sections a detail page carries. Categories are discovered with {@link ServiceLoader}.
 */
public interface Category {

	/** Short id used in phase ids and file names, e.g. "experts" */
	String id();

	String displayName();

	/** Position in the phase numbering */
	int order();

	/** True when the listing is split into per-institution partitions */
	boolean partitioned();

	/** Known detail sections in the order they appear in a detail record */
	List<SectionSpec> sections();

	/** Whether a listing row is kept at all */
	default boolean accept(Map<String, String> row) {
		return true;
	}

	SummaryRecord toSummary(PartitionRef partition, Map<String, String> row, Instant harvestedAt);

	/** All discovered categories keyed by id, in phase order */
	static Map<String, Category> available() {
		Map<String, Category> categories = new LinkedHashMap<>();
		StreamSupport.stream(ServiceLoader.load(Category.class).spliterator(), false)
				.sorted(Comparator.comparingInt(Category::order).thenComparing(Category::id))
				.forEach(category -> categories.put(category.id(), category));
		return categories;
	}
}
