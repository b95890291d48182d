package dev.ocip.harvester.portal;

import dev.ocip.harvester.model.PartitionRef;
import java.util.List;

/**
 * Page automation collaborator. Column level parsing happens here; the engine only sees raw field
 * maps and raw section payloads.
 */
public interface PageFetcher {

	/**
	 * The partitions of the current category's listing. An unpartitioned category returns the
	 * single {@link PartitionRef#global()} partition.
	 */
	List<PartitionRef> listPartitions() throws PortalException;

	/** Fetch one page (0-based) of a partition's listing */
	ListPage fetchListPage(PartitionRef partition, int pageIndex) throws PortalException;

	/** Fetch a detail page; individual sections may still fail when read */
	DetailPage fetchDetailPage(String url) throws PortalException;
}
