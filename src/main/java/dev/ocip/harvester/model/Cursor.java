package dev.ocip.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last fully-completed position of a traversal. For list traversals this is a partition and page;
 * {@code partitionDone} marks that every page of the partition has been handled. For detail
 * traversals only {@code itemIndex} is used. Negative indexes mean nothing has completed yet.
 */
public record Cursor(
		@JsonProperty("partition_index") int partitionIndex,
		@JsonProperty("partition_label") String partitionLabel,
		@JsonProperty("page_index") int pageIndex,
		@JsonProperty("partition_done") boolean partitionDone,
		@JsonProperty("item_index") int itemIndex) {

	public static Cursor start() {
		return new Cursor(0, null, -1, false, -1);
	}

	public static Cursor page(int partitionIndex, String partitionLabel, int pageIndex) {
		return new Cursor(partitionIndex, partitionLabel, pageIndex, false, -1);
	}

	public static Cursor endOfPartition(int partitionIndex, String partitionLabel, int pageIndex) {
		return new Cursor(partitionIndex, partitionLabel, pageIndex, true, -1);
	}

	public static Cursor item(int itemIndex) {
		return new Cursor(0, null, -1, false, itemIndex);
	}

	@JsonIgnore
	public boolean isStart() {
		return pageIndex < 0 && itemIndex < 0 && !partitionDone;
	}

	@Override
	public String toString() {
		if (itemIndex >= 0) {
			return "item " + itemIndex;
		}
		if (isStart()) {
			return "start";
		}
		return "partition %d (%s) page %d%s"
				.formatted(partitionIndex, partitionLabel, pageIndex, partitionDone ? " [done]" : "");
	}
}
