package dev.ocip.harvester.model;

import java.util.Comparator;

/**
 * One sub-listing of a category's list view, e.g. an institution. A {@code null} label stands for
 * the single global table of an unpartitioned category.
 */
public record PartitionRef(String label) {
	public static final Comparator<PartitionRef> BY_LABEL =
			Comparator.comparing(PartitionRef::label, Comparator.nullsFirst(Comparator.naturalOrder()));

	private static final PartitionRef GLOBAL = new PartitionRef(null);

	public static PartitionRef global() {
		return GLOBAL;
	}

	public static PartitionRef of(String label) {
		return new PartitionRef(label);
	}

	public boolean isGlobal() {
		return label == null;
	}

	@Override
	public String toString() {
		return isGlobal() ? "<all>" : label;
	}
}
