package dev.ocip.harvester.engine;

/**
 * Safety limits of a list traversal.
 *
 * @param maxPagesPerPartition pages fetched per partition at most
 * @param maxConsecutivePageFailures terminal page failures in a row before a partition is abandoned
 */
public record TraversalLimits(int maxPagesPerPartition, int maxConsecutivePageFailures) {
	public static final TraversalLimits DEFAULT = new TraversalLimits(50, 2);

	public TraversalLimits {
		if (maxPagesPerPartition < 1 || maxConsecutivePageFailures < 1) {
			throw new IllegalArgumentException("Traversal limits must be positive");
		}
	}
}
