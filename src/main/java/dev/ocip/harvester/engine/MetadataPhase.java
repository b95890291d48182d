package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.PortalSession;
import dev.ocip.harvester.portal.SessionExpiredException;
import java.util.Iterator;
import java.util.List;

/** Harvests a category's listing into its master list */
public class MetadataPhase extends BasePhase {

	public MetadataPhase(PhaseConfig config, PortalSession session) {
		super(config, session);
	}

	public MetadataPhase(PhaseConfig config, PortalSession session, CheckpointStore checkpoints) {
		super(config, session, checkpoints);
	}

	@Override
	protected Iterator<?> traverse(TraversalContext ctx) {
		ctx.checkSession();
		List<PartitionRef> partitions;
		try {
			partitions = ctx.pacing().execute(session::listPartitions);
		} catch (SessionExpiredException e) {
			throw new FatalPhaseException(FatalCause.SESSION_LOST, e.getMessage(), e);
		} catch (PortalException e) {
			logger.error("Cannot list partitions: {}", e.getMessage());
			ctx.ledger()
					.record(ErrorEntry.terminal(
							id(),
							FailureClassifier.classify(e),
							null,
							"partitions",
							e.getMessage(),
							FailureClassifier.retriesOf(e)));
			partitions = List.of();
		}
		if (partitions.isEmpty()) {
			logger.warn("No partitions found for {}", category.displayName());
		} else {
			logger.info("Found {} partitions", partitions.size());
		}

		Deduplicator deduplicator = Deduplicator.keepFirst(ctx.state().completed());
		return new ListTraversal(ctx, deduplicator, config.limits()).run(partitions, ctx.state().cursor());
	}
}
