package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.Counters;
import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.SummaryRecord;
import dev.ocip.harvester.portal.PortalSession;
import dev.ocip.harvester.store.JsonFileStore;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** Visits the detail page of every master list entry of a category */
public class DetailsPhase extends BasePhase {

	public DetailsPhase(PhaseConfig config, PortalSession session) {
		super(config, session);
	}

	public DetailsPhase(PhaseConfig config, PortalSession session, CheckpointStore checkpoints) {
		super(config, session, checkpoints);
	}

	@Override
	protected Iterator<?> traverse(TraversalContext ctx) {
		List<SummaryRecord> masterList;
		try {
			masterList = JsonFileStore.readMasterList(layout.masterListFile());
		} catch (IOException e) {
			throw new FatalPhaseException(
					FatalCause.MISSING_PREREQUISITE,
					"Cannot read master list " + layout.masterListFile() + ": " + e.getMessage(),
					e);
		}
		if (masterList.isEmpty()) {
			throw new FatalPhaseException(
					FatalCause.MISSING_PREREQUISITE,
					"No master list at " + layout.masterListFile() + ", run "
							+ config.definition().prerequisite().id() + " first");
		}
		logger.info("Loaded {} entries from {}", masterList.size(), layout.masterListFile());
		// Failed entries of an earlier run are visited again, so only completed ones carry over
		Counters carried = config.force() ? Counters.zero() : ctx.state().counters().completedOnly();
		ctx.state().counters(carried.withTotal(masterList.size()));

		Set<IdentityKey> resumeSet;
		Deduplicator deduplicator;
		if (config.force()) {
			logger.info("Re-scraping {} previously completed entries", ctx.state().completed().size());
			resumeSet = Set.of();
			deduplicator = Deduplicator.keepLatest(ctx.state().completed());
		} else {
			resumeSet = ctx.state().completed();
			deduplicator = Deduplicator.keepFirst(Set.of());
		}
		return new DetailTraversal(ctx, deduplicator).run(masterList, resumeSet);
	}
}
