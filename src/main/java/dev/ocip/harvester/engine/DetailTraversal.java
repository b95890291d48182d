package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.Cursor;
import dev.ocip.harvester.model.DetailRecord;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.SectionPayload;
import dev.ocip.harvester.model.SectionSpec;
import dev.ocip.harvester.model.SummaryRecord;
import dev.ocip.harvester.portal.DetailPage;
import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.SectionSource;
import dev.ocip.harvester.portal.SessionExpiredException;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Visits the detail page of every master list entry, in master list order. Sections are extracted
 * one by one; a failing section is ledgered and the record is emitted without it. A record is
 * persisted and its identity marked complete before the checkpoint is flushed and the next entry is
 * fetched. An entry whose page cannot be fetched emits nothing and stays eligible for a later run.
 */
public class DetailTraversal {
	private final TraversalContext ctx;
	private final Deduplicator deduplicator;

	public DetailTraversal(TraversalContext ctx, Deduplicator deduplicator) {
		this.ctx = ctx;
		this.deduplicator = deduplicator;
	}

	/**
	 * Lazily visits the master list. Entries whose identity is in {@code resumeSet} are passed over
	 * without a fetch and without being counted again; repeated master list entries count as skipped.
	 */
	public Iterator<DetailRecord> run(List<SummaryRecord> masterList, Set<IdentityKey> resumeSet) {
		if (masterList == null || masterList.isEmpty()) {
			throw new FatalPhaseException(FatalCause.MISSING_PREREQUISITE, "The master list is missing or empty");
		}
		return new ItemIterator(masterList, Set.copyOf(resumeSet));
	}

	private class ItemIterator extends PaginatedIterator<DetailRecord> {
		private final List<SummaryRecord> masterList;
		private final Set<IdentityKey> resumeSet;
		private int index;
		private int handled;

		ItemIterator(List<SummaryRecord> masterList, Set<IdentityKey> resumeSet) {
			this.masterList = masterList;
			this.resumeSet = resumeSet;
		}

		@Override
		protected List<DetailRecord> fetchNext() {
			if (index >= masterList.size()) {
				return null;
			}
			int itemIndex = index++;
			SummaryRecord summary = masterList.get(itemIndex);

			// Already counted as processed by the run that completed it
			if (resumeSet.contains(summary.identity())) {
				ctx.logger().debug("Skipping {} (already completed)", summary.identity());
				return List.of();
			}
			if (!deduplicator.admit(summary.identity()).admitted()) {
				ctx.logger().debug("Skipping {} (duplicate in master list)", summary.identity());
				skipped();
				return List.of();
			}
			if (!summary.hasDetailLocator()) {
				itemFailed(itemIndex, summary, FailureReason.MISSING_LOCATOR, "No valid detail URL", 0);
				return List.of();
			}

			ctx.checkSession();
			DetailPage page;
			try {
				page = ctx.pacing().execute(() -> ctx.fetcher().fetchDetailPage(summary.detailUrl()));
			} catch (SessionExpiredException e) {
				throw new FatalPhaseException(FatalCause.SESSION_LOST, e.getMessage(), e);
			} catch (FatalPhaseException | InterruptedProgressException e) {
				throw e;
			} catch (PortalException | RuntimeException e) {
				itemFailed(
						itemIndex,
						summary,
						FailureClassifier.classify(e),
						e.getMessage(),
						FailureClassifier.retriesOf(e));
				return List.of();
			}

			DetailRecord record = extract(summary, page);
			try {
				ctx.store().writeDetail(record);
			} catch (IOException e) {
				throw new FatalPhaseException(
						FatalCause.PERSISTENCE_FAILURE, "Cannot write details: " + e.getMessage(), e);
			}
			ctx.state().markCompleted(record.identity());
			ctx.state()
					.advance(Cursor.item(itemIndex))
					.counters(
							record.isPartial()
									? ctx.state().counters().plusPartial()
									: ctx.state().counters().plusProcessed(1));
			ctx.flush();

			if (record.isPartial()) {
				ctx.logger().warn(
						"[{}/{}] {}: extracted with failed sections {}",
						itemIndex + 1,
						masterList.size(),
						summary.name(),
						record.failedSections());
			} else {
				ctx.logger().info("[{}/{}] {}: extracted", itemIndex + 1, masterList.size(), summary.name());
			}
			ctx.pacing().onBatchBoundary(++handled);
			return List.of(record);
		}

		private DetailRecord extract(SummaryRecord summary, DetailPage page) {
			Map<String, SectionPayload> sections = new LinkedHashMap<>();
			List<String> failed = new ArrayList<>();
			List<SectionSpec> specs = ctx.category().sections();
			if (specs.isEmpty()) {
				specs = new ArrayList<>();
				for (Map.Entry<String, SectionSource> section : page.sections().entrySet()) {
					specs.add(new SectionSpec(section.getKey(), null));
				}
			}
			for (SectionSpec spec : specs) {
				SectionSource source = page.section(spec.name());
				try {
					if (source == null) {
						sections.put(spec.name(), SectionPayload.emptyOf(spec.shape()));
						continue;
					}
					Object raw = source.read();
					sections.put(
							spec.name(),
							SectionParser.parse(raw, spec.shape() != null ? spec.shape() : SectionParser.shapeOf(raw)));
				} catch (FatalPhaseException | InterruptedProgressException e) {
					throw e;
				} catch (SessionExpiredException e) {
					throw new FatalPhaseException(FatalCause.SESSION_LOST, e.getMessage(), e);
				} catch (Exception e) {
					failed.add(spec.name());
					FailureReason reason = e instanceof SectionParser.MalformedSectionException
							? FailureReason.MALFORMED_SECTION
							: FailureReason.SECTION_FAILED;
					ctx.ledger()
							.record(ErrorEntry.partial(
									ctx.phaseId(),
									reason,
									summary.identity(),
									summary.detailUrl(),
									spec.name(),
									e.getMessage()));
				}
			}
			return new DetailRecord(
					summary.identity(), DetailRecord.Meta.of(summary, Instant.now()), sections, failed);
		}

		private void itemFailed(int itemIndex, SummaryRecord summary, FailureReason reason, String message, int retries) {
			ctx.logger().error("[{}/{}] {}: {} ({})", itemIndex + 1, masterList.size(), summary.name(), message, reason);
			ctx.ledger()
					.record(ErrorEntry.terminal(
							ctx.phaseId(), reason, summary.identity(), summary.detailUrl(), message, retries));
			ctx.state().advance(Cursor.item(itemIndex)).counters(ctx.state().counters().plusFailed());
			ctx.flush();
			ctx.pacing().onBatchBoundary(++handled);
		}

		private void skipped() {
			ctx.state().counters(ctx.state().counters().plusSkipped());
		}
	}
}
