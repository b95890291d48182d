package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.Cursor;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.FailureReason;
import dev.ocip.harvester.model.IdentityKey;
import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.model.SummaryRecord;
import dev.ocip.harvester.portal.ListPage;
import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.SessionExpiredException;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Paginated harvest of summary records. Partitions are visited in label order and each one is
 * paged until the portal reports no further page. Every page is persisted, its identities marked
 * complete and the checkpoint flushed before the next page is requested.
 */
public class ListTraversal {
	private final TraversalContext ctx;
	private final Deduplicator deduplicator;
	private final TraversalLimits limits;

	public ListTraversal(TraversalContext ctx, Deduplicator deduplicator, TraversalLimits limits) {
		this.ctx = ctx;
		this.deduplicator = deduplicator;
		this.limits = limits;
	}

	/**
	 * Lazily harvests the given partitions, continuing after the resume cursor if there is one. The
	 * returned iterator yields the newly admitted records; each page is fetched only when the
	 * records of the previous page have been consumed.
	 */
	public Iterator<SummaryRecord> run(List<PartitionRef> partitions, Cursor resumeCursor) {
		List<PartitionRef> ordered = new ArrayList<>(partitions);
		ordered.sort(PartitionRef.BY_LABEL);
		return new PageIterator(ordered, resumeCursor == null ? Cursor.start() : resumeCursor);
	}

	private class PageIterator extends PaginatedIterator<SummaryRecord> {
		private final List<PartitionRef> partitions;
		// Identities listed by the current partition so far, whether or not they were persisted
		private final Set<IdentityKey> partitionSeen = new HashSet<>();
		private int partitionIndex;
		private int pageIndex;
		private int pagesSucceeded;
		private int consecutiveFailures;
		private int pagesHandled;

		PageIterator(List<PartitionRef> partitions, Cursor cursor) {
			this.partitions = partitions;
			if (cursor.isStart()) {
				return;
			}
			int index = resolvePartition(cursor);
			if (cursor.partitionDone()) {
				partitionIndex = index + 1;
			} else {
				partitionIndex = index;
				pageIndex = cursor.pageIndex() + 1;
				pagesSucceeded = pageIndex;
			}
			ctx.logger().info("Resuming at partition {} page {}", partitionIndex, pageIndex);
		}

		/** Locates the cursor's partition by label, falling back to its index */
		private int resolvePartition(Cursor cursor) {
			if (cursor.partitionLabel() != null) {
				for (int i = 0; i < partitions.size(); i++) {
					if (cursor.partitionLabel().equals(partitions.get(i).label())) {
						return i;
					}
				}
				ctx.logger().warn(
						"Partition '{}' of the checkpoint is no longer listed, continuing at index {}",
						cursor.partitionLabel(),
						cursor.partitionIndex());
			}
			return Math.min(cursor.partitionIndex(), partitions.size());
		}

		@Override
		protected List<SummaryRecord> fetchNext() {
			while (partitionIndex < partitions.size()) {
				PartitionRef partition = partitions.get(partitionIndex);
				if (pageIndex >= limits.maxPagesPerPartition()) {
					ctx.logger().warn(
							"Reached the limit of {} pages for partition {}, moving on",
							limits.maxPagesPerPartition(),
							partition);
					nextPartition();
					continue;
				}

				ctx.checkSession();
				int page = pageIndex;
				ListPage listPage;
				try {
					listPage = ctx.pacing().execute(() -> ctx.fetcher().fetchListPage(partition, page));
				} catch (SessionExpiredException e) {
					throw new FatalPhaseException(FatalCause.SESSION_LOST, e.getMessage(), e);
				} catch (FatalPhaseException | InterruptedProgressException e) {
					throw e;
				} catch (PortalException | RuntimeException e) {
					pageFailed(partition, page, e);
					continue;
				}
				consecutiveFailures = 0;
				return pageFetched(partition, page, listPage);
			}
			return null;
		}

		private List<SummaryRecord> pageFetched(PartitionRef partition, int page, ListPage listPage) {
			// Rows repeated within one page: the last one wins
			Instant now = Instant.now();
			Map<IdentityKey, SummaryRecord> collapsed = new LinkedHashMap<>();
			for (Map<String, String> row : listPage.rows()) {
				if (!ctx.category().accept(row)) {
					continue;
				}
				SummaryRecord record = ctx.category().toSummary(partition, row, now);
				collapsed.put(record.identity(), record);
			}

			List<SummaryRecord> admitted = new ArrayList<>();
			boolean newToPartition = false;
			for (SummaryRecord record : collapsed.values()) {
				newToPartition |= partitionSeen.add(record.identity());
				if (deduplicator.admit(record.identity()).admitted()) {
					admitted.add(record);
				}
			}

			if (!admitted.isEmpty()) {
				try {
					ctx.store().writeSummary(admitted);
				} catch (IOException e) {
					throw new FatalPhaseException(
							FatalCause.PERSISTENCE_FAILURE, "Cannot write master list: " + e.getMessage(), e);
				}
			}
			admitted.forEach(record -> ctx.state().markCompleted(record.identity()));

			// A page that lists nothing new for this partition means the portal is repeating itself
			boolean exhausted = !listPage.hasNextPage()
					|| (!newToPartition && (pagesSucceeded > 0 || listPage.rows().isEmpty()));
			pagesSucceeded++;
			ctx.state()
					.advance(
							exhausted
									? Cursor.endOfPartition(partitionIndex, partition.label(), page)
									: Cursor.page(partitionIndex, partition.label(), page))
					.counters(ctx.state().counters().plusProcessed(admitted.size()));
			ctx.flush();

			ctx.logger().info(
					"{} page {}: {} rows, {} new{}",
					partition,
					page,
					listPage.rows().size(),
					admitted.size(),
					exhausted ? ", last page" : "");

			if (exhausted) {
				nextPartition();
			} else {
				pageIndex++;
			}
			ctx.pacing().onBatchBoundary(++pagesHandled);
			return admitted;
		}

		private void pageFailed(PartitionRef partition, int page, Exception error) {
			FailureReason reason = FailureClassifier.classify(error);
			ctx.logger().error("Failed to fetch {} page {}: {}", partition, page, error.getMessage());
			ctx.ledger()
					.record(ErrorEntry.terminal(
							ctx.phaseId(),
							reason,
							null,
							partition + "#page-" + page,
							error.getMessage(),
							FailureClassifier.retriesOf(error)));
			consecutiveFailures++;

			boolean abandon = consecutiveFailures >= limits.maxConsecutivePageFailures();
			if (abandon) {
				ctx.logger().error("Abandoning partition {} after {} failed pages", partition, consecutiveFailures);
				ctx.ledger()
						.record(ErrorEntry.terminal(
								ctx.phaseId(),
								FailureReason.PARTITION_ABANDONED,
								null,
								partition.toString(),
								consecutiveFailures + " consecutive pages failed",
								0));
			}
			ctx.state()
					.advance(
							abandon
									? Cursor.endOfPartition(partitionIndex, partition.label(), page)
									: Cursor.page(partitionIndex, partition.label(), page))
					.counters(ctx.state().counters().plusFailed());
			ctx.flush();

			if (abandon) {
				nextPartition();
			} else {
				pageIndex++;
			}
		}

		private void nextPartition() {
			partitionIndex++;
			pageIndex = 0;
			pagesSucceeded = 0;
			consecutiveFailures = 0;
			partitionSeen.clear();
		}
	}
}
