package dev.ocip.harvester.engine;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Abstract base class for lazy iteration over units of work that each yield a batch of results.
 * The next batch is only produced once the previous one has been consumed, so at most one unit
 * is in flight.
 */
public abstract class PaginatedIterator<T> implements Iterator<T> {
	private Iterator<T> currentBatch = null;
	private boolean hasMore = true;

	@Override
	public boolean hasNext() {
		while ((currentBatch == null || !currentBatch.hasNext()) && hasMore) {
			fetchNextBatch();
		}
		return currentBatch != null && currentBatch.hasNext();
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		return currentBatch.next();
	}

	private void fetchNextBatch() {
		List<T> items = fetchNext();
		if (items == null) {
			hasMore = false;
			currentBatch = null;
			return;
		}
		currentBatch = items.iterator();
	}

	/**
	 * Process the next unit of work.
	 * @return the results of the unit, possibly empty, or null when there is no more work
	 */
	protected abstract List<T> fetchNext();
}
