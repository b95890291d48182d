package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.PartitionRef;
import dev.ocip.harvester.portal.DetailPage;
import dev.ocip.harvester.portal.ListPage;
import dev.ocip.harvester.portal.PageUnavailableException;
import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.PortalSession;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Scripted portal session that counts every fetch */
public class DummyPageFetcher implements PortalSession {
	private final List<PartitionRef> partitions = new ArrayList<>();
	private final Map<String, ListPage> pages = new HashMap<>();
	private final Map<String, Deque<PortalException>> pageFailures = new HashMap<>();
	private final Map<String, DetailPage> details = new HashMap<>();
	private final Map<String, Deque<PortalException>> detailFailures = new HashMap<>();
	private final Map<String, Integer> listFetches = new LinkedHashMap<>();
	private final Map<String, Integer> detailFetches = new LinkedHashMap<>();
	private boolean valid = true;
	private int expireAfterDetailFetches = -1;

	public DummyPageFetcher partitions(String... labels) {
		Arrays.stream(labels).map(PartitionRef::of).forEach(partitions::add);
		return this;
	}

	public DummyPageFetcher page(String partition, int index, ListPage page) {
		pages.put(key(partition, index), page);
		return this;
	}

	/** The next fetches of the page fail with these errors, in order */
	public DummyPageFetcher failPage(String partition, int index, PortalException... failures) {
		pageFailures.computeIfAbsent(key(partition, index), k -> new ArrayDeque<>()).addAll(List.of(failures));
		return this;
	}

	public DummyPageFetcher detail(String url, Map<String, ?> sections) {
		details.put(url, DetailPage.of(sections));
		return this;
	}

	public DummyPageFetcher detail(String url, DetailPage page) {
		details.put(url, page);
		return this;
	}

	/** The next fetches of the detail page fail with these errors, in order */
	public DummyPageFetcher failDetail(String url, PortalException... failures) {
		detailFailures.computeIfAbsent(url, k -> new ArrayDeque<>()).addAll(List.of(failures));
		return this;
	}

	public DummyPageFetcher expireAfterDetailFetches(int count) {
		this.expireAfterDetailFetches = count;
		return this;
	}

	public void invalidate() {
		valid = false;
	}

	@Override
	public boolean isValid() {
		return valid;
	}

	@Override
	public List<PartitionRef> listPartitions() {
		return partitions.isEmpty() ? List.of(PartitionRef.global()) : List.copyOf(partitions);
	}

	@Override
	public ListPage fetchListPage(PartitionRef partition, int pageIndex) throws PortalException {
		String key = key(partition.label(), pageIndex);
		listFetches.merge(key, 1, Integer::sum);
		Deque<PortalException> failures = pageFailures.get(key);
		if (failures != null && !failures.isEmpty()) {
			throw failures.poll();
		}
		ListPage page = pages.get(key);
		if (page == null) {
			throw new PageUnavailableException("No page " + key);
		}
		return page;
	}

	@Override
	public DetailPage fetchDetailPage(String url) throws PortalException {
		detailFetches.merge(url, 1, Integer::sum);
		if (expireAfterDetailFetches >= 0 && totalDetailFetches() >= expireAfterDetailFetches) {
			valid = false;
		}
		Deque<PortalException> failures = detailFailures.get(url);
		if (failures != null && !failures.isEmpty()) {
			throw failures.poll();
		}
		DetailPage page = details.get(url);
		if (page == null) {
			throw new PageUnavailableException("No detail page " + url);
		}
		return page;
	}

	@Override
	public void close() {}

	public int listFetchCount(String partition, int index) {
		return listFetches.getOrDefault(key(partition, index), 0);
	}

	public int totalListFetches() {
		return listFetches.values().stream().mapToInt(Integer::intValue).sum();
	}

	public int detailFetchCount(String url) {
		return detailFetches.getOrDefault(url, 0);
	}

	public int totalDetailFetches() {
		return detailFetches.values().stream().mapToInt(Integer::intValue).sum();
	}

	public Map<String, Integer> detailFetches() {
		return Map.copyOf(detailFetches);
	}

	private static String key(String partition, int index) {
		return (partition == null ? "*" : partition) + "#" + index;
	}
}
