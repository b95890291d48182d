package dev.ocip.harvester.portal;

import java.util.List;
import java.util.Map;

/** One page of a listing: raw field maps as parsed by the fetcher, plus whether more pages follow */
public record ListPage(List<Map<String, String>> rows, boolean hasNextPage) {

	public ListPage {
		rows = rows == null ? List.of() : List.copyOf(rows);
	}

	public static ListPage last(List<Map<String, String>> rows) {
		return new ListPage(rows, false);
	}

	public static ListPage more(List<Map<String, String>> rows) {
		return new ListPage(rows, true);
	}
}
