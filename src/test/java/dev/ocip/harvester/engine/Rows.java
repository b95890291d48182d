package dev.ocip.harvester.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/** Listing rows of the dummy category */
final class Rows {

	private Rows() {}

	static Map<String, String> row(String id, String name) {
		Map<String, String> row = new LinkedHashMap<>();
		row.put("id", id);
		row.put("name", name);
		row.put("Manage_URL", url(id));
		return row;
	}

	static Map<String, String> rowWithoutLink(String id, String name) {
		Map<String, String> row = row(id, name);
		row.put("Manage_URL", "Not Found");
		return row;
	}

	static String url(String id) {
		return "https://portal.test/detail/" + id;
	}
}
