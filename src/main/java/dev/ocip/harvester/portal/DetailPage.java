package dev.ocip.harvester.portal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A fetched detail page, keyed by section name */
public record DetailPage(Map<String, SectionSource> sections) {

	public DetailPage {
		sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
	}

	/** Page whose sections are all readable values */
	public static DetailPage of(Map<String, ?> rawSections) {
		Map<String, SectionSource> sections = new LinkedHashMap<>();
		rawSections.forEach((name, raw) -> sections.put(name, SectionSource.of(raw)));
		return new DetailPage(sections);
	}

	public SectionSource section(String name) {
		return sections.get(name);
	}
}
