package dev.ocip.harvester.model;

/** A named detail section together with its declared shape */
public record SectionSpec(String name, SectionShape shape) {

	public static SectionSpec fields(String name) {
		return new SectionSpec(name, SectionShape.FIELDS);
	}

	public static SectionSpec rows(String name) {
		return new SectionSpec(name, SectionShape.ROWS);
	}
}
