package dev.ocip.harvester.model;

/** The two shapes a detail section can take */
public enum SectionShape {
	/** A flat map of field name to value */
	FIELDS,
	/** An ordered list of flat rows */
	ROWS
}
