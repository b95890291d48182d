package dev.ocip.harvester.category;

import dev.ocip.harvester.model.SectionSpec;
import java.util.List;
import java.util.Map;

/** Industry organizations, listed in one global table */
public class Organizations extends BaseCategory {
	private static final List<SectionSpec> SECTIONS = List.of(
			SectionSpec.fields("General_Information"),
			SectionSpec.fields("Organization_Information"),
			SectionSpec.fields("Annual_Information"),
			SectionSpec.rows("NAICS_Sectors"),
			SectionSpec.rows("Contacts"),
			SectionSpec.rows("Locations"),
			SectionSpec.rows("Languages_Serviced"),
			SectionSpec.rows("Web_Presence"),
			SectionSpec.rows("OCIP_Activity"),
			SectionSpec.fields("Audit_Trail"));

	@Override
	public String id() {
		return "organizations";
	}

	@Override
	public String displayName() {
		return "Organizations";
	}

	@Override
	public int order() {
		return 3;
	}

	@Override
	public boolean partitioned() {
		return false;
	}

	@Override
	public List<SectionSpec> sections() {
		return SECTIONS;
	}

	/** Rows without a name are filler rows of the grid */
	@Override
	public boolean accept(Map<String, String> row) {
		String name = row.get(nameField());
		return name != null && !name.isBlank();
	}

	@Override
	protected String naturalIdField() {
		return null;
	}

	@Override
	protected String nameField() {
		return "Organization_Name";
	}

	@Override
	protected String typeField() {
		return null;
	}
}
