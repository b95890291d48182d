package dev.ocip.harvester.category;

import dev.ocip.harvester.model.SectionSpec;
import java.util.List;

/**
 * Research facilities, listed per institution. The listing's id column is not reliable, so
 * facilities are identified by institution and detail link.
 */
public class Facilities extends BaseCategory {
	private static final List<SectionSpec> SECTIONS = List.of(
			SectionSpec.fields("General_Information"),
			SectionSpec.fields("Academic_Unit_Details"),
			SectionSpec.rows("Provinces_Served"),
			SectionSpec.rows("Activities_Offered"),
			SectionSpec.rows("Sectors_Served"),
			SectionSpec.rows("Contacts"),
			SectionSpec.rows("Locations"),
			SectionSpec.fields("Facility_Descriptors"),
			SectionSpec.rows("Languages_Serviced"),
			SectionSpec.rows("Web_Presence"),
			SectionSpec.rows("OCIP_Activity"),
			SectionSpec.fields("Audit_Trail"));

	@Override
	public String id() {
		return "facilities";
	}

	@Override
	public String displayName() {
		return "Facilities";
	}

	@Override
	public int order() {
		return 2;
	}

	@Override
	public boolean partitioned() {
		return true;
	}

	@Override
	public List<SectionSpec> sections() {
		return SECTIONS;
	}

	@Override
	protected String naturalIdField() {
		return null;
	}

	@Override
	protected String nameField() {
		return "Facility_Name";
	}

	@Override
	protected String typeField() {
		return "Type";
	}
}
