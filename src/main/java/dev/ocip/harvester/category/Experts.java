package dev.ocip.harvester.category;

import dev.ocip.harvester.model.SectionSpec;
import java.util.List;

/** Research experts, listed per institution and identified by their expert id */
public class Experts extends BaseCategory {
	private static final List<SectionSpec> SECTIONS = List.of(
			SectionSpec.fields("General_Information"),
			SectionSpec.fields("Details"),
			SectionSpec.fields("Expert_Demographics"),
			SectionSpec.rows("Expertise"),
			SectionSpec.fields("Price_Availability"),
			SectionSpec.rows("Facility_Affiliation"),
			SectionSpec.rows("Web_Presence"),
			SectionSpec.rows("OCIP_Activity"),
			SectionSpec.fields("Audit_Trail"));

	@Override
	public String id() {
		return "experts";
	}

	@Override
	public String displayName() {
		return "Experts";
	}

	@Override
	public int order() {
		return 1;
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
		return "Expert_ID";
	}

	@Override
	protected String nameField() {
		return "Name";
	}

	@Override
	protected String typeField() {
		return "Expert_Type";
	}
}
