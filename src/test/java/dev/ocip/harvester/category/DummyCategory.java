package dev.ocip.harvester.category;

import dev.ocip.harvester.model.SectionSpec;
import java.util.List;

/** Dummy category for testing purposes */
public class DummyCategory extends BaseCategory {

	@Override
	public String id() {
		return "dummy";
	}

	@Override
	public String displayName() {
		return "Dummies";
	}

	@Override
	public int order() {
		return 99;
	}

	@Override
	public boolean partitioned() {
		return true;
	}

	@Override
	public List<SectionSpec> sections() {
		return List.of(SectionSpec.fields("Overview"), SectionSpec.rows("Web_Presence"));
	}

	@Override
	protected String naturalIdField() {
		return "id";
	}

	@Override
	protected String nameField() {
		return "name";
	}

	@Override
	protected String typeField() {
		return null;
	}
}
