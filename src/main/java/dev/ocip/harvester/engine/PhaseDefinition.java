package dev.ocip.harvester.engine;

import dev.ocip.harvester.category.Category;

/** A phase as it is listed and selected on the command line, e.g. {@code experts-details} */
public record PhaseDefinition(Category category, Phase.Stage stage, int number) {

	public String id() {
		return category.id() + "-" + stage.id();
	}

	public String description() {
		return "Phase %d: %s %s".formatted(number, category.displayName(), stage.id());
	}

	/** The metadata phase a details phase reads its master list from */
	public PhaseDefinition prerequisite() {
		return stage == Phase.Stage.DETAILS ? new PhaseDefinition(category, Phase.Stage.METADATA, number - 1) : null;
	}
}
