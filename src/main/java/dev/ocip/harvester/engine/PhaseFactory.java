package dev.ocip.harvester.engine;

import dev.ocip.harvester.category.Category;
import dev.ocip.harvester.portal.PortalSession;
import dev.ocip.harvester.reporting.ProgressReporter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/** Creates phase instances for the categories discovered with {@link java.util.ServiceLoader} */
public class PhaseFactory {
	private final HarvestDirs dirs;
	private final ProgressReporter reporter;
	private final PacingPolicy pacing;
	private final Sleeper sleeper;
	private final TraversalLimits limits;
	private final boolean force;
	private final int limitProgress;

	public static PhaseFactory create(
			HarvestDirs dirs,
			ProgressReporter reporter,
			PacingPolicy pacing,
			TraversalLimits limits,
			boolean force,
			int limitProgress) {
		return new PhaseFactory(dirs, reporter, pacing, Sleeper.SYSTEM, limits, force, limitProgress);
	}

	PhaseFactory(
			HarvestDirs dirs,
			ProgressReporter reporter,
			PacingPolicy pacing,
			Sleeper sleeper,
			TraversalLimits limits,
			boolean force,
			int limitProgress) {
		this.dirs = dirs;
		this.reporter = reporter;
		this.pacing = pacing;
		this.sleeper = sleeper;
		this.limits = limits;
		this.force = force;
		this.limitProgress = limitProgress;
	}

	/** Create a specific phase bound to a session of its category */
	public Phase createPhase(PhaseDefinition definition, ResumeMode mode, PortalSession session) {
		PhaseConfig config = configFor(definition, mode);
		return switch (definition.stage()) {
			case METADATA -> new MetadataPhase(config, session);
			case DETAILS -> new DetailsPhase(config, session);
		};
	}

	PhaseConfig configFor(PhaseDefinition definition, ResumeMode mode) {
		return new PhaseConfig(
				definition,
				dirs.layout(definition),
				mode,
				force && definition.stage() == Phase.Stage.DETAILS,
				limitProgress,
				pacing,
				sleeper,
				limits,
				reporter == null ? PhaseProgress.NONE : reporter.forPhase(definition.id()),
				LoggerFactory.getLogger(definition.id()));
	}

	/** All phases of all discovered categories keyed by id, numbered in run order */
	public static Map<String, PhaseDefinition> getAvailablePhases() {
		Map<String, PhaseDefinition> phases = new LinkedHashMap<>();
		int number = 1;
		for (Category category : Category.available().values()) {
			for (Phase.Stage stage : Phase.Stage.values()) {
				PhaseDefinition definition = new PhaseDefinition(category, stage, number++);
				phases.put(definition.id(), definition);
			}
		}
		return phases;
	}
}
