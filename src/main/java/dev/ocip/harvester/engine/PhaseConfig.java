package dev.ocip.harvester.engine;

import org.slf4j.Logger;

/**
 * Configuration record for phase instances.
 *
 * @param definition which phase to run
 * @param layout the files of the phase
 * @param mode whether to continue after an existing checkpoint
 * @param force re-scrape details that were already completed
 * @param limitProgress stop cleanly after this many records, unlimited when not positive
 */
public record PhaseConfig(
		PhaseDefinition definition,
		PhaseLayout layout,
		ResumeMode mode,
		boolean force,
		int limitProgress,
		PacingPolicy pacing,
		Sleeper sleeper,
		TraversalLimits limits,
		PhaseProgress progress,
		Logger logger) {}
