package dev.ocip.harvester.engine;

import dev.ocip.harvester.model.Counters;

/** Receives the counters of a running phase after every unit */
@FunctionalInterface
public interface PhaseProgress {
	PhaseProgress NONE = counters -> {};

	void update(Counters counters);
}
