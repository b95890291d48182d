package dev.ocip.harvester.engine;

/** How a phase treats a checkpoint left by an earlier run */
public enum ResumeMode {
	/** Continue after the checkpoint */
	RESUME,
	/** Start over; earlier output is replaced once new output is written */
	FRESH
}
