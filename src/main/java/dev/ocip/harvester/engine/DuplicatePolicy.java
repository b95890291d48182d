package dev.ocip.harvester.engine;

/** Which of two records with the same identity survives */
public enum DuplicatePolicy {
	KEEP_FIRST,
	KEEP_LATEST
}
