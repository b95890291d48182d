package dev.ocip.harvester.model;

/** Severity of a ledger entry */
public enum ErrorKind {
	/** The unit produced no record and stays eligible for a later run */
	TERMINAL_ITEM,
	/** The record was emitted but some of its sections are missing */
	PARTIAL_ITEM,
	/** The phase was aborted */
	FATAL
}
