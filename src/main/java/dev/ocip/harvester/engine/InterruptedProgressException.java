package dev.ocip.harvester.engine;

/** Stops a phase at a unit boundary, either on request or because the progress limit was reached */
public class InterruptedProgressException extends RuntimeException {
	public InterruptedProgressException(String message) {
		super(message);
	}
}
