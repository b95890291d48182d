package dev.ocip.harvester.portal;

/** Authenticated browsing session, established outside the engine */
public interface Session {

	/** Cheap check whether the session can still be used */
	boolean isValid();
}
