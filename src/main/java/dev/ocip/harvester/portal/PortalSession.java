package dev.ocip.harvester.portal;

/** A session bound to one category, owned by a single worker */
public interface PortalSession extends Session, PageFetcher, AutoCloseable {

	@Override
	void close();
}
