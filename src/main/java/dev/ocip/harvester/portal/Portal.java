package dev.ocip.harvester.portal;

import dev.ocip.harvester.category.Category;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;

/** Source of portal sessions. Implementations are discovered with {@link ServiceLoader}. */
public interface Portal {

	/** Opens a session for one category; each category gets its own */
	PortalSession open(Category category) throws PortalException;

	/** Factory interface for portal discovery */
	interface Discovery {
		String name();

		Portal create(Path location);
	}

	/** Get all available portal discoveries */
	static Map<String, Discovery> availablePortals() {
		Map<String, Discovery> portals = new HashMap<>();
		for (Discovery discovery : ServiceLoader.load(Discovery.class)) {
			portals.put(discovery.name(), discovery);
		}
		return portals;
	}

	static Portal create(String name, Path location) {
		Discovery discovery = availablePortals().get(name);
		if (discovery == null) {
			throw new IllegalArgumentException("Unknown portal: " + name);
		}
		return discovery.create(location);
	}
}
