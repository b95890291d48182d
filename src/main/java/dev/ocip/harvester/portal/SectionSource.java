package dev.ocip.harvester.portal;

/**
 * Deferred access to the raw content of one detail section. Reading may fail independently of the
 * other sections of the same page.
 *
 * <p>The raw content is a {@code Map} of field name to scalar value for flat sections, or a
 * {@code List} of such maps for repeating sections.
 */
@FunctionalInterface
public interface SectionSource {

	Object read() throws Exception;

	static SectionSource of(Object raw) {
		return () -> raw;
	}

	static SectionSource failing(String message) {
		return () -> {
			throw new IllegalStateException(message);
		};
	}
}
