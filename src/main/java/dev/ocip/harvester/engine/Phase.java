package dev.ocip.harvester.engine;

import java.util.Locale;
import java.util.concurrent.Callable;

/** One extraction phase of one category. Phases implement {@link Callable} to run on a worker. */
public interface Phase extends Callable<PhaseResult> {

	enum Stage {
		METADATA,
		DETAILS;

		public String id() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	String id();

	@Override
	PhaseResult call();
}
